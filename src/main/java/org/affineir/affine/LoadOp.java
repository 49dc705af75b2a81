/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.affineir.affine;

import java.util.ArrayList;
import java.util.List;
import org.affineir.expr.AffineMap;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/** Reads one element of a memref. Operands are the memref followed by the map operands. */
public final class LoadOp extends AffineAccessOp {

  private LoadOp(IrContext context, AffineMap map, List<Value> operands, Type resultType) {
    super(context, OpKind.LOAD, map, operands, List.of(resultType));
  }

  public static LoadOp create(
      OpBuilder builder, Value memref, AffineMap map, List<? extends Value> mapOperands) {
    checkMap(map, memref, mapOperands);
    List<Value> operands = new ArrayList<>();
    operands.add(memref);
    operands.addAll(mapOperands);
    Type elementType = ((MemRefType) memref.type()).elementType();
    return builder.insert(new LoadOp(builder.context(), map, operands, elementType));
  }

  /** Creates a load whose subscripts are {@code indices} (the identity map). */
  public static LoadOp create(OpBuilder builder, Value memref, List<? extends Value> indices) {
    return create(builder, memref, defaultMap(builder.exprs(), memref), indices);
  }

  @Override
  int memRefOperandIndex() {
    return 0;
  }

  @Override
  public boolean isWrite() {
    return false;
  }

  @Override
  public Type valueType() {
    return result().type();
  }

  @Override
  public boolean verify() {
    if (!super.verify()) {
      return false;
    } else if (!result().type().equals(memRefType().elementType())) {
      return emitOpError("result type must match element type of memref");
    }
    return true;
  }
}
