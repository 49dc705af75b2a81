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
import org.affineir.ir.Value;

/**
 * Writes one element of a memref. Operands are the value to store, the memref, and the map
 * operands.
 */
public final class StoreOp extends AffineAccessOp {

  private StoreOp(IrContext context, AffineMap map, List<Value> operands) {
    super(context, OpKind.STORE, map, operands, List.of());
  }

  public static StoreOp create(
      OpBuilder builder,
      Value value,
      Value memref,
      AffineMap map,
      List<? extends Value> mapOperands) {
    checkMap(map, memref, mapOperands);
    List<Value> operands = new ArrayList<>();
    operands.add(value);
    operands.add(memref);
    operands.addAll(mapOperands);
    return builder.insert(new StoreOp(builder.context(), map, operands));
  }

  public static StoreOp create(
      OpBuilder builder, Value value, Value memref, List<? extends Value> indices) {
    return create(builder, value, memref, defaultMap(builder.exprs(), memref), indices);
  }

  @Override
  int memRefOperandIndex() {
    return 1;
  }

  @Override
  public boolean isWrite() {
    return true;
  }

  public Value valueToStore() {
    return operand(0);
  }

  @Override
  public Type valueType() {
    return valueToStore().type();
  }

  @Override
  public boolean verify() {
    if (!super.verify()) {
      return false;
    } else if (!valueToStore().type().equals(memRefType().elementType())) {
      return emitOpError("first operand must have same type memref element type");
    }
    return true;
  }
}
