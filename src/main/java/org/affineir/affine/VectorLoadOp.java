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
import org.affineir.ir.Type.VectorType;
import org.affineir.ir.Value;

/**
 * Reads a vector of consecutive elements of a memref, starting at the subscripts given by the map.
 */
public final class VectorLoadOp extends AffineAccessOp {

  private VectorLoadOp(IrContext context, AffineMap map, List<Value> operands, VectorType type) {
    super(context, OpKind.VECTOR_LOAD, map, operands, List.of(type));
  }

  public static VectorLoadOp create(
      OpBuilder builder,
      VectorType type,
      Value memref,
      AffineMap map,
      List<? extends Value> mapOperands) {
    checkMap(map, memref, mapOperands);
    List<Value> operands = new ArrayList<>();
    operands.add(memref);
    operands.addAll(mapOperands);
    return builder.insert(new VectorLoadOp(builder.context(), map, operands, type));
  }

  public static VectorLoadOp create(
      OpBuilder builder, VectorType type, Value memref, List<? extends Value> indices) {
    return create(builder, type, memref, defaultMap(builder.exprs(), memref), indices);
  }

  @Override
  int memRefOperandIndex() {
    return 0;
  }

  @Override
  public boolean isWrite() {
    return false;
  }

  public VectorType vectorType() {
    return (VectorType) result().type();
  }

  @Override
  public Type valueType() {
    return vectorType();
  }

  @Override
  public boolean verify() {
    if (!super.verify()) {
      return false;
    } else if (!vectorType().elementType().equals(memRefType().elementType())) {
      return emitOpError("requires memref and vector types of the same elemental type");
    }
    return true;
  }
}
