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

import com.google.common.base.Preconditions;
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
 * Writes a vector to consecutive elements of a memref, starting at the subscripts given by the
 * map. Operands are the vector, the memref, and the map operands.
 */
public final class VectorStoreOp extends AffineAccessOp {

  private VectorStoreOp(IrContext context, AffineMap map, List<Value> operands) {
    super(context, OpKind.VECTOR_STORE, map, operands, List.of());
  }

  public static VectorStoreOp create(
      OpBuilder builder,
      Value vector,
      Value memref,
      AffineMap map,
      List<? extends Value> mapOperands) {
    Preconditions.checkArgument(
        vector.type() instanceof VectorType, "%s is not a vector", vector.type());
    checkMap(map, memref, mapOperands);
    List<Value> operands = new ArrayList<>();
    operands.add(vector);
    operands.add(memref);
    operands.addAll(mapOperands);
    return builder.insert(new VectorStoreOp(builder.context(), map, operands));
  }

  public static VectorStoreOp create(
      OpBuilder builder, Value vector, Value memref, List<? extends Value> indices) {
    return create(builder, vector, memref, defaultMap(builder.exprs(), memref), indices);
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

  public VectorType vectorType() {
    return (VectorType) valueToStore().type();
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
