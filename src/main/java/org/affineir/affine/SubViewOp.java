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
import java.util.EnumSet;
import java.util.List;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Trait;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/**
 * A rectangular window into another memref of the same rank. Operands are the source, one offset
 * per dimension, and the dynamic sizes of the result.
 */
public final class SubViewOp extends Operation implements MemRefDefOp {

  private SubViewOp(IrContext context, MemRefType type, List<Value> operands) {
    super(context, OpKind.SUBVIEW, EnumSet.of(Trait.NO_MEMORY_EFFECT), operands, List.of(type), 0);
  }

  public static SubViewOp create(
      OpBuilder builder,
      MemRefType type,
      Value source,
      List<? extends Value> offsets,
      List<? extends Value> dynamicSizes) {
    Preconditions.checkArgument(
        offsets.size() == type.rank(), "%s needs %s offsets", type, type.rank());
    Preconditions.checkArgument(
        dynamicSizes.size() == type.numDynamicDims(),
        "%s needs %s dynamic sizes, not %s",
        type,
        type.numDynamicDims(),
        dynamicSizes.size());
    List<Value> operands = new ArrayList<>();
    operands.add(source);
    operands.addAll(offsets);
    operands.addAll(dynamicSizes);
    return builder.insert(new SubViewOp(builder.context(), type, operands));
  }

  public Value source() {
    return operand(0);
  }

  public List<Value> offsets() {
    return operands().subList(1, 1 + memRefType().rank());
  }

  @Override
  public MemRefType memRefType() {
    return (MemRefType) result().type();
  }

  @Override
  public List<Value> dynamicSizes() {
    return operands().subList(1 + memRefType().rank(), numOperands());
  }

  @Override
  public boolean verify() {
    MemRefType type = memRefType();
    if (!(source().type() instanceof MemRefType sourceType) || sourceType.rank() != type.rank()) {
      return emitOpError("source and result must be memrefs of the same rank");
    } else if (!sourceType.elementType().equals(type.elementType())) {
      return emitOpError("source and result element types must match");
    } else if (numOperands() != 1 + type.rank() + type.numDynamicDims()) {
      return emitOpError("incorrect number of offset and size operands for type %s", type);
    }
    return true;
  }
}
