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
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/**
 * Reinterprets a one-dimensional byte buffer, starting at a byte offset, as a memref of another
 * shape. Operands are the source buffer, the byte offset, and the dynamic sizes of the result.
 */
public final class ViewOp extends Operation implements MemRefDefOp {

  private ViewOp(IrContext context, MemRefType type, List<Value> operands) {
    super(context, OpKind.VIEW, EnumSet.of(Trait.NO_MEMORY_EFFECT), operands, List.of(type), 0);
  }

  public static ViewOp create(
      OpBuilder builder,
      MemRefType type,
      Value source,
      Value byteShift,
      List<? extends Value> dynamicSizes) {
    Preconditions.checkArgument(
        dynamicSizes.size() == type.numDynamicDims(),
        "%s needs %s dynamic sizes, not %s",
        type,
        type.numDynamicDims(),
        dynamicSizes.size());
    List<Value> operands = new ArrayList<>();
    operands.add(source);
    operands.add(byteShift);
    operands.addAll(dynamicSizes);
    return builder.insert(new ViewOp(builder.context(), type, operands));
  }

  public Value source() {
    return operand(0);
  }

  public Value byteShift() {
    return operand(1);
  }

  @Override
  public MemRefType memRefType() {
    return (MemRefType) result().type();
  }

  @Override
  public List<Value> dynamicSizes() {
    return operands().subList(2, numOperands());
  }

  @Override
  public boolean verify() {
    if (!(source().type() instanceof MemRefType sourceType)
        || sourceType.rank() != 1
        || sourceType.elementType() != Type.I8) {
      return emitOpError("requires a one-dimensional i8 memref source");
    } else if (!byteShift().type().isIndex()) {
      return emitOpError("requires an index byte shift");
    } else if (dynamicSizes().size() != memRefType().numDynamicDims()) {
      return emitOpError("incorrect number of size operands for type %s", memRefType());
    }
    return true;
  }
}
