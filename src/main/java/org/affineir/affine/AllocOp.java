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
import java.util.List;
import java.util.Set;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/** Allocates a new memref; its operands are the sizes of the dynamic dimensions. */
public final class AllocOp extends Operation implements MemRefDefOp {

  private AllocOp(IrContext context, MemRefType type, List<? extends Value> dynamicSizes) {
    super(context, OpKind.ALLOC, Set.of(), dynamicSizes, List.of(type), 0);
  }

  public static AllocOp create(OpBuilder builder, MemRefType type, List<? extends Value> sizes) {
    Preconditions.checkArgument(
        sizes.size() == type.numDynamicDims(),
        "%s needs %s dynamic sizes, not %s",
        type,
        type.numDynamicDims(),
        sizes.size());
    return builder.insert(new AllocOp(builder.context(), type, sizes));
  }

  public static AllocOp create(OpBuilder builder, MemRefType type, Value... sizes) {
    return create(builder, type, List.of(sizes));
  }

  @Override
  public MemRefType memRefType() {
    return (MemRefType) result().type();
  }

  @Override
  public List<Value> dynamicSizes() {
    return operands();
  }

  @Override
  public boolean verify() {
    if (numOperands() != memRefType().numDynamicDims()) {
      return emitOpError("dimension operand count does not equal memref dynamic dimension count");
    }
    return true;
  }
}
