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
import java.util.EnumSet;
import java.util.List;
import org.affineir.ir.FoldResult;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/** Returns the size of one dimension of a memref. */
public final class DimOp extends Operation {

  private final int index;

  private DimOp(IrContext context, Value source, int index) {
    super(
        context,
        OpKind.DIM,
        EnumSet.of(Trait.NO_MEMORY_EFFECT),
        List.of(source),
        List.of(Type.INDEX),
        0);
    this.index = index;
  }

  public static DimOp create(OpBuilder builder, Value source, int index) {
    Preconditions.checkArgument(index >= 0, "negative dimension index");
    return builder.insert(new DimOp(builder.context(), source, index));
  }

  public Value source() {
    return operand(0);
  }

  /** The dimension whose size is returned. */
  public int index() {
    return index;
  }

  @Override
  public boolean verify() {
    if (!(source().type() instanceof MemRefType type)) {
      return emitOpError("requires a memref operand");
    } else if (index >= type.rank()) {
      return emitOpError("index is out of range");
    }
    return true;
  }

  /**
   * Folds to the size if the dimension is static, or to the corresponding size operand if the
   * source is defined by a {@link MemRefDefOp}.
   */
  @Override
  public FoldResult fold() {
    if (!(source().type() instanceof MemRefType type) || index >= type.rank()) {
      return FoldResult.FAILURE;
    } else if (!type.isDynamicDim(index)) {
      return FoldResult.ofConstant(type.dimSize(index));
    } else if (source().definingOp() instanceof MemRefDefOp def) {
      return FoldResult.of(def.dynamicSizes().get(type.dynamicDimIndex(index)));
    }
    return FoldResult.FAILURE;
  }

  @Override
  protected String attributesString() {
    return "index = " + index;
  }
}
