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

import java.util.EnumSet;
import java.util.List;
import org.affineir.ir.Block;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Region;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Value;

/**
 * Terminates the body of a for, parallel or if operation. Its operands become the results of the
 * parent operation (for a for loop, the values carried into the next iteration).
 */
public final class YieldOp extends Operation {

  private YieldOp(IrContext context, List<? extends Value> operands) {
    super(
        context,
        OpKind.YIELD,
        EnumSet.of(Trait.TERMINATOR, Trait.NO_MEMORY_EFFECT),
        operands,
        List.of(),
        0);
  }

  public static YieldOp create(OpBuilder builder, List<? extends Value> operands) {
    return builder.insert(new YieldOp(builder.context(), operands));
  }

  public static YieldOp create(OpBuilder builder) {
    return create(builder, List.of());
  }

  /**
   * Ensures that {@code region} has a block ending in a terminator, adding an empty block and an
   * operand-free yield as needed.
   */
  static void ensureTerminator(Region region, IrContext context) {
    Block block = region.isEmpty() ? region.addBlock() : region.front();
    if (block.terminator() == null) {
      OpBuilder builder = new OpBuilder(context);
      builder.setInsertionPointToEnd(block);
      create(builder);
    }
  }

  @Override
  public boolean verify() {
    Operation parent = parentOp();
    if (!(parent instanceof ForOp || parent instanceof ParallelOp || parent instanceof IfOp)) {
      return emitOpError("only terminates affine.if/for/parallel regions");
    }
    if (parent.numResults() != numOperands()) {
      return emitOpError(
          "parent of yield must have same number of results as the yield operands");
    }
    for (int i = 0; i < numOperands(); i++) {
      Type expected = parent.result(i).type();
      if (!expected.equals(operand(i).type())) {
        return emitOpError("types mismatch between yield op and its parent");
      }
    }
    return true;
  }
}
