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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.affineir.ir.Block;
import org.affineir.ir.BlockArgument;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Trait;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/**
 * Starts a new affine scope inside an existing one, so that values computed in the enclosing
 * scope's loops become symbols. Every memref used inside must be passed in explicitly: the
 * operands are memrefs and the entry block has one argument of the same type for each.
 */
public final class ExecuteRegionOp extends Operation {

  private ExecuteRegionOp(IrContext context, List<? extends Value> memRefs) {
    super(context, OpKind.EXECUTE_REGION, Set.of(Trait.SCOPE), memRefs, List.of(), 1);
  }

  public static ExecuteRegionOp create(OpBuilder builder, List<? extends Value> memRefs) {
    ExecuteRegionOp result = builder.insert(new ExecuteRegionOp(builder.context(), memRefs));
    Block body = result.region(0).addBlock();
    memRefs.forEach(v -> body.addArgument(v.type()));
    return result;
  }

  public Block body() {
    return region(0).front();
  }

  @Override
  public boolean verify() {
    Set<Value> memRefsUsed = new LinkedHashSet<>();
    region(0)
        .walk(
            inner -> {
              for (Value v : inner.operands()) {
                if (v.type() instanceof MemRefType) {
                  memRefsUsed.add(v);
                }
              }
            });
    for (Value memRef : memRefsUsed) {
      if (!isCaptured(memRef)) {
        return emitOpError("incoming memref not explicitly captured");
      }
    }
    Block entry = body();
    if (entry.numArguments() != numOperands()) {
      return emitOpError("region argument count does not match operand count");
    }
    for (int i = 0; i < numOperands(); i++) {
      if (!operand(i).type().equals(entry.argument(i).type())) {
        return emitOpError("region argument %s does not match corresponding operand", i);
      }
    }
    return true;
  }

  /** True if {@code memRef} is an argument of this op's body or is defined inside it. */
  private boolean isCaptured(Value memRef) {
    if (memRef instanceof BlockArgument arg) {
      return arg.owner.parentOp() == this;
    }
    Operation def = memRef.definingOp();
    return def != null && isProperAncestor(def);
  }
}
