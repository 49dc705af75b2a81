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

package org.affineir.ir;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.affineir.expr.AffineExprContext;
import org.jspecify.annotations.Nullable;

/**
 * An OpBuilder inserts newly-created Operations at its current insertion point, which is either
 * the end of a block or just before an existing operation. Operations may also be created without
 * an insertion point, in which case they are left detached.
 */
public final class OpBuilder {

  /** A saved insertion point; see {@link #saveInsertionPoint}. */
  public record InsertionPoint(@Nullable Block block, @Nullable Operation before) {}

  private final IrContext context;
  private @Nullable Block block;

  /** If non-null, new operations are inserted just before this one; otherwise at the block end. */
  private @Nullable Operation before;

  public OpBuilder(IrContext context) {
    this.context = context;
  }

  public static OpBuilder atBlockEnd(Block block) {
    OpBuilder result = new OpBuilder(block.context());
    result.setInsertionPointToEnd(block);
    return result;
  }

  public static OpBuilder atBlockBegin(Block block) {
    OpBuilder result = new OpBuilder(block.context());
    result.setInsertionPointToStart(block);
    return result;
  }

  public static OpBuilder before(Operation op) {
    OpBuilder result = new OpBuilder(op.context());
    result.setInsertionPoint(op);
    return result;
  }

  public IrContext context() {
    return context;
  }

  /** Shorthand for {@code context().exprs()}. */
  public AffineExprContext exprs() {
    return context.exprs();
  }

  public @Nullable Block insertionBlock() {
    return block;
  }

  public void setInsertionPointToEnd(Block block) {
    this.block = block;
    this.before = null;
  }

  public void setInsertionPointToStart(Block block) {
    this.block = block;
    this.before = block.isEmpty() ? null : block.front();
  }

  /** Subsequent operations will be inserted just before {@code op}. */
  public void setInsertionPoint(Operation op) {
    Preconditions.checkArgument(op.parentBlock() != null, "%s is not in a block", op);
    this.block = op.parentBlock();
    this.before = op;
  }

  /** Subsequent operations will be inserted just after {@code op}. */
  public void setInsertionPointAfter(Operation op) {
    Block parent = op.parentBlock();
    Preconditions.checkArgument(parent != null, "%s is not in a block", op);
    int next = parent.indexOf(op) + 1;
    this.block = parent;
    this.before = (next < parent.numOperations()) ? parent.operations().get(next) : null;
  }

  /** Subsequent operations will not be inserted anywhere. */
  public void clearInsertionPoint() {
    this.block = null;
    this.before = null;
  }

  public InsertionPoint saveInsertionPoint() {
    return new InsertionPoint(block, before);
  }

  public void restoreInsertionPoint(InsertionPoint ip) {
    this.block = ip.block();
    this.before = ip.before();
  }

  /** Inserts {@code op} at the current insertion point (if there is one), and returns it. */
  @CanIgnoreReturnValue
  public <T extends Operation> T insert(T op) {
    if (block != null) {
      int index = (before == null) ? block.numOperations() : block.indexOf(before);
      block.insert(index, op);
    }
    return op;
  }
}
