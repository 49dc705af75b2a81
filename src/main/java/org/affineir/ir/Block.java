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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A Block is a list of block arguments followed by an ordered list of Operations. The last
 * operation may be a terminator (an operation with {@link Trait#TERMINATOR}).
 */
public final class Block {

  private final IrContext context;
  private @Nullable Region parent;
  private final List<BlockArgument> arguments = new ArrayList<>();
  private final List<Operation> operations = new ArrayList<>();

  Block(IrContext context, @Nullable Region parent) {
    this.context = context;
    this.parent = parent;
  }

  public IrContext context() {
    return context;
  }

  /** The region containing this block, or null if it has been removed from its region. */
  public @Nullable Region parent() {
    return parent;
  }

  void setParent(@Nullable Region parent) {
    this.parent = parent;
  }

  /** The operation owning the region containing this block, if any. */
  public @Nullable Operation parentOp() {
    return (parent == null) ? null : parent.parentOp();
  }

  public BlockArgument addArgument(Type type) {
    BlockArgument arg = new BlockArgument(this, arguments.size(), type);
    arguments.add(arg);
    return arg;
  }

  public List<BlockArgument> arguments() {
    return Collections.unmodifiableList(arguments);
  }

  public BlockArgument argument(int i) {
    return arguments.get(i);
  }

  public int numArguments() {
    return arguments.size();
  }

  public List<Operation> operations() {
    return Collections.unmodifiableList(operations);
  }

  public int numOperations() {
    return operations.size();
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  public Operation front() {
    return operations.get(0);
  }

  public int indexOf(Operation op) {
    Preconditions.checkArgument(op.parentBlock() == this, "%s is not in this block", op);
    return operations.indexOf(op);
  }

  void insert(int index, Operation op) {
    Preconditions.checkArgument(op.parentBlock() == null, "%s is already in a block", op);
    operations.add(index, op);
    op.setParentBlock(this);
  }

  void remove(Operation op) {
    boolean removed = operations.remove(op);
    assert removed;
    op.setParentBlock(null);
  }

  /** Returns the last operation if it is a terminator, otherwise null. */
  public @Nullable Operation terminator() {
    if (operations.isEmpty()) {
      return null;
    }
    Operation last = operations.get(operations.size() - 1);
    return last.hasTrait(Trait.TERMINATOR) ? last : null;
  }

  /** True if this block contains exactly one operation, its terminator. */
  public boolean hasOnlyTerminator() {
    return operations.size() == 1 && terminator() != null;
  }

  /**
   * Returns {@code op} or the ancestor of {@code op} that is directly contained in this block, or
   * null if {@code op} is not nested in this block.
   */
  public @Nullable Operation findAncestorOpInBlock(Operation op) {
    for (Operation current = op; current != null; current = current.parentOp()) {
      if (current.parentBlock() == this) {
        return current;
      }
    }
    return null;
  }

  /** Calls {@code visitor} on each nested operation, in post-order. */
  public void walk(Consumer<Operation> visitor) {
    // Copy so that the visitor may erase the operation it is given
    for (Operation op : new ArrayList<>(operations)) {
      op.walk(visitor);
    }
  }
}
