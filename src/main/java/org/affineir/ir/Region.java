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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/** A Region is an ordered list of Blocks owned by an Operation. */
public final class Region {

  private final Operation owner;
  private final List<Block> blocks = new ArrayList<>();

  Region(Operation owner) {
    this.owner = owner;
  }

  public Operation parentOp() {
    return owner;
  }

  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  public boolean hasOneBlock() {
    return blocks.size() == 1;
  }

  public Block front() {
    return blocks.get(0);
  }

  /** Appends a new empty block to this region. */
  public Block addBlock() {
    Block block = new Block(owner.context(), this);
    blocks.add(block);
    return block;
  }

  /** Erases {@code block} and all the operations it contains. */
  public void eraseBlock(Block block) {
    for (Operation op : new ArrayList<>(block.operations())) {
      op.dropAllReferences();
    }
    for (int i = block.numOperations() - 1; i >= 0; i--) {
      block.operations().get(i).erase();
    }
    boolean removed = blocks.remove(block);
    assert removed;
    block.setParent(null);
  }

  /**
   * True if {@code other} is this region or is nested (at any depth) within an operation in this
   * region.
   */
  public boolean isAncestor(Region other) {
    for (Region r = other; r != null; ) {
      if (r == this) {
        return true;
      }
      Operation op = r.parentOp();
      r = op.parentRegion();
    }
    return false;
  }

  /** Calls {@code visitor} on each nested operation, in post-order. */
  public void walk(Consumer<Operation> visitor) {
    for (Block block : new ArrayList<>(blocks)) {
      block.walk(visitor);
    }
  }
}
