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

import org.jspecify.annotations.Nullable;

/** Argument {@link #index} of a Block, e.g. a loop induction variable or a function parameter. */
public final class BlockArgument extends Value {
  public final Block owner;
  public final int index;

  BlockArgument(Block owner, int index, Type type) {
    super(type);
    this.owner = owner;
    this.index = index;
  }

  @Override
  public IrContext context() {
    return owner.context();
  }

  @Override
  public @Nullable Operation definingOp() {
    return null;
  }

  @Override
  public Block parentBlock() {
    return owner;
  }

  @Override
  public String toString() {
    Operation parent = owner.parentOp();
    return (parent == null) ? "%arg" + index : "%" + parent.id + "_arg" + index;
  }
}
