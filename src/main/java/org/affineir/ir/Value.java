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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A Value is an SSA value: either the result of an {@link Operation} ({@link OpResult}) or an
 * argument of a {@link Block} ({@link BlockArgument}). Values are compared by identity.
 */
public abstract class Value {

  private final Type type;

  /** Every operand slot that currently refers to this value. */
  private final List<Use> uses = new ArrayList<>();

  Value(Type type) {
    this.type = type;
  }

  public Type type() {
    return type;
  }

  /** The context of the Operation or Block that owns this value. */
  public abstract IrContext context();

  /** Returns the Operation that produced this value, or null for a block argument. */
  public abstract @Nullable Operation definingOp();

  /**
   * Returns the Block in which this value is defined: the owner of a block argument, or the block
   * containing the defining operation (null if that operation has not been inserted).
   */
  public abstract @Nullable Block parentBlock();

  /** Returns the Region containing {@link #parentBlock}, if any. */
  public @Nullable Region parentRegion() {
    Block block = parentBlock();
    return (block == null) ? null : block.parent();
  }

  public List<Use> uses() {
    return Collections.unmodifiableList(uses);
  }

  public boolean hasNoUses() {
    return uses.isEmpty();
  }

  /** Returns the distinct operations that use this value, in the order of their first use. */
  public Set<Operation> users() {
    Set<Operation> result = new LinkedHashSet<>();
    for (Use use : uses) {
      result.add(use.user());
    }
    return result;
  }

  void addUse(Use use) {
    uses.add(use);
  }

  void removeUse(Use use) {
    boolean removed = uses.remove(use);
    assert removed;
  }

  /** Makes every current use of this value refer to {@code replacement} instead. */
  public void replaceAllUsesWith(Value replacement) {
    replaceAllUsesExcept(replacement, Set.of());
  }

  /**
   * Makes every current use of this value refer to {@code replacement} instead, except uses by the
   * operations in {@code exceptions}.
   */
  public void replaceAllUsesExcept(Value replacement, Set<Operation> exceptions) {
    Preconditions.checkArgument(replacement != this, "cannot replace a value with itself");
    for (Use use : new ArrayList<>(uses)) {
      if (!exceptions.contains(use.user())) {
        use.user().setOperand(use.index(), replacement);
      }
    }
  }
}
