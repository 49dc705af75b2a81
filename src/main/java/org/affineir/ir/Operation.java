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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An Operation is a node in the IR: it has a kind, a list of operand Values, a list of result
 * Values, and zero or more nested Regions. An Operation belongs to at most one Block at a time.
 *
 * <p>Subclasses define the operations of this library; each provides its own static {@code
 * create} methods, which build the operation and insert it with an {@link OpBuilder}.
 *
 * <p>The operand list and the use lists of the operand values are always kept consistent; all
 * operand changes go through {@link #setOperand} or {@link #setOperands}.
 */
public abstract class Operation {

  private final IrContext context;
  private final OpKind kind;
  private final Set<Trait> traits;

  /** A small integer, unique within the context, used only when printing. */
  final int id;

  private final List<Value> operands = new ArrayList<>();
  private final ImmutableList<OpResult> results;
  private final ImmutableList<Region> regions;
  private @Nullable Block block;
  private boolean erased;

  protected Operation(
      IrContext context,
      OpKind kind,
      Set<Trait> traits,
      List<? extends Value> operands,
      List<Type> resultTypes,
      int numRegions) {
    this.context = context;
    this.kind = kind;
    this.traits = traits.isEmpty() ? Set.of() : Sets.immutableEnumSet(traits);
    this.id = context.nextOpId();
    ImmutableList.Builder<OpResult> resultBuilder = ImmutableList.builder();
    for (int i = 0; i < resultTypes.size(); i++) {
      resultBuilder.add(new OpResult(this, i, resultTypes.get(i)));
    }
    this.results = resultBuilder.build();
    ImmutableList.Builder<Region> regionBuilder = ImmutableList.builder();
    for (int i = 0; i < numRegions; i++) {
      regionBuilder.add(new Region(this));
    }
    this.regions = regionBuilder.build();
    addOperands(operands);
  }

  public IrContext context() {
    return context;
  }

  public OpKind kind() {
    return kind;
  }

  /** The printed name of this operation, e.g. {@code "affine.for"}. */
  public String name() {
    return kind.opName;
  }

  public boolean hasTrait(Trait trait) {
    return traits.contains(trait);
  }

  /** True if this operation neither reads nor writes memory. */
  public boolean hasNoMemoryEffect() {
    return hasTrait(Trait.NO_MEMORY_EFFECT);
  }

  public List<Value> operands() {
    return Collections.unmodifiableList(operands);
  }

  public Value operand(int i) {
    return operands.get(i);
  }

  public int numOperands() {
    return operands.size();
  }

  /** Replaces operand {@code i}, keeping the use lists consistent. */
  public void setOperand(int i, Value value) {
    Value old = operands.get(i);
    if (old == value) {
      return;
    }
    Use use = new Use(this, i);
    old.removeUse(use);
    operands.set(i, value);
    value.addUse(use);
  }

  /** Replaces the whole operand list, which may change its length. */
  protected void setOperands(List<? extends Value> newOperands) {
    List<Value> copy = new ArrayList<>(newOperands);
    dropOperands();
    addOperands(copy);
  }

  /**
   * Replaces the {@code length} operands starting at {@code start} with {@code replacements}, which
   * may have a different length.
   */
  protected void setOperands(int start, int length, List<? extends Value> replacements) {
    List<Value> newOperands = new ArrayList<>(operands.subList(0, start));
    newOperands.addAll(replacements);
    newOperands.addAll(operands.subList(start + length, operands.size()));
    setOperands(newOperands);
  }

  private void addOperands(List<? extends Value> values) {
    for (Value v : values) {
      Preconditions.checkArgument(v != null, "null operand");
      v.addUse(new Use(this, operands.size()));
      operands.add(v);
    }
  }

  private void dropOperands() {
    for (int i = 0; i < operands.size(); i++) {
      operands.get(i).removeUse(new Use(this, i));
    }
    operands.clear();
  }

  public List<OpResult> results() {
    return results;
  }

  public OpResult result(int i) {
    return results.get(i);
  }

  /** Returns the only result of this operation. */
  public OpResult result() {
    Preconditions.checkState(results.size() == 1, "%s does not have exactly one result", this);
    return results.get(0);
  }

  public int numResults() {
    return results.size();
  }

  /** Returns the types of this operation's results. */
  public List<Type> resultTypes() {
    return results.stream().map(Value::type).collect(Collectors.toList());
  }

  /** True if none of this operation's results are used. */
  public boolean resultsUnused() {
    return results.stream().allMatch(Value::hasNoUses);
  }

  public List<Region> regions() {
    return regions;
  }

  public Region region(int i) {
    return regions.get(i);
  }

  public int numRegions() {
    return regions.size();
  }

  public @Nullable Block parentBlock() {
    return block;
  }

  void setParentBlock(@Nullable Block block) {
    this.block = block;
  }

  public @Nullable Region parentRegion() {
    return (block == null) ? null : block.parent();
  }

  /** Returns the operation whose region contains this one, or null at the top level. */
  public @Nullable Operation parentOp() {
    Region region = parentRegion();
    return (region == null) ? null : region.parentOp();
  }

  /** True if {@code other} is nested (at any depth) in one of this operation's regions. */
  public boolean isProperAncestor(Operation other) {
    for (Operation op = other.parentOp(); op != null; op = op.parentOp()) {
      if (op == this) {
        return true;
      }
    }
    return false;
  }

  /** True if {@link #erase} has been called on this operation or an ancestor. */
  public boolean isErased() {
    return erased;
  }

  /**
   * Calls {@code visitor} on each operation nested in this one and then on this one (i.e. in
   * post-order). The visitor may erase the operation it is passed.
   */
  public void walk(Consumer<Operation> visitor) {
    for (Region region : regions) {
      region.walk(visitor);
    }
    visitor.accept(this);
  }

  /** Drops the operands of this operation and of every operation nested in it. */
  public void dropAllReferences() {
    walk(Operation::dropOperands);
  }

  /**
   * Removes this operation from its block and discards it, along with everything nested in it. Its
   * results must not have any remaining uses.
   */
  public void erase() {
    for (OpResult r : results) {
      Preconditions.checkState(r.hasNoUses(), "cannot erase %s: %s still has uses", this, r);
    }
    dropAllReferences();
    walk(op -> op.erased = true);
    if (block != null) {
      block.remove(this);
    }
  }

  /** Removes this operation from its current block and inserts it just before {@code anchor}. */
  public void moveBefore(Operation anchor) {
    Block target = anchor.parentBlock();
    Preconditions.checkArgument(target != null, "%s is not in a block", anchor);
    if (block != null) {
      block.remove(this);
    }
    target.insert(target.indexOf(anchor), this);
  }

  /**
   * Checks the operation-specific invariants of this operation, reporting any failure through
   * {@link #emitOpError}. Nested operations are checked separately by the {@link Verifier}.
   */
  public boolean verify() {
    return true;
  }

  /**
   * Attempts to fold this operation, either by simplifying it in place or by determining that its
   * single result is equal to an existing value or to a constant.
   */
  public FoldResult fold() {
    return FoldResult.FAILURE;
  }

  /** Returns the patterns that the canonicalizer should try on operations of this kind. */
  public List<RewritePattern> canonicalizationPatterns() {
    return ImmutableList.of();
  }

  /** Reports an error about this operation; always returns false. */
  @FormatMethod
  @CanIgnoreReturnValue
  public boolean emitOpError(String fmt, Object... args) {
    String message = "'" + name() + "' op " + String.format(fmt, args);
    context.diagnostics().emit(Diagnostic.Severity.ERROR, this, message);
    return false;
  }

  /**
   * Reports an error about this operation unless the same error has already been reported through
   * this method; always returns false.
   */
  @FormatMethod
  @CanIgnoreReturnValue
  public boolean emitUniqueOpError(String fmt, Object... args) {
    String message = "'" + name() + "' op " + String.format(fmt, args);
    context.diagnostics().emitUnique(Diagnostic.Severity.ERROR, this, message);
    return false;
  }

  @FormatMethod
  public void emitWarning(String fmt, Object... args) {
    context.diagnostics().emit(Diagnostic.Severity.WARNING, this, String.format(fmt, args));
  }

  @FormatMethod
  public void emitRemark(String fmt, Object... args) {
    context.diagnostics().emit(Diagnostic.Severity.REMARK, this, String.format(fmt, args));
  }

  /** Returns a string describing any operation-specific attributes, or an empty string. */
  protected String attributesString() {
    return "";
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!results.isEmpty()) {
      sb.append(results.stream().map(Value::toString).collect(Collectors.joining(", ")));
      sb.append(" = ");
    }
    sb.append(name());
    if (!operands.isEmpty()) {
      sb.append(operands.stream().map(Value::toString).collect(Collectors.joining(", ", "(", ")")));
    }
    String attributes = attributesString();
    if (!attributes.isEmpty()) {
      sb.append(" {").append(attributes).append('}');
    }
    return sb.toString();
  }
}
