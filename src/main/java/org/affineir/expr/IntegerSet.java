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

package org.affineir.expr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * An IntegerSet is a conjunction of constraints over {@link #numDims} dimensions and {@link
 * #numSymbols} symbols. Each constraint is an AffineExpr that must either equal zero (an equality)
 * or be non-negative (an inequality).
 */
public final class IntegerSet implements AffineStructure<IntegerSet> {

  private final AffineExprContext context;
  private final int numDims;
  private final int numSymbols;
  private final ImmutableList<AffineExpr> constraints;

  /** {@code eqFlags[i]} is true if constraint {@code i} is an equality. */
  private final boolean[] eqFlags;

  private IntegerSet(
      AffineExprContext context,
      int numDims,
      int numSymbols,
      ImmutableList<AffineExpr> constraints,
      boolean[] eqFlags) {
    this.context = context;
    this.numDims = numDims;
    this.numSymbols = numSymbols;
    this.constraints = constraints;
    this.eqFlags = eqFlags;
  }

  public static IntegerSet get(
      AffineExprContext context,
      int numDims,
      int numSymbols,
      List<AffineExpr> constraints,
      boolean... eqFlags) {
    Preconditions.checkArgument(
        constraints.size() == eqFlags.length, "each constraint needs exactly one equality flag");
    ImmutableList<AffineExpr> copy = ImmutableList.copyOf(constraints);
    for (AffineExpr c : copy) {
      Preconditions.checkArgument(c.context() == context, "%s from another context", c);
      AffineMap.checkInRange(c, numDims, numSymbols);
    }
    return new IntegerSet(context, numDims, numSymbols, copy, eqFlags.clone());
  }

  /** Returns the set with no constraints, which contains every point. */
  public static IntegerSet universe(AffineExprContext context, int numDims, int numSymbols) {
    return new IntegerSet(context, numDims, numSymbols, ImmutableList.of(), new boolean[0]);
  }

  @Override
  public AffineExprContext context() {
    return context;
  }

  @Override
  public int numDims() {
    return numDims;
  }

  @Override
  public int numSymbols() {
    return numSymbols;
  }

  public int numConstraints() {
    return constraints.size();
  }

  public ImmutableList<AffineExpr> constraints() {
    return constraints;
  }

  public AffineExpr constraint(int i) {
    return constraints.get(i);
  }

  public boolean isEq(int i) {
    return eqFlags[i];
  }

  public int numEqualities() {
    int result = 0;
    for (boolean eq : eqFlags) {
      if (eq) {
        result++;
      }
    }
    return result;
  }

  public int numInequalities() {
    return eqFlags.length - numEqualities();
  }

  public boolean isFunctionOfDim(int position) {
    return constraints.stream().anyMatch(c -> c.isFunctionOfDim(position));
  }

  public boolean isFunctionOfSymbol(int position) {
    return constraints.stream().anyMatch(c -> c.isFunctionOfSymbol(position));
  }

  @Override
  public void walkExprs(Consumer<AffineExpr> visitor) {
    constraints.forEach(c -> c.walk(visitor));
  }

  @Override
  public IntegerSet replaceDimsAndSymbols(
      @Nullable AffineExpr[] dimReplacements,
      @Nullable AffineExpr[] symbolReplacements,
      int newNumDims,
      int newNumSymbols) {
    ImmutableList<AffineExpr> newConstraints =
        constraints.stream()
            .map(c -> c.replaceDimsAndSymbols(dimReplacements, symbolReplacements))
            .collect(ImmutableList.toImmutableList());
    return get(context, newNumDims, newNumSymbols, newConstraints, eqFlags);
  }

  @Override
  public IntegerSet simplify() {
    ImmutableList<AffineExpr> newConstraints =
        constraints.stream()
            .map(c -> FlatAffineExpr.simplify(c, numDims, numSymbols))
            .collect(ImmutableList.toImmutableList());
    return newConstraints.equals(constraints)
        ? this
        : new IntegerSet(context, numDims, numSymbols, newConstraints, eqFlags);
  }

  /**
   * True if the given point (dimensions first, then symbols) satisfies every constraint. A
   * constraint that cannot be evaluated (a division by a non-positive value) is not satisfied.
   */
  public boolean contains(long... inputs) {
    Preconditions.checkArgument(inputs.length == numInputs(), "wrong number of inputs");
    long[] dims = Arrays.copyOfRange(inputs, 0, numDims);
    long[] syms = Arrays.copyOfRange(inputs, numDims, inputs.length);
    for (int i = 0; i < constraints.size(); i++) {
      OptionalLong v = constraints.get(i).evaluate(dims, syms);
      if (v.isEmpty()) {
        return false;
      }
      long value = v.getAsLong();
      if (eqFlags[i] ? value != 0 : value < 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof IntegerSet other)
        && context == other.context
        && numDims == other.numDims
        && numSymbols == other.numSymbols
        && constraints.equals(other.constraints)
        && Arrays.equals(eqFlags, other.eqFlags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numDims, numSymbols, constraints, Arrays.hashCode(eqFlags));
  }

  /** Prints e.g. {@code (d0)[s0] : (d0 - s0 >= 0, d0 == 0)}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    AffineMap.appendInputs(sb, numDims, numSymbols);
    sb.append(" : (");
    for (int i = 0; i < constraints.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(constraints.get(i)).append(eqFlags[i] ? " == 0" : " >= 0");
    }
    return sb.append(')').toString();
  }
}
