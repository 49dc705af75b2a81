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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.affineir.expr.AffineExpr.Constant;
import org.affineir.expr.AffineExpr.Dim;
import org.affineir.expr.AffineExpr.Symbol;
import org.jspecify.annotations.Nullable;

/**
 * An AffineMap is a function from {@link #numDims} dimensions and {@link #numSymbols} symbols to a
 * list of results, each an {@link AffineExpr} over those inputs. A map with no results is
 * "empty".
 *
 * <p>AffineMaps are immutable and compared structurally; since their results are interned,
 * comparing two maps from the same context is cheap.
 */
public final class AffineMap implements AffineStructure<AffineMap> {

  private final AffineExprContext context;
  private final int numDims;
  private final int numSymbols;
  private final ImmutableList<AffineExpr> results;

  private AffineMap(
      AffineExprContext context, int numDims, int numSymbols, ImmutableList<AffineExpr> results) {
    this.context = context;
    this.numDims = numDims;
    this.numSymbols = numSymbols;
    this.results = results;
  }

  /**
   * Returns a new AffineMap. Every result must belong to {@code context} and may only reference
   * dimensions below {@code numDims} and symbols below {@code numSymbols}.
   */
  public static AffineMap get(
      AffineExprContext context, int numDims, int numSymbols, List<AffineExpr> results) {
    Preconditions.checkArgument(numDims >= 0 && numSymbols >= 0);
    ImmutableList<AffineExpr> copy = ImmutableList.copyOf(results);
    for (AffineExpr result : copy) {
      Preconditions.checkArgument(result.context() == context, "%s from another context", result);
      checkInRange(result, numDims, numSymbols);
    }
    return new AffineMap(context, numDims, numSymbols, copy);
  }

  public static AffineMap get(
      AffineExprContext context, int numDims, int numSymbols, AffineExpr... results) {
    return get(context, numDims, numSymbols, Arrays.asList(results));
  }

  /** Returns a map with no inputs and no results. */
  public static AffineMap empty(AffineExprContext context) {
    return new AffineMap(context, 0, 0, ImmutableList.of());
  }

  /** Returns {@code () -> (value)}. */
  public static AffineMap constant(AffineExprContext context, long value) {
    return new AffineMap(context, 0, 0, ImmutableList.of(context.constant(value)));
  }

  /** Returns {@code (d0, ..., d<n-1>) -> (d0, ..., d<n-1>)}. */
  public static AffineMap identity(AffineExprContext context, int n) {
    ImmutableList.Builder<AffineExpr> builder = ImmutableList.builderWithExpectedSize(n);
    for (int i = 0; i < n; i++) {
      builder.add(context.dim(i));
    }
    return new AffineMap(context, n, 0, builder.build());
  }

  /** Returns {@code ()[s0] -> (s0)}. */
  public static AffineMap symbolIdentity(AffineExprContext context) {
    return new AffineMap(context, 0, 1, ImmutableList.of(context.symbol(0)));
  }

  static void checkInRange(AffineExpr expr, int numDims, int numSymbols) {
    expr.walk(
        e -> {
          if (e instanceof Dim d) {
            Preconditions.checkArgument(
                d.position < numDims, "%s used with only %s dimensions", e, numDims);
          } else if (e instanceof Symbol s) {
            Preconditions.checkArgument(
                s.position < numSymbols, "%s used with only %s symbols", e, numSymbols);
          }
        });
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

  public int numResults() {
    return results.size();
  }

  public ImmutableList<AffineExpr> results() {
    return results;
  }

  public AffineExpr result(int i) {
    return results.get(i);
  }

  /** True if this map has no results. */
  public boolean isEmpty() {
    return results.isEmpty();
  }

  /** True if result {@code i} is {@code d<i>} for every result, and there is one per dimension. */
  public boolean isIdentity() {
    if (numDims != results.size()) {
      return false;
    }
    for (int i = 0; i < numDims; i++) {
      if (!(results.get(i) instanceof Dim d) || d.position != i) {
        return false;
      }
    }
    return true;
  }

  /** True if this map has a single result and that result is a constant. */
  public boolean isSingleConstant() {
    return results.size() == 1 && results.get(0) instanceof Constant;
  }

  /** Requires {@link #isSingleConstant}. */
  public long singleConstantResult() {
    Preconditions.checkState(isSingleConstant(), "%s is not a single constant", this);
    return ((Constant) results.get(0)).value;
  }

  /** True if every result is a constant (vacuously true for an empty map). */
  public boolean isConstant() {
    return results.stream().allMatch(r -> r instanceof Constant);
  }

  /** Requires {@link #isConstant}. */
  public long[] constantResults() {
    Preconditions.checkState(isConstant(), "%s is not constant", this);
    return results.stream().mapToLong(r -> ((Constant) r).value).toArray();
  }

  /** True if some result references dimension {@code position}. */
  public boolean isFunctionOfDim(int position) {
    return results.stream().anyMatch(r -> r.isFunctionOfDim(position));
  }

  /** True if some result references symbol {@code position}. */
  public boolean isFunctionOfSymbol(int position) {
    return results.stream().anyMatch(r -> r.isFunctionOfSymbol(position));
  }

  @Override
  public void walkExprs(Consumer<AffineExpr> visitor) {
    results.forEach(r -> r.walk(visitor));
  }

  @Override
  public AffineMap replaceDimsAndSymbols(
      @Nullable AffineExpr[] dimReplacements,
      @Nullable AffineExpr[] symbolReplacements,
      int newNumDims,
      int newNumSymbols) {
    ImmutableList<AffineExpr> newResults =
        results.stream()
            .map(r -> r.replaceDimsAndSymbols(dimReplacements, symbolReplacements))
            .collect(ImmutableList.toImmutableList());
    return get(context, newNumDims, newNumSymbols, newResults);
  }

  /**
   * Returns a map with {@code newNumDims} dimensions and {@code newNumSymbols} symbols whose
   * results are these with every occurrence of {@code expr} replaced by {@code replacement}.
   */
  public AffineMap replace(
      AffineExpr expr, AffineExpr replacement, int newNumDims, int newNumSymbols) {
    ImmutableList<AffineExpr> newResults =
        results.stream()
            .map(r -> r.replace(expr, replacement))
            .collect(ImmutableList.toImmutableList());
    return get(context, newNumDims, newNumSymbols, newResults);
  }

  /** Returns a map with the same inputs and the given results. */
  public AffineMap withResults(List<AffineExpr> newResults) {
    return get(context, numDims, numSymbols, newResults);
  }

  /** Returns a map with only the results at the given positions. */
  public AffineMap subMap(int... positions) {
    ImmutableList.Builder<AffineExpr> builder = ImmutableList.builder();
    for (int i : positions) {
      builder.add(results.get(i));
    }
    return new AffineMap(context, numDims, numSymbols, builder.build());
  }

  /** Returns a map with the first occurrence of each distinct result, in order. */
  public AffineMap dropDuplicateResults() {
    LinkedHashSet<AffineExpr> unique = new LinkedHashSet<>(results);
    if (unique.size() == results.size()) {
      return this;
    }
    return new AffineMap(context, numDims, numSymbols, ImmutableList.copyOf(unique));
  }

  /**
   * Returns {@code this(inner(...))}. The result takes {@code inner}'s dimensions, and the symbols
   * of {@code inner} followed by those of this map.
   */
  public AffineMap compose(AffineMap inner) {
    Preconditions.checkArgument(
        numDims == inner.numResults(),
        "cannot compose %s with %s: %s dimensions but %s results",
        this,
        inner,
        numDims,
        inner.numResults());
    AffineExpr[] dimReplacements = inner.results.toArray(new AffineExpr[0]);
    AffineExpr[] symReplacements = new AffineExpr[numSymbols];
    for (int i = 0; i < numSymbols; i++) {
      symReplacements[i] = context.symbol(inner.numSymbols + i);
    }
    return replaceDimsAndSymbols(
        dimReplacements, symReplacements, inner.numDims, inner.numSymbols + numSymbols);
  }

  /** Returns this map with its dimensions renumbered from {@code shift}. */
  public AffineMap shiftDims(int shift) {
    return get(
        context,
        numDims + shift,
        numSymbols,
        results.stream().map(r -> r.shiftDims(shift)).collect(Collectors.toList()));
  }

  /** Returns this map with its symbols renumbered from {@code shift}. */
  public AffineMap shiftSymbols(int shift) {
    return get(
        context,
        numDims,
        numSymbols + shift,
        results.stream().map(r -> r.shiftSymbols(shift)).collect(Collectors.toList()));
  }

  @Override
  public AffineMap simplify() {
    ImmutableList<AffineExpr> newResults =
        results.stream()
            .map(r -> FlatAffineExpr.simplify(r, numDims, numSymbols))
            .collect(ImmutableList.toImmutableList());
    return newResults.equals(results)
        ? this
        : new AffineMap(context, numDims, numSymbols, newResults);
  }

  /**
   * Evaluates every result with the given inputs (dimensions first, then symbols). Returns empty if
   * any result cannot be evaluated.
   */
  public Optional<long[]> constantFold(long... inputs) {
    Preconditions.checkArgument(inputs.length == numInputs(), "wrong number of inputs");
    long[] dims = Arrays.copyOfRange(inputs, 0, numDims);
    long[] syms = Arrays.copyOfRange(inputs, numDims, inputs.length);
    long[] values = new long[results.size()];
    for (int i = 0; i < values.length; i++) {
      OptionalLong v = results.get(i).evaluate(dims, syms);
      if (v.isEmpty()) {
        return Optional.empty();
      }
      values[i] = v.getAsLong();
    }
    return Optional.of(values);
  }

  /**
   * Substitutes the known inputs (dimensions first, then symbols; null for unknown) into this map
   * and simplifies. The returned map has the same inputs as this one.
   */
  public AffineMap partialConstantFold(List<@Nullable Long> inputs) {
    Preconditions.checkArgument(inputs.size() == numInputs(), "wrong number of inputs");
    AffineExpr[] dimReplacements = new AffineExpr[numDims];
    AffineExpr[] symReplacements = new AffineExpr[numSymbols];
    for (int i = 0; i < numDims; i++) {
      Long v = inputs.get(i);
      dimReplacements[i] = (v == null) ? context.dim(i) : context.constant(v);
    }
    for (int i = 0; i < numSymbols; i++) {
      Long v = inputs.get(numDims + i);
      symReplacements[i] = (v == null) ? context.symbol(i) : context.constant(v);
    }
    return replaceDimsAndSymbols(dimReplacements, symReplacements, numDims, numSymbols).simplify();
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof AffineMap other)
        && context == other.context
        && numDims == other.numDims
        && numSymbols == other.numSymbols
        && results.equals(other.results);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numDims, numSymbols, results);
  }

  /** Prints e.g. {@code (d0, d1)[s0] -> (d0 + s0, d1)}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendInputs(sb, numDims, numSymbols);
    sb.append(" -> (");
    sb.append(results.stream().map(AffineExpr::toString).collect(Collectors.joining(", ")));
    return sb.append(')').toString();
  }

  static void appendInputs(StringBuilder sb, int numDims, int numSymbols) {
    List<String> dims = new ArrayList<>();
    for (int i = 0; i < numDims; i++) {
      dims.add("d" + i);
    }
    sb.append('(').append(String.join(", ", dims)).append(')');
    if (numSymbols != 0) {
      List<String> syms = new ArrayList<>();
      for (int i = 0; i < numSymbols; i++) {
        syms.add("s" + i);
      }
      sb.append('[').append(String.join(", ", syms)).append(']');
    }
  }
}
