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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.affineir.affine.AffineComposer.WithOperands;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.ir.Value;

/**
 * An AffineMap together with the Values bound to its inputs and, optionally, the Values holding
 * its results. AffineValueMaps do not own any of these Values.
 *
 * <p>The map and operands are always replaced together, so {@code operands().size() ==
 * map().numInputs()} holds after every operation.
 */
public final class AffineValueMap {

  private AffineMap map;
  private ImmutableList<Value> operands;
  private ImmutableList<Value> results;

  public AffineValueMap(AffineMap map, List<? extends Value> operands) {
    this(map, operands, List.of());
  }

  public AffineValueMap(
      AffineMap map, List<? extends Value> operands, List<? extends Value> results) {
    reset(map, operands, results);
  }

  public void reset(AffineMap map, List<? extends Value> operands) {
    reset(map, operands, List.of());
  }

  public void reset(AffineMap map, List<? extends Value> operands, List<? extends Value> results) {
    Preconditions.checkArgument(
        map.numInputs() == operands.size(),
        "%s has %s inputs but %s operands",
        map,
        map.numInputs(),
        operands.size());
    this.map = map;
    this.operands = ImmutableList.copyOf(operands);
    this.results = ImmutableList.copyOf(results);
  }

  public AffineMap map() {
    return map;
  }

  public ImmutableList<Value> operands() {
    return operands;
  }

  public Value operand(int i) {
    return operands.get(i);
  }

  public int numOperands() {
    return operands.size();
  }

  public int numDims() {
    return map.numDims();
  }

  public int numSymbols() {
    return map.numSymbols();
  }

  public int numResults() {
    return map.numResults();
  }

  public AffineExpr result(int i) {
    return map.result(i);
  }

  /** The Values holding the map's results, if they were provided. */
  public ImmutableList<Value> results() {
    return results;
  }

  /** Replaces result {@code i} of the map, keeping its inputs. */
  public void setResult(int i, AffineExpr expr) {
    List<AffineExpr> newResults = new ArrayList<>(map.results());
    newResults.set(i, expr);
    map = map.withResults(newResults);
  }

  /** True if result {@code index} of the map depends on {@code value}. */
  public boolean isFunctionOf(int index, Value value) {
    AffineExpr expr = map.result(index);
    for (int i = 0; i < operands.size(); i++) {
      if (operands.get(i) == value) {
        boolean uses =
            (i < map.numDims())
                ? expr.isFunctionOfDim(i)
                : expr.isFunctionOfSymbol(i - map.numDims());
        if (uses) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Composes any affine.apply operations producing the operands into the map, and canonicalizes
   * the result. Returns true if the map or its operands changed.
   */
  public boolean canonicalize() {
    WithOperands<AffineMap> composed = AffineComposer.compose(map, operands);
    if (composed.structure().equals(map) && composed.operands().equals(operands)) {
      return false;
    }
    reset(composed.structure(), composed.operands());
    return true;
  }

  /**
   * Returns a value map whose results are the results of {@code a} minus the corresponding results
   * of {@code b}, over the union of their (fully composed) operands.
   */
  public static AffineValueMap difference(AffineValueMap a, AffineValueMap b) {
    Preconditions.checkArgument(
        a.numResults() == b.numResults(),
        "cannot subtract %s results from %s",
        b.numResults(),
        a.numResults());
    WithOperands<AffineMap> aFull = AffineComposer.fullyCompose(a.map, a.operands);
    WithOperands<AffineMap> bFull = AffineComposer.fullyCompose(b.map, b.operands);
    // A value bound to a symbol in either map is bound to a symbol in the union
    Map<Value, Integer> symbols = new IdentityHashMap<>();
    addSymbols(aFull, symbols);
    addSymbols(bFull, symbols);
    Map<Value, Integer> dims = new IdentityHashMap<>();
    List<Value> dimValues = new ArrayList<>();
    for (WithOperands<AffineMap> m : List.of(aFull, bFull)) {
      for (Value v : m.operands().subList(0, m.structure().numDims())) {
        if (!symbols.containsKey(v) && !dims.containsKey(v)) {
          dims.put(v, dimValues.size());
          dimValues.add(v);
        }
      }
    }
    List<Value> unionOperands = new ArrayList<>(dimValues);
    unionOperands.addAll(orderedKeys(symbols));
    AffineExprContext context = a.map.context();
    AffineMap aMap = remap(aFull, dims, symbols);
    AffineMap bMap = remap(bFull, dims, symbols);
    List<AffineExpr> diffs = new ArrayList<>();
    for (int i = 0; i < aMap.numResults(); i++) {
      diffs.add(aMap.result(i).minus(bMap.result(i)));
    }
    AffineMap diffMap = AffineMap.get(context, dims.size(), symbols.size(), diffs);
    WithOperands<AffineMap> result = AffineComposer.compose(diffMap, unionOperands);
    return new AffineValueMap(result.structure(), result.operands());
  }

  /** Assigns the next free index to each not-yet-seen symbol operand of {@code m}. */
  private static void addSymbols(WithOperands<AffineMap> m, Map<Value, Integer> indices) {
    List<Value> operands = m.operands();
    for (Value v : operands.subList(m.structure().numDims(), operands.size())) {
      indices.putIfAbsent(v, indices.size());
    }
  }

  private static List<Value> orderedKeys(Map<Value, Integer> indices) {
    Value[] result = new Value[indices.size()];
    indices.forEach((v, i) -> result[i] = v);
    return List.of(result);
  }

  /** Rewrites {@code m}'s map over the union inputs described by {@code dims} and {@code syms}. */
  private static AffineMap remap(
      WithOperands<AffineMap> m, Map<Value, Integer> dims, Map<Value, Integer> syms) {
    AffineMap map = m.structure();
    AffineExprContext context = map.context();
    AffineExpr[] dimReplacements = new AffineExpr[map.numDims()];
    AffineExpr[] symReplacements = new AffineExpr[map.numSymbols()];
    for (int i = 0; i < map.numInputs(); i++) {
      Value v = m.operands().get(i);
      Integer symbol = syms.get(v);
      AffineExpr replacement =
          (symbol != null) ? context.symbol(symbol) : context.dim(dims.get(v));
      if (i < map.numDims()) {
        dimReplacements[i] = replacement;
      } else {
        symReplacements[i - map.numDims()] = replacement;
      }
    }
    return map.replaceDimsAndSymbols(dimReplacements, symReplacements, dims.size(), syms.size());
  }

  @Override
  public String toString() {
    return map + " " + operands;
  }
}
