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
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.expr.AffineStructure;
import org.affineir.expr.IntegerSet;
import org.affineir.ir.AffineOptions;
import org.affineir.ir.Logging;
import org.affineir.ir.Matchers;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Value;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A static-only class that rewrites an affine map or integer set together with the values bound
 * to its inputs.
 *
 * <p>Canonicalization ({@link #canonicalize}) leaves the denoted values unchanged but
 *
 * <ul>
 *   <li>moves dimension inputs that are valid symbols to symbol positions,
 *   <li>drops inputs that no expression references,
 *   <li>merges inputs bound to the same value, and
 *   <li>replaces symbols bound to constants by the constants themselves.
 * </ul>
 *
 * <p>Composition ({@link #compose}) additionally replaces each input bound to the result of an
 * affine.apply by that apply's expression, binding the apply's operands in its place, and then
 * canonicalizes and simplifies the result.
 */
public class AffineComposer {

  private static final Logger logger = Logging.getLogger();

  private AffineComposer() {}

  /** An affine map or integer set together with the values bound to its inputs. */
  public record WithOperands<T extends AffineStructure<T>>(
      T structure, ImmutableList<Value> operands) {
    public WithOperands {
      Preconditions.checkArgument(
          structure.numInputs() == operands.size(),
          "%s has %s inputs but %s operands",
          structure,
          structure.numInputs(),
          operands.size());
    }

    public static <T extends AffineStructure<T>> WithOperands<T> of(
        T structure, List<? extends Value> operands) {
      return new WithOperands<>(structure, ImmutableList.copyOf(operands));
    }
  }

  public static WithOperands<AffineMap> canonicalizeMapAndOperands(
      AffineMap map, List<? extends Value> operands) {
    return canonicalize(WithOperands.of(map, operands));
  }

  public static WithOperands<IntegerSet> canonicalizeSetAndOperands(
      IntegerSet set, List<? extends Value> operands) {
    return canonicalize(WithOperands.of(set, operands));
  }

  /**
   * Canonicalizes {@code input} until it no longer changes; applying this to its own result
   * returns an equal result.
   */
  public static <T extends AffineStructure<T>> WithOperands<T> canonicalize(WithOperands<T> input) {
    WithOperands<T> current = input;
    // Each productive round removes an operand or moves one from a dimension to a symbol
    for (int round = 0; round <= 2 * input.operands().size(); round++) {
      WithOperands<T> next = canonicalizeOnce(current);
      if (next.equals(current)) {
        return current;
      }
      current = next;
    }
    return current;
  }

  private static <T extends AffineStructure<T>> WithOperands<T> canonicalizeOnce(
      WithOperands<T> input) {
    if (input.operands().isEmpty()) {
      return input;
    }
    WithOperands<T> promoted = promoteSymbols(input);
    T s = promoted.structure();
    List<Value> operands = promoted.operands();
    AffineExprContext context = s.context();
    int numDims = s.numDims();

    BitSet usedDims = new BitSet();
    BitSet usedSyms = new BitSet();
    s.walkExprs(
        e -> {
          if (e instanceof AffineExpr.Dim d) {
            usedDims.set(d.position);
          } else if (e instanceof AffineExpr.Symbol sym) {
            usedSyms.set(sym.position);
          }
        });

    List<Value> result = new ArrayList<>();
    Map<Value, AffineExpr> seenDims = new IdentityHashMap<>();
    AffineExpr[] dimRemapping = new AffineExpr[numDims];
    int nextDim = 0;
    for (int i = 0; i < numDims; i++) {
      if (usedDims.get(i)) {
        Value v = operands.get(i);
        AffineExpr seen = seenDims.get(v);
        if (seen == null) {
          seen = context.dim(nextDim++);
          seenDims.put(v, seen);
          result.add(v);
        }
        dimRemapping[i] = seen;
      }
    }
    Map<Value, AffineExpr> seenSyms = new IdentityHashMap<>();
    AffineExpr[] symRemapping = new AffineExpr[s.numSymbols()];
    int nextSym = 0;
    for (int i = 0; i < s.numSymbols(); i++) {
      if (!usedSyms.get(i)) {
        continue;
      }
      Value v = operands.get(numDims + i);
      OptionalLong constant = Matchers.constantValue(v);
      if (constant.isPresent()) {
        symRemapping[i] = context.constant(constant.getAsLong());
        continue;
      }
      AffineExpr seen = seenSyms.get(v);
      if (seen == null) {
        seen = context.symbol(nextSym++);
        seenSyms.put(v, seen);
        result.add(v);
      }
      symRemapping[i] = seen;
    }
    return WithOperands.of(
        s.replaceDimsAndSymbols(dimRemapping, symRemapping, nextDim, nextSym), result);
  }

  /** Moves each dimension input bound to a valid symbol to a new symbol position at the end. */
  private static <T extends AffineStructure<T>> WithOperands<T> promoteSymbols(
      WithOperands<T> input) {
    T s = input.structure();
    List<Value> operands = input.operands();
    AffineExprContext context = s.context();
    int oldNumSyms = s.numSymbols();
    List<Value> result = new ArrayList<>();
    List<Value> promoted = new ArrayList<>();
    AffineExpr[] dimRemapping = new AffineExpr[s.numDims()];
    int nextDim = 0;
    for (int i = 0; i < s.numDims(); i++) {
      Value v = operands.get(i);
      if (AffineLegality.isValidSymbol(v)) {
        dimRemapping[i] = context.symbol(oldNumSyms + promoted.size());
        promoted.add(v);
      } else {
        dimRemapping[i] = context.dim(nextDim++);
        result.add(v);
      }
    }
    if (promoted.isEmpty()) {
      return input;
    }
    result.addAll(operands.subList(s.numDims(), operands.size()));
    result.addAll(promoted);
    int numSyms = oldNumSyms + promoted.size();
    T remapped = s.replaceDimsAndSymbols(dimRemapping, new AffineExpr[0], nextDim, numSyms);
    return WithOperands.of(remapped, result);
  }

  /**
   * Replaces every input of {@code map} that is bound to an affine.apply result by the apply's
   * expression, repeatedly, then canonicalizes and simplifies.
   */
  public static WithOperands<AffineMap> compose(AffineMap map, List<? extends Value> operands) {
    Preconditions.checkArgument(
        map.numInputs() == operands.size(),
        "%s has %s inputs but %s operands",
        map,
        map.numInputs(),
        operands.size());
    if (map.numResults() != 0) {
      Splicer splicer = new Splicer(map, operands);
      splicer.run(maxSteps(operands));
      operands = splicer.prune();
      map = splicer.map;
    }
    WithOperands<AffineMap> result = canonicalizeMapAndOperands(map, operands);
    AffineMap simplified = result.structure().simplify();
    // Simplification may cancel terms, leaving inputs unreferenced
    return canonicalizeMapAndOperands(simplified, result.operands());
  }

  /** Composes {@code map} until none of its operands is an affine.apply result. */
  public static WithOperands<AffineMap> fullyCompose(
      AffineMap map, List<? extends Value> operands) {
    WithOperands<AffineMap> result = WithOperands.of(map, operands);
    int limit = maxSteps(operands);
    for (int round = 0; hasApplyOperand(result.operands()); round++) {
      if (round >= limit) {
        logger.warn(String.format("Composition of %s stopped after %s rounds", map, round));
        break;
      }
      result = compose(result.structure(), result.operands());
    }
    return result;
  }

  /** Creates an affine.apply of the composition of {@code map} and {@code operands}. */
  public static ApplyOp makeComposedApply(
      OpBuilder builder, AffineMap map, List<? extends Value> operands) {
    WithOperands<AffineMap> composed = compose(map, operands);
    return ApplyOp.create(builder, composed.structure(), composed.operands());
  }

  public static boolean hasApplyOperand(List<? extends Value> operands) {
    return operands.stream().anyMatch(v -> v.definingOp() instanceof ApplyOp);
  }

  private static int maxSteps(List<? extends Value> operands) {
    return operands.isEmpty()
        ? AffineOptions.DEFAULT.maxCompositionSteps()
        : operands.get(0).context().options().maxCompositionSteps();
  }

  /**
   * Holds a map whose dimensions and symbols are bound to {@link #dims} and {@link #syms}. Each
   * splice nulls out the replaced entry and appends the apply's operands; entries are never
   * reordered, so positions stay valid throughout.
   */
  private static class Splicer {
    AffineMap map;
    final List<@Nullable Value> dims;
    final List<@Nullable Value> syms;

    Splicer(AffineMap map, List<? extends Value> operands) {
      this.map = map;
      this.dims = new ArrayList<>(operands.subList(0, map.numDims()));
      this.syms = new ArrayList<>(operands.subList(map.numDims(), operands.size()));
    }

    void run(int maxSteps) {
      for (int steps = 0; ; steps++) {
        boolean changed = false;
        for (int pos = 0; pos < dims.size() + syms.size(); pos++) {
          if (splice(pos)) {
            changed = true;
            break;
          }
        }
        if (!changed) {
          return;
        } else if (steps + 1 >= maxSteps) {
          logger.warn(
              String.format("Composition stopped after %s splices into %s", maxSteps, map));
          return;
        }
      }
    }

    /**
     * If input {@code pos} (dimensions first, then symbols) is bound to an affine.apply result,
     * replaces it by the apply's expression and returns true.
     */
    boolean splice(int pos) {
      boolean isDim = pos < dims.size();
      int index = isDim ? pos : pos - dims.size();
      Value v = isDim ? dims.get(index) : syms.get(index);
      if (v == null || !(v.definingOp() instanceof ApplyOp apply)) {
        return false;
      }
      if (isDim) {
        dims.set(index, null);
      } else {
        syms.set(index, null);
      }
      AffineMap applyMap = apply.map();
      Preconditions.checkState(applyMap.numResults() == 1, "%s must have one result", apply);
      AffineExprContext context = map.context();
      AffineExpr expr = applyMap.result(0);
      List<Value> applyOperands = apply.operands();
      int applyDims = applyMap.numDims();
      AffineExpr toReplace;
      if (isDim) {
        toReplace = context.dim(index);
        expr = expr.shiftDims(dims.size()).shiftSymbols(syms.size());
        dims.addAll(applyOperands.subList(0, applyDims));
        syms.addAll(applyOperands.subList(applyDims, applyOperands.size()));
      } else {
        // A symbol may only be computed from symbols, so bind all of the apply's inputs as symbols
        toReplace = context.symbol(index);
        AffineExpr[] dimsAsSyms = new AffineExpr[applyDims];
        for (int i = 0; i < applyDims; i++) {
          dimsAsSyms[i] = context.symbol(syms.size() + i);
        }
        expr =
            expr.shiftSymbols(syms.size() + applyDims)
                .replaceDimsAndSymbols(dimsAsSyms, new AffineExpr[0]);
        syms.addAll(applyOperands);
      }
      if (logger.isTraceEnabled()) {
        logger.trace(String.format("Splicing %s for %s in %s", expr, toReplace, map));
      }
      map = map.replace(toReplace, expr, dims.size(), syms.size());
      return true;
    }

    /**
     * Removes the null entries from {@link #dims} and {@link #syms}, renumbering the map's inputs
     * to match, and returns the remaining operands.
     */
    List<Value> prune() {
      AffineExprContext context = map.context();
      List<Value> operands = new ArrayList<>();
      AffineExpr[] dimReplacements = new AffineExpr[dims.size()];
      int numDims = 0;
      for (int i = 0; i < dims.size(); i++) {
        Value v = dims.get(i);
        if (v == null) {
          assert !map.isFunctionOfDim(i);
          dimReplacements[i] = context.constant(0);
        } else {
          dimReplacements[i] = context.dim(numDims++);
          operands.add(v);
        }
      }
      AffineExpr[] symReplacements = new AffineExpr[syms.size()];
      int numSyms = 0;
      for (int i = 0; i < syms.size(); i++) {
        Value v = syms.get(i);
        if (v == null) {
          assert !map.isFunctionOfSymbol(i);
          symReplacements[i] = context.constant(0);
        } else {
          symReplacements[i] = context.symbol(numSyms++);
          operands.add(v);
        }
      }
      map = map.replaceDimsAndSymbols(dimReplacements, symReplacements, numDims, numSyms);
      return operands;
    }
  }
}
