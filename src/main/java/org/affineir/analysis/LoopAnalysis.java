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

package org.affineir.analysis;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import org.affineir.affine.AffineAccessOp;
import org.affineir.affine.AffineValueMap;
import org.affineir.affine.ApplyOp;
import org.affineir.affine.ForOp;
import org.affineir.affine.IfOp;
import org.affineir.affine.LoadOp;
import org.affineir.affine.StoreOp;
import org.affineir.affine.VectorLoadOp;
import org.affineir.affine.VectorStoreOp;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.expr.FlatAffineExpr;
import org.affineir.ir.Block;
import org.affineir.ir.Logging;
import org.affineir.ir.Operation;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Type.VectorType;
import org.affineir.ir.Use;
import org.affineir.ir.Value;
import org.affineir.util.MathUtil;
import org.apache.log4j.Logger;

/**
 * Static analyses of for loops and the memory accesses in their bodies: trip counts, invariance
 * and contiguity of accesses, vectorizability, and legality of shifting body operations.
 *
 * <p>None of these analyses modify the IR.
 */
public class LoopAnalysis {

  private static final Logger logger = Logging.getLogger();

  /** Matches the vector loads and stores, and any generic operation named vector.transfer_*. */
  public static final Predicate<Operation> DEFAULT_VECTOR_TRANSFER_MATCHER =
      op ->
          op instanceof VectorLoadOp
              || op instanceof VectorStoreOp
              || op.name().startsWith("vector.transfer_");

  private LoopAnalysis() {}

  /**
   * Returns a map computing the loop's trip count. With constant bounds this is a constant map;
   * otherwise each result is the trip count implied by one upper bound (the loop runs for the
   * minimum of them). Returns empty if the lower bound has more than one result, or if constant
   * bounds are so far apart that their difference does not fit in a long.
   */
  public static Optional<AffineValueMap> buildTripCountMap(ForOp loop) {
    long step = loop.step();
    AffineExprContext exprs = loop.context().exprs();
    if (loop.hasConstantBounds()) {
      OptionalLong span =
          MathUtil.checkedSubtract(loop.constantUpperBound(), loop.constantLowerBound());
      if (span.isEmpty()) {
        return Optional.empty();
      }
      long tripCount = MathUtil.ceilDiv(Math.max(0, span.getAsLong()), step);
      AffineMap map = AffineMap.constant(exprs, tripCount);
      return Optional.of(new AffineValueMap(map, List.of()));
    }
    AffineMap lbMap = loop.lowerBoundMap();
    if (lbMap.numResults() != 1) {
      return Optional.empty();
    }
    AffineValueMap ub = loop.upperBoundValueMap();
    AffineMap lbSplat =
        AffineMap.get(
            exprs,
            lbMap.numDims(),
            lbMap.numSymbols(),
            Collections.nCopies(ub.numResults(), lbMap.result(0)));
    AffineValueMap tripCount =
        AffineValueMap.difference(ub, new AffineValueMap(lbSplat, loop.lowerBoundOperands()));
    for (int i = 0; i < tripCount.numResults(); i++) {
      tripCount.setResult(i, tripCount.result(i).ceilDiv(step));
    }
    return Optional.of(tripCount);
  }

  /**
   * Returns the loop's trip count if every result of its trip count map is constant (the minimum
   * of them if there is more than one). A negative difference between the bounds counts as zero.
   */
  public static OptionalLong constantTripCount(ForOp loop) {
    Optional<AffineValueMap> tripCount = buildTripCountMap(loop);
    if (tripCount.isEmpty() || !tripCount.get().map().isConstant()) {
      return OptionalLong.empty();
    }
    long result = Long.MAX_VALUE;
    for (long count : tripCount.get().map().constantResults()) {
      result = Math.min(result, Math.max(0, count));
    }
    return OptionalLong.of(result);
  }

  /**
   * Returns the largest integer known to divide the loop's trip count: the GCD over the results
   * of its trip count map of either the constant result or the largest known divisor of the
   * expression. A zero trip count is divisible by anything, so if every result is zero this
   * returns {@link Long#MAX_VALUE}.
   */
  public static long largestDivisorOfTripCount(ForOp loop) {
    Optional<AffineValueMap> tripCount = buildTripCountMap(loop);
    if (tripCount.isEmpty()) {
      return 1;
    }
    long gcd = 0;
    for (AffineExpr expr : tripCount.get().map().results()) {
      long divisor;
      if (expr instanceof AffineExpr.Constant c) {
        divisor = Math.max(0, c.value);
      } else {
        divisor = expr.largestKnownDivisor();
      }
      gcd = MathUtil.gcd(gcd, divisor);
    }
    return (gcd == 0) ? Long.MAX_VALUE : gcd;
  }

  /**
   * True if {@code index} does not vary with {@code iv}, the induction variable of a for loop.
   * Only one level of affine.apply is looked through; if {@code index} depends on more than one
   * apply the result is conservatively false.
   */
  public static boolean isAccessIndexInvariant(Value iv, Value index) {
    Preconditions.checkArgument(ForOp.isForInductionVar(iv), "%s is not a loop variable", iv);
    Preconditions.checkArgument(index.type().isIndex(), "%s is not an index", index);
    List<ApplyOp> applies = reachableApplies(index);
    if (applies.isEmpty()) {
      return index != iv;
    } else if (applies.size() > 1) {
      applies
          .get(0)
          .emitRemark(
              "affine.apply operations must be composed first: there should be at most one"
                  + " affine.apply, returning false conservatively");
      return false;
    }
    return !applies.get(0).valueMap().isFunctionOf(0, iv);
  }

  /** Returns the elements of {@code indices} that do not vary with {@code iv}. */
  public static Set<Value> invariantAccesses(Value iv, List<Value> indices) {
    Set<Value> result = new LinkedHashSet<>();
    for (Value index : indices) {
      if (isAccessIndexInvariant(iv, index)) {
        result.add(index);
      }
    }
    return result;
  }

  /**
   * True if none of the subscripts of {@code access} vary with {@code loop}'s induction variable,
   * or with the induction variable of any loop whose bounds depend on it.
   */
  public static boolean isInvariantAccess(AffineAccessOp access, ForOp loop) {
    Value iv = loop.inductionVar();
    for (Value operand : access.mapOperands()) {
      if (!isAccessIndexInvariant(iv, operand)) {
        return false;
      }
    }
    for (ForOp dependent : dependentLoops(iv)) {
      if (!isInvariantAccess(access, dependent)) {
        return false;
      }
    }
    return true;
  }

  /**
   * If {@code access} is contiguous along {@code iv} (it is invariant along {@code iv} or only one
   * of its subscripts varies, with stride 1), returns the varying memref dimension counted from
   * the innermost, or -1 if the access is invariant. Returns empty if the access is not
   * contiguous. Memrefs with a non-identity layout are reported as unsupported, once per access.
   */
  public static OptionalInt contiguousDim(Value iv, AffineAccessOp access) {
    MemRefType type = access.memRefType();
    if (!type.hasIdentityLayout()) {
      access.emitUniqueOpError("non-trivial layout map not supported");
      return OptionalInt.empty();
    }
    AffineMap map = access.map();
    List<Value> operands = access.mapOperands();
    int varyingResult = -1;
    for (int i = 0; i < type.rank(); i++) {
      Optional<FlatAffineExpr> flat =
          FlatAffineExpr.of(map.result(i), map.numDims(), map.numSymbols());
      long coefficient = 0;
      for (int j = 0; j < operands.size(); j++) {
        if (operands.get(j) != iv) {
          continue;
        }
        if (flat.isEmpty() || flat.get().isUsedByLocal(j)) {
          // Semi-affine, or the induction variable is divided: no constant stride
          AffineExpr result = map.result(i);
          boolean uses =
              (j < map.numDims())
                  ? result.isFunctionOfDim(j)
                  : result.isFunctionOfSymbol(j - map.numDims());
          if (uses) {
            return OptionalInt.empty();
          }
          continue;
        }
        coefficient += flat.get().coefficient(j);
      }
      if (coefficient == 0) {
        continue;
      } else if (varyingResult != -1 || coefficient != 1) {
        return OptionalInt.empty();
      }
      varyingResult = i;
    }
    int memRefDim = (varyingResult == -1) ? -1 : type.rank() - (varyingResult + 1);
    for (ForOp dependent : dependentLoops(iv)) {
      OptionalInt depDim = contiguousDim(dependent.inductionVar(), access);
      if (depDim.isEmpty()) {
        return OptionalInt.empty();
      } else if (memRefDim == -1) {
        memRefDim = depDim.getAsInt();
      } else if (depDim.getAsInt() != memRefDim) {
        return OptionalInt.empty();
      }
    }
    return OptionalInt.of(memRefDim);
  }

  public static boolean isContiguousAccess(Value iv, AffineAccessOp access) {
    return contiguousDim(iv, access).isPresent();
  }

  /**
   * True if the body of {@code loop} could be vectorized: it contains no conditionals, no other
   * operations with regions except nested for loops, nothing matched by {@code
   * vectorTransferMatcher}, and every load and store accesses scalar elements and satisfies
   * {@code isVectorizableOp}.
   */
  public static boolean isVectorizableLoopBody(
      ForOp loop,
      BiPredicate<ForOp, AffineAccessOp> isVectorizableOp,
      Predicate<Operation> vectorTransferMatcher) {
    List<Operation> nested = new ArrayList<>();
    loop.region(0).walk(nested::add);
    for (Operation op : nested) {
      if (op instanceof IfOp) {
        return false;
      } else if (op.numRegions() != 0 && !(op instanceof ForOp)) {
        return false;
      } else if (vectorTransferMatcher.test(op)) {
        return false;
      }
    }
    for (Operation op : nested) {
      if (op instanceof LoadOp || op instanceof StoreOp) {
        AffineAccessOp access = (AffineAccessOp) op;
        if (access.memRefType().elementType() instanceof VectorType
            || !isVectorizableOp.test(loop, access)) {
          return false;
        }
      }
    }
    return true;
  }

  /** As above, with no restriction on individual loads and stores beyond their element type. */
  public static boolean isVectorizableLoopBody(
      ForOp loop, Predicate<Operation> vectorTransferMatcher) {
    return isVectorizableLoopBody(loop, (l, access) -> true, vectorTransferMatcher);
  }

  /**
   * Returns the memref dimension along which every load and store in the body of {@code loop} is
   * contiguous (-1 if all are invariant), or empty if the body is not vectorizable or its accesses
   * are contiguous along different dimensions.
   */
  public static OptionalInt vectorizableMemRefDim(
      ForOp loop, Predicate<Operation> vectorTransferMatcher) {
    int[] memRefDim = {-1};
    BiPredicate<ForOp, AffineAccessOp> contiguous =
        (l, access) -> {
          OptionalInt dim = contiguousDim(l.inductionVar(), access);
          if (dim.isEmpty()) {
            return false;
          }
          int thisDim = dim.getAsInt();
          if (thisDim != -1) {
            if (memRefDim[0] != -1 && memRefDim[0] != thisDim) {
              return false;
            }
            memRefDim[0] = thisDim;
          }
          return true;
        };
    if (!isVectorizableLoopBody(loop, contiguous, vectorTransferMatcher)) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(memRefDim[0]);
  }

  /**
   * True if shifting the operations in the body of {@code loop} by {@code shifts} (one per
   * operation, in order) would keep every value defined before it is used: each result must only
   * be used by operations in the body with the same shift as its producer.
   */
  public static boolean isOpwiseShiftValid(ForOp loop, long[] shifts) {
    Block body = loop.body();
    List<Operation> ops = body.operations();
    Preconditions.checkArgument(
        shifts.length == ops.size(),
        "expected %s shifts, not %s",
        ops.size(),
        shifts.length);
    // Visit users before their producers so that each user's shift has been recorded
    Map<Operation, Long> bodyShift = new IdentityHashMap<>();
    for (int i = ops.size() - 1; i >= 0; i--) {
      Operation op = ops.get(i);
      long shift = shifts[i];
      bodyShift.put(op, shift);
      for (Value result : op.results()) {
        for (Use use : result.uses()) {
          Operation ancestor = body.findAncestorOpInBlock(use.user());
          if (ancestor == null) {
            continue;
          }
          Long userShift = bodyShift.get(ancestor);
          assert userShift != null;
          if (userShift != shift) {
            if (logger.isDebugEnabled()) {
              logger.debug(
                  String.format(
                      "Shift %s of %s differs from shift %s of its user %s",
                      shift, op.name(), userShift, ancestor.name()));
            }
            return false;
          }
        }
      }
    }
    return true;
  }

  /** Returns the affine.apply operations that {@code value} depends on, directly or indirectly. */
  private static List<ApplyOp> reachableApplies(Value value) {
    List<ApplyOp> result = new ArrayList<>();
    Deque<Value> pending = new ArrayDeque<>();
    pending.add(value);
    while (!pending.isEmpty()) {
      Value v = pending.removeFirst();
      if (v.definingOp() instanceof ApplyOp apply && !result.contains(apply)) {
        result.add(apply);
        pending.addAll(apply.operands());
      }
    }
    return result;
  }

  /** Returns the for loops that use {@code iv} as a bound operand. */
  private static Set<ForOp> dependentLoops(Value iv) {
    Set<ForOp> result = new LinkedHashSet<>();
    for (Use use : iv.uses()) {
      if (use.user() instanceof ForOp loop) {
        result.add(loop);
      }
    }
    return result;
  }
}
