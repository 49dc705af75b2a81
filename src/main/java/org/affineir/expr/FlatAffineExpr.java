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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.affineir.expr.AffineExpr.Binary;
import org.affineir.expr.AffineExpr.Constant;
import org.affineir.expr.AffineExpr.Dim;
import org.affineir.expr.AffineExpr.Symbol;
import org.affineir.util.MathUtil;
import org.jspecify.annotations.Nullable;

/**
 * A pure affine expression flattened into a sum of terms: one coefficient per dimension, one per
 * symbol, one per "local" (a floordiv or ceildiv of some other flattened sum by a positive
 * constant), and a constant term.
 *
 * <p>For example {@code d0 * 2 + (d1 mod 4) + 3} flattens to {@code 2*d0 + d1 - 4*q + 3}, where
 * {@code q} is the local {@code d1 floordiv 4}.
 */
public final class FlatAffineExpr {

  /** A local variable: {@code dividend floordiv divisor} or {@code dividend ceildiv divisor}. */
  private record Local(LinearSum dividend, long divisor, boolean ceil) {}

  /**
   * A linear combination over inputs and locals. The locals are shared by all sums produced while
   * flattening a single expression, so a LinearSum only records their coefficients.
   */
  private static final class LinearSum {
    final long[] inputs;
    long[] locals;
    long constant;

    LinearSum(int numInputs, int numLocals) {
      inputs = new long[numInputs];
      locals = new long[numLocals];
    }

    long local(int i) {
      return (i < locals.length) ? locals[i] : 0;
    }

    void setLocal(int i, long coefficient) {
      if (i >= locals.length) {
        locals = Arrays.copyOf(locals, i + 1);
      }
      locals[i] = coefficient;
    }

    boolean isConstant() {
      return allZero(inputs) && allZero(locals);
    }

    LinearSum plus(LinearSum other, long scale) {
      LinearSum result = new LinearSum(inputs.length, Math.max(locals.length, other.locals.length));
      for (int i = 0; i < inputs.length; i++) {
        result.inputs[i] = inputs[i] + scale * other.inputs[i];
      }
      for (int i = 0; i < result.locals.length; i++) {
        result.locals[i] = local(i) + scale * other.local(i);
      }
      result.constant = constant + scale * other.constant;
      return result;
    }

    LinearSum scale(long factor) {
      LinearSum result = new LinearSum(inputs.length, locals.length);
      return result.plus(this, factor);
    }

    /** Returns the gcd of all coefficients and {@code divisor}. */
    long gcdWith(long divisor) {
      long result = MathUtil.gcd(divisor, constant);
      for (long c : inputs) {
        result = MathUtil.gcd(result, c);
      }
      for (long c : locals) {
        result = MathUtil.gcd(result, c);
      }
      return result;
    }

    LinearSum divideExactly(long divisor) {
      LinearSum result = new LinearSum(inputs.length, locals.length);
      for (int i = 0; i < inputs.length; i++) {
        result.inputs[i] = inputs[i] / divisor;
      }
      for (int i = 0; i < locals.length; i++) {
        result.locals[i] = locals[i] / divisor;
      }
      result.constant = constant / divisor;
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof LinearSum other)) {
        return false;
      }
      if (constant != other.constant || !Arrays.equals(inputs, other.inputs)) {
        return false;
      }
      int n = Math.max(locals.length, other.locals.length);
      for (int i = 0; i < n; i++) {
        if (local(i) != other.local(i)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int hashCode() {
      // Trailing zero locals must not affect the hash
      int n = locals.length;
      while (n > 0 && locals[n - 1] == 0) {
        n--;
      }
      return Arrays.hashCode(inputs) * 31
          + Arrays.hashCode(Arrays.copyOf(locals, n)) * 7
          + Long.hashCode(constant);
    }
  }

  private static boolean allZero(long[] array) {
    for (long x : array) {
      if (x != 0) {
        return false;
      }
    }
    return true;
  }

  private final AffineExprContext context;
  private final int numDims;
  private final int numSymbols;
  private final LinearSum sum;
  private final List<Local> locals;

  private FlatAffineExpr(
      AffineExprContext context, int numDims, int numSymbols, LinearSum sum, List<Local> locals) {
    this.context = context;
    this.numDims = numDims;
    this.numSymbols = numSymbols;
    this.sum = sum;
    this.locals = locals;
  }

  /**
   * Flattens {@code expr}, which may reference dimensions below {@code numDims} and symbols below
   * {@code numSymbols}. Returns empty if the expression is semi-affine (multiplies by a symbol or
   * divides by a symbol or by a non-positive constant).
   */
  public static Optional<FlatAffineExpr> of(AffineExpr expr, int numDims, int numSymbols) {
    List<Local> locals = new ArrayList<>();
    LinearSum sum = new Flattener(numDims, numSymbols, locals).visit(expr);
    return (sum == null)
        ? Optional.empty()
        : Optional.of(new FlatAffineExpr(expr.context(), numDims, numSymbols, sum, locals));
  }

  /**
   * Returns a simplified equivalent of {@code expr}. Pure affine subexpressions are flattened and
   * rebuilt, which collects like terms and cancels those that sum to zero; semi-affine nodes are
   * kept, with their operands simplified.
   */
  public static AffineExpr simplify(AffineExpr expr, int numDims, int numSymbols) {
    if (!(expr instanceof Binary b)) {
      return expr;
    }
    Optional<FlatAffineExpr> flat = of(expr, numDims, numSymbols);
    if (flat.isPresent()) {
      return flat.get().toExpr();
    }
    AffineExpr lhs = simplify(b.lhs, numDims, numSymbols);
    AffineExpr rhs = simplify(b.rhs, numDims, numSymbols);
    return expr.context().binary(b.kind(), lhs, rhs);
  }

  /**
   * Returns the coefficient of an input; positions {@code 0..numDims-1} are dimensions and the
   * following {@code numSymbols} positions are symbols.
   */
  public long coefficient(int inputPosition) {
    return sum.inputs[inputPosition];
  }

  public long constantTerm() {
    return sum.constant;
  }

  public int numLocals() {
    return locals.size();
  }

  /** True if {@code inputPosition} appears in any local's dividend. */
  public boolean isUsedByLocal(int inputPosition) {
    for (Local local : locals) {
      if (local.dividend.inputs[inputPosition] != 0) {
        return true;
      }
    }
    return false;
  }

  /** Rebuilds an AffineExpr from this flattened form. */
  public AffineExpr toExpr() {
    List<AffineExpr> localExprs = new ArrayList<>();
    for (Local local : locals) {
      AffineExpr dividend = build(local.dividend, localExprs);
      AffineExpr divisor = context.constant(local.divisor);
      localExprs.add(
          local.ceil ? context.ceilDiv(dividend, divisor) : context.floorDiv(dividend, divisor));
    }
    return build(sum, localExprs);
  }

  /**
   * Builds the expression for a sum, recognizing {@code x - c * (x floordiv c)} as {@code x mod c}.
   */
  private AffineExpr build(LinearSum s, List<AffineExpr> localExprs) {
    AffineExpr result = null;
    LinearSum remaining = s;
    for (int i = 0; i < localExprs.size(); i++) {
      Local local = locals.get(i);
      if (local.ceil || remaining.local(i) != -local.divisor) {
        continue;
      }
      if (!containsTerms(remaining, local.dividend)) {
        continue;
      }
      AffineExpr dividend = build(local.dividend, localExprs);
      AffineExpr mod = context.mod(dividend, context.constant(local.divisor));
      result = (result == null) ? mod : context.add(result, mod);
      // remaining - (dividend - divisor * q)
      remaining = remaining.plus(local.dividend, -1);
      remaining.setLocal(i, 0);
    }
    for (int i = 0; i < numDims + numSymbols; i++) {
      long c = remaining.inputs[i];
      if (c != 0) {
        AffineExpr input = (i < numDims) ? context.dim(i) : context.symbol(i - numDims);
        result = addTerm(result, input, c);
      }
    }
    for (int i = 0; i < localExprs.size(); i++) {
      long c = remaining.local(i);
      if (c != 0) {
        result = addTerm(result, localExprs.get(i), c);
      }
    }
    if (result == null) {
      return context.constant(remaining.constant);
    }
    return context.add(result, context.constant(remaining.constant));
  }

  private AffineExpr addTerm(@Nullable AffineExpr result, AffineExpr term, long coefficient) {
    AffineExpr scaled = context.mul(term, context.constant(coefficient));
    return (result == null) ? scaled : context.add(result, scaled);
  }

  /**
   * True if every non-zero input or local term of {@code part} appears with the same coefficient in
   * {@code s}. Constant terms are ignored.
   */
  private static boolean containsTerms(LinearSum s, LinearSum part) {
    for (int i = 0; i < part.inputs.length; i++) {
      if (part.inputs[i] != 0 && s.inputs[i] != part.inputs[i]) {
        return false;
      }
    }
    for (int i = 0; i < part.locals.length; i++) {
      if (part.locals[i] != 0 && s.local(i) != part.locals[i]) {
        return false;
      }
    }
    return true;
  }

  /** Walks an expression, building its LinearSum and appending any locals it needs. */
  private static class Flattener {
    final int numDims;
    final int numInputs;
    final List<Local> locals;

    Flattener(int numDims, int numSymbols, List<Local> locals) {
      this.numDims = numDims;
      this.numInputs = numDims + numSymbols;
      this.locals = locals;
    }

    @Nullable LinearSum visit(AffineExpr expr) {
      if (expr instanceof Dim d) {
        Preconditions.checkArgument(d.position < numDims, "%s out of range", d);
        LinearSum result = new LinearSum(numInputs, 0);
        result.inputs[d.position] = 1;
        return result;
      } else if (expr instanceof Symbol s) {
        Preconditions.checkArgument(numDims + s.position < numInputs, "%s out of range", s);
        LinearSum result = new LinearSum(numInputs, 0);
        result.inputs[numDims + s.position] = 1;
        return result;
      } else if (expr instanceof Constant c) {
        LinearSum result = new LinearSum(numInputs, 0);
        result.constant = c.value;
        return result;
      }
      Binary b = (Binary) expr;
      LinearSum lhs = visit(b.lhs);
      LinearSum rhs = visit(b.rhs);
      if (lhs == null || rhs == null) {
        return null;
      }
      switch (b.kind()) {
        case ADD:
          return lhs.plus(rhs, 1);
        case MUL:
          if (rhs.isConstant()) {
            return lhs.scale(rhs.constant);
          } else if (lhs.isConstant()) {
            return rhs.scale(lhs.constant);
          }
          return null;
        default:
          break;
      }
      if (!rhs.isConstant() || rhs.constant < 1) {
        return null;
      }
      long divisor = rhs.constant;
      switch (b.kind()) {
        case FLOOR_DIV:
        case CEIL_DIV:
          {
            if (lhs.gcdWith(divisor) == divisor) {
              return lhs.divideExactly(divisor);
            }
            LinearSum result = new LinearSum(numInputs, 0);
            result.setLocal(addLocal(lhs, divisor, b.kind() == AffineExpr.Kind.CEIL_DIV), 1);
            return result;
          }
        case MOD:
          {
            if (lhs.gcdWith(divisor) == divisor) {
              return new LinearSum(numInputs, 0);
            }
            LinearSum q = new LinearSum(numInputs, 0);
            q.setLocal(addLocal(lhs, divisor, false), 1);
            return lhs.plus(q, -divisor);
          }
        default:
          throw new AssertionError();
      }
    }

    /**
     * Returns the index of the local for {@code dividend / divisor}, after dividing both by their
     * common factor; reuses an existing local if there is one.
     */
    int addLocal(LinearSum dividend, long divisor, boolean ceil) {
      long g = dividend.gcdWith(divisor);
      if (g > 1) {
        dividend = dividend.divideExactly(g);
        divisor /= g;
      }
      Local local = new Local(dividend, divisor, ceil);
      int index = locals.indexOf(local);
      if (index < 0) {
        index = locals.size();
        locals.add(local);
      }
      return index;
    }
  }
}
