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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.affineir.expr.AffineExpr.Binary;
import org.affineir.expr.AffineExpr.Constant;
import org.affineir.expr.AffineExpr.Dim;
import org.affineir.expr.AffineExpr.Kind;
import org.affineir.expr.AffineExpr.Symbol;
import org.affineir.util.MathUtil;

/**
 * An AffineExprContext creates and interns AffineExprs. Every request for an expression that is
 * structurally equal to one previously returned by the same context returns the previous object.
 *
 * <p>The binary factories ({@link #add}, {@link #mul}, {@link #floorDiv}, {@link #ceilDiv} and
 * {@link #mod}) apply local simplifications before interning: constant operands are folded,
 * identities such as {@code x + 0} and {@code x * 1} are removed, and constants are moved to the
 * right-hand side of commutative operations.
 *
 * <p>AffineExprContext is not thread-safe.
 */
public class AffineExprContext {

  private final List<Dim> dims = new ArrayList<>();
  private final List<Symbol> symbols = new ArrayList<>();
  private final Map<Long, Constant> constants = new HashMap<>();
  private final Map<BinaryKey, Binary> binaries = new HashMap<>();

  /**
   * Binary nodes are keyed by their operands' identities; since the operands are themselves
   * interned, identity is structural equality.
   */
  private record BinaryKey(Kind kind, AffineExpr lhs, AffineExpr rhs) {}

  public Dim dim(int position) {
    Preconditions.checkArgument(position >= 0, "negative dimension position %s", position);
    while (dims.size() <= position) {
      dims.add(new Dim(this, dims.size()));
    }
    return dims.get(position);
  }

  public Symbol symbol(int position) {
    Preconditions.checkArgument(position >= 0, "negative symbol position %s", position);
    while (symbols.size() <= position) {
      symbols.add(new Symbol(this, symbols.size()));
    }
    return symbols.get(position);
  }

  public Constant constant(long value) {
    return constants.computeIfAbsent(value, v -> new Constant(this, v));
  }

  /** The number of distinct binary expressions this context has interned. */
  public int numInternedBinaries() {
    return binaries.size();
  }

  /** Dispatches to the factory for the given binary kind. */
  public AffineExpr binary(Kind kind, AffineExpr lhs, AffineExpr rhs) {
    return switch (kind) {
      case ADD -> add(lhs, rhs);
      case MUL -> mul(lhs, rhs);
      case MOD -> mod(lhs, rhs);
      case FLOOR_DIV -> floorDiv(lhs, rhs);
      case CEIL_DIV -> ceilDiv(lhs, rhs);
      default -> throw new IllegalArgumentException(kind + " is not a binary kind");
    };
  }

  private Binary intern(Kind kind, AffineExpr lhs, AffineExpr rhs) {
    checkOwned(lhs);
    checkOwned(rhs);
    return binaries.computeIfAbsent(
        new BinaryKey(kind, lhs, rhs), k -> new Binary(this, k.kind(), k.lhs(), k.rhs()));
  }

  private void checkOwned(AffineExpr expr) {
    Preconditions.checkArgument(expr.context == this, "%s belongs to another context", expr);
  }

  public AffineExpr add(AffineExpr lhs, AffineExpr rhs) {
    if (lhs instanceof Constant l && rhs instanceof Constant r) {
      return constant(l.value + r.value);
    }
    // Keep constants on the right
    if (lhs instanceof Constant) {
      AffineExpr tmp = lhs;
      lhs = rhs;
      rhs = tmp;
    }
    if (rhs instanceof Constant r) {
      if (r.value == 0) {
        return lhs;
      }
      // (x + c1) + c2 => x + (c1 + c2)
      if (lhs instanceof Binary lb && lb.kind == Kind.ADD && lb.rhs instanceof Constant c1) {
        return add(lb.lhs, constant(c1.value + r.value));
      }
      return intern(Kind.ADD, lhs, rhs);
    }
    // (x + c) + y => (x + y) + c
    if (lhs instanceof Binary lb && lb.kind == Kind.ADD && lb.rhs instanceof Constant) {
      return add(add(lb.lhs, rhs), lb.rhs);
    }
    // x + (y + c) => (x + y) + c
    if (rhs instanceof Binary rb && rb.kind == Kind.ADD && rb.rhs instanceof Constant) {
      return add(add(lhs, rb.lhs), rb.rhs);
    }
    // x + (x floordiv c) * -c => x mod c
    if (rhs instanceof Binary rb
        && rb.kind == Kind.MUL
        && rb.lhs instanceof Binary q
        && q.kind == Kind.FLOOR_DIV
        && q.lhs == lhs
        && q.rhs instanceof Constant c
        && rb.rhs instanceof Constant k
        && k.value == -c.value) {
      return mod(lhs, q.rhs);
    }
    return intern(Kind.ADD, lhs, rhs);
  }

  /**
   * Returns {@code lhs * rhs}. At least one operand must be free of dimensions; a product of two
   * dimension-dependent expressions is not affine.
   */
  public AffineExpr mul(AffineExpr lhs, AffineExpr rhs) {
    if (lhs instanceof Constant l && rhs instanceof Constant r) {
      return constant(l.value * r.value);
    }
    Preconditions.checkArgument(
        lhs.isSymbolicOrConstant() || rhs.isSymbolicOrConstant(),
        "product of dimension-dependent expressions %s and %s is not affine",
        lhs,
        rhs);
    // Keep the constant (or failing that, the symbolic) factor on the right
    if (lhs instanceof Constant || (lhs.isSymbolicOrConstant() && !rhs.isSymbolicOrConstant())) {
      AffineExpr tmp = lhs;
      lhs = rhs;
      rhs = tmp;
    }
    if (rhs instanceof Constant r) {
      if (r.value == 1) {
        return lhs;
      } else if (r.value == 0) {
        return rhs;
      }
      // (x * c1) * c2 => x * (c1 * c2)
      if (lhs instanceof Binary lb && lb.kind == Kind.MUL && lb.rhs instanceof Constant c1) {
        return mul(lb.lhs, constant(c1.value * r.value));
      }
    }
    return intern(Kind.MUL, lhs, rhs);
  }

  /**
   * Returns {@code lhs floordiv rhs}. The divisor must be free of dimensions; a constant divisor
   * less than one is accepted but never simplified.
   */
  public AffineExpr floorDiv(AffineExpr lhs, AffineExpr rhs) {
    checkDivisor(lhs, rhs, "floordiv");
    if (rhs instanceof Constant r && r.value >= 1) {
      if (lhs instanceof Constant l) {
        return constant(MathUtil.floorDiv(l.value, r.value));
      } else if (r.value == 1) {
        return lhs;
      }
      // (x * c1) floordiv c2 => x * (c1 / c2) when c2 divides c1
      if (lhs instanceof Binary lb
          && lb.kind == Kind.MUL
          && lb.rhs instanceof Constant c1
          && c1.value % r.value == 0) {
        return mul(lb.lhs, constant(c1.value / r.value));
      }
      // (x floordiv c1) floordiv c2 => x floordiv (c1 * c2)
      if (lhs instanceof Binary lb
          && lb.kind == Kind.FLOOR_DIV
          && lb.rhs instanceof Constant c1
          && c1.value >= 1) {
        return floorDiv(lb.lhs, constant(c1.value * r.value));
      }
    }
    return intern(Kind.FLOOR_DIV, lhs, rhs);
  }

  /** Returns {@code lhs ceildiv rhs}, with the same restrictions as {@link #floorDiv}. */
  public AffineExpr ceilDiv(AffineExpr lhs, AffineExpr rhs) {
    checkDivisor(lhs, rhs, "ceildiv");
    if (rhs instanceof Constant r && r.value >= 1) {
      if (lhs instanceof Constant l) {
        return constant(MathUtil.ceilDiv(l.value, r.value));
      } else if (r.value == 1) {
        return lhs;
      }
      if (lhs instanceof Binary lb
          && lb.kind == Kind.MUL
          && lb.rhs instanceof Constant c1
          && c1.value % r.value == 0) {
        return mul(lb.lhs, constant(c1.value / r.value));
      }
    }
    return intern(Kind.CEIL_DIV, lhs, rhs);
  }

  /** Returns {@code lhs mod rhs}, with the same restrictions as {@link #floorDiv}. */
  public AffineExpr mod(AffineExpr lhs, AffineExpr rhs) {
    checkDivisor(lhs, rhs, "mod");
    if (rhs instanceof Constant r && r.value >= 1) {
      if (lhs instanceof Constant l) {
        return constant(MathUtil.mod(l.value, r.value));
      } else if (r.value == 1 || lhs.isMultipleOf(r.value)) {
        return constant(0);
      }
      // (x mod c1) mod c2 => x mod c2 when c2 divides c1
      if (lhs instanceof Binary lb
          && lb.kind == Kind.MOD
          && lb.rhs instanceof Constant c1
          && c1.value % r.value == 0) {
        return mod(lb.lhs, rhs);
      }
    }
    return intern(Kind.MOD, lhs, rhs);
  }

  private static void checkDivisor(AffineExpr lhs, AffineExpr rhs, String op) {
    Preconditions.checkArgument(
        rhs.isSymbolicOrConstant(),
        "%s %s %s is not affine: the divisor depends on a dimension",
        lhs,
        op,
        rhs);
  }
}
