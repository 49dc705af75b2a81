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

import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.affineir.util.MathUtil;
import org.jspecify.annotations.Nullable;

/**
 * An AffineExpr is a node in an immutable expression tree over dimension identifiers ({@code d0,
 * d1, ...}), symbol identifiers ({@code s0, s1, ...}) and integer constants. There are four
 * subclasses:
 *
 * <ul>
 *   <li>{@link Dim}: a reference to a dimension position
 *   <li>{@link Symbol}: a reference to a symbol position
 *   <li>{@link Constant}: an integer literal
 *   <li>{@link Binary}: one of add, mul, floordiv, ceildiv or mod applied to two subexpressions
 * </ul>
 *
 * <p>AffineExprs are only created by an {@link AffineExprContext}, which interns them: two
 * structurally identical expressions from the same context are the same object, so AffineExpr
 * does not override {@code equals()} and identity comparison is the intended test.
 *
 * <p>Multiplication requires at least one side to be free of dimensions, and the right-hand side
 * of a division or modulo must be free of dimensions. Expressions that use a symbol as a
 * coefficient or divisor are "semi-affine"; see {@link #isPureAffine}.
 */
public abstract class AffineExpr {

  /** The kinds of AffineExpr. The first five are the binary operations. */
  public enum Kind {
    ADD("+"),
    MUL("*"),
    MOD("mod"),
    FLOOR_DIV("floordiv"),
    CEIL_DIV("ceildiv"),
    CONSTANT(null),
    DIM(null),
    SYMBOL(null);

    /** For binary kinds, the operator as it is printed; otherwise null. */
    final String spelling;

    Kind(String spelling) {
      this.spelling = spelling;
    }

    public boolean isBinary() {
      return spelling != null;
    }
  }

  final AffineExprContext context;

  /** Only the nested subclasses may extend AffineExpr. */
  private AffineExpr(AffineExprContext context) {
    this.context = context;
  }

  public abstract Kind kind();

  /** The context that interned this expression. */
  public final AffineExprContext context() {
    return context;
  }

  /** True if this expression does not reference any dimension. */
  public abstract boolean isSymbolicOrConstant();

  /**
   * True if this expression is affine in the strict sense: every multiplication has a constant
   * operand and every division or modulo has a constant right-hand side.
   */
  public abstract boolean isPureAffine();

  /** True if the expression references dimension {@code position}. */
  public abstract boolean isFunctionOfDim(int position);

  /** True if the expression references symbol {@code position}. */
  public abstract boolean isFunctionOfSymbol(int position);

  /**
   * Returns the largest integer that is known to divide the value of this expression for all
   * values of its dimensions and symbols.
   */
  public abstract long largestKnownDivisor();

  /** Calls {@code visitor} with every node of this expression, children before parents. */
  public abstract void walk(Consumer<AffineExpr> visitor);

  /**
   * Returns the result of rebuilding this expression bottom-up, calling {@code leafFn} on each
   * dimension and symbol. Binary nodes are recreated through the context, so the result is
   * simplified just as if it had been built directly.
   */
  abstract AffineExpr rebuild(UnaryOperator<AffineExpr> leafFn);

  /**
   * Evaluates this expression with the given dimension and symbol values. Returns empty if a
   * division or modulo has a non-positive divisor.
   */
  public abstract OptionalLong evaluate(long[] dimValues, long[] symbolValues);

  /** True if {@code factor} is known to divide this expression. */
  public final boolean isMultipleOf(long factor) {
    long divisor = largestKnownDivisor();
    return factor != 0 && (divisor == 0 || divisor % factor == 0);
  }

  /**
   * Returns this expression with each {@code d<i>} replaced by {@code dimReplacements[i]} and each
   * {@code s<j>} replaced by {@code symbolReplacements[j]}. Positions beyond the end of either
   * array are left unchanged; a null entry must not be referenced.
   */
  public final AffineExpr replaceDimsAndSymbols(
      @Nullable AffineExpr[] dimReplacements, @Nullable AffineExpr[] symbolReplacements) {
    return rebuild(
        leaf -> {
          @Nullable AffineExpr replacement = null;
          if (leaf instanceof Dim d) {
            if (d.position >= dimReplacements.length) {
              return leaf;
            }
            replacement = dimReplacements[d.position];
          } else if (leaf instanceof Symbol s) {
            if (s.position >= symbolReplacements.length) {
              return leaf;
            }
            replacement = symbolReplacements[s.position];
          }
          if (replacement == null) {
            throw new IllegalStateException("no replacement for referenced " + leaf);
          }
          return replacement;
        });
  }

  /** Returns this expression with each occurrence of {@code expr} replaced by {@code repl}. */
  public final AffineExpr replace(AffineExpr expr, AffineExpr replacement) {
    if (this == expr) {
      return replacement;
    } else if (this instanceof Binary b) {
      AffineExpr lhs = b.lhs.replace(expr, replacement);
      AffineExpr rhs = b.rhs.replace(expr, replacement);
      return (lhs == b.lhs && rhs == b.rhs) ? this : context.binary(b.kind, lhs, rhs);
    } else {
      return this;
    }
  }

  /** Returns this expression with every dimension position increased by {@code shift}. */
  public final AffineExpr shiftDims(int shift) {
    return rebuild(leaf -> (leaf instanceof Dim d) ? context.dim(d.position + shift) : leaf);
  }

  /** Returns this expression with every symbol position increased by {@code shift}. */
  public final AffineExpr shiftSymbols(int shift) {
    return rebuild(leaf -> (leaf instanceof Symbol s) ? context.symbol(s.position + shift) : leaf);
  }

  public final AffineExpr plus(AffineExpr other) {
    return context.add(this, other);
  }

  public final AffineExpr plus(long value) {
    return context.add(this, context.constant(value));
  }

  public final AffineExpr minus(AffineExpr other) {
    return context.add(this, context.mul(other, context.constant(-1)));
  }

  public final AffineExpr times(AffineExpr other) {
    return context.mul(this, other);
  }

  public final AffineExpr times(long value) {
    return context.mul(this, context.constant(value));
  }

  public final AffineExpr floorDiv(AffineExpr other) {
    return context.floorDiv(this, other);
  }

  public final AffineExpr floorDiv(long value) {
    return context.floorDiv(this, context.constant(value));
  }

  public final AffineExpr ceilDiv(AffineExpr other) {
    return context.ceilDiv(this, other);
  }

  public final AffineExpr ceilDiv(long value) {
    return context.ceilDiv(this, context.constant(value));
  }

  public final AffineExpr mod(AffineExpr other) {
    return context.mod(this, other);
  }

  public final AffineExpr mod(long value) {
    return context.mod(this, context.constant(value));
  }

  /** Returns the value of this expression if it is a {@link Constant}. */
  public final OptionalLong constantValue() {
    return (this instanceof Constant c) ? OptionalLong.of(c.value) : OptionalLong.empty();
  }

  /** How tightly the surrounding expression binds when printing. */
  private enum Binding {
    WEAK,
    STRONG
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    print(sb, Binding.WEAK);
    return sb.toString();
  }

  private void print(StringBuilder sb, Binding enclosing) {
    if (!(this instanceof Binary b)) {
      sb.append(leafString());
      return;
    }
    if (b.kind != Kind.ADD) {
      if (enclosing == Binding.STRONG) {
        sb.append('(');
      }
      if (b.kind == Kind.MUL && b.rhs instanceof Constant c && c.value == -1) {
        sb.append('-');
        b.lhs.print(sb, Binding.STRONG);
      } else {
        b.lhs.print(sb, Binding.STRONG);
        sb.append(' ').append(b.kind.spelling).append(' ');
        b.rhs.print(sb, Binding.STRONG);
      }
      if (enclosing == Binding.STRONG) {
        sb.append(')');
      }
      return;
    }
    if (enclosing == Binding.STRONG) {
      sb.append('(');
    }
    b.lhs.print(sb, Binding.WEAK);
    if (b.rhs instanceof Constant c && c.value < 0) {
      sb.append(" - ").append(-c.value);
    } else if (b.rhs instanceof Binary mul
        && mul.kind == Kind.MUL
        && mul.rhs instanceof Constant c
        && c.value < 0) {
      sb.append(" - ");
      mul.lhs.print(sb, Binding.STRONG);
      if (c.value != -1) {
        sb.append(" * ").append(-c.value);
      }
    } else {
      sb.append(" + ");
      b.rhs.print(sb, Binding.WEAK);
    }
    if (enclosing == Binding.STRONG) {
      sb.append(')');
    }
  }

  /** Only called on non-binary expressions. */
  abstract String leafString();

  /** A reference to dimension {@code d<position>}. */
  public static final class Dim extends AffineExpr {
    public final int position;

    Dim(AffineExprContext context, int position) {
      super(context);
      this.position = position;
    }

    @Override
    public Kind kind() {
      return Kind.DIM;
    }

    @Override
    public boolean isSymbolicOrConstant() {
      return false;
    }

    @Override
    public boolean isPureAffine() {
      return true;
    }

    @Override
    public boolean isFunctionOfDim(int position) {
      return this.position == position;
    }

    @Override
    public boolean isFunctionOfSymbol(int position) {
      return false;
    }

    @Override
    public long largestKnownDivisor() {
      return 1;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
      visitor.accept(this);
    }

    @Override
    AffineExpr rebuild(UnaryOperator<AffineExpr> leafFn) {
      return leafFn.apply(this);
    }

    @Override
    public OptionalLong evaluate(long[] dimValues, long[] symbolValues) {
      return OptionalLong.of(dimValues[position]);
    }

    @Override
    String leafString() {
      return "d" + position;
    }
  }

  /** A reference to symbol {@code s<position>}. */
  public static final class Symbol extends AffineExpr {
    public final int position;

    Symbol(AffineExprContext context, int position) {
      super(context);
      this.position = position;
    }

    @Override
    public Kind kind() {
      return Kind.SYMBOL;
    }

    @Override
    public boolean isSymbolicOrConstant() {
      return true;
    }

    @Override
    public boolean isPureAffine() {
      return true;
    }

    @Override
    public boolean isFunctionOfDim(int position) {
      return false;
    }

    @Override
    public boolean isFunctionOfSymbol(int position) {
      return this.position == position;
    }

    @Override
    public long largestKnownDivisor() {
      return 1;
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
      visitor.accept(this);
    }

    @Override
    AffineExpr rebuild(UnaryOperator<AffineExpr> leafFn) {
      return leafFn.apply(this);
    }

    @Override
    public OptionalLong evaluate(long[] dimValues, long[] symbolValues) {
      return OptionalLong.of(symbolValues[position]);
    }

    @Override
    String leafString() {
      return "s" + position;
    }
  }

  /** An integer literal. */
  public static final class Constant extends AffineExpr {
    public final long value;

    Constant(AffineExprContext context, long value) {
      super(context);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.CONSTANT;
    }

    @Override
    public boolean isSymbolicOrConstant() {
      return true;
    }

    @Override
    public boolean isPureAffine() {
      return true;
    }

    @Override
    public boolean isFunctionOfDim(int position) {
      return false;
    }

    @Override
    public boolean isFunctionOfSymbol(int position) {
      return false;
    }

    @Override
    public long largestKnownDivisor() {
      // 2^63 is not representable; its largest representable divisor is 2^62
      return (value == Long.MIN_VALUE) ? 1L << 62 : Math.abs(value);
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
      visitor.accept(this);
    }

    @Override
    AffineExpr rebuild(UnaryOperator<AffineExpr> leafFn) {
      return this;
    }

    @Override
    public OptionalLong evaluate(long[] dimValues, long[] symbolValues) {
      return OptionalLong.of(value);
    }

    @Override
    String leafString() {
      return String.valueOf(value);
    }
  }

  /** One of the binary operations; {@link #kind} is never a leaf kind. */
  public static final class Binary extends AffineExpr {
    final Kind kind;
    public final AffineExpr lhs;
    public final AffineExpr rhs;

    Binary(AffineExprContext context, Kind kind, AffineExpr lhs, AffineExpr rhs) {
      super(context);
      assert kind.isBinary();
      this.kind = kind;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public boolean isSymbolicOrConstant() {
      return lhs.isSymbolicOrConstant() && rhs.isSymbolicOrConstant();
    }

    @Override
    public boolean isPureAffine() {
      return switch (kind) {
        case ADD -> lhs.isPureAffine() && rhs.isPureAffine();
        case MUL ->
            lhs.isPureAffine()
                && rhs.isPureAffine()
                && (lhs instanceof Constant || rhs instanceof Constant);
        case MOD, FLOOR_DIV, CEIL_DIV -> lhs.isPureAffine() && rhs instanceof Constant;
        default -> throw new AssertionError();
      };
    }

    @Override
    public boolean isFunctionOfDim(int position) {
      return lhs.isFunctionOfDim(position) || rhs.isFunctionOfDim(position);
    }

    @Override
    public boolean isFunctionOfSymbol(int position) {
      return lhs.isFunctionOfSymbol(position) || rhs.isFunctionOfSymbol(position);
    }

    @Override
    public long largestKnownDivisor() {
      long lhsDivisor = lhs.largestKnownDivisor();
      long rhsDivisor = rhs.largestKnownDivisor();
      switch (kind) {
        case ADD:
          return MathUtil.gcd(lhsDivisor, rhsDivisor);
        case MUL:
          return lhsDivisor * rhsDivisor;
        case MOD:
          return (rhs instanceof Constant) ? MathUtil.gcd(lhsDivisor, rhsDivisor) : 1;
        case FLOOR_DIV:
        case CEIL_DIV:
          // (k * x) div c is a multiple of k / c only when c divides k
          if (rhs instanceof Constant c && c.value > 0 && lhsDivisor % c.value == 0) {
            return (lhsDivisor == 0) ? 0 : lhsDivisor / c.value;
          }
          return 1;
        default:
          throw new AssertionError();
      }
    }

    @Override
    public void walk(Consumer<AffineExpr> visitor) {
      lhs.walk(visitor);
      rhs.walk(visitor);
      visitor.accept(this);
    }

    @Override
    AffineExpr rebuild(UnaryOperator<AffineExpr> leafFn) {
      AffineExpr newLhs = lhs.rebuild(leafFn);
      AffineExpr newRhs = rhs.rebuild(leafFn);
      return (newLhs == lhs && newRhs == rhs) ? this : context.binary(kind, newLhs, newRhs);
    }

    @Override
    public OptionalLong evaluate(long[] dimValues, long[] symbolValues) {
      OptionalLong l = lhs.evaluate(dimValues, symbolValues);
      OptionalLong r = rhs.evaluate(dimValues, symbolValues);
      if (l.isEmpty() || r.isEmpty()) {
        return OptionalLong.empty();
      }
      long x = l.getAsLong();
      long y = r.getAsLong();
      switch (kind) {
        case ADD:
          return OptionalLong.of(x + y);
        case MUL:
          return OptionalLong.of(x * y);
        default:
          break;
      }
      if (y < 1) {
        return OptionalLong.empty();
      }
      return switch (kind) {
        case MOD -> OptionalLong.of(MathUtil.mod(x, y));
        case FLOOR_DIV -> OptionalLong.of(MathUtil.floorDiv(x, y));
        case CEIL_DIV -> OptionalLong.of(MathUtil.ceilDiv(x, y));
        default -> throw new AssertionError();
      };
    }

    @Override
    String leafString() {
      throw new AssertionError();
    }
  }
}
