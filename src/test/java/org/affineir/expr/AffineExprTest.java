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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.affineir.expr.AffineExpr.Kind;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AffineExprTest {

  private AffineExprContext ctx;
  private AffineExpr d0;
  private AffineExpr d1;
  private AffineExpr s0;

  @Before
  public void setup() {
    ctx = new AffineExprContext();
    d0 = ctx.dim(0);
    d1 = ctx.dim(1);
    s0 = ctx.symbol(0);
  }

  @Test
  public void interning() {
    assertThat(ctx.dim(0)).isSameInstanceAs(d0);
    assertThat(ctx.constant(7)).isSameInstanceAs(ctx.constant(7));
    assertThat(d0.plus(s0)).isSameInstanceAs(d0.plus(s0));
    assertThat(d0.plus(s0)).isNotSameInstanceAs(s0.plus(d0));
  }

  @Test
  public void constantFolding() {
    assertThat(ctx.constant(3).plus(4)).isSameInstanceAs(ctx.constant(7));
    assertThat(ctx.constant(-7).floorDiv(2)).isSameInstanceAs(ctx.constant(-4));
    assertThat(ctx.constant(-7).ceilDiv(2)).isSameInstanceAs(ctx.constant(-3));
    assertThat(ctx.constant(-7).mod(2)).isSameInstanceAs(ctx.constant(1));
  }

  @Test
  public void addSimplifications() {
    assertThat(d0.plus(0)).isSameInstanceAs(d0);
    assertThat(ctx.constant(2).plus(d0)).isSameInstanceAs(d0.plus(2));
    assertThat(d0.plus(1).plus(2)).isSameInstanceAs(d0.plus(3));
    assertThat(d0.plus(1).plus(s0)).isSameInstanceAs(d0.plus(s0).plus(1));
    assertThat(d0.plus(d0.floorDiv(4).times(-4))).isSameInstanceAs(d0.mod(4));
  }

  @Test
  public void mulSimplifications() {
    assertThat(d0.times(1)).isSameInstanceAs(d0);
    assertThat(d0.times(0)).isSameInstanceAs(ctx.constant(0));
    assertThat(d0.times(2).times(3)).isSameInstanceAs(d0.times(6));
    assertThat(ctx.constant(2).times(d0)).isSameInstanceAs(d0.times(2));
  }

  @Test
  public void divisionSimplifications() {
    assertThat(d0.floorDiv(1)).isSameInstanceAs(d0);
    assertThat(d0.times(4).floorDiv(4)).isSameInstanceAs(d0);
    assertThat(d0.times(8).ceilDiv(2)).isSameInstanceAs(d0.times(4));
    assertThat(d0.floorDiv(2).floorDiv(3)).isSameInstanceAs(d0.floorDiv(6));
    assertThat(d0.times(4).mod(4)).isSameInstanceAs(ctx.constant(0));
    assertThat(d0.mod(6).mod(3)).isSameInstanceAs(d0.mod(3));
  }

  @Test
  public void semiAffineExpressions() {
    AffineExpr product = d0.times(s0);
    assertThat(product.kind()).isEqualTo(Kind.MUL);
    assertThat(product.isPureAffine()).isFalse();
    assertThat(d0.floorDiv(s0).isPureAffine()).isFalse();
    assertThat(d0.times(3).plus(s0).isPureAffine()).isTrue();
  }

  @Test
  public void nonAffineExpressionsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> d0.times(d1));
    assertThrows(IllegalArgumentException.class, () -> s0.floorDiv(d0));
    assertThrows(IllegalArgumentException.class, () -> s0.mod(d0.plus(1)));
  }

  @Test
  public void nonPositiveDivisorIsKept() {
    AffineExpr e = d0.floorDiv(0);
    assertThat(e.kind()).isEqualTo(Kind.FLOOR_DIV);
    assertThat(e.evaluate(new long[] {5}, new long[0]).isPresent()).isFalse();
    assertThat(d0.mod(-2).evaluate(new long[] {5}, new long[0]).isPresent()).isFalse();
  }

  @Test
  public void printing() {
    assertThat(d0.plus(2).toString()).isEqualTo("d0 + 2");
    assertThat(d0.plus(-3).toString()).isEqualTo("d0 - 3");
    assertThat(d0.minus(s0).toString()).isEqualTo("d0 - s0");
    assertThat(d0.plus(1).times(2).toString()).isEqualTo("(d0 + 1) * 2");
    assertThat(d0.floorDiv(2).plus(1).toString()).isEqualTo("d0 floordiv 2 + 1");
    assertThat(d0.times(-1).toString()).isEqualTo("-d0");
    assertThat(d0.plus(s0.times(-4)).toString()).isEqualTo("d0 - s0 * 4");
  }

  @Test
  public void evaluate() {
    AffineExpr e = d0.times(3).plus(s0).mod(5);
    assertThat(e.evaluate(new long[] {4}, new long[] {2}).getAsLong()).isEqualTo(4);
    assertThat(d0.ceilDiv(s0).evaluate(new long[] {7}, new long[] {2}).getAsLong())
        .isEqualTo(4);
    assertThat(d0.floorDiv(s0).evaluate(new long[] {7}, new long[] {0}).isPresent()).isFalse();
  }

  @Test
  public void largestKnownDivisor() {
    assertThat(d0.largestKnownDivisor()).isEqualTo(1);
    assertThat(ctx.constant(-12).largestKnownDivisor()).isEqualTo(12);
    assertThat(d0.times(6).plus(s0.times(4)).largestKnownDivisor()).isEqualTo(2);
    assertThat(d0.times(4).plus(s0.times(8)).floorDiv(2).largestKnownDivisor()).isEqualTo(2);
    assertThat(d0.times(4).plus(s0.times(8)).floorDiv(3).largestKnownDivisor()).isEqualTo(1);
    assertThat(d0.times(6).mod(4).largestKnownDivisor()).isEqualTo(2);
    assertThat(d0.times(6).isMultipleOf(3)).isTrue();
  }

  @Test
  public void largestKnownDivisorOfMinValue() {
    assertThat(ctx.constant(Long.MIN_VALUE).largestKnownDivisor()).isEqualTo(1L << 62);
    assertThat(d0.plus(Long.MIN_VALUE).largestKnownDivisor()).isEqualTo(1);
    assertThat(d0.times(4).plus(Long.MIN_VALUE).largestKnownDivisor()).isEqualTo(4);
  }

  @Test
  public void functionOfInputs() {
    AffineExpr e = d1.plus(s0.times(2));
    assertThat(e.isFunctionOfDim(0)).isFalse();
    assertThat(e.isFunctionOfDim(1)).isTrue();
    assertThat(e.isFunctionOfSymbol(0)).isTrue();
    assertThat(e.isSymbolicOrConstant()).isFalse();
    assertThat(s0.plus(3).isSymbolicOrConstant()).isTrue();
  }

  @Test
  public void replacement() {
    AffineExpr e = d0.plus(s0);
    AffineExpr replaced = e.replace(s0, ctx.constant(3));
    assertThat(replaced).isSameInstanceAs(d0.plus(3));
    assertThat(e.shiftDims(2)).isSameInstanceAs(ctx.dim(2).plus(s0));
    assertThat(e.shiftSymbols(1)).isSameInstanceAs(d0.plus(ctx.symbol(1)));
  }
}
