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

import static com.google.common.truth.Truth.assertThat;
import static org.affineir.affine.IrTestUtil.atEnd;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.affineir.affine.AffineComposer.WithOperands;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.expr.IntegerSet;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Type;
import org.affineir.ir.Value;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AffineComposerTest {

  private AffineExprContext exprs;
  private AffineExpr d0;
  private AffineExpr d1;
  private AffineExpr s0;
  private Value m;
  private Value iv;
  private Value jv;
  private OpBuilder inner;

  @Before
  public void setup() {
    IrContext ctx = new IrContext();
    exprs = ctx.exprs();
    d0 = exprs.dim(0);
    d1 = exprs.dim(1);
    s0 = exprs.symbol(0);
    FuncOp func = FuncOp.create(ctx, "f", Type.INDEX);
    m = func.argument(0);
    ForOp outer = ForOp.create(atEnd(func), 0, 10, 1);
    ForOp nested = ForOp.create(OpBuilder.before(outer.body().terminator()), 0, 10, 1);
    iv = outer.inductionVar();
    jv = nested.inductionVar();
    inner = OpBuilder.before(nested.body().terminator());
  }

  @Test
  public void validSymbolsArePromoted() {
    WithOperands<AffineMap> result =
        AffineComposer.canonicalizeMapAndOperands(
            AffineMap.get(exprs, 2, 0, d0.plus(d1)), List.of(iv, m));
    assertThat(result.structure().toString()).isEqualTo("(d0)[s0] -> (d0 + s0)");
    assertThat(result.operands()).containsExactly(iv, m).inOrder();
  }

  @Test
  public void constantSymbolsAreFolded() {
    Value seven = ConstantOp.create(inner, 7).result();
    WithOperands<AffineMap> result =
        AffineComposer.canonicalizeMapAndOperands(
            AffineMap.get(exprs, 1, 1, d0.plus(s0)), List.of(iv, seven));
    assertThat(result.structure().toString()).isEqualTo("(d0) -> (d0 + 7)");
    assertThat(result.operands()).containsExactly(iv);
  }

  @Test
  public void constantDimsArePromotedThenFolded() {
    Value three = ConstantOp.create(inner, 3).result();
    WithOperands<AffineMap> result =
        AffineComposer.canonicalizeMapAndOperands(
            AffineMap.get(exprs, 1, 0, d0.times(2)), List.of(three));
    assertThat(result.structure().toString()).isEqualTo("() -> (6)");
    assertThat(result.operands()).isEmpty();
  }

  @Test
  public void unusedInputsArePruned() {
    WithOperands<AffineMap> result =
        AffineComposer.canonicalizeMapAndOperands(
            AffineMap.get(exprs, 2, 1, d1), List.of(iv, jv, m));
    assertThat(result.structure().toString()).isEqualTo("(d0) -> (d0)");
    assertThat(result.operands()).containsExactly(jv);
  }

  @Test
  public void duplicateOperandsAreMerged() {
    WithOperands<AffineMap> result =
        AffineComposer.compose(AffineMap.get(exprs, 2, 0, d0.plus(d1)), List.of(iv, iv));
    assertThat(result.structure().toString()).isEqualTo("(d0) -> (d0 * 2)");
    assertThat(result.operands()).containsExactly(iv);
  }

  @Test
  public void canonicalizeIsIdempotent() {
    Value seven = ConstantOp.create(inner, 7).result();
    WithOperands<AffineMap> once =
        AffineComposer.canonicalizeMapAndOperands(
            AffineMap.get(exprs, 3, 1, d0.plus(d1).plus(exprs.dim(2)), s0),
            List.of(jv, m, iv, seven));
    assertThat(AffineComposer.canonicalize(once)).isEqualTo(once);
  }

  @Test
  public void setsAreCanonicalizedToo() {
    IntegerSet set = IntegerSet.get(exprs, 2, 0, List.of(d0.minus(d1)), false);
    WithOperands<IntegerSet> result =
        AffineComposer.canonicalizeSetAndOperands(set, List.of(iv, m));
    assertThat(result.structure().toString()).isEqualTo("(d0)[s0] : (d0 - s0 >= 0)");
    assertThat(result.operands()).containsExactly(iv, m).inOrder();
  }

  @Test
  public void arityMismatchIsRejected() {
    AffineMap map = AffineMap.identity(exprs, 2);
    assertThrows(IllegalArgumentException.class, () -> WithOperands.of(map, List.of(iv)));
    assertThrows(IllegalArgumentException.class, () -> AffineComposer.compose(map, List.of(iv)));
  }

  @Test
  public void composeThroughChainOfApplies() {
    Value plusOne = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(1)), iv).result();
    Value doubled =
        ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.times(2)), plusOne).result();
    WithOperands<AffineMap> result =
        AffineComposer.compose(AffineMap.identity(exprs, 1), List.of(doubled));
    assertThat(result.structure().toString()).isEqualTo("(d0) -> (d0 * 2 + 2)");
    assertThat(result.operands()).containsExactly(iv);
    assertThat(AffineComposer.hasApplyOperand(result.operands())).isFalse();
  }

  @Test
  public void applyBoundToSymbolIsSplicedAsSymbols() {
    Value plusOne = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(1)), m).result();
    WithOperands<AffineMap> result =
        AffineComposer.compose(AffineMap.get(exprs, 0, 1, s0.times(3)), List.of(plusOne));
    assertThat(result.structure().toString()).isEqualTo("()[s0] -> (s0 * 3 + 3)");
    assertThat(result.operands()).containsExactly(m);
  }

  @Test
  public void composeCancelsTerms() {
    Value shifted = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(5)), jv).result();
    WithOperands<AffineMap> result =
        AffineComposer.compose(AffineMap.get(exprs, 2, 0, d0.minus(d1)), List.of(shifted, jv));
    assertThat(result.structure().toString()).isEqualTo("() -> (5)");
    assertThat(result.operands()).isEmpty();
  }

  @Test
  public void makeComposedApply() {
    Value plusOne = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(1)), iv).result();
    ApplyOp apply =
        AffineComposer.makeComposedApply(
            inner, AffineMap.get(exprs, 2, 0, d0.plus(d1)), List.of(plusOne, jv));
    assertThat(apply.map().toString()).isEqualTo("(d0, d1) -> (d0 + d1 + 1)");
    assertThat(apply.operands()).containsExactly(jv, iv).inOrder();
  }

  @Test
  public void fullyComposeRemovesAllApplies() {
    Value a = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(1)), iv).result();
    Value b = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(2)), a).result();
    Value c = ApplyOp.create(inner, AffineMap.get(exprs, 1, 0, d0.plus(3)), b).result();
    WithOperands<AffineMap> result =
        AffineComposer.fullyCompose(AffineMap.identity(exprs, 1), List.of(c));
    assertThat(result.structure().toString()).isEqualTo("(d0) -> (d0 + 6)");
    assertThat(result.operands()).containsExactly(iv);
  }
}
