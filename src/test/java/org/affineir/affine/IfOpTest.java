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
import static org.affineir.affine.IrTestUtil.canonicalize;
import static org.affineir.affine.IrTestUtil.use;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.IntegerSet;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Type;
import org.affineir.ir.Value;
import org.affineir.ir.Verifier;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IfOpTest {

  private AffineExprContext exprs;
  private AffineExpr d0;
  private AffineExpr s0;
  private FuncOp func;
  private Value n;
  private Value iv;
  private OpBuilder body;

  @Before
  public void setup() {
    IrContext ctx = new IrContext();
    exprs = ctx.exprs();
    d0 = exprs.dim(0);
    s0 = exprs.symbol(0);
    func = FuncOp.create(ctx, "f", Type.INDEX);
    n = func.argument(0);
    ForOp loop = ForOp.create(atEnd(func), 0, 10, 1);
    iv = loop.inductionVar();
    body = OpBuilder.before(loop.body().terminator());
  }

  private IntegerSet ivAtLeastN() {
    return IntegerSet.get(exprs, 1, 1, List.of(d0.minus(s0)), false);
  }

  @Test
  public void createWithElse() {
    IfOp ifOp = IfOp.create(body, ivAtLeastN(), List.of(iv, n), true);
    assertThat(ifOp.numRegions()).isEqualTo(2);
    assertThat(ifOp.hasElse()).isTrue();
    assertThat(ifOp.thenBlock().hasOnlyTerminator()).isTrue();
    assertThat(ifOp.elseBlock().hasOnlyTerminator()).isTrue();
    assertThat(Verifier.verify(func)).isTrue();
  }

  @Test
  public void createWithoutElse() {
    IfOp ifOp = IfOp.create(body, ivAtLeastN(), List.of(iv, n), false);
    assertThat(ifOp.numRegions()).isEqualTo(2);
    assertThat(ifOp.hasElse()).isFalse();
    assertThat(ifOp.elseBlock()).isNull();
    assertThat(ifOp.elseRegion().isEmpty()).isTrue();
  }

  @Test
  public void resultsRequireElse() {
    assertThrows(
        IllegalArgumentException.class,
        () -> IfOp.create(body, List.of(Type.INDEX), ivAtLeastN(), List.of(iv, n), false));
    assertThrows(
        IllegalArgumentException.class, () -> IfOp.create(body, ivAtLeastN(), List.of(iv), true));
  }

  @Test
  public void ifWithResults() {
    IfOp ifOp = IfOp.create(body, List.of(Type.INDEX), ivAtLeastN(), List.of(iv, n), true);
    assertThat(ifOp.thenBlock().terminator()).isNull();
    YieldOp.create(OpBuilder.atBlockEnd(ifOp.thenBlock()), List.of(iv));
    YieldOp.create(OpBuilder.atBlockEnd(ifOp.elseBlock()), List.of(n));
    use(body, ifOp.result());
    assertThat(Verifier.verify(func)).isTrue();
  }

  @Test
  public void yieldTypesMustMatch() {
    IfOp ifOp = IfOp.create(body, List.of(Type.F32), ivAtLeastN(), List.of(iv, n), true);
    YieldOp.create(OpBuilder.atBlockEnd(ifOp.thenBlock()), List.of(iv));
    YieldOp.create(OpBuilder.atBlockEnd(ifOp.elseBlock()), List.of(iv));
    assertThat(Verifier.verify(func)).isFalse();
    assertThat(IrTestUtil.errors(func.context()))
        .containsExactly(
            "'affine.yield' op types mismatch between yield op and its parent",
            "'affine.yield' op types mismatch between yield op and its parent");
  }

  @Test
  public void conditionOperandsArePromoted() {
    IntegerSet set =
        IntegerSet.get(exprs, 2, 0, List.of(d0.minus(exprs.dim(1))), false);
    IfOp ifOp = IfOp.create(body, set, List.of(iv, n), false);
    use(OpBuilder.before(ifOp.thenBlock().terminator()), iv);
    canonicalize(func);
    assertThat(ifOp.condition().toString()).isEqualTo("(d0)[s0] : (d0 - s0 >= 0)");
    assertThat(ifOp.operands()).containsExactly(iv, n).inOrder();
  }

  @Test
  public void canonicalConditionIsLeftAlone() {
    IntegerSet set = ivAtLeastN();
    IfOp ifOp = IfOp.create(body, set, List.of(iv, n), false);
    canonicalize(func);
    assertThat(ifOp.condition()).isSameInstanceAs(set);
  }

  @Test
  public void constantSymbolsAreFoldedIntoCondition() {
    Value seven = ConstantOp.create(body, 7).result();
    IntegerSet set = IntegerSet.get(exprs, 0, 1, List.of(s0.plus(-5)), false);
    IfOp ifOp = IfOp.create(body, set, List.of(seven), false);
    canonicalize(func);
    assertThat(ifOp.condition().toString()).isEqualTo("() : (2 >= 0)");
    assertThat(ifOp.operands()).isEmpty();
    assertThat(seven.definingOp().isErased()).isTrue();
  }

  @Test
  public void emptyElseIsRemoved() {
    IfOp ifOp = IfOp.create(body, ivAtLeastN(), List.of(iv, n), true);
    canonicalize(func);
    assertThat(ifOp.hasElse()).isFalse();
    assertThat(ifOp.numRegions()).isEqualTo(2);
  }

  @Test
  public void nonEmptyElseIsKept() {
    IfOp ifOp = IfOp.create(body, ivAtLeastN(), List.of(iv, n), true);
    use(OpBuilder.before(ifOp.elseBlock().terminator()), n);
    canonicalize(func);
    assertThat(ifOp.hasElse()).isTrue();
  }

  @Test
  public void setConditional() {
    IfOp ifOp = IfOp.create(body, ivAtLeastN(), List.of(iv, n), false);
    IntegerSet universe = IntegerSet.universe(exprs, 1, 0);
    ifOp.setConditional(universe, List.of(iv));
    assertThat(ifOp.condition()).isSameInstanceAs(universe);
    assertThat(ifOp.operands()).containsExactly(iv);
    assertThrows(IllegalArgumentException.class, () -> ifOp.setIntegerSet(ivAtLeastN()));
  }
}
