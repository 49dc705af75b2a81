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

import java.util.ArrayList;
import java.util.List;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Operation;
import org.affineir.ir.Type;
import org.affineir.ir.Value;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LoopNestsTest {

  private final IrContext ctx = new IrContext();

  @Test
  public void constantNest() {
    FuncOp func = FuncOp.create(ctx, "f");
    List<Value> seen = new ArrayList<>();
    List<ForOp> loops =
        LoopNests.buildLoopNest(
            atEnd(func),
            new long[] {0, 0},
            new long[] {4, 8},
            new long[] {1, 2},
            (b, ivs) -> {
              seen.addAll(ivs);
              IrTestUtil.use(b, ivs.toArray(new Value[0]));
            });
    assertThat(loops).hasSize(2);
    ForOp outer = loops.get(0);
    ForOp inner = loops.get(1);
    assertThat(outer.constantUpperBound()).isEqualTo(4);
    assertThat(inner.constantUpperBound()).isEqualTo(8);
    assertThat(inner.step()).isEqualTo(2);
    assertThat(inner.parentOp()).isSameInstanceAs(outer);
    assertThat(outer.body().front()).isSameInstanceAs(inner);
    assertThat(seen).containsExactly(outer.inductionVar(), inner.inductionVar()).inOrder();

    Operation user = inner.body().front();
    assertThat(user.name()).isEqualTo("test.use");
    assertThat(user.operands()).containsExactlyElementsIn(seen).inOrder();
    assertThat(inner.body().terminator()).isInstanceOf(YieldOp.class);
  }

  @Test
  public void emptyNestBuildsBodyInPlace() {
    FuncOp func = FuncOp.create(ctx, "f");
    OpBuilder builder = atEnd(func);
    List<List<Value>> calls = new ArrayList<>();
    List<ForOp> loops =
        LoopNests.buildLoopNest(
            builder,
            new long[0],
            new long[0],
            new long[0],
            (b, ivs) -> {
              calls.add(ivs);
              ConstantOp.create(b, 1);
            });
    assertThat(loops).isEmpty();
    assertThat(calls).containsExactly(List.of());
    assertThat(func.body().front()).isInstanceOf(ConstantOp.class);
  }

  @Test
  public void nestWithoutBodyBuilder() {
    FuncOp func = FuncOp.create(ctx, "f");
    List<ForOp> loops =
        LoopNests.buildLoopNest(
            atEnd(func), new long[] {0}, new long[] {10}, new long[] {1}, null);
    assertThat(loops).hasSize(1);
    assertThat(loops.get(0).body().hasOnlyTerminator()).isTrue();
  }

  @Test
  public void mismatchedCounts() {
    FuncOp func = FuncOp.create(ctx, "f");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            LoopNests.buildLoopNest(
                atEnd(func), new long[] {0, 0}, new long[] {4}, new long[] {1, 1}, null));
  }

  @Test
  public void nestFromValues() {
    FuncOp func = FuncOp.create(ctx, "f", Type.INDEX);
    Value n = func.argument(0);
    OpBuilder builder = atEnd(func);
    Value zero = ConstantOp.create(builder, 0).result();
    Value four = ConstantOp.create(builder, 4).result();
    List<ForOp> loops =
        LoopNests.buildLoopNestFromValues(
            builder,
            List.of(zero, zero),
            List.of(four, n),
            new long[] {1, 1},
            (b, ivs) -> IrTestUtil.use(b, ivs.toArray(new Value[0])));
    ForOp outer = loops.get(0);
    ForOp inner = loops.get(1);
    assertThat(outer.hasConstantBounds()).isTrue();
    assertThat(outer.constantUpperBound()).isEqualTo(4);
    assertThat(inner.lowerBoundMap().toString()).isEqualTo("(d0) -> (d0)");
    assertThat(inner.lowerBoundOperands()).containsExactly(zero);
    assertThat(inner.upperBoundOperands()).containsExactly(n);

    IrTestUtil.canonicalize(func);
    assertThat(inner.hasConstantLowerBound()).isTrue();
    assertThat(inner.constantLowerBound()).isEqualTo(0);
    assertThat(inner.upperBoundMap().toString()).isEqualTo("()[s0] -> (s0)");
    assertThat(inner.upperBoundOperands()).containsExactly(n);
  }
}
