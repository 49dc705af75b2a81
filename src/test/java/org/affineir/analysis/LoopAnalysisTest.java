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

import static com.google.common.truth.Truth.assertThat;
import static org.affineir.analysis.LoopAnalysis.DEFAULT_VECTOR_TRANSFER_MATCHER;
import static org.junit.Assert.assertThrows;

import java.util.List;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import org.affineir.affine.AffineValueMap;
import org.affineir.affine.ApplyOp;
import org.affineir.affine.ForOp;
import org.affineir.affine.FuncOp;
import org.affineir.affine.IfOp;
import org.affineir.affine.LoadOp;
import org.affineir.affine.StoreOp;
import org.affineir.affine.VectorLoadOp;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.expr.IntegerSet;
import org.affineir.ir.Diagnostic;
import org.affineir.ir.GenericOp;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Operation;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Type.VectorType;
import org.affineir.ir.Value;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LoopAnalysisTest {

  private IrContext ctx;
  private AffineExprContext exprs;
  private FuncOp func;
  private Value matrix;
  private Value vector;
  private Value n;
  private ForOp outer;
  private ForOp inner;
  private Value iv;
  private Value jv;
  private OpBuilder body;

  @Before
  public void setup() {
    ctx = new IrContext();
    exprs = ctx.exprs();
    func =
        FuncOp.create(
            ctx,
            "f",
            MemRefType.of(Type.F32, 4, 8),
            MemRefType.of(Type.F32, 8),
            Type.INDEX,
            Type.F32);
    matrix = func.argument(0);
    vector = func.argument(1);
    n = func.argument(2);
    outer = ForOp.create(OpBuilder.atBlockEnd(func.body()), 0, 4, 1);
    inner = ForOp.create(OpBuilder.before(outer.body().terminator()), 0, 8, 1);
    iv = outer.inductionVar();
    jv = inner.inductionVar();
    body = OpBuilder.before(inner.body().terminator());
  }

  private ForOp loop(long lb, long ub, long step) {
    return ForOp.create(OpBuilder.atBlockEnd(func.body()), lb, ub, step);
  }

  private ForOp loop(AffineMap ubMap, List<Value> ubOperands, long step) {
    return ForOp.create(
        OpBuilder.atBlockEnd(func.body()),
        AffineMap.constant(exprs, 0),
        List.of(),
        ubMap,
        ubOperands,
        step);
  }

  @Test
  public void constantTripCount() {
    ForOp loop = loop(0, 10, 3);
    assertThat(LoopAnalysis.constantTripCount(loop)).isEqualTo(OptionalLong.of(4));
    assertThat(LoopAnalysis.largestDivisorOfTripCount(loop)).isEqualTo(4);
    AffineValueMap tripCount = LoopAnalysis.buildTripCountMap(loop).get();
    assertThat(tripCount.map().toString()).isEqualTo("() -> (4)");
  }

  @Test
  public void emptyLoopHasZeroTrips() {
    ForOp loop = loop(0, 0, 1);
    assertThat(LoopAnalysis.constantTripCount(loop)).isEqualTo(OptionalLong.of(0));
    assertThat(LoopAnalysis.largestDivisorOfTripCount(loop)).isEqualTo(Long.MAX_VALUE);
  }

  @Test
  public void reversedBoundsHaveZeroTrips() {
    assertThat(LoopAnalysis.constantTripCount(loop(5, 2, 1))).isEqualTo(OptionalLong.of(0));
  }

  @Test
  public void symbolicTripCount() {
    AffineExpr s0 = exprs.symbol(0);
    ForOp loop = loop(AffineMap.get(exprs, 0, 1, s0.times(4)), List.of(n), 2);
    AffineValueMap tripCount = LoopAnalysis.buildTripCountMap(loop).get();
    assertThat(tripCount.map().toString()).isEqualTo("()[s0] -> (s0 * 2)");
    assertThat(tripCount.operands()).containsExactly(n);
    assertThat(LoopAnalysis.constantTripCount(loop)).isEqualTo(OptionalLong.empty());
    assertThat(LoopAnalysis.largestDivisorOfTripCount(loop)).isEqualTo(2);
  }

  @Test
  public void multipleUpperBounds() {
    AffineExpr s0 = exprs.symbol(0);
    ForOp loop = loop(AffineMap.get(exprs, 0, 1, s0.times(4), exprs.constant(12)), List.of(n), 1);
    assertThat(LoopAnalysis.constantTripCount(loop)).isEqualTo(OptionalLong.empty());
    assertThat(LoopAnalysis.largestDivisorOfTripCount(loop)).isEqualTo(4);

    ForOp constantLoop =
        loop(AffineMap.get(exprs, 0, 0, exprs.constant(10), exprs.constant(6)), List.of(), 1);
    assertThat(LoopAnalysis.constantTripCount(constantLoop)).isEqualTo(OptionalLong.of(6));
    assertThat(LoopAnalysis.largestDivisorOfTripCount(constantLoop)).isEqualTo(2);
  }

  @Test
  public void indexInvariance() {
    assertThat(LoopAnalysis.isAccessIndexInvariant(iv, iv)).isFalse();
    assertThat(LoopAnalysis.isAccessIndexInvariant(iv, jv)).isTrue();
    assertThat(LoopAnalysis.isAccessIndexInvariant(iv, n)).isTrue();
    assertThat(LoopAnalysis.invariantAccesses(iv, List.of(iv, jv, n)))
        .containsExactly(jv, n)
        .inOrder();
    assertThrows(IllegalArgumentException.class, () -> LoopAnalysis.isAccessIndexInvariant(n, iv));
  }

  @Test
  public void invarianceThroughApply() {
    AffineMap plusOne = AffineMap.get(exprs, 1, 0, exprs.dim(0).plus(1));
    Value shifted = ApplyOp.create(body, plusOne, iv).result();
    assertThat(LoopAnalysis.isAccessIndexInvariant(iv, shifted)).isFalse();
    assertThat(LoopAnalysis.isAccessIndexInvariant(jv, shifted)).isTrue();
  }

  @Test
  public void chainedAppliesAreConservative() {
    AffineMap plusOne = AffineMap.get(exprs, 1, 0, exprs.dim(0).plus(1));
    Value first = ApplyOp.create(body, plusOne, n).result();
    Value second = ApplyOp.create(body, plusOne, first).result();
    assertThat(LoopAnalysis.isAccessIndexInvariant(iv, second)).isFalse();
    assertThat(ctx.diagnostics().messages(Diagnostic.Severity.REMARK)).hasSize(1);
  }

  @Test
  public void invariantAccess() {
    LoadOp rowLoad = LoadOp.create(body, vector, List.of(jv));
    LoadOp matrixLoad = LoadOp.create(body, matrix, List.of(iv, jv));
    assertThat(LoopAnalysis.isInvariantAccess(rowLoad, outer)).isTrue();
    assertThat(LoopAnalysis.isInvariantAccess(rowLoad, inner)).isFalse();
    assertThat(LoopAnalysis.isInvariantAccess(matrixLoad, outer)).isFalse();
  }

  @Test
  public void contiguousDimensions() {
    LoadOp load = LoadOp.create(body, matrix, List.of(iv, jv));
    assertThat(LoopAnalysis.contiguousDim(jv, load)).isEqualTo(OptionalInt.of(0));
    assertThat(LoopAnalysis.contiguousDim(iv, load)).isEqualTo(OptionalInt.of(1));

    LoadOp invariant = LoadOp.create(body, vector, List.of(iv));
    assertThat(LoopAnalysis.contiguousDim(jv, invariant)).isEqualTo(OptionalInt.of(-1));
    assertThat(LoopAnalysis.isContiguousAccess(jv, invariant)).isTrue();
  }

  @Test
  public void stridedAccessIsNotContiguous() {
    AffineMap strided = AffineMap.get(exprs, 2, 0, exprs.dim(0), exprs.dim(1).times(2));
    LoadOp load = LoadOp.create(body, matrix, strided, List.of(iv, jv));
    assertThat(LoopAnalysis.contiguousDim(jv, load)).isEqualTo(OptionalInt.empty());
    assertThat(LoopAnalysis.contiguousDim(iv, load)).isEqualTo(OptionalInt.of(1));
  }

  @Test
  public void twoVaryingResultsAreNotContiguous() {
    AffineMap diagonal = AffineMap.get(exprs, 1, 0, exprs.dim(0), exprs.dim(0));
    LoadOp load = LoadOp.create(body, matrix, diagonal, List.of(iv));
    assertThat(LoopAnalysis.contiguousDim(iv, load)).isEqualTo(OptionalInt.empty());
    assertThat(LoopAnalysis.isContiguousAccess(iv, load)).isFalse();
    assertThat(LoopAnalysis.contiguousDim(jv, load)).isEqualTo(OptionalInt.of(-1));
  }

  @Test
  public void dividedAccessIsNotContiguous() {
    AffineMap halved = AffineMap.get(exprs, 1, 0, exprs.dim(0).floorDiv(2));
    LoadOp load = LoadOp.create(body, vector, halved, List.of(jv));
    assertThat(LoopAnalysis.isContiguousAccess(jv, load)).isFalse();
  }

  @Test
  public void nonIdentityLayoutIsUnsupported() {
    AffineMap shift = AffineMap.get(exprs, 1, 0, exprs.dim(0).plus(1));
    FuncOp g = FuncOp.create(ctx, "g", MemRefType.of(List.of(8L), Type.F32, List.of(shift)));
    ForOp loop = ForOp.create(OpBuilder.atBlockEnd(g.body()), 0, 8, 1);
    Value index = loop.inductionVar();
    LoadOp load =
        LoadOp.create(OpBuilder.before(loop.body().terminator()), g.argument(0), List.of(index));
    assertThat(LoopAnalysis.contiguousDim(index, load)).isEqualTo(OptionalInt.empty());
    assertThat(ctx.diagnostics().messages(Diagnostic.Severity.ERROR))
        .containsExactly("'affine.load' op non-trivial layout map not supported");

    // Asking again does not report the same access twice
    assertThat(LoopAnalysis.isContiguousAccess(index, load)).isFalse();
    assertThat(LoopAnalysis.vectorizableMemRefDim(loop, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isEqualTo(OptionalInt.empty());
    assertThat(ctx.diagnostics().messages(Diagnostic.Severity.ERROR)).hasSize(1);
  }

  @Test
  public void vectorizableBody() {
    Value loaded = LoadOp.create(body, matrix, List.of(iv, jv)).result();
    StoreOp.create(body, loaded, vector, List.of(jv));
    assertThat(LoopAnalysis.isVectorizableLoopBody(inner, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isTrue();
    assertThat(LoopAnalysis.vectorizableMemRefDim(inner, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isEqualTo(OptionalInt.of(0));
  }

  @Test
  public void accessesAlongDifferentDimensions() {
    LoadOp.create(body, matrix, List.of(iv, jv));
    LoadOp.create(body, matrix, List.of(jv, iv));
    assertThat(LoopAnalysis.isVectorizableLoopBody(inner, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isTrue();
    assertThat(LoopAnalysis.vectorizableMemRefDim(inner, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isEqualTo(OptionalInt.empty());
  }

  @Test
  public void conditionalIsNotVectorizable() {
    IntegerSet set = IntegerSet.get(exprs, 1, 0, List.of(exprs.dim(0)), false);
    IfOp.create(body, set, List.of(jv), false);
    assertThat(LoopAnalysis.isVectorizableLoopBody(inner, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isFalse();
  }

  @Test
  public void vectorTransferIsNotVectorizable() {
    VectorLoadOp.create(body, VectorType.of(Type.F32, 4), matrix, List.of(iv, jv));
    assertThat(LoopAnalysis.isVectorizableLoopBody(inner, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isFalse();
    assertThat(LoopAnalysis.isVectorizableLoopBody(inner, op -> false)).isTrue();
  }

  @Test
  public void vectorElementsAreNotVectorizable() {
    FuncOp g = FuncOp.create(ctx, "g", MemRefType.of(VectorType.of(Type.F32, 4), 8));
    ForOp loop = ForOp.create(OpBuilder.atBlockEnd(g.body()), 0, 8, 1);
    LoadOp.create(
        OpBuilder.before(loop.body().terminator()), g.argument(0), List.of(loop.inductionVar()));
    assertThat(LoopAnalysis.isVectorizableLoopBody(loop, DEFAULT_VECTOR_TRANSFER_MATCHER))
        .isFalse();
  }

  @Test
  public void namedVectorTransferMatches() {
    Operation transfer =
        GenericOp.create(body, "vector.transfer_read", Set.of(), List.of(), List.of());
    Operation other = GenericOp.create(body, "test.op", Set.of(), List.of(), List.of());
    assertThat(DEFAULT_VECTOR_TRANSFER_MATCHER.test(transfer)).isTrue();
    assertThat(DEFAULT_VECTOR_TRANSFER_MATCHER.test(other)).isFalse();
  }

  @Test
  public void opwiseShifts() {
    Operation producer =
        GenericOp.create(
            body, "test.def", Set.of(Trait.NO_MEMORY_EFFECT), List.of(jv), List.of(Type.F32));
    StoreOp.create(body, producer.result(), vector, List.of(jv));
    // producer, store, yield
    assertThat(LoopAnalysis.isOpwiseShiftValid(inner, new long[] {0, 0, 0})).isTrue();
    assertThat(LoopAnalysis.isOpwiseShiftValid(inner, new long[] {1, 1, 0})).isTrue();
    assertThat(LoopAnalysis.isOpwiseShiftValid(inner, new long[] {0, 1, 0})).isFalse();
    assertThrows(
        IllegalArgumentException.class,
        () -> LoopAnalysis.isOpwiseShiftValid(inner, new long[] {0, 0}));
  }

  @Test
  public void shiftsIgnoreUsesOutsideTheBody() {
    ForOp loop = loop(0, 8, 1);
    Operation producer =
        GenericOp.create(
            OpBuilder.before(loop.body().terminator()),
            "test.def",
            Set.of(Trait.NO_MEMORY_EFFECT),
            List.of(),
            List.of(Type.F32));
    StoreOp.create(OpBuilder.atBlockEnd(func.body()), producer.result(), vector, List.of(n));
    assertThat(LoopAnalysis.isOpwiseShiftValid(loop, new long[] {3, 0})).isTrue();
  }
}
