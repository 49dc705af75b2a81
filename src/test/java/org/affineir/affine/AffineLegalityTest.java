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

import java.util.List;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AffineLegalityTest {

  private AffineExprContext exprs;
  private FuncOp func;
  private Value n;
  private Value memref;
  private Value f;
  private ForOp loop;
  private OpBuilder inLoop;

  @Before
  public void setup() {
    IrContext ctx = new IrContext();
    exprs = ctx.exprs();
    func =
        FuncOp.create(
            ctx, "f", Type.INDEX, MemRefType.of(Type.F32, MemRefType.DYNAMIC, 8), Type.F32);
    n = func.argument(0);
    memref = func.argument(1);
    f = func.argument(2);
    loop = ForOp.create(atEnd(func), 0, 10, 1, List.of(n), null);
    inLoop = OpBuilder.atBlockEnd(loop.body());
  }

  @Test
  public void functionArguments() {
    assertThat(AffineLegality.isValidSymbol(n)).isTrue();
    assertThat(AffineLegality.isValidDim(n)).isTrue();
    assertThat(AffineLegality.isTopLevelValue(n)).isTrue();
    // Only index values qualify
    assertThat(AffineLegality.isValidSymbol(f)).isFalse();
    assertThat(AffineLegality.isValidDim(f)).isFalse();
  }

  @Test
  public void inductionVariables() {
    Value iv = loop.inductionVar();
    assertThat(AffineLegality.isValidDim(iv)).isTrue();
    assertThat(AffineLegality.isValidSymbol(iv)).isFalse();
    assertThat(AffineLegality.isTopLevelValue(iv)).isFalse();
    Value iterArg = loop.regionIterArgs().get(0);
    assertThat(AffineLegality.isValidDim(iterArg)).isFalse();
  }

  @Test
  public void parallelInductionVariables() {
    ParallelOp parallel =
        ParallelOp.create(atEnd(func), List.of(), List.of(), new long[] {4, 4});
    for (Value v : parallel.inductionVars()) {
      assertThat(AffineLegality.isValidDim(v)).isTrue();
      assertThat(AffineLegality.isValidSymbol(v)).isFalse();
    }
  }

  @Test
  public void constantsAreSymbolsAnywhere() {
    Value c = ConstantOp.create(inLoop, 3).result();
    assertThat(AffineLegality.isValidSymbol(c)).isTrue();
    assertThat(AffineLegality.isValidDim(c)).isTrue();
    assertThat(AffineLegality.isValidSymbol(c, null)).isTrue();
  }

  @Test
  public void applies() {
    AffineMap plusOne = AffineMap.get(exprs, 1, 0, exprs.dim(0).plus(1));
    Value ofIv = ApplyOp.create(inLoop, plusOne, loop.inductionVar()).result();
    Value ofArg = ApplyOp.create(inLoop, plusOne, n).result();
    assertThat(AffineLegality.isValidDim(ofIv)).isTrue();
    assertThat(AffineLegality.isValidSymbol(ofIv)).isFalse();
    assertThat(AffineLegality.isValidSymbol(ofArg)).isTrue();
    assertThat(AffineLegality.isValidAffineIndexOperand(ofIv, func.region(0))).isTrue();
  }

  @Test
  public void dimensionSizes() {
    Value dynamicSize = DimOp.create(inLoop, memref, 0).result();
    Value staticSize = DimOp.create(inLoop, memref, 1).result();
    assertThat(AffineLegality.isValidSymbol(dynamicSize)).isTrue();
    assertThat(AffineLegality.isValidSymbol(staticSize)).isTrue();
  }

  @Test
  public void dimensionSizeOfAllocation() {
    MemRefType type = MemRefType.of(Type.F32, MemRefType.DYNAMIC);
    Value outer = AllocOp.create(OpBuilder.before(loop), type, n).result();
    assertThat(AffineLegality.isValidSymbol(DimOp.create(inLoop, outer, 0).result())).isTrue();
    Value inner = AllocOp.create(inLoop, type, loop.inductionVar()).result();
    Value size = DimOp.create(inLoop, inner, 0).result();
    assertThat(AffineLegality.isValidSymbol(size)).isFalse();
  }

  @Test
  public void affineScope() {
    Value c = ConstantOp.create(inLoop, 3).result();
    assertThat(AffineLegality.affineScope(c.definingOp())).isSameInstanceAs(func.region(0));
    assertThat(AffineLegality.affineScope(func)).isNull();
  }

  @Test
  public void executeRegionStartsAScope() {
    ExecuteRegionOp region = ExecuteRegionOp.create(inLoop, List.of(memref));
    OpBuilder inRegion = OpBuilder.atBlockEnd(region.body());
    ApplyOp apply =
        ApplyOp.create(inRegion, AffineMap.get(exprs, 1, 0, exprs.dim(0)), loop.inductionVar());
    assertThat(AffineLegality.affineScope(apply)).isSameInstanceAs(region.region(0));
  }
}
