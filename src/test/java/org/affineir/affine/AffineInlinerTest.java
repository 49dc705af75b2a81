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
import java.util.Map;
import java.util.Set;
import org.affineir.expr.AffineMap;
import org.affineir.ir.Block;
import org.affineir.ir.GenericOp;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Region;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AffineInlinerTest {

  private IrContext ctx;
  private FuncOp func;
  private Value memref;
  private Value x;
  private ForOp loop;
  private Region src;
  private Block srcBlock;
  private Value srcArg;
  private OpBuilder srcBuilder;

  @Before
  public void setup() {
    ctx = new IrContext();
    func = FuncOp.create(ctx, "f", MemRefType.of(Type.F32, 16), Type.F32);
    memref = func.argument(0);
    x = func.argument(1);
    loop = ForOp.create(atEnd(func), 0, 16, 1);
    // A detached callee-like region with one index argument
    GenericOp callee =
        GenericOp.create(new OpBuilder(ctx), "test.callee", Set.of(), List.of(), List.of(), 1);
    src = callee.region(0);
    srcBlock = src.addBlock();
    srcArg = srcBlock.addArgument(Type.INDEX);
    srcBuilder = OpBuilder.atBlockEnd(srcBlock);
  }

  @Test
  public void argumentMappedToInductionVar() {
    StoreOp.create(srcBuilder, x, memref, List.of(srcArg));
    Map<Value, Value> mapping = Map.of(srcArg, loop.inductionVar());
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, mapping)).isTrue();
  }

  @Test
  public void unmappedArgumentIsIllegal() {
    StoreOp.create(srcBuilder, x, memref, List.of(srcArg));
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, Map.of())).isFalse();
  }

  @Test
  public void argumentMappedToNonIndexIsIllegal() {
    LoadOp.create(srcBuilder, memref, List.of(srcArg));
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, Map.of(srcArg, x))).isFalse();
  }

  @Test
  public void constantSubscriptIsLegal() {
    Value c = ConstantOp.create(srcBuilder, 3).result();
    LoadOp.create(srcBuilder, memref, List.of(c));
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, Map.of())).isTrue();
  }

  @Test
  public void opaqueSubscriptIsIllegal() {
    Value opaque =
        GenericOp.create(
                srcBuilder,
                "test.opaque",
                Set.of(Trait.NO_MEMORY_EFFECT),
                List.of(),
                List.of(Type.INDEX))
            .result();
    LoadOp.create(srcBuilder, memref, List.of(opaque));
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, Map.of())).isFalse();
  }

  @Test
  public void unknownSideEffectsAreIllegal() {
    IrTestUtil.use(srcBuilder, srcArg);
    Map<Value, Value> mapping = Map.of(srcArg, loop.inductionVar());
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, mapping)).isFalse();
  }

  @Test
  public void pureOperationsAreLegal() {
    ApplyOp.create(srcBuilder, AffineMap.identity(ctx.exprs(), 1), List.of(srcArg));
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, Map.of())).isTrue();
  }

  @Test
  public void destinationMustBeAffineConstruct() {
    assertThat(AffineInliner.isLegalToInline(func.region(0), src, Map.of())).isFalse();
  }

  @Test
  public void sourceMustHaveOneBlock() {
    src.addBlock();
    assertThat(AffineInliner.isLegalToInline(loop.region(0), src, Map.of())).isFalse();
  }

  @Test
  public void operationIntoRegion() {
    Value c = ConstantOp.create(srcBuilder, 3).result();
    assertThat(AffineInliner.isLegalToInline(c.definingOp(), func.region(0))).isTrue();
    assertThat(AffineInliner.isLegalToInline(c.definingOp(), loop.region(0))).isTrue();
    assertThat(AffineInliner.isLegalToInline(c.definingOp(), src)).isFalse();
  }
}
