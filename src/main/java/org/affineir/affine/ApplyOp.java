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

import com.google.common.base.Preconditions;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineMap;
import org.affineir.ir.FoldResult;
import org.affineir.ir.IrContext;
import org.affineir.ir.Matchers;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.RewritePattern;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Value;

/**
 * Applies a single-result AffineMap to its operands (the first {@code map.numDims()} bound to
 * dimensions, the rest to symbols), producing one index value.
 */
public final class ApplyOp extends Operation implements AffineMapUser {

  private AffineMap map;

  private ApplyOp(IrContext context, AffineMap map, List<? extends Value> operands) {
    super(
        context,
        OpKind.APPLY,
        EnumSet.of(Trait.NO_MEMORY_EFFECT),
        operands,
        List.of(Type.INDEX),
        0);
    this.map = map;
  }

  public static ApplyOp create(OpBuilder builder, AffineMap map, List<? extends Value> operands) {
    checkMap(map, operands);
    return builder.insert(new ApplyOp(builder.context(), map, operands));
  }

  public static ApplyOp create(OpBuilder builder, AffineMap map, Value... operands) {
    return create(builder, map, List.of(operands));
  }

  private static void checkMap(AffineMap map, List<? extends Value> operands) {
    Preconditions.checkArgument(
        map.numResults() == 1, "affine.apply requires a single-result map, not %s", map);
    Preconditions.checkArgument(
        map.numInputs() == operands.size(),
        "%s has %s inputs but %s operands",
        map,
        map.numInputs(),
        operands.size());
  }

  @Override
  public AffineMap map() {
    return map;
  }

  @Override
  public List<Value> mapOperands() {
    return operands();
  }

  @Override
  public void setMap(AffineMap map, List<? extends Value> operands) {
    checkMap(map, operands);
    this.map = map;
    setOperands(operands);
  }

  /** Returns this operation's map, operands and result as an AffineValueMap. */
  public AffineValueMap valueMap() {
    return new AffineValueMap(map, operands(), results());
  }

  @Override
  public boolean verify() {
    if (numOperands() != map.numInputs()) {
      return emitOpError("operand count and affine map dimension and symbol count must match");
    } else if (map.numResults() != 1) {
      return emitOpError("mapping must produce one value");
    }
    return true;
  }

  @Override
  public FoldResult fold() {
    AffineExpr expr = map.result(0);
    if (expr instanceof AffineExpr.Dim d) {
      return FoldResult.of(operand(d.position));
    } else if (expr instanceof AffineExpr.Symbol s) {
      return FoldResult.of(operand(map.numDims() + s.position));
    }
    long[] inputs = new long[numOperands()];
    for (int i = 0; i < inputs.length; i++) {
      Long c = Matchers.constantOrNull(operand(i));
      if (c == null) {
        return FoldResult.FAILURE;
      }
      inputs[i] = c;
    }
    Optional<long[]> folded = map.constantFold(inputs);
    return folded.isPresent() ? FoldResult.ofConstant(folded.get()[0]) : FoldResult.FAILURE;
  }

  @Override
  public List<RewritePattern> canonicalizationPatterns() {
    return List.of(ComposeMapOperands.INSTANCE);
  }

  @Override
  protected String attributesString() {
    return "map = " + map;
  }
}
