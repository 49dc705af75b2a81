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
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
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
import org.jspecify.annotations.Nullable;

/**
 * affine.min and affine.max: evaluates each result of a multi-result map and returns the smallest
 * (for min) or largest (for max).
 */
public final class MinMaxOp extends Operation implements AffineMapUser {

  private AffineMap map;

  private MinMaxOp(IrContext context, OpKind kind, AffineMap map, List<? extends Value> operands) {
    super(context, kind, EnumSet.of(Trait.NO_MEMORY_EFFECT), operands, List.of(Type.INDEX), 0);
    this.map = map;
  }

  public static MinMaxOp createMin(
      OpBuilder builder, AffineMap map, List<? extends Value> operands) {
    return create(builder, OpKind.MIN, map, operands);
  }

  public static MinMaxOp createMax(
      OpBuilder builder, AffineMap map, List<? extends Value> operands) {
    return create(builder, OpKind.MAX, map, operands);
  }

  private static MinMaxOp create(
      OpBuilder builder, OpKind kind, AffineMap map, List<? extends Value> operands) {
    checkMap(map, operands);
    return builder.insert(new MinMaxOp(builder.context(), kind, map, operands));
  }

  private static void checkMap(AffineMap map, List<? extends Value> operands) {
    Preconditions.checkArgument(!map.isEmpty(), "%s has no results", map);
    Preconditions.checkArgument(
        map.numInputs() == operands.size(),
        "%s has %s inputs but %s operands",
        map,
        map.numInputs(),
        operands.size());
  }

  public boolean isMin() {
    return kind() == OpKind.MIN;
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

  @Override
  public boolean verify() {
    if (numOperands() != map.numInputs()) {
      return emitOpError("operand count and affine map dimension and symbol count must match");
    }
    return true;
  }

  /**
   * Folds to a constant if every result of the map is constant once the constant operands are
   * substituted; otherwise replaces the map with the partially folded one.
   */
  @Override
  public FoldResult fold() {
    List<@Nullable Long> constants = new ArrayList<>();
    for (Value v : operands()) {
      constants.add(Matchers.constantOrNull(v));
    }
    AffineMap folded = map.partialConstantFold(constants);
    if (folded.isConstant()) {
      long result = folded.constantResults()[0];
      for (long v : folded.constantResults()) {
        result = isMin() ? Math.min(result, v) : Math.max(result, v);
      }
      return FoldResult.ofConstant(result);
    } else if (folded.equals(map)) {
      return FoldResult.FAILURE;
    }
    map = folded;
    return FoldResult.IN_PLACE;
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
