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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.affineir.expr.AffineExpr;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.ir.Block;
import org.affineir.ir.BlockArgument;
import org.affineir.ir.FoldResult;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Region;
import org.affineir.ir.Type;
import org.affineir.ir.Value;

/**
 * A nest of loops whose iterations may run in any order. Dimension {@code i} runs from result
 * {@code i} of the lower bounds map up to result {@code i} of the upper bounds map by step {@code
 * i}. Each result of the operation is combined across iterations with its {@link ReductionKind}.
 */
public final class ParallelOp extends Operation {

  /** The associative operations that may combine the values yielded by each iteration. */
  public enum ReductionKind {
    ADDF,
    ADDI,
    ASSIGN,
    MAXF,
    MAXS,
    MAXU,
    MINF,
    MINS,
    MINU,
    MULF,
    MULI
  }

  private AffineMap lowerBoundsMap;
  private AffineMap upperBoundsMap;
  private long[] steps;
  private final ImmutableList<ReductionKind> reductions;

  private ParallelOp(
      IrContext context,
      List<Type> resultTypes,
      List<ReductionKind> reductions,
      AffineMap lowerBoundsMap,
      AffineMap upperBoundsMap,
      long[] steps,
      List<Value> operands) {
    super(context, OpKind.PARALLEL, Set.of(), operands, resultTypes, 1);
    this.lowerBoundsMap = lowerBoundsMap;
    this.upperBoundsMap = upperBoundsMap;
    this.steps = steps;
    this.reductions = ImmutableList.copyOf(reductions);
  }

  /**
   * Creates a parallel loop nest. The body has one index argument per dimension; if there are no
   * results it ends with an operand-free yield, otherwise the caller must add the yield.
   */
  public static ParallelOp create(
      OpBuilder builder,
      List<Type> resultTypes,
      List<ReductionKind> reductions,
      AffineMap lbMap,
      List<? extends Value> lbOperands,
      AffineMap ubMap,
      List<? extends Value> ubOperands,
      long[] steps) {
    Preconditions.checkArgument(
        resultTypes.size() == reductions.size(), "one reduction is required per result");
    Preconditions.checkArgument(
        lbMap.numResults() == ubMap.numResults() && lbMap.numResults() == steps.length,
        "bounds and steps must have one entry per dimension");
    Preconditions.checkArgument(
        lbMap.numInputs() == lbOperands.size(), "lower bound operand count mismatch");
    Preconditions.checkArgument(
        ubMap.numInputs() == ubOperands.size(), "upper bound operand count mismatch");
    for (long step : steps) {
      Preconditions.checkArgument(step > 0, "step must be positive, not %s", step);
    }
    List<Value> operands = new ArrayList<>(lbOperands);
    operands.addAll(ubOperands);
    ParallelOp result =
        builder.insert(
            new ParallelOp(
                builder.context(),
                resultTypes,
                reductions,
                lbMap,
                ubMap,
                steps.clone(),
                operands));
    Region region = result.region(0);
    Block body = region.addBlock();
    for (int i = 0; i < steps.length; i++) {
      body.addArgument(Type.INDEX);
    }
    if (resultTypes.isEmpty()) {
      YieldOp.ensureTerminator(region, builder.context());
    }
    return result;
  }

  /** Creates a parallel loop nest with unit steps. */
  public static ParallelOp create(
      OpBuilder builder,
      List<Type> resultTypes,
      List<ReductionKind> reductions,
      AffineMap lbMap,
      List<? extends Value> lbOperands,
      AffineMap ubMap,
      List<? extends Value> ubOperands) {
    long[] steps = new long[lbMap.numResults()];
    Arrays.fill(steps, 1);
    return create(
        builder, resultTypes, reductions, lbMap, lbOperands, ubMap, ubOperands, steps);
  }

  /** Creates a parallel loop nest in which dimension {@code i} runs from 0 to {@code ranges[i]}. */
  public static ParallelOp create(
      OpBuilder builder,
      List<Type> resultTypes,
      List<ReductionKind> reductions,
      long[] ranges) {
    AffineExprContext exprs = builder.exprs();
    List<AffineExpr> lbs = new ArrayList<>();
    List<AffineExpr> ubs = new ArrayList<>();
    for (long range : ranges) {
      lbs.add(exprs.constant(0));
      ubs.add(exprs.constant(range));
    }
    return create(
        builder,
        resultTypes,
        reductions,
        AffineMap.get(exprs, 0, 0, lbs),
        List.of(),
        AffineMap.get(exprs, 0, 0, ubs),
        List.of());
  }

  public int numDims() {
    return steps.length;
  }

  public Block body() {
    return region(0).front();
  }

  public List<BlockArgument> inductionVars() {
    return body().arguments();
  }

  public long[] steps() {
    return steps.clone();
  }

  public void setSteps(long[] newSteps) {
    Preconditions.checkArgument(newSteps.length == numDims(), "wrong number of steps");
    for (long step : newSteps) {
      Preconditions.checkArgument(step > 0, "step must be positive, not %s", step);
    }
    steps = newSteps.clone();
  }

  public ImmutableList<ReductionKind> reductions() {
    return reductions;
  }

  public AffineMap lowerBoundsMap() {
    return lowerBoundsMap;
  }

  public AffineMap upperBoundsMap() {
    return upperBoundsMap;
  }

  public List<Value> lowerBoundsOperands() {
    return operands().subList(0, lowerBoundsMap.numInputs());
  }

  public List<Value> upperBoundsOperands() {
    return operands().subList(lowerBoundsMap.numInputs(), numOperands());
  }

  public AffineValueMap lowerBoundsValueMap() {
    return new AffineValueMap(lowerBoundsMap, lowerBoundsOperands());
  }

  public AffineValueMap upperBoundsValueMap() {
    return new AffineValueMap(upperBoundsMap, upperBoundsOperands());
  }

  public void setLowerBounds(List<? extends Value> operands, AffineMap map) {
    checkBounds(map, operands);
    setOperands(0, lowerBoundsMap.numInputs(), operands);
    lowerBoundsMap = map;
  }

  public void setUpperBounds(List<? extends Value> operands, AffineMap map) {
    checkBounds(map, operands);
    setOperands(lowerBoundsMap.numInputs(), upperBoundsMap.numInputs(), operands);
    upperBoundsMap = map;
  }

  /** Replaces the lower bounds map with one that has the same inputs. */
  public void setLowerBoundsMap(AffineMap map) {
    checkBounds(map, lowerBoundsOperands());
    lowerBoundsMap = map;
  }

  /** Replaces the upper bounds map with one that has the same inputs. */
  public void setUpperBoundsMap(AffineMap map) {
    checkBounds(map, upperBoundsOperands());
    upperBoundsMap = map;
  }

  private void checkBounds(AffineMap map, List<? extends Value> operands) {
    Preconditions.checkArgument(
        map.numResults() == numDims(), "%s does not have %s results", map, numDims());
    Preconditions.checkArgument(
        map.numInputs() == operands.size(),
        "%s has %s inputs but %s operands",
        map,
        map.numInputs(),
        operands.size());
  }

  /** Returns the extent of each dimension (upper bound minus lower bound). */
  public AffineValueMap rangesValueMap() {
    return AffineValueMap.difference(upperBoundsValueMap(), lowerBoundsValueMap());
  }

  /** Returns the extent of each dimension if they are all constant. */
  public Optional<long[]> constantRanges() {
    AffineValueMap ranges = rangesValueMap();
    if (!ranges.map().isConstant()) {
      return Optional.empty();
    }
    return Optional.of(ranges.map().constantResults());
  }

  /** True if {@code value} is not defined in this loop nest's body. */
  public boolean isDefinedOutsideOfLoop(Value value) {
    Region region = value.parentRegion();
    return region == null || !region(0).isAncestor(region);
  }

  /** Moves each of {@code ops} to just before this loop nest. */
  public void moveOutOfLoop(List<Operation> ops) {
    for (Operation op : ops) {
      op.moveBefore(this);
    }
  }

  @Override
  public boolean verify() {
    int numDims = region(0).isEmpty() ? -1 : body().numArguments();
    if (numDims != lowerBoundsMap.numResults()
        || numDims != upperBoundsMap.numResults()
        || numDims != steps.length) {
      return emitOpError(
          "region argument count and num results of upper bounds, lower bounds, and steps must"
              + " all match");
    }
    if (reductions.size() != numResults()) {
      return emitOpError("a reduction must be specified for each output");
    }
    if (!AffineLegality.verifyDimAndSymbolIdentifiers(
            this, lowerBoundsOperands(), lowerBoundsMap.numDims())
        || !AffineLegality.verifyDimAndSymbolIdentifiers(
            this, upperBoundsOperands(), upperBoundsMap.numDims())) {
      return false;
    }
    return true;
  }

  /** Composes and canonicalizes both bounds maps with their operands. */
  @Override
  public FoldResult fold() {
    boolean changed = false;
    AffineValueMap lbs = lowerBoundsValueMap();
    if (lbs.canonicalize()) {
      setLowerBounds(lbs.operands(), lbs.map());
      changed = true;
    }
    AffineValueMap ubs = upperBoundsValueMap();
    if (ubs.canonicalize()) {
      setUpperBounds(ubs.operands(), ubs.map());
      changed = true;
    }
    return FoldResult.inPlaceIf(changed);
  }

  @Override
  protected String attributesString() {
    return String.format(
        "lower_bounds = %s, upper_bounds = %s, steps = %s, reductions = %s",
        lowerBoundsMap, upperBoundsMap, Arrays.toString(steps), reductions);
  }
}
