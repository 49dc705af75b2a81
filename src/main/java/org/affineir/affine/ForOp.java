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
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import org.affineir.affine.AffineComposer.WithOperands;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.ir.Block;
import org.affineir.ir.BlockArgument;
import org.affineir.ir.FoldResult;
import org.affineir.ir.IrContext;
import org.affineir.ir.Logging;
import org.affineir.ir.Matchers;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Region;
import org.affineir.ir.RewritePattern;
import org.affineir.ir.Type;
import org.affineir.ir.Value;
import org.affineir.util.MathUtil;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A loop whose induction variable runs from a lower bound up to (but not including) an upper
 * bound by a positive constant step. Each bound is an AffineMap with one or more results applied
 * to some of the loop's operands; the lower bound is the maximum of its map's results and the
 * upper bound is the minimum of its map's results.
 *
 * <p>The operands are the lower bound operands, then the upper bound operands, then the initial
 * values of any loop-carried variables. The body is a single block whose arguments are the
 * induction variable followed by the loop-carried variables; its yield provides the next values
 * of the loop-carried variables, and their final values are the loop's results.
 */
public final class ForOp extends Operation {

  private static final Logger logger = Logging.getLogger();

  private static final List<RewritePattern> PATTERNS =
      List.of(new EmptyLoopFolder(), new StrideNormalizer());

  /** Fills in the body of a newly-created loop. */
  @FunctionalInterface
  public interface BodyBuilder {
    /**
     * Called with {@code builder} positioned at the start of the loop body; {@code iterArgs} are
     * the body arguments for the loop-carried variables.
     */
    void build(OpBuilder builder, Value inductionVar, List<Value> iterArgs);
  }

  private AffineMap lowerBoundMap;
  private AffineMap upperBoundMap;
  private long step;

  private ForOp(
      IrContext context,
      AffineMap lowerBoundMap,
      AffineMap upperBoundMap,
      long step,
      List<Value> operands,
      List<Type> resultTypes) {
    super(context, OpKind.FOR, Set.of(), operands, resultTypes, 1);
    this.lowerBoundMap = lowerBoundMap;
    this.upperBoundMap = upperBoundMap;
    this.step = step;
  }

  /**
   * Creates a loop. If {@code bodyBuilder} is null the body is empty, and if there are no
   * loop-carried variables it is given an operand-free yield; with loop-carried variables the
   * caller must add the yield.
   */
  public static ForOp create(
      OpBuilder builder,
      AffineMap lbMap,
      List<? extends Value> lbOperands,
      AffineMap ubMap,
      List<? extends Value> ubOperands,
      long step,
      List<? extends Value> iterArgs,
      @Nullable BodyBuilder bodyBuilder) {
    checkBound(lbMap, lbOperands);
    checkBound(ubMap, ubOperands);
    Preconditions.checkArgument(step > 0, "step must be positive, not %s", step);
    List<Value> operands = new ArrayList<>(lbOperands);
    operands.addAll(ubOperands);
    operands.addAll(iterArgs);
    List<Type> resultTypes = new ArrayList<>();
    iterArgs.forEach(v -> resultTypes.add(v.type()));
    ForOp result =
        builder.insert(
            new ForOp(builder.context(), lbMap, ubMap, step, operands, resultTypes));
    Region region = result.region(0);
    Block body = region.addBlock();
    body.addArgument(Type.INDEX);
    resultTypes.forEach(body::addArgument);
    if (bodyBuilder != null) {
      OpBuilder bodyOps = OpBuilder.atBlockBegin(body);
      bodyBuilder.build(bodyOps, result.inductionVar(), result.regionIterArgs());
    }
    if (iterArgs.isEmpty()) {
      YieldOp.ensureTerminator(region, builder.context());
    }
    return result;
  }

  public static ForOp create(
      OpBuilder builder,
      AffineMap lbMap,
      List<? extends Value> lbOperands,
      AffineMap ubMap,
      List<? extends Value> ubOperands,
      long step) {
    return create(builder, lbMap, lbOperands, ubMap, ubOperands, step, List.of(), null);
  }

  /** Creates a loop with constant bounds. */
  public static ForOp create(
      OpBuilder builder,
      long lb,
      long ub,
      long step,
      List<? extends Value> iterArgs,
      @Nullable BodyBuilder bodyBuilder) {
    AffineExprContext exprs = builder.exprs();
    return create(
        builder,
        AffineMap.constant(exprs, lb),
        List.of(),
        AffineMap.constant(exprs, ub),
        List.of(),
        step,
        iterArgs,
        bodyBuilder);
  }

  public static ForOp create(OpBuilder builder, long lb, long ub, long step) {
    return create(builder, lb, ub, step, List.of(), null);
  }

  private static void checkBound(AffineMap map, List<? extends Value> operands) {
    Preconditions.checkArgument(
        map.numInputs() == operands.size(),
        "bound operand count does not match %s",
        map);
    Preconditions.checkArgument(map.numResults() >= 1, "bound map has no results");
  }

  public Block body() {
    return region(0).front();
  }

  public BlockArgument inductionVar() {
    return body().argument(0);
  }

  /** The body arguments holding the current values of the loop-carried variables. */
  public List<Value> regionIterArgs() {
    List<BlockArgument> args = body().arguments();
    return new ArrayList<>(args.subList(1, args.size()));
  }

  public long step() {
    return step;
  }

  public void setStep(long step) {
    Preconditions.checkArgument(step > 0, "step must be positive, not %s", step);
    this.step = step;
  }

  public AffineMap lowerBoundMap() {
    return lowerBoundMap;
  }

  public AffineMap upperBoundMap() {
    return upperBoundMap;
  }

  public List<Value> lowerBoundOperands() {
    return operands().subList(0, lowerBoundMap.numInputs());
  }

  public List<Value> upperBoundOperands() {
    int start = lowerBoundMap.numInputs();
    return operands().subList(start, start + upperBoundMap.numInputs());
  }

  /** The initial values of the loop-carried variables. */
  public List<Value> iterOperands() {
    int start = lowerBoundMap.numInputs() + upperBoundMap.numInputs();
    return operands().subList(start, numOperands());
  }

  public int numIterOperands() {
    return iterOperands().size();
  }

  public AffineValueMap lowerBoundValueMap() {
    return new AffineValueMap(lowerBoundMap, lowerBoundOperands());
  }

  public AffineValueMap upperBoundValueMap() {
    return new AffineValueMap(upperBoundMap, upperBoundOperands());
  }

  public void setLowerBound(List<? extends Value> operands, AffineMap map) {
    checkBound(map, operands);
    setOperands(0, lowerBoundMap.numInputs(), operands);
    lowerBoundMap = map;
  }

  public void setUpperBound(List<? extends Value> operands, AffineMap map) {
    checkBound(map, operands);
    setOperands(lowerBoundMap.numInputs(), upperBoundMap.numInputs(), operands);
    upperBoundMap = map;
  }

  /** Replaces the lower bound map with one that has the same inputs. */
  public void setLowerBoundMap(AffineMap map) {
    Preconditions.checkArgument(
        map.numDims() == lowerBoundMap.numDims()
            && map.numSymbols() == lowerBoundMap.numSymbols(),
        "%s does not have the same inputs as %s",
        map,
        lowerBoundMap);
    checkBound(map, lowerBoundOperands());
    lowerBoundMap = map;
  }

  /** Replaces the upper bound map with one that has the same inputs. */
  public void setUpperBoundMap(AffineMap map) {
    Preconditions.checkArgument(
        map.numDims() == upperBoundMap.numDims()
            && map.numSymbols() == upperBoundMap.numSymbols(),
        "%s does not have the same inputs as %s",
        map,
        upperBoundMap);
    checkBound(map, upperBoundOperands());
    upperBoundMap = map;
  }

  public boolean hasConstantLowerBound() {
    return lowerBoundMap.isSingleConstant();
  }

  public boolean hasConstantUpperBound() {
    return upperBoundMap.isSingleConstant();
  }

  public boolean hasConstantBounds() {
    return hasConstantLowerBound() && hasConstantUpperBound();
  }

  public long constantLowerBound() {
    return lowerBoundMap.singleConstantResult();
  }

  public long constantUpperBound() {
    return upperBoundMap.singleConstantResult();
  }

  public void setConstantLowerBound(long value) {
    setLowerBound(List.of(), AffineMap.constant(lowerBoundMap.context(), value));
  }

  public void setConstantUpperBound(long value) {
    setUpperBound(List.of(), AffineMap.constant(upperBoundMap.context(), value));
  }

  /** True if both bounds have the same inputs and they are bound to the same operands. */
  public boolean matchingBoundOperandList() {
    if (lowerBoundMap.numDims() != upperBoundMap.numDims()
        || lowerBoundMap.numSymbols() != upperBoundMap.numSymbols()) {
      return false;
    }
    List<Value> lbOperands = lowerBoundOperands();
    List<Value> ubOperands = upperBoundOperands();
    for (int i = 0; i < lbOperands.size(); i++) {
      if (lbOperands.get(i) != ubOperands.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** True if {@code value} is not defined in this loop's body. */
  public boolean isDefinedOutsideOfLoop(Value value) {
    Region region = value.parentRegion();
    return region == null || !region(0).isAncestor(region);
  }

  /** Moves each of {@code ops} to just before this loop. */
  public void moveOutOfLoop(List<Operation> ops) {
    for (Operation op : ops) {
      op.moveBefore(this);
    }
  }

  /** Returns the loop whose induction variable is {@code value}, or null. */
  public static @Nullable ForOp forInductionVarOwner(Value value) {
    if (value instanceof BlockArgument arg
        && arg.index == 0
        && arg.owner.parentOp() instanceof ForOp loop) {
      return loop;
    }
    return null;
  }

  public static boolean isForInductionVar(Value value) {
    return forInductionVarOwner(value) != null;
  }

  public static List<Value> inductionVars(List<ForOp> loops) {
    List<Value> result = new ArrayList<>(loops.size());
    loops.forEach(loop -> result.add(loop.inductionVar()));
    return result;
  }

  @Override
  public boolean verify() {
    Block body = region(0).isEmpty() ? null : body();
    if (body == null || body.numArguments() == 0 || !body.argument(0).type().isIndex()) {
      return emitOpError(
          "expected body to have a single index argument for the induction variable");
    }
    if (lowerBoundMap.numInputs() > 0
        && !AffineLegality.verifyDimAndSymbolIdentifiers(
            this, lowerBoundOperands(), lowerBoundMap.numDims())) {
      return false;
    }
    if (upperBoundMap.numInputs() > 0
        && !AffineLegality.verifyDimAndSymbolIdentifiers(
            this, upperBoundOperands(), upperBoundMap.numDims())) {
      return false;
    }
    if (numResults() == 0) {
      return true;
    } else if (numIterOperands() != numResults()) {
      return emitOpError("mismatch between the number of loop-carried values and results");
    } else if (body.numArguments() - 1 != numResults()) {
      return emitOpError("mismatch between the number of basic block args and results");
    }
    return true;
  }

  /**
   * Replaces bounds whose operands are all constants by single constant results, then
   * canonicalizes both bounds and drops duplicate results.
   */
  @Override
  public FoldResult fold() {
    boolean folded = foldConstantBounds();
    if (canonicalizeBounds()) {
      folded = true;
    }
    return FoldResult.inPlaceIf(folded);
  }

  private boolean foldConstantBounds() {
    boolean folded = false;
    if (!hasConstantLowerBound()) {
      AffineMap map = foldBound(lowerBoundMap, lowerBoundOperands());
      if (map.isConstant()) {
        long max = Long.MIN_VALUE;
        for (long v : map.constantResults()) {
          max = Math.max(max, v);
        }
        setConstantLowerBound(max);
        folded = true;
      }
    }
    if (!hasConstantUpperBound()) {
      AffineMap map = foldBound(upperBoundMap, upperBoundOperands());
      if (map.isConstant()) {
        long min = Long.MAX_VALUE;
        for (long v : map.constantResults()) {
          min = Math.min(min, v);
        }
        setConstantUpperBound(min);
        folded = true;
      }
    }
    return folded;
  }

  private static AffineMap foldBound(AffineMap map, List<Value> operands) {
    List<@Nullable Long> constants = new ArrayList<>();
    operands.forEach(v -> constants.add(Matchers.constantOrNull(v)));
    return map.partialConstantFold(constants);
  }

  private boolean canonicalizeBounds() {
    WithOperands<AffineMap> lb =
        AffineComposer.canonicalizeMapAndOperands(lowerBoundMap, lowerBoundOperands());
    WithOperands<AffineMap> ub =
        AffineComposer.canonicalizeMapAndOperands(upperBoundMap, upperBoundOperands());
    AffineMap lbMap = lb.structure().dropDuplicateResults();
    AffineMap ubMap = ub.structure().dropDuplicateResults();
    boolean lbChanged =
        !lbMap.equals(lowerBoundMap) || !lb.operands().equals(lowerBoundOperands());
    boolean ubChanged =
        !ubMap.equals(upperBoundMap) || !ub.operands().equals(upperBoundOperands());
    if (lbChanged) {
      setLowerBound(lb.operands(), lbMap);
    }
    if (ubChanged) {
      setUpperBound(ub.operands(), ubMap);
    }
    return lbChanged || ubChanged;
  }

  @Override
  public List<RewritePattern> canonicalizationPatterns() {
    return PATTERNS;
  }

  /**
   * Erases a loop whose body contains only its yield. Each result must then be the corresponding
   * initial value, which requires the yield to pass each loop-carried variable through unchanged.
   */
  private static class EmptyLoopFolder implements RewritePattern {
    @Override
    public boolean matchAndRewrite(Operation op, OpBuilder builder) {
      ForOp loop = (ForOp) op;
      Block body = loop.body();
      if (!body.hasOnlyTerminator()) {
        return false;
      }
      Operation yield = body.terminator();
      List<Value> iterArgs = loop.regionIterArgs();
      for (int i = 0; i < loop.numResults(); i++) {
        if (yield.operand(i) != iterArgs.get(i)) {
          return false;
        }
      }
      List<Value> inits = loop.iterOperands();
      for (int i = 0; i < loop.numResults(); i++) {
        loop.result(i).replaceAllUsesWith(inits.get(i));
      }
      loop.erase();
      return true;
    }
  }

  /**
   * Rewrites a loop with constant bounds and a non-unit step to count from zero by one, and
   * recomputes the original induction variable from the new one at the start of the body.
   */
  private static class StrideNormalizer implements RewritePattern {
    @Override
    public boolean matchAndRewrite(Operation op, OpBuilder builder) {
      ForOp loop = (ForOp) op;
      long step = loop.step;
      if (step == 1 || !loop.hasConstantBounds()) {
        return false;
      }
      long lb = loop.constantLowerBound();
      long ub = loop.constantUpperBound();
      OptionalLong span = MathUtil.checkedSubtract(ub, lb);
      if (span.isEmpty()) {
        // The rescaled bounds would not be representable
        return false;
      }
      long tripCount = Math.max(0, MathUtil.ceilDiv(span.getAsLong(), step));
      if (logger.isDebugEnabled()) {
        logger.debug(
            String.format(
                "Normalizing loop %s..%s step %s to 0..%s step 1", lb, ub, step, tripCount));
      }
      loop.setStep(1);
      loop.setConstantLowerBound(0);
      loop.setConstantUpperBound(tripCount);
      AffineExprContext exprs = builder.exprs();
      AffineMap scale = AffineMap.get(exprs, 1, 0, exprs.dim(0).times(step).plus(lb));
      BlockArgument iv = loop.inductionVar();
      ApplyOp original = ApplyOp.create(OpBuilder.atBlockBegin(loop.body()), scale, iv);
      iv.replaceAllUsesExcept(original.result(), Set.of(original));
      return true;
    }
  }

  @Override
  protected String attributesString() {
    return String.format(
        "lower_bound = %s, upper_bound = %s, step = %s", lowerBoundMap, upperBoundMap, step);
  }
}
