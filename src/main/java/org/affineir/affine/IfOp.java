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
import java.util.List;
import java.util.Set;
import org.affineir.affine.AffineComposer.WithOperands;
import org.affineir.expr.IntegerSet;
import org.affineir.ir.Block;
import org.affineir.ir.FoldResult;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Region;
import org.affineir.ir.RewritePattern;
import org.affineir.ir.Type;
import org.affineir.ir.Value;
import org.jspecify.annotations.Nullable;

/**
 * Executes its then block if its operands satisfy an IntegerSet, and its else block (if any)
 * otherwise. An IfOp always has two regions; the second is empty if there is no else block.
 */
public final class IfOp extends Operation {

  private static final List<RewritePattern> PATTERNS = List.of(new SimplifyDeadElse());

  private IntegerSet condition;

  private IfOp(
      IrContext context, IntegerSet condition, List<? extends Value> operands, List<Type> types) {
    super(context, OpKind.IF, Set.of(), operands, types, 2);
    this.condition = condition;
  }

  /**
   * Creates a conditional with the given result types, which requires an else block. Blocks are
   * given an operand-free yield only when there are no results.
   */
  public static IfOp create(
      OpBuilder builder,
      List<Type> resultTypes,
      IntegerSet condition,
      List<? extends Value> operands,
      boolean withElse) {
    checkCondition(condition, operands);
    Preconditions.checkArgument(
        withElse || resultTypes.isEmpty(), "a conditional with results needs an else block");
    IfOp result = builder.insert(new IfOp(builder.context(), condition, operands, resultTypes));
    result.region(0).addBlock();
    if (withElse) {
      result.region(1).addBlock();
    }
    if (resultTypes.isEmpty()) {
      YieldOp.ensureTerminator(result.region(0), builder.context());
      if (withElse) {
        YieldOp.ensureTerminator(result.region(1), builder.context());
      }
    }
    return result;
  }

  public static IfOp create(
      OpBuilder builder, IntegerSet condition, List<? extends Value> operands, boolean withElse) {
    return create(builder, List.of(), condition, operands, withElse);
  }

  private static void checkCondition(IntegerSet condition, List<? extends Value> operands) {
    Preconditions.checkArgument(
        condition.numInputs() == operands.size(),
        "%s has %s inputs but %s operands",
        condition,
        condition.numInputs(),
        operands.size());
  }

  public IntegerSet condition() {
    return condition;
  }

  /** Replaces the condition with one that has the same inputs. */
  public void setIntegerSet(IntegerSet set) {
    checkCondition(set, operands());
    condition = set;
  }

  public void setConditional(IntegerSet set, List<? extends Value> operands) {
    checkCondition(set, operands);
    condition = set;
    setOperands(operands);
  }

  public Block thenBlock() {
    return region(0).front();
  }

  public boolean hasElse() {
    return !region(1).isEmpty();
  }

  public @Nullable Block elseBlock() {
    return hasElse() ? region(1).front() : null;
  }

  public Region elseRegion() {
    return region(1);
  }

  @Override
  public boolean verify() {
    if (numOperands() != condition.numInputs()) {
      return emitOpError(
          "operand count and condition integer set dimension and symbol count must match");
    }
    if (!AffineLegality.verifyDimAndSymbolIdentifiers(this, operands(), condition.numDims())) {
      return false;
    }
    if (numResults() != 0 && !hasElse()) {
      return emitOpError("must have an else block if defining values");
    }
    return true;
  }

  /**
   * Canonicalizes the condition and its operands, keeping the result only if it has fewer
   * operands, or as many operands and more of them bound to symbols.
   */
  @Override
  public FoldResult fold() {
    WithOperands<IntegerSet> canonical =
        AffineComposer.canonicalizeSetAndOperands(condition, operands());
    IntegerSet set = canonical.structure();
    int newCount = canonical.operands().size();
    boolean better =
        newCount < numOperands()
            || (newCount == numOperands() && set.numSymbols() > condition.numSymbols());
    if (!better) {
      return FoldResult.FAILURE;
    }
    setConditional(set, canonical.operands());
    return FoldResult.IN_PLACE;
  }

  @Override
  public List<RewritePattern> canonicalizationPatterns() {
    return PATTERNS;
  }

  /** Removes an else block that contains only an operand-free yield. */
  private static class SimplifyDeadElse implements RewritePattern {
    @Override
    public boolean matchAndRewrite(Operation op, OpBuilder builder) {
      IfOp ifOp = (IfOp) op;
      Block elseBlock = ifOp.elseBlock();
      if (elseBlock == null || !elseBlock.hasOnlyTerminator() || ifOp.numResults() != 0) {
        return false;
      }
      ifOp.elseRegion().eraseBlock(elseBlock);
      return true;
    }
  }

  @Override
  protected String attributesString() {
    return "condition = " + condition;
  }
}
