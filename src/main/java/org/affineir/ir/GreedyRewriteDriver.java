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

package org.affineir.ir;

import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Repeatedly folds and applies the canonicalization patterns of every operation nested in a root
 * operation, until a sweep makes no changes or {@link AffineOptions#maxRewriteIterations} sweeps
 * have been made. Operations that have no memory effects and whose results are unused are erased.
 */
public final class GreedyRewriteDriver {

  private static final Logger logger = Logging.getLogger();

  private final IrContext context;
  private final ConstantMaterializer materializer;
  private final Level rewriteLevel;

  public GreedyRewriteDriver(IrContext context, ConstantMaterializer materializer) {
    this.context = context;
    this.materializer = materializer;
    this.rewriteLevel = context.options().verbose() ? Level.INFO : Level.DEBUG;
  }

  /**
   * Rewrites the operations nested in {@code root} (and {@code root} itself, although it is never
   * erased). Returns true if a fixed point was reached.
   */
  public boolean rewrite(Operation root) {
    int maxIterations = context.options().maxRewriteIterations();
    for (int i = 0; i < maxIterations; i++) {
      List<Operation> worklist = new ArrayList<>();
      root.walk(worklist::add);
      boolean changed = false;
      for (Operation op : worklist) {
        if (!op.isErased() && process(op, root)) {
          changed = true;
        }
      }
      if (!changed) {
        return true;
      }
    }
    logger.warn(
        String.format(
            "Rewriting %s did not converge after %s iterations", root.name(), maxIterations));
    return false;
  }

  private boolean process(Operation op, Operation root) {
    if (op != root && isTriviallyDead(op)) {
      log("erasing dead", op);
      op.erase();
      return true;
    }
    FoldResult folded = op.fold();
    switch (folded.outcome) {
      case IN_PLACE:
        log("folded in place", op);
        return true;
      case VALUE:
        if (folded.value() == op.result()) {
          return false;
        }
        log("folded to value", op);
        op.result().replaceAllUsesWith(folded.value());
        op.erase();
        return true;
      case CONSTANT:
        if (op.parentBlock() == null) {
          return false;
        }
        log("folded to constant", op);
        Value constant =
            materializer.materialize(OpBuilder.before(op), folded.constant(), op.result().type());
        op.result().replaceAllUsesWith(constant);
        op.erase();
        return true;
      case FAILURE:
        break;
    }
    if (op.parentBlock() == null) {
      return false;
    }
    for (RewritePattern pattern : op.canonicalizationPatterns()) {
      String before = op.toString();
      if (pattern.matchAndRewrite(op, OpBuilder.before(op))) {
        if (logger.isEnabledFor(rewriteLevel)) {
          logger.log(rewriteLevel, pattern.getClass().getSimpleName() + " rewrote " + before);
        }
        return true;
      }
    }
    return false;
  }

  private void log(String what, Operation op) {
    if (logger.isEnabledFor(rewriteLevel)) {
      logger.log(rewriteLevel, what + ": " + op);
    }
  }

  private static boolean isTriviallyDead(Operation op) {
    return op.hasNoMemoryEffect()
        && op.numRegions() == 0
        && !op.hasTrait(Trait.TERMINATOR)
        && op.resultsUnused();
  }
}
