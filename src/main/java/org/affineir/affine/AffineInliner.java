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

import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import org.affineir.expr.AffineMap;
import org.affineir.ir.BlockArgument;
import org.affineir.ir.Matchers;
import org.affineir.ir.Operation;
import org.affineir.ir.Region;
import org.affineir.ir.Trait;
import org.affineir.ir.Value;

/**
 * Decides whether code may be inlined into or out of affine constructs without breaking the rules
 * for which values may be used as dimensions and symbols.
 */
public class AffineInliner {

  private AffineInliner() {}

  /**
   * True if the single-block region {@code src} may be inlined into {@code dest}, a region of a
   * for, parallel or if operation. {@code mapping} gives the value that will replace each argument
   * of {@code src}.
   */
  public static boolean isLegalToInline(Region dest, Region src, Map<Value, Value> mapping) {
    Operation destOp = dest.parentOp();
    if (!isAffineConstruct(destOp) || !src.hasOneBlock()) {
      return false;
    }
    for (Operation op : src.front().operations()) {
      if (op.hasNoMemoryEffect()) {
        continue;
      }
      boolean remainsValid;
      if (op instanceof ApplyOp apply) {
        remainsValid = remainsLegal(apply, src, dest, mapping);
      } else if (op instanceof AffineAccessOp access) {
        remainsValid = remainsLegal(access.map(), access.mapOperands(), src, dest, mapping);
      } else {
        // Nothing is known about other operations with memory effects
        remainsValid = false;
      }
      if (!remainsValid) {
        return false;
      }
    }
    return true;
  }

  /** True if {@code op} may be inlined into {@code region}. */
  public static boolean isLegalToInline(Operation op, Region region) {
    Operation parentOp = region.parentOp();
    return parentOp.hasTrait(Trait.SCOPE) || isAffineConstruct(parentOp);
  }

  private static boolean isAffineConstruct(Operation op) {
    return op instanceof ForOp || op instanceof ParallelOp || op instanceof IfOp;
  }

  private static boolean remainsLegal(
      ApplyOp apply, Region src, Region dest, Map<Value, Value> mapping) {
    BiPredicate<Value, Region> check =
        AffineLegality.isValidDim(apply.result(), src)
            ? AffineLegality::isValidDim
            : AffineLegality::isValidSymbol;
    return allRemainLegal(apply.operands(), src, dest, mapping, check);
  }

  private static boolean remainsLegal(
      AffineMap map, List<Value> operands, Region src, Region dest, Map<Value, Value> mapping) {
    int numDims = map.numDims();
    return allRemainLegal(
            operands.subList(0, numDims), src, dest, mapping, AffineLegality::isValidDim)
        && allRemainLegal(
            operands.subList(numDims, operands.size()),
            src,
            dest,
            mapping,
            AffineLegality::isValidSymbol);
  }

  private static boolean allRemainLegal(
      List<Value> values,
      Region src,
      Region dest,
      Map<Value, Value> mapping,
      BiPredicate<Value, Region> check) {
    for (Value value : values) {
      if (!remainsLegal(value, src, dest, mapping, check)) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if {@code value}, a legal dimension or symbol in {@code src}, remains legal once its user
   * is inlined into {@code dest}.
   */
  private static boolean remainsLegal(
      Value value,
      Region src,
      Region dest,
      Map<Value, Value> mapping,
      BiPredicate<Value, Region> check) {
    // Values that are legal for any other reason than being top-level are inlined along with
    // whatever makes them legal
    if (!AffineLegality.isTopLevelValue(value, src)) {
      return true;
    }
    if (value instanceof BlockArgument) {
      Value replacement = mapping.get(value);
      return replacement != null && check.test(replacement, dest);
    }
    // Constants and dims are legal anywhere
    return Matchers.isConstant(value) || value.definingOp() instanceof DimOp;
  }
}
