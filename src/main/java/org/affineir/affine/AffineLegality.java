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
import org.affineir.ir.BlockArgument;
import org.affineir.ir.Matchers;
import org.affineir.ir.Operation;
import org.affineir.ir.Region;
import org.affineir.ir.Trait;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;
import org.jspecify.annotations.Nullable;

/**
 * A static-only class that decides whether a Value may be bound to a dimension or a symbol
 * position of an affine map or integer set.
 *
 * <p>Symbols are values that are fixed throughout the execution of an affine scope (the region of
 * an operation with {@link Trait#SCOPE}, such as a function): values defined at the top level of
 * the scope, constants, the sizes of memrefs defined with symbolic sizes, and affine.apply results
 * computed only from symbols. Dimensions are symbols plus loop induction variables and
 * affine.apply results computed from dimensions.
 *
 * <p>All of these predicates require the value to have index type.
 */
public class AffineLegality {

  private AffineLegality() {}

  /**
   * True if {@code value} is an argument of {@code region}'s block or is defined by an operation
   * directly in {@code region}.
   */
  public static boolean isTopLevelValue(Value value, Region region) {
    return value.parentRegion() == region;
  }

  /**
   * True if {@code value} is an argument of, or is defined directly in, a region of an operation
   * with {@link Trait#SCOPE}. Values in detached blocks are conservatively not top-level.
   */
  public static boolean isTopLevelValue(Value value) {
    Operation parentOp =
        (value instanceof BlockArgument arg) ? arg.owner.parentOp() : definingParentOp(value);
    return parentOp != null && parentOp.hasTrait(Trait.SCOPE);
  }

  private static @Nullable Operation definingParentOp(Value value) {
    Operation def = value.definingOp();
    return (def == null) ? null : def.parentOp();
  }

  /**
   * Returns the region directly enclosing {@code op} (or one of its ancestors) that belongs to an
   * operation with {@link Trait#SCOPE}, or null if there is none.
   */
  public static @Nullable Region affineScope(Operation op) {
    Operation current = op;
    for (Operation parent = current.parentOp(); parent != null; parent = current.parentOp()) {
      if (parent.hasTrait(Trait.SCOPE)) {
        return current.parentRegion();
      }
      current = parent;
    }
    return null;
  }

  /** True if {@code value} is a valid dimension wherever it is used. */
  public static boolean isValidDim(Value value) {
    if (!value.type().isIndex()) {
      return false;
    }
    Operation def = value.definingOp();
    if (def != null) {
      return isValidDim(value, affineScope(def));
    }
    BlockArgument arg = (BlockArgument) value;
    Operation parentOp = arg.owner.parentOp();
    return parentOp != null && (parentOp.hasTrait(Trait.SCOPE) || isInductionVar(arg));
  }

  /**
   * True if {@code value} is a valid dimension for uses in {@code scope}. A null scope accepts only
   * values that are valid regardless of the surrounding structure.
   */
  public static boolean isValidDim(Value value, @Nullable Region scope) {
    if (!value.type().isIndex()) {
      return false;
    }
    if (isValidSymbol(value, scope)) {
      return true;
    }
    Operation def = value.definingOp();
    if (def == null) {
      return isInductionVar((BlockArgument) value);
    } else if (def instanceof ApplyOp apply) {
      return apply.operands().stream().allMatch(v -> isValidDim(v, scope));
    } else if (def instanceof DimOp dim) {
      return isTopLevelValue(dim.source());
    }
    return false;
  }

  /** True if {@code value} is a valid symbol wherever it is used. */
  public static boolean isValidSymbol(Value value) {
    if (!value.type().isIndex()) {
      return false;
    }
    if (isTopLevelValue(value)) {
      return true;
    }
    Operation def = value.definingOp();
    return def != null && isValidSymbol(value, affineScope(def));
  }

  /**
   * True if {@code value} is a valid symbol for uses in {@code scope}: it is a constant, an
   * affine.apply of symbols, a size of a memref with symbolic sizes, defined at the top level of
   * {@code scope}, or (unless {@code scope}'s owner is isolated from above) a valid symbol of the
   * enclosing region. A null scope accepts only the first three.
   */
  public static boolean isValidSymbol(Value value, @Nullable Region scope) {
    if (!value.type().isIndex()) {
      return false;
    }
    if (scope != null && isTopLevelValue(value, scope)) {
      return true;
    }
    Operation def = value.definingOp();
    if (def != null) {
      if (Matchers.isConstant(value)) {
        return true;
      } else if (def instanceof ApplyOp apply) {
        return apply.operands().stream().allMatch(v -> isValidSymbol(v, scope));
      } else if (def instanceof DimOp dim) {
        return isDimOpValidSymbol(dim, scope);
      }
    }
    // A value defined outside the scope's owner is a valid symbol if it is one there
    Operation scopeOp = (scope == null) ? null : scope.parentOp();
    if (scopeOp != null && !scopeOp.hasTrait(Trait.ISOLATED_FROM_ABOVE)) {
      Region enclosing = scopeOp.parentRegion();
      if (enclosing != null) {
        return isValidSymbol(value, enclosing);
      }
    }
    return false;
  }

  /** True if {@code value} may be used as a subscript of an affine memory access. */
  public static boolean isValidAffineIndexOperand(Value value, @Nullable Region scope) {
    return isValidDim(value, scope) || isValidSymbol(value, scope);
  }

  /**
   * Checks that the first {@code numDims} of {@code operands} are valid dimensions and the rest are
   * valid symbols, in the affine scope of {@code op}; reports the first failure on {@code op}.
   */
  public static boolean verifyDimAndSymbolIdentifiers(
      Operation op, List<Value> operands, int numDims) {
    Region scope = affineScope(op);
    for (int i = 0; i < operands.size(); i++) {
      if (i < numDims) {
        if (!isValidDim(operands.get(i), scope)) {
          return op.emitOpError("operand cannot be used as a dimension id");
        }
      } else if (!isValidSymbol(operands.get(i), scope)) {
        return op.emitOpError("operand cannot be used as a symbol");
      }
    }
    return true;
  }

  /** True for the induction variables of for and parallel loops. */
  static boolean isInductionVar(BlockArgument arg) {
    Operation parentOp = arg.owner.parentOp();
    if (parentOp instanceof ForOp) {
      return arg.index == 0;
    }
    return parentOp instanceof ParallelOp;
  }

  private static boolean isDimOpValidSymbol(DimOp dim, @Nullable Region scope) {
    Value source = dim.source();
    if (isTopLevelValue(source)) {
      return true;
    }
    // Other block arguments (e.g. loop-carried memrefs) are conservatively not symbols
    if (source instanceof BlockArgument) {
      return false;
    }
    return (source.definingOp() instanceof MemRefDefOp def)
        && isMemRefSizeValidSymbol(def, dim.index(), scope);
  }

  /**
   * True if dimension {@code index} of the memref defined by {@code def} is static, or its dynamic
   * size is a valid symbol in {@code scope}.
   */
  private static boolean isMemRefSizeValidSymbol(
      MemRefDefOp def, int index, @Nullable Region scope) {
    MemRefType type = def.memRefType();
    if (!type.isDynamicDim(index)) {
      return true;
    }
    return isValidSymbol(def.dynamicSizes().get(type.dynamicDimIndex(index)), scope);
  }
}
