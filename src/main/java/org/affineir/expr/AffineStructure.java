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

package org.affineir.expr;

import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Implemented by {@link AffineMap} and {@link IntegerSet}: a list of AffineExprs over a declared
 * number of dimensions and symbols. Code that rewrites the inputs of either (e.g. operand
 * canonicalization) is written once against this interface.
 */
public interface AffineStructure<T extends AffineStructure<T>> {

  AffineExprContext context();

  int numDims();

  int numSymbols();

  default int numInputs() {
    return numDims() + numSymbols();
  }

  /** Calls {@code visitor} on every node of every expression. */
  void walkExprs(Consumer<AffineExpr> visitor);

  /**
   * Returns a new instance with {@code newNumDims} dimensions and {@code newNumSymbols} symbols,
   * whose expressions are those of this one after {@link AffineExpr#replaceDimsAndSymbols}.
   */
  T replaceDimsAndSymbols(
      @Nullable AffineExpr[] dimReplacements,
      @Nullable AffineExpr[] symbolReplacements,
      int newNumDims,
      int newNumSymbols);

  /** Returns a new instance with each expression simplified. */
  T simplify();
}
