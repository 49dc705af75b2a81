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
import org.affineir.expr.AffineMap;
import org.affineir.ir.Value;

/**
 * Implemented by operations that hold a single AffineMap applied to a contiguous run of their
 * operands (apply, min, max, and the memory accesses).
 */
public interface AffineMapUser {

  AffineMap map();

  /** The operands bound to the map's inputs, dimensions first. */
  List<Value> mapOperands();

  /**
   * Replaces the map and its operands; {@code operands.size()} must equal {@code
   * map.numInputs()}.
   */
  void setMap(AffineMap map, List<? extends Value> operands);
}
