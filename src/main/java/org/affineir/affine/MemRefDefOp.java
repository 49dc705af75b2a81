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
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/**
 * Implemented by operations that define a memref whose dynamic dimension sizes are given by
 * operands (alloc, view, subview). {@link AffineLegality} uses this to decide whether a {@link
 * DimOp} of such a memref is a valid symbol.
 */
public interface MemRefDefOp {

  MemRefType memRefType();

  /** One operand per dynamic dimension of {@link #memRefType}, in dimension order. */
  List<Value> dynamicSizes();
}
