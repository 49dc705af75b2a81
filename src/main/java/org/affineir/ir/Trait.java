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

/** Structural properties that an Operation may declare. */
public enum Trait {
  /**
   * The operation's regions start a new affine scope: values defined at the top level of such a
   * region may be used as symbols by affine operations nested within it.
   */
  SCOPE,

  /** Operations nested in the operation's regions may not refer to values defined outside it. */
  ISOLATED_FROM_ABOVE,

  /** The operation must be the last operation of its block. */
  TERMINATOR,

  /** The operation has no operands and always produces the same value. */
  CONSTANT_LIKE,

  /** The operation does not access memory, so it may be removed if its results are unused. */
  NO_MEMORY_EFFECT
}
