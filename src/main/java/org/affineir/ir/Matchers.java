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

import java.util.OptionalLong;
import org.jspecify.annotations.Nullable;

/** A static-only class with predicates over Values. */
public class Matchers {

  private Matchers() {}

  /** If {@code value} is produced by a constant-like operation, returns its value. */
  public static OptionalLong constantValue(Value value) {
    Operation def = value.definingOp();
    if (def instanceof ConstantLike c && def.hasTrait(Trait.CONSTANT_LIKE)) {
      return OptionalLong.of(c.value());
    }
    return OptionalLong.empty();
  }

  /** Returns the constant value of {@code value}, or null if it is not a constant. */
  public static @Nullable Long constantOrNull(Value value) {
    OptionalLong c = constantValue(value);
    return c.isPresent() ? c.getAsLong() : null;
  }

  public static boolean isConstant(Value value) {
    return constantValue(value).isPresent();
  }

  /** True if {@code value} is a constant equal to {@code expected}. */
  public static boolean isConstant(Value value, long expected) {
    OptionalLong c = constantValue(value);
    return c.isPresent() && c.getAsLong() == expected;
  }
}
