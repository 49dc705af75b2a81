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

package org.affineir.util;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import java.math.RoundingMode;
import java.util.OptionalLong;

/**
 * A static-only class with the integer arithmetic used by affine expressions. All divisions round
 * towards negative infinity (floor) or positive infinity (ceiling), never towards zero, and the
 * modulo is always non-negative for a positive divisor. Results that do not fit in a long are
 * reported rather than wrapped.
 */
public class MathUtil {

  private MathUtil() {}

  /** Returns {@code floor(lhs / rhs)}; {@code rhs} must be non-zero. */
  public static long floorDiv(long lhs, long rhs) {
    Preconditions.checkArgument(rhs != 0, "division by zero");
    return LongMath.divide(lhs, rhs, RoundingMode.FLOOR);
  }

  /** Returns {@code ceil(lhs / rhs)}; {@code rhs} must be non-zero. */
  public static long ceilDiv(long lhs, long rhs) {
    Preconditions.checkArgument(rhs != 0, "division by zero");
    return LongMath.divide(lhs, rhs, RoundingMode.CEILING);
  }

  /**
   * Returns {@code lhs - rhs * floor(lhs / rhs)}, i.e. a result in {@code [0, rhs)} when {@code
   * rhs} is positive.
   */
  public static long mod(long lhs, long rhs) {
    Preconditions.checkArgument(rhs != 0, "modulo by zero");
    return Math.floorMod(lhs, rhs);
  }

  /** Returns {@code lhs - rhs}, or empty if the difference does not fit in a long. */
  public static OptionalLong checkedSubtract(long lhs, long rhs) {
    try {
      return OptionalLong.of(LongMath.checkedSubtract(lhs, rhs));
    } catch (ArithmeticException e) {
      return OptionalLong.empty();
    }
  }

  /**
   * Returns the greatest common divisor of the absolute values of {@code a} and {@code b}.
   *
   * @throws ArithmeticException if the result is 2^63 (one argument is {@code Long.MIN_VALUE} and
   *     the other is zero or also {@code Long.MIN_VALUE})
   */
  public static long gcd(long a, long b) {
    if (a == Long.MIN_VALUE || b == Long.MIN_VALUE) {
      // |MIN_VALUE| is 2^63, so only the other argument's power-of-two factor is shared
      long other = (a == Long.MIN_VALUE) ? b : a;
      if (other == 0 || other == Long.MIN_VALUE) {
        throw new ArithmeticException("gcd(" + a + ", " + b + ") overflows");
      }
      return Long.lowestOneBit(other);
    }
    return LongMath.gcd(Math.abs(a), Math.abs(b));
  }
}
