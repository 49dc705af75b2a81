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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.OptionalLong;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class MathUtilTest {

  @Test
  @Parameters({
    "7, 2, 3, 4, 1",
    "-7, 2, -4, -3, 1",
    "6, 3, 2, 2, 0",
    "-6, 3, -2, -2, 0",
    "0, 5, 0, 0, 0",
    "-1, 4, -1, 0, 3"
  })
  public void divisionRounding(long lhs, long rhs, long floor, long ceil, long mod) {
    assertThat(MathUtil.floorDiv(lhs, rhs)).isEqualTo(floor);
    assertThat(MathUtil.ceilDiv(lhs, rhs)).isEqualTo(ceil);
    assertThat(MathUtil.mod(lhs, rhs)).isEqualTo(mod);
  }

  @Test
  public void divisionByZero() {
    assertThrows(IllegalArgumentException.class, () -> MathUtil.floorDiv(1, 0));
    assertThrows(IllegalArgumentException.class, () -> MathUtil.ceilDiv(1, 0));
    assertThrows(IllegalArgumentException.class, () -> MathUtil.mod(1, 0));
  }

  @Test
  @Parameters({"12, 18, 6", "-12, 18, 6", "0, 7, 7", "0, 0, 0", "5, 3, 1"})
  public void gcd(long a, long b, long expected) {
    assertThat(MathUtil.gcd(a, b)).isEqualTo(expected);
  }

  @Test
  public void gcdWithMinValue() {
    assertThat(MathUtil.gcd(Long.MIN_VALUE, 12)).isEqualTo(4);
    assertThat(MathUtil.gcd(-24, Long.MIN_VALUE)).isEqualTo(8);
    assertThat(MathUtil.gcd(Long.MIN_VALUE, 1L << 62)).isEqualTo(1L << 62);
    assertThrows(ArithmeticException.class, () -> MathUtil.gcd(Long.MIN_VALUE, 0));
    assertThrows(ArithmeticException.class, () -> MathUtil.gcd(Long.MIN_VALUE, Long.MIN_VALUE));
  }

  @Test
  public void checkedSubtract() {
    assertThat(MathUtil.checkedSubtract(10, 3)).isEqualTo(OptionalLong.of(7));
    assertThat(MathUtil.checkedSubtract(Long.MAX_VALUE, 0))
        .isEqualTo(OptionalLong.of(Long.MAX_VALUE));
    assertThat(MathUtil.checkedSubtract(Long.MAX_VALUE, -10)).isEqualTo(OptionalLong.empty());
    assertThat(MathUtil.checkedSubtract(Long.MIN_VALUE, 1)).isEqualTo(OptionalLong.empty());
  }
}
