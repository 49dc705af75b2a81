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

package org.affineir.analysis;

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.OptionalLong;
import org.affineir.affine.ForOp;
import org.affineir.affine.FuncOp;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class TripCountTest {

  /** Loops with constant bounds, and the trip count and divisor expected for each. */
  enum ConstantLoop {
    UNIT_STEP(3, 20, 1, 17, 17),
    EXACT(0, 16, 4, 4, 4),
    ROUNDED_UP(0, 10, 3, 4, 4),
    ODD_SPAN(0, 7, 2, 4, 4),
    EMPTY(0, 0, 1, 0, Long.MAX_VALUE),
    REVERSED(5, 2, 1, 0, Long.MAX_VALUE),
    WIDEST_SPAN(0, Long.MAX_VALUE, 1L << 40, 1L << 23, 1L << 23),
    // The span does not fit in a long, so the trip count is unknown
    OVERFLOWING_SPAN(-10, Long.MAX_VALUE, 1L << 40);

    final long lb;
    final long ub;
    final long step;
    final OptionalLong tripCount;
    final long divisor;

    ConstantLoop(long lb, long ub, long step, long tripCount, long divisor) {
      this.lb = lb;
      this.ub = ub;
      this.step = step;
      this.tripCount = OptionalLong.of(tripCount);
      this.divisor = divisor;
    }

    ConstantLoop(long lb, long ub, long step) {
      this.lb = lb;
      this.ub = ub;
      this.step = step;
      this.tripCount = OptionalLong.empty();
      this.divisor = 1;
    }
  }

  @Test
  public void constantBounds(@TestParameter ConstantLoop testCase) {
    FuncOp func = FuncOp.create(new IrContext(), "f");
    ForOp loop =
        ForOp.create(
            OpBuilder.atBlockEnd(func.body()), testCase.lb, testCase.ub, testCase.step);
    assertThat(LoopAnalysis.constantTripCount(loop)).isEqualTo(testCase.tripCount);
    assertThat(LoopAnalysis.buildTripCountMap(loop).isPresent())
        .isEqualTo(testCase.tripCount.isPresent());
    assertThat(LoopAnalysis.largestDivisorOfTripCount(loop)).isEqualTo(testCase.divisor);
  }
}
