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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of {@link Operation#fold}. A fold either fails, updates the operation in place, or
 * determines that the operation's single result equals an existing Value or a constant.
 */
public final class FoldResult {

  public enum Outcome {
    FAILURE,
    IN_PLACE,
    VALUE,
    CONSTANT
  }

  public static final FoldResult FAILURE = new FoldResult(Outcome.FAILURE, null, 0);
  public static final FoldResult IN_PLACE = new FoldResult(Outcome.IN_PLACE, null, 0);

  public final Outcome outcome;
  private final @Nullable Value value;
  private final long constant;

  private FoldResult(Outcome outcome, @Nullable Value value, long constant) {
    this.outcome = outcome;
    this.value = value;
    this.constant = constant;
  }

  public static FoldResult of(Value value) {
    return new FoldResult(Outcome.VALUE, value, 0);
  }

  public static FoldResult ofConstant(long constant) {
    return new FoldResult(Outcome.CONSTANT, null, constant);
  }

  /** Returns {@link #IN_PLACE} if {@code changed} is true, otherwise {@link #FAILURE}. */
  public static FoldResult inPlaceIf(boolean changed) {
    return changed ? IN_PLACE : FAILURE;
  }

  public boolean succeeded() {
    return outcome != Outcome.FAILURE;
  }

  public Value value() {
    Preconditions.checkState(outcome == Outcome.VALUE);
    return value;
  }

  public long constant() {
    Preconditions.checkState(outcome == Outcome.CONSTANT);
    return constant;
  }

  @Override
  public String toString() {
    return switch (outcome) {
      case FAILURE, IN_PLACE -> outcome.name();
      case VALUE -> "VALUE(" + value + ")";
      case CONSTANT -> "CONSTANT(" + constant + ")";
    };
  }
}
