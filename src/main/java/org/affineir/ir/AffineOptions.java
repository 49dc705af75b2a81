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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Properties;

/**
 * Settings that control the canonicalization machinery. Instances are immutable; use {@link
 * #builder} or {@link #fromProperties}.
 *
 * <p>The recognized property keys are
 *
 * <ul>
 *   <li>{@code affine.verbose}: log each rewrite at INFO rather than DEBUG (default false)
 *   <li>{@code affine.maxRewriteIterations}: the most times the rewrite driver will sweep the IR
 *       before giving up on reaching a fixed point (default 10)
 *   <li>{@code affine.maxCompositionSteps}: the most affine.apply operations that a single
 *       composition may splice into a map, and the most rounds a full composition may take
 *       (default 1000)
 * </ul>
 */
public final class AffineOptions {

  public static final String VERBOSE = "affine.verbose";
  public static final String MAX_REWRITE_ITERATIONS = "affine.maxRewriteIterations";
  public static final String MAX_COMPOSITION_STEPS = "affine.maxCompositionSteps";

  public static final AffineOptions DEFAULT = builder().build();

  private final boolean verbose;
  private final int maxRewriteIterations;
  private final int maxCompositionSteps;

  private AffineOptions(Builder builder) {
    this.verbose = builder.verbose;
    this.maxRewriteIterations = builder.maxRewriteIterations;
    this.maxCompositionSteps = builder.maxCompositionSteps;
  }

  public boolean verbose() {
    return verbose;
  }

  public int maxRewriteIterations() {
    return maxRewriteIterations;
  }

  public int maxCompositionSteps() {
    return maxCompositionSteps;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options read from {@code properties}; keys that are absent keep their default values.
   *
   * @throws IllegalArgumentException if a numeric value cannot be parsed or is not positive
   */
  public static AffineOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String verbose = properties.getProperty(VERBOSE);
    if (verbose != null) {
      builder.setVerbose(Boolean.parseBoolean(verbose.trim()));
    }
    String iterations = properties.getProperty(MAX_REWRITE_ITERATIONS);
    if (iterations != null) {
      builder.setMaxRewriteIterations(parsePositive(MAX_REWRITE_ITERATIONS, iterations));
    }
    String steps = properties.getProperty(MAX_COMPOSITION_STEPS);
    if (steps != null) {
      builder.setMaxCompositionSteps(parsePositive(MAX_COMPOSITION_STEPS, steps));
    }
    return builder.build();
  }

  /** Returns options read from the JVM's system properties. */
  public static AffineOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  private static int parsePositive(String key, String value) {
    int result;
    try {
      result = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
    }
    Preconditions.checkArgument(result > 0, "%s must be positive, got %s", key, result);
    return result;
  }

  @Override
  public String toString() {
    return String.format(
        "%s=%s, %s=%s, %s=%s",
        VERBOSE,
        verbose,
        MAX_REWRITE_ITERATIONS,
        maxRewriteIterations,
        MAX_COMPOSITION_STEPS,
        maxCompositionSteps);
  }

  /** A Builder for AffineOptions, initialized with the defaults. */
  public static final class Builder {
    private boolean verbose;
    private int maxRewriteIterations = 10;
    private int maxCompositionSteps = 1000;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxRewriteIterations(int maxRewriteIterations) {
      Preconditions.checkArgument(maxRewriteIterations > 0);
      this.maxRewriteIterations = maxRewriteIterations;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxCompositionSteps(int maxCompositionSteps) {
      Preconditions.checkArgument(maxCompositionSteps > 0);
      this.maxCompositionSteps = maxCompositionSteps;
      return this;
    }

    public AffineOptions build() {
      return new AffineOptions(this);
    }
  }
}
