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

import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.affineir.expr.AffineMap;
import org.affineir.ir.Matchers;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Value;
import org.jspecify.annotations.Nullable;

/** Builders for perfectly nested for loops. */
public class LoopNests {

  private LoopNests() {}

  /** Fills in the body of the innermost loop of a nest. */
  @FunctionalInterface
  public interface NestBodyBuilder {
    /** Called with the induction variables of the nest, outermost first. */
    void build(OpBuilder builder, List<Value> inductionVars);
  }

  /** A function that creates one loop of a nest. */
  private interface LoopCreator<T> {
    ForOp create(OpBuilder builder, T lb, T ub, long step, ForOp.BodyBuilder bodyBuilder);
  }

  /**
   * Builds a nest of loops with constant bounds, where loop {@code i} runs from {@code lbs[i]} to
   * {@code ubs[i]} by {@code steps[i]}, and calls {@code bodyBuilder} in the innermost loop. With
   * no loops, {@code bodyBuilder} is called at the builder's insertion point.
   */
  public static List<ForOp> buildLoopNest(
      OpBuilder builder,
      long[] lbs,
      long[] ubs,
      long[] steps,
      @Nullable NestBodyBuilder bodyBuilder) {
    return buildLoopNest(
        builder,
        Longs.asList(lbs),
        Longs.asList(ubs),
        steps,
        bodyBuilder,
        (b, lb, ub, step, body) -> ForOp.create(b, lb, ub, step, List.of(), body));
  }

  /**
   * Builds a nest of loops whose bounds are given by values. Loops whose bounds are both constant
   * get constant bound maps; other loops bind each bound value to the single-dimension identity
   * map.
   */
  public static List<ForOp> buildLoopNestFromValues(
      OpBuilder builder,
      List<Value> lbs,
      List<Value> ubs,
      long[] steps,
      @Nullable NestBodyBuilder bodyBuilder) {
    return buildLoopNest(builder, lbs, ubs, steps, bodyBuilder, LoopNests::buildLoopFromValues);
  }

  private static ForOp buildLoopFromValues(
      OpBuilder builder, Value lb, Value ub, long step, ForOp.BodyBuilder bodyBuilder) {
    OptionalLong lbConst = Matchers.constantValue(lb);
    OptionalLong ubConst = Matchers.constantValue(ub);
    if (lbConst.isPresent() && ubConst.isPresent()) {
      return ForOp.create(
          builder, lbConst.getAsLong(), ubConst.getAsLong(), step, List.of(), bodyBuilder);
    }
    AffineMap identity = AffineMap.identity(builder.exprs(), 1);
    return ForOp.create(
        builder, identity, List.of(lb), identity, List.of(ub), step, List.of(), bodyBuilder);
  }

  private static <T> List<ForOp> buildLoopNest(
      OpBuilder builder,
      List<T> lbs,
      List<T> ubs,
      long[] steps,
      @Nullable NestBodyBuilder bodyBuilder,
      LoopCreator<T> loopCreator) {
    Preconditions.checkArgument(
        lbs.size() == ubs.size() && lbs.size() == steps.length,
        "mismatched bound and step counts");
    List<ForOp> loops = new ArrayList<>();
    if (lbs.isEmpty()) {
      if (bodyBuilder != null) {
        bodyBuilder.build(builder, List.of());
      }
      return loops;
    }
    List<Value> ivs = new ArrayList<>();
    OpBuilder current = builder;
    for (int i = 0; i < lbs.size(); i++) {
      boolean innermost = (i == lbs.size() - 1);
      ForOp loop =
          loopCreator.create(
              current,
              lbs.get(i),
              ubs.get(i),
              steps[i],
              (nested, iv, iterArgs) -> {
                ivs.add(iv);
                if (innermost && bodyBuilder != null) {
                  bodyBuilder.build(nested, ivs);
                }
              });
      loops.add(loop);
      current = OpBuilder.before(loop.body().terminator());
    }
    return loops;
  }
}
