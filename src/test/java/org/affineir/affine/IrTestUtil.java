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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;
import org.affineir.ir.Diagnostic;
import org.affineir.ir.GenericOp;
import org.affineir.ir.GreedyRewriteDriver;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Operation;
import org.affineir.ir.Value;

/** Helpers shared by the tests that build IR. */
public final class IrTestUtil {

  private IrTestUtil() {}

  public static OpBuilder atEnd(FuncOp func) {
    return OpBuilder.atBlockEnd(func.body());
  }

  /** Runs the canonicalizer on {@code root}; returns true if it reached a fixed point. */
  public static boolean canonicalize(Operation root) {
    return new GreedyRewriteDriver(root.context(), ConstantOp.MATERIALIZER).rewrite(root);
  }

  /**
   * Creates an operation with unknown side effects that uses {@code values}, so that they (and the
   * loops computing them) are not erased as dead.
   */
  public static Operation use(OpBuilder builder, Value... values) {
    return GenericOp.create(builder, "test.use", Set.of(), List.of(values), List.of());
  }

  public static ImmutableList<String> errors(IrContext context) {
    return context.diagnostics().messages(Diagnostic.Severity.ERROR);
  }
}
