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

import org.affineir.expr.AffineExprContext;

/**
 * The state shared by all IR built together: the table of interned affine expressions, the
 * collected diagnostics, and the options. Not thread-safe; each thread that builds IR should use
 * its own IrContext.
 */
public final class IrContext {

  private final AffineExprContext exprs = new AffineExprContext();
  private final DiagnosticEngine diagnostics = new DiagnosticEngine();
  private final AffineOptions options;
  private int nextOpId;

  public IrContext() {
    this(AffineOptions.DEFAULT);
  }

  public IrContext(AffineOptions options) {
    this.options = options;
  }

  public AffineExprContext exprs() {
    return exprs;
  }

  public DiagnosticEngine diagnostics() {
    return diagnostics;
  }

  public AffineOptions options() {
    return options;
  }

  int nextOpId() {
    return nextOpId++;
  }
}
