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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Collects the Diagnostics emitted while verifying or transforming IR, and mirrors each one to the
 * log (errors at ERROR, warnings at WARN, remarks at DEBUG).
 *
 * <p>Diagnostics accumulate for the life of the engine; callers that reuse an IrContext across
 * independent runs should {@link #clear} it in between. Analyses that may be queried repeatedly
 * about the same operation report through {@link #emitUnique} so that repeated queries do not add
 * duplicate entries.
 */
public class DiagnosticEngine {

  private static final Logger logger = Logging.getLogger();

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  /** Diagnostics already reported through {@link #emitUnique}. */
  private final Set<Diagnostic> emitted = new HashSet<>();

  public void emit(Diagnostic.Severity severity, @Nullable Operation op, String message) {
    Diagnostic diagnostic = new Diagnostic(severity, op, message);
    diagnostics.add(diagnostic);
    switch (severity) {
      case ERROR -> logger.error(diagnostic);
      case WARNING -> logger.warn(diagnostic);
      case REMARK -> logger.debug(diagnostic);
    }
  }

  /**
   * Emits a diagnostic unless one with the same severity, operation and message has already been
   * emitted through this method. Returns true if it was emitted.
   */
  @CanIgnoreReturnValue
  public boolean emitUnique(Diagnostic.Severity severity, @Nullable Operation op, String message) {
    if (!emitted.add(new Diagnostic(severity, op, message))) {
      logger.debug("Duplicate diagnostic: " + message);
      return false;
    }
    emit(severity, op, message);
    return true;
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the messages of all diagnostics with the given severity, in the order emitted. */
  public ImmutableList<String> messages(Diagnostic.Severity severity) {
    return diagnostics.stream()
        .filter(d -> d.severity() == severity)
        .map(Diagnostic::message)
        .collect(ImmutableList.toImmutableList());
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
  }

  public void clear() {
    diagnostics.clear();
    emitted.clear();
  }
}
