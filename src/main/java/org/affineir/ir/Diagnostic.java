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

import com.google.common.base.Ascii;
import org.jspecify.annotations.Nullable;

/** A message about the IR, usually attached to the Operation it concerns. */
public record Diagnostic(Severity severity, @Nullable Operation op, String message) {

  public enum Severity {
    ERROR,
    WARNING,
    /** Informational; e.g. an analysis explaining why it gave a conservative answer. */
    REMARK
  }

  @Override
  public String toString() {
    String prefix = Ascii.toLowerCase(severity.name()) + ": " + message;
    return (op == null) ? prefix : prefix + " [" + op.name() + "]";
  }
}
