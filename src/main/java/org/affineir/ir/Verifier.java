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

/**
 * A static-only class that checks an operation and everything nested in it. Failures are reported
 * as error diagnostics; verification continues after a failure so that all of them are reported.
 */
public class Verifier {

  private Verifier() {}

  /** Returns true if {@code root} and all operations nested in it are valid. */
  public static boolean verify(Operation root) {
    boolean[] ok = {true};
    root.walk(
        op -> {
          // Check structure first, but run the op-specific checks regardless
          boolean structureOk = verifyStructure(op);
          if (!op.verify() || !structureOk) {
            ok[0] = false;
          }
        });
    return ok[0];
  }

  private static boolean verifyStructure(Operation op) {
    for (int i = 0; i < op.numOperands(); i++) {
      Operation def = op.operand(i).definingOp();
      if (def != null && def.isErased()) {
        return op.emitOpError("operand #%s was produced by an erased operation", i);
      }
    }
    Block block = op.parentBlock();
    if (op.hasTrait(Trait.TERMINATOR)
        && block != null
        && block.operations().get(block.numOperations() - 1) != op) {
      return op.emitOpError("must be the last operation in the parent block");
    }
    return true;
  }
}
