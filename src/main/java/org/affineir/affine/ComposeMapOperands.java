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

import java.util.List;
import org.affineir.affine.AffineComposer.WithOperands;
import org.affineir.expr.AffineMap;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.Operation;
import org.affineir.ir.RewritePattern;
import org.affineir.ir.Value;

/**
 * Composes the affine.apply operations that produce an operation's map operands into its map (see
 * {@link AffineComposer#compose}), and canonicalizes the result.
 */
final class ComposeMapOperands implements RewritePattern {

  static final ComposeMapOperands INSTANCE = new ComposeMapOperands();

  private ComposeMapOperands() {}

  @Override
  public boolean matchAndRewrite(Operation op, OpBuilder builder) {
    AffineMapUser user = (AffineMapUser) op;
    AffineMap map = user.map();
    List<Value> operands = user.mapOperands();
    WithOperands<AffineMap> composed = AffineComposer.compose(map, operands);
    if (composed.structure().equals(map) && composed.operands().equals(operands)) {
      return false;
    }
    user.setMap(composed.structure(), composed.operands());
    return true;
  }
}
