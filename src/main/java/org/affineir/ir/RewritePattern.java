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

/** A local transformation applied by the {@link GreedyRewriteDriver}. */
public interface RewritePattern {

  /**
   * Attempts to rewrite {@code op}, returning true if the IR was changed. Any new operations should
   * be created with {@code builder}, which is positioned just before {@code op}. The pattern may
   * erase {@code op}.
   */
  boolean matchAndRewrite(Operation op, OpBuilder builder);
}
