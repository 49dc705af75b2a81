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

import org.apache.log4j.Logger;

/** A static-only class that provides the logger shared by this library. */
public class Logging {

  /** All classes log to this one logger, so that a single setting controls the output. */
  public static final String LOGGER_NAME = "org.affineir";

  private Logging() {}

  public static Logger getLogger() {
    return Logger.getLogger(LOGGER_NAME);
  }
}
