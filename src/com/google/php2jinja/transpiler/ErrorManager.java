/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.php2jinja.transpiler;

import com.google.common.collect.ImmutableList;

/** Error reporting interface: collects diagnostics and generates a report at the end of a run. */
public interface ErrorManager extends ErrorHandler {

  /** Writes a report of all diagnostics reported so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<TranspilerError> getErrors();

  ImmutableList<TranspilerError> getWarnings();

  /** Returns true if an error was reported, meaning no output may be written. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
