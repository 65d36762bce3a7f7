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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * State owned by a single translation run: the call-site registry, the counter used to mint
 * loop variable names, and the sink for diagnostics. Runs never share an instance.
 */
public final class TranslationRun {
  static final String LOOP_VAR_PREFIX = "$loop_var_";

  private final CallSiteRegistry callSites = new CallSiteRegistry();
  private final ErrorHandler errorHandler;
  private final @Nullable String sourceName;
  private int nextLoopVarIndex = 1;

  public TranslationRun(ErrorHandler errorHandler, @Nullable String sourceName) {
    this.errorHandler = checkNotNull(errorHandler);
    this.sourceName = sourceName;
  }

  public CallSiteRegistry getCallSites() {
    return callSites;
  }

  public @Nullable String getSourceName() {
    return sourceName;
  }

  /** Returns a fresh {@code $loop_var_N} name; N starts at 1 and is never reused in this run. */
  String newLoopVariable() {
    return LOOP_VAR_PREFIX + nextLoopVarIndex++;
  }

  void report(TranspilerError error) {
    errorHandler.report(error.getDefaultLevel(), error);
  }
}
