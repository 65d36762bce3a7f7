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
import java.util.ArrayList;
import java.util.List;

/**
 * An error manager that collects diagnostics in the order they are reported and prints errors
 * before warnings when {@link #generateReport()} is called.
 *
 * <p>This error manager does not produce any output, but subclasses can override the {@link
 * #println(CheckLevel, TranspilerError)} method to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final List<TranspilerError> errors = new ArrayList<>();
  private final List<TranspilerError> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, TranspilerError error) {
    if (!level.isOn()) {
      return;
    }
    if (level == CheckLevel.ERROR) {
      errors.add(error);
    } else {
      warnings.add(error);
    }
  }

  @Override
  public void generateReport() {
    for (TranspilerError error : errors) {
      println(CheckLevel.ERROR, error);
    }
    for (TranspilerError warning : warnings) {
      println(CheckLevel.WARNING, warning);
    }
    printSummary();
  }

  @Override
  public int getErrorCount() {
    return errors.size();
  }

  @Override
  public int getWarningCount() {
    return warnings.size();
  }

  @Override
  public ImmutableList<TranspilerError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public ImmutableList<TranspilerError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, TranspilerError error);

  /** Print the summary of the run - number of errors and warnings. */
  protected abstract void printSummary();
}
