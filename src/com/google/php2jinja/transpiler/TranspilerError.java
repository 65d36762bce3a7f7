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

import static java.util.Objects.requireNonNull;

import com.google.php2jinja.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * A translation error or warning.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location, or -1 if unknown.
 * @param node Node where the warning occurred.
 */
public record TranspilerError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    @Nullable Node node) {
  public TranspilerError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /**
   * Creates a TranspilerError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranspilerError make(DiagnosticType type, String... arguments) {
    return new TranspilerError(type, type.format(arguments), null, -1, null);
  }

  /**
   * Creates a TranspilerError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranspilerError make(
      @Nullable String sourceName, int lineno, DiagnosticType type, String... arguments) {
    return new TranspilerError(type, type.format(arguments), sourceName, lineno, null);
  }

  /**
   * Creates a TranspilerError from a file and Node position.
   *
   * @param sourceName The source file name
   * @param n Determines the line position
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranspilerError make(
      @Nullable String sourceName, Node n, DiagnosticType type, String... arguments) {
    return new TranspilerError(type, type.format(arguments), sourceName, n.getLineno(), n);
  }

  public CheckLevel getDefaultLevel() {
    return type.level;
  }

  /** Formats this error as {@code source:line: LEVEL - [KEY] description}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName).append(':');
      if (lineno > 0) {
        sb.append(lineno).append(':');
      }
      sb.append(' ');
    } else if (lineno > 0) {
      sb.append("line ").append(lineno).append(": ");
    }
    sb.append(level).append(" - [").append(type.key).append("] ").append(description);
    return sb.toString();
  }

  @Override
  public String toString() {
    return format(type.level);
  }
}
