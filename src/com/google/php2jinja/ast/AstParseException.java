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

package com.google.php2jinja.ast;

/** Thrown when source text or a serialized tree cannot be turned into PHP syntax nodes. */
public final class AstParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int lineno;

  public AstParseException(String message) {
    this(message, -1);
  }

  public AstParseException(String message, int lineno) {
    super(message);
    this.lineno = lineno;
  }

  public AstParseException(String message, Throwable cause) {
    super(message, cause);
    this.lineno = -1;
  }

  /** Returns the one-indexed line of the failure, or -1 if unknown. */
  public int getLineno() {
    return lineno;
  }
}
