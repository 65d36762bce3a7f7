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

import java.io.Serializable;

/** Options that control how Jinja2 output is rendered. */
public class TranspilerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Render statement tags as {@code # stmt} lines instead of {@code {% stmt %}} tags. */
  private boolean lineStatements = false;

  /** Repeated once per indent level. */
  private String indentUnit = "\t";

  public boolean isLineStatements() {
    return lineStatements;
  }

  public void setLineStatements(boolean lineStatements) {
    this.lineStatements = lineStatements;
  }

  public String getIndentUnit() {
    return indentUnit;
  }

  public void setIndentUnit(String indentUnit) {
    this.indentUnit = checkNotNull(indentUnit);
  }
}
