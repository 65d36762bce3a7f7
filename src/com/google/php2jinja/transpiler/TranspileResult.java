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

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/** The output of one translation run. */
@AutoValue
public abstract class TranspileResult {

  static TranspileResult create(String template, @Nullable String stubs) {
    return new AutoValue_TranspileResult(template, stubs);
  }

  /** The Jinja2 template text, with runs of blank lines collapsed. */
  public abstract String getTemplate();

  /** The stub file text, or null if the template calls no plain functions. */
  public abstract @Nullable String getStubs();
}
