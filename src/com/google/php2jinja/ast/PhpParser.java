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

import com.google.common.collect.ImmutableList;

/**
 * Turns PHP source text into its top-level syntax nodes.
 *
 * <p>No implementation ships with this package; the command line runner discovers one with
 * {@link java.util.ServiceLoader}.
 */
public interface PhpParser {

  /**
   * Parses a whole PHP template.
   *
   * @throws AstParseException if the source cannot be parsed
   */
  ImmutableList<Node> parse(String phpSource) throws AstParseException;
}
