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
import com.google.php2jinja.ast.Node;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Prints Python stub functions for the plain function calls recorded during a run, so the
 * template's helpers can be registered as Jinja2 globals.
 *
 * <p>Each stub takes as many positional parameters as the call with the most arguments, and
 * lists up to three distinct calls as examples.
 */
public final class StubPrinter {
  static final String HEADER = "# stubs for observed function calls\n";
  private static final int MAX_EXAMPLES = 3;

  private final TranspilerOptions options;

  public StubPrinter(TranspilerOptions options) {
    this.options = options;
  }

  public String print(CallSiteRegistry callSites) {
    // Examples are rendered in a run of their own so they record nothing into callSites. Any
    // diagnostics were already reported when the calls were first translated.
    JinjaCodeGenerator generator =
        new JinjaCodeGenerator(options, new TranslationRun((level, error) -> {}, null));

    StringBuilder sb = new StringBuilder(HEADER);
    for (String name : callSites.getCalledNames()) {
      ImmutableList<Node> calls = callSites.getCalls(name);
      int arity = canonicalArity(calls);

      sb.append("def ").append(name).append('(');
      for (int i = 0; i < arity; i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append("arg").append(i);
      }
      sb.append("):\n");

      if (arity > 0) {
        Set<String> examples = new LinkedHashSet<>();
        for (Node call : calls) {
          if (examples.size() == MAX_EXAMPLES) {
            break;
          }
          examples.add(generator.translate(call, true, 0));
        }
        for (String example : examples) {
          sb.append("    # ").append(example).append('\n');
        }
      }
      sb.append("    pass\n\n");
    }
    return sb.toString();
  }

  /** Returns the argument count of the first call with the most arguments. */
  static int canonicalArity(ImmutableList<Node> calls) {
    int arity = 0;
    for (Node call : calls) {
      arity = Math.max(arity, call.getList("params").size());
    }
    return arity;
  }
}
