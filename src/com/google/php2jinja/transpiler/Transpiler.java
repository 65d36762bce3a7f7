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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.php2jinja.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Transpiler translates a parsed PHP template into a Jinja2 template.
 *
 * <p>Each call to {@link #transpile} is a run of its own, with a fresh call-site registry and
 * loop variable counter, so translating the same tree twice gives identical output. Problems are
 * reported to the error manager; none of them stops a run.
 */
public final class Transpiler {
  private static final Logger logger = Logger.getLogger(Transpiler.class.getName());

  /** Parent of every logger in this tool. */
  private static final Logger rootLogger = Logger.getLogger("com.google.php2jinja");

  private static final CharMatcher NEWLINE = CharMatcher.is('\n');

  private final TranspilerOptions options;

  /** The caller's error manager, or null to log a report at the end of each run. */
  private final @Nullable ErrorManager errorManager;

  /**
   * Creates a transpiler that logs its diagnostics. Each run gets a fresh {@link
   * LoggerErrorManager}, and its report is logged when the run ends.
   */
  public Transpiler(TranspilerOptions options) {
    this.options = checkNotNull(options);
    this.errorManager = null;
  }

  /**
   * Creates a transpiler that reports to the given error manager. Diagnostics accumulate across
   * runs, and the caller decides when to call {@link ErrorManager#generateReport}.
   */
  public Transpiler(TranspilerOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public TranspileResult transpile(List<Node> nodes) {
    return transpile(null, nodes);
  }

  /**
   * Translates the top-level nodes of one template.
   *
   * @param sourceName the name used in diagnostics, or null
   */
  public TranspileResult transpile(@Nullable String sourceName, List<Node> nodes) {
    logger.fine("Translating " + nodes.size() + " top-level node(s) from " + sourceName);
    ErrorManager runErrors = errorManager != null ? errorManager : new LoggerErrorManager(logger);
    TranslationRun run = new TranslationRun(runErrors, sourceName);
    JinjaCodeGenerator generator = new JinjaCodeGenerator(options, run);

    List<String> statements = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      statements.add(generator.translate(node));
    }
    String template = collapseBlankLines(Joiner.on('\n').join(statements));

    String stubs = null;
    if (!run.getCallSites().isEmpty()) {
      stubs = new StubPrinter(options).print(run.getCallSites());
    }
    logger.fine(
        "Translated "
            + sourceName
            + ": "
            + run.getCallSites().getCalledNames().size()
            + " distinct function(s) called");
    if (errorManager == null) {
      runErrors.generateReport();
    }
    return TranspileResult.create(template, stubs);
  }

  /** Sets the level of every logger under {@code com.google.php2jinja}. */
  public static void setLoggingLevel(Level level) {
    rootLogger.setLevel(level);
  }

  /** Collapses every run of consecutive newlines into a single newline. */
  public static String collapseBlankLines(String text) {
    return NEWLINE.collapseFrom(text, '\n');
  }

  /**
   * Rewrites every "else if" in PHP source as "elseif". The parser only understands the single
   * keyword form, and the two are equivalent in PHP. This is a plain text substitution.
   */
  public static String normalizeElseIf(String phpSource) {
    return phpSource.replace("else if", "elseif");
  }
}
