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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import com.google.errorprone.annotations.ForOverride;
import com.google.php2jinja.ast.AstJsonReader;
import com.google.php2jinja.ast.AstJsonWriter;
import com.google.php2jinja.ast.AstParseException;
import com.google.php2jinja.ast.Node;
import com.google.php2jinja.ast.PhpParser;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * CommandLineRunner translates one PHP template into a Jinja2 template, and optionally writes a
 * Python stub module for the functions the template calls.
 *
 * <p>Usage:
 *
 * <pre>
 * php2jinja [--out TEMPLATE.html | --no-out] [--stubs STUBS.py] [--line-statements]
 *     [--input_format PHP|AST_JSON] [--print_ast] [TEMPLATE.php]
 * </pre>
 *
 * <p>With no input file the source is read from standard input; with no {@code --out} the template
 * is written to standard output. The process exits with a non-zero status if any error was
 * reported.
 *
 * <p>PHP input needs a {@link PhpParser} implementation registered with {@link ServiceLoader}.
 * {@code AST_JSON} input is the generic node form written by {@code --print_ast}.
 *
 * <p>This class is not thread-safe.
 */
public class CommandLineRunner {
  private static final Logger logger = Logger.getLogger(CommandLineRunner.class.getName());

  static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("PHP2JINJA_PARSE_ERROR", "Cannot parse {0}: {1}");

  static final DiagnosticType NO_PARSER =
      DiagnosticType.error(
          "PHP2JINJA_NO_PARSER",
          "No PHP parser is installed. Add a PhpParser implementation to the class path, or use"
              + " --input_format=AST_JSON");

  static final DiagnosticType IO_ERROR =
      DiagnosticType.error("PHP2JINJA_IO_ERROR", "Cannot {0} {1}: {2}");

  private static final Pattern FLAG_WITH_VALUE = Pattern.compile("(--[a-zA-Z_-]+)=(.*)");

  /** A value wrapped in matching single or double quotes. */
  private static final Pattern QUOTED_VALUE = Pattern.compile("(['\"])(.*)\\1");

  /** The name used in diagnostics for input read from standard input. */
  static final String STDIN_NAME = "<stdin>";

  /** The forms the input can take. */
  public enum InputFormat {
    /** PHP source, handed to the installed {@link PhpParser}. */
    PHP,
    /** The JSON generic node form. */
    AST_JSON,
  }

  private static class Flags {
    @Option(
        name = "--help",
        handler = SwitchOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--out",
        metaVar = "TEMPLATE.html",
        usage = "Path of the generated Jinja2 template. Defaults to stdout")
    private String output = null;

    @Option(
        name = "--no-out",
        handler = SwitchOptionHandler.class,
        usage = "Translate, but do not write the template. Stubs are still written")
    private boolean dryRun = false;

    @Option(
        name = "--stubs",
        metaVar = "STUBS.py",
        usage = "Path of the Python stub module for the functions the template calls")
    private String stubs = null;

    @Option(
        name = "--line-statements",
        handler = SwitchOptionHandler.class,
        usage = "Emit statement tags as '# ...' line statements instead of {% ... %}")
    private boolean lineStatements = false;

    @Option(
        name = "--input_format",
        usage = "Specifies the format of the input. Options: PHP, AST_JSON")
    private InputFormat inputFormat = InputFormat.PHP;

    @Option(
        name = "--print_ast",
        handler = SwitchOptionHandler.class,
        usage = "Prints the parsed tree in JSON generic form instead of translating it")
    private boolean printAst = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for progress"
                + " messages")
    private String loggingLevel = Level.WARNING.getName();

    @Argument(metaVar = "TEMPLATE.php", usage = "The input file. Defaults to stdin")
    private String input = null;

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    private void parse(List<String> args) throws CmdLineException {
      parser.parseArgument(args.toArray(new String[] {}));
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: php2jinja [options] [TEMPLATE.php]");
      parser.printUsage(ps);
      ps.flush();
    }

    private void printShortUsageAfterErrors(PrintStream ps) {
      ps.print("Sample usage: ");
      ps.println("--out TEMPLATE.html --stubs STUBS.py TEMPLATE.php");
      ps.println("Run with --help for all options and details");
      ps.flush();
    }
  }

  /**
   * Handles on/off flags. A bare {@code --flag} is on; a following {@code true}/{@code on}/{@code
   * yes}/{@code 1} or {@code false}/{@code off}/{@code no}/{@code 0} is consumed as its value.
   */
  public static class SwitchOptionHandler extends OptionHandler<Boolean> {
    private static final ImmutableSet<String> ON = ImmutableSet.of("true", "on", "yes", "1");
    private static final ImmutableSet<String> OFF = ImmutableSet.of("false", "off", "no", "0");

    public SwitchOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      String value = params.size() > 0 ? params.getParameter(0).toLowerCase(Locale.ROOT) : null;
      if (value != null && OFF.contains(value)) {
        setter.addValue(false);
        return 1;
      }
      setter.addValue(true);
      return value != null && ON.contains(value) ? 1 : 0;
    }

    @Override
    public String getDefaultMetaVariable() {
      return null;
    }
  }

  private final Flags flags = new Flags();
  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;
  private final ErrorManager errorManager;

  private boolean errors = false;
  private boolean runTranspiler = false;

  protected CommandLineRunner(String[] args) {
    this(args, System.in, System.out, System.err);
  }

  protected CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this(args, System.in, out, err);
  }

  protected CommandLineRunner(
      String[] args, InputStream in, PrintStream out, PrintStream err) {
    this.in = in;
    this.out = out;
    this.err = err;
    this.errorManager = new PrintStreamErrorManager(err);
    initConfigFromFlags(args);
  }

  private void reportError(String message) {
    errors = true;
    err.println(message);
    err.flush();
  }

  /** Splits {@code --flag=value} into the two arguments args4j expects, unquoting the value. */
  private static ImmutableList<String> splitFlagValues(String[] args) {
    ImmutableList.Builder<String> split = ImmutableList.builder();
    for (String arg : args) {
      Matcher flag = FLAG_WITH_VALUE.matcher(arg);
      if (!flag.matches()) {
        split.add(arg);
        continue;
      }
      Matcher quoted = QUOTED_VALUE.matcher(flag.group(2));
      split.add(flag.group(1), quoted.matches() ? quoted.group(2) : flag.group(2));
    }
    return split.build();
  }

  private void initConfigFromFlags(String[] args) {
    try {
      flags.parse(splitFlagValues(args));
    } catch (CmdLineException e) {
      reportError(e.getMessage());
    }

    Level level = null;
    try {
      level = Level.parse(flags.loggingLevel);
    } catch (IllegalArgumentException e) {
      reportError("ERROR - invalid logging_level specified: " + flags.loggingLevel);
    }

    if (flags.dryRun && flags.output != null) {
      reportError("ERROR - --no-out cannot be used with --out.");
    }

    if (errors) {
      flags.printShortUsageAfterErrors(err);
    } else if (flags.displayHelp) {
      flags.printUsage(out);
    } else {
      Transpiler.setLoggingLevel(level);
      runTranspiler = true;
    }
  }

  /** Returns whether the flags were valid and asked for a translation. */
  public boolean shouldRunTranspiler() {
    return runTranspiler;
  }

  /** Returns whether any error was reported, by flag parsing or by the run. */
  public boolean hasErrors() {
    return errors || errorManager.hasHaltingErrors();
  }

  /**
   * Runs the translation and prints the diagnostic report.
   *
   * @return the process exit status: 0 on success, -1 if any error was reported
   */
  public final int run() {
    doRun();
    errorManager.generateReport();
    out.flush();
    return hasErrors() ? -1 : 0;
  }

  private void doRun() {
    String sourceName = flags.input != null ? flags.input : STDIN_NAME;
    String source;
    try {
      source = readInput();
    } catch (IOException e) {
      errorManager.report(
          CheckLevel.ERROR, TranspilerError.make(IO_ERROR, "read", sourceName, e.getMessage()));
      return;
    }

    ImmutableList<Node> nodes;
    try {
      nodes = parse(source);
    } catch (AstParseException e) {
      errorManager.report(
          CheckLevel.ERROR,
          TranspilerError.make(
              sourceName, e.getLineno(), PARSE_ERROR, sourceName, e.getMessage()));
      return;
    }
    if (nodes == null) {
      return;
    }
    logger.fine("Parsed " + nodes.size() + " top-level node(s) from " + sourceName);

    if (flags.printAst) {
      out.println(new AstJsonWriter(true).write(nodes));
      return;
    }

    TranspilerOptions options = new TranspilerOptions();
    options.setLineStatements(flags.lineStatements);
    TranspileResult result = new Transpiler(options, errorManager).transpile(sourceName, nodes);

    if (!flags.dryRun) {
      if (flags.output == null) {
        out.print(result.getTemplate());
      } else {
        writeFile(flags.output, result.getTemplate());
      }
    }

    if (flags.stubs != null) {
      if (result.getStubs() != null) {
        writeFile(flags.stubs, result.getStubs());
      } else {
        logger.info("No function calls in " + sourceName + "; not writing " + flags.stubs);
      }
    }
  }

  private String readInput() throws IOException {
    if (flags.input == null) {
      return CharStreams.toString(new InputStreamReader(in, UTF_8));
    }
    return Files.asCharSource(new File(flags.input), UTF_8).read();
  }

  /** Parses the source in the configured input format; returns null if an error was reported. */
  private @Nullable ImmutableList<Node> parse(String source) throws AstParseException {
    switch (flags.inputFormat) {
      case AST_JSON:
        return new AstJsonReader().read(source);
      case PHP:
        PhpParser parser = createPhpParser();
        if (parser == null) {
          errorManager.report(CheckLevel.ERROR, TranspilerError.make(NO_PARSER));
          return null;
        }
        return parser.parse(Transpiler.normalizeElseIf(source));
    }
    throw new IllegalStateException("Unexpected input format: " + flags.inputFormat);
  }

  /** Returns the PHP parser to use, or null if none is installed. */
  @ForOverride
  protected @Nullable PhpParser createPhpParser() {
    Iterator<PhpParser> parsers = ServiceLoader.load(PhpParser.class).iterator();
    return parsers.hasNext() ? parsers.next() : null;
  }

  private void writeFile(String path, String contents) {
    try {
      Files.asCharSink(new File(path), UTF_8).write(contents);
      logger.fine("Wrote " + path);
    } catch (IOException e) {
      errorManager.report(
          CheckLevel.ERROR, TranspilerError.make(IO_ERROR, "write", path, e.getMessage()));
    }
  }

  /** Runs the translator. */
  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunTranspiler()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}
