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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.php2jinja.ast.AstParseException;
import com.google.php2jinja.ast.PhpIR;
import com.google.php2jinja.ast.PhpParser;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CommandLineRunner}. */
@RunWith(JUnit4.class)
public final class CommandLineRunnerTest {
  private static final String ECHO_X_JSON =
      "[[\"Echo\", {\"nodes\": [[\"Variable\", {\"name\": \"$x\"}]]}]]";

  private static final String CALL_F_JSON =
      "[[\"FunctionCall\", {\"name\": \"f\", \"params\": [[\"Parameter\","
          + " {\"node\": [\"Variable\", {\"name\": \"$a\"}], \"is_ref\": false}]]}]]";

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  private ByteArrayOutputStream outReader;
  private ByteArrayOutputStream errReader;
  private InputStream stdin;

  /** When set, the runner uses this parser for PHP input. */
  private PhpParser phpParser;

  /** Sources handed to {@link #phpParser}. */
  private List<String> parsedSources;

  private CommandLineRunner lastRunner;
  private int lastExitCode;

  @Before
  public void setUp() {
    outReader = new ByteArrayOutputStream();
    errReader = new ByteArrayOutputStream();
    stdin = new ByteArrayInputStream(new byte[0]);
    phpParser = null;
    parsedSources = new ArrayList<>();
  }

  private String stdout() {
    return outReader.toString(UTF_8);
  }

  private String stderr() {
    return errReader.toString(UTF_8);
  }

  private File writeTempFile(String name, String contents) throws IOException {
    File file = tempFolder.newFile(name);
    Files.asCharSink(file, UTF_8).write(contents);
    return file;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, UTF_8).read();
  }

  private CommandLineRunner createRunner(String... args) {
    lastRunner =
        new CommandLineRunner(
            args,
            stdin,
            new PrintStream(outReader, true, UTF_8),
            new PrintStream(errReader, true, UTF_8)) {
          @Override
          protected PhpParser createPhpParser() {
            if (phpParser == null) {
              return super.createPhpParser();
            }
            return source -> {
              parsedSources.add(source);
              return phpParser.parse(source);
            };
          }
        };
    return lastRunner;
  }

  private int run(String... args) {
    CommandLineRunner runner = createRunner(args);
    assertThat(runner.shouldRunTranspiler()).isTrue();
    lastExitCode = runner.run();
    return lastExitCode;
  }

  @Test
  public void testAstJsonToFile() throws Exception {
    File input = writeTempFile("page.json", ECHO_X_JSON);
    File output = new File(tempFolder.getRoot(), "page.html");

    assertThat(
            run("--input_format=AST_JSON", "--out", output.getPath(), input.getPath()))
        .isEqualTo(0);
    assertThat(read(output)).isEqualTo("{{ x | safe -}}");
    assertThat(stdout()).isEmpty();
    assertThat(stderr()).isEmpty();
  }

  @Test
  public void testStdinToStdout() {
    stdin = new ByteArrayInputStream(ECHO_X_JSON.getBytes(UTF_8));
    assertThat(run("--input_format", "AST_JSON")).isEqualTo(0);
    assertThat(stdout()).isEqualTo("{{ x | safe -}}");
  }

  @Test
  public void testStubsAreWritten() throws Exception {
    File input = writeTempFile("page.json", CALL_F_JSON);
    File stubs = new File(tempFolder.getRoot(), "stubs.py");

    assertThat(run("--input_format=AST_JSON", "--stubs", stubs.getPath(), input.getPath()))
        .isEqualTo(0);
    assertThat(stdout()).isEqualTo("{{ f(a) -}}");
    assertThat(read(stubs))
        .isEqualTo(StubPrinter.HEADER + "def f(arg0):\n    # f(a)\n    pass\n\n");
  }

  @Test
  public void testDryRunStillWritesStubs() throws Exception {
    File input = writeTempFile("page.json", CALL_F_JSON);
    File stubs = new File(tempFolder.getRoot(), "stubs.py");

    assertThat(
            run(
                "--input_format=AST_JSON",
                "--no-out",
                "--stubs",
                stubs.getPath(),
                input.getPath()))
        .isEqualTo(0);
    assertThat(stdout()).isEmpty();
    assertThat(read(stubs)).startsWith(StubPrinter.HEADER);
  }

  @Test
  public void testNoStubsFileWithoutCalls() throws Exception {
    File input = writeTempFile("page.json", ECHO_X_JSON);
    File stubs = new File(tempFolder.getRoot(), "stubs.py");

    assertThat(run("--input_format=AST_JSON", "--stubs", stubs.getPath(), input.getPath()))
        .isEqualTo(0);
    assertThat(stubs.exists()).isFalse();
  }

  @Test
  public void testParseErrorWritesNothing() throws Exception {
    File input = writeTempFile("page.json", "[[\"Goto\", {\"name\": \"end\"}]]");
    File output = new File(tempFolder.getRoot(), "page.html");
    File stubs = new File(tempFolder.getRoot(), "stubs.py");

    assertThat(
            run(
                "--input_format=AST_JSON",
                "--out",
                output.getPath(),
                "--stubs",
                stubs.getPath(),
                input.getPath()))
        .isEqualTo(-1);
    assertThat(output.exists()).isFalse();
    assertThat(stubs.exists()).isFalse();
    assertThat(stderr()).contains("PHP2JINJA_PARSE_ERROR");
    assertThat(stderr()).contains("Unknown node kind: Goto");
    assertThat(lastRunner.hasErrors()).isTrue();
  }

  @Test
  public void testMissingInputFile() {
    File missing = new File(tempFolder.getRoot(), "missing.json");
    assertThat(run("--input_format=AST_JSON", missing.getPath())).isEqualTo(-1);
    assertThat(stderr()).contains("PHP2JINJA_IO_ERROR");
  }

  @Test
  public void testPhpInputUsesInstalledParser() throws Exception {
    phpParser = source -> ImmutableList.of(PhpIR.echo(PhpIR.variable("$x")));
    File input = writeTempFile("page.php", "<?php if ($a) { } else if ($b) { } echo $x; ?>");

    assertThat(run(input.getPath())).isEqualTo(0);
    assertThat(stdout()).isEqualTo("{{ x | safe -}}");
    assertThat(parsedSources).containsExactly("<?php if ($a) { } elseif ($b) { } echo $x; ?>");
  }

  @Test
  public void testPhpParserFailure() {
    phpParser =
        source -> {
          throw new AstParseException("unexpected '}'", 3);
        };
    stdin = new ByteArrayInputStream("<?php } ?>".getBytes(UTF_8));

    assertThat(run()).isEqualTo(-1);
    assertThat(stdout()).isEmpty();
    assertThat(stderr()).contains("<stdin>:3: ERROR - [PHP2JINJA_PARSE_ERROR]");
  }

  @Test
  public void testNoParserInstalled() {
    stdin = new ByteArrayInputStream("<?php echo $x; ?>".getBytes(UTF_8));
    assertThat(run()).isEqualTo(-1);
    assertThat(stderr()).contains("PHP2JINJA_NO_PARSER");
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testLineStatements() {
    stdin =
        new ByteArrayInputStream(
            ("[[\"Assignment\", {\"node\": [\"Variable\", {\"name\": \"$a\"}],"
                    + " \"expr\": 1, \"is_ref\": false}]]")
                .getBytes(UTF_8));
    assertThat(run("--input_format=AST_JSON", "--line-statements")).isEqualTo(0);
    assertThat(stdout()).isEqualTo("\n# set a = 1\n");
  }

  @Test
  public void testBooleanFlagValues() {
    stdin = new ByteArrayInputStream(ECHO_X_JSON.getBytes(UTF_8));
    assertThat(run("--input_format=AST_JSON", "--no-out=false", "--line-statements", "false"))
        .isEqualTo(0);
    assertThat(stdout()).isEqualTo("{{ x | safe -}}");
  }

  @Test
  public void testQuotedFlagValueAndSwitchWords() throws Exception {
    stdin = new ByteArrayInputStream(ECHO_X_JSON.getBytes(UTF_8));
    File output = new File(tempFolder.getRoot(), "quoted.html");
    assertThat(
            run(
                "--input_format=AST_JSON",
                "--out=\"" + output.getPath() + "\"",
                "--line-statements=off",
                "--print_ast",
                "no"))
        .isEqualTo(0);
    assertThat(read(output)).isEqualTo("{{ x | safe -}}");
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testUnsupportedConstructsAreWarnings() {
    stdin = new ByteArrayInputStream("[[\"Break\", {\"node\": null}]]".getBytes(UTF_8));
    assertThat(run("--input_format=AST_JSON")).isEqualTo(0);
    assertThat(stdout()).isEqualTo("{# XXX Break(null) #}");
    assertThat(stderr()).contains("WARNING - [PHP2JINJA_UNSUPPORTED_CONSTRUCT]");
    assertThat(stderr()).contains("0 error(s), 1 warning(s)");
  }

  @Test
  public void testPrintAst() {
    stdin = new ByteArrayInputStream(ECHO_X_JSON.getBytes(UTF_8));
    assertThat(run("--input_format=AST_JSON", "--print_ast")).isEqualTo(0);
    assertThat(stdout()).contains("\"Echo\"");
    assertThat(stdout()).contains("\"$x\"");
  }

  @Test
  public void testHelp() {
    CommandLineRunner runner = createRunner("--help");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isFalse();
    assertThat(stdout()).contains("--line-statements");
    assertThat(stdout()).contains("--input_format");
  }

  @Test
  public void testUnknownFlag() {
    CommandLineRunner runner = createRunner("--bogus");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(stderr()).contains("Run with --help");
  }

  @Test
  public void testBadInputFormat() {
    CommandLineRunner runner = createRunner("--input_format=YAML");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
  }

  @Test
  public void testBadLoggingLevel() {
    CommandLineRunner runner = createRunner("--logging_level=LOUD");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(stderr()).contains("invalid logging_level");
  }

  @Test
  public void testOutConflictsWithNoOut() {
    CommandLineRunner runner = createRunner("--no-out", "--out", "x.html");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
  }

  @Test
  public void testTooManyInputs() {
    CommandLineRunner runner = createRunner("a.php", "b.php");
    assertThat(runner.shouldRunTranspiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
  }
}
