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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.php2jinja.ast.Kind;
import com.google.php2jinja.ast.Literals;
import com.google.php2jinja.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * JinjaCodeGenerator renders PHP syntax nodes as Jinja2 template text.
 *
 * <p>Every node is rendered in a context made of an expression flag (is the text substituted
 * inside a larger expression, or is it a statement of its own) and an indent level. Constructs
 * with no Jinja2 counterpart are rendered as a visible {@code XXX} marker and reported as
 * warnings; translation never stops on them.
 *
 * @see Transpiler
 */
public class JinjaCodeGenerator {
  private static final Logger logger = Logger.getLogger(JinjaCodeGenerator.class.getName());

  static final DiagnosticType UNSUPPORTED_CONSTRUCT =
      DiagnosticType.warning(
          "PHP2JINJA_UNSUPPORTED_CONSTRUCT",
          "{0} has no Jinja2 translation and was left as a marker");

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  /** Body statements of a macro are separated by a newline and a fixed four space indent. */
  private static final String MACRO_BODY_SEPARATOR = "\n    ";

  private static final ImmutableMap<String, String> OPERATORS =
      ImmutableMap.<String, String>builder()
          .put("&&", "and")
          .put("||", "or")
          .put("!", "not")
          .put("!==", "!=")
          .put("===", "==")
          .put(".", "~")
          .buildOrThrow();

  // Jinja2 spells these constants in lower case.
  private static final ImmutableMap<String, String> CONSTANTS =
      ImmutableMap.of("null", "none", "true", "true", "false", "false");

  private static final ImmutableSet<String> FILTER_CASTS =
      ImmutableSet.of("int", "float", "string");

  private final TranspilerOptions options;
  private final TranslationRun run;

  public JinjaCodeGenerator(TranspilerOptions options, TranslationRun run) {
    this.options = checkNotNull(options);
    this.run = checkNotNull(run);
  }

  /** Renders a top-level statement. */
  public String translate(@Nullable Object value) {
    return translate(value, false, 0);
  }

  /** Renders a value in expression position. */
  String translateExpr(@Nullable Object value) {
    return translate(value, true, 0);
  }

  /**
   * Renders a node or a scalar field value.
   *
   * @param value a node, a string, number or boolean literal, or null
   * @param isExpr whether the text is substituted inside a larger expression
   * @param indent the indent level of the enclosing block
   */
  public String translate(@Nullable Object value, boolean isExpr, int indent) {
    if (value instanceof String) {
      return Literals.quote((String) value);
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? "true" : "false";
    } else if (value instanceof Number) {
      return value.toString();
    } else if (!(value instanceof Node)) {
      return unsupported(value, isExpr);
    }

    Node n = (Node) value;
    switch (n.getKind()) {
      case INLINE_HTML:
        return String.valueOf(n.getField("data"));

      case CONSTANT:
        {
          String name = String.valueOf(n.getField("name"));
          String mapped = CONSTANTS.get(Ascii.toLowerCase(name));
          return mapped != null ? mapped : name;
        }

      case VARIABLE:
        {
          Object name = n.getField("name");
          if (!(name instanceof String)) {
            return unsupported(n, isExpr);
          }
          return stripSigil((String) name);
        }

      case ECHO:
        {
          List<String> parts = new ArrayList<>();
          for (Object expr : n.getList("nodes")) {
            parts.add(translateExpr(expr));
          }
          // Anything echoed may already be HTML, so the output is never auto-escaped.
          return expression(Joiner.on(" ~ ").join(parts) + " | safe");
        }

      case PRINT:
        return expression(translateExpr(n.getField("node")) + " | safe");

      case INCLUDE:
      case REQUIRE:
        // Jinja2 has no include-once.
        return statement("include " + translateExpr(n.getField("expr")), 0, false, true);

      case BLOCK:
        {
          StringBuilder sb = new StringBuilder();
          for (Object stmt : n.getList("nodes")) {
            sb.append(translate(stmt, false, indent));
          }
          return sb.toString();
        }

      case ARRAY_OFFSET:
      case STRING_OFFSET:
        return translateExpr(n.getField("node")) + "[" + translateExpr(n.getField("expr")) + "]";

      case OBJECT_PROPERTY:
        {
          Object name = n.getField("name");
          String target = translateExpr(n.getField("node"));
          if (name instanceof String) {
            return target + "." + name;
          }
          return target + "[" + translateExpr(name) + "]";
        }

      case STATIC_PROPERTY:
        {
          Object name = n.getField("name");
          if (!(name instanceof String)) {
            return unsupported(n, isExpr);
          }
          return nameOf(n.getField("node")) + "." + stripSigil((String) name);
        }

      case ARRAY:
        {
          List<?> elements = n.getList("nodes");
          List<String> items = new ArrayList<>(elements.size());
          for (Object element : elements) {
            items.add(translateExpr(element));
          }
          // Only the first element decides between a dict and a list literal.
          if (!elements.isEmpty() && isKeyed(elements.get(0))) {
            return "{" + COMMA_JOINER.join(items) + "}";
          }
          return "[" + COMMA_JOINER.join(items) + "]";
        }

      case ARRAY_ELEMENT:
        {
          Object key = n.getField("key");
          String itemValue = translateExpr(n.getField("value"));
          if (key != null) {
            return translateExpr(key) + ": " + itemValue;
          }
          return itemValue;
        }

      case ASSIGNMENT:
        {
          Object target = n.getField("node");
          Object expr = n.getField("expr");
          if (isAppendTarget(target)) {
            // $a[] = x appends to the list.
            Object list = ((Node) target).getField("node");
            return statement(
                "do " + translateExpr(list) + ".append(" + translateExpr(expr) + ")",
                0,
                false,
                true);
          }
          return statement(
              "set " + translateExpr(target) + " = " + translateExpr(expr), 0, false, true);
        }

      case ASSIGN_OP:
        {
          if (!".=".equals(n.getField("op"))) {
            return unsupported(n, isExpr);
          }
          String variable = translateExpr(n.getField("left"));
          return statement(
              "set " + variable + " = " + variable + " ~ " + translateExpr(n.getField("right")),
              0,
              false,
              true);
        }

      case LIST_ASSIGNMENT:
        {
          List<String> targets = new ArrayList<>();
          for (Object target : n.getList("nodes")) {
            if (!(target instanceof Node) || !((Node) target).is(Kind.VARIABLE)) {
              return unsupported(n, isExpr);
            }
            targets.add(translateExpr(target));
          }
          if (targets.isEmpty()) {
            return unsupported(n, isExpr);
          }
          return statement(
              "set " + COMMA_JOINER.join(targets) + " = " + translateExpr(n.getField("expr")),
              0,
              false,
              true);
        }

      case UNARY_OP:
        return "(" + operator(n.getField("op")) + " " + translateExpr(n.getField("expr")) + ")";

      case BINARY_OP:
        return "("
            + translateExpr(n.getField("left"))
            + " "
            + operator(n.getField("op"))
            + " "
            + translateExpr(n.getField("right"))
            + ")";

      case TERNARY_OP:
        {
          String cond = translateExpr(n.getField("expr"));
          Object ifTrue = n.getField("iftrue");
          // The short form "a ?: b" yields the condition itself.
          String whenTrue = ifTrue == null ? cond : translateExpr(ifTrue);
          return "("
              + whenTrue
              + " if "
              + cond
              + " else "
              + translateExpr(n.getField("iffalse"))
              + ")";
        }

      case IS_SET:
        {
          List<?> operands = n.getList("nodes");
          if (operands.size() == 1) {
            return "(" + translateExpr(operands.get(0)) + " is defined)";
          }
          List<String> tests = new ArrayList<>(operands.size());
          for (Object operand : operands) {
            tests.add("(" + translateExpr(operand) + " is defined)");
          }
          return "(" + Joiner.on(" and ").join(tests) + ")";
        }

      case EMPTY:
        return "(not " + translateExpr(n.getField("expr")) + ")";

      case SILENCE:
        return translateExpr(n.getField("expr"));

      case CAST:
        {
          Object type = n.getField("type");
          String expr = translateExpr(n.getField("expr"));
          if (FILTER_CASTS.contains(type)) {
            return expr + "|" + type;
          }
          return expr;
        }

      case IF:
        return translateIf(n, indent);

      case WHILE:
        {
          // Jinja2 has no while loop. The condition is treated as something to iterate over,
          // which only matches PHP when the condition is itself iterable.
          Node loopVar =
              new Node(n.getLineno(), Kind.FOR_EACH_VARIABLE, run.newLoopVariable(), false);
          Node forEach =
              new Node(
                  n.getLineno(),
                  Kind.FOR_EACH,
                  n.getField("expr"),
                  null,
                  loopVar,
                  n.getField("node"));
          return translate(forEach, isExpr, indent);
        }

      case FOR_EACH:
        return translateForEach(n, isExpr, indent);

      case FUNCTION:
        return translateFunction(n, isExpr);

      case RETURN:
        // A return cannot abort a Jinja2 render; keep it visible as a comment.
        return comment(n.toString());

      case FUNCTION_CALL:
        return translateCall(n, isExpr);

      case METHOD_CALL:
        {
          String body =
              translateExpr(n.getField("node"))
                  + "."
                  + nameOf(n.getField("name"))
                  + "("
                  + translateArguments(n.getList("params"))
                  + ")";
          return isExpr ? body : expression(body);
        }

      case STATIC_METHOD_CALL:
        {
          String body =
              nameOf(n.getField("class_"))
                  + "."
                  + nameOf(n.getField("name"))
                  + "("
                  + translateArguments(n.getList("params"))
                  + ")";
          return isExpr ? body : expression(body);
        }

      case NEW:
        {
          // There is no construction syntax; "new Foo(x)" is the call "Foo(x)".
          Node call =
              new Node(n.getLineno(), Kind.FUNCTION_CALL, n.getField("name"), n.getField("params"));
          return translate(call, isExpr, indent);
        }

      case PARAMETER:
        return translateExpr(n.getField("node"));

      case CLONE:
      case BREAK:
      case CONTINUE:
      case GLOBAL:
      case STATIC:
      case UNSET:
      case THROW:
      case EXIT:
      case EVAL:
      case PRE_INC_DEC_OP:
      case POST_INC_DEC_OP:
      case MAGIC_CONSTANT:
      case STATIC_VARIABLE:
      case FORMAL_PARAMETER:
      case SCOPE_RESOLUTION:
      case METHOD:
      case CLASS:
      case CLASS_CONSTANTS:
      case CLASS_CONSTANT:
      case CLASS_VARIABLES:
      case CLASS_VARIABLE:
      case INTERFACE:
      case ELSE_IF:
      case ELSE:
      case DO_WHILE:
      case FOR:
      case FOR_EACH_VARIABLE:
      case SWITCH:
      case CASE:
      case DEFAULT:
        return unsupported(n, isExpr);
    }
    throw new IllegalStateException("Unexpected kind: " + n.getKind());
  }

  /** Renders an if chain. The if and elif bodies get a leading indent; the else body does not. */
  private String translateIf(Node n, int indent) {
    String bodyIndent = indentation(indent + 1);
    StringBuilder sb = new StringBuilder();
    sb.append(statement("if " + translateExpr(n.getField("expr")), 0, false, true))
        .append('\n')
        .append(bodyIndent)
        .append(translate(n.getField("node"), false, indent + 1));
    for (Object item : n.getList("elseifs")) {
      Node elseIf = (Node) item;
      sb.append('\n')
          .append(statement("elif " + translateExpr(elseIf.getField("expr")), 0, false, true))
          .append('\n')
          .append(bodyIndent)
          .append(translate(elseIf.getField("node"), false, indent + 1));
    }
    Node elseNode = n.getNode("else_");
    if (elseNode != null) {
      sb.append('\n')
          .append(statement("else", 0, false, true))
          .append('\n')
          .append(translate(elseNode.getField("node"), false, indent + 1));
    }
    sb.append('\n').append(statement("endif", 0, false, true));
    return sb.toString();
  }

  private String translateForEach(Node n, boolean isExpr, int indent) {
    String value = loopVariableName(n.getNode("valvar"));
    Node keyVar = n.getNode("keyvar");
    if (value == null || (keyVar != null && loopVariableName(keyVar) == null)) {
      return unsupported(n, isExpr);
    }
    String vars = keyVar != null ? loopVariableName(keyVar) + ", " + value : value;
    return statement("for " + vars + " in " + translateExpr(n.getField("expr")), 0, false, true)
        + translate(n.getField("node"), false, indent + 1)
        + statement("endfor", 0, false, true);
  }

  /** Returns the bare name bound by a ForEachVariable, or null if it has no static name. */
  private static @Nullable String loopVariableName(@Nullable Node forEachVariable) {
    if (forEachVariable == null) {
      return null;
    }
    Object name = forEachVariable.getField("name");
    if (name instanceof Node && ((Node) name).is(Kind.VARIABLE)) {
      name = ((Node) name).getField("name");
    }
    return name instanceof String ? stripSigil((String) name) : null;
  }

  private String translateFunction(Node n, boolean isExpr) {
    List<String> params = new ArrayList<>();
    for (Object param : n.getList("params")) {
      if (!(param instanceof Node) || !(((Node) param).getField("name") instanceof String)) {
        return unsupported(n, isExpr);
      }
      // Default values and by-reference flags have no macro counterpart yet.
      params.add(stripSigil(((Node) param).getString("name")));
    }
    List<String> body = new ArrayList<>();
    for (Object stmt : n.getList("nodes")) {
      body.add(translate(stmt));
    }
    return statement(
            "macro " + n.getField("name") + "(" + COMMA_JOINER.join(params) + ")", 0, false, true)
        + MACRO_BODY_SEPARATOR
        + Joiner.on(MACRO_BODY_SEPARATOR).join(body)
        + "\n"
        + statement("endmacro", 0, true, true)
        + "\n\n";
  }

  private String translateCall(Node n, boolean isExpr) {
    Object name = n.getField("name");
    if (name instanceof String) {
      run.getCallSites().record((String) name, n);
    }
    List<?> params = n.getList("params");
    String body;
    if (name instanceof String && ((String) name).endsWith("printf") && !params.isEmpty()) {
      // printf-style calls become the % formatting operator over a tuple.
      List<String> args = new ArrayList<>();
      for (Object param : params.subList(1, params.size())) {
        args.add(translateExpr(param));
      }
      String tuple = args.isEmpty() ? "()" : "(" + COMMA_JOINER.join(args) + ",)";
      body = translateExpr(params.get(0)) + " % " + tuple;
    } else {
      body = nameOf(name) + "(" + translateArguments(params) + ")";
    }
    return isExpr ? body : expression(body);
  }

  private String translateArguments(List<?> params) {
    List<String> args = new ArrayList<>(params.size());
    for (Object param : params) {
      args.add(translateExpr(param));
    }
    return COMMA_JOINER.join(args);
  }

  /** A name field is usually a plain identifier, but may be a dynamic expression. */
  private String nameOf(@Nullable Object name) {
    return name instanceof String ? (String) name : translateExpr(name);
  }

  /** Whether an assignment target is the offset-less form {@code $a[]}. */
  private static boolean isAppendTarget(@Nullable Object target) {
    return target instanceof Node
        && ((Node) target).is(Kind.ARRAY_OFFSET)
        && ((Node) target).getField("expr") == null;
  }

  private static boolean isKeyed(Object element) {
    return element instanceof Node
        && ((Node) element).is(Kind.ARRAY_ELEMENT)
        && ((Node) element).getField("key") != null;
  }

  private static String operator(@Nullable Object op) {
    String token = String.valueOf(op);
    String mapped = OPERATORS.get(token);
    return mapped != null ? mapped : token;
  }

  private static String stripSigil(String name) {
    return name.startsWith("$") ? name.substring(1) : name;
  }

  /**
   * Renders a value no rule covers: a comment marker in statement position, an {@code XXX(...)}
   * placeholder in expression position.
   */
  private String unsupported(@Nullable Object value, boolean isExpr) {
    String text = String.valueOf(value);
    String what = value instanceof Node ? ((Node) value).getKind().getKindName() : text;
    logger.fine("No translation for " + text);
    if (value instanceof Node) {
      run.report(
          TranspilerError.make(run.getSourceName(), (Node) value, UNSUPPORTED_CONSTRUCT, what));
    } else {
      run.report(TranspilerError.make(run.getSourceName(), -1, UNSUPPORTED_CONSTRUCT, what));
    }
    if (isExpr) {
      return "XXX(" + Literals.quote(text) + ")";
    }
    return comment("XXX " + text);
  }

  private String indentation(int level) {
    return Strings.repeat(options.getIndentUnit(), level);
  }

  /**
   * Renders a statement tag, or a {@code #} line statement when line statements are on.
   *
   * @param lstrip whether the tag strips whitespace before it
   * @param rstrip whether the tag strips whitespace after it
   */
  protected String statement(String content, int indent, boolean lstrip, boolean rstrip) {
    if (options.isLineStatements()) {
      return "\n# " + indentation(indent) + content + "\n";
    }
    return indentation(indent)
        + "{%"
        + (lstrip ? "-" : "")
        + " "
        + content
        + " "
        + (rstrip ? "-" : "")
        + "%}";
  }

  /** Renders an output tag; it strips the whitespace that follows it. */
  protected String expression(String body) {
    return "{{ " + body + " -}}";
  }

  protected String comment(String body) {
    return "{# " + body + " #}";
  }
}
