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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class.
 *
 * <p>Variable names keep their leading {@code $}, as the PHP parser produces them.
 */
public class PhpIR {

  private PhpIR() {}

  public static Node inlineHtml(String data) {
    return new Node(Kind.INLINE_HTML, data);
  }

  public static Node block(Node... stmts) {
    return block(Arrays.asList(stmts));
  }

  public static Node block(List<Node> stmts) {
    return new Node(Kind.BLOCK, ImmutableList.copyOf(stmts));
  }

  public static Node variable(String name) {
    checkArgument(name.startsWith("$"), "variable name must start with '$': %s", name);
    return new Node(Kind.VARIABLE, name);
  }

  public static Node constant(String name) {
    return new Node(Kind.CONSTANT, name);
  }

  public static Node magicConstant(String name, @Nullable Object value) {
    return new Node(Kind.MAGIC_CONSTANT, name, value);
  }

  public static Node assign(Node target, Object value) {
    return new Node(Kind.ASSIGNMENT, target, value, false);
  }

  public static Node assignRef(Node target, Object value) {
    return new Node(Kind.ASSIGNMENT, target, value, true);
  }

  public static Node listAssign(List<@Nullable Node> targets, Object value) {
    return new Node(Kind.LIST_ASSIGNMENT, targets, value);
  }

  public static Node assignOp(String op, Node left, Object right) {
    checkArgument(op.endsWith("="), "not an assignment operator: %s", op);
    return new Node(Kind.ASSIGN_OP, op, left, right);
  }

  public static Node binaryOp(String op, Object left, Object right) {
    return new Node(Kind.BINARY_OP, op, left, right);
  }

  public static Node unaryOp(String op, Object expr) {
    return new Node(Kind.UNARY_OP, op, expr);
  }

  public static Node ternaryOp(Object cond, @Nullable Object ifTrue, Object ifFalse) {
    return new Node(Kind.TERNARY_OP, cond, ifTrue, ifFalse);
  }

  public static Node preIncDec(String op, Node expr) {
    return new Node(Kind.PRE_INC_DEC_OP, op, expr);
  }

  public static Node postIncDec(String op, Node expr) {
    return new Node(Kind.POST_INC_DEC_OP, op, expr);
  }

  public static Node cast(String type, Object expr) {
    return new Node(Kind.CAST, type, expr);
  }

  public static Node isSet(Node... exprs) {
    checkArgument(exprs.length > 0, "isset() needs at least one operand");
    return new Node(Kind.IS_SET, ImmutableList.copyOf(exprs));
  }

  public static Node empty(Object expr) {
    return new Node(Kind.EMPTY, expr);
  }

  public static Node eval(Object expr) {
    return new Node(Kind.EVAL, expr);
  }

  public static Node silence(Object expr) {
    return new Node(Kind.SILENCE, expr);
  }

  public static Node include(Object expr, boolean once) {
    return new Node(Kind.INCLUDE, expr, once);
  }

  public static Node require(Object expr, boolean once) {
    return new Node(Kind.REQUIRE, expr, once);
  }

  public static Node exit(@Nullable Object expr) {
    return new Node(Kind.EXIT, expr);
  }

  public static Node echo(Object... exprs) {
    checkArgument(exprs.length > 0, "echo needs at least one operand");
    return new Node(Kind.ECHO, Arrays.asList(exprs));
  }

  public static Node print(Object expr) {
    return new Node(Kind.PRINT, expr);
  }

  public static Node unset(Node... targets) {
    return new Node(Kind.UNSET, ImmutableList.copyOf(targets));
  }

  public static Node throwNode(Node expr) {
    return new Node(Kind.THROW, expr);
  }

  public static Node returnNode(@Nullable Object expr) {
    return new Node(Kind.RETURN, expr);
  }

  public static Node breakNode(@Nullable Object levels) {
    return new Node(Kind.BREAK, levels);
  }

  public static Node continueNode(@Nullable Object levels) {
    return new Node(Kind.CONTINUE, levels);
  }

  public static Node global(Node... vars) {
    return new Node(Kind.GLOBAL, ImmutableList.copyOf(vars));
  }

  public static Node staticNode(Node... vars) {
    return new Node(Kind.STATIC, ImmutableList.copyOf(vars));
  }

  public static Node staticVariable(String name, @Nullable Object initial) {
    return new Node(Kind.STATIC_VARIABLE, name, initial);
  }

  public static Node clone(Node expr) {
    return new Node(Kind.CLONE, expr);
  }

  public static Node formalParameter(String name, @Nullable Object defaultValue, boolean isRef) {
    return new Node(Kind.FORMAL_PARAMETER, name, defaultValue, isRef);
  }

  public static Node formalParameter(String name) {
    return formalParameter(name, null, false);
  }

  public static Node function(String name, List<Node> params, List<Node> body) {
    for (Node param : params) {
      checkState(param.is(Kind.FORMAL_PARAMETER), param);
    }
    return new Node(Kind.FUNCTION, name, params, body, false);
  }

  public static Node method(
      String name, List<String> modifiers, List<Node> params, List<Node> body) {
    return new Node(Kind.METHOD, name, modifiers, params, body, false);
  }

  public static Node classNode(
      String name,
      @Nullable String type,
      @Nullable Object extendsName,
      List<?> implementsNames,
      List<Node> members) {
    return new Node(Kind.CLASS, name, type, extendsName, implementsNames, members);
  }

  public static Node classConstants(Node... constants) {
    return new Node(Kind.CLASS_CONSTANTS, ImmutableList.copyOf(constants));
  }

  public static Node classConstant(String name, Object initial) {
    return new Node(Kind.CLASS_CONSTANT, name, initial);
  }

  public static Node classVariables(List<String> modifiers, Node... variables) {
    return new Node(Kind.CLASS_VARIABLES, modifiers, ImmutableList.copyOf(variables));
  }

  public static Node classVariable(String name, @Nullable Object initial) {
    return new Node(Kind.CLASS_VARIABLE, name, initial);
  }

  public static Node interfaceNode(String name, List<?> extendsNames, List<Node> members) {
    return new Node(Kind.INTERFACE, name, extendsNames, members);
  }

  /** Wraps an argument expression as a call parameter. */
  public static Node param(Object expr) {
    return new Node(Kind.PARAMETER, expr, false);
  }

  public static Node call(String name, Object... args) {
    return new Node(Kind.FUNCTION_CALL, name, params(args));
  }

  public static Node methodCall(Node receiver, String name, Object... args) {
    return new Node(Kind.METHOD_CALL, receiver, name, params(args));
  }

  public static Node staticMethodCall(String className, String name, Object... args) {
    return new Node(Kind.STATIC_METHOD_CALL, className, name, params(args));
  }

  public static Node newNode(String className, Object... args) {
    return new Node(Kind.NEW, className, params(args));
  }

  private static List<Node> params(Object... args) {
    List<Node> params = new ArrayList<>(args.length);
    for (Object arg : args) {
      params.add(param(arg));
    }
    return params;
  }

  public static Node array(Node... elements) {
    for (Node element : elements) {
      checkState(element.is(Kind.ARRAY_ELEMENT), element);
    }
    return new Node(Kind.ARRAY, ImmutableList.copyOf(elements));
  }

  public static Node arrayElement(Object value) {
    return new Node(Kind.ARRAY_ELEMENT, null, value, false);
  }

  public static Node arrayElement(Object key, Object value) {
    return new Node(Kind.ARRAY_ELEMENT, key, value, false);
  }

  /** An offset access; a null offset is the append form {@code $a[]}. */
  public static Node arrayOffset(Object target, @Nullable Object offset) {
    return new Node(Kind.ARRAY_OFFSET, target, offset);
  }

  public static Node stringOffset(Object target, Object offset) {
    return new Node(Kind.STRING_OFFSET, target, offset);
  }

  public static Node objectProperty(Object target, Object name) {
    return new Node(Kind.OBJECT_PROPERTY, target, name);
  }

  public static Node staticProperty(Object className, String name) {
    return new Node(Kind.STATIC_PROPERTY, className, name);
  }

  public static Node scopeResolution(String className, Object member) {
    return new Node(Kind.SCOPE_RESOLUTION, className, member);
  }

  public static Node ifNode(
      Object cond, Node body, List<Node> elseIfs, @Nullable Node elseNode) {
    for (Node elseIf : elseIfs) {
      checkState(elseIf.is(Kind.ELSE_IF), elseIf);
    }
    checkState(elseNode == null || elseNode.is(Kind.ELSE), elseNode);
    return new Node(Kind.IF, cond, body, elseIfs, elseNode);
  }

  public static Node ifNode(Object cond, Node body) {
    return ifNode(cond, body, ImmutableList.of(), null);
  }

  public static Node elseIf(Object cond, Node body) {
    return new Node(Kind.ELSE_IF, cond, body);
  }

  public static Node elseNode(Node body) {
    return new Node(Kind.ELSE, body);
  }

  public static Node whileNode(Object cond, Node body) {
    return new Node(Kind.WHILE, cond, body);
  }

  public static Node doWhile(Node body, Object cond) {
    return new Node(Kind.DO_WHILE, body, cond);
  }

  public static Node forNode(List<Node> start, List<Node> test, List<Node> count, Node body) {
    return new Node(Kind.FOR, start, test, count, body);
  }

  public static Node forEach(
      Object iterable, @Nullable Node keyVar, Node valueVar, Node body) {
    checkState(keyVar == null || keyVar.is(Kind.FOR_EACH_VARIABLE), keyVar);
    checkState(valueVar.is(Kind.FOR_EACH_VARIABLE), valueVar);
    return new Node(Kind.FOR_EACH, iterable, keyVar, valueVar, body);
  }

  /** A foreach binding; {@code name} is either a {@code $name} string or a Variable node. */
  public static Node forEachVariable(Object name, boolean isRef) {
    return new Node(Kind.FOR_EACH_VARIABLE, name, isRef);
  }

  public static Node forEachVariable(String name) {
    return forEachVariable(name, false);
  }

  public static Node switchNode(Object expr, Node... cases) {
    for (Node c : cases) {
      checkState(c.is(Kind.CASE) || c.is(Kind.DEFAULT), c);
    }
    return new Node(Kind.SWITCH, expr, ImmutableList.copyOf(cases));
  }

  public static Node caseNode(Object expr, Node... stmts) {
    return new Node(Kind.CASE, expr, ImmutableList.copyOf(stmts));
  }

  public static Node defaultNode(Node... stmts) {
    return new Node(Kind.DEFAULT, ImmutableList.copyOf(stmts));
  }
}
