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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The closed set of PHP syntax node kinds, each with its fixed, ordered list of field names.
 *
 * <p>Field names follow the PHP parser that produces the trees, so a tree dumped in generic form
 * by that parser can be read back without renaming. Newer parser releases spell the foreach kinds
 * {@code Foreach} and {@code ForeachVariable}; {@link #fromKindName} accepts both spellings.
 */
public enum Kind {
  INLINE_HTML("InlineHTML", "data"),
  BLOCK("Block", "nodes"),
  ASSIGNMENT("Assignment", "node", "expr", "is_ref"),
  LIST_ASSIGNMENT("ListAssignment", "nodes", "expr"),
  NEW("New", "name", "params"),
  CLONE("Clone", "node"),
  BREAK("Break", "node"),
  CONTINUE("Continue", "node"),
  RETURN("Return", "node"),
  GLOBAL("Global", "nodes"),
  STATIC("Static", "nodes"),
  ECHO("Echo", "nodes"),
  PRINT("Print", "node"),
  UNSET("Unset", "nodes"),
  THROW("Throw", "node"),
  FUNCTION("Function", "name", "params", "nodes", "is_ref"),
  METHOD("Method", "name", "modifiers", "params", "nodes", "is_ref"),
  CLASS("Class", "name", "type", "extends", "implements", "nodes"),
  CLASS_CONSTANTS("ClassConstants", "nodes"),
  CLASS_CONSTANT("ClassConstant", "name", "initial"),
  CLASS_VARIABLES("ClassVariables", "modifiers", "nodes"),
  CLASS_VARIABLE("ClassVariable", "name", "initial"),
  INTERFACE("Interface", "name", "extends", "nodes"),
  ASSIGN_OP("AssignOp", "op", "left", "right"),
  BINARY_OP("BinaryOp", "op", "left", "right"),
  UNARY_OP("UnaryOp", "op", "expr"),
  TERNARY_OP("TernaryOp", "expr", "iftrue", "iffalse"),
  PRE_INC_DEC_OP("PreIncDecOp", "op", "expr"),
  POST_INC_DEC_OP("PostIncDecOp", "op", "expr"),
  CAST("Cast", "type", "expr"),
  IS_SET("IsSet", "nodes"),
  EMPTY("Empty", "expr"),
  EVAL("Eval", "expr"),
  INCLUDE("Include", "expr", "once"),
  REQUIRE("Require", "expr", "once"),
  EXIT("Exit", "expr"),
  SILENCE("Silence", "expr"),
  MAGIC_CONSTANT("MagicConstant", "name", "value"),
  CONSTANT("Constant", "name"),
  VARIABLE("Variable", "name"),
  STATIC_VARIABLE("StaticVariable", "name", "initial"),
  FORMAL_PARAMETER("FormalParameter", "name", "default", "is_ref"),
  PARAMETER("Parameter", "node", "is_ref"),
  FUNCTION_CALL("FunctionCall", "name", "params"),
  ARRAY("Array", "nodes"),
  ARRAY_ELEMENT("ArrayElement", "key", "value", "is_ref"),
  ARRAY_OFFSET("ArrayOffset", "node", "expr"),
  STRING_OFFSET("StringOffset", "node", "expr"),
  OBJECT_PROPERTY("ObjectProperty", "node", "name"),
  STATIC_PROPERTY("StaticProperty", "node", "name"),
  METHOD_CALL("MethodCall", "node", "name", "params"),
  STATIC_METHOD_CALL("StaticMethodCall", "class_", "name", "params"),
  SCOPE_RESOLUTION("ScopeResolution", "class_", "node"),
  IF("If", "expr", "node", "elseifs", "else_"),
  ELSE_IF("ElseIf", "expr", "node"),
  ELSE("Else", "node"),
  WHILE("While", "expr", "node"),
  DO_WHILE("DoWhile", "node", "expr"),
  FOR("For", "start", "test", "count", "node"),
  FOR_EACH("ForEach", "expr", "keyvar", "valvar", "node"),
  FOR_EACH_VARIABLE("ForEachVariable", "name", "is_ref"),
  SWITCH("Switch", "expr", "nodes"),
  CASE("Case", "expr", "nodes"),
  DEFAULT("Default", "nodes");

  private static final ImmutableMap<String, Kind> BY_KIND_NAME;

  static {
    ImmutableMap.Builder<String, Kind> builder = ImmutableMap.builder();
    for (Kind kind : values()) {
      builder.put(kind.kindName, kind);
    }
    builder.put("Foreach", FOR_EACH);
    builder.put("ForeachVariable", FOR_EACH_VARIABLE);
    BY_KIND_NAME = builder.buildOrThrow();
  }

  private final String kindName;
  private final ImmutableList<String> fieldNames;

  Kind(String kindName, String... fieldNames) {
    this.kindName = kindName;
    this.fieldNames = ImmutableList.copyOf(fieldNames);
  }

  /** Returns the name the PHP parser uses for this kind, e.g. {@code "ForEach"}. */
  public String getKindName() {
    return kindName;
  }

  public ImmutableList<String> getFieldNames() {
    return fieldNames;
  }

  public int getArity() {
    return fieldNames.size();
  }

  /** Returns the position of the named field, or -1 if this kind has no such field. */
  public int indexOf(String fieldName) {
    return fieldNames.indexOf(fieldName);
  }

  /**
   * Looks up a kind by its parser name, or by a known alternate spelling. Returns null for names
   * outside the closed set.
   */
  public static @Nullable Kind fromKindName(String kindName) {
    return BY_KIND_NAME.get(kindName);
  }
}
