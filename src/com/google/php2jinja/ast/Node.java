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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An immutable PHP syntax node: a {@link Kind} plus exactly one value per field the kind
 * declares.
 *
 * <p>A field value is {@code null}, a {@link String}, a {@link Long}, a {@link BigInteger} for
 * integers beyond the range of a long, a {@link Double}, a {@link Boolean}, another {@code
 * Node}, or a list of those. Absent parts of a construct (no else clause, no key variable) are
 * present-but-null fields, never missing ones.
 *
 * <p>The line number is carried for diagnostics only; it takes no part in equality.
 */
public final class Node {
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final Kind kind;
  private final List<@Nullable Object> values;
  private final int lineno;

  /**
   * Creates a node without a source position.
   *
   * @throws IllegalArgumentException if the number of values differs from the kind's arity
   */
  public Node(Kind kind, @Nullable Object... values) {
    this(-1, kind, values);
  }

  /**
   * Creates a node at the given one-indexed line, or -1 if unknown.
   *
   * @throws IllegalArgumentException if the number of values differs from the kind's arity
   */
  public Node(int lineno, Kind kind, @Nullable Object... values) {
    checkNotNull(kind);
    checkNotNull(values, "values");
    checkArgument(
        values.length == kind.getArity(),
        "%s takes %s arguments, got %s",
        kind.getKindName(),
        kind.getArity(),
        values.length);
    List<@Nullable Object> copy = new ArrayList<>(values.length);
    for (Object value : values) {
      copy.add(freeze(value));
    }
    this.kind = kind;
    this.values = Collections.unmodifiableList(copy);
    this.lineno = lineno;
  }

  /**
   * Normalizes a field value: lists become unmodifiable copies, integral numbers that fit a long
   * become Longs.
   */
  private static @Nullable Object freeze(@Nullable Object value) {
    if (value instanceof List) {
      List<@Nullable Object> items = new ArrayList<>();
      for (Object item : (List<?>) value) {
        items.add(freeze(item));
      }
      return Collections.unmodifiableList(items);
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    } else if (value instanceof BigInteger && ((BigInteger) value).bitLength() < Long.SIZE) {
      return ((BigInteger) value).longValue();
    } else if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    return value;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  /** Returns the one-indexed source line, or -1 if unknown. */
  public int getLineno() {
    return lineno;
  }

  /** Returns the field values in declaration order. */
  public List<@Nullable Object> getValues() {
    return values;
  }

  /**
   * Returns the value of the named field.
   *
   * @throws IllegalArgumentException if this node's kind declares no such field
   */
  public @Nullable Object getField(String fieldName) {
    int index = kind.indexOf(fieldName);
    checkArgument(index >= 0, "%s has no field '%s'", kind.getKindName(), fieldName);
    return values.get(index);
  }

  /** Returns the named field, which must hold a node or null. */
  public @Nullable Node getNode(String fieldName) {
    Object value = getField(fieldName);
    checkState(
        value == null || value instanceof Node,
        "%s.%s is not a node: %s",
        kind.getKindName(),
        fieldName,
        value);
    return (Node) value;
  }

  /** Returns the named field as a list; a null field reads as the empty list. */
  public List<?> getList(String fieldName) {
    Object value = getField(fieldName);
    if (value == null) {
      return Collections.emptyList();
    }
    checkState(
        value instanceof List,
        "%s.%s is not a list: %s",
        kind.getKindName(),
        fieldName,
        value);
    return (List<?>) value;
  }

  /** Returns the named field, which must hold a string or null. */
  public @Nullable String getString(String fieldName) {
    Object value = getField(fieldName);
    checkState(
        value == null || value instanceof String,
        "%s.%s is not a string: %s",
        kind.getKindName(),
        fieldName,
        value);
    return (String) value;
  }

  /** Returns the named field as a boolean; anything but {@code Boolean.TRUE} reads as false. */
  public boolean getBoolean(String fieldName) {
    return Boolean.TRUE.equals(getField(fieldName));
  }

  /**
   * Converts this node to its language-agnostic generic form. Nested nodes are converted
   * recursively, lists element-wise.
   */
  public GenericNode toGeneric() {
    Map<String, @Nullable Object> fields = new LinkedHashMap<>();
    for (int i = 0; i < values.size(); i++) {
      fields.put(kind.getFieldNames().get(i), toGenericValue(values.get(i)));
    }
    return GenericNode.create(kind.getKindName(), fields);
  }

  private static @Nullable Object toGenericValue(@Nullable Object value) {
    if (value instanceof Node) {
      return ((Node) value).toGeneric();
    } else if (value instanceof List) {
      List<@Nullable Object> items = new ArrayList<>();
      for (Object item : (List<?>) value) {
        items.add(toGenericValue(item));
      }
      return Collections.unmodifiableList(items);
    }
    return value;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node other = (Node) o;
    return kind == other.kind && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, values);
  }

  /** Returns the node's textual form, e.g. {@code Variable('$x')}. */
  @Override
  public String toString() {
    List<String> items = new ArrayList<>(values.size());
    for (Object value : values) {
      items.add(Literals.repr(value));
    }
    return kind.getKindName() + "(" + COMMA_JOINER.join(items) + ")";
  }
}
