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
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Reads PHP syntax trees serialized in generic form as JSON.
 *
 * <p>The document is an array of top-level nodes. Each node is a two element array holding its
 * kind name and an object with one entry per field, plus an optional {@code "lineno"}:
 *
 * <pre>
 * [["Echo", {"nodes": [["Variable", {"name": "$x"}]], "lineno": 3}]]
 * </pre>
 */
public final class AstJsonReader {
  static final String LINENO = "lineno";

  public ImmutableList<Node> read(String json) throws AstParseException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new AstParseException("JSON parse exception: " + e.getMessage(), e);
    }
    if (!root.isJsonArray()) {
      throw new AstParseException("Expected an array of top-level nodes");
    }
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (JsonElement each : root.getAsJsonArray()) {
      if (!isNode(each)) {
        throw new AstParseException("Expected a node but found: " + each);
      }
      nodes.add(readNode(each.getAsJsonArray()));
    }
    return nodes.build();
  }

  private static boolean isNode(JsonElement element) {
    if (!element.isJsonArray()) {
      return false;
    }
    JsonArray array = element.getAsJsonArray();
    return array.size() == 2
        && array.get(0).isJsonPrimitive()
        && array.get(0).getAsJsonPrimitive().isString()
        && array.get(1).isJsonObject();
  }

  private Node readNode(JsonArray array) throws AstParseException {
    String kindName = array.get(0).getAsString();
    JsonObject fields = array.get(1).getAsJsonObject();
    int lineno = readLineno(fields);

    Kind kind = Kind.fromKindName(kindName);
    if (kind == null) {
      throw new AstParseException("Unknown node kind: " + kindName, lineno);
    }
    for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
      if (!entry.getKey().equals(LINENO) && kind.indexOf(entry.getKey()) < 0) {
        throw new AstParseException(kindName + " has no field '" + entry.getKey() + "'", lineno);
      }
    }

    Object[] values = new Object[kind.getArity()];
    for (int i = 0; i < values.length; i++) {
      String fieldName = kind.getFieldNames().get(i);
      if (!fields.has(fieldName)) {
        throw new AstParseException(kindName + " is missing field '" + fieldName + "'", lineno);
      }
      values[i] = readValue(fields.get(fieldName));
    }
    return new Node(lineno, kind, values);
  }

  private static int readLineno(JsonObject fields) throws AstParseException {
    if (!fields.has(LINENO) || fields.get(LINENO).isJsonNull()) {
      return -1;
    }
    try {
      return fields.get(LINENO).getAsInt();
    } catch (RuntimeException e) {
      throw new AstParseException("Bad lineno: " + fields.get(LINENO), e);
    }
  }

  private @Nullable Object readValue(JsonElement element) throws AstParseException {
    if (element.isJsonNull()) {
      return null;
    } else if (isNode(element)) {
      return readNode(element.getAsJsonArray());
    } else if (element.isJsonArray()) {
      List<@Nullable Object> items = new ArrayList<>();
      for (JsonElement item : element.getAsJsonArray()) {
        items.add(readValue(item));
      }
      return items;
    } else if (element.isJsonPrimitive()) {
      return readPrimitive(element.getAsJsonPrimitive());
    }
    throw new AstParseException("Unexpected field value: " + element);
  }

  private static Object readPrimitive(JsonPrimitive primitive) {
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean();
    } else if (primitive.isNumber()) {
      String text = primitive.getAsString();
      if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
        // PHP integer literals are unbounded in the parser output.
        BigInteger value = primitive.getAsBigInteger();
        return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
      }
      return primitive.getAsDouble();
    }
    return primitive.getAsString();
  }
}
