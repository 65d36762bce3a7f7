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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.List;
import java.util.Map;

/** Writes PHP syntax trees in the generic-form JSON that {@link AstJsonReader} reads. */
public final class AstJsonWriter {
  private final Gson gson;

  public AstJsonWriter(boolean prettyPrint) {
    GsonBuilder builder = new GsonBuilder().serializeNulls().disableHtmlEscaping();
    if (prettyPrint) {
      builder.setPrettyPrinting();
    }
    this.gson = builder.create();
  }

  public String write(List<Node> nodes) {
    JsonArray root = new JsonArray();
    for (Node node : nodes) {
      root.add(toJson(node.toGeneric(), node));
    }
    return gson.toJson(root);
  }

  private static JsonArray toJson(GenericNode generic, Node node) {
    JsonObject fields = new JsonObject();
    int i = 0;
    for (Map.Entry<String, Object> entry : generic.getFields().entrySet()) {
      fields.add(entry.getKey(), toJson(entry.getValue(), node.getValues().get(i++)));
    }
    if (node.getLineno() >= 0) {
      fields.addProperty(AstJsonReader.LINENO, node.getLineno());
    }
    JsonArray array = new JsonArray();
    array.add(generic.getKindName());
    array.add(fields);
    return array;
  }

  /**
   * Converts one generic field value. The matching original value is walked alongside so nested
   * nodes keep their line numbers.
   */
  private static JsonElement toJson(Object generic, Object original) {
    if (generic == null) {
      return JsonNull.INSTANCE;
    } else if (generic instanceof GenericNode) {
      return toJson((GenericNode) generic, (Node) original);
    } else if (generic instanceof List) {
      List<?> items = (List<?>) generic;
      List<?> originals = (List<?>) original;
      JsonArray array = new JsonArray();
      for (int i = 0; i < items.size(); i++) {
        array.add(toJson(items.get(i), originals.get(i)));
      }
      return array;
    } else if (generic instanceof Boolean) {
      return new JsonPrimitive((Boolean) generic);
    } else if (generic instanceof Number) {
      return new JsonPrimitive((Number) generic);
    }
    return new JsonPrimitive(generic.toString());
  }
}
