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

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Textual forms of the scalar values that appear as node fields. */
public final class Literals {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private Literals() {}

  /**
   * Returns {@code s} as a quoted string literal. Single quotes are used unless the text contains
   * a single quote and no double quote.
   */
  public static String quote(String s) {
    char quote = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append(quote);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c == quote) {
            sb.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append(quote);
    return sb.toString();
  }

  /**
   * Returns the textual form of a field value: quoted strings, bracketed lists, {@code null},
   * {@code true}/{@code false}, numbers as decimal text, nodes as {@link Node#toString()}.
   */
  public static String repr(@Nullable Object value) {
    if (value == null) {
      return "null";
    } else if (value instanceof String) {
      return quote((String) value);
    } else if (value instanceof List) {
      List<String> items = new ArrayList<>();
      for (Object item : (List<?>) value) {
        items.add(repr(item));
      }
      return "[" + COMMA_JOINER.join(items) + "]";
    }
    return value.toString();
  }
}
