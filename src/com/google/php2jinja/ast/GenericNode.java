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

import com.google.auto.value.AutoValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The generic form of a {@link Node}: its kind name and a field map in declaration order. Nested
 * nodes are themselves generic nodes. Used for inspection and serialization only.
 */
@AutoValue
public abstract class GenericNode {

  public static GenericNode create(String kindName, Map<String, @Nullable Object> fields) {
    return new AutoValue_GenericNode(
        kindName, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
  }

  public abstract String getKindName();

  public abstract Map<String, @Nullable Object> getFields();
}
