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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.php2jinja.ast.Kind;
import com.google.php2jinja.ast.Node;

/**
 * Every plain function call seen during one translation run, keyed by callee name in first-seen
 * order. Method and static method calls are not recorded.
 */
public final class CallSiteRegistry {
  private final ListMultimap<String, Node> calls =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  /** Records a FunctionCall node under its name. */
  public void record(String name, Node call) {
    checkArgument(call.is(Kind.FUNCTION_CALL), "not a function call: %s", call);
    calls.put(name, call);
  }

  public boolean isEmpty() {
    return calls.isEmpty();
  }

  /** Returns the recorded callee names in the order they were first seen. */
  public ImmutableSet<String> getCalledNames() {
    return ImmutableSet.copyOf(calls.keySet());
  }

  /** Returns every recorded call of {@code name}, in the order seen. */
  public ImmutableList<Node> getCalls(String name) {
    return ImmutableList.copyOf(calls.get(name));
  }
}
