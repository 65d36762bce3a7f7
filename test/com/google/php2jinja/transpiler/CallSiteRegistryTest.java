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
import static com.google.php2jinja.ast.PhpIR.call;
import static com.google.php2jinja.ast.PhpIR.methodCall;
import static com.google.php2jinja.ast.PhpIR.variable;
import static org.junit.Assert.assertThrows;

import com.google.php2jinja.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CallSiteRegistryTest {

  @Test
  public void testRecordsInFirstSeenOrder() {
    CallSiteRegistry registry = new CallSiteRegistry();
    assertThat(registry.isEmpty()).isTrue();

    Node first = call("b", 1L);
    Node second = call("a");
    Node third = call("b", 2L);
    registry.record("b", first);
    registry.record("a", second);
    registry.record("b", third);

    assertThat(registry.isEmpty()).isFalse();
    assertThat(registry.getCalledNames()).containsExactly("b", "a").inOrder();
    assertThat(registry.getCalls("b")).containsExactly(first, third).inOrder();
    assertThat(registry.getCalls("missing")).isEmpty();
  }

  @Test
  public void testOnlyFunctionCallsAreRecorded() {
    CallSiteRegistry registry = new CallSiteRegistry();
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.record("m", methodCall(variable("$o"), "m")));
  }
}
