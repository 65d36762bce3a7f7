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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PhpIRTest {

  @Test
  public void testVariableNeedsSigil() {
    assertThat(PhpIR.variable("$x").getString("name")).isEqualTo("$x");
    assertThrows(IllegalArgumentException.class, () -> PhpIR.variable("x"));
  }

  @Test
  public void testAssignOpNeedsAssignmentOperator() {
    assertThat(PhpIR.assignOp(".=", PhpIR.variable("$a"), "x").getField("op")).isEqualTo(".=");
    assertThrows(
        IllegalArgumentException.class, () -> PhpIR.assignOp(".", PhpIR.variable("$a"), "x"));
  }

  @Test
  public void testCallWrapsArgumentsAsParameters() {
    Node call = PhpIR.call("f", PhpIR.variable("$a"), 2L);
    assertThat(call.getList("params"))
        .containsExactly(
            new Node(Kind.PARAMETER, PhpIR.variable("$a"), false),
            new Node(Kind.PARAMETER, 2L, false))
        .inOrder();
    assertThat(PhpIR.call("g").getList("params")).isEmpty();
  }

  @Test
  public void testIfChecksClauseKinds() {
    Node body = PhpIR.block();
    Node ok =
        PhpIR.ifNode(
            PhpIR.variable("$a"),
            body,
            ImmutableList.of(PhpIR.elseIf(PhpIR.variable("$b"), body)),
            PhpIR.elseNode(body));
    assertThat(ok.getList("elseifs")).hasSize(1);
    assertThrows(
        IllegalStateException.class,
        () -> PhpIR.ifNode(PhpIR.variable("$a"), body, ImmutableList.of(body), null));
    assertThrows(
        IllegalStateException.class,
        () -> PhpIR.ifNode(PhpIR.variable("$a"), body, ImmutableList.of(), body));
  }

  @Test
  public void testArrayNeedsElements() {
    assertThrows(IllegalStateException.class, () -> PhpIR.array(PhpIR.variable("$a")));
    Node keyed = PhpIR.arrayElement("k", 1L);
    assertThat(keyed.getField("key")).isEqualTo("k");
    assertThat(PhpIR.arrayElement(1L).getField("key")).isNull();
  }

  @Test
  public void testForEachChecksVariables() {
    assertThrows(
        IllegalStateException.class,
        () ->
            PhpIR.forEach(
                PhpIR.variable("$items"), null, PhpIR.variable("$item"), PhpIR.block()));
  }

  @Test
  public void testEchoNeedsOperand() {
    assertThrows(IllegalArgumentException.class, () -> PhpIR.echo());
  }

  @Test
  public void testSimpleStatementFactories() {
    Node target = PhpIR.variable("$a");
    assertThat(PhpIR.assignRef(target, PhpIR.variable("$b")))
        .isEqualTo(new Node(Kind.ASSIGNMENT, target, PhpIR.variable("$b"), true));
    assertThat(PhpIR.unset(target).getList("nodes")).containsExactly(target);
    assertThat(PhpIR.throwNode(target).getNode("node")).isEqualTo(target);
    assertThat(PhpIR.continueNode(2).getField("node")).isEqualTo(2L);
    assertThat(PhpIR.continueNode(null).getField("node")).isNull();
    assertThat(PhpIR.global(target, PhpIR.variable("$b")).getList("nodes")).hasSize(2);
    assertThat(PhpIR.clone(target)).isEqualTo(new Node(Kind.CLONE, target));
    assertThat(PhpIR.eval("1;").getField("expr")).isEqualTo("1;");
    assertThat(PhpIR.postIncDec("--", target))
        .isEqualTo(new Node(Kind.POST_INC_DEC_OP, "--", target));
    assertThat(PhpIR.magicConstant("__LINE__", 3L).getValues())
        .containsExactly("__LINE__", 3L)
        .inOrder();
  }

  @Test
  public void testStaticFactories() {
    Node counter = PhpIR.staticVariable("$count", 0L);
    assertThat(counter.getKind()).isEqualTo(Kind.STATIC_VARIABLE);
    assertThat(counter.getString("name")).isEqualTo("$count");
    assertThat(counter.getField("initial")).isEqualTo(0L);
    assertThat(PhpIR.staticVariable("$cache", null).getField("initial")).isNull();
    assertThat(PhpIR.staticNode(counter).getList("nodes")).containsExactly(counter);
  }

  @Test
  public void testClassFactories() {
    Node constant = PhpIR.classConstant("LIMIT", 10L);
    Node constants = PhpIR.classConstants(constant);
    Node property = PhpIR.classVariable("$name", null);
    Node properties = PhpIR.classVariables(ImmutableList.of("private"), property);
    Node c =
        PhpIR.classNode(
            "Pager", null, "Base", ImmutableList.of("Countable"), ImmutableList.of(constants));

    assertThat(constants.getList("nodes")).containsExactly(constant);
    assertThat(constant.getValues()).containsExactly("LIMIT", 10L).inOrder();
    assertThat(property.getValues()).containsExactly("$name", null).inOrder();
    assertThat(properties.getList("modifiers")).containsExactly("private");
    assertThat(properties.getList("nodes")).containsExactly(property);
    assertThat(c.getString("name")).isEqualTo("Pager");
    assertThat(c.getField("type")).isNull();
    assertThat(c.getField("extends")).isEqualTo("Base");
    assertThat(c.getList("implements")).containsExactly("Countable");
    assertThat(c.getList("nodes")).containsExactly(constants);

    Node i = PhpIR.interfaceNode("Renderable", ImmutableList.of(), ImmutableList.of(properties));
    assertThat(i.getKind()).isEqualTo(Kind.INTERFACE);
    assertThat(i.getList("extends")).isEmpty();
    assertThat(i.getList("nodes")).containsExactly(properties);
  }

  @Test
  public void testLoopFactories() {
    Node i = PhpIR.variable("$i");
    Node body = PhpIR.block(PhpIR.echo(i));
    Node doWhile = PhpIR.doWhile(body, i);
    assertThat(doWhile.getValues()).containsExactly(body, i).inOrder();

    Node forLoop =
        PhpIR.forNode(
            ImmutableList.of(PhpIR.assign(i, 0L)),
            ImmutableList.of(PhpIR.binaryOp("<", i, 3L)),
            ImmutableList.of(PhpIR.postIncDec("++", i)),
            body);
    assertThat(forLoop.getKind().getFieldNames())
        .containsExactly("start", "test", "count", "node")
        .inOrder();
    assertThat(forLoop.getList("start")).containsExactly(PhpIR.assign(i, 0L));
    assertThat(forLoop.getList("count")).containsExactly(PhpIR.postIncDec("++", i));
    assertThat(forLoop.getNode("node")).isEqualTo(body);
  }

  @Test
  public void testSwitchChecksClauseKinds() {
    Node echo = PhpIR.echo("one");
    Node one = PhpIR.caseNode(1L, echo, PhpIR.breakNode(null));
    Node other = PhpIR.defaultNode(echo);
    Node s = PhpIR.switchNode(PhpIR.variable("$n"), one, other);

    assertThat(one.getField("expr")).isEqualTo(1L);
    assertThat(one.getList("nodes")).hasSize(2);
    assertThat(other.getList("nodes")).containsExactly(echo);
    assertThat(s.getList("nodes")).containsExactly(one, other).inOrder();
    assertThat(PhpIR.switchNode(PhpIR.variable("$n")).getList("nodes")).isEmpty();
    assertThrows(
        IllegalStateException.class, () -> PhpIR.switchNode(PhpIR.variable("$n"), echo));
  }
}
