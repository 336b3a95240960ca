/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.elm.ast;

import static net.hydromatic.elm.ast.ElmBuilder.elm;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.elm.util.Unit;
import org.junit.jupiter.api.Test;

/** Tests for {@link Scope}. */
public class ScopeTest {
  private static <V> Expression<V> times(Expression<V> e0, Expression<V> e1) {
    return elm.applyAll(elm.<V>global("Basics.*"), e0, e1);
  }

  @Test
  void testAbstract1() {
    final Expression<String> e = times(elm.var("x"), elm.var("y"));
    final Scope<Unit, String> scope = Scope.abstract1(e, "x");
    assertThat(
        scope,
        hasToString(
            "Scope(App(App(Global(Basics.*), Var(B(()))), Var(F(y))))"));
    assertThat(
        scope.instantiate1(elm.intLiteral(2)),
        is(times(elm.intLiteral(2), elm.var("y"))));

    // Abstracting a variable that does not occur leaves the body alone
    final Scope<Unit, String> scope2 = Scope.abstract1(e, "z");
    assertThat(scope2.instantiate1(elm.intLiteral(2)), is(e));
  }

  @Test
  void testAbstractVars() {
    final Map<String, Integer> indexes = ImmutableMap.of("a", 0, "b", 1);
    final Expression<String> e =
        elm.list(elm.var("b"), elm.var("c"), elm.var("a"), elm.var("b"));
    final Scope<Integer, String> scope = Scope.abstractVars(e, indexes::get);

    final List<Integer> bound = new ArrayList<>();
    scope.forEachBound(bound::add);
    assertThat(bound, is(ImmutableList.of(1, 0, 1)));

    final Expression<String> e2 =
        scope.instantiate(i -> elm.var(i == 0 ? "first" : "second"));
    assertThat(
        e2,
        is(
            elm.list(
                elm.var("second"),
                elm.var("c"),
                elm.var("first"),
                elm.var("second"))));
    assertThat(scope.fromScope().freeVariables().size(), is(3));
  }

  /** Substituting into a scope changes only its free variables. */
  @Test
  void testSubstitute() {
    final Scope<Unit, String> scope =
        Scope.abstract1(times(elm.var("x"), elm.var("y")), "x");
    final Scope<Unit, Void> scope2 = scope.substitute(v -> elm.intLiteral(3));
    assertThat(
        scope2.instantiate1(elm.intLiteral(2)),
        is(times(elm.intLiteral(2), elm.intLiteral(3))));
    assertThat(
        scope2,
        hasToString(
            "Scope(App(App(Global(Basics.*), Var(B(()))), Int(3)))"));
  }

  @Test
  void testVar() {
    final Scope.Var<Integer, String> bound = Scope.Var.bound(3);
    final Scope.Var<Integer, String> free = Scope.Var.free("x");
    assertThat(bound.isBound(), is(true));
    assertThat(bound.bound(), is(3));
    assertThat(free.isBound(), is(false));
    assertThat(free.free(), is("x"));
    assertThat(bound, hasToString("B(3)"));
    assertThat(free, hasToString("F(x)"));
    assertThrows(IllegalStateException.class, bound::free);
    assertThrows(IllegalStateException.class, free::bound);

    final List<Scope.Var<Integer, String>> list =
        ImmutableList.of(
            Scope.Var.free("b"),
            Scope.Var.bound(2),
            Scope.Var.free("a"),
            Scope.Var.bound(1));
    assertThat(
        Scope.Var.<Integer, String>ordering(
                Integer::compareTo, String::compareTo)
            .sortedCopy(list),
        hasToString("[B(1), B(2), F(a), F(b)]"));
  }
}

// End ScopeTest.java
