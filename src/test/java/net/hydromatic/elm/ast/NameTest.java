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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Name}. */
public class NameTest {
  @Test
  void testQualified() {
    checkQualified("Maybe.Just", ImmutableList.of("Maybe"), "Just");
    checkQualified(
        "Json.Decode.field", ImmutableList.of("Json", "Decode"), "field");
    checkQualified("Parser.|.", ImmutableList.of("Parser"), "|.");
    checkQualified("Basics.,", ImmutableList.of("Basics"), ",");
    checkQualified("Basics.//", ImmutableList.of("Basics"), "//");
    checkQualified("List.::", ImmutableList.of("List"), "::");
    checkQualified("x", ImmutableList.of(), "x");
    checkQualified("point.x", ImmutableList.of(), "point.x");

    final Name.Qualified name =
        Name.Qualified.of(ImmutableList.of("Html", "Attributes"), "class");
    assertThat(name, hasToString("Html.Attributes.class"));
    assertThat(name.moduleName(), is("Html.Attributes"));
    assertThat(name, is(Name.Qualified.of("Html.Attributes.class")));
  }

  private static void checkQualified(
      String s, List<String> modules, String name) {
    final Name.Qualified q = Name.Qualified.of(s);
    assertThat(q.modules, is(modules));
    assertThat(q.name, is(name));
    assertThat(q, hasToString(s));
  }

  /** Names sort by module path, then by identifier; a module sorts before
   * its sub-modules. */
  @Test
  void testQualifiedOrdering() {
    final List<Name.Qualified> names =
        ImmutableList.of(
            Name.Qualified.of("Html.Attributes.class"),
            Name.Qualified.of("Html.text"),
            Name.Qualified.of("Basics.max"),
            Name.Qualified.of("Html.div"),
            Name.Qualified.of("x"));
    assertThat(
        Ordering.<Name.Qualified>natural().sortedCopy(names),
        hasToString(
            "[x, Basics.max, Html.div, Html.text, Html.Attributes.class]"));
  }

  @Test
  void testEmpty() {
    assertThrows(IllegalArgumentException.class, () -> Name.Local.of(""));
    assertThrows(IllegalArgumentException.class, () -> Name.Field.of(""));
    assertThrows(
        IllegalArgumentException.class, () -> Name.Constructor.of(""));
    assertThrows(IllegalArgumentException.class, () -> Name.Qualified.of(""));
    assertThrows(NullPointerException.class, () -> Name.Local.of(null));
  }
}

// End NameTest.java
