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
package net.hydromatic.elm.print;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import net.hydromatic.elm.ast.Name;
import net.hydromatic.elm.ast.Pattern;
import net.hydromatic.elm.ast.Scope;
import net.hydromatic.elm.util.Pair;
import net.hydromatic.elm.util.Unit;

/**
 * Environment for printing.
 *
 * <p>Maps each variable that is in scope at a point in an expression to the
 * name that is printed for it, and knows which fresh names have not yet been
 * used.
 *
 * <p>Every environment is immutable; when you call {@link #extend} or {@link
 * #extendForPattern}, a new environment is created that inherits from the
 * previous environment, and both remain usable. Two environments extended from
 * the same parent may assign the same fresh names; that is fine, because they
 * are used for disjoint parts of the tree.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 *
 * @param <V> Type of variables
 */
public abstract class Environment<V> {
  /** Ordinal of the next fresh name; see {@link #freshName(int)}. */
  final int nextFresh;

  Environment(int nextFresh) {
    this.nextFresh = nextFresh;
  }

  /**
   * Returns the name of a variable.
   *
   * @throws AssertionError if the variable is not bound in this environment
   */
  public abstract Name.Local lookup(V v);

  /**
   * Creates an environment that is the same as this, plus a name for the
   * placeholder of a scope that binds one variable. Returns the environment
   * and the name.
   */
  public Pair<Environment<Scope.Var<Unit, V>>, Name.Local> extend() {
    final Name.Local name = freshName(nextFresh);
    final Environment<Scope.Var<Unit, V>> env =
        new Environments.ScopeEnvironment<>(this, name, nextFresh + 1);
    return Pair.of(env, name);
  }

  /**
   * Creates an environment that is the same as this, plus a name for each
   * distinct variable declared by a pattern.
   *
   * <p>Names are assigned in increasing order of the variables' indexes, so
   * the result does not depend on the order in which variables occur in the
   * pattern.
   */
  public Environment<Scope.Var<Integer, V>> extendForPattern(
      Pattern<Integer> pattern) {
    final ImmutableSortedSet<Integer> indexes =
        ImmutableSortedSet.copyOf(pattern.vars());
    final ImmutableSortedMap.Builder<Integer, Name.Local> b =
        ImmutableSortedMap.naturalOrder();
    int next = nextFresh;
    for (int i : indexes) {
      b.put(i, freshName(next++));
    }
    return new Environments.PatternEnvironment<>(this, b.build(), next);
  }

  /**
   * Returns the fresh name with a given ordinal.
   *
   * <p>The sequence of names is "a" through "z", then "a0" through "z0", then
   * "a1" through "z1", and so on; it never repeats a name.
   */
  public static Name.Local freshName(int ordinal) {
    if (ordinal < 0) {
      throw new AssertionError("fresh name supply exhausted");
    }
    final char letter = (char) ('a' + ordinal % 26);
    if (ordinal < 26) {
      return Name.Local.of(String.valueOf(letter));
    }
    return Name.Local.of(letter + Integer.toString(ordinal / 26 - 1));
  }
}

// End Environment.java
