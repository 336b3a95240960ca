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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.function.Function;
import net.hydromatic.elm.ast.Name;
import net.hydromatic.elm.ast.Scope;
import net.hydromatic.elm.util.Unit;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Returns the empty environment. It can only be used to print closed
   * expressions. */
  public static Environment<Void> empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /**
   * Creates an environment for expressions whose free variables have names.
   *
   * <p>The caller must make sure that the names do not clash with fresh names
   * ("a", "b", ... "a0", ...) that will be assigned to bound variables.
   */
  public static <V> Environment<V> free(Function<? super V, String> namer) {
    return new FreeEnvironment<>(namer);
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment<Void> {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    private EmptyEnvironment() {
      super(0);
    }

    @Override
    public Name.Local lookup(Void v) {
      throw new AssertionError("closed expression has free variable " + v);
    }

    @Override
    public String toString() {
      return "{}";
    }
  }

  /** Environment whose variables are free, named by a function. */
  private static class FreeEnvironment<V> extends Environment<V> {
    private final Function<? super V, String> namer;

    FreeEnvironment(Function<? super V, String> namer) {
      super(0);
      this.namer = requireNonNull(namer, "namer");
    }

    @Override
    public Name.Local lookup(V v) {
      return Name.Local.of(namer.apply(v));
    }
  }

  /**
   * Environment that inherits from a parent environment and names the
   * placeholder of a {@code let} or lambda.
   */
  static class ScopeEnvironment<V> extends Environment<Scope.Var<Unit, V>> {
    private final Environment<V> parent;
    private final Name.Local name;

    ScopeEnvironment(Environment<V> parent, Name.Local name, int nextFresh) {
      super(nextFresh);
      this.parent = requireNonNull(parent, "parent");
      this.name = requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name + ", ...";
    }

    @Override
    public Name.Local lookup(Scope.Var<Unit, V> v) {
      return v.isBound() ? name : parent.lookup(v.free());
    }
  }

  /**
   * Environment that inherits from a parent environment and names the
   * variables declared by the pattern of a {@code case} branch.
   */
  static class PatternEnvironment<V>
      extends Environment<Scope.Var<Integer, V>> {
    private final Environment<V> parent;
    private final ImmutableSortedMap<Integer, Name.Local> names;

    PatternEnvironment(
        Environment<V> parent,
        ImmutableSortedMap<Integer, Name.Local> names,
        int nextFresh) {
      super(nextFresh);
      this.parent = requireNonNull(parent, "parent");
      this.names = requireNonNull(names, "names");
    }

    @Override
    public String toString() {
      return names + ", ...";
    }

    @Override
    public Name.Local lookup(Scope.Var<Integer, V> v) {
      if (!v.isBound()) {
        return parent.lookup(v.free());
      }
      final Name.Local name = names.get(v.bound());
      if (name == null) {
        throw new AssertionError(
            "unbound pattern variable " + v.bound() + " in " + names);
      }
      return name;
    }
  }
}

// End Environments.java
