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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.List;

/**
 * Names of things in Elm code.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Name {
  private Name() {}

  /** Ordering on module paths; "Html" sorts before "Html.Attributes". */
  private static final Ordering<Iterable<String>> MODULE_ORDERING =
      Ordering.<String>natural().lexicographical();

  /** Name of a local variable, such as "x" in "\x -> x". */
  public static final class Local implements Comparable<Local> {
    public final String name;

    private Local(String name) {
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    public static Local of(String name) {
      return new Local(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Local && name.equals(((Local) o).name);
    }

    @Override
    public int compareTo(Local o) {
      return name.compareTo(o.name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Name of a record field, such as "age" in "{ age = 42 }". */
  public static final class Field implements Comparable<Field> {
    public final String name;

    private Field(String name) {
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty field name");
    }

    public static Field of(String name) {
      return new Field(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Field && name.equals(((Field) o).name);
    }

    @Override
    public int compareTo(Field o) {
      return name.compareTo(o.name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Name of a data constructor, such as "Just", in the definition of the type
   * that declares it. */
  public static final class Constructor implements Comparable<Constructor> {
    public final String name;

    private Constructor(String name) {
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty constructor name");
    }

    public static Constructor of(String name) {
      return new Constructor(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constructor && name.equals(((Constructor) o).name);
    }

    @Override
    public int compareTo(Constructor o) {
      return name.compareTo(o.name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Name of a value, type or constructor qualified by the path of the module
   * that defines it, such as "List.map" or "Json.Decode.field".
   */
  public static final class Qualified implements Comparable<Qualified> {
    public final ImmutableList<String> modules;
    public final String name;

    private Qualified(ImmutableList<String> modules, String name) {
      this.modules = requireNonNull(modules, "modules");
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    /** Creates a qualified name from a module path and an identifier. */
    public static Qualified of(List<String> modules, String name) {
      return new Qualified(ImmutableList.copyOf(modules), name);
    }

    /**
     * Parses the shorthand form of a qualified name.
     *
     * <p>Leading segments that start with an upper-case letter and are
     * followed by a dot form the module path; the remainder is the identifier.
     * Thus "Maybe.Just" has module path ["Maybe"] and identifier "Just", and
     * "Parser.|." has module path ["Parser"] and identifier "|.".
     */
    public static Qualified of(String s) {
      final ImmutableList.Builder<String> modules = ImmutableList.builder();
      int start = 0;
      for (;;) {
        final int dot = s.indexOf('.', start);
        if (dot < 0 || dot == s.length() - 1) {
          break;
        }
        final String segment = s.substring(start, dot);
        if (!isModuleSegment(segment)) {
          break;
        }
        modules.add(segment);
        start = dot + 1;
      }
      return new Qualified(modules.build(), s.substring(start));
    }

    private static boolean isModuleSegment(String s) {
      if (s.isEmpty() || !Character.isUpperCase(s.charAt(0))) {
        return false;
      }
      for (int i = 1; i < s.length(); i++) {
        final char c = s.charAt(i);
        if (!Character.isLetterOrDigit(c) && c != '_') {
          return false;
        }
      }
      return true;
    }

    /** Returns the module path joined with dots, e.g. "Json.Decode". */
    public String moduleName() {
      return Joiner.on('.').join(modules);
    }

    @Override
    public int hashCode() {
      return modules.hashCode() * 31 + name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Qualified
              && modules.equals(((Qualified) o).modules)
              && name.equals(((Qualified) o).name);
    }

    @Override
    public int compareTo(Qualified o) {
      final int c = MODULE_ORDERING.compare(modules, o.modules);
      return c != 0 ? c : name.compareTo(o.name);
    }

    @Override
    public String toString() {
      return modules.isEmpty() ? name : moduleName() + "." + name;
    }
  }
}

// End Name.java
