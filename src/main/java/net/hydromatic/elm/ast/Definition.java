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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.function.Consumer;
import net.hydromatic.elm.util.Pair;

/** Top-level definition in an Elm module. */
public abstract class Definition {
  public final Op op;
  public final Name.Qualified name;

  Definition(Op op, Name.Qualified name) {
    this.op = requireNonNull(op, "op");
    this.name = requireNonNull(name, "name");
  }

  /** Calls a consumer for each qualified name referenced by this definition,
   * not including the name being defined. */
  public abstract void forEachGlobal(Consumer<Name.Qualified> consumer);

  /** Value definition, such as "answer : Int" and "answer = 42". */
  public static final class Constant extends Definition {
    public final Type<Void> type;
    public final Expression<Void> expression;

    Constant(
        Name.Qualified name, Type<Void> type, Expression<Void> expression) {
      super(Op.CONSTANT_DEF, name);
      this.type = requireNonNull(type, "type");
      this.expression = requireNonNull(expression, "expression");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      type.forEachGlobal(consumer);
      expression.forEachGlobal(consumer);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, type, expression);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
              && name.equals(((Constant) o).name)
              && type.equals(((Constant) o).type)
              && expression.equals(((Constant) o).expression);
    }

    @Override
    public String toString() {
      return "Constant(" + name + ", " + type + ", " + expression + ")";
    }
  }

  /** Custom type definition, such as "type Color = Red | Green | Blue". */
  public static final class DataType extends Definition {
    public final ImmutableList<
            Pair<Name.Constructor, ImmutableList<Type<Void>>>>
        constructors;

    DataType(
        Name.Qualified name,
        ImmutableList<Pair<Name.Constructor, ImmutableList<Type<Void>>>>
            constructors) {
      super(Op.TYPE_DEF, name);
      this.constructors = requireNonNull(constructors, "constructors");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      constructors.forEach(
          p -> p.right.forEach(t -> t.forEachGlobal(consumer)));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, constructors);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DataType
              && name.equals(((DataType) o).name)
              && constructors.equals(((DataType) o).constructors);
    }

    @Override
    public String toString() {
      return "Type(" + name + ", " + constructors + ")";
    }
  }

  /** Type alias, such as "type alias Point = { x : Float, y : Float }". */
  public static final class Alias extends Definition {
    public final Type<Void> type;

    Alias(Name.Qualified name, Type<Void> type) {
      super(Op.ALIAS_DEF, name);
      this.type = requireNonNull(type, "type");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      type.forEachGlobal(consumer);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Alias
              && name.equals(((Alias) o).name)
              && type.equals(((Alias) o).type);
    }

    @Override
    public String toString() {
      return "Alias(" + name + ", " + type + ")";
    }
  }
}

// End Definition.java
