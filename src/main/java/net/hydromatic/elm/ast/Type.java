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
import static net.hydromatic.elm.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import net.hydromatic.elm.util.Pair;

/**
 * Elm type.
 *
 * <p>Types have no binders. The printer only handles closed types, of type
 * {@code Type<Void>}.
 *
 * @param <V> Type of type variables
 */
public abstract class Type<V> {
  public final Op op;

  Type(Op op) {
    this.op = requireNonNull(op, "op");
  }

  /** Calls a consumer for each qualified name referenced by this type. */
  public abstract void forEachGlobal(Consumer<Name.Qualified> consumer);

  /** Renames each type variable. */
  public abstract <W> Type<W> map(Function<? super V, ? extends W> f);

  /** Type variable. */
  public static final class Var<V> extends Type<V> {
    public final V variable;

    Var(V variable) {
      super(Op.TY_VAR);
      this.variable = requireNonNull(variable, "variable");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @Override
    public <W> Type<W> map(Function<? super V, ? extends W> f) {
      return new Var<W>(f.apply(variable));
    }

    @Override
    public int hashCode() {
      return variable.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var && variable.equals(((Var<?>) o).variable);
    }

    @Override
    public String toString() {
      return "Var(" + variable + ")";
    }
  }

  /** Reference to a type defined in a module, such as "Maybe.Maybe". */
  public static final class Global<V> extends Type<V> {
    public final Name.Qualified name;

    Global(Name.Qualified name) {
      super(Op.TY_GLOBAL);
      this.name = requireNonNull(name, "name");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      consumer.accept(name);
    }

    @Override
    public <W> Type<W> map(Function<? super V, ? extends W> f) {
      return new Global<>(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Global && name.equals(((Global<?>) o).name);
    }

    @Override
    public String toString() {
      return "Global(" + name + ")";
    }
  }

  /** Application of a type constructor to one argument, such as
   * "List Int". */
  public static final class App<V> extends Type<V> {
    public final Type<V> fn;
    public final Type<V> arg;

    App(Type<V> fn, Type<V> arg) {
      super(Op.TY_APP);
      this.fn = requireNonNull(fn, "fn");
      this.arg = requireNonNull(arg, "arg");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      fn.forEachGlobal(consumer);
      arg.forEachGlobal(consumer);
    }

    @Override
    public <W> Type<W> map(Function<? super V, ? extends W> f) {
      return new App<W>(fn.map(f), arg.map(f));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof App
              && fn.equals(((App<?>) o).fn)
              && arg.equals(((App<?>) o).arg);
    }

    @Override
    public String toString() {
      return "App(" + fn + ", " + arg + ")";
    }
  }

  /** Function type, such as "Int -> String". */
  public static final class Fun<V> extends Type<V> {
    public final Type<V> param;
    public final Type<V> result;

    Fun(Type<V> param, Type<V> result) {
      super(Op.FUNCTION_TYPE);
      this.param = requireNonNull(param, "param");
      this.result = requireNonNull(result, "result");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      param.forEachGlobal(consumer);
      result.forEachGlobal(consumer);
    }

    @Override
    public <W> Type<W> map(Function<? super V, ? extends W> f) {
      return new Fun<W>(param.map(f), result.map(f));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, param, result);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fun
              && param.equals(((Fun<?>) o).param)
              && result.equals(((Fun<?>) o).result);
    }

    @Override
    public String toString() {
      return "Fun(" + param + ", " + result + ")";
    }
  }

  /** Record type, such as "{ name : String, age : Int }". */
  public static final class Record<V> extends Type<V> {
    public final ImmutableList<Pair<Name.Field, Type<V>>> fields;

    Record(ImmutableList<Pair<Name.Field, Type<V>>> fields) {
      super(Op.RECORD_TYPE);
      this.fields = requireNonNull(fields, "fields");
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      fields.forEach(p -> p.right.forEachGlobal(consumer));
    }

    @Override
    public <W> Type<W> map(Function<? super V, ? extends W> f) {
      return new Record<W>(
          transformEager(fields, p -> Pair.of(p.left, p.right.map(f))));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, fields);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Record && fields.equals(((Record<?>) o).fields);
    }

    @Override
    public String toString() {
      return "Record(" + fields + ")";
    }
  }
}

// End Type.java
