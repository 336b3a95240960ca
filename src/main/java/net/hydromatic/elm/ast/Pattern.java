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
import static net.hydromatic.elm.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Pattern in a {@code case} branch.
 *
 * <p>The variables that a pattern declares have type {@code V}; in a
 * {@link Expression.Branch} they are integers, and the branch's scope binds
 * the same integers.
 *
 * @param <V> Type of pattern variables
 */
public abstract class Pattern<V> {
  public final Op op;

  Pattern(Op op) {
    this.op = requireNonNull(op, "op");
  }

  /** Calls a consumer for each variable the pattern declares, left to
   * right. */
  public abstract void forEachVar(Consumer<? super V> consumer);

  /** Calls a consumer for each constructor name in this pattern. */
  public abstract void forEachGlobal(Consumer<Name.Qualified> consumer);

  /** Renames each variable. */
  public abstract <W> Pattern<W> map(Function<? super V, ? extends W> f);

  abstract int compareSameOp(Pattern<V> o, Comparator<? super V> c);

  /** Returns the variables declared by this pattern, left to right. A
   * variable may occur more than once. */
  public ImmutableList<V> vars() {
    final ImmutableList.Builder<V> b = ImmutableList.builder();
    forEachVar(b::add);
    return b.build();
  }

  /** Returns a total ordering on patterns, given an ordering on their
   * variables. */
  public static <V> Ordering<Pattern<V>> ordering(
      Comparator<? super V> comparator) {
    return Ordering.from(
        (p0, p1) -> {
          final int c = p0.op.compareTo(p1.op);
          return c != 0 ? c : p0.compareSameOp(p1, comparator);
        });
  }

  /** Pattern that binds a variable. */
  public static final class Var<V> extends Pattern<V> {
    public final V variable;

    Var(V variable) {
      super(Op.VAR_PAT);
      this.variable = requireNonNull(variable, "variable");
    }

    @Override
    public void forEachVar(Consumer<? super V> consumer) {
      consumer.accept(variable);
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @Override
    public <W> Pattern<W> map(Function<? super V, ? extends W> f) {
      return new Var<W>(f.apply(variable));
    }

    @Override
    int compareSameOp(Pattern<V> o, Comparator<? super V> c) {
      return c.compare(variable, ((Var<V>) o).variable);
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

  /** Wildcard pattern, "_". */
  public static final class Wildcard<V> extends Pattern<V> {
    Wildcard() {
      super(Op.WILDCARD_PAT);
    }

    @Override
    public void forEachVar(Consumer<? super V> consumer) {}

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @Override
    public <W> Pattern<W> map(Function<? super V, ? extends W> f) {
      return new Wildcard<>();
    }

    @Override
    int compareSameOp(Pattern<V> o, Comparator<? super V> c) {
      return 0;
    }

    @Override
    public int hashCode() {
      return "_".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Wildcard;
    }

    @Override
    public String toString() {
      return "Wildcard";
    }
  }

  /** Constructor applied to zero or more patterns, such as "Just x" or
   * "Nothing". */
  public static final class Con<V> extends Pattern<V> {
    public final Name.Qualified con;
    public final ImmutableList<Pattern<V>> args;

    Con(Name.Qualified con, ImmutableList<Pattern<V>> args) {
      super(Op.CON_PAT);
      this.con = requireNonNull(con, "con");
      this.args = requireNonNull(args, "args");
      checkArgument(
          !con.equals(ElmBuilder.TUPLE) || args.size() == 2 || args.size() == 3,
          "tuple pattern must have 2 or 3 elements: %s",
          args);
    }

    @Override
    public void forEachVar(Consumer<? super V> consumer) {
      args.forEach(p -> p.forEachVar(consumer));
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      consumer.accept(con);
      args.forEach(p -> p.forEachGlobal(consumer));
    }

    @Override
    public <W> Pattern<W> map(Function<? super V, ? extends W> f) {
      return new Con<W>(con, transformEager(args, p -> p.map(f)));
    }

    @Override
    int compareSameOp(Pattern<V> o, Comparator<? super V> c) {
      final Con<V> con2 = (Con<V>) o;
      final int c0 = con.compareTo(con2.con);
      return c0 != 0
          ? c0
          : Pattern.<V>ordering(c)
              .lexicographical()
              .compare(args, con2.args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(con, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Con
              && con.equals(((Con<?>) o).con)
              && args.equals(((Con<?>) o).args);
    }

    @Override
    public String toString() {
      return "Con(" + con + ", " + args + ")";
    }
  }

  /** Literal pattern: a string, integer or float. */
  @SuppressWarnings("rawtypes")
  public static final class Literal<V> extends Pattern<V> {
    public final Comparable value;

    Literal(Op op, Comparable value) {
      super(op);
      this.value = requireNonNull(value, "value");
      checkArgument(
          op == Op.STRING_LITERAL_PAT && value instanceof String
              || op == Op.INT_LITERAL_PAT && value instanceof Long
              || op == Op.FLOAT_LITERAL_PAT && value instanceof Double,
          "bad literal pattern %s %s",
          op,
          value);
    }

    @Override
    public void forEachVar(Consumer<? super V> consumer) {}

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @Override
    public <W> Pattern<W> map(Function<? super V, ? extends W> f) {
      return new Literal<>(op, value);
    }

    @SuppressWarnings("unchecked")
    @Override
    int compareSameOp(Pattern<V> o, Comparator<? super V> c) {
      return value.compareTo(((Literal<V>) o).value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal<?>) o).op
              && value.equals(((Literal<?>) o).value);
    }

    @Override
    public String toString() {
      return op == Op.STRING_LITERAL_PAT
          ? op.debugName + "(\"" + value + "\")"
          : op.debugName + "(" + value + ")";
    }
  }
}

// End Pattern.java
