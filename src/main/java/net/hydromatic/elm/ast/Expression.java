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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import net.hydromatic.elm.util.Pair;
import net.hydromatic.elm.util.Unit;

/**
 * Elm expression.
 *
 * <p>An expression is a tree, parameterized by the type {@code V} of its free
 * variables. Variables bound inside the tree (by {@code let}, lambda and
 * {@code case}) are not named; they are placeholders inside a {@link Scope}.
 * An expression that has no free variables has type {@code Expression<Void>};
 * only such an expression can be printed.
 *
 * <p>Expressions are immutable. Use {@link ElmBuilder#elm} to create them.
 *
 * @param <V> Type of free variables
 */
public abstract class Expression<V> {
  public final Op op;

  Expression(Op op) {
    this.op = requireNonNull(op, "op");
  }

  /** Creates a variable reference. */
  public static <V> Expression<V> var(V v) {
    return new Var<>(v);
  }

  /**
   * Replaces each free variable with an expression.
   *
   * <p>This is the "bind" operation of the expression monad. The function
   * sees only the variables that are free in the whole tree; placeholders
   * bound inside scopes are never passed to it, and the expressions it returns
   * are never captured by a binder in this tree.
   */
  public abstract <W> Expression<W> substitute(
      Function<? super V, ? extends Expression<W>> f);

  /** Renames each free variable. */
  public <W> Expression<W> map(Function<? super V, ? extends W> f) {
    return this.<W>substitute(v -> Expression.<W>var(f.apply(v)));
  }

  /** Calls a consumer for each occurrence of a free variable, left to
   * right. */
  abstract void forEachVar(Consumer<? super V> consumer);

  /** Calls a consumer for each qualified name referenced by this
   * expression, including constructors in {@code case} patterns. */
  public abstract void forEachGlobal(Consumer<Name.Qualified> consumer);

  /** Compares with another expression that has the same {@link #op}. */
  abstract int compareSameOp(Expression<V> o, Comparator<? super V> c);

  /** Returns the distinct free variables, in order of first occurrence. */
  public List<V> freeVariables() {
    final Set<V> set = new LinkedHashSet<>();
    forEachVar(set::add);
    return ImmutableList.copyOf(set);
  }

  /**
   * Returns this expression as a closed expression.
   *
   * @throws IllegalArgumentException if this expression has a free variable
   */
  public Expression<Void> close() {
    return this.<Void>substitute(
        v -> {
          throw new IllegalArgumentException("free variable " + v);
        });
  }

  /** Returns a total ordering on expressions, given an ordering on their
   * free variables. */
  public static <V> Ordering<Expression<V>> ordering(
      Comparator<? super V> comparator) {
    requireNonNull(comparator, "comparator");
    return Ordering.from(
        (e0, e1) -> {
          final int c = e0.op.compareTo(e1.op);
          return c != 0 ? c : e0.compareSameOp(e1, comparator);
        });
  }

  /** Returns the natural ordering on expressions whose free variables are
   * comparable. */
  public static <V extends Comparable<? super V>>
      Ordering<Expression<V>> ordering() {
    return ordering(Comparator.<V>naturalOrder());
  }

  /** Returns the ordering on closed expressions. */
  public static Ordering<Expression<Void>> closedOrdering() {
    return ordering(
        (Void v0, Void v1) -> {
          throw new AssertionError("closed expression has variable");
        });
  }

  /** Reference to a variable. */
  public static final class Var<V> extends Expression<V> {
    public final V variable;

    Var(V variable) {
      super(Op.VAR);
      this.variable = requireNonNull(variable, "variable");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return f.apply(variable);
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      consumer.accept(variable);
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
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

  /** Reference to a value defined in a module. */
  public static final class Global<V> extends Expression<V> {
    public final Name.Qualified name;

    Global(Name.Qualified name) {
      super(Op.GLOBAL);
      this.name = requireNonNull(name, "name");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Global<>(name);
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {}

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      consumer.accept(name);
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      return name.compareTo(((Global<V>) o).name);
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

  /** Application of a function to one argument.
   *
   * <p>A call with several arguments is a chain of applications, as built by
   * {@link ElmBuilder#applyAll}. */
  public static final class App<V> extends Expression<V> {
    public final Expression<V> fn;
    public final Expression<V> arg;

    App(Expression<V> fn, Expression<V> arg) {
      super(Op.APP);
      this.fn = requireNonNull(fn, "fn");
      this.arg = requireNonNull(arg, "arg");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new App<>(fn.substitute(f), arg.substitute(f));
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      fn.forEachVar(consumer);
      arg.forEachVar(consumer);
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      fn.forEachGlobal(consumer);
      arg.forEachGlobal(consumer);
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      final App<V> app = (App<V>) o;
      final Ordering<Expression<V>> ordering = Expression.<V>ordering(c);
      final int c0 = ordering.compare(fn, app.fn);
      return c0 != 0 ? c0 : ordering.compare(arg, app.arg);
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

  /** "let" expression. Evaluates {@link #exp} and binds the result to the
   * single placeholder of {@link #scope}. */
  public static final class Let<V> extends Expression<V> {
    public final Expression<V> exp;
    public final Scope<Unit, V> scope;

    Let(Expression<V> exp, Scope<Unit, V> scope) {
      super(Op.LET);
      this.exp = requireNonNull(exp, "exp");
      this.scope = requireNonNull(scope, "scope");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Let<>(exp.substitute(f), scope.substitute(f));
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      exp.forEachVar(consumer);
      scope.forEachFree(consumer);
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      exp.forEachGlobal(consumer);
      scope.fromScope().forEachGlobal(consumer);
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      final Let<V> let = (Let<V>) o;
      final int c0 = Expression.<V>ordering(c).compare(exp, let.exp);
      return c0 != 0
          ? c0
          : Scope.<Unit, V>ordering(Ordering.natural(), c)
              .compare(scope, let.scope);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, scope);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
              && exp.equals(((Let<?>) o).exp)
              && scope.equals(((Let<?>) o).scope);
    }

    @Override
    public String toString() {
      return "Let(" + exp + ", " + scope + ")";
    }
  }

  /** Lambda; a function of one argument, the placeholder of
   * {@link #scope}. */
  public static final class Lam<V> extends Expression<V> {
    public final Scope<Unit, V> scope;

    Lam(Scope<Unit, V> scope) {
      super(Op.LAM);
      this.scope = requireNonNull(scope, "scope");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Lam<>(scope.substitute(f));
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      scope.forEachFree(consumer);
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      scope.fromScope().forEachGlobal(consumer);
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      return Scope.<Unit, V>ordering(Ordering.natural(), c)
          .compare(scope, ((Lam<V>) o).scope);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, scope);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lam && scope.equals(((Lam<?>) o).scope);
    }

    @Override
    public String toString() {
      return "Lam(" + scope + ")";
    }
  }

  /** Record construction, such as "{ x = 1, y = 2 }".
   *
   * <p>Fields are kept in the order given. Field names are assumed to be
   * distinct; this class does not check. */
  public static final class Record<V> extends Expression<V> {
    public final ImmutableList<Pair<Name.Field, Expression<V>>> fields;

    Record(ImmutableList<Pair<Name.Field, Expression<V>>> fields) {
      super(Op.RECORD);
      this.fields = requireNonNull(fields, "fields");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Record<W>(
          transformEager(fields, p -> Pair.of(p.left, p.right.substitute(f))));
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      fields.forEach(p -> p.right.forEachVar(consumer));
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      fields.forEach(p -> p.right.forEachGlobal(consumer));
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      final Ordering<Expression<V>> ordering = Expression.<V>ordering(c);
      final Ordering<Pair<Name.Field, Expression<V>>> pairOrdering =
          Ordering.from(
              (p0, p1) -> {
                final int c0 = p0.left.compareTo(p1.left);
                return c0 != 0 ? c0 : ordering.compare(p0.right, p1.right);
              });
      return pairOrdering
          .lexicographical()
          .compare(fields, ((Record<V>) o).fields);
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
      final StringBuilder b = new StringBuilder("Record([");
      for (int i = 0; i < fields.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(fields.get(i).left).append(" = ").append(fields.get(i).right);
      }
      return b.append("])").toString();
    }
  }

  /** Record field accessor, such as ".name". It is a function; apply it to a
   * record to get the value of the field. */
  public static final class Proj<V> extends Expression<V> {
    public final Name.Field field;

    Proj(Name.Field field) {
      super(Op.PROJ);
      this.field = requireNonNull(field, "field");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Proj<>(field);
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {}

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      return field.compareTo(((Proj<V>) o).field);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, field);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Proj && field.equals(((Proj<?>) o).field);
    }

    @Override
    public String toString() {
      return "Proj(" + field + ")";
    }
  }

  /** "case" expression. */
  public static final class Case<V> extends Expression<V> {
    public final Expression<V> exp;
    public final ImmutableList<Branch<V>> branches;

    Case(Expression<V> exp, ImmutableList<Branch<V>> branches) {
      super(Op.CASE);
      this.exp = requireNonNull(exp, "exp");
      this.branches = requireNonNull(branches, "branches");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Case<W>(
          exp.substitute(f), transformEager(branches, b -> b.substitute(f)));
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      exp.forEachVar(consumer);
      branches.forEach(b -> b.scope.forEachFree(consumer));
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      exp.forEachGlobal(consumer);
      branches.forEach(
          b -> {
            b.pattern.forEachGlobal(consumer);
            b.scope.fromScope().forEachGlobal(consumer);
          });
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      final Case<V> kase = (Case<V>) o;
      final int c0 = Expression.<V>ordering(c).compare(exp, kase.exp);
      if (c0 != 0) {
        return c0;
      }
      final Ordering<Branch<V>> branchOrdering =
          Ordering.from((b0, b1) -> b0.compare(b1, c));
      return branchOrdering.lexicographical().compare(branches, kase.branches);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, branches);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Case
              && exp.equals(((Case<?>) o).exp)
              && branches.equals(((Case<?>) o).branches);
    }

    @Override
    public String toString() {
      return "Case(" + exp + ", " + branches + ")";
    }
  }

  /**
   * Branch of a {@link Case}.
   *
   * <p>The pattern declares zero or more variables, each identified by an
   * integer; the scope binds those same integers.
   */
  public static final class Branch<V> {
    public final Pattern<Integer> pattern;
    public final Scope<Integer, V> scope;

    Branch(Pattern<Integer> pattern, Scope<Integer, V> scope) {
      this.pattern = requireNonNull(pattern, "pattern");
      this.scope = requireNonNull(scope, "scope");
      final ImmutableSortedSet<Integer> declared =
          ImmutableSortedSet.copyOf(pattern.vars());
      scope.forEachBound(
          i ->
              checkArgument(
                  declared.contains(i),
                  "branch refers to variable %s not declared by pattern %s",
                  i,
                  pattern));
    }

    <W> Branch<W> substitute(Function<? super V, ? extends Expression<W>> f) {
      return new Branch<>(pattern, scope.substitute(f));
    }

    int compare(Branch<V> o, Comparator<? super V> c) {
      final int c0 =
          Pattern.<Integer>ordering(Ordering.natural())
              .compare(pattern, o.pattern);
      return c0 != 0
          ? c0
          : Scope.<Integer, V>ordering(Ordering.natural(), c)
              .compare(scope, o.scope);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pattern, scope);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Branch
              && pattern.equals(((Branch<?>) o).pattern)
              && scope.equals(((Branch<?>) o).scope);
    }

    @Override
    public String toString() {
      return "(" + pattern + ", " + scope + ")";
    }
  }

  /** List construction, such as "[ 1, 2, 3 ]". */
  public static final class ListExp<V> extends Expression<V> {
    public final ImmutableList<Expression<V>> args;

    ListExp(ImmutableList<Expression<V>> args) {
      super(Op.LIST);
      this.args = requireNonNull(args, "args");
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new ListExp<W>(transformEager(args, e -> e.substitute(f)));
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {
      args.forEach(e -> e.forEachVar(consumer));
    }

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {
      args.forEach(e -> e.forEachGlobal(consumer));
    }

    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
      return Expression.<V>ordering(c)
          .lexicographical()
          .compare(args, ((ListExp<V>) o).args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp && args.equals(((ListExp<?>) o).args);
    }

    @Override
    public String toString() {
      return "List(" + args + ")";
    }
  }

  /**
   * Literal: a string, integer or float.
   *
   * <p>The value of a string literal is its text as it is to appear between
   * quotes in Elm source; it is printed as is, without escaping.
   */
  @SuppressWarnings("rawtypes")
  public static final class Literal<V> extends Expression<V> {
    public final Comparable value;

    Literal(Op op, Comparable value) {
      super(op);
      this.value = requireNonNull(value, "value");
      checkArgument(
          op == Op.STRING_LITERAL && value instanceof String
              || op == Op.INT_LITERAL && value instanceof Long
              || op == Op.FLOAT_LITERAL && value instanceof Double,
          "bad literal %s %s",
          op,
          value);
    }

    @Override
    public <W> Expression<W> substitute(
        Function<? super V, ? extends Expression<W>> f) {
      return new Literal<>(op, value);
    }

    @Override
    void forEachVar(Consumer<? super V> consumer) {}

    @Override
    public void forEachGlobal(Consumer<Name.Qualified> consumer) {}

    @SuppressWarnings("unchecked")
    @Override
    int compareSameOp(Expression<V> o, Comparator<? super V> c) {
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
      return op == Op.STRING_LITERAL
          ? op.debugName + "(\"" + value + "\")"
          : op.debugName + "(" + value + ")";
    }
  }
}

// End Expression.java
