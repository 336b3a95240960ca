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

import static net.hydromatic.elm.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.elm.util.Pair;
import net.hydromatic.elm.util.Unit;

/** Builds expressions, patterns, types and definitions. */
public enum ElmBuilder {
  /**
   * The singleton instance of the builder. The short name is convenient for
   * use via 'import static'.
   */
  elm;

  /** Qualified name of the operator that applies a function to a value,
   * written "x |> f". */
  public static final Name.Qualified PIPE = Name.Qualified.of("Basics.|>");

  /** Qualified name of the tuple constructor; applied to two or three
   * arguments it makes "( x, y )" or "( x, y, z )". */
  public static final Name.Qualified TUPLE = Name.Qualified.of("Basics.,");

  // expressions

  /** Creates a reference to a variable. */
  public <V> Expression<V> var(V v) {
    return new Expression.Var<>(v);
  }

  /** Creates a reference to a global value, given its name in shorthand form,
   * such as "List.map". */
  public <V> Expression<V> global(String name) {
    return global(Name.Qualified.of(name));
  }

  /** Creates a reference to a global value. */
  public <V> Expression<V> global(Name.Qualified name) {
    return new Expression.Global<>(name);
  }

  /** Creates an application of a function to an argument. */
  public <V> Expression<V> app(Expression<V> fn, Expression<V> arg) {
    return new Expression.App<>(fn, arg);
  }

  /** Applies a function to a list of arguments, one at a time.
   *
   * <p>{@code applyAll(f, [a, b, c])} returns
   * {@code App(App(App(f, a), b), c)}; if the list is empty, returns
   * {@code f}. */
  public <V> Expression<V> applyAll(
      Expression<V> fn, Iterable<? extends Expression<V>> args) {
    Expression<V> e = fn;
    for (Expression<V> arg : args) {
      e = app(e, arg);
    }
    return e;
  }

  /** Applies a function to several arguments. */
  @SafeVarargs
  public final <V> Expression<V> applyAll(
      Expression<V> fn, Expression<V>... args) {
    return applyAll(fn, Arrays.asList(args));
  }

  /** Creates "e1 |> e2", which applies e2 to e1. */
  public <V> Expression<V> pipeInto(Expression<V> e1, Expression<V> e2) {
    return applyAll(global(PIPE), e1, e2);
  }

  /** Creates a pair, "( e1, e2 )". */
  public <V> Expression<V> pair(Expression<V> e1, Expression<V> e2) {
    return applyAll(global(TUPLE), e1, e2);
  }

  /** Creates a triple, "( e1, e2, e3 )". */
  public <V> Expression<V> triple(
      Expression<V> e1, Expression<V> e2, Expression<V> e3) {
    return applyAll(global(TUPLE), e1, e2, e3);
  }

  /** Creates a "let" expression from a scope that binds the value. */
  public <V> Expression<V> let(Expression<V> exp, Scope<Unit, V> scope) {
    return new Expression.Let<>(exp, scope);
  }

  /** Creates "let v = exp in body", binding each occurrence of {@code v} in
   * {@code body}. */
  public <V> Expression<V> let(V v, Expression<V> exp, Expression<V> body) {
    return let(exp, Scope.abstract1(body, v));
  }

  /** Creates a lambda from a scope. */
  public <V> Expression<V> lam(Scope<Unit, V> scope) {
    return new Expression.Lam<>(scope);
  }

  /** Creates "\v -> body", binding each occurrence of {@code v} in
   * {@code body}. */
  public <V> Expression<V> lam(V v, Expression<V> body) {
    return lam(Scope.abstract1(body, v));
  }

  /** Creates a record. */
  public <V> Expression<V> record(
      List<Pair<Name.Field, Expression<V>>> fields) {
    return new Expression.Record<>(ImmutableList.copyOf(fields));
  }

  /** Creates a record from a map whose iteration order is the field
   * order. */
  public <V> Expression<V> record(Map<String, Expression<V>> fields) {
    final ImmutableList.Builder<Pair<Name.Field, Expression<V>>> b =
        ImmutableList.builder();
    fields.forEach((name, e) -> b.add(Pair.of(Name.Field.of(name), e)));
    return new Expression.Record<>(b.build());
  }

  /** Creates a field accessor, ".field". */
  public <V> Expression<V> proj(String field) {
    return new Expression.Proj<>(Name.Field.of(field));
  }

  /** Creates a "case" expression. */
  public <V> Expression<V> caseOf(
      Expression<V> exp, List<Expression.Branch<V>> branches) {
    return new Expression.Case<>(exp, ImmutableList.copyOf(branches));
  }

  /** Creates a "case" expression. */
  @SafeVarargs
  public final <V> Expression<V> caseOf(
      Expression<V> exp, Expression.Branch<V>... branches) {
    return caseOf(exp, Arrays.asList(branches));
  }

  /** Creates a branch of a "case" expression.
   *
   * @throws IllegalArgumentException if the scope refers to a variable that
   *     the pattern does not declare */
  public <V> Expression.Branch<V> branch(
      Pattern<Integer> pattern, Scope<Integer, V> scope) {
    return new Expression.Branch<>(pattern, scope);
  }

  /** Creates a branch of a "case" expression from a pattern whose variables
   * are named in the same way as the free variables of the body.
   *
   * <p>The variables are numbered in order of first occurrence in the
   * pattern, and the occurrences of those variables in {@code body} become
   * placeholders. */
  public <V> Expression.Branch<V> branch(
      Pattern<V> pattern, Expression<V> body) {
    final Map<V, Integer> indexes = new HashMap<>();
    pattern.forEachVar(v -> indexes.putIfAbsent(v, indexes.size()));
    return branch(
        pattern.map(indexes::get), Scope.abstractVars(body, indexes::get));
  }

  /** Creates a list. */
  public <V> Expression<V> list(List<Expression<V>> args) {
    return new Expression.ListExp<>(ImmutableList.copyOf(args));
  }

  /** Creates a list. */
  @SafeVarargs
  public final <V> Expression<V> list(Expression<V>... args) {
    return list(Arrays.asList(args));
  }

  /** Creates a string literal. The text must already be escaped. */
  public <V> Expression<V> string(String s) {
    return new Expression.Literal<>(Op.STRING_LITERAL, s);
  }

  /** Creates an integer literal. */
  public <V> Expression<V> intLiteral(long i) {
    return new Expression.Literal<>(Op.INT_LITERAL, i);
  }

  /** Creates a float literal. */
  public <V> Expression<V> floatLiteral(double d) {
    return new Expression.Literal<>(Op.FLOAT_LITERAL, d);
  }

  // patterns

  /** Creates a pattern that declares a variable. */
  public <V> Pattern<V> varPat(V v) {
    return new Pattern.Var<>(v);
  }

  /** Creates a wildcard pattern, "_". */
  public <V> Pattern<V> wildcardPat() {
    return new Pattern.Wildcard<>();
  }

  /** Creates a constructor pattern, such as "Just x". */
  public <V> Pattern<V> conPat(Name.Qualified con, List<Pattern<V>> args) {
    return new Pattern.Con<>(con, ImmutableList.copyOf(args));
  }

  /** Creates a constructor pattern, given the constructor's name in
   * shorthand form. */
  @SafeVarargs
  public final <V> Pattern<V> conPat(String con, Pattern<V>... args) {
    return conPat(Name.Qualified.of(con), Arrays.asList(args));
  }

  /** Creates a string literal pattern. */
  public <V> Pattern<V> stringPat(String s) {
    return new Pattern.Literal<>(Op.STRING_LITERAL_PAT, s);
  }

  /** Creates an integer literal pattern. */
  public <V> Pattern<V> intPat(long i) {
    return new Pattern.Literal<>(Op.INT_LITERAL_PAT, i);
  }

  /** Creates a float literal pattern. */
  public <V> Pattern<V> floatPat(double d) {
    return new Pattern.Literal<>(Op.FLOAT_LITERAL_PAT, d);
  }

  // types

  /** Creates a type variable. */
  public <V> Type<V> tyVar(V v) {
    return new Type.Var<>(v);
  }

  /** Creates a reference to a global type, such as "Basics.Int". */
  public <V> Type<V> tyGlobal(String name) {
    return new Type.Global<>(Name.Qualified.of(name));
  }

  /** Applies a type constructor to arguments, such as
   * "Dict.Dict String Int". */
  @SafeVarargs
  public final <V> Type<V> tyApp(Type<V> fn, Type<V>... args) {
    Type<V> t = fn;
    for (Type<V> arg : args) {
      t = new Type.App<>(t, arg);
    }
    return t;
  }

  /** Creates a function type. */
  public <V> Type<V> fnType(Type<V> param, Type<V> result) {
    return new Type.Fun<>(param, result);
  }

  /** Creates a record type from a map whose iteration order is the field
   * order. */
  public <V> Type<V> recordType(Map<String, Type<V>> fields) {
    final ImmutableList.Builder<Pair<Name.Field, Type<V>>> b =
        ImmutableList.builder();
    fields.forEach((name, t) -> b.add(Pair.of(Name.Field.of(name), t)));
    return new Type.Record<>(b.build());
  }

  // definitions

  /** Creates a value definition. */
  public Definition constant(
      String name, Type<Void> type, Expression<Void> expression) {
    return new Definition.Constant(Name.Qualified.of(name), type, expression);
  }

  /** Creates a constructor of a custom type, for use in
   * {@link #dataType}. */
  @SafeVarargs
  public final Pair<Name.Constructor, List<Type<Void>>> constructor(
      String name, Type<Void>... args) {
    return Pair.of(Name.Constructor.of(name), Arrays.asList(args));
  }

  /** Creates a custom type definition. */
  public Definition dataType(
      String name,
      List<Pair<Name.Constructor, List<Type<Void>>>> constructors) {
    return new Definition.DataType(
        Name.Qualified.of(name),
        transformEager(
            constructors, p -> Pair.of(p.left, ImmutableList.copyOf(p.right))));
  }

  /** Creates a custom type definition. */
  @SafeVarargs
  public final Definition dataType(
      String name, Pair<Name.Constructor, List<Type<Void>>>... constructors) {
    return dataType(name, Arrays.asList(constructors));
  }

  /** Creates a type alias. */
  public Definition alias(String name, Type<Void> type) {
    return new Definition.Alias(Name.Qualified.of(name), type);
  }
}

// End ElmBuilder.java
