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

import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import net.hydromatic.elm.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Body of a binding construct, in which the variables bound by the construct
 * have a type that is distinct from the variables bound outside it.
 *
 * <p>The body is an expression whose variables are {@link Var} values: either
 * {@link Var#bound bound} (a placeholder for one of the variables that this
 * scope binds, identified by an index of type {@code B}) or {@link Var#free
 * free} (a variable of type {@code V} bound further out, or not bound at all).
 *
 * <p>Because the two kinds of variable have different types, substituting
 * into a scope can never capture one of its placeholders: the substitution
 * function sees only free variables. A {@code let} or a lambda uses a scope
 * whose index type is {@link Unit}; a {@code case} branch uses a scope whose
 * index type is {@link Integer}, the index being the one that the branch's
 * pattern declares.
 *
 * <p>Scopes are immutable.
 *
 * @param <B> Type of the index of a bound placeholder
 * @param <V> Type of free variables
 */
public final class Scope<B, V> {
  private final Expression<Var<B, V>> body;

  private Scope(Expression<Var<B, V>> body) {
    this.body = requireNonNull(body, "body");
  }

  /** Creates a scope from a body that already refers to its placeholders. */
  public static <B, V> Scope<B, V> toScope(Expression<Var<B, V>> body) {
    return new Scope<>(body);
  }

  /**
   * Creates a scope by abstracting over some of the variables of an
   * expression.
   *
   * <p>Each occurrence of a variable for which {@code f} returns an index
   * becomes a placeholder with that index; each occurrence of a variable for
   * which {@code f} returns null remains free.
   */
  public static <B, V> Scope<B, V> abstractVars(
      Expression<V> expression, Function<? super V, @Nullable B> f) {
    return new Scope<>(
        expression.<Var<B, V>>map(
            v -> {
              final B b = f.apply(v);
              return b == null ? Var.<B, V>free(v) : Var.<B, V>bound(b);
            }));
  }

  /** Creates a scope that binds a single variable. */
  public static <V> Scope<Unit, V> abstract1(Expression<V> expression, V v) {
    requireNonNull(v, "v");
    return abstractVars(expression, v2 -> v.equals(v2) ? Unit.INSTANCE : null);
  }

  /** Returns the body of this scope. */
  public Expression<Var<B, V>> fromScope() {
    return body;
  }

  /** Replaces each placeholder with an expression. */
  public Expression<V> instantiate(
      Function<? super B, ? extends Expression<V>> f) {
    return body.<V>substitute(
        var -> {
          if (var.isBound()) {
            return f.apply(var.bound());
          }
          return Expression.var(var.free());
        });
  }

  /** Replaces every placeholder with the same expression. Intended for
   * scopes that bind one variable. */
  public Expression<V> instantiate1(Expression<V> expression) {
    return instantiate(b -> expression);
  }

  /**
   * Substitutes for the free variables of this scope.
   *
   * <p>The substitution is shifted past this scope's binder: placeholders are
   * left alone, and the expressions that {@code f} returns are wrapped so that
   * their variables are free in the new scope.
   */
  public <W> Scope<B, W> substitute(
      Function<? super V, ? extends Expression<W>> f) {
    return new Scope<>(
        body.<Var<B, W>>substitute(
            var -> {
              if (var.isBound()) {
                return Expression.var(Var.<B, W>bound(var.bound()));
              }
              final Expression<W> e = f.apply(var.free());
              return e.map(Var::<B, W>free);
            }));
  }

  /** Calls a consumer for each occurrence of a free variable. */
  void forEachFree(Consumer<? super V> consumer) {
    body.forEachVar(
        var -> {
          if (!var.isBound()) {
            consumer.accept(var.free());
          }
        });
  }

  /** Calls a consumer for each occurrence of a placeholder of this scope. */
  public void forEachBound(Consumer<? super B> consumer) {
    body.forEachVar(
        var -> {
          if (var.isBound()) {
            consumer.accept(var.bound());
          }
        });
  }

  @Override
  public int hashCode() {
    return body.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Scope && body.equals(((Scope<?, ?>) o).body);
  }

  @Override
  public String toString() {
    return "Scope(" + body + ")";
  }

  /** Returns an ordering on scopes, given orderings on indices and free
   * variables. */
  public static <B, V> Ordering<Scope<B, V>> ordering(
      Comparator<? super B> boundComparator,
      Comparator<? super V> freeComparator) {
    final Ordering<Expression<Var<B, V>>> bodyOrdering =
        Expression.ordering(Var.ordering(boundComparator, freeComparator));
    return Ordering.from((s0, s1) -> bodyOrdering.compare(s0.body, s1.body));
  }

  /**
   * Variable in the body of a scope: either a placeholder bound by the scope,
   * or a variable free in the scope.
   *
   * <p>Placeholders sort before free variables.
   *
   * @param <B> Type of the index of a bound placeholder
   * @param <F> Type of free variables
   */
  public static final class Var<B, F> {
    private final @Nullable B bound;
    private final @Nullable F free;

    private Var(@Nullable B bound, @Nullable F free) {
      this.bound = bound;
      this.free = free;
    }

    /** Creates a placeholder. */
    public static <B, F> Var<B, F> bound(B b) {
      return new Var<>(requireNonNull(b, "b"), null);
    }

    /** Creates a free variable. */
    public static <B, F> Var<B, F> free(F f) {
      return new Var<>(null, requireNonNull(f, "f"));
    }

    /** Returns whether this is a placeholder. */
    public boolean isBound() {
      return bound != null;
    }

    /** Returns the index of this placeholder; throws if this is free. */
    public B bound() {
      if (bound == null) {
        throw new IllegalStateException("not bound: " + this);
      }
      return bound;
    }

    /** Returns this free variable; throws if this is a placeholder. */
    public F free() {
      if (free == null) {
        throw new IllegalStateException("not free: " + this);
      }
      return free;
    }

    @Override
    public int hashCode() {
      return bound != null
          ? Objects.hash(true, bound)
          : Objects.hash(false, free);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
              && Objects.equals(bound, ((Var<?, ?>) o).bound)
              && Objects.equals(free, ((Var<?, ?>) o).free);
    }

    @Override
    public String toString() {
      return bound != null ? "B(" + bound + ")" : "F(" + free + ")";
    }

    /** Returns an ordering on variables, given orderings on indices and free
     * variables. */
    public static <B, F> Ordering<Var<B, F>> ordering(
        Comparator<? super B> boundComparator,
        Comparator<? super F> freeComparator) {
      return Ordering.from(
          (v0, v1) -> {
            if (v0.isBound()) {
              return v1.isBound()
                  ? boundComparator.compare(v0.bound(), v1.bound())
                  : -1;
            } else {
              return v1.isBound()
                  ? 1
                  : freeComparator.compare(v0.free(), v1.free());
            }
          });
    }
  }
}

// End Scope.java
