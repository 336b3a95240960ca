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

import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import net.hydromatic.elm.ast.Name;

/**
 * Precedence and associativity of an infix operator.
 *
 * <p>An operator with precedence {@code n} prints its left operand with
 * minimum precedence {@link #left}, and its right operand with minimum
 * precedence {@link #right}; the whole call needs parentheses if the
 * surrounding context requires a precedence greater than {@link #prec}.
 * Function application has precedence {@link Pretty#APP_PREC}, higher than
 * any operator.
 */
public final class Fixity {
  public final int left;
  public final int prec;
  public final int right;
  /** Whether the right operand goes on a new line, as in a pipeline. */
  public final boolean twoLine;

  private Fixity(int left, int prec, int right, boolean twoLine) {
    this.left = left;
    this.prec = prec;
    this.right = right;
    this.twoLine = twoLine;
  }

  /** Creates a left-associative fixity: "a + b + c" is "(a + b) + c". */
  public static Fixity leftAssoc(int prec) {
    return new Fixity(prec, prec, prec + 1, false);
  }

  /** Creates a right-associative fixity: "a :: b :: c" is "a :: (b :: c)". */
  public static Fixity rightAssoc(int prec) {
    return new Fixity(prec + 1, prec, prec, false);
  }

  /** Creates a non-associative fixity; "a == b == c" is invalid. */
  public static Fixity nonAssoc(int prec) {
    return new Fixity(prec + 1, prec, prec + 1, false);
  }

  /** Returns whether this fixity has the same associativity as another;
   * their precedences may differ. */
  public boolean sameAssociativity(Fixity o) {
    return left - prec == o.left - o.prec && right - prec == o.right - o.prec;
  }

  /** Returns a copy of this fixity whose right operand goes on a new line. */
  public Fixity twoLine() {
    return new Fixity(left, prec, right, true);
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, prec, right, twoLine);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Fixity
            && left == ((Fixity) o).left
            && prec == ((Fixity) o).prec
            && right == ((Fixity) o).right
            && twoLine == ((Fixity) o).twoLine;
  }

  @Override
  public String toString() {
    return "Fixity(" + left + ", " + prec + ", " + right
        + (twoLine ? ", twoLine)" : ")");
  }

  /** Fixities of Elm's built-in operators. */
  public static final ImmutableMap<Name.Qualified, Fixity> DEFAULT =
      ImmutableMap.<Name.Qualified, Fixity>builder()
          .put(Name.Qualified.of("Basics.>>"), leftAssoc(9).twoLine())
          .put(Name.Qualified.of("Basics.<<"), rightAssoc(9).twoLine())
          .put(Name.Qualified.of("Basics.^"), rightAssoc(8))
          .put(Name.Qualified.of("Basics.*"), leftAssoc(7))
          .put(Name.Qualified.of("Basics./"), leftAssoc(7))
          .put(Name.Qualified.of("Basics.//"), leftAssoc(7))
          .put(Name.Qualified.of("Basics.%"), leftAssoc(7))
          .put(Name.Qualified.of("Basics.+"), leftAssoc(6))
          .put(Name.Qualified.of("Basics.-"), leftAssoc(6))
          .put(Name.Qualified.of("Parser.|."), leftAssoc(6))
          .put(Name.Qualified.of("Parser.|="), leftAssoc(5))
          .put(Name.Qualified.of("Basics.++"), rightAssoc(5))
          .put(Name.Qualified.of("List.::"), rightAssoc(5))
          .put(Name.Qualified.of("Basics.=="), nonAssoc(4))
          .put(Name.Qualified.of("Basics./="), nonAssoc(4))
          .put(Name.Qualified.of("Basics.<"), nonAssoc(4))
          .put(Name.Qualified.of("Basics.>"), nonAssoc(4))
          .put(Name.Qualified.of("Basics.<="), nonAssoc(4))
          .put(Name.Qualified.of("Basics.>="), nonAssoc(4))
          .put(Name.Qualified.of("Basics.&&"), rightAssoc(3))
          .put(Name.Qualified.of("Basics.||"), leftAssoc(2))
          .put(Name.Qualified.of("Basics.|>"), leftAssoc(0).twoLine())
          .put(Name.Qualified.of("Basics.<|"), rightAssoc(0).twoLine())
          .build();

  /** Empty table; every operator prints as a prefix function. */
  public static final ImmutableMap<Name.Qualified, Fixity> NONE =
      ImmutableMap.of();
}

// End Fixity.java
