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

import static net.hydromatic.elm.Elm.def;
import static net.hydromatic.elm.Elm.expr;
import static net.hydromatic.elm.Elm.module;
import static net.hydromatic.elm.Elm.type;
import static net.hydromatic.elm.ast.ElmBuilder.elm;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.elm.ast.Definition;
import net.hydromatic.elm.ast.Expression;
import net.hydromatic.elm.ast.Name;
import net.hydromatic.elm.ast.Pattern;
import net.hydromatic.elm.ast.Scope;
import net.hydromatic.elm.ast.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Pretty}. */
public class PrettyTest {
  /** Environment that names each free variable after itself. */
  private static final Environment<String> FREE = Environments.free(s -> s);

  private static final Type<Void> INT = elm.tyGlobal("Basics.Int");
  private static final Type<Void> FLOAT = elm.tyGlobal("Basics.Float");

  private static Expression<Void> i(long value) {
    return elm.intLiteral(value);
  }

  /** Applies a binary operator from module "Basics". */
  private static <V> Expression<V> op(
      String name, Expression<V> e0, Expression<V> e1) {
    return elm.applyAll(elm.<V>global("Basics." + name), e0, e1);
  }

  @Test
  void testOperators() {
    expr(op("+", i(1), i(2))).assertPrint("1 + 2");
    expr(op("+", i(1), op("*", i(2), i(3)))).assertPrint("1 + 2 * 3");
    expr(op("*", i(1), op("+", i(2), i(3)))).assertPrint("1 * (2 + 3)");
    expr(op("*", op("+", i(1), i(2)), i(3))).assertPrint("(1 + 2) * 3");
  }

  /** Tests that the parentheses around a nested operator depend on its
   * associativity. */
  @Test
  void testAssociativity() {
    // left-associative
    expr(op("-", op("-", i(1), i(2)), i(3))).assertPrint("1 - 2 - 3");
    expr(op("-", i(1), op("-", i(2), i(3)))).assertPrint("1 - (2 - 3)");

    // right-associative
    final Expression<Void> a = elm.string("a");
    final Expression<Void> b = elm.string("b");
    final Expression<Void> c = elm.string("c");
    expr(op("++", a, op("++", b, c))).assertPrint("\"a\" ++ \"b\" ++ \"c\"");
    expr(op("++", op("++", a, b), c))
        .assertPrint("(\"a\" ++ \"b\") ++ \"c\"");
    expr(op("^", i(2), op("^", i(3), i(4)))).assertPrint("2 ^ 3 ^ 4");

    // non-associative
    final Expression<Void> t = elm.global("Basics.True");
    expr(op("==", op("<", i(1), i(2)), t)).assertPrint("(1 < 2) == True");
    expr(op("==", t, op("<", i(1), i(2)))).assertPrint("True == (1 < 2)");
  }

  @Test
  void testLogicalOperators() {
    final Expression<Void> t = elm.global("Basics.True");
    final Expression<Void> f = elm.global("Basics.False");
    expr(op("||", t, op("&&", f, t))).assertPrint("True || False && True");
    expr(op("&&", op("||", t, f), t)).assertPrint("(True || False) && True");
  }

  @Test
  void testCustomFixities() {
    final Map<Name.Qualified, Fixity> fixities =
        ImmutableMap.of(Name.Qualified.of("Basics.+"), Fixity.rightAssoc(6));
    expr(op("+", op("+", i(1), i(2)), i(3)))
        .withFixities(fixities)
        .assertPrint("(1 + 2) + 3");
    expr(op("+", i(1), op("+", i(2), i(3))))
        .withFixities(fixities)
        .assertPrint("1 + 2 + 3");
  }

  /** Without any fixities, every operator is printed as a prefix
   * function. */
  @Test
  void testNoFixities() {
    expr(op("+", i(1), i(2))).withFixities(Fixity.NONE).assertPrint("+ 1 2");
  }

  @Test
  void testApplication() {
    final Expression<Void> negate = elm.global("Basics.negate");
    expr(elm.app(negate, op("+", i(1), i(2)))).assertPrint("negate (1 + 2)");
    expr(op("+", elm.app(negate, i(1)), i(2))).assertPrint("negate 1 + 2");
    expr(elm.app(negate, elm.app(negate, i(1))))
        .assertPrint("negate (negate 1)");
    expr(elm.app(elm.global("Basics.abs"), i(-3))).assertPrint("abs (-3)");
    expr(elm.app(elm.global("Basics.abs"), elm.floatLiteral(-2.5)))
        .assertPrint("abs (-2.5)");
    expr(i(-3)).assertPrint("-3");
  }

  /** Tests that a chain of applications is printed as one call. */
  @Test
  void testSpine() {
    final Expression<Void> e =
        elm.applyAll(
            elm.global("List.foldl"),
            elm.global("Basics.+"),
            i(0),
            elm.list(i(1), i(2), i(3)));
    expr(e).assertPrint("List.foldl (+) 0 [ 1, 2, 3 ]");

    final Expression<Void> e2 =
        elm.applyAll(
            elm.global("List.map"),
            elm.app(elm.global("Basics.+"), i(1)),
            elm.list());
    expr(e2).assertPrint("List.map ((+) 1) []");

    // An operator with more than two arguments
    final Expression<Void> e3 =
        elm.applyAll(elm.global("Basics.+"), i(1), i(2), i(3));
    expr(e3).assertPrint("(1 + 2) 3");
  }

  @Test
  void testPipeline() {
    final Expression<Void> e =
        elm.pipeInto(elm.list(i(1), i(2)), elm.global("List.reverse"));
    expr(e).assertPrintLines("[ 1, 2 ] |>", "List.reverse");

    final Expression<String> e2 =
        elm.let(
            "x",
            elm.pipeInto(
                elm.list(elm.intLiteral(1), elm.intLiteral(2)),
                elm.global("List.reverse")),
            elm.var("x"));
    expr(e2.close())
        .assertPrintLines(
            "let",
            "    a =",
            "        [ 1, 2 ] |>",
            "        List.reverse",
            "in",
            "a");
  }

  /** Operators of the same precedence but different associativity, such as
   * "<|" and "|>", cannot be mixed without parentheses. */
  @Test
  void testMixedAssociativity() {
    final Expression<Void> f = elm.global("f");
    final Expression<Void> g = elm.global("g");
    final Expression<Void> x = elm.global("x");
    final Expression<Void> apL = elm.global("Basics.<|");
    expr(elm.pipeInto(elm.applyAll(apL, f, x), g))
        .assertPrintLines("(f <|", "x) |>", "g");
    expr(elm.applyAll(apL, f, elm.pipeInto(x, g)))
        .assertPrintLines("f <|", "(x |>", "g)");

    final Expression<String> id = elm.lam("y", elm.var("y"));
    final Expression<String> e =
        elm.pipeInto(
            elm.applyAll(elm.global("Basics.<|"), elm.global("f"), id),
            elm.global("g"));
    expr(e.close()).assertPrintLines("(f <|", "\\a -> a) |>", "g");

    // Same associativity needs no parentheses
    expr(elm.pipeInto(elm.pipeInto(x, f), g))
        .assertPrintLines("x |>", "f |>", "g");
    expr(elm.applyAll(apL, f, elm.applyAll(apL, g, x)))
        .assertPrintLines("f <|", "g <|", "x");

    // "++" (right 5) and "|=" (left 5)
    final Expression<Void> e2 =
        elm.applyAll(
            elm.global("Parser.|="),
            op("++", elm.string("a"), elm.string("b")),
            elm.global("p"));
    expr(e2).assertPrint("(\"a\" ++ \"b\") |= p");
  }

  @Test
  void testLambda() {
    final Expression<String> add =
        elm.lam("x", elm.lam("y", op("+", elm.var("x"), elm.var("y"))));
    expr(add.close()).assertPrint("\\a b -> a + b");

    final Expression<String> inc =
        elm.lam("x", op("+", elm.var("x"), elm.intLiteral(1)));
    final Expression<String> map =
        elm.applyAll(elm.global("List.map"), inc, elm.list(elm.intLiteral(1)));
    expr(map.close()).assertPrint("List.map (\\a -> a + 1) [ 1 ]");

    // Free variable "y" keeps its own name
    final Expression<String> e =
        elm.lam("x", op("+", elm.var("x"), elm.var("y")));
    expr(FREE, e).assertPrint("\\a -> a + y");
  }

  /** After "z", fresh names continue with "a0". */
  @Test
  void testManyLambdas() {
    Expression<String> e = elm.var("v26");
    for (int i = 26; i >= 0; i--) {
      e = elm.lam("v" + i, e);
    }
    final StringBuilder expected = new StringBuilder("\\");
    for (char c = 'a'; c <= 'z'; c++) {
      expected.append(c).append(' ');
    }
    expected.append("a0 -> a0");
    expr(e.close()).assertPrint(expected.toString());
  }

  @Test
  void testLet() {
    final Expression<String> e =
        elm.let("x", elm.intLiteral(1), op("+", elm.var("x"), elm.var("x")));
    expr(e.close())
        .assertPrintLines("let", "    a =", "        1", "in", "a + a");

    final Expression<String> e2 =
        elm.let(
            "x",
            elm.intLiteral(1),
            elm.let("y", elm.var("x"), elm.var("y")));
    expr(e2.close())
        .assertPrintLines(
            "let",
            "    a =",
            "        1",
            "",
            "    b =",
            "        a",
            "in",
            "b");

    expr(e.close())
        .withProp(Prop.INDENT, 2)
        .assertPrintLines("let", "  a =", "    1", "in", "a + a");
  }

  @Test
  void testCase() {
    final Expression<String> e =
        elm.caseOf(
            elm.var("x"),
            elm.branch(
                elm.conPat("Maybe.Just", elm.varPat("y")), elm.var("y")));
    expr(FREE, e).assertPrintLines("case x of", "    Just a ->", "        a");

    final Expression<String> e2 =
        elm.caseOf(
            elm.var("n"),
            elm.branch(elm.intPat(0), elm.string("zero")),
            elm.branch(elm.wildcardPat(), elm.string("many")));
    expr(FREE, e2)
        .assertPrintLines(
            "case n of",
            "    0 ->",
            "        \"zero\"",
            "",
            "    _ ->",
            "        \"many\"");
  }

  @Test
  void testCaseTuple() {
    final Expression<String> e =
        elm.caseOf(
            elm.var("t"),
            elm.branch(
                elm.conPat("Basics.,", elm.varPat("p"), elm.varPat("q")),
                op("+", elm.var("p"), elm.var("q"))));
    expr(FREE, e)
        .assertPrintLines("case t of", "    ( a, b ) ->", "        a + b");
  }

  /** Names are assigned to pattern variables in the order of their indexes,
   * not the order in which they occur. */
  @Test
  void testPatternNameOrder() {
    final Pattern<Integer> pattern =
        elm.conPat("Basics.,", elm.varPat(1), elm.varPat(0));
    final Expression<Scope.Var<Integer, Void>> body =
        op(
            "-",
            elm.var(Scope.Var.<Integer, Void>bound(0)),
            elm.var(Scope.Var.<Integer, Void>bound(1)));
    final Expression<Void> e =
        elm.caseOf(
            elm.global("x"),
            elm.branch(pattern, Scope.<Integer, Void>toScope(body)));
    expr(e).assertPrintLines("case x of", "    ( b, a ) ->", "        a - b");
  }

  @Test
  void testRecord() {
    final Map<String, Expression<Void>> fields =
        ImmutableMap.of("a", i(1), "b", elm.string("x"));
    expr(elm.record(fields)).assertPrint("{ a = 1, b = \"x\" }");
    expr(elm.record(ImmutableMap.<String, Expression<Void>>of()))
        .assertPrint("{}");

    final Map<String, Expression<Void>> fields3 =
        ImmutableMap.of("a", i(1), "b", i(2), "c", i(3));
    expr(elm.record(fields3)).assertPrint("{ a = 1, b = 2, c = 3 }");
    expr(elm.record(fields3))
        .withProp(Prop.LINE_WIDTH, 20)
        .assertPrintLines("{ a = 1", ", b = 2", ", c = 3", "}");
  }

  @Test
  void testList() {
    expr(elm.list()).assertPrint("[]");
    expr(elm.list(elm.list(i(1), i(2)), elm.list()))
        .assertPrint("[ [ 1, 2 ], [] ]");

    final Expression<String> e =
        elm.let(
            "x",
            elm.list(
                elm.intLiteral(100),
                elm.intLiteral(200),
                elm.intLiteral(300),
                elm.intLiteral(400)),
            elm.var("x"));
    expr(e.close())
        .withProp(Prop.LINE_WIDTH, 20)
        .assertPrintLines(
            "let",
            "    a =",
            "        [ 100",
            "        , 200",
            "        , 300",
            "        , 400",
            "        ]",
            "in",
            "a");
  }

  @Test
  void testProjAndLiterals() {
    expr(elm.app(elm.proj("name"), elm.global("user")))
        .assertPrint(".name user");
    expr(elm.floatLiteral(1.5)).assertPrint("1.5");
    expr(elm.string("hello")).assertPrint("\"hello\"");
  }

  @Test
  void testTuple() {
    expr(elm.pair(i(1), elm.string("x"))).assertPrint("( 1, \"x\" )");
    expr(elm.app(elm.global("Tuple.first"), elm.pair(i(1), i(2))))
        .assertPrint("Tuple.first ( 1, 2 )");
    expr(elm.triple(i(1), i(2), i(3))).assertPrint("( 1, 2, 3 )");
  }

  @Test
  void testTuplePattern() {
    final Expression<String> e =
        elm.caseOf(
            elm.var("t"),
            elm.branch(
                elm.conPat(
                    "Basics.,",
                    elm.varPat("p"),
                    elm.wildcardPat(),
                    elm.varPat("q")),
                op("+", elm.var("p"), elm.var("q"))));
    expr(FREE, e)
        .assertPrintLines("case t of", "    ( a, _, b ) ->", "        a + b");
  }

  /** Printing the same expression twice, or with two printers, gives the
   * same result. */
  @Test
  void testDeterministic() {
    final Expression<String> e =
        elm.lam("x", elm.let("y", elm.var("x"), elm.var("y")));
    final String s = new Pretty().expression(e.close());
    assertThat(new Pretty().expression(e.close()), is(s));
    assertThat(expr(e.close()).print(), is(s));
  }

  @Test
  void testType() {
    type(elm.fnType(INT, elm.fnType(INT, INT)))
        .assertPrint("Int -> Int -> Int");
    type(elm.fnType(elm.fnType(INT, INT), INT))
        .assertPrint("(Int -> Int) -> Int");
    final Type<Void> listInt = elm.tyApp(elm.tyGlobal("List.List"), INT);
    type(listInt).assertPrint("List Int");
    type(elm.tyApp(elm.tyGlobal("Maybe.Maybe"), listInt))
        .assertPrint("Maybe (List Int)");
    type(
            elm.tyApp(
                elm.tyGlobal("Dict.Dict"), elm.tyGlobal("String.String"), INT))
        .assertPrint("Dict.Dict String Int");
  }

  @Test
  void testConstant() {
    def(elm.constant("Main.answer", INT, i(42)))
        .assertPrintLines("answer : Int", "answer =", "    42");

    final Expression<String> add =
        elm.lam("x", elm.lam("y", op("+", elm.var("x"), elm.var("y"))));
    final Type<Void> intIntInt = elm.fnType(INT, elm.fnType(INT, INT));
    def(elm.constant("Main.add", intIntInt, add.close()))
        .assertPrintLines("add : Int -> Int -> Int", "add a b =", "    a + b");
  }

  @Test
  void testDataType() {
    final Definition shape =
        elm.dataType(
            "Main.Shape",
            elm.constructor("Circle", FLOAT),
            elm.constructor("Rect", FLOAT, FLOAT),
            elm.constructor(
                "Wrap", elm.tyApp(elm.tyGlobal("Maybe.Maybe"), INT)),
            elm.constructor("Empty"));
    def(shape)
        .assertPrintLines(
            "type Shape",
            "    = Circle Float",
            "    | Rect Float Float",
            "    | Wrap (Maybe Int)",
            "    | Empty");
  }

  @Test
  void testAlias() {
    final Map<String, Type<Void>> fields =
        ImmutableMap.of("x", FLOAT, "y", FLOAT);
    def(elm.alias("Main.Point", elm.recordType(fields)))
        .assertPrintLines("type alias Point =", "    { x : Float, y : Float }");
  }

  @Test
  void testModule() {
    final Definition answer = elm.constant("Main.answer", INT, i(42));
    final Definition view =
        elm.constant(
            "Main.view",
            elm.tyApp(elm.tyGlobal("Html.Html"), elm.tyGlobal("Basics.Never")),
            elm.app(
                elm.global("Html.text"),
                elm.app(
                    elm.global("String.fromInt"),
                    elm.global("Main.answer"))));
    final Definition parser =
        elm.constant(
            "Main.parser",
            elm.tyApp(elm.tyGlobal("Parser.Parser"), INT),
            elm.applyAll(
                elm.global("Parser.|="),
                elm.app(
                    elm.global("Parser.succeed"),
                    elm.global("Basics.identity")),
                elm.global("Parser.int")));
    module("Main", answer, view, parser)
        .assertPrintLines(
            "module Main exposing (..)",
            "",
            "import Html",
            "import Parser exposing ((|=))",
            "",
            "",
            "answer : Int",
            "answer =",
            "    42",
            "",
            "",
            "view : Html.Html Never",
            "view =",
            "    Html.text (String.fromInt answer)",
            "",
            "",
            "parser : Parser.Parser Int",
            "parser =",
            "    Parser.succeed identity |= Parser.int",
            "");

    module("Main", answer)
        .assertPrintLines(
            "module Main exposing (..)",
            "",
            "",
            "answer : Int",
            "answer =",
            "    42",
            "");
  }

  /** Tests that the printed form of a module does not depend on the order in
   * which its definitions reference other modules. */
  @Test
  void testModuleImportOrder() {
    final List<Definition> definitions = new ArrayList<>();
    for (String m : ImmutableList.of("Set", "Array", "Dict")) {
      definitions.add(
          elm.constant(
              "Main." + m.toLowerCase(Locale.ROOT),
              elm.tyApp(elm.tyGlobal(m + "." + m), INT),
              elm.global(m + ".empty")));
    }
    final String s = new Pretty().module("Main", definitions);
    assertThat(
        s.substring(0, s.indexOf("\n\n\n")),
        is(
            "module Main exposing (..)\n"
                + "\n"
                + "import Array\n"
                + "import Dict\n"
                + "import Set"));
  }
}

// End PrettyTest.java
