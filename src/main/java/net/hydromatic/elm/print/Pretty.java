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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.elm.ast.ElmBuilder.elm;
import static net.hydromatic.elm.util.Static.skip;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import net.hydromatic.elm.ast.Definition;
import net.hydromatic.elm.ast.ElmBuilder;
import net.hydromatic.elm.ast.Expression;
import net.hydromatic.elm.ast.Name;
import net.hydromatic.elm.ast.Op;
import net.hydromatic.elm.ast.Pattern;
import net.hydromatic.elm.ast.Scope;
import net.hydromatic.elm.ast.Type;
import net.hydromatic.elm.util.Pair;
import net.hydromatic.elm.util.Unit;
import org.apache.log4j.Logger;

/**
 * Prints expressions, types and definitions as Elm source code.
 *
 * <p>Each method that prints an expression, pattern or type has a {@code
 * prec} argument, the minimum precedence of the context; a construct whose
 * own precedence is lower is enclosed in parentheses.
 *
 * <p>Each method that prints has an {@code indent} argument, the number of
 * spaces at the start of any new line it starts. It may start new lines
 * indented further, but never less.
 */
public class Pretty {
  private static final Logger LOGGER = Logger.getLogger(Pretty.class);

  /** Precedence of function application, which binds tighter than any
   * infix operator. */
  public static final int APP_PREC = 10;

  static final int LET_PREC = 0;
  static final int LAM_PREC = 0;
  static final int CASE_PREC = 0;
  static final int FUN_PREC = 0;

  private static final ImmutableList<String> BASICS =
      ImmutableList.of("Basics");

  /** Names that Elm imports by default, and the names that they are printed
   * as. Everything in module "Basics" is also imported. */
  private static final ImmutableMap<Name.Qualified, String> DEFAULT_IMPORTS =
      ImmutableMap.<Name.Qualified, String>builder()
          .put(Name.Qualified.of("List.List"), "List")
          .put(Name.Qualified.of("List.::"), "::")
          .put(Name.Qualified.of("Maybe.Maybe"), "Maybe")
          .put(Name.Qualified.of("Maybe.Nothing"), "Nothing")
          .put(Name.Qualified.of("Maybe.Just"), "Just")
          .put(Name.Qualified.of("Result.Result"), "Result")
          .put(Name.Qualified.of("Result.Ok"), "Ok")
          .put(Name.Qualified.of("Result.Err"), "Err")
          .put(Name.Qualified.of("String.String"), "String")
          .put(Name.Qualified.of("Char.Char"), "Char")
          .build();

  /** Modules that every Elm module imports implicitly. */
  private static final ImmutableSet<String> IMPLICIT_MODULES =
      ImmutableSet.of(
          "Basics",
          "Char",
          "Debug",
          "List",
          "Maybe",
          "Platform",
          "Platform.Cmd",
          "Platform.Sub",
          "Result",
          "String",
          "Tuple");

  private final int lineWidth;
  private final int indentWidth;
  private final ImmutableMap<Name.Qualified, Fixity> fixities;
  /** Path of the module being printed, whose names print unqualified; empty
   * if not printing a module. */
  private final ImmutableList<String> module;

  /** Creates a printer with default properties. */
  public Pretty() {
    this(ImmutableMap.of());
  }

  /** Creates a printer with the given properties. */
  public Pretty(Map<Prop, Object> propMap) {
    this(
        Prop.LINE_WIDTH.intValue(propMap),
        Prop.INDENT.intValue(propMap),
        Fixity.DEFAULT,
        ImmutableList.of());
  }

  private Pretty(
      int lineWidth,
      int indentWidth,
      Map<Name.Qualified, Fixity> fixities,
      ImmutableList<String> module) {
    checkArgument(lineWidth > 0, "lineWidth must be positive: %s", lineWidth);
    checkArgument(indentWidth > 0, "indent must be positive: %s", indentWidth);
    this.lineWidth = lineWidth;
    this.indentWidth = indentWidth;
    this.fixities = ImmutableMap.copyOf(fixities);
    this.module = requireNonNull(module, "module");
  }

  /** Returns a printer that uses a given table of operator fixities. */
  public Pretty withFixities(Map<Name.Qualified, Fixity> fixities) {
    return new Pretty(lineWidth, indentWidth, fixities, module);
  }

  /** Prints a closed expression. */
  public String expression(Expression<Void> e) {
    return expression(Environments.empty(), e);
  }

  /** Prints an expression whose free variables are named by an
   * environment. */
  public <V> String expression(Environment<V> env, Expression<V> e) {
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("print expression " + e);
    }
    final StringBuilder buf = new StringBuilder();
    expression(buf, 0, env, 0, e);
    return buf.toString();
  }

  /** Prints a closed type. */
  public String type(Type<Void> t) {
    final StringBuilder buf = new StringBuilder();
    type(buf, 0, 0, t);
    return buf.toString();
  }

  /** Prints a definition. */
  public String definition(Definition d) {
    final StringBuilder buf = new StringBuilder();
    definition(buf, d);
    return buf.toString();
  }

  /**
   * Prints a module: its header, the imports required by its definitions,
   * and the definitions.
   *
   * <p>Names defined in the module itself print unqualified.
   */
  public String module(String moduleName, List<Definition> definitions) {
    LOGGER.debug(
        "print module " + moduleName + ", "
            + definitions.size() + " definitions");
    final Pretty pretty =
        new Pretty(
            lineWidth,
            indentWidth,
            fixities,
            ImmutableList.copyOf(Splitter.on('.').split(moduleName)));
    final StringBuilder buf = new StringBuilder();
    buf.append("module ").append(moduleName).append(" exposing (..)\n");
    final SortedMap<String, SortedSet<String>> imports =
        pretty.imports(definitions);
    if (!imports.isEmpty()) {
      buf.append('\n');
      imports.forEach(
          (moduleName2, operators) -> {
            buf.append("import ").append(moduleName2);
            if (!operators.isEmpty()) {
              buf.append(" exposing (")
                  .append(Joiner.on(", ").join(operators))
                  .append(')');
            }
            buf.append('\n');
          });
    }
    for (Definition definition : definitions) {
      buf.append("\n\n");
      pretty.definition(buf, definition);
      buf.append('\n');
    }
    return buf.toString();
  }

  /**
   * Returns the modules that must be imported to use the names referenced by
   * some definitions, each with the set of operators that the import must
   * expose, such as "(|=)".
   */
  private SortedMap<String, SortedSet<String>> imports(
      List<Definition> definitions) {
    final SortedMap<String, SortedSet<String>> imports = new TreeMap<>();
    for (Definition definition : definitions) {
      definition.forEachGlobal(
          name -> {
            if (name.modules.isEmpty() || name.modules.equals(module)) {
              return;
            }
            final String moduleName = name.moduleName();
            if (IMPLICIT_MODULES.contains(moduleName)) {
              return;
            }
            final SortedSet<String> operators =
                imports.computeIfAbsent(moduleName, k -> new TreeSet<>());
            if (fixities.containsKey(name)) {
              operators.add("(" + name.name + ")");
            }
          });
    }
    return imports;
  }

  // definitions

  private void definition(StringBuilder buf, Definition d) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("print definition " + d.name);
    }
    switch (d.op) {
      case CONSTANT_DEF:
        final Definition.Constant constant = (Definition.Constant) d;
        buf.append(constant.name.name).append(" : ");
        type(buf, 0, 0, constant.type);
        newline(buf, 0);
        buf.append(constant.name.name);
        lambdas(buf, 0, Environments.empty(), constant.expression, true, true);
        return;

      case TYPE_DEF:
        final Definition.DataType dataType = (Definition.DataType) d;
        buf.append("type ").append(dataType.name.name);
        for (int i = 0; i < dataType.constructors.size(); i++) {
          final Pair<Name.Constructor, ImmutableList<Type<Void>>> constructor =
              dataType.constructors.get(i);
          newline(buf, indentWidth);
          buf.append(i == 0 ? "= " : "| ").append(constructor.left.name);
          for (Type<Void> arg : constructor.right) {
            buf.append(' ');
            type(buf, indentWidth + 2, APP_PREC + 1, arg);
          }
        }
        return;

      case ALIAS_DEF:
        final Definition.Alias alias = (Definition.Alias) d;
        buf.append("type alias ").append(alias.name.name).append(" =");
        newline(buf, indentWidth);
        type(buf, indentWidth, 0, alias.type);
        return;

      default:
        throw new AssertionError("unknown op " + d.op);
    }
  }

  // expressions

  private <V> void expression(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      int prec,
      Expression<V> e) {
    switch (e.op) {
      case VAR:
        buf.append(env.lookup(((Expression.Var<V>) e).variable).name);
        return;

      case GLOBAL:
      case APP:
        final Pair<Expression<V>, List<Expression<V>>> spine = spine(e);
        if (spine.left.op == Op.GLOBAL) {
          final Name.Qualified name = ((Expression.Global<V>) spine.left).name;
          globalApps(buf, indent, env, prec, name, spine.right);
        } else if (!spine.right.isEmpty()) {
          apps(buf, indent, env, prec, spine.left, spine.right);
        } else {
          throw new AssertionError("application without arguments: " + e);
        }
        return;

      case LET:
        final boolean letParens = prec > LET_PREC;
        if (letParens) {
          buf.append('(');
        }
        buf.append("let");
        lets(buf, indent, env, e, true);
        if (letParens) {
          buf.append(')');
        }
        return;

      case LAM:
        final boolean lamParens = prec > LAM_PREC;
        if (lamParens) {
          buf.append('(');
        }
        buf.append('\\');
        lambdas(buf, indent, env, e, true, false);
        if (lamParens) {
          buf.append(')');
        }
        return;

      case RECORD:
        final List<Printer> fields = new ArrayList<>();
        for (Pair<Name.Field, Expression<V>> field
            : ((Expression.Record<V>) e).fields) {
          fields.add(
              (buf2, indent2) -> {
                buf2.append(field.left.name).append(" = ");
                expression(buf2, indent2, env, 0, field.right);
              });
        }
        enclose(buf, "{ ", " }", fields);
        return;

      case PROJ:
        buf.append('.').append(((Expression.Proj<V>) e).field.name);
        return;

      case CASE:
        final Expression.Case<V> kase = (Expression.Case<V>) e;
        final boolean caseParens = prec > CASE_PREC;
        if (caseParens) {
          buf.append('(');
        }
        buf.append("case ");
        expression(buf, indent, env, 0, kase.exp);
        buf.append(" of");
        for (int i = 0; i < kase.branches.size(); i++) {
          if (i > 0) {
            buf.append('\n');
          }
          branch(buf, indent + indentWidth, env, kase.branches.get(i));
        }
        if (caseParens) {
          buf.append(')');
        }
        return;

      case LIST:
        final List<Printer> elements = new ArrayList<>();
        for (Expression<V> arg : ((Expression.ListExp<V>) e).args) {
          elements.add(
              (buf2, indent2) -> expression(buf2, indent2, env, 0, arg));
        }
        enclose(buf, "[ ", " ]", elements);
        return;

      case STRING_LITERAL:
      case INT_LITERAL:
      case FLOAT_LITERAL:
        literal(buf, prec, e.op, ((Expression.Literal<V>) e).value);
        return;

      default:
        throw new AssertionError("unknown op " + e.op);
    }
  }

  /** Prints a branch of a "case", on a new line. Each branch gets its own
   * environment. */
  private <V> void branch(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      Expression.Branch<V> branch) {
    final Environment<Scope.Var<Integer, V>> env2 =
        env.extendForPattern(branch.pattern);
    newline(buf, indent);
    pattern(buf, indent, env2, 0, branch.pattern);
    buf.append(" ->");
    newline(buf, indent + indentWidth);
    expression(buf, indent + indentWidth, env2, 0, branch.scope.fromScope());
  }

  /** Prints an application whose head is a global, which may be an infix
   * operator. */
  private <V> void globalApps(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      int prec,
      Name.Qualified name,
      List<Expression<V>> args) {
    final Fixity fixity = fixities.get(name);
    if (fixity == null) {
      if (name.equals(ElmBuilder.TUPLE)) {
        tupleApps(buf, indent, env, prec, name, args);
      } else {
        atomApps(buf, indent, env, prec, qualified(name), args);
      }
      return;
    }
    switch (args.size()) {
      case 0:
      case 1:
        // Operator without enough arguments prints as a prefix function,
        // e.g. "(+) 1"
        atomApps(buf, indent, env, prec, "(" + name.name + ")", args);
        return;

      case 2:
        final boolean parens = prec > fixity.prec;
        if (parens) {
          buf.append('(');
        }
        final Expression<V> left = args.get(0);
        final Expression<V> right = args.get(1);
        expression(
            buf, indent, env, operandPrec(fixity.left, fixity, left), left);
        buf.append(' ').append(name.name);
        if (fixity.twoLine) {
          newline(buf, indent);
        } else {
          buf.append(' ');
        }
        expression(
            buf, indent, env, operandPrec(fixity.right, fixity, right), right);
        if (parens) {
          buf.append(')');
        }
        return;

      default:
        // Apply the operator to its first two arguments, then apply the
        // result to the rest, e.g. "(f >> g) x"
        final Expression<V> fn =
            elm.applyAll(elm.<V>global(name), args.get(0), args.get(1));
        apps(buf, indent, env, prec, fn, skip(args, 2));
    }
  }

  /**
   * Returns the minimum precedence at which to print an operand of an infix
   * operator.
   *
   * <p>Usually this is the operator's {@link Fixity#left} or {@link
   * Fixity#right}. But Elm does not allow operators of the same precedence
   * and different associativity to be mixed, as in "f <| x |> g", so such an
   * operand needs parentheses.
   */
  private <V> int operandPrec(int prec, Fixity fixity, Expression<V> operand) {
    final Pair<Expression<V>, List<Expression<V>>> spine = spine(operand);
    if (spine.left.op == Op.GLOBAL && spine.right.size() == 2) {
      final Fixity fixity2 =
          fixities.get(((Expression.Global<V>) spine.left).name);
      if (fixity2 != null
          && fixity2.prec == fixity.prec
          && !fixity2.sameAssociativity(fixity)) {
        return fixity.prec + 1;
      }
    }
    return prec;
  }

  /** Prints an application of the tuple constructor. Two or three arguments
   * make a tuple, "( a, b )" or "( a, b, c )". */
  private <V> void tupleApps(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      int prec,
      Name.Qualified name,
      List<Expression<V>> args) {
    switch (args.size()) {
      case 0:
      case 1:
        atomApps(buf, indent, env, prec, "Tuple.pair", args);
        return;

      case 2:
      case 3:
        final List<Printer> elements = new ArrayList<>();
        for (Expression<V> arg : args) {
          elements.add(
              (buf2, indent2) -> expression(buf2, indent2, env, 0, arg));
        }
        enclose(buf, "( ", " )", elements);
        return;

      default:
        final Expression<V> fn =
            elm.applyAll(
                elm.<V>global(name), args.get(0), args.get(1), args.get(2));
        apps(buf, indent, env, prec, fn, skip(args, 3));
    }
  }

  /** Prints a function applied to arguments. */
  private <V> void apps(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      int prec,
      Expression<V> fn,
      List<Expression<V>> args) {
    final boolean parens = prec > APP_PREC;
    if (parens) {
      buf.append('(');
    }
    expression(buf, indent, env, APP_PREC, fn);
    for (Expression<V> arg : args) {
      buf.append(' ');
      expression(buf, indent, env, APP_PREC + 1, arg);
    }
    if (parens) {
      buf.append(')');
    }
  }

  /** Prints an atomic function, already rendered as a string, applied to
   * zero or more arguments. */
  private <V> void atomApps(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      int prec,
      String fn,
      List<Expression<V>> args) {
    if (args.isEmpty()) {
      buf.append(fn);
      return;
    }
    final boolean parens = prec > APP_PREC;
    if (parens) {
      buf.append('(');
    }
    buf.append(fn);
    for (Expression<V> arg : args) {
      buf.append(' ');
      expression(buf, indent, env, APP_PREC + 1, arg);
    }
    if (parens) {
      buf.append(')');
    }
  }

  /** Prints the bindings of a chain of "let" expressions, then "in" and the
   * body of the innermost. */
  private <V> void lets(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      Expression<V> e,
      boolean first) {
    if (e.op != Op.LET) {
      newline(buf, indent);
      buf.append("in");
      newline(buf, indent);
      expression(buf, indent, env, LET_PREC, e);
      return;
    }
    final Expression.Let<V> let = (Expression.Let<V>) e;
    final Pair<Environment<Scope.Var<Unit, V>>, Name.Local> pair =
        env.extend();
    if (!first) {
      buf.append('\n');
    }
    newline(buf, indent + indentWidth);
    buf.append(pair.right.name).append(" =");
    newline(buf, indent + 2 * indentWidth);
    // The bound expression cannot see the name it is bound to
    expression(buf, indent + 2 * indentWidth, env, 0, let.exp);
    lets(buf, indent, pair.left, let.scope.fromScope(), false);
  }

  /**
   * Prints the parameters of a chain of lambdas, and then the body of the
   * innermost.
   *
   * <p>If {@code definition}, prints the parameters as the arguments of a
   * value definition, "f a b =", with the body on the next line; otherwise as
   * a lambda, "\a b -> body".
   */
  private <V> void lambdas(
      StringBuilder buf,
      int indent,
      Environment<V> env,
      Expression<V> e,
      boolean first,
      boolean definition) {
    if (e.op == Op.LAM) {
      final Pair<Environment<Scope.Var<Unit, V>>, Name.Local> pair =
          env.extend();
      if (definition || !first) {
        buf.append(' ');
      }
      buf.append(pair.right.name);
      final Expression.Lam<V> lam = (Expression.Lam<V>) e;
      lambdas(buf, indent, pair.left, lam.scope.fromScope(), false, definition);
    } else if (definition) {
      buf.append(" =");
      newline(buf, indent + indentWidth);
      expression(buf, indent + indentWidth, env, 0, e);
    } else {
      buf.append(" -> ");
      expression(buf, indent, env, LAM_PREC, e);
    }
  }

  /** Prints a literal. A negative number needs parentheses if it is an
   * argument, so that "f (-1)" does not become "f - 1". */
  @SuppressWarnings("rawtypes")
  private static void literal(
      StringBuilder buf, int prec, Op op, Comparable value) {
    switch (op) {
      case STRING_LITERAL:
      case STRING_LITERAL_PAT:
        buf.append('"').append(value).append('"');
        return;

      case INT_LITERAL:
      case INT_LITERAL_PAT:
      case FLOAT_LITERAL:
      case FLOAT_LITERAL_PAT:
        final String s = value.toString();
        if (prec > APP_PREC && s.startsWith("-")) {
          buf.append('(').append(s).append(')');
        } else {
          buf.append(s);
        }
        return;

      default:
        throw new AssertionError("not a literal: " + op);
    }
  }

  // patterns

  private <V> void pattern(
      StringBuilder buf,
      int indent,
      Environment<Scope.Var<Integer, V>> env,
      int prec,
      Pattern<Integer> p) {
    switch (p.op) {
      case VAR_PAT:
        final int i = ((Pattern.Var<Integer>) p).variable;
        buf.append(env.lookup(Scope.Var.<Integer, V>bound(i)).name);
        return;

      case WILDCARD_PAT:
        buf.append('_');
        return;

      case CON_PAT:
        final Pattern.Con<Integer> con = (Pattern.Con<Integer>) p;
        if (con.con.equals(ElmBuilder.TUPLE)) {
          final List<Printer> elements = new ArrayList<>();
          for (Pattern<Integer> arg : con.args) {
            elements.add(
                (buf2, indent2) -> pattern(buf2, indent2, env, 0, arg));
          }
          enclose(buf, "( ", " )", elements);
          return;
        }
        if (con.args.isEmpty()) {
          buf.append(qualified(con.con));
          return;
        }
        final boolean parens = prec > APP_PREC;
        if (parens) {
          buf.append('(');
        }
        buf.append(qualified(con.con));
        for (Pattern<Integer> arg : con.args) {
          buf.append(' ');
          pattern(buf, indent, env, APP_PREC + 1, arg);
        }
        if (parens) {
          buf.append(')');
        }
        return;

      case STRING_LITERAL_PAT:
      case INT_LITERAL_PAT:
      case FLOAT_LITERAL_PAT:
        literal(buf, prec, p.op, ((Pattern.Literal<Integer>) p).value);
        return;

      default:
        throw new AssertionError("unknown op " + p.op);
    }
  }

  // types

  private void type(StringBuilder buf, int indent, int prec, Type<Void> t) {
    switch (t.op) {
      case TY_VAR:
        throw new AssertionError("closed type has variable: " + t);

      case TY_GLOBAL:
        buf.append(qualified(((Type.Global<Void>) t).name));
        return;

      case TY_APP:
        final Type.App<Void> app = (Type.App<Void>) t;
        final boolean appParens = prec > APP_PREC;
        if (appParens) {
          buf.append('(');
        }
        type(buf, indent, APP_PREC, app.fn);
        buf.append(' ');
        type(buf, indent, APP_PREC + 1, app.arg);
        if (appParens) {
          buf.append(')');
        }
        return;

      case FUNCTION_TYPE:
        final Type.Fun<Void> fun = (Type.Fun<Void>) t;
        final boolean funParens = prec > FUN_PREC;
        if (funParens) {
          buf.append('(');
        }
        type(buf, indent, FUN_PREC + 1, fun.param);
        buf.append(" -> ");
        type(buf, indent, FUN_PREC, fun.result);
        if (funParens) {
          buf.append(')');
        }
        return;

      case RECORD_TYPE:
        final List<Printer> fields = new ArrayList<>();
        final Type.Record<Void> record = (Type.Record<Void>) t;
        for (Pair<Name.Field, Type<Void>> field : record.fields) {
          fields.add(
              (buf2, indent2) -> {
                buf2.append(field.left.name).append(" : ");
                type(buf2, indent2, 0, field.right);
              });
        }
        enclose(buf, "{ ", " }", fields);
        return;

      default:
        throw new AssertionError("unknown op " + t.op);
    }
  }

  // names

  /** Returns how a qualified name is printed: unqualified if Elm imports it
   * by default or it belongs to the module being printed, otherwise with its
   * module path. */
  String qualified(Name.Qualified name) {
    if (name.modules.equals(BASICS)) {
      return name.name;
    }
    final String s = DEFAULT_IMPORTS.get(name);
    if (s != null) {
      return s;
    }
    if (name.modules.isEmpty() || name.modules.equals(module)) {
      return name.name;
    }
    return name.toString();
  }

  // layout

  /**
   * Prints a sequence of elements between delimiters.
   *
   * <p>If every element fits on one line and the whole fits within the line
   * width, prints "{ a, b }"; otherwise prints one element per line, with
   * separators and the closing delimiter aligned with the opening one.
   */
  private void enclose(
      StringBuilder buf, String open, String close, List<Printer> elements) {
    if (elements.isEmpty()) {
      buf.append(open.trim()).append(close.trim());
      return;
    }
    final int column = column(buf);
    final int elementColumn = column + open.length();
    final List<String> strings = new ArrayList<>();
    boolean multiLine = false;
    int length = column + open.length() + close.length();
    for (Printer element : elements) {
      final String s = render(elementColumn, element);
      strings.add(s);
      multiLine |= s.indexOf('\n') >= 0;
      length += s.length();
    }
    length += ", ".length() * (strings.size() - 1);
    if (!multiLine && length <= lineWidth) {
      buf.append(open).append(Joiner.on(", ").join(strings)).append(close);
      return;
    }
    buf.append(open).append(strings.get(0));
    for (String s : skip(strings, 1)) {
      newline(buf, column);
      buf.append(", ").append(s);
    }
    newline(buf, column);
    buf.append(close.trim());
  }

  /** Prints an element starting at a given column, and returns the text. */
  private static String render(int column, Printer printer) {
    final StringBuilder buf = new StringBuilder();
    spaces(buf, column);
    printer.print(buf, column);
    return buf.substring(column);
  }

  /** Returns the column at which the next character will be printed. */
  private static int column(StringBuilder buf) {
    return buf.length() - (buf.lastIndexOf("\n") + 1);
  }

  private static void newline(StringBuilder buf, int indent) {
    buf.append('\n');
    spaces(buf, indent);
  }

  private static void spaces(StringBuilder buf, int n) {
    for (int i = 0; i < n; i++) {
      buf.append(' ');
    }
  }

  /** Decomposes a chain of applications "f a b c" into its head "f" and its
   * arguments "[a, b, c]". */
  static <V> Pair<Expression<V>, List<Expression<V>>> spine(Expression<V> e) {
    final List<Expression<V>> args = new ArrayList<>();
    while (e.op == Op.APP) {
      final Expression.App<V> app = (Expression.App<V>) e;
      args.add(app.arg);
      e = app.fn;
    }
    return Pair.of(e, ImmutableList.copyOf(Lists.reverse(args)));
  }

  /** Prints an element of a record, list or tuple. */
  private interface Printer {
    void print(StringBuilder buf, int indent);
  }
}

// End Pretty.java
