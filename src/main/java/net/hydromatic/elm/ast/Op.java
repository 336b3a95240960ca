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

/** Sub-types of {@link Expression}, {@link Pattern}, {@link Type} and
 * {@link Definition}. */
public enum Op {
  // expressions
  VAR("Var"),
  GLOBAL("Global"),
  APP("App"),
  LET("Let"),
  LAM("Lam"),
  RECORD("Record"),
  PROJ("Proj"),
  CASE("Case"),
  LIST("List"),
  STRING_LITERAL("String"),
  INT_LITERAL("Int"),
  FLOAT_LITERAL("Float"),

  // patterns
  VAR_PAT("Var"),
  WILDCARD_PAT("Wildcard"),
  CON_PAT("Con"),
  STRING_LITERAL_PAT("String"),
  INT_LITERAL_PAT("Int"),
  FLOAT_LITERAL_PAT("Float"),

  // types
  TY_VAR("Var"),
  TY_GLOBAL("Global"),
  TY_APP("App"),
  FUNCTION_TYPE("Fun"),
  RECORD_TYPE("Record"),

  // definitions
  CONSTANT_DEF("Constant"),
  TYPE_DEF("Type"),
  ALIAS_DEF("Alias");

  /** Name of the constructor in the debug form of a node, e.g. "App". */
  public final String debugName;

  Op(String debugName) {
    this.debugName = debugName;
  }
}

// End Op.java
