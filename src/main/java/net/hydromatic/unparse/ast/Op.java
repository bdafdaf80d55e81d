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
package net.hydromatic.unparse.ast;

import static com.google.common.base.Preconditions.checkArgument;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kinds of {@link PyNode}, operators, and the precedence contexts in which
 * nodes are written.
 *
 * <p>Each value with a precedence is given a level; its {@link #precedence}
 * is {@code level * 2 + 1}. Because adjacent levels are two apart, "one more
 * than the precedence of X" always sits strictly between X and the next
 * level. A value with no precedence never governs parentheses.
 */
public enum Op {
  // roots
  MODULE,
  INTERACTIVE,
  EXPRESSION,

  // statements
  FUNCTION_DEF,
  ASYNC_FUNCTION_DEF,
  CLASS_DEF,
  RETURN(5),
  DELETE,
  ASSIGN(1),
  AUG_ASSIGN(2),
  ANN_ASSIGN(2),
  FOR(4),
  ASYNC_FOR(4),
  WHILE(4),
  IF(4),
  WITH,
  ASYNC_WITH,
  RAISE(11),
  TRY,
  ASSERT(11),
  IMPORT,
  IMPORT_FROM,
  GLOBAL,
  NONLOCAL,
  EXPR(2),
  PASS,
  BREAK,
  CONTINUE,

  // legacy statements
  TRY_EXCEPT,
  TRY_FINALLY,

  // expressions
  BOOL_OP,
  NAMED_EXPR(11),
  BIN_OP,
  UNARY_OP,
  LAMBDA(13),
  IF_EXP(13),
  DICT,
  SET,
  LIST_COMP,
  SET_COMP,
  DICT_COMP,
  GENERATOR_EXP(0),
  AWAIT(28),
  YIELD(3),
  YIELD_FROM(3),
  COMPARE,
  CALL,
  FORMATTED_VALUE(9),
  JOINED_STR,
  CONSTANT(30),
  ATTRIBUTE,
  SUBSCRIPT(6),
  STARRED,
  NAME,
  LIST,
  TUPLE(9),
  SLICE(6),

  // legacy expressions
  NUM(29),
  STR,
  BYTES,
  NAME_CONSTANT,
  ELLIPSIS,
  INDEX(7),
  EXT_SLICE(8),

  // helpers
  ARGUMENTS,
  ARG,
  KEYWORD,
  ALIAS,
  WITH_ITEM,
  COMPREHENSION(14),
  EXCEPT_HANDLER,

  // contexts that are not node kinds
  /** Element of a comma-separated list. */
  COMMA(10),
  /** Sole argument of a call; a generator expression may share the call's
   * parentheses. */
  CALL_ONE_ARG(12),
  /** Right operand of {@code **}; binds looser than unary operators. */
  POW_RHS(25),
  /** Target of a {@code for} clause in a comprehension. */
  COMPREHENSION_TARGET(9),

  // boolean operators
  OR("or", 15),
  AND("and", 16),

  // unary operators
  NOT("not", 17),
  INVERT("~", 26),
  UADD("+", 26),
  USUB("-", 26),

  // comparison operators
  EQ("==", 18),
  NOT_EQ("!=", 18),
  LT("<", 18),
  LT_E("<=", 18),
  GT(">", 18),
  GT_E(">=", 18),
  IS("is", 18),
  IS_NOT("is not", 18),
  IN("in", 18),
  NOT_IN("not in", 18),

  // binary operators
  BIT_OR("|", 19),
  BIT_XOR("^", 20),
  BIT_AND("&", 21),
  L_SHIFT("<<", 22),
  R_SHIFT(">>", 22),
  ADD("+", 23),
  SUB("-", 23),
  MULT("*", 24),
  MAT_MULT("@", 24),
  DIV("/", 24),
  MOD("%", 24),
  FLOOR_DIV("//", 24),
  POW("**", 27);

  /** Precedence of a node that is not in any context; such a node keeps its
   * delimiters unless it is atomic. */
  public static final int HIGHEST = 31 * 2 + 1;

  /** Precedence value for values that have none. */
  public static final int NONE = -1;

  /** Operator symbol, e.g. "not in"; null if this is not an operator. */
  public final @Nullable String symbol;

  /** Symbol padded with spaces, e.g. " not in "; null if not an operator. */
  public final @Nullable String padded;

  /** Precedence; higher binds tighter; {@link #NONE} if not applicable. */
  public final int precedence;

  Op() {
    this(null, -1);
  }

  Op(int level) {
    this(null, level);
  }

  Op(@Nullable String symbol, int level) {
    this.symbol = symbol;
    this.padded = symbol == null ? null : " " + symbol + " ";
    this.precedence = level < 0 ? NONE : level * 2 + 1;
  }

  /** Returns whether this operator is spelled as a word, such as "not",
   * and therefore needs a space before its operand. */
  public boolean isAlpha() {
    return symbol != null && Character.isLetter(symbol.charAt(0));
  }

  /** Returns the precedence, throwing if this value has none. */
  public int precedence() {
    checkArgument(precedence != NONE, "%s has no precedence", this);
    return precedence;
  }
}

// End Op.java
