/*
 * Copyright 2009 The FBJS Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.fbjs.ast;

/**
 * The closed set of node kinds. Operators get one token each so that the operator is part of the
 * node's kind.
 */
public enum Token {
  PROGRAM,
  STATEMENT_LIST,

  // Literals
  NUMBER,
  STRING,
  REGEXP,
  TRUE,
  FALSE,
  NULL,
  THIS,
  EMPTY,

  // Binary operators
  COMMA, // ,
  OR, // ||
  AND, // &&
  BITOR, // |
  BITXOR, // ^
  BITAND, // &
  EQ, // ==
  NE, // !=
  SHEQ, // ===
  SHNE, // !==
  LT, // <
  LE, // <=
  GT, // >
  GE, // >=
  IN,
  INSTANCEOF,
  LSH, // <<
  RSH, // >>
  URSH, // >>>
  ADD, // +
  SUB, // -
  MUL, // *
  DIV, // /
  MOD, // %

  HOOK, // conditional (?:)
  PAREN, // explicit parentheses

  // Assignments
  ASSIGN, // =
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  ASSIGN_MOD, // %=
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_LSH, // <<=
  ASSIGN_RSH, // >>=
  ASSIGN_URSH, // >>>=
  ASSIGN_BITAND, // &=
  ASSIGN_BITXOR, // ^=
  ASSIGN_BITOR, // |=

  // Unary operators. INC and DEC are postfix when the node has INCRDECR set.
  DELPROP, // delete
  VOID,
  TYPEOF,
  INC, // ++
  DEC, // --
  POS, // +
  NEG, // -
  BITNOT, // ~
  NOT, // !

  NAME,
  ARG_LIST,
  FUNCTION, // declaration
  FUNCTION_EXPR,
  CALL,
  NEW,

  // Statements
  IF,
  WITH,
  TRY,
  RETURN,
  THROW,
  BREAK,
  CONTINUE,
  LABEL,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  VAR,
  FOR,
  FOR_IN,
  WHILE,
  DO,

  OBJECTLIT,
  OBJECT_PROPERTY,
  ARRAYLIT,
  GETPROP, // foo.bar
  GETELEM, // foo['bar']

  // Placeholder for an optional slot that is not present.
  ABSENT;

  /** Whether this token is a binary operator, including the comma operator. */
  public boolean isBinaryOperator() {
    return compareTo(COMMA) >= 0 && compareTo(MOD) <= 0;
  }

  /** Whether this token is a simple or compound assignment. */
  public boolean isAssignment() {
    return compareTo(ASSIGN) >= 0 && compareTo(ASSIGN_BITOR) <= 0;
  }

  /** Whether this token is a prefix operator, or INC/DEC in either position. */
  public boolean isUnaryOperator() {
    return compareTo(DELPROP) >= 0 && compareTo(NOT) <= 0;
  }

  /**
   * Whether nodes of this kind are expressions. An expression used as a statement is terminated
   * with a semicolon.
   */
  public boolean isExpression() {
    if (isBinaryOperator() || isAssignment() || isUnaryOperator()) {
      return true;
    }
    switch (this) {
      case NUMBER:
      case STRING:
      case REGEXP:
      case TRUE:
      case FALSE:
      case NULL:
      case THIS:
      case EMPTY:
      case HOOK:
      case PAREN:
      case NAME:
      case FUNCTION_EXPR:
      case CALL:
      case NEW:
      case OBJECTLIT:
      case ARRAYLIT:
      case GETPROP:
      case GETELEM:
        return true;
      default:
        return false;
    }
  }
}
