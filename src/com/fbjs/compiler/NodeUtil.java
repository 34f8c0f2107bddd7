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

package com.fbjs.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.fbjs.ast.Node;
import com.fbjs.ast.Token;
import com.fbjs.base.Tri;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /**
   * Gets the boolean value of a node that represents an expression, or {@code Tri.UNKNOWN} if no
   * such value can be determined by static analysis.
   *
   * <p>Only side-effect-free literals (and parentheses around them) report a known value. The
   * reducer relies on this: an operand with a known value is dropped without being evaluated, so
   * any kind added here must not have side effects.
   */
  public static Tri getPureBooleanValue(Node n) {
    switch (n.getToken()) {
      case NUMBER:
        {
          double value = n.getDouble();
          return Tri.forBoolean(value != 0 && !Double.isNaN(value));
        }

      case TRUE:
        return Tri.TRUE;

      case FALSE:
      case NULL:
        return Tri.FALSE;

      case STRING:
        {
          String value = n.getUnquotedString();
          if (value.isEmpty()) {
            return Tri.FALSE;
          }
          // An escape sequence may stand for nothing at all, such as a line continuation.
          return value.indexOf('\\') < 0 ? Tri.TRUE : Tri.UNKNOWN;
        }

      case PAREN:
        return getPureBooleanValue(n.getFirstChild());

      default:
        return Tri.UNKNOWN;
    }
  }

  /** Whether {@code n} is a body that does nothing: an empty statement list or EMPTY. */
  public static boolean isEmptyBlock(Node n) {
    return (n.isStatementList() && !n.hasChildren()) || n.isEmpty();
  }

  /** Whether {@code n} is a call of the global function {@code name}. */
  static boolean isCallTo(Node n, String name) {
    if (!n.isCall()) {
      return false;
    }
    Node callee = n.getFirstChild();
    return callee.isName() && callee.getString().equals(name);
  }

  /** Whether {@code n} is a direct call to {@code eval}. */
  public static boolean isEvalCall(Node n) {
    return isCallTo(n, "eval");
  }

  /**
   * Converts an operator's token value (see {@link Token}) to a string representation.
   *
   * @param operator the operator's token value to convert
   * @return the string representation or {@code null} if the token value is not an operator
   */
  public static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case COMMA:
        return ",";
      case BITOR:
        return "|";
      case OR:
        return "||";
      case BITXOR:
        return "^";
      case AND:
        return "&&";
      case BITAND:
        return "&";
      case SHEQ:
        return "===";
      case EQ:
        return "==";
      case NOT:
        return "!";
      case NE:
        return "!=";
      case SHNE:
        return "!==";
      case LSH:
        return "<<";
      case IN:
        return "in";
      case LE:
        return "<=";
      case LT:
        return "<";
      case URSH:
        return ">>>";
      case RSH:
        return ">>";
      case GE:
        return ">=";
      case GT:
        return ">";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case BITNOT:
        return "~";
      case ADD:
      case POS:
        return "+";
      case SUB:
      case NEG:
        return "-";
      case INC:
        return "++";
      case DEC:
        return "--";
      case ASSIGN:
        return "=";
      case ASSIGN_BITOR:
        return "|=";
      case ASSIGN_BITXOR:
        return "^=";
      case ASSIGN_BITAND:
        return "&=";
      case ASSIGN_LSH:
        return "<<=";
      case ASSIGN_RSH:
        return ">>=";
      case ASSIGN_URSH:
        return ">>>=";
      case ASSIGN_ADD:
        return "+=";
      case ASSIGN_SUB:
        return "-=";
      case ASSIGN_MUL:
        return "*=";
      case ASSIGN_DIV:
        return "/=";
      case ASSIGN_MOD:
        return "%=";
      case DELPROP:
        return "delete";
      case VOID:
        return "void";
      case TYPEOF:
        return "typeof";
      case INSTANCEOF:
        return "instanceof";
      default:
        return null;
    }
  }

  /**
   * Converts an operator's token value (see {@link Token}) to a string representation or fails.
   *
   * @throws IllegalArgumentException if the token value is not an operator
   */
  static String opToStrNoFail(Token operator) {
    String res = opToStr(operator);
    checkArgument(res != null, "Unknown op %s", operator);
    return res;
  }
}
