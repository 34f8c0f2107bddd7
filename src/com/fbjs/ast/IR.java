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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/**
 * An AST construction helper class. Every factory builds a node of one kind with the slots that
 * kind requires, filling optional slots with {@link #absent()}.
 */
public class IR {

  private IR() {}

  public static Node program(Node statements) {
    checkState(statements.isStatementList(), statements);
    return new Node(Token.PROGRAM, statements).setLineno(1);
  }

  public static Node statementList() {
    return new Node(Token.STATEMENT_LIST);
  }

  public static Node statementList(Node... stmts) {
    Node block = statementList();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Statement list cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node statementList(List<Node> stmts) {
    return statementList(stmts.toArray(new Node[0]));
  }

  // Literals

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  /** A synthesized string literal; the renderer adds the double quotes. */
  public static Node string(String s) {
    return Node.newString(Token.STRING, s);
  }

  /**
   * A string literal as it appeared in the source, {@code quoted} including its quote
   * characters.
   */
  public static Node quotedString(String quoted) {
    checkArgument(quoted.length() >= 2, "not a quoted string: %s", quoted);
    char q = quoted.charAt(0);
    checkArgument((q == '"' || q == '\'') && quoted.charAt(quoted.length() - 1) == q, quoted);
    Node n = Node.newString(Token.STRING, quoted);
    n.putBooleanProp(Node.QUOTED_PROP, true);
    return n;
  }

  public static Node regexp(String pattern, String flags) {
    return Node.newRegExp(pattern, flags);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node booleanNode(boolean value) {
    return value ? trueNode() : falseNode();
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  /** Placeholder for an optional slot that is not present. */
  public static Node absent() {
    return new Node(Token.ABSENT);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  // Operators

  public static Node binaryOp(Token op, Node left, Node right) {
    checkArgument(op.isBinaryOperator(), op);
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(op, left, right);
  }

  public static Node or(Node left, Node right) {
    return binaryOp(Token.OR, left, right);
  }

  public static Node and(Node left, Node right) {
    return binaryOp(Token.AND, left, right);
  }

  public static Node comma(Node left, Node right) {
    return binaryOp(Token.COMMA, left, right);
  }

  public static Node hook(Node test, Node then, Node elseNode) {
    checkState(mayBeExpression(test));
    checkState(mayBeExpression(then));
    checkState(mayBeExpression(elseNode));
    return new Node(Token.HOOK, test, then, elseNode);
  }

  public static Node paren(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.PAREN, expr);
  }

  public static Node assign(Node target, Node value) {
    return assign(Token.ASSIGN, target, value);
  }

  public static Node assign(Token op, Node target, Node value) {
    checkArgument(op.isAssignment(), op);
    checkState(target.isValidAssignmentTarget(), target);
    checkState(mayBeExpression(value), value);
    return new Node(op, target, value);
  }

  public static Node unaryOp(Token op, Node operand) {
    checkArgument(op.isUnaryOperator(), op);
    checkState(mayBeExpression(operand), operand);
    return new Node(op, operand);
  }

  public static Node not(Node operand) {
    return unaryOp(Token.NOT, operand);
  }

  /** A postfix {@code x++} or {@code x--}. */
  public static Node postfix(Token op, Node operand) {
    checkArgument(op == Token.INC || op == Token.DEC, op);
    Node n = unaryOp(op, operand);
    n.putBooleanProp(Node.INCRDECR_PROP, true);
    return n;
  }

  // Functions and calls

  public static Node argList(Node... args) {
    Node argList = new Node(Token.ARG_LIST);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isAbsent(), arg);
      argList.addChildToBack(arg);
    }
    return argList;
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.getToken() == Token.ARG_LIST);
    checkState(body.isStatementList());
    return new Node(Token.FUNCTION, name, params, body);
  }

  /** A function expression; {@code name} may be {@link #absent()}. */
  public static Node functionExpr(Node name, Node params, Node body) {
    checkState(name.isName() || name.isAbsent());
    checkState(params.getToken() == Token.ARG_LIST);
    checkState(body.isStatementList());
    return new Node(Token.FUNCTION_EXPR, name, params, body);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    return new Node(Token.CALL, target, argList(args));
  }

  public static Node newNode(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    return new Node(Token.NEW, target, argList(args));
  }

  // Statements

  public static Node ifNode(Node cond, Node then) {
    return ifNode(cond, then, absent());
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeStatement(then), then);
    checkState(mayBeStatement(elseNode) || elseNode.isAbsent(), elseNode);
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node with(Node object, Node body) {
    checkState(mayBeExpression(object), object);
    checkState(mayBeStatement(body), body);
    return new Node(Token.WITH, object, body);
  }

  public static Node tryCatch(Node tryBody, Node catchName, Node catchBody) {
    return tryNode(tryBody, catchName, catchBody, absent());
  }

  public static Node tryFinally(Node tryBody, Node finallyBody) {
    return tryNode(tryBody, absent(), absent(), finallyBody);
  }

  /**
   * A try statement. The catch name and catch body are both present or both {@link #absent()}.
   */
  public static Node tryNode(Node tryBody, Node catchName, Node catchBody, Node finallyBody) {
    checkState(tryBody.isStatementList(), tryBody);
    checkState(catchName.isAbsent() == catchBody.isAbsent(), "incomplete catch clause");
    checkState(catchName.isName() || catchName.isAbsent(), catchName);
    checkState(catchBody.isStatementList() || catchBody.isAbsent(), catchBody);
    checkState(finallyBody.isStatementList() || finallyBody.isAbsent(), finallyBody);
    checkState(!catchBody.isAbsent() || !finallyBody.isAbsent(), "try without catch or finally");
    Node n = new Node(Token.TRY, tryBody, catchName, catchBody);
    n.addChildToBack(finallyBody);
    return n;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN, absent());
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.THROW, expr);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK, absent());
  }

  public static Node breakNode(Node label) {
    checkState(label.isName(), label);
    return new Node(Token.BREAK, label);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE, absent());
  }

  public static Node continueNode(Node label) {
    checkState(label.isName(), label);
    return new Node(Token.CONTINUE, label);
  }

  public static Node label(Node name, Node stmt) {
    checkState(name.isName(), name);
    checkState(mayBeStatement(stmt), stmt);
    return new Node(Token.LABEL, name, stmt);
  }

  /** A switch statement; {@code body} holds the clauses followed by their statements. */
  public static Node switchNode(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(body.isStatementList(), body);
    return new Node(Token.SWITCH, cond, body);
  }

  public static Node caseNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.CASE, expr);
  }

  public static Node defaultCase() {
    return new Node(Token.DEFAULT_CASE);
  }

  /** A var declaration of names or {@code name = value} assignments. */
  public static Node var(Node... declarations) {
    checkArgument(declarations.length > 0, "empty var declaration");
    Node var = new Node(Token.VAR);
    for (Node decl : declarations) {
      checkState(
          decl.isName() || (decl.getToken() == Token.ASSIGN && decl.getFirstChild().isName()),
          decl);
      var.addChildToBack(decl);
    }
    return var;
  }

  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(mayBeExpression(init) || init.isVar(), init);
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeExpression(incr), incr);
    checkState(mayBeStatement(body), body);
    Node n = new Node(Token.FOR, init, cond, incr);
    n.addChildToBack(body);
    return n;
  }

  public static Node forIn(Node target, Node object, Node body) {
    checkState(target.isVar() || target.isValidAssignmentTarget(), target);
    checkState(mayBeExpression(object), object);
    checkState(mayBeStatement(body), body);
    if (target.isVar()) {
      target.setForIterator(true);
    }
    return new Node(Token.FOR_IN, target, object, body);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeStatement(body), body);
    return new Node(Token.WHILE, cond, body);
  }

  public static Node doNode(Node body, Node cond) {
    checkState(mayBeStatement(body), body);
    checkState(mayBeExpression(cond), cond);
    return new Node(Token.DO, body, cond);
  }

  // Object and array literals, member access

  public static Node objectlit(Node... properties) {
    Node obj = new Node(Token.OBJECTLIT);
    for (Node prop : properties) {
      checkState(prop.isObjectProperty(), prop);
      obj.addChildToBack(prop);
    }
    return obj;
  }

  public static Node property(Node key, Node value) {
    checkState(key.isName() || key.isString() || key.isNumber(), key);
    checkState(mayBeExpression(value), value);
    return new Node(Token.OBJECT_PROPERTY, key, value);
  }

  /** An array literal; {@link #absent()} elements are elisions. */
  public static Node arraylit(Node... elements) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node element : elements) {
      checkState(mayBeExpression(element) || element.isAbsent(), element);
      arraylit.addChildToBack(element);
    }
    return arraylit;
  }

  public static Node getprop(Node target, String name) {
    return getprop(target, name(name));
  }

  public static Node getprop(Node target, Node name) {
    checkState(mayBeExpression(target), target);
    checkState(name.isName(), name);
    return new Node(Token.GETPROP, target, name);
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(elem), elem);
    return new Node(Token.GETELEM, target, elem);
  }

  /** It isn't possible to always determine if a detached node is an expression. */
  static boolean mayBeExpression(Node n) {
    return n.getToken().isExpression();
  }

  static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case STATEMENT_LIST:
      case FUNCTION:
      case IF:
      case WITH:
      case TRY:
      case RETURN:
      case THROW:
      case BREAK:
      case CONTINUE:
      case LABEL:
      case SWITCH:
      case CASE:
      case DEFAULT_CASE:
      case VAR:
      case FOR:
      case FOR_IN:
      case WHILE:
      case DO:
        return true;
      default:
        return mayBeExpression(n);
    }
  }
}
