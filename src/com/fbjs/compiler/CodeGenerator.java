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

import static com.google.common.base.Preconditions.checkState;

import com.fbjs.ast.Node;
import com.fbjs.ast.Token;
import com.google.common.base.Strings;

/**
 * CodeGenerator generates code from a parse tree, sending it to the specified CodeConsumer.
 *
 * <p>Rendering goes through four entry points that call each other: {@link #add(Node, int)} emits
 * the node itself, {@link #addStatement} adds the terminating semicolon where the node needs one,
 * {@link #addBlock} emits a body with or without braces, and {@link #addIndentedStatement} starts
 * a statement on its own line.
 */
public class CodeGenerator {
  private static final String INDENT = "  ";

  private final CodeConsumer cc;
  private final RenderContext context;

  CodeGenerator(CodeConsumer consumer, RenderContext context) {
    this.cc = consumer;
    this.context = context;
  }

  protected void add(String str) {
    cc.add(str);
  }

  protected void add(Node n) {
    add(n, 0);
  }

  /** Emits the text of {@code n} without a statement terminator. */
  protected void add(Node n, int indent) {
    Token type = n.getToken();
    Node first = n.getFirstChild();
    Node last = n.getLastChild();

    if (type.isBinaryOperator()) {
      checkState(
          n.hasXChildren(2),
          "Bad binary operator \"%s\": expected 2 arguments but got %s",
          type,
          n.getChildCount());
      add(first, indent);
      addBinaryOp(type);
      add(last, indent);
      return;
    }

    if (type.isAssignment()) {
      checkState(n.hasXChildren(2), n);
      add(first, indent);
      add(context.pretty ? " " + NodeUtil.opToStrNoFail(type) + " " : NodeUtil.opToStrNoFail(type));
      add(last, indent);
      return;
    }

    if (type.isUnaryOperator()) {
      checkState(n.hasOneChild(), n);
      if (n.isPostfix()) {
        add(first, indent);
        add(NodeUtil.opToStrNoFail(type));
      } else {
        add(NodeUtil.opToStrNoFail(type));
        if (isWordOperator(type) && !first.isParen()) {
          add(" ");
        }
        add(first, indent);
      }
      return;
    }

    switch (type) {
      case PROGRAM:
        checkState(n.hasOneChild(), n);
        add(first, indent);
        break;

      case STATEMENT_LIST:
        for (Node c = first; c != null; c = c.getNext()) {
          if (!c.isAbsent()) {
            addIndentedStatement(c, indent);
          }
        }
        break;

      case NUMBER:
        cc.addNumber(n.getDouble());
        break;

      case STRING:
        if (n.getBooleanProp(Node.QUOTED_PROP)) {
          add(n.getString());
        } else {
          add("\"" + n.getString() + "\"");
        }
        break;

      case REGEXP:
        add("/" + n.getString() + "/" + n.getRegExpFlags());
        break;

      case TRUE:
        add("true");
        break;

      case FALSE:
        add("false");
        break;

      case NULL:
        add("null");
        break;

      case THIS:
        add("this");
        break;

      case EMPTY:
      case ABSENT:
        break;

      case NAME:
        add(n.getString());
        break;

      case HOOK:
        checkState(n.hasXChildren(3), n);
        add(first, indent);
        add(context.pretty ? " ? " : "?");
        add(first.getNext(), indent);
        add(context.pretty ? " : " : ":");
        add(last, indent);
        break;

      case PAREN:
        checkState(n.hasOneChild(), n);
        add("(");
        add(first, indent);
        add(")");
        break;

      case ARG_LIST:
        add("(");
        addList(n, indent);
        add(")");
        break;

      case FUNCTION:
        checkState(n.hasXChildren(3), n);
        add("function ");
        add(first, indent);
        add(first.getNext(), indent);
        addBlock(last, true, indent);
        break;

      case FUNCTION_EXPR:
        checkState(n.hasXChildren(3), n);
        add("function");
        if (!first.isAbsent()) {
          add(" ");
          add(first, indent);
        }
        add(first.getNext(), indent);
        addBlock(last, true, indent);
        break;

      case CALL:
        checkState(n.hasXChildren(2), n);
        add(first, indent);
        add(last, indent);
        break;

      case NEW:
        checkState(n.hasXChildren(2), n);
        add("new ");
        add(first, indent);
        add(last, indent);
        break;

      case IF:
        checkState(n.hasXChildren(3), n);
        addIf(n, indent);
        break;

      case WITH:
        checkState(n.hasXChildren(2), n);
        add(context.pretty ? "with (" : "with(");
        add(first, indent);
        add(")");
        addBlock(last, false, indent);
        break;

      case TRY:
        {
          checkState(n.hasXChildren(4), n);
          Node catchName = first.getNext();
          Node catchBody = catchName.getNext();
          add("try");
          addBlock(first, true, indent);
          if (!catchName.isAbsent()) {
            add(context.pretty ? " catch (" : "catch(");
            add(catchName, indent);
            add(")");
            addBlock(catchBody, true, indent);
          }
          if (!last.isAbsent()) {
            add(context.pretty ? " finally" : "finally");
            addBlock(last, true, indent);
          }
          break;
        }

      case RETURN:
      case THROW:
      case BREAK:
      case CONTINUE:
        checkState(n.hasOneChild(), n);
        add(keywordOf(type));
        if (!first.isAbsent()) {
          add(" ");
          add(first, indent);
        }
        break;

      case LABEL:
        checkState(n.hasXChildren(2), n);
        add(first, indent);
        add(context.pretty ? ": " : ":");
        if (last.isStatementList()) {
          // Without braces the label would only cover the first statement.
          addBlock(last, true, indent);
        } else {
          add(last, indent);
        }
        break;

      case SWITCH:
        checkState(n.hasXChildren(2), n);
        add(context.pretty ? "switch (" : "switch(");
        add(first, indent);
        add(")");
        // Clauses render one level shallower than the statements they head.
        addBracedBlock(last, indent + 1, indent);
        break;

      case CASE:
        checkState(n.hasOneChild(), n);
        add("case ");
        add(first, indent);
        add(":");
        break;

      case DEFAULT_CASE:
        add("default:");
        break;

      case VAR:
        add("var ");
        addList(n, indent);
        break;

      case OBJECTLIT:
        add("{");
        addList(n, indent);
        add("}");
        break;

      case OBJECT_PROPERTY:
        checkState(n.hasXChildren(2), n);
        add(first, indent);
        add(context.pretty ? ": " : ":");
        add(last, indent);
        break;

      case ARRAYLIT:
        add("[");
        addList(n, indent);
        add("]");
        break;

      case GETPROP:
        {
          checkState(n.hasXChildren(2), n);
          // 1.toString is a syntax error.
          boolean needsParens = first.isNumber();
          if (needsParens) {
            add("(");
          }
          add(first, indent);
          if (needsParens) {
            add(")");
          }
          add(".");
          add(last, indent);
          break;
        }

      case GETELEM:
        checkState(n.hasXChildren(2), n);
        add(first, indent);
        add("[");
        add(last, indent);
        add("]");
        break;

      case FOR:
        {
          checkState(n.hasXChildren(4), n);
          Node cond = first.getNext();
          Node incr = cond.getNext();
          add(context.pretty ? "for (" : "for(");
          add(first, indent);
          add(context.pretty ? "; " : ";");
          add(cond, indent);
          add(context.pretty ? "; " : ";");
          add(incr, indent);
          add(")");
          addBlock(last, false, indent);
          break;
        }

      case FOR_IN:
        checkState(n.hasXChildren(3), n);
        add(context.pretty ? "for (" : "for(");
        add(first, indent);
        add(" in ");
        add(first.getNext(), indent);
        add(")");
        addBlock(last, false, indent);
        break;

      case WHILE:
        checkState(n.hasXChildren(2), n);
        add(context.pretty ? "while (" : "while(");
        add(first, indent);
        add(")");
        addBlock(last, false, indent);
        break;

      case DO:
        checkState(n.hasXChildren(2), n);
        add("do");
        addBlock(first, true, indent);
        if (context.preserveLineNumbers) {
          catchup(last);
        }
        add(context.pretty ? " while (" : "while(");
        add(last, indent);
        add(")");
        break;

      default:
        throw new IllegalStateException("Unknown token " + type + "\n" + n.toStringTree());
    }
  }

  /** Emits {@code n} as a statement, with its semicolon if it takes one. */
  protected void addStatement(Node n, int indent) {
    add(n, indent);
    if (needsSemicolon(n.getToken())) {
      add(";");
    }
  }

  /**
   * Emits {@code n} as the body of a compound statement. Braces are left out for a single
   * statement in compact mode unless {@code mustBrace} is set.
   */
  protected void addBlock(Node n, boolean mustBrace, int indent) {
    switch (n.getToken()) {
      case EMPTY:
        add(";");
        return;

      case STATEMENT_LIST:
        if (!mustBrace && !n.hasChildren()) {
          add(";");
        } else if (!mustBrace && !context.pretty && n.hasOneChild()) {
          if (context.preserveLineNumbers) {
            catchup(n);
          }
          addBlock(n.getFirstChild(), false, indent);
        } else {
          addBracedBlock(n, indent, indent);
        }
        return;

      default:
        if (!mustBrace && !context.pretty) {
          if (context.preserveLineNumbers) {
            catchup(n);
          }
          addStatement(n, indent);
        } else {
          addBracedBlock(n, indent, indent);
        }
    }
  }

  /** Emits {@code n} on a new line (pretty mode) or on its source line (line preservation). */
  protected void addIndentedStatement(Node n, int indent) {
    switch (n.getToken()) {
      case STATEMENT_LIST:
        add(n, indent);
        return;

      case CASE:
      case DEFAULT_CASE:
        startStatement(n, indent - 1);
        addStatement(n, indent - 1);
        return;

      default:
        startStatement(n, indent);
        addStatement(n, indent);
    }
  }

  private void startStatement(Node n, int indent) {
    if (!context.pretty && !context.preserveLineNumbers) {
      return;
    }
    boolean newline;
    if (context.preserveLineNumbers) {
      newline = catchup(n);
    } else {
      newline = context.startOutput();
      if (newline) {
        cc.append("\n");
      }
    }
    if (context.pretty && newline) {
      addIndent(indent);
    }
  }

  /**
   * Emits "{", the contents at one level below {@code indent} and the closing "}" at {@code
   * closeIndent}.
   */
  private void addBracedBlock(Node n, int indent, int closeIndent) {
    add(context.pretty ? " {" : "{");
    addIndentedStatement(n, indent + 1);
    if (context.pretty || context.preserveLineNumbers) {
      boolean newline;
      if (context.preserveLineNumbers) {
        newline = catchup(n);
      } else {
        cc.append("\n");
        newline = true;
      }
      if (context.pretty && newline) {
        addIndent(closeIndent);
      }
    }
    add("}");
  }

  private void addIf(Node n, int indent) {
    Node cond = n.getFirstChild();
    Node thenBlock = cond.getNext();
    Node elseBlock = n.getLastChild();

    add(context.pretty ? "if (" : "if(");
    add(cond, indent);
    add(")");

    // The braces keep a following else from binding to a nested if.
    boolean needBraces =
        context.pretty
            || (thenBlock.isStatementList() && !thenBlock.hasChildren())
            || !elseBlock.isAbsent();
    addBlock(thenBlock, needBraces, indent);

    if (elseBlock.isAbsent()) {
      return;
    }
    add(context.pretty ? " else" : "else");
    if (elseBlock.isIf()) {
      if (context.preserveLineNumbers) {
        catchup(elseBlock);
      }
      add(" ");
      add(elseBlock, indent);
    } else {
      CodePrinter.RopeCodePrinter block = new CodePrinter.RopeCodePrinter();
      new CodeGenerator(block, context).addBlock(elseBlock, false, indent);
      char firstChar = block.getFirstChar();
      if (firstChar != '{' && firstChar != ' ') {
        add(" ");
      }
      for (String fragment : block.getFragments()) {
        cc.append(fragment);
      }
    }
  }

  private void addBinaryOp(Token op) {
    if (context.pretty) {
      if (op != Token.COMMA) {
        add(" ");
      }
      add(NodeUtil.opToStrNoFail(op));
      add(" ");
    } else if (op == Token.IN || op == Token.INSTANCEOF) {
      add(" " + NodeUtil.opToStrNoFail(op) + " ");
    } else {
      add(NodeUtil.opToStrNoFail(op));
    }
  }

  /** Emits the children separated by commas. Absent children leave an empty slot. */
  private void addList(Node n, int indent) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (c != n.getFirstChild()) {
        add(context.pretty ? ", " : ",");
      }
      if (!c.isAbsent()) {
        add(c, indent);
      }
    }
  }

  /** Pads the output to the source line of {@code n}. Returns whether anything was emitted. */
  private boolean catchup(Node n) {
    int newlines = context.advanceTo(n.getLineno());
    if (newlines == 0) {
      return false;
    }
    cc.append(Strings.repeat("\n", newlines));
    return true;
  }

  private void addIndent(int indent) {
    if (indent > 0) {
      cc.append(Strings.repeat(INDENT, indent));
    }
  }

  private static boolean isWordOperator(Token type) {
    return type == Token.DELPROP || type == Token.VOID || type == Token.TYPEOF;
  }

  private static boolean needsSemicolon(Token type) {
    switch (type) {
      case VAR:
      case RETURN:
      case THROW:
      case BREAK:
      case CONTINUE:
      case DO:
      case LABEL:
        return true;
      default:
        return type.isExpression();
    }
  }

  private static String keywordOf(Token type) {
    switch (type) {
      case RETURN:
        return "return";
      case THROW:
        return "throw";
      case BREAK:
        return "break";
      case CONTINUE:
        return "continue";
      default:
        throw new IllegalArgumentException("Not a jump statement: " + type);
    }
  }
}
