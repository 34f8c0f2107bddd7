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

import static com.google.common.truth.Truth.assertThat;

import com.fbjs.ast.IR;
import com.fbjs.ast.Node;
import com.fbjs.ast.Token;
import com.fbjs.compiler.CodePrinter.RenderOption;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {
  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private static Node program(Node... statements) {
    return IR.program(IR.statementList(statements));
  }

  private static Node call(String name, Node... args) {
    return IR.call(IR.name(name), args);
  }

  private static Node name(String name) {
    return IR.name(name);
  }

  private static void assertPrint(Node statement, String expected) {
    assertThat(CodePrinter.toSource(program(statement))).isEqualTo(expected);
  }

  private static void assertPrettyPrint(Node statement, String expected) {
    assertThat(CodePrinter.toSource(program(statement), RenderOption.PRETTY)).isEqualTo(expected);
  }

  @Test
  public void testAssignment() {
    assertPrint(IR.assign(name("a"), IR.number(1)), "a=1;");
    assertPrettyPrint(IR.assign(name("a"), IR.number(1)), "a = 1;");
    assertPrint(IR.assign(Token.ASSIGN_URSH, name("a"), IR.number(2)), "a>>>=2;");
    assertPrettyPrint(IR.assign(Token.ASSIGN_ADD, name("a"), name("b")), "a += b;");
  }

  @Test
  public void testBinaryOperators() {
    Node expr =
        IR.binaryOp(Token.ADD, name("a"), IR.binaryOp(Token.MUL, name("b"), name("c")));
    assertPrint(expr.cloneTree(), "a+b*c;");
    assertPrettyPrint(expr, "a + b * c;");

    assertPrint(IR.binaryOp(Token.SHNE, name("a"), IR.nullNode()), "a!==null;");
    assertPrint(IR.or(name("a"), IR.and(name("b"), name("c"))), "a||b&&c;");
  }

  @Test
  public void testCommaSpacing() {
    assertPrint(IR.comma(name("a"), name("b")), "a,b;");
    assertPrettyPrint(IR.comma(name("a"), name("b")), "a, b;");
  }

  @Test
  public void testWordOperatorsArePadded() {
    assertPrint(IR.binaryOp(Token.IN, IR.string("x"), name("o")), "\"x\" in o;");
    assertPrint(IR.binaryOp(Token.INSTANCEOF, name("a"), name("B")), "a instanceof B;");
    assertPrettyPrint(IR.binaryOp(Token.IN, name("k"), name("o")), "k in o;");
  }

  @Test
  public void testUnaryOperators() {
    assertPrint(IR.not(name("x")), "!x;");
    assertPrint(IR.unaryOp(Token.NEG, name("x")), "-x;");
    assertPrint(IR.unaryOp(Token.BITNOT, name("x")), "~x;");
    assertPrint(IR.unaryOp(Token.INC, name("i")), "++i;");
    assertPrint(IR.postfix(Token.INC, name("i")), "i++;");
    assertPrint(IR.postfix(Token.DEC, name("i")), "i--;");
  }

  @Test
  public void testWordUnaryOperatorSpacing() {
    assertPrint(IR.unaryOp(Token.TYPEOF, name("x")), "typeof x;");
    assertPrint(IR.unaryOp(Token.TYPEOF, IR.paren(name("x"))), "typeof(x);");
    assertPrint(IR.unaryOp(Token.DELPROP, IR.getprop(name("a"), "b")), "delete a.b;");
    assertPrint(IR.unaryOp(Token.VOID, IR.number(0)), "void 0;");
  }

  @Test
  public void testAdjacentSignsAreSeparated() {
    assertPrint(IR.binaryOp(Token.ADD, name("a"), IR.unaryOp(Token.POS, name("b"))), "a+ +b;");
    assertPrint(
        IR.binaryOp(Token.SUB, name("a"), IR.unaryOp(Token.NEG, IR.number(1))), "a- -1;");
    assertPrint(IR.binaryOp(Token.SUB, name("a"), IR.number(-1)), "a- -1;");
    assertPrint(
        IR.binaryOp(Token.ADD, IR.postfix(Token.INC, name("a")), IR.unaryOp(Token.INC, name("b"))),
        "a++ + ++b;");
  }

  @Test
  public void testRegExpAfterDivideIsSeparated() {
    assertPrint(IR.binaryOp(Token.DIV, name("a"), IR.regexp("re", "g")), "a/ /re/g;");
    assertPrint(
        IR.assign(Token.ASSIGN_DIV, name("a"), IR.regexp("re", "")), "a/=/re/;");
  }

  @Test
  public void testNumbers() {
    assertPrint(IR.number(1), "1;");
    assertPrint(IR.number(1.5), "1.5;");
    assertPrint(IR.number(0.1), "0.1;");
    assertPrint(IR.number(100), "100;");
    assertPrint(IR.number(1000), "1E3;");
    assertPrint(IR.number(123000), "123E3;");
  }

  @Test
  public void testLiterals() {
    assertPrint(IR.string("abc"), "\"abc\";");
    assertPrint(IR.quotedString("'abc'"), "'abc';");
    assertPrint(IR.regexp("a+", "g"), "/a+/g;");
    assertPrint(IR.trueNode(), "true;");
    assertPrint(IR.falseNode(), "false;");
    assertPrint(IR.nullNode(), "null;");
    assertPrint(IR.thisNode(), "this;");
    assertPrint(IR.empty(), ";");
  }

  @Test
  public void testHook() {
    Node hook = IR.hook(name("a"), name("b"), name("c"));
    assertPrint(hook.cloneTree(), "a?b:c;");
    assertPrettyPrint(hook, "a ? b : c;");
  }

  @Test
  public void testCallsAndMembers() {
    assertPrint(call("f", IR.number(1), name("x")), "f(1,x);");
    assertPrettyPrint(call("f", IR.number(1), name("x")), "f(1, x);");
    assertPrint(IR.newNode(name("Foo")), "new Foo();");
    assertPrint(IR.getprop(IR.thisNode(), "a"), "this.a;");
    assertPrint(IR.getelem(name("a"), IR.quotedString("'b c'")), "a['b c'];");
  }

  @Test
  public void testNumberPropertyTargetIsParenthesized() {
    assertPrint(IR.getprop(IR.number(1), "toString"), "(1).toString;");
    assertPrint(IR.getprop(IR.number(-1.5), "x"), "(-1.5).x;");
    assertPrint(IR.getelem(IR.number(1), IR.string("x")), "1[\"x\"];");
  }

  @Test
  public void testObjectAndArrayLiterals() {
    Node obj =
        IR.paren(
            IR.objectlit(
                IR.property(name("a"), IR.number(1)),
                IR.property(IR.quotedString("'b-c'"), IR.number(2))));
    assertPrint(obj.cloneTree(), "({a:1,'b-c':2});");
    assertPrettyPrint(obj, "({a: 1, 'b-c': 2});");

    assertPrint(IR.arraylit(IR.number(1), IR.absent(), IR.number(3)), "[1,,3];");
    assertPrint(IR.arraylit(), "[];");
  }

  @Test
  public void testVar() {
    assertPrint(IR.var(IR.assign(name("a"), IR.number(1)), name("b")), "var a=1,b;");
    assertPrettyPrint(IR.var(IR.assign(name("a"), IR.number(1)), name("b")), "var a = 1, b;");
  }

  @Test
  public void testFunction() {
    Node fn =
        IR.function(
            name("f"),
            IR.argList(name("a"), name("b")),
            IR.statementList(IR.returnNode(IR.binaryOp(Token.ADD, name("a"), name("b")))));
    assertPrint(fn.cloneTree(), "function f(a,b){return a+b;}");
    assertPrettyPrint(fn, LINE_JOINER.join("function f(a, b) {", "  return a + b;", "}"));
  }

  @Test
  public void testFunctionExpression() {
    assertPrint(
        IR.assign(name("f"), IR.functionExpr(IR.absent(), IR.argList(), IR.statementList())),
        "f=function(){};");
    assertPrint(
        IR.assign(name("f"), IR.functionExpr(name("g"), IR.argList(), IR.statementList())),
        "f=function g(){};");
  }

  @Test
  public void testJumps() {
    assertPrint(IR.returnNode(), "return;");
    assertPrint(IR.throwNode(name("e")), "throw e;");
    assertPrint(IR.breakNode(name("outer")), "break outer;");
    assertPrint(IR.continueNode(), "continue;");
  }

  @Test
  public void testIf() {
    assertPrint(IR.ifNode(name("x"), IR.statementList(call("f"))), "if(x)f();");
    assertPrint(IR.ifNode(name("x"), IR.statementList()), "if(x){}");
    assertPrint(
        IR.ifNode(name("x"), IR.statementList(call("f"), call("g"))), "if(x){f();g();}");
    assertPrettyPrint(
        IR.ifNode(name("x"), IR.statementList(call("f"))),
        LINE_JOINER.join("if (x) {", "  f();", "}"));
  }

  @Test
  public void testIfElse() {
    Node ifElse =
        IR.ifNode(name("x"), IR.statementList(call("f")), IR.statementList(call("g")));
    assertPrint(ifElse.cloneTree(), "if(x){f();}else g();");
    assertPrettyPrint(
        ifElse, LINE_JOINER.join("if (x) {", "  f();", "} else {", "  g();", "}"));
  }

  @Test
  public void testElseSeparation() {
    assertPrint(
        IR.ifNode(
            name("x"),
            IR.statementList(call("f")),
            IR.statementList(call("g"), call("h"))),
        "if(x){f();}else{g();h();}");
    assertPrint(
        IR.ifNode(name("x"), IR.statementList(call("f")), IR.paren(name("a"))),
        "if(x){f();}else (a);");
  }

  @Test
  public void testElseIf() {
    Node ifElseIf =
        IR.ifNode(
            name("x"),
            IR.statementList(call("f")),
            IR.ifNode(name("y"), IR.statementList(call("g"))));
    assertPrint(ifElseIf.cloneTree(), "if(x){f();}else if(y)g();");
    assertPrettyPrint(
        ifElseIf, LINE_JOINER.join("if (x) {", "  f();", "} else if (y) {", "  g();", "}"));
  }

  @Test
  public void testLoops() {
    assertPrint(IR.whileNode(name("x"), IR.statementList(call("f"))), "while(x)f();");
    assertPrint(IR.whileNode(name("x"), IR.statementList()), "while(x);");
    assertPrint(IR.doNode(IR.statementList(call("f")), name("x")), "do{f();}while(x);");
    assertPrint(
        IR.forNode(IR.empty(), IR.empty(), IR.empty(), IR.statementList()), "for(;;);");
    assertPrint(
        IR.forIn(IR.var(name("k")), name("o"), IR.statementList(call("f", name("k")))),
        "for(var k in o)f(k);");
    assertPrint(IR.with(name("o"), IR.statementList(call("f"))), "with(o)f();");
  }

  @Test
  public void testFor() {
    Node loop =
        IR.forNode(
            IR.var(IR.assign(name("i"), IR.number(0))),
            IR.binaryOp(Token.LT, name("i"), IR.number(10)),
            IR.postfix(Token.INC, name("i")),
            IR.statementList(call("f", name("i"))));
    assertPrint(loop.cloneTree(), "for(var i=0;i<10;i++)f(i);");
    assertPrettyPrint(
        loop, LINE_JOINER.join("for (var i = 0; i < 10; i++) {", "  f(i);", "}"));
  }

  @Test
  public void testDoWhilePretty() {
    assertPrettyPrint(
        IR.doNode(IR.statementList(call("f")), name("x")),
        LINE_JOINER.join("do {", "  f();", "} while (x);"));
  }

  @Test
  public void testTry() {
    assertPrint(
        IR.tryNode(
            IR.statementList(call("f")),
            name("e"),
            IR.statementList(call("g")),
            IR.statementList(call("h"))),
        "try{f();}catch(e){g();}finally{h();}");
    assertPrint(
        IR.tryFinally(IR.statementList(call("f")), IR.statementList()), "try{f();}finally{}");
    assertPrettyPrint(
        IR.tryCatch(IR.statementList(call("f")), name("e"), IR.statementList(call("g"))),
        LINE_JOINER.join("try {", "  f();", "} catch (e) {", "  g();", "}"));
  }

  @Test
  public void testSwitch() {
    Node sw =
        IR.switchNode(
            name("x"),
            IR.statementList(
                IR.caseNode(IR.number(1)),
                call("f"),
                IR.breakNode(),
                IR.defaultCase(),
                call("g")));
    assertPrint(sw.cloneTree(), "switch(x){case 1:f();break;default:g();}");
    assertPrettyPrint(
        sw,
        LINE_JOINER.join(
            "switch (x) {", "  case 1:", "    f();", "    break;", "  default:", "    g();", "}"));
  }

  @Test
  public void testLabel() {
    assertPrint(IR.label(name("foo"), call("f")), "foo:f();");
    assertPrint(
        IR.label(name("foo"), IR.statementList(call("f"), IR.breakNode(name("foo")))),
        "foo:{f();break foo;};");
  }

  @Test
  public void testNestedBlocksIndentPretty() {
    Node fn =
        IR.function(
            name("f"),
            IR.argList(),
            IR.statementList(
                IR.whileNode(name("x"), IR.statementList(call("g"))), IR.returnNode()));
    assertPrettyPrint(
        fn,
        LINE_JOINER.join(
            "function f() {", "  while (x) {", "    g();", "  }", "  return;", "}"));
  }

  @Test
  public void testPrettyStatementsOnSeparateLines() {
    assertThat(CodePrinter.toSource(program(call("f"), call("g")), RenderOption.PRETTY))
        .isEqualTo("f();\ng();");
    assertThat(CodePrinter.toSource(program(call("f"), call("g")))).isEqualTo("f();g();");
  }

  @Test
  public void testLineNumberCatchup() {
    Node root = program(call("f").setLineno(3), call("g").setLineno(7));
    assertThat(CodePrinter.toSource(root, RenderOption.MAINTAIN_LINE_NUMBERS))
        .isEqualTo("\n\nf();\n\n\n\ng();");
  }

  @Test
  public void testLineNumberCatchupOnFirstLine() {
    Node root = program(call("f").setLineno(1), call("g").setLineno(2));
    assertThat(CodePrinter.toSource(root, RenderOption.MAINTAIN_LINE_NUMBERS))
        .isEqualTo("f();\ng();");
  }

  @Test
  public void testLineNumbersNeverGoBackwards() {
    Node root = program(call("f").setLineno(5), call("g").setLineno(3), call("h"));
    assertThat(CodePrinter.toSource(root, RenderOption.MAINTAIN_LINE_NUMBERS))
        .isEqualTo("\n\n\n\nf();g();h();");
  }

  @Test
  public void testLineNumbersInBlocks() {
    Node fn =
        IR.function(
                name("f"), IR.argList(), IR.statementList(IR.returnNode().setLineno(2)).setLineno(3))
            .setLineno(1);
    assertThat(CodePrinter.toSource(program(fn), RenderOption.MAINTAIN_LINE_NUMBERS))
        .isEqualTo("function f(){\nreturn;\n}");
  }

  @Test
  public void testLineNumbersWithPrettyPrint() {
    Node fn =
        IR.function(
                name("f"), IR.argList(), IR.statementList(IR.returnNode().setLineno(3)).setLineno(4))
            .setLineno(1);
    assertThat(
            CodePrinter.toSource(
                program(fn), RenderOption.PRETTY, RenderOption.MAINTAIN_LINE_NUMBERS))
        .isEqualTo("function f() {\n\n  return;\n}");
  }

  @Test
  public void testLineNumbersDoWhile() {
    Node loop =
        IR.doNode(IR.statementList(call("f").setLineno(2)), name("x").setLineno(3)).setLineno(1);
    assertThat(CodePrinter.toSource(program(loop), RenderOption.MAINTAIN_LINE_NUMBERS))
        .isEqualTo("do{\nf();}\nwhile(x);");
  }

  @Test
  public void testBuilderOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setPrettyPrint(true);
    Node root = program(IR.assign(name("a"), IR.number(1)));
    assertThat(new CodePrinter.Builder(root).setCompilerOptions(options).build())
        .isEqualTo("a = 1;");
    assertThat(
            new CodePrinter.Builder(root)
                .setRenderOptions(EnumSet.noneOf(RenderOption.class))
                .build())
        .isEqualTo("a=1;");
    assertThat(new CodePrinter.Builder(root).setPrettyPrint(true).build()).isEqualTo("a = 1;");
  }

  @Test
  public void testFragmentsJoinToOutput() {
    Node root = program(IR.ifNode(name("x"), IR.statementList(call("f")), IR.statementList()));
    CodePrinter.Builder builder = new CodePrinter.Builder(root);
    ImmutableList<String> fragments = builder.buildFragments();
    assertThat(fragments.size()).isGreaterThan(1);
    assertThat(fragments).doesNotContain("");
    assertThat(Joiner.on("").join(fragments)).isEqualTo(builder.build());
  }

  @Test
  public void testRenderingDoesNotModifyTree() {
    Node root = program(IR.ifNode(name("x"), IR.statementList(call("f"))));
    Node copy = root.cloneTree();
    CodePrinter.toSource(root, RenderOption.PRETTY, RenderOption.MAINTAIN_LINE_NUMBERS);
    assertThat(root.isEquivalentTo(copy)).isTrue();
  }
}
