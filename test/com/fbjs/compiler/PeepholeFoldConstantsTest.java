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

import com.fbjs.ast.IR;
import com.fbjs.ast.Node;
import com.fbjs.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PeepholeFoldConstants} in isolation. */
@RunWith(JUnit4.class)
public final class PeepholeFoldConstantsTest extends PeepholeTestBase {

  @Override
  protected PeepholeOptimizationsPass getProcessor() {
    return new PeepholeOptimizationsPass(options, "foldConstants", new PeepholeFoldConstants());
  }

  @Test
  public void testFoldOrOfConstants() {
    test(assignX(IR.or(IR.trueNode(), IR.falseNode())), assignX(IR.trueNode()));
    test(assignX(IR.or(IR.falseNode(), IR.falseNode())), assignX(IR.falseNode()));
    test(assignX(IR.or(IR.falseNode(), IR.trueNode())), assignX(IR.trueNode()));
    test(assignX(IR.or(IR.number(0), IR.string("a"))), assignX(IR.string("a")));
    test(assignX(IR.or(IR.number(1), IR.nullNode())), assignX(IR.number(1)));
  }

  @Test
  public void testOrKeepsUnknownRightOperand() {
    testSame(assignX(IR.or(IR.trueNode(), call("f"))));
    testSame(assignX(IR.or(IR.falseNode(), call("f"))));
    testSame(assignX(IR.or(call("f"), IR.trueNode())));
  }

  @Test
  public void testFoldAnd() {
    test(assignX(IR.and(IR.falseNode(), call("f"))), assignX(IR.falseNode()));
    test(assignX(IR.and(IR.trueNode(), IR.falseNode())), assignX(IR.falseNode()));
    test(assignX(IR.and(IR.trueNode(), call("f"))), assignX(call("f")));
    test(assignX(IR.and(IR.trueNode(), IR.trueNode())), assignX(IR.trueNode()));
    test(assignX(IR.and(IR.nullNode(), call("f"))), assignX(IR.falseNode()));
    testSame(assignX(IR.and(call("f"), IR.falseNode())));
  }

  @Test
  public void testFoldComma() {
    test(assignX(IR.paren(IR.comma(IR.number(0), name("y")))), assignX(IR.paren(name("y"))));
    testSame(assignX(IR.paren(IR.comma(call("f"), name("y")))));
  }

  @Test
  public void testFoldNot() {
    test(assignX(IR.not(IR.trueNode())), assignX(IR.falseNode()));
    test(assignX(IR.not(IR.number(0))), assignX(IR.trueNode()));
    test(assignX(IR.not(IR.number(Double.NaN))), assignX(IR.trueNode()));
    test(assignX(IR.not(IR.string(""))), assignX(IR.trueNode()));
    test(assignX(IR.not(IR.quotedString("'a'"))), assignX(IR.falseNode()));
    test(assignX(IR.not(IR.paren(IR.nullNode()))), assignX(IR.trueNode()));
    testSame(assignX(IR.not(call("f"))));
    testSame(assignX(IR.not(IR.quotedString("'\\n'"))));
    testSame(assignX(IR.not(IR.thisNode())));
  }

  @Test
  public void testFoldNested() {
    test(
        assignX(IR.not(IR.paren(IR.and(IR.trueNode(), IR.falseNode())))),
        assignX(IR.trueNode()));
    test(
        assignX(IR.or(IR.not(IR.number(1)), IR.and(IR.trueNode(), IR.trueNode()))),
        assignX(IR.trueNode()));
  }

  @Test
  public void testFoldHook() {
    test(assignX(IR.hook(IR.trueNode(), call("a"), call("b"))), assignX(call("a")));
    test(assignX(IR.hook(IR.number(0), call("a"), call("b"))), assignX(call("b")));
    testSame(assignX(IR.hook(name("c"), call("a"), call("b"))));
  }

  @Test
  public void testHookKeepsSubtreeExactly() {
    Node consequent = IR.getprop(call("a", IR.number(1)), "b");
    test(IR.hook(IR.trueNode(), consequent, call("b")), consequent.cloneTree());
  }

  @Test
  public void testFoldAlwaysFalseCall() {
    test(assignX(call("bagofholding")), assignX(IR.falseNode()));
    test(assignX(call("bagofholding", call("f"))), assignX(IR.falseNode()));
    testSame(assignX(call("f")));
    testSame(assignX(IR.call(IR.getprop(name("o"), "bagofholding"))));
  }

  @Test
  public void testAlwaysFalseCallDisabled() {
    options.setAlwaysFalseCallName(null);
    testSame(assignX(call("bagofholding")));
  }

  @Test
  public void testAlwaysFalseCallRenamed() {
    options.setAlwaysFalseCallName("debugOnly");
    test(assignX(call("debugOnly")), assignX(IR.falseNode()));
    testSame(assignX(call("bagofholding")));
  }

  @Test
  public void testConstantStatementsAreDropped() {
    test(IR.and(IR.falseNode(), call("f")));
    test(IR.not(IR.trueNode()));
    testSame(IR.or(IR.trueNode(), call("f")));
  }

  @Test
  public void testOtherOperatorsAreLeftAlone() {
    testSame(assignX(IR.binaryOp(Token.ADD, IR.number(1), IR.number(2))));
    testSame(assignX(IR.unaryOp(Token.NEG, IR.trueNode())));
  }
}
