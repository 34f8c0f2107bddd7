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

import com.fbjs.ast.IR;
import com.fbjs.ast.Node;
import com.fbjs.base.Tri;

/**
 * Peephole optimization to fold constants (e.g. false && x() --> false).
 *
 * <p>An operand is only dropped when its value is known, which implies it has no side effects.
 */
class PeepholeFoldConstants extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node subtree) {
    switch (subtree.getToken()) {
      case OR:
        return tryFoldOr(subtree);

      case AND:
        return tryFoldAnd(subtree);

      case COMMA:
        return tryFoldComma(subtree);

      case NOT:
        return tryFoldNot(subtree);

      case HOOK:
        return tryFoldHook(subtree);

      case CALL:
        return tryFoldAlwaysFalseCall(subtree);

      default:
        return subtree;
    }
  }

  /**
   * Folds an OR of two constants. A constant on the left alone is not enough: a right operand
   * with unknown value is never dropped.
   */
  private Node tryFoldOr(Node n) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    Tri leftVal = NodeUtil.getPureBooleanValue(left);
    Tri rightVal = NodeUtil.getPureBooleanValue(right);
    if (!leftVal.isKnown() || !rightVal.isKnown()) {
      return n;
    }

    if (leftVal == Tri.TRUE) {
      // (TRUE || FALSE) => TRUE
      return n.removeChild(left);
    } else if (rightVal == Tri.TRUE) {
      // (FALSE || TRUE) => TRUE
      return n.removeChild(right);
    } else {
      return IR.falseNode().srcref(n);
    }
  }

  private Node tryFoldAnd(Node n) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    Tri leftVal = NodeUtil.getPureBooleanValue(left);

    switch (leftVal) {
      case FALSE:
        // (FALSE && x) => false
        return IR.falseNode().srcref(n);
      case TRUE:
        if (NodeUtil.getPureBooleanValue(right) == Tri.FALSE) {
          return IR.falseNode().srcref(n);
        }
        // (TRUE && x) => x
        return n.removeChild(right);
      default:
        return n;
    }
  }

  private Node tryFoldComma(Node n) {
    if (!NodeUtil.getPureBooleanValue(n.getFirstChild()).isKnown()) {
      return n;
    }
    // (1, x) => x
    return n.removeChild(n.getLastChild());
  }

  Node tryFoldNot(Node n) {
    checkState(n.hasOneChild(), n);
    Tri val = NodeUtil.getPureBooleanValue(n.getFirstChild());
    if (!val.isKnown()) {
      return n;
    }
    return IR.booleanNode(val.not().toBoolean(false)).srcref(n);
  }

  private Node tryFoldHook(Node n) {
    checkState(n.hasXChildren(3), n);
    Node cond = n.getFirstChild();
    Node thenBody = cond.getNext();
    Node elseBody = n.getLastChild();

    switch (NodeUtil.getPureBooleanValue(cond)) {
      case TRUE:
        return n.removeChild(thenBody);
      case FALSE:
        return n.removeChild(elseBody);
      default:
        return n;
    }
  }

  /** Replaces a call of the configured always-false function with {@code false}. */
  private Node tryFoldAlwaysFalseCall(Node n) {
    String name = getOptions().getAlwaysFalseCallName();
    if (name == null || !NodeUtil.isCallTo(n, name)) {
      return n;
    }
    return IR.falseNode().srcref(n);
  }
}
