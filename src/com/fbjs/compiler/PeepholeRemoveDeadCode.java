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
import org.jspecify.annotations.Nullable;

/**
 * Peephole optimization to remove useless code such as if statements with a constant condition
 * or empty branches.
 */
class PeepholeRemoveDeadCode extends AbstractPeepholeOptimization {

  // Folds the negated condition of an if statement whose branches were swapped.
  private final PeepholeFoldConstants folder = new PeepholeFoldConstants();

  @Override
  void beginTraversal(CompilerOptions options) {
    super.beginTraversal(options);
    folder.beginTraversal(options);
  }

  @Override
  @Nullable Node optimizeSubtree(Node subtree) {
    switch (subtree.getToken()) {
      case IF:
        return tryFoldIf(subtree);
      default:
        return subtree;
    }
  }

  /**
   * Try folding IF nodes by removing dead branches.
   *
   * @return the replacement node, if changed, or the original if not
   */
  private @Nullable Node tryFoldIf(Node n) {
    checkState(n.isIf(), n);
    Node cond = n.getFirstChild();
    Node thenBody = cond.getNext();
    Node elseBody = n.getLastChild();

    switch (NodeUtil.getPureBooleanValue(cond)) {
      case TRUE:
        // if (true) { x } else { y } => { x }
        return n.removeChild(thenBody);
      case FALSE:
        // if (false) { x } else { y } => { y }
        // if (false) { x } => nothing
        return elseBody.isAbsent() ? null : n.removeChild(elseBody);
      default:
        break;
    }

    // Empty branches are usually left behind by other rewrites, e.g. of the always-false call.
    // if (x) { y } else { } => if (x) { y }
    if (!elseBody.isAbsent() && NodeUtil.isEmptyBlock(elseBody)) {
      elseBody = IR.absent();
      n.replaceChild(n.getLastChild(), elseBody);
    }

    if (!NodeUtil.isEmptyBlock(thenBody)) {
      return n;
    }

    if (elseBody.isAbsent()) {
      // if (x) { } => x
      return n.removeChild(cond);
    }

    // if (x) { } else { y } => if (!(x)) { y }
    int lineno = cond.getLineno();
    n.removeChild(cond);
    Node newCond = IR.not(IR.paren(cond).setLineno(lineno)).setLineno(lineno);
    n.addChildToFront(folder.tryFoldNot(newCond));
    n.replaceChild(thenBody, n.removeChild(elseBody));
    n.addChildToBack(IR.absent());
    return n;
  }
}
