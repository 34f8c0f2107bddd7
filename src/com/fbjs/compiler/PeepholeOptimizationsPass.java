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
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A compiler pass to run various peephole optimizations (e.g. constant folding, some useless code
 * removal, some minimizations).
 *
 * <p>The tree is visited in post order, so every optimization sees children that are already
 * optimized. The pass splices each result into the parent: in a statement list a removed
 * statement, or an expression statement with a known boolean value, is dropped; a removed else
 * branch becomes an absent slot; any other removed child becomes an EMPTY node.
 */
public class PeepholeOptimizationsPass {
  private static final Logger logger =
      Logger.getLogger(PeepholeOptimizationsPass.class.getName());

  private final CompilerOptions options;
  private final String passName;
  private final ImmutableList<AbstractPeepholeOptimization> peepholeOptimizations;
  private int changes;

  /** Creates a peephole optimization pass that runs the given optimizations. */
  PeepholeOptimizationsPass(
      CompilerOptions options, String passName, AbstractPeepholeOptimization... optimizations) {
    this(options, passName, ImmutableList.copyOf(optimizations));
  }

  PeepholeOptimizationsPass(
      CompilerOptions options, String passName, List<AbstractPeepholeOptimization> optimizations) {
    this.options = options;
    this.passName = passName;
    this.peepholeOptimizations = ImmutableList.copyOf(optimizations);
  }

  /** Creates the pass with all the reducing optimizations, in the order they run. */
  public static PeepholeOptimizationsPass create(CompilerOptions options) {
    return new PeepholeOptimizationsPass(
        options,
        "peepholeOptimizations",
        new PeepholeSubstituteAlternateSyntax(),
        new PeepholeFoldConstants(),
        new PeepholeRemoveDeadCode());
  }

  /**
   * Optimizes {@code root} and everything under it. The children of {@code root} are rewritten in
   * place; the returned node is {@code root}, its replacement, or null when the root itself was
   * optimized away.
   */
  public @Nullable Node process(Node root) {
    beginTraversal();
    changes = 0;
    Node result = visit(root);
    logger.fine(passName + ": " + changes + " change(s)");
    return result;
  }

  @VisibleForTesting
  int getChangeCount() {
    return changes;
  }

  private @Nullable Node visit(Node n) {
    for (Node child = n.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      if (child.isAbsent()) {
        if (n.isStatementList()) {
          n.removeChild(child);
          changes++;
        }
      } else {
        splice(n, child, visit(child));
      }
      child = next;
    }

    Node currentNode = n;
    for (AbstractPeepholeOptimization optim : peepholeOptimizations) {
      Node result = optim.optimizeSubtree(currentNode);
      if (result != currentNode) {
        changes++;
        if (logger.isLoggable(Level.FINER)) {
          logger.finer(
              optim.getClass().getSimpleName() + " rewrote " + currentNode + " to " + result);
        }
      }
      if (result == null) {
        return null;
      }
      currentNode = result;
    }
    return currentNode;
  }

  private void splice(Node parent, Node child, @Nullable Node result) {
    if (parent.isStatementList()) {
      // A constant expression statement has no side effects. A string statement is kept: it
      // may be a directive such as "use strict".
      if (result == null
          || (!result.isString() && NodeUtil.getPureBooleanValue(result).isKnown())) {
        parent.removeChild(child);
        if (result == child) {
          changes++;
        }
        return;
      }
    } else if (result == null) {
      if (parent.isIf() && child == parent.getLastChild()) {
        parent.replaceChild(child, IR.absent());
      } else {
        parent.replaceChild(child, IR.empty().srcref(child));
      }
      return;
    }
    if (result != child) {
      parent.replaceChild(child, result);
    }
  }

  /** Make sure that all the optimizations have the current options. */
  private void beginTraversal() {
    for (AbstractPeepholeOptimization optimization : peepholeOptimizations) {
      optimization.beginTraversal(options);
    }
  }
}
