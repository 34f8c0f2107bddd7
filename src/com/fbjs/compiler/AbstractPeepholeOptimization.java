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

import static com.google.common.base.Preconditions.checkNotNull;

import com.fbjs.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * An abstract class whose implementations run peephole optimizations: optimizations that look at
 * a small section of code and either remove that code (if it is not needed) or replace it with
 * smaller code.
 */
abstract class AbstractPeepholeOptimization {

  /** Intentionally not exposed to subclasses */
  private @Nullable CompilerOptions options;

  /**
   * Given a node to optimize, optimize the node. Subclasses should override to provide their own
   * peephole optimization. The children of {@code subtree} have already been optimized.
   *
   * <p>Implementations never detach {@code subtree} itself; the caller splices the result into
   * the tree. A replacement must be detached, and may be built from children taken out of
   * {@code subtree}.
   *
   * @param subtree The subtree that will be optimized.
   * @return {@code subtree} if it has not changed, a detached replacement, or null if the subtree
   *     should be removed.
   */
  abstract @Nullable Node optimizeSubtree(Node subtree);

  /** Informs the optimization that a traversal will begin. */
  void beginTraversal(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  protected final CompilerOptions getOptions() {
    return checkNotNull(options, "beginTraversal was not called");
  }
}
