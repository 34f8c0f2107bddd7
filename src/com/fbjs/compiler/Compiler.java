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
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs the reducer and the code printer over a tree, as configured by a {@link CompilerOptions}.
 *
 * <p>A Compiler holds no state between calls and may be reused for any number of trees, one at a
 * time.
 */
public class Compiler {
  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  private final CompilerOptions options;

  /** Creates a compiler with the default options. */
  public Compiler() {
    this(new CompilerOptions());
  }

  public Compiler(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /**
   * Folds constants and removes dead code under {@code root}, unless reducing is disabled.
   *
   * @return {@code root}, the node that replaced it, or null if nothing is left of it
   */
  public @Nullable Node optimize(Node root) {
    if (!options.isReduceEnabled()) {
      logger.fine("Peephole optimizations are disabled");
      return root;
    }
    logger.fine("Running peephole optimizations");
    return PeepholeOptimizationsPass.create(options).process(root);
  }

  /** Renders {@code root} with the output options. */
  public String toSource(Node root) {
    String code = new CodePrinter.Builder(root).setCompilerOptions(options).build();
    logger.finest("Printed " + code.length() + " characters");
    return code;
  }

  /** Optimizes then renders {@code root}. An optimized-away root renders as nothing. */
  public String compile(Node root) {
    Node result = optimize(root);
    return result == null ? "" : toSource(result);
  }
}
