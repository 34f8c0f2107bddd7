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

import com.google.common.base.MoreObjects;

/**
 * Mutable state of one render. The line counter only moves forward.
 */
final class RenderContext {
  final boolean pretty;
  final boolean preserveLineNumbers;

  /** The output line the next fragment lands on. */
  private int lineno = 1;

  /** Whether a statement has been emitted yet; pretty mode skips the first newline. */
  private boolean startedOutput = false;

  RenderContext(boolean pretty, boolean preserveLineNumbers) {
    this.pretty = pretty;
    this.preserveLineNumbers = preserveLineNumbers;
  }

  int getLineno() {
    return lineno;
  }

  /**
   * Returns the number of newlines needed to bring the output to {@code target} and moves the
   * counter there. Returns 0 for synthetic nodes and lines already reached.
   */
  int advanceTo(int target) {
    if (target == 0 || lineno >= target) {
      return 0;
    }
    int newlines = target - lineno;
    lineno = target;
    return newlines;
  }

  /** Marks the output as started, returning whether it already was. */
  boolean startOutput() {
    boolean started = startedOutput;
    startedOutput = true;
    return started;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("pretty", pretty)
        .add("preserveLineNumbers", preserveLineNumbers)
        .add("lineno", lineno)
        .toString();
  }
}
