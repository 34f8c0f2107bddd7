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
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Compiler options. */
public class CompilerOptions implements Serializable {

  /** Name of the call that the reducer replaces with {@code false} unless changed. */
  public static final String DEFAULT_ALWAYS_FALSE_CALL_NAME = "bagofholding";

  private boolean prettyPrint;

  /** Pad the output with newlines so that statements land on their source lines. */
  private boolean preserveLineNumbers;

  /** Run the constant folding and dead code removal pass before rendering. */
  private boolean reduceEnabled;

  /**
   * Calls to a global function of this name are folded to {@code false}. Null turns the rewrite
   * off.
   */
  private @Nullable String alwaysFalseCallName;

  public CompilerOptions() {
    prettyPrint = false;
    preserveLineNumbers = false;
    reduceEnabled = true;
    alwaysFalseCallName = DEFAULT_ALWAYS_FALSE_CALL_NAME;
  }

  public void setPrettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  public boolean isPrettyPrint() {
    return this.prettyPrint;
  }

  public void setPreserveLineNumbers(boolean preserveLineNumbers) {
    this.preserveLineNumbers = preserveLineNumbers;
  }

  public boolean shouldPreserveLineNumbers() {
    return preserveLineNumbers;
  }

  public void setReduceEnabled(boolean reduceEnabled) {
    this.reduceEnabled = reduceEnabled;
  }

  public boolean isReduceEnabled() {
    return reduceEnabled;
  }

  public void setAlwaysFalseCallName(@Nullable String alwaysFalseCallName) {
    this.alwaysFalseCallName = alwaysFalseCallName;
  }

  public @Nullable String getAlwaysFalseCallName() {
    return alwaysFalseCallName;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("alwaysFalseCallName", alwaysFalseCallName)
        .add("preserveLineNumbers", preserveLineNumbers)
        .add("prettyPrint", prettyPrint)
        .add("reduceEnabled", reduceEnabled)
        .toString();
  }
}
