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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * CodePrinter prints out JS code in either pretty format or compact format, optionally padded so
 * that statements keep their source line.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {

  /** Rendering modes. They combine freely; no option at all means compact output. */
  public enum RenderOption {
    PRETTY,
    MAINTAIN_LINE_NUMBERS,
  }

  private CodePrinter() {}

  /** Collects the generated fragments in order, without joining them. */
  static final class RopeCodePrinter extends CodeConsumer {
    private final List<String> fragments = new ArrayList<>();
    private char lastChar = '\0';

    @Override
    char getLastChar() {
      return lastChar;
    }

    @Override
    void append(String str) {
      if (str.isEmpty()) {
        return;
      }
      fragments.add(str);
      lastChar = str.charAt(str.length() - 1);
    }

    /** Returns the first character of the output, or 0 when nothing was emitted. */
    char getFirstChar() {
      return fragments.isEmpty() ? '\0' : fragments.get(0).charAt(0);
    }

    ImmutableList<String> getFragments() {
      return ImmutableList.copyOf(fragments);
    }

    String getCode() {
      return Joiner.on("").join(fragments);
    }
  }

  public static final class Builder {
    private final Node root;
    private boolean prettyPrint;
    private boolean preserveLineNumbers;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node, "Cannot build without root node being specified");
    }

    /** Sets the output options from compiler options. */
    public Builder setCompilerOptions(CompilerOptions options) {
      this.prettyPrint = options.isPrettyPrint();
      this.preserveLineNumbers = options.shouldPreserveLineNumbers();
      return this;
    }

    /**
     * Sets whether pretty printing should be used.
     *
     * @param prettyPrint If true, pretty printing will be used.
     */
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /**
     * Sets whether newlines are inserted so that each statement starts on its source line.
     */
    public Builder setPreserveLineNumbers(boolean preserveLineNumbers) {
      this.preserveLineNumbers = preserveLineNumbers;
      return this;
    }

    /** Replaces both mode flags with the given set of options. */
    public Builder setRenderOptions(Set<RenderOption> options) {
      this.prettyPrint = options.contains(RenderOption.PRETTY);
      this.preserveLineNumbers = options.contains(RenderOption.MAINTAIN_LINE_NUMBERS);
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      return print().getCode();
    }

    /** Generates the source code and returns the fragments it was emitted in. */
    public ImmutableList<String> buildFragments() {
      return print().getFragments();
    }

    private RopeCodePrinter print() {
      RopeCodePrinter rcp = new RopeCodePrinter();
      CodeGenerator cg =
          new CodeGenerator(rcp, new RenderContext(prettyPrint, preserveLineNumbers));
      cg.add(root);
      return rcp;
    }
  }

  /** Converts a tree to JS code. */
  public static String toSource(Node root, RenderOption... options) {
    return new Builder(root)
        .setRenderOptions(Sets.newEnumSet(Arrays.asList(options), RenderOption.class))
        .build();
  }
}
