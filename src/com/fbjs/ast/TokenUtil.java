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

package com.fbjs.ast;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/**
 * Helper methods for deciding whether a string can be written as a bare identifier.
 */
public final class TokenUtil {

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          // Keywords
          "break", "case", "catch", "continue", "default", "delete", "do", "else", "finally",
          "for", "function", "if", "in", "instanceof", "new", "return", "switch", "this",
          "throw", "try", "typeof", "var", "void", "while", "with",
          // Future reserved words. Some engines reject these as property names, so they are
          // never treated as identifiers.
          "abstract", "boolean", "byte", "char", "class", "const", "debugger", "double", "enum",
          "export", "extends", "final", "float", "goto", "implements", "import", "int",
          "interface", "long", "native", "package", "private", "protected", "public", "short",
          "static", "super", "synchronized", "throws", "transient", "volatile",
          // NullLiteral and BooleanLiteral
          "true", "false", "null");

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.anyOf("$_"));

  private static final CharMatcher IDENTIFIER_PART =
      IDENTIFIER_START.or(CharMatcher.inRange('0', '9'));

  private TokenUtil() {}

  /** Whether {@code name} is a keyword, a future reserved word or a literal name. */
  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  /**
   * Whether {@code s} may be written as an identifier: ASCII {@code [a-zA-Z$_][a-zA-Z0-9$_]*}
   * and not reserved. Escaped unicode is not recognized.
   */
  public static boolean isJSIdentifier(String s) {
    if (s.isEmpty() || isKeyword(s)) {
      return false;
    }
    return IDENTIFIER_START.matches(s.charAt(0))
        && IDENTIFIER_PART.matchesAllOf(s.subSequence(1, s.length()));
  }
}
