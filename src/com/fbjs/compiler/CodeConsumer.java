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

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {

  /** Retrieve the last character of the last string sent to append, or 0 before any output. */
  abstract char getLastChar();

  /**
   * Appends a string to the code as is.
   *
   * <p>NOTE: the string must be a complete token. Use {@link #add} to get the separating
   * whitespace two adjacent tokens may need.
   */
  abstract void append(String str);

  void add(String newcode) {
    if (newcode.isEmpty()) {
      return;
    }

    char c = newcode.charAt(0);
    char prev = getLastChar();
    if ((isWordChar(c) || c == '\\') && isWordChar(prev)) {
      // need space to separate. This is not pretty printing.
      // For example: "return foo;"
      append(" ");
    } else if ((c == '+' || c == '-') && prev == c) {
      // This is not pretty printing. This is to prevent misparsing of
      // things like "x + ++y" or "x- -1"
      append(" ");
    } else if (c == '/' && prev == '/') {
      // "a/ /re/" would otherwise start a line comment.
      append(" ");
    }

    append(newcode);
  }

  void addNumber(double x) {
    // This is not pretty printing. This is to prevent misparsing of x- -4 as
    // x--4 (which is a syntax error).
    char prev = getLastChar();
    if (x < 0 && prev == '-') {
      add(" ");
    }

    if ((long) x == x) {
      long value = (long) x;
      long mantissa = value;
      int exp = 0;
      if (Math.abs(x) >= 100) {
        while (mantissa / 10 * Math.pow(10, exp + 1) == value) {
          mantissa /= 10;
          exp++;
        }
      }
      if (exp > 2) {
        add(Long.toString(mantissa) + "E" + Integer.toString(exp));
      } else {
        add(Long.toString(value));
      }
    } else {
      add(String.valueOf(x));
    }
  }

  static boolean isWordChar(char ch) {
    return (ch == '_' || ch == '$' || Character.isLetterOrDigit(ch));
  }
}
