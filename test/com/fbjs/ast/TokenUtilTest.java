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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TokenUtilTest {

  @Test
  public void testKeywords() {
    assertThat(TokenUtil.isKeyword("for")).isTrue();
    assertThat(TokenUtil.isKeyword("instanceof")).isTrue();
    assertThat(TokenUtil.isKeyword("class")).isTrue();
    assertThat(TokenUtil.isKeyword("synchronized")).isTrue();
    assertThat(TokenUtil.isKeyword("null")).isTrue();
    assertThat(TokenUtil.isKeyword("true")).isTrue();

    assertThat(TokenUtil.isKeyword("undefined")).isFalse();
    assertThat(TokenUtil.isKeyword("For")).isFalse();
    assertThat(TokenUtil.isKeyword("")).isFalse();
  }

  @Test
  public void testIdentifiers() {
    assertThat(TokenUtil.isJSIdentifier("validName")).isTrue();
    assertThat(TokenUtil.isJSIdentifier("$")).isTrue();
    assertThat(TokenUtil.isJSIdentifier("_a1")).isTrue();
    assertThat(TokenUtil.isJSIdentifier("a$b_c9")).isTrue();
  }

  @Test
  public void testNotIdentifiers() {
    assertThat(TokenUtil.isJSIdentifier("")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("123abc")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("a-b")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("a b")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("for")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("enum")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("false")).isFalse();
    // Only ASCII letters are recognized.
    assertThat(TokenUtil.isJSIdentifier("caf\u00e9")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("\\u0061")).isFalse();
  }
}
