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
import com.fbjs.ast.TokenUtil;
import org.jspecify.annotations.Nullable;

/**
 * A peephole optimization that replaces quoted member names and object keys with bare
 * identifiers where the name allows it.
 */
class PeepholeSubstituteAlternateSyntax extends AbstractPeepholeOptimization {

  /** Tries apply our various peephole minimizations on the passed in node. */
  @Override
  Node optimizeSubtree(Node node) {
    return switch (node.getToken()) {
      case GETELEM -> tryFoldGetElem(node);
      case OBJECT_PROPERTY -> tryUnquoteKey(node);
      default -> node;
    };
  }

  /** x['y'] => x.y */
  private Node tryFoldGetElem(Node n) {
    checkState(n.isGetElem(), n);
    Node subscript = n.getLastChild();
    String name = identifierValueOf(subscript);
    if (name == null) {
      return n;
    }
    Node target = n.removeFirstChild();
    return IR.getprop(target, IR.name(name).srcref(subscript)).srcref(n);
  }

  /** {'y': 1} => {y: 1} */
  private Node tryUnquoteKey(Node n) {
    checkState(n.isObjectProperty(), n);
    Node key = n.getFirstChild();
    String name = identifierValueOf(key);
    if (name != null) {
      n.replaceChild(key, IR.name(name).srcref(key));
    }
    return n;
  }

  /** Returns the value of a string literal that can be written as an identifier. */
  private static @Nullable String identifierValueOf(Node n) {
    if (!n.isString()) {
      return null;
    }
    String value = n.getUnquotedString();
    return TokenUtil.isJSIdentifier(value) ? value : null;
  }
}
