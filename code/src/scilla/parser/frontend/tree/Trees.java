/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package scilla.parser.frontend.tree;

import scilla.parser.ast.AstVisitor;
import scilla.parser.ast.ScillaAST;
import scilla.parser.ast.WithMetaData;
import scilla.parser.common.exceptions.ScillaRuntimeError;
import scilla.parser.frontend.LogHelper;

/**
 * Helpers shared by the tree builders
 */
class Trees {

  /**
   * Attach the source range of an ANTLR subtree to a node
   */
  static <T extends AstVisitor> WithMetaData<T> located(T node,
                                                        ScillaAST tree) {
    return new WithMetaData<T>(node, tree.startPosition(),
                               tree.endPosition());
  }

  static ScillaRuntimeError unexpected(String what, ScillaAST tree) {
    return new ScillaRuntimeError("Unexpected token in " + what + ": " +
                                  LogHelper.tokName(tree.getType()));
  }

  /**
   * Strip the quotes from a string literal token
   */
  static String unquote(String text) {
    assert(text.length() >= 2 && text.startsWith("\"")
            && text.endsWith("\"")) : text;
    return text.substring(1, text.length() - 1);
  }
}
