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
package scilla.parser.ast;

import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.TokenStream;
import org.antlr.runtime.tree.CommonTreeAdaptor;

/**
 * Makes the ANTLR parser build {@link ScillaAST} nodes
 */
public class ScillaTreeAdaptor extends CommonTreeAdaptor {
  @Override
  public Object create(Token t) {
    return new ScillaAST(t);
  }

  @Override
  public Object dupNode(Object t) {
    if (t == null) {
      return null;
    }
    return create(((ScillaAST)t).getToken());
  }

  /**
   * Stand-in for a subtree the parser recovered from.  The generated
   * parser casts every node to ScillaAST, so this cannot be the default
   * CommonErrorNode.  The error itself has already been reported.
   */
  @Override
  public Object errorNode(TokenStream input, Token start, Token stop,
                          RecognitionException e) {
    return new ScillaAST(start);
  }
}
