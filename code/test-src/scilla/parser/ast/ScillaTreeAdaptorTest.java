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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.MismatchedTokenException;
import org.junit.Test;

import scilla.parser.ast.antlr.ScillaParser;

public class ScillaTreeAdaptorTest {

  @Test
  public void testErrorNodeIsScillaAST() {
    ScillaTreeAdaptor adaptor = new ScillaTreeAdaptor();
    CommonToken start = new CommonToken(ScillaParser.CONTRACT, "contract");
    Object node = adaptor.errorNode(null, start, start,
                                    new MismatchedTokenException());
    assertTrue(node instanceof ScillaAST);
    assertEquals(ScillaParser.CONTRACT, ((ScillaAST)node).getType());
  }

  @Test
  public void testNilIsScillaAST() {
    assertTrue(new ScillaTreeAdaptor().nil() instanceof ScillaAST);
  }
}
