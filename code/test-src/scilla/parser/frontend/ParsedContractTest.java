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
package scilla.parser.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import scilla.parser.Fixtures;
import scilla.parser.ast.antlr.ScillaParser;
import scilla.parser.common.exceptions.InvalidSyntaxException;

public class ParsedContractTest {

  @Test
  public void testTreeRoot() throws Exception {
    ParsedContract parsed = ParsedContract.parse(
                              Fixtures.read("HelloWorld.scilla"));
    assertEquals(ScillaParser.PROGRAM, parsed.ast.getType());
    assertEquals(ScillaParser.VERSION, parsed.ast.child(0).getType());
    assertEquals(ScillaParser.LIB, parsed.ast.child(1).getType());
    assertEquals(ScillaParser.CONTRACT_DEF, parsed.ast.child(2).getType());
  }

  @Test
  public void testCommentsIgnored() throws Exception {
    ParsedContract parsed = ParsedContract.parse(
        "(* outer (* nested *) comment *)\n" +
        "scilla_version 0\n" +
        "contract C() (* trailing *)\n");
    assertEquals(2, parsed.ast.childCount());
  }

  @Test
  public void testParserDiagnostics() {
    try {
      ParsedContract.parse("scilla_version 0\n" +
                           "contract C()\n" +
                           "transition T()\n" +
                           "  accept\n");
      fail("Expected InvalidSyntaxException");
    } catch (InvalidSyntaxException e) {
      assertFalse(e.getDiagnostics().isEmpty());
      for (String d: e.getDiagnostics()) {
        assertTrue(d, d.startsWith("line "));
      }
      assertTrue(e.getMessage().startsWith("Syntax error: "));
    }
  }

  @Test
  public void testLexerDiagnostics() {
    try {
      ParsedContract.parse("scilla_version 0\n" +
                           "contract C()\n" +
                           "field f : Uint32 = $\n");
      fail("Expected InvalidSyntaxException");
    } catch (InvalidSyntaxException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("line 3"));
    }
  }

  @Test
  public void testMissingVersion() {
    try {
      ParsedContract.parse("contract C()\n");
      fail("Expected InvalidSyntaxException");
    } catch (InvalidSyntaxException e) {
      // expected
    }
  }
}
