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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import scilla.parser.ast.nodes.NodeMetaIdentifier;
import scilla.parser.ast.nodes.NodeScillaType;
import scilla.parser.ast.nodes.NodeTypeArgument;
import scilla.parser.ast.nodes.NodeTypeMapKey;
import scilla.parser.ast.nodes.NodeTypeMapValue;
import scilla.parser.ast.nodes.NodeTypeNameIdentifier;
import scilla.parser.common.exceptions.AstVisitException;

public class TraversalTest {

  private static WithMetaData<NodeMetaIdentifier> meta(String name) {
    return WithMetaData.unknown((NodeMetaIdentifier)
        new NodeMetaIdentifier.MetaName(WithMetaData.unknown(
          (NodeTypeNameIdentifier)
          new NodeTypeNameIdentifier.TypeOrEnumLikeIdentifier(name))));
  }

  /** Map String Uint128 */
  private static WithMetaData<NodeScillaType> mapType() {
    NodeTypeMapKey key = new NodeTypeMapKey.GenericMapKey(meta("String"));
    NodeTypeMapValue value =
        new NodeTypeMapValue.MapValueTypeOrEnumLikeIdentifier(
                                                      meta("Uint128"));
    return new WithMetaData<NodeScillaType>(
        new NodeScillaType.MapType(WithMetaData.unknown(key),
                                   WithMetaData.unknown(value)),
        new SourcePosition(10, 2, 3), new SourcePosition(30, 2, 23));
  }

  /** List (Option Int32) */
  private static WithMetaData<NodeScillaType> listType() {
    NodeScillaType option = new NodeScillaType.GenericTypeWithArgs(
        meta("Option"), Arrays.asList(WithMetaData.unknown(
            (NodeTypeArgument)new NodeTypeArgument.GenericTypeArgument(
                                                      meta("Int32")))));
    NodeTypeArgument enclosed = new NodeTypeArgument.EnclosedTypeArgument(
        WithMetaData.unknown(option));
    return WithMetaData.unknown((NodeScillaType)
        new NodeScillaType.GenericTypeWithArgs(meta("List"),
            Arrays.asList(WithMetaData.unknown(enclosed))));
  }

  @Test
  public void testMapKeyBeforeValue() throws AstVisitException {
    RecordingEmitter rec = new RecordingEmitter();
    TraversalResult result = mapType().visit(rec);

    assertEquals(TraversalResult.CONTINUE, result);
    List<String> expected = Arrays.asList(
        "ENTER ScillaType",
        "ENTER TypeMapKey",
        "ENTER MetaIdentifier",
        "ENTER TypeNameIdentifier",
        "EXIT TypeNameIdentifier",
        "EXIT MetaIdentifier",
        "EXIT TypeMapKey",
        "ENTER TypeMapValue",
        "ENTER MetaIdentifier",
        "ENTER TypeNameIdentifier",
        "EXIT TypeNameIdentifier",
        "EXIT MetaIdentifier",
        "EXIT TypeMapValue",
        "EXIT ScillaType");
    assertEquals(expected, rec.calls);
  }

  @Test
  public void testPositionsBracketNodes() throws AstVisitException {
    RecordingEmitter rec = new RecordingEmitter();
    mapType().visit(rec);

    assertEquals("Every push popped", 0, rec.positionDepth());
    assertEquals(4, rec.maxPositionDepth());
    assertEquals("Outermost range pushed first",
                 new SourcePosition(10, 2, 3), rec.starts.get(0));
  }

  @Test
  public void testSkipChildren() throws AstVisitException {
    RecordingEmitter rec = new RecordingEmitter().skip("TypeMapKey");
    mapType().visit(rec);

    assertEquals("No exit for a skipped node", 0,
                 rec.count("EXIT TypeMapKey"));
    assertEquals("Children of skipped key not visited, value still is",
                 1, rec.count("ENTER TypeNameIdentifier"));
    assertTrue(rec.calls.contains("EXIT ScillaType"));
  }

  @Test
  public void testChildResultPropagates() throws AstVisitException {
    RecordingEmitter rec = new RecordingEmitter().stopOnExit("TypeMapKey");
    TraversalResult result = mapType().visit(rec);

    assertEquals(TraversalResult.SKIP_CHILDREN, result);
    assertEquals("EXIT TypeMapKey", rec.calls.get(rec.calls.size() - 1));
    assertFalse("Sibling not visited",
                rec.calls.contains("ENTER TypeMapValue"));
    assertFalse("Parent exit not called",
                rec.calls.contains("EXIT ScillaType"));
    assertEquals(0, rec.positionDepth());
  }

  @Test
  public void testSkipAtRoot() throws AstVisitException {
    RecordingEmitter rec = new RecordingEmitter().skip("ScillaType");
    TraversalResult result = listType().visit(rec);

    assertEquals(TraversalResult.CONTINUE, result);
    assertEquals(Arrays.asList("ENTER ScillaType"), rec.calls);
  }

  @Test
  public void testNestedArgumentsInOrder() throws AstVisitException {
    RecordingEmitter rec = new RecordingEmitter().skip("MetaIdentifier");
    listType().visit(rec);

    List<String> expected = Arrays.asList(
        "ENTER ScillaType",
        "ENTER MetaIdentifier",
        "ENTER TypeArgument",
        "ENTER ScillaType",
        "ENTER MetaIdentifier",
        "ENTER TypeArgument",
        "ENTER MetaIdentifier",
        "EXIT TypeArgument",
        "EXIT ScillaType",
        "EXIT TypeArgument",
        "EXIT ScillaType");
    assertEquals(expected, rec.calls);
  }

  @Test
  public void testFailFast() {
    RecordingEmitter rec = new RecordingEmitter()
                        .failOn("TypeMapKey", TreeTraversalMode.EXIT);
    try {
      mapType().visit(rec);
      fail("Expected exception");
    } catch (AstVisitException e) {
      assertEquals("failing on EXIT TypeMapKey", e.getMessage());
    }

    assertEquals("EXIT TypeMapKey", rec.calls.get(rec.calls.size() - 1));
    assertFalse("Sibling not visited after failure",
                rec.calls.contains("ENTER TypeMapValue"));
    assertFalse("Ancestor exit not called after failure",
                rec.calls.contains("EXIT ScillaType"));
    assertEquals("Positions balanced on error path",
                 0, rec.positionDepth());
  }

  @Test
  public void testFailOnEnter() {
    RecordingEmitter rec = new RecordingEmitter()
                        .failOn("ScillaType", TreeTraversalMode.ENTER);
    try {
      mapType().visit(rec);
      fail("Expected exception");
    } catch (AstVisitException e) {
      // expected
    }
    assertEquals(Arrays.asList("ENTER ScillaType"), rec.calls);
    assertEquals(0, rec.positionDepth());
  }
}
