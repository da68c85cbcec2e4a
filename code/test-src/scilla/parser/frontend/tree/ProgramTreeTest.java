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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

import scilla.parser.Fixtures;
import scilla.parser.ast.SourcePosition;
import scilla.parser.ast.WithMetaData;
import scilla.parser.ast.nodes.NodeComponentDefinition;
import scilla.parser.ast.nodes.NodeContractDefinition;
import scilla.parser.ast.nodes.NodeFullExpression;
import scilla.parser.ast.nodes.NodeImportedName;
import scilla.parser.ast.nodes.NodeLibraryDefinition;
import scilla.parser.ast.nodes.NodeLibrarySingleDefinition;
import scilla.parser.ast.nodes.NodeProgram;
import scilla.parser.ast.nodes.NodeScillaType;
import scilla.parser.ast.nodes.NodeTransitionDefinition;
import scilla.parser.frontend.ParsedContract;

public class ProgramTreeTest {

  private static NodeProgram build(String source) throws Exception {
    return ProgramTree.fromAST(ParsedContract.parse(source).ast).node();
  }

  @Test
  public void testProgramParts() throws Exception {
    NodeProgram program = build(Fixtures.read("Staking.scilla"));
    assertEquals("0", program.version());

    NodeImportedName alias = program.importDeclarations().node()
                                    .importList().get(1).node();
    assertEquals(NodeImportedName.Kind.ALIASED_IMPORT, alias.kind());
    assertEquals("ListUtils", alias.name().toString());
    assertEquals("LU", alias.localName());

    NodeLibraryDefinition lib = program.libraryDefinition().node();
    assertEquals("StakingLib", lib.name().toString());
    assertEquals(6, lib.definitions().size());

    NodeLibrarySingleDefinition.LetDefinition oneMsg =
        (NodeLibrarySingleDefinition.LetDefinition)
                    lib.definitions().get(4).node();
    assertEquals("one_msg", oneMsg.variableName());
    assertEquals(NodeFullExpression.Kind.FUNCTION_DECLARATION,
                 oneMsg.expression().node().kind());
  }

  @Test
  public void testContractParts() throws Exception {
    NodeContractDefinition contract = build(
          Fixtures.read("Staking.scilla")).contractDefinition().node();
    assertEquals("StakingContract", contract.contractName().toString());
    assertEquals(1, contract.parameters().node().parameters().size());
    assertNull(contract.constraint());
    assertEquals(6, contract.fields().size());
    assertEquals(3, contract.components().size());
  }

  @Test
  public void testTypeShapes() throws Exception {
    NodeContractDefinition contract = build(Fixtures.read("Map.scilla"))
                                        .contractDefinition().node();
    NodeScillaType firstMap = contract.fields().get(0).node()
        .typedIdentifier().node().annotation().node().typeName().node();
    assertEquals(NodeScillaType.Kind.MAP_TYPE, firstMap.kind());
  }

  @Test
  public void testEmptyBody() throws Exception {
    NodeContractDefinition contract = build(
        "scilla_version 0\ncontract C()\ntransition T()\nend\n")
        .contractDefinition().node();
    NodeTransitionDefinition t = ((NodeComponentDefinition.TransitionComponent)
        contract.components().get(0).node()).transition().node();
    assertEquals("T", t.name().toString());
    assertEquals(0, t.body().node().statementBlock().node()
                        .statements().size());
  }

  @Test
  public void testPositions() throws Exception {
    WithMetaData<NodeContractDefinition> contract = build(
        "scilla_version 0\ncontract C()\n").contractDefinition();
    SourcePosition start = contract.start();
    assertEquals(2, start.line);
    assertEquals(10, start.column);
    assertEquals("Range ends after the contract name",
                 11, contract.end().column);
  }
}
