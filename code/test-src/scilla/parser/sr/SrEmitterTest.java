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
package scilla.parser.sr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import scilla.parser.Fixtures;
import scilla.parser.ast.WithMetaData;
import scilla.parser.ast.nodes.NodeProgram;
import scilla.parser.common.Logging;
import scilla.parser.common.exceptions.InvalidConstructException;
import scilla.parser.common.exceptions.ScillaException;
import scilla.parser.common.lang.Contract;
import scilla.parser.common.lang.Field;
import scilla.parser.common.lang.FieldList;
import scilla.parser.common.lang.Transition;
import scilla.parser.common.lang.Type;
import scilla.parser.ui.ContractParser;

public class SrEmitterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/SrEmitterTest.log", true);
  }

  private static WithMetaData<NodeProgram> program(String source)
                                          throws ScillaException {
    return ContractParser.parseProgram(source);
  }

  private static String contractWith(String body) {
    return "scilla_version 0\n" +
           "contract C()\n" + body + "\n";
  }

  private static List<String> describe(List<SrIdentifier> ids) {
    List<String> result = new ArrayList<String>();
    for (SrIdentifier id: ids) {
      result.add(id.kind() + " " + id.qualifiedName());
    }
    return result;
  }

  @Test
  public void testStacksEmptyAfterLowering() throws Exception {
    SrEmitter emitter = new SrEmitter();
    emitter.emit(program(Fixtures.read("HelloWorld.scilla")));

    assertEquals(0, emitter.operandStackSize());
    assertEquals(0, emitter.namespaceStackSize());
    assertEquals(0, emitter.positionStackSize());
  }

  @Test
  public void testSingleUse() throws Exception {
    WithMetaData<NodeProgram> prog = program(Fixtures.read("Map.scilla"));
    SrEmitter emitter = new SrEmitter();
    emitter.emit(prog);
    try {
      emitter.emit(prog);
      fail("Second emit must be rejected");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testDefinitionsNamespaced() throws Exception {
    SrEmitter emitter = new SrEmitter();
    emitter.emit(program(Fixtures.read("Staking.scilla")));

    List<String> expected = new ArrayList<String>();
    expected.add("TYPE_NAME StakingLib.RewardParam");
    expected.add("TYPE_NAME StakingLib.Stake");
    expected.add("VIRTUAL_REGISTER StakingLib.zero");
    expected.add("VIRTUAL_REGISTER StakingLib.paused_default");
    expected.add("FUNCTION_NAME StakingLib.one_msg");
    expected.add("FUNCTION_NAME StakingLib.identity");
    expected.add("STATE StakingContract.owner");
    expected.add("STATE StakingContract.paused");
    expected.add("STATE StakingContract.reward_pairs");
    expected.add("STATE StakingContract.stakes");
    expected.add("STATE StakingContract.flag");
    expected.add("STATE StakingContract.total_staked_amount");
    expected.add("PROCEDURE_NAME StakingContract.ThrowIfPaused");
    expected.add("TRANSITION_NAME StakingContract.Pause");
    expected.add("TRANSITION_NAME StakingContract.AddStake");
    assertEquals(expected, describe(emitter.getDefinitions()));

    for (SrIdentifier id: emitter.getDefinitions()) {
      assertTrue(id + " marked as definition", id.isDefinition());
    }

    SrIdentifier stakes = emitter.getDefinitions().get(9);
    assertEquals("(Map ByStr20, Stake)", stakes.typeReference());
  }

  @Test
  public void testImports() throws Exception {
    SrEmitter emitter = new SrEmitter();
    emitter.emit(program(Fixtures.read("Staking.scilla")));

    List<SrIdentifier> imports = emitter.getImports();
    assertEquals(2, imports.size());
    assertEquals("BoolUtils", imports.get(0).unresolved());
    assertEquals("BoolUtils", imports.get(0).resolved());
    assertEquals("LU", imports.get(1).unresolved());
    assertEquals("ListUtils", imports.get(1).resolved());
    assertEquals(SrIdentifierKind.NAMESPACE, imports.get(1).kind());
  }

  @Test
  public void testProceduresNotInSurface() throws Exception {
    Contract c = new SrEmitter().emit(
                    program(Fixtures.read("Staking.scilla")));
    assertEquals(2, c.transitions().size());
    assertEquals("Pause", c.transitions().get(0).name());
    assertEquals("AddStake", c.transitions().get(1).name());
  }

  @Test
  public void testQualifiedTypeNames() throws Exception {
    Contract c = new SrEmitter().emit(program(contractWith(
        "field a : Option LU.Flag = None {LU.Flag}\n" +
        "field b : 0xabcd.Token = x\n" +
        "field c : Map ByStr20 Event = Emp ByStr20 Event")));

    FieldList expected = FieldList.of(
        new Field("a", Type.option(Type.other("LU.Flag"))),
        new Field("b", Type.other("0xabcd.Token")),
        new Field("c", Type.map(Type.BYSTR20, Type.other("Event"))));
    assertEquals(expected, c.fields());
  }

  @Test
  public void testNestedMapValue() throws Exception {
    Contract c = new SrEmitter().emit(program(contractWith(
        "field m : Map ByStr20 Map ByStr20 Uint128 = Emp ByStr20 (Map ByStr20 Uint128)")));

    assertEquals(Type.map(Type.BYSTR20, Type.map(Type.BYSTR20, Type.UINT128)),
                 c.fields().get(0).type());
  }

  @Test
  public void testMapTypeArgument() throws Exception {
    Contract c = new SrEmitter().emit(program(contractWith(
        "transition T(l : List Map String Uint32)\nend")));

    Transition t = c.transitions().get(0);
    assertEquals(Type.list(Type.map(Type.STRING, Type.UINT32)),
                 t.params().get(0).type());
  }

  @Test
  public void testFunctionTypedField() throws Exception {
    SrEmitter emitter = new SrEmitter();
    try {
      emitter.emit(program(contractWith(
          "field f : Uint128 -> Uint128 = fun (a : Uint128) => a")));
      fail("Expected InvalidConstructException");
    } catch (InvalidConstructException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Function type"));
    }
    assertEquals("Positions popped on the error path",
                 0, emitter.positionStackSize());
  }

  @Test
  public void testPolymorphicParameter() throws Exception {
    try {
      new SrEmitter().emit(program(contractWith(
          "transition T(f : forall 'A. 'A)\nend")));
      fail("Expected InvalidConstructException");
    } catch (InvalidConstructException e) {
      // expected
    }
  }

  @Test
  public void testTypeVariableArgument() throws Exception {
    try {
      new SrEmitter().emit(program(contractWith(
          "field l : List 'A = Nil {'A}")));
      fail("Expected InvalidConstructException");
    } catch (InvalidConstructException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("'A"));
    }
  }

  @Test
  public void testFailedEmitterStaysFailed() throws Exception {
    WithMetaData<NodeProgram> bad = program(contractWith(
        "field f : Uint128 -> Uint128 = fun (a : Uint128) => a"));
    SrEmitter emitter = new SrEmitter();
    try {
      emitter.emit(bad);
      fail("Expected InvalidConstructException");
    } catch (InvalidConstructException e) {
      // expected
    }
    try {
      emitter.emit(program(contractWith("")));
      fail("Failed emitter must not be reused");
    } catch (IllegalStateException e) {
      assertFalse(e.getMessage().isEmpty());
    }
  }
}
