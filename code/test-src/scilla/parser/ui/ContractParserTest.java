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
package scilla.parser.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import scilla.parser.Fixtures;
import scilla.parser.common.exceptions.ContractIOException;
import scilla.parser.common.exceptions.InvalidConstructException;
import scilla.parser.common.exceptions.InvalidSyntaxException;
import scilla.parser.common.lang.Contract;
import scilla.parser.common.lang.Field;
import scilla.parser.common.lang.FieldList;
import scilla.parser.common.lang.Transition;
import scilla.parser.common.lang.TransitionList;
import scilla.parser.common.lang.Type;

public class ContractParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Contract parseFixture(String name) throws Exception {
    return ContractParser.parseContract(Fixtures.read(name));
  }

  private static Type addr(String kind, Field ...fields) {
    return Type.byStr20With(kind, FieldList.of(fields));
  }

  @Test
  public void testHelloWorld() throws Exception {
    Contract expected = new Contract("HelloWorld",
        FieldList.of(new Field("owner", Type.BYSTR20)),
        FieldList.of(new Field("welcome_msg", Type.STRING)),
        TransitionList.of(
            new Transition("setHello",
                FieldList.of(new Field("msg", Type.STRING))),
            Transition.withoutParams("getHello")));
    assertEquals(expected, parseFixture("HelloWorld.scilla"));
  }

  @Test
  public void testMaps() throws Exception {
    Contract expected = new Contract("DifferentMaps",
        new FieldList(),
        FieldList.of(
            new Field("first_map", Type.map(Type.STRING, Type.BNUM)),
            new Field("status3days", Type.map(Type.STRING,
                                  Type.pair(Type.BYSTR20, Type.BNUM))),
            new Field("reward_pairs", Type.map(Type.BYSTR20,
                                  Type.list(Type.UINT128)))),
        new TransitionList());
    assertEquals(expected, parseFixture("Map.scilla"));
  }

  @Test
  public void testByStrVariants() throws Exception {
    Type verifier = addr("contract", new Field("verification_methods",
                          Type.map(Type.STRING, Type.byStrX(33))));
    Type balances = Type.map(Type.BYSTR20, Type.UINT128);

    FieldList initParams = FieldList.of(
        new Field("bystr", Type.BYSTR),
        new Field("bystr32", Type.byStrX(32)),
        new Field("raw_address", Type.BYSTR20),
        new Field("library_address", addr("library")),
        new Field("contract_address", addr("contract")),
        new Field("detailed_contract_address", addr("contract",
            new Field("allowances", Type.map(Type.BYSTR20, balances)),
            new Field("balances", balances),
            new Field("total_supply", Type.UINT128))),
        new Field("complex_contract_address", addr("contract",
            new Field("implementation", addr("contract",
                new Field("services", Type.map(Type.STRING, Type.BYSTR20)),
                new Field("utility", Type.map(Type.STRING, Type.UINT128)))),
            new Field("dns", Type.map(Type.STRING, Type.BYSTR20)),
            new Field("guardians", Type.map(Type.STRING, verifier)))));

    TransitionList transitions = TransitionList.of(
        new Transition("ArbitrageFromXCAD", FieldList.of(
            new Field("token", addr("contract",
                                    new Field("balances", balances))))),
        new Transition("BuyNFTUsername", FieldList.of(
            new Field("username", Type.STRING),
            new Field("guardianship", Type.option(verifier)),
            new Field("id", Type.STRING),
            new Field("tyron", Type.option(Type.UINT128)))));

    Contract expected = new Contract("AllByStrVariants", initParams,
                                     new FieldList(), transitions);
    assertEquals(expected, parseFixture("ByStr.scilla"));
  }

  @Test
  public void testTimestamp() throws Exception {
    Contract expected = new Contract("Timestamp", new FieldList(),
        new FieldList(), TransitionList.of(new Transition("EventTimestamp",
            FieldList.of(new Field("bnum", Type.BNUM)))));
    assertEquals(expected, parseFixture("Timestamp.scilla"));
  }

  @Test
  public void testChainId() throws Exception {
    Contract expected = new Contract("ChainId", new FieldList(),
        FieldList.of(new Field("dummy_field", Type.UINT256)),
        TransitionList.of(Transition.withoutParams("EventChainID")));
    assertEquals(expected, parseFixture("chainid.scilla"));
  }

  @Test
  public void testUserDefinedTypes() throws Exception {
    Contract c = parseFixture("Staking.scilla");
    assertEquals("StakingContract", c.name());
    assertEquals(FieldList.of(new Field("initial_owner", Type.BYSTR20)),
                 c.initParams());
    assertEquals(new Field("reward_pairs", Type.map(Type.BYSTR20,
                      Type.list(Type.other("RewardParam")))),
                 c.fields().get(2));
    assertEquals(new Field("stakes", Type.map(Type.BYSTR20,
                      Type.other("Stake"))),
                 c.fields().get(3));
    assertEquals(new Transition("AddStake", FieldList.of(
                      new Field("amount", Type.UINT128),
                      new Field("expiration_time", Type.UINT64))),
                 c.transitions().get(1));
  }

  @Test
  public void testZeroParameterTransition() throws Exception {
    Contract c = parseFixture("HelloWorld.scilla");
    FieldList params = c.transitions().get(1).params();
    assertTrue(params.isEmpty());
    assertEquals(new FieldList(), params);
  }

  @Test
  public void testDeterministic() throws Exception {
    String source = Fixtures.read("ByStr.scilla");
    assertEquals(ContractParser.parseContract(source),
                 ContractParser.parseContract(source));
  }

  @Test
  public void testParseFile() throws Exception {
    Contract c = ContractParser.parseContractFile(
                          Fixtures.file("Timestamp.scilla"));
    assertEquals("Timestamp", c.name());
  }

  @Test
  public void testMissingFile() throws Exception {
    exception.expect(ContractIOException.class);
    ContractParser.parseContractFile(new File("no/such/contract.scilla"));
  }

  @Test
  public void testUnterminatedTransition() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    ContractParser.parseContract("scilla_version 0\n" +
        "contract C()\n" +
        "transition T()\n" +
        "  accept\n");
  }

  @Test
  public void testUnclosedParameterList() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    ContractParser.parseContract("scilla_version 0\n" +
        "contract C(\n");
  }

  @Test
  public void testByStrWidthOverflow() throws Exception {
    exception.expect(InvalidConstructException.class);
    ContractParser.parseContract("scilla_version 0\n" +
        "contract C(a : ByStr99999999999)\n");
  }

  @Test
  public void testFunctionTypedField() throws Exception {
    exception.expect(InvalidConstructException.class);
    ContractParser.parseContract("scilla_version 0\n" +
        "contract C()\n" +
        "field f : Uint128 -> Uint128 = fun (a : Uint128) => a\n");
  }

  @Test
  public void testConstraintNotLowered() throws Exception {
    Contract c = ContractParser.parseContract("scilla_version 0\n" +
        "contract C(limit : Uint32)\n" +
        "with builtin lt limit limit =>\n" +
        "field f : Uint32 = limit\n");
    assertEquals(FieldList.of(new Field("limit", Type.UINT32)),
                 c.initParams());
    assertEquals(1, c.fields().size());
  }
}
