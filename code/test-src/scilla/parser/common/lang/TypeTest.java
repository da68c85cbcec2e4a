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
package scilla.parser.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TypeTest {

  @Test
  public void testScalarLookup() {
    assertEquals(Type.UINT128, Type.lookupPrim("Uint128"));
    assertEquals(Type.BNUM, Type.lookupPrim("BNum"));
    assertEquals(Type.BYSTR, Type.lookupPrim("ByStr"));
    assertEquals(Type.BYSTR20, Type.lookupPrim("ByStr20"));
    assertNull("Sized byte strings are not scalars",
               Type.lookupPrim("ByStr32"));
    assertNull(Type.lookupPrim("Stake"));
  }

  @Test
  public void testDisplay() {
    assertEquals("(Map String, Uint128)",
        Type.map(Type.STRING, Type.UINT128).toString());
    assertEquals("(Option Bool)", Type.option(Type.BOOL).toString());
    assertEquals("ByStr32", Type.byStrX(32).toString());
    assertEquals("RewardParam", Type.other("RewardParam").toString());

    Type nested = Type.list(Type.pair(Type.BYSTR20,
        Type.list(Type.pair(Type.BYSTR20, Type.UINT32))));
    assertEquals("(List (Pair ByStr20 (List (Pair ByStr20 Uint32))))",
                 nested.toString());
  }

  @Test
  public void testAddressDisplay() {
    Type bare = Type.byStr20With("", new FieldList());
    assertEquals("ByStr20 with end", bare.toString());

    Type token = Type.byStr20With("contract", FieldList.of(
        new Field("balances", Type.map(Type.BYSTR20, Type.UINT128)),
        new Field("total_supply", Type.UINT128)));
    assertEquals("ByStr20 with contract field balances : " +
        "(Map ByStr20, Uint128), field total_supply : Uint128 end",
        token.toString());
  }

  @Test
  public void testStructuralEquality() {
    Type a = Type.map(Type.STRING, Type.pair(Type.BYSTR20, Type.BNUM));
    Type b = Type.map(Type.STRING, Type.pair(Type.BYSTR20, Type.BNUM));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());

    assertFalse("Pair order matters",
        Type.pair(Type.BYSTR20, Type.BNUM).equals(
            Type.pair(Type.BNUM, Type.BYSTR20)));
    assertFalse("Raw address differs from address with interface",
        Type.BYSTR20.equals(Type.byStr20With("", new FieldList())));
    assertEquals(Type.byStrX(33), Type.byStrX(33));
    assertFalse(Type.byStrX(32).equals(Type.byStrX(33)));
    assertFalse(Type.other("A").equals(Type.other("B")));
  }

  @Test
  public void testFieldListOrder() {
    Field x = new Field("x", Type.INT32);
    Field y = new Field("y", Type.STRING);
    FieldList xy = FieldList.of(x, y);

    assertEquals(xy, FieldList.of(x, y));
    assertFalse("Equality is order sensitive", xy.equals(FieldList.of(y, x)));
    assertEquals(2, xy.size());
    assertEquals(y, xy.get(1));
    assertTrue(new FieldList().isEmpty());
  }

  @Test
  public void testTransitionEquality() {
    Transition t = new Transition("setHello",
                      FieldList.of(new Field("msg", Type.STRING)));
    assertEquals(t, new Transition("setHello",
                      FieldList.of(new Field("msg", Type.STRING))));
    assertEquals(Transition.withoutParams("getHello"),
                 new Transition("getHello", new FieldList()));
    assertFalse(t.equals(Transition.withoutParams("setHello")));
  }
}
