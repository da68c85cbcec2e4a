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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import scilla.parser.common.exceptions.InvalidConstructException;
import scilla.parser.common.lang.Field;
import scilla.parser.common.lang.FieldList;
import scilla.parser.common.lang.Type;

public class SrTypeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static SrType generic(String name, SrType ...args) {
    SrType t = new SrType(name);
    for (SrType arg: args) {
      t.addSubType(arg);
    }
    return t;
  }

  @Test
  public void testScalars() throws InvalidConstructException {
    assertEquals(Type.STRING, new SrType("String").toType());
    assertEquals(Type.BYSTR, new SrType("ByStr").toType());
    assertEquals(Type.BYSTR20, new SrType("ByStr20").toType());
    assertEquals(Type.byStrX(33), new SrType("ByStr33").toType());
    assertEquals("Unknown names keep their spelling",
                 Type.other("Stake"), new SrType("Stake").toType());
  }

  @Test
  public void testByStrWidthOutOfRange() throws InvalidConstructException {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("ByStr99999999999");
    new SrType("ByStr99999999999").toType();
  }

  @Test
  public void testMapKeyAndValue() throws InvalidConstructException {
    SrType map = SrType.map(new SrType("String"),
        generic("Pair", new SrType("ByStr20"), new SrType("BNum")));
    assertEquals(SrType.MAP, map.mainType());
    assertEquals("String", map.subTypes().get(0).mainType());
    assertEquals(Type.map(Type.STRING, Type.pair(Type.BYSTR20, Type.BNUM)),
                 map.toType());
  }

  @Test
  public void testNestedGenerics() throws InvalidConstructException {
    SrType t = generic("List", generic("Pair", new SrType("ByStr20"),
        generic("List", generic("Pair", new SrType("ByStr20"),
                                        new SrType("Uint32")))));
    assertEquals("(List (Pair ByStr20 (List (Pair ByStr20 Uint32))))",
                 t.toType().toString());
  }

  @Test
  public void testAddressInterface() throws InvalidConstructException {
    FieldList fields = FieldList.of(new Field("balances",
                             Type.map(Type.BYSTR20, Type.UINT128)));
    SrType t = new SrType("ByStr20");
    t.setAddressType(new AddressType("contract", fields));
    assertEquals("contract", t.addressType().typeName());
    assertEquals(Type.byStr20With("contract", fields), t.toType());
  }

  @Test
  public void testAddressOnWrongBase() throws InvalidConstructException {
    SrType t = new SrType("ByStr32");
    t.setAddressType(new AddressType("", new FieldList()));
    exception.expect(InvalidConstructException.class);
    t.toType();
  }

  @Test
  public void testMapArity() throws InvalidConstructException {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("expects 2");
    generic("Map", new SrType("String")).toType();
  }

  @Test
  public void testOptionArity() throws InvalidConstructException {
    exception.expect(InvalidConstructException.class);
    new SrType("Option").toType();
  }

  @Test
  public void testScalarWithArguments() throws InvalidConstructException {
    exception.expect(InvalidConstructException.class);
    generic("Uint128", new SrType("String")).toType();
  }
}
