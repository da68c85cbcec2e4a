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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import scilla.parser.common.exceptions.InvalidConstructException;
import scilla.parser.common.lang.Type;

/**
 * Type descriptor built up on the operand stack: a type name with the
 * descriptors of its arguments in source order.
 */
public class SrType {
  public static final String MAP = "Map";
  public static final String PAIR = "Pair";
  public static final String OPTION = "Option";
  public static final String LIST = "List";

  private static final Pattern SIZED_BYSTR = Pattern.compile("ByStr([0-9]+)");

  private final String mainType;
  private final List<SrType> subTypes;
  private AddressType addressType;

  public SrType(String mainType) {
    this.mainType = mainType;
    this.subTypes = new ArrayList<SrType>();
    this.addressType = null;
  }

  public static SrType fromIdentifier(SrIdentifier identifier) {
    return new SrType(identifier.unresolved());
  }

  public static SrType map(SrType key, SrType value) {
    SrType result = new SrType(MAP);
    result.addSubType(key);
    result.addSubType(value);
    return result;
  }

  public String mainType() {
    return mainType;
  }

  public List<SrType> subTypes() {
    return subTypes;
  }

  public void addSubType(SrType subType) {
    subTypes.add(subType);
  }

  public AddressType addressType() {
    return addressType;
  }

  public void setAddressType(AddressType addressType) {
    this.addressType = addressType;
  }

  /**
   * Resolve the descriptor to a final type
   * @throws InvalidConstructException if a type constructor has the wrong
   *        number of arguments, or an address interface is attached to
   *        something other than ByStr20
   */
  public Type toType() throws InvalidConstructException {
    if (addressType != null) {
      if (!mainType.equals(Type.BYSTR20_NAME)) {
        throw new InvalidConstructException("Address interface on " +
                                  mainType + ", expected ByStr20");
      }
      checkArity(0);
      return Type.byStr20With(addressType.typeName(), addressType.fields());
    }

    if (mainType.equals(MAP) || mainType.equals(PAIR)) {
      checkArity(2);
      // Consumed from the end: second argument first
      List<SrType> args = new ArrayList<SrType>(subTypes);
      Type second = args.remove(1).toType();
      Type first = args.remove(0).toType();
      return mainType.equals(MAP) ? Type.map(first, second)
                                  : Type.pair(first, second);
    } else if (mainType.equals(OPTION)) {
      checkArity(1);
      return Type.option(subTypes.get(0).toType());
    } else if (mainType.equals(LIST)) {
      checkArity(1);
      return Type.list(subTypes.get(0).toType());
    }

    Type prim = Type.lookupPrim(mainType);
    if (prim != null) {
      checkArity(0);
      return prim;
    }

    Matcher m = SIZED_BYSTR.matcher(mainType);
    if (m.matches()) {
      checkArity(0);
      try {
        return Type.byStrX(Integer.parseInt(m.group(1)));
      } catch (NumberFormatException e) {
        throw new InvalidConstructException("Byte string width of "
                                      + mainType + " is out of range");
      }
    }

    // User defined types keep their name only
    return Type.other(mainType);
  }

  private void checkArity(int expected) throws InvalidConstructException {
    if (subTypes.size() != expected) {
      throw new InvalidConstructException("Type " + mainType + " expects "
            + expected + " type argument(s) but was given "
            + subTypes.size());
    }
  }

  @Override
  public String toString() {
    if (subTypes.isEmpty() && addressType == null) {
      return mainType;
    }
    StringBuilder sb = new StringBuilder("(");
    sb.append(mainType);
    if (!subTypes.isEmpty()) {
      sb.append(' ');
      sb.append(StringUtils.join(subTypes, ' '));
    }
    if (addressType != null) {
      sb.append(' ');
      sb.append(addressType);
    }
    sb.append(')');
    return sb.toString();
  }
}
