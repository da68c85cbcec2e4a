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

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableMap;

/**
 * Scilla types as they appear on the deployable surface of a contract.
 * The set of variants is closed: see {@link Kind}.
 */
public abstract class Type {

  public enum Kind {
    INT32, INT64, INT128, INT256,
    UINT32, UINT64, UINT128, UINT256,
    STRING, BNUM, BOOL,
    MAP, OPTION, PAIR, LIST,
    /** Raw, unsized byte string */
    BYSTR,
    /** Fixed width byte string other than an address */
    BYSTRX,
    /** Plain 20 byte address */
    BYSTR20,
    /** Address annotated with the contract or library it points to */
    BYSTR20_WITH,
    /** Any type not known here, e.g. a user-defined ADT */
    OTHER,
  }

  public static final String BYSTR_NAME = "ByStr";
  public static final String BYSTR20_NAME = "ByStr20";

  public static final Type INT32 = new PrimType(Kind.INT32, "Int32");
  public static final Type INT64 = new PrimType(Kind.INT64, "Int64");
  public static final Type INT128 = new PrimType(Kind.INT128, "Int128");
  public static final Type INT256 = new PrimType(Kind.INT256, "Int256");
  public static final Type UINT32 = new PrimType(Kind.UINT32, "Uint32");
  public static final Type UINT64 = new PrimType(Kind.UINT64, "Uint64");
  public static final Type UINT128 = new PrimType(Kind.UINT128, "Uint128");
  public static final Type UINT256 = new PrimType(Kind.UINT256, "Uint256");
  public static final Type STRING = new PrimType(Kind.STRING, "String");
  public static final Type BNUM = new PrimType(Kind.BNUM, "BNum");
  public static final Type BOOL = new PrimType(Kind.BOOL, "Bool");
  public static final Type BYSTR = new PrimType(Kind.BYSTR, BYSTR_NAME);
  public static final Type BYSTR20 = new PrimType(Kind.BYSTR20, BYSTR20_NAME);

  private static final Map<String, Type> PRIM_TYPES;
  static {
    ImmutableMap.Builder<String, Type> b = ImmutableMap.builder();
    for (Type t: new Type[] {INT32, INT64, INT128, INT256, UINT32, UINT64,
                  UINT128, UINT256, STRING, BNUM, BOOL, BYSTR, BYSTR20}) {
      b.put(t.toString(), t);
    }
    PRIM_TYPES = b.build();
  }

  /**
   * Look up a type that takes no arguments by its Scilla name.
   * @param name
   * @return the type, or null if the name is not a builtin scalar type
   */
  public static Type lookupPrim(String name) {
    return PRIM_TYPES.get(name);
  }

  public static Type map(Type key, Type value) {
    return new MapType(key, value);
  }

  public static Type option(Type elem) {
    return new OptionType(elem);
  }

  public static Type pair(Type first, Type second) {
    return new PairType(first, second);
  }

  public static Type list(Type elem) {
    return new ListType(elem);
  }

  public static Type byStrX(int width) {
    return new ByStrXType(width);
  }

  public static Type byStr20With(String typeName, FieldList fields) {
    return new ByStr20WithType(typeName, fields);
  }

  public static Type other(String name) {
    return new OtherType(name);
  }

  public abstract Kind kind();

  @Override
  public abstract boolean equals(Object other);

  @Override
  public abstract int hashCode();

  /**
   * Source spelling of the type
   */
  @Override
  public abstract String toString();

  public static class PrimType extends Type {
    private final Kind kind;
    private final String name;

    private PrimType(Kind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PrimType && ((PrimType)other).kind == kind;
    }

    @Override
    public int hashCode() {
      return kind.ordinal();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class MapType extends Type {
    private final Type keyType;
    private final Type valType;

    public MapType(Type keyType, Type valType) {
      this.keyType = keyType;
      this.valType = valType;
    }

    public Type keyType() {
      return keyType;
    }

    public Type valType() {
      return valType;
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof MapType)) {
        return false;
      }
      MapType o = (MapType)other;
      return keyType.equals(o.keyType) && valType.equals(o.valType);
    }

    @Override
    public int hashCode() {
      return (Kind.MAP.ordinal() * 31 + keyType.hashCode()) * 31 +
             valType.hashCode();
    }

    @Override
    public String toString() {
      return "(Map " + keyType + ", " + valType + ")";
    }
  }

  public static class OptionType extends Type {
    private final Type elemType;

    public OptionType(Type elemType) {
      this.elemType = elemType;
    }

    public Type elemType() {
      return elemType;
    }

    @Override
    public Kind kind() {
      return Kind.OPTION;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OptionType &&
             elemType.equals(((OptionType)other).elemType);
    }

    @Override
    public int hashCode() {
      return Kind.OPTION.ordinal() * 31 + elemType.hashCode();
    }

    @Override
    public String toString() {
      return "(Option " + elemType + ")";
    }
  }

  public static class PairType extends Type {
    private final Type first;
    private final Type second;

    public PairType(Type first, Type second) {
      this.first = first;
      this.second = second;
    }

    public Type first() {
      return first;
    }

    public Type second() {
      return second;
    }

    @Override
    public Kind kind() {
      return Kind.PAIR;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof PairType)) {
        return false;
      }
      PairType o = (PairType)other;
      return first.equals(o.first) && second.equals(o.second);
    }

    @Override
    public int hashCode() {
      return (Kind.PAIR.ordinal() * 31 + first.hashCode()) * 31 +
             second.hashCode();
    }

    @Override
    public String toString() {
      return "(Pair " + first + " " + second + ")";
    }
  }

  public static class ListType extends Type {
    private final Type elemType;

    public ListType(Type elemType) {
      this.elemType = elemType;
    }

    public Type elemType() {
      return elemType;
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof ListType &&
             elemType.equals(((ListType)other).elemType);
    }

    @Override
    public int hashCode() {
      return Kind.LIST.ordinal() * 31 + elemType.hashCode();
    }

    @Override
    public String toString() {
      return "(List " + elemType + ")";
    }
  }

  public static class ByStrXType extends Type {
    private final int width;

    public ByStrXType(int width) {
      this.width = width;
    }

    /**
     * @return width in bytes
     */
    public int width() {
      return width;
    }

    @Override
    public Kind kind() {
      return Kind.BYSTRX;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof ByStrXType &&
             ((ByStrXType)other).width == width;
    }

    @Override
    public int hashCode() {
      return Kind.BYSTRX.ordinal() * 31 + width;
    }

    @Override
    public String toString() {
      return BYSTR_NAME + width;
    }
  }

  /**
   * An address together with the fields the contract or library at
   * that address is expected to have, e.g.
   * <code>ByStr20 with contract field balances : Map ByStr20 Uint128 end</code>
   */
  public static class ByStr20WithType extends Type {
    /** "contract", "library" or empty */
    private final String typeName;
    private final FieldList fields;

    public ByStr20WithType(String typeName, FieldList fields) {
      this.typeName = typeName;
      this.fields = fields;
    }

    public String typeName() {
      return typeName;
    }

    public FieldList fields() {
      return fields;
    }

    @Override
    public Kind kind() {
      return Kind.BYSTR20_WITH;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ByStr20WithType)) {
        return false;
      }
      ByStr20WithType o = (ByStr20WithType)other;
      return typeName.equals(o.typeName) && fields.equals(o.fields);
    }

    @Override
    public int hashCode() {
      return (Kind.BYSTR20_WITH.ordinal() * 31 + typeName.hashCode()) * 31 +
             fields.hashCode();
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder(BYSTR20_NAME + " with");
      if (!typeName.isEmpty()) {
        sb.append(' ').append(typeName);
      }
      if (!fields.isEmpty()) {
        sb.append(" field ");
        sb.append(StringUtils.join(fields.asList(), ", field "));
      }
      sb.append(" end");
      return sb.toString();
    }
  }

  public static class OtherType extends Type {
    private final String name;

    public OtherType(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.OTHER;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OtherType && ((OtherType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return Kind.OTHER.ordinal() * 31 + name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
