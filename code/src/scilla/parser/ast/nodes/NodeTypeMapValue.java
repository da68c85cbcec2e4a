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
package scilla.parser.ast.nodes;

import java.util.List;

import scilla.parser.ast.AstConverting;
import scilla.parser.ast.AstNode;
import scilla.parser.ast.AstVisitor;
import scilla.parser.ast.Children;
import scilla.parser.ast.TraversalResult;
import scilla.parser.ast.TreeTraversalMode;
import scilla.parser.ast.WithMetaData;
import scilla.parser.common.exceptions.AstVisitException;

public abstract class NodeTypeMapValue extends AstNode {
  public enum Kind {
    MAP_VALUE_TYPE_OR_ENUM_LIKE_IDENTIFIER,
    MAP_KEY_VALUE,
    MAP_VALUE_PARENTHESIZED_TYPE,
    MAP_VALUE_ADDRESS_TYPE,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitTypeMapValue(mode, this);
  }

  public static class MapValueTypeOrEnumLikeIdentifier extends NodeTypeMapValue {
    private final WithMetaData<NodeMetaIdentifier> name;

    public MapValueTypeOrEnumLikeIdentifier(
                        WithMetaData<NodeMetaIdentifier> name) {
      this.name = name;
    }

    public WithMetaData<NodeMetaIdentifier> name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_VALUE_TYPE_OR_ENUM_LIKE_IDENTIFIER;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name);
    }
  }

  /** A nested map: <code>Map K1 (Map K2 V)</code> without parentheses */
  public static class MapKeyValue extends NodeTypeMapValue {
    private final WithMetaData<NodeTypeMapEntry> entry;

    public MapKeyValue(WithMetaData<NodeTypeMapEntry> entry) {
      this.entry = entry;
    }

    public WithMetaData<NodeTypeMapEntry> entry() {
      return entry;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_KEY_VALUE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(entry);
    }
  }

  public static class MapValueParenthesizedType extends NodeTypeMapValue {
    private final WithMetaData<NodeScillaType> type;

    public MapValueParenthesizedType(WithMetaData<NodeScillaType> type) {
      this.type = type;
    }

    public WithMetaData<NodeScillaType> type() {
      return type;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_VALUE_PARENTHESIZED_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(type);
    }
  }

  public static class MapValueAddressType extends NodeTypeMapValue {
    private final WithMetaData<NodeAddressType> address;

    public MapValueAddressType(WithMetaData<NodeAddressType> address) {
      this.address = address;
    }

    public WithMetaData<NodeAddressType> address() {
      return address;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_VALUE_ADDRESS_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(address);
    }
  }
}
