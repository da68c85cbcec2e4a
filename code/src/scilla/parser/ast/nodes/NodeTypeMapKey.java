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

/**
 * Key type of a map.  Only type names and address types may be keys.
 */
public abstract class NodeTypeMapKey extends AstNode {
  public enum Kind {
    GENERIC_MAP_KEY,
    ENCLOSED_GENERIC_ID,
    ENCLOSED_ADDRESS_MAP_KEY_TYPE,
    ADDRESS_MAP_KEY_TYPE,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitTypeMapKey(mode, this);
  }

  public abstract static class MetaKey extends NodeTypeMapKey {
    private final WithMetaData<NodeMetaIdentifier> name;

    private MetaKey(WithMetaData<NodeMetaIdentifier> name) {
      this.name = name;
    }

    public WithMetaData<NodeMetaIdentifier> name() {
      return name;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name);
    }
  }

  public abstract static class AddressKey extends NodeTypeMapKey {
    private final WithMetaData<NodeAddressType> address;

    private AddressKey(WithMetaData<NodeAddressType> address) {
      this.address = address;
    }

    public WithMetaData<NodeAddressType> address() {
      return address;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(address);
    }
  }

  /** e.g. <code>Map ByStr20 ...</code> */
  public static class GenericMapKey extends MetaKey {
    public GenericMapKey(WithMetaData<NodeMetaIdentifier> name) {
      super(name);
    }

    @Override
    public Kind kind() {
      return Kind.GENERIC_MAP_KEY;
    }
  }

  /** e.g. <code>Map (ByStr20) ...</code> */
  public static class EnclosedGenericId extends MetaKey {
    public EnclosedGenericId(WithMetaData<NodeMetaIdentifier> name) {
      super(name);
    }

    @Override
    public Kind kind() {
      return Kind.ENCLOSED_GENERIC_ID;
    }
  }

  public static class EnclosedAddressMapKeyType extends AddressKey {
    public EnclosedAddressMapKeyType(WithMetaData<NodeAddressType> address) {
      super(address);
    }

    @Override
    public Kind kind() {
      return Kind.ENCLOSED_ADDRESS_MAP_KEY_TYPE;
    }
  }

  public static class AddressMapKeyType extends AddressKey {
    public AddressMapKeyType(WithMetaData<NodeAddressType> address) {
      super(address);
    }

    @Override
    public Kind kind() {
      return Kind.ADDRESS_MAP_KEY_TYPE;
    }
  }
}
