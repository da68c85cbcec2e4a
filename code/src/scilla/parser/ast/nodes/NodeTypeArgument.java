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
 * Argument of a type application, e.g. the <code>Uint32</code> in
 * <code>Option Uint32</code>
 */
public abstract class NodeTypeArgument extends AstNode {
  public enum Kind {
    ENCLOSED_TYPE_ARGUMENT,
    GENERIC_TYPE_ARGUMENT,
    TEMPLATE_TYPE_ARGUMENT,
    ADDRESS_TYPE_ARGUMENT,
    MAP_TYPE_ARGUMENT,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitTypeArgument(mode, this);
  }

  public static class EnclosedTypeArgument extends NodeTypeArgument {
    private final WithMetaData<NodeScillaType> type;

    public EnclosedTypeArgument(WithMetaData<NodeScillaType> type) {
      this.type = type;
    }

    public WithMetaData<NodeScillaType> type() {
      return type;
    }

    @Override
    public Kind kind() {
      return Kind.ENCLOSED_TYPE_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(type);
    }
  }

  public static class GenericTypeArgument extends NodeTypeArgument {
    private final WithMetaData<NodeMetaIdentifier> name;

    public GenericTypeArgument(WithMetaData<NodeMetaIdentifier> name) {
      this.name = name;
    }

    public WithMetaData<NodeMetaIdentifier> name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.GENERIC_TYPE_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name);
    }
  }

  /** A type variable such as <code>'A</code> */
  public static class TemplateTypeArgument extends NodeTypeArgument {
    private final String name;

    public TemplateTypeArgument(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.TEMPLATE_TYPE_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class AddressTypeArgument extends NodeTypeArgument {
    private final WithMetaData<NodeAddressType> address;

    public AddressTypeArgument(WithMetaData<NodeAddressType> address) {
      this.address = address;
    }

    public WithMetaData<NodeAddressType> address() {
      return address;
    }

    @Override
    public Kind kind() {
      return Kind.ADDRESS_TYPE_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(address);
    }
  }

  public static class MapTypeArgument extends NodeTypeArgument {
    private final WithMetaData<NodeTypeMapKey> key;
    private final WithMetaData<NodeTypeMapValue> value;

    public MapTypeArgument(WithMetaData<NodeTypeMapKey> key,
                           WithMetaData<NodeTypeMapValue> value) {
      this.key = key;
      this.value = value;
    }

    public WithMetaData<NodeTypeMapKey> key() {
      return key;
    }

    public WithMetaData<NodeTypeMapValue> value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_TYPE_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(key, value);
    }
  }
}
