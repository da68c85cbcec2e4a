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

import com.google.common.collect.ImmutableList;

import scilla.parser.ast.AstConverting;
import scilla.parser.ast.AstNode;
import scilla.parser.ast.AstVisitor;
import scilla.parser.ast.Children;
import scilla.parser.ast.TraversalResult;
import scilla.parser.ast.TreeTraversalMode;
import scilla.parser.ast.WithMetaData;
import scilla.parser.common.exceptions.AstVisitException;

/**
 * A type expression as written in the source
 */
public abstract class NodeScillaType extends AstNode {
  public enum Kind {
    GENERIC_TYPE_WITH_ARGS,
    MAP_TYPE,
    FUNCTION_TYPE,
    POLY_FUNCTION_TYPE,
    ENCLOSED_TYPE,
    ADDRESS_TYPE,
    TYPE_VAR_TYPE,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitScillaType(mode, this);
  }

  /**
   * A named type applied to zero or more arguments,
   * e.g. <code>Uint128</code> or <code>Pair ByStr20 BNum</code>
   */
  public static class GenericTypeWithArgs extends NodeScillaType {
    private final WithMetaData<NodeMetaIdentifier> head;
    private final List<WithMetaData<NodeTypeArgument>> arguments;

    public GenericTypeWithArgs(WithMetaData<NodeMetaIdentifier> head,
                    List<WithMetaData<NodeTypeArgument>> arguments) {
      this.head = head;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public WithMetaData<NodeMetaIdentifier> head() {
      return head;
    }

    public List<WithMetaData<NodeTypeArgument>> arguments() {
      return arguments;
    }

    @Override
    public Kind kind() {
      return Kind.GENERIC_TYPE_WITH_ARGS;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(head).addAll(arguments).build();
    }
  }

  public static class MapType extends NodeScillaType {
    private final WithMetaData<NodeTypeMapKey> key;
    private final WithMetaData<NodeTypeMapValue> value;

    public MapType(WithMetaData<NodeTypeMapKey> key,
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
      return Kind.MAP_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(key, value);
    }
  }

  /** <code>A -> B</code> */
  public static class FunctionType extends NodeScillaType {
    private final WithMetaData<NodeScillaType> from;
    private final WithMetaData<NodeScillaType> to;

    public FunctionType(WithMetaData<NodeScillaType> from,
                        WithMetaData<NodeScillaType> to) {
      this.from = from;
      this.to = to;
    }

    public WithMetaData<NodeScillaType> from() {
      return from;
    }

    public WithMetaData<NodeScillaType> to() {
      return to;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(from, to);
    }
  }

  /** <code>forall 'A. T</code> */
  public static class PolyFunctionType extends NodeScillaType {
    private final String typeVariable;
    private final WithMetaData<NodeScillaType> body;

    public PolyFunctionType(String typeVariable,
                            WithMetaData<NodeScillaType> body) {
      this.typeVariable = typeVariable;
      this.body = body;
    }

    public String typeVariable() {
      return typeVariable;
    }

    public WithMetaData<NodeScillaType> body() {
      return body;
    }

    @Override
    public Kind kind() {
      return Kind.POLY_FUNCTION_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(body);
    }
  }

  public static class EnclosedType extends NodeScillaType {
    private final WithMetaData<NodeScillaType> inner;

    public EnclosedType(WithMetaData<NodeScillaType> inner) {
      this.inner = inner;
    }

    public WithMetaData<NodeScillaType> inner() {
      return inner;
    }

    @Override
    public Kind kind() {
      return Kind.ENCLOSED_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(inner);
    }
  }

  public static class AddressType extends NodeScillaType {
    private final WithMetaData<NodeAddressType> address;

    public AddressType(WithMetaData<NodeAddressType> address) {
      this.address = address;
    }

    public WithMetaData<NodeAddressType> address() {
      return address;
    }

    @Override
    public Kind kind() {
      return Kind.ADDRESS_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(address);
    }
  }

  public static class TypeVarType extends NodeScillaType {
    private final String name;

    public TypeVarType(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_VAR_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }
}
