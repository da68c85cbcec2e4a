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
 * An address type with an interface,
 * e.g. <code>ByStr20 with contract field f : Uint128 end</code>
 */
public class NodeAddressType extends AstNode {
  /** Address kind word */
  public static final String CONTRACT = "contract";
  public static final String LIBRARY = "library";

  private final WithMetaData<NodeTypeNameIdentifier> identifier;
  private final String typeName;
  private final List<WithMetaData<NodeAddressTypeField>> addressFields;

  /**
   * @param typeName "contract", "library" or "" if no kind word given
   */
  public NodeAddressType(WithMetaData<NodeTypeNameIdentifier> identifier,
               String typeName,
               List<WithMetaData<NodeAddressTypeField>> addressFields) {
    this.identifier = identifier;
    this.typeName = typeName;
    this.addressFields = ImmutableList.copyOf(addressFields);
  }

  public WithMetaData<NodeTypeNameIdentifier> identifier() {
    return identifier;
  }

  public String typeName() {
    return typeName;
  }

  public List<WithMetaData<NodeAddressTypeField>> addressFields() {
    return addressFields;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitAddressType(mode, this);
  }

  @Override
  protected List<AstVisitor> children() {
    return Children.start().add(identifier).addAll(addressFields).build();
  }
}
