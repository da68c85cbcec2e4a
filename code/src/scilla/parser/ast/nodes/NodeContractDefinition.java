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

public class NodeContractDefinition extends AstNode {
  private final WithMetaData<NodeTypeNameIdentifier> contractName;
  private final WithMetaData<NodeComponentParameters> parameters;
  private final WithMetaData<NodeWithConstraint> constraint;
  private final List<WithMetaData<NodeContractField>> fields;
  private final List<WithMetaData<NodeComponentDefinition>> components;

  /**
   * @param constraint null if absent
   */
  public NodeContractDefinition(
              WithMetaData<NodeTypeNameIdentifier> contractName,
              WithMetaData<NodeComponentParameters> parameters,
              WithMetaData<NodeWithConstraint> constraint,
              List<WithMetaData<NodeContractField>> fields,
              List<WithMetaData<NodeComponentDefinition>> components) {
    this.contractName = contractName;
    this.parameters = parameters;
    this.constraint = constraint;
    this.fields = ImmutableList.copyOf(fields);
    this.components = ImmutableList.copyOf(components);
  }

  public WithMetaData<NodeTypeNameIdentifier> contractName() {
    return contractName;
  }

  public WithMetaData<NodeComponentParameters> parameters() {
    return parameters;
  }

  public WithMetaData<NodeWithConstraint> constraint() {
    return constraint;
  }

  public List<WithMetaData<NodeContractField>> fields() {
    return fields;
  }

  public List<WithMetaData<NodeComponentDefinition>> components() {
    return components;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitContractDefinition(mode, this);
  }

  /**
   * Parameters, constraint, fields, then components.  The contract name
   * is read by backends on entry.
   */
  @Override
  protected List<AstVisitor> children() {
    return Children.start().add(parameters).add(constraint)
                   .addAll(fields).addAll(components).build();
  }
}
