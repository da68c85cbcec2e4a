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
 * A transition: part of the callable surface of the contract
 */
public class NodeTransitionDefinition extends AstNode {
  private final WithMetaData<NodeComponentId> name;
  private final WithMetaData<NodeComponentParameters> parameters;
  private final WithMetaData<NodeComponentBody> body;

  public NodeTransitionDefinition(WithMetaData<NodeComponentId> name,
                  WithMetaData<NodeComponentParameters> parameters,
                  WithMetaData<NodeComponentBody> body) {
    this.name = name;
    this.parameters = parameters;
    this.body = body;
  }

  public WithMetaData<NodeComponentId> name() {
    return name;
  }

  public WithMetaData<NodeComponentParameters> parameters() {
    return parameters;
  }

  public WithMetaData<NodeComponentBody> body() {
    return body;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitTransitionDefinition(mode, this);
  }

  @Override
  protected List<AstVisitor> children() {
    return Children.of(name, parameters, body);
  }
}
