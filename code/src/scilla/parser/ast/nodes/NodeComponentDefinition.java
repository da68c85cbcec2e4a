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

public abstract class NodeComponentDefinition extends AstNode {
  public enum Kind {
    TRANSITION_COMPONENT,
    PROCEDURE_COMPONENT,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitComponentDefinition(mode, this);
  }

  public static class TransitionComponent extends NodeComponentDefinition {
    private final WithMetaData<NodeTransitionDefinition> transition;

    public TransitionComponent(
                  WithMetaData<NodeTransitionDefinition> transition) {
      this.transition = transition;
    }

    public WithMetaData<NodeTransitionDefinition> transition() {
      return transition;
    }

    @Override
    public Kind kind() {
      return Kind.TRANSITION_COMPONENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(transition);
    }
  }

  public static class ProcedureComponent extends NodeComponentDefinition {
    private final WithMetaData<NodeProcedureDefinition> procedure;

    public ProcedureComponent(
                  WithMetaData<NodeProcedureDefinition> procedure) {
      this.procedure = procedure;
    }

    public WithMetaData<NodeProcedureDefinition> procedure() {
      return procedure;
    }

    @Override
    public Kind kind() {
      return Kind.PROCEDURE_COMPONENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(procedure);
    }
  }
}
