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

public abstract class NodeAtomicExpression extends AstNode {
  public enum Kind {
    ATOMIC_SID,
    ATOMIC_LIT,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitAtomicExpression(mode, this);
  }

  public static class AtomicSid extends NodeAtomicExpression {
    private final WithMetaData<NodeVariableIdentifier> variable;

    public AtomicSid(WithMetaData<NodeVariableIdentifier> variable) {
      this.variable = variable;
    }

    public WithMetaData<NodeVariableIdentifier> variable() {
      return variable;
    }

    @Override
    public Kind kind() {
      return Kind.ATOMIC_SID;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(variable);
    }
  }

  public static class AtomicLit extends NodeAtomicExpression {
    private final WithMetaData<NodeValueLiteral> literal;

    public AtomicLit(WithMetaData<NodeValueLiteral> literal) {
      this.literal = literal;
    }

    public WithMetaData<NodeValueLiteral> literal() {
      return literal;
    }

    @Override
    public Kind kind() {
      return Kind.ATOMIC_LIT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(literal);
    }
  }
}
