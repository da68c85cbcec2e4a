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

/** One constructor of a user defined type */
public abstract class NodeTypeAlternativeClause extends AstNode {
  public enum Kind {
    CLAUSE_TYPE,
    CLAUSE_TYPE_WITH_ARGS,
  }

  private final WithMetaData<NodeTypeNameIdentifier> name;

  private NodeTypeAlternativeClause(WithMetaData<NodeTypeNameIdentifier> name) {
    this.name = name;
  }

  public abstract Kind kind();

  public WithMetaData<NodeTypeNameIdentifier> name() {
    return name;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitTypeAlternativeClause(mode, this);
  }

  public static class ClauseType extends NodeTypeAlternativeClause {
    public ClauseType(WithMetaData<NodeTypeNameIdentifier> name) {
      super(name);
    }

    @Override
    public Kind kind() {
      return Kind.CLAUSE_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name());
    }
  }

  public static class ClauseTypeWithArgs extends NodeTypeAlternativeClause {
    private final List<WithMetaData<NodeTypeArgument>> typeArguments;

    public ClauseTypeWithArgs(WithMetaData<NodeTypeNameIdentifier> name,
                List<WithMetaData<NodeTypeArgument>> typeArguments) {
      super(name);
      this.typeArguments = ImmutableList.copyOf(typeArguments);
    }

    public List<WithMetaData<NodeTypeArgument>> typeArguments() {
      return typeArguments;
    }

    @Override
    public Kind kind() {
      return Kind.CLAUSE_TYPE_WITH_ARGS;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(name()).addAll(typeArguments).build();
    }
  }
}
