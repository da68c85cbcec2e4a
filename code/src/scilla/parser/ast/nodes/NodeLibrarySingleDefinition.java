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

public abstract class NodeLibrarySingleDefinition extends AstNode {
  public enum Kind {
    LET_DEFINITION,
    TYPE_DEFINITION,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitLibrarySingleDefinition(mode, this);
  }

  /** <code>let x : T = e</code> */
  public static class LetDefinition extends NodeLibrarySingleDefinition {
    private final String variableName;
    private final WithMetaData<NodeTypeAnnotation> typeAnnotation;
    private final WithMetaData<NodeFullExpression> expression;

    /**
     * @param typeAnnotation null if absent
     */
    public LetDefinition(String variableName,
                         WithMetaData<NodeTypeAnnotation> typeAnnotation,
                         WithMetaData<NodeFullExpression> expression) {
      this.variableName = variableName;
      this.typeAnnotation = typeAnnotation;
      this.expression = expression;
    }

    public String variableName() {
      return variableName;
    }

    public WithMetaData<NodeTypeAnnotation> typeAnnotation() {
      return typeAnnotation;
    }

    public WithMetaData<NodeFullExpression> expression() {
      return expression;
    }

    @Override
    public Kind kind() {
      return Kind.LET_DEFINITION;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(typeAnnotation, expression);
    }
  }

  /** <code>type T = | A | B of Uint32</code> */
  public static class TypeDefinition extends NodeLibrarySingleDefinition {
    private final WithMetaData<NodeTypeNameIdentifier> name;
    private final List<WithMetaData<NodeTypeAlternativeClause>> clauses;

    public TypeDefinition(WithMetaData<NodeTypeNameIdentifier> name,
              List<WithMetaData<NodeTypeAlternativeClause>> clauses) {
      this.name = name;
      this.clauses = ImmutableList.copyOf(clauses);
    }

    public WithMetaData<NodeTypeNameIdentifier> name() {
      return name;
    }

    public List<WithMetaData<NodeTypeAlternativeClause>> clauses() {
      return clauses;
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_DEFINITION;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(name).addAll(clauses).build();
    }
  }
}
