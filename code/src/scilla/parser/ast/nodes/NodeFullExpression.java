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
 * An expression.  Expressions appear in library definitions, field
 * initializers, contract constraints and bind statements.
 */
public abstract class NodeFullExpression extends AstNode {
  public enum Kind {
    LOCAL_VARIABLE_DECLARATION,
    FUNCTION_DECLARATION,
    FUNCTION_CALL,
    EXPRESSION_ATOMIC,
    EXPRESSION_BUILTIN,
    MESSAGE,
    MATCH,
    CONSTRUCTOR_CALL,
    TEMPLATE_FUNCTION,
    T_APP,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitFullExpression(mode, this);
  }

  /** <code>let x : T = e1 in e2</code> */
  public static class LocalVariableDeclaration extends NodeFullExpression {
    private final String identifierName;
    private final WithMetaData<NodeTypeAnnotation> typeAnnotation;
    private final WithMetaData<NodeFullExpression> expression;
    private final WithMetaData<NodeFullExpression> containingExpression;

    /**
     * @param typeAnnotation null if absent
     */
    public LocalVariableDeclaration(String identifierName,
                WithMetaData<NodeTypeAnnotation> typeAnnotation,
                WithMetaData<NodeFullExpression> expression,
                WithMetaData<NodeFullExpression> containingExpression) {
      this.identifierName = identifierName;
      this.typeAnnotation = typeAnnotation;
      this.expression = expression;
      this.containingExpression = containingExpression;
    }

    public String identifierName() {
      return identifierName;
    }

    public WithMetaData<NodeTypeAnnotation> typeAnnotation() {
      return typeAnnotation;
    }

    public WithMetaData<NodeFullExpression> expression() {
      return expression;
    }

    public WithMetaData<NodeFullExpression> containingExpression() {
      return containingExpression;
    }

    @Override
    public Kind kind() {
      return Kind.LOCAL_VARIABLE_DECLARATION;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(typeAnnotation, expression, containingExpression);
    }
  }

  /** <code>fun (x : T) => e</code> */
  public static class FunctionDeclaration extends NodeFullExpression {
    private final WithMetaData<NodeTypedIdentifier> identifier;
    private final WithMetaData<NodeFullExpression> expression;

    public FunctionDeclaration(WithMetaData<NodeTypedIdentifier> identifier,
                               WithMetaData<NodeFullExpression> expression) {
      this.identifier = identifier;
      this.expression = expression;
    }

    public WithMetaData<NodeTypedIdentifier> identifier() {
      return identifier;
    }

    public WithMetaData<NodeFullExpression> expression() {
      return expression;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_DECLARATION;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(identifier, expression);
    }
  }

  public static class FunctionCall extends NodeFullExpression {
    private final WithMetaData<NodeVariableIdentifier> functionName;
    private final List<WithMetaData<NodeVariableIdentifier>> argumentList;

    public FunctionCall(WithMetaData<NodeVariableIdentifier> functionName,
                List<WithMetaData<NodeVariableIdentifier>> argumentList) {
      this.functionName = functionName;
      this.argumentList = ImmutableList.copyOf(argumentList);
    }

    public WithMetaData<NodeVariableIdentifier> functionName() {
      return functionName;
    }

    public List<WithMetaData<NodeVariableIdentifier>> argumentList() {
      return argumentList;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_CALL;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(functionName).addAll(argumentList).build();
    }
  }

  public static class ExpressionAtomic extends NodeFullExpression {
    private final WithMetaData<NodeAtomicExpression> atomic;

    public ExpressionAtomic(WithMetaData<NodeAtomicExpression> atomic) {
      this.atomic = atomic;
    }

    public WithMetaData<NodeAtomicExpression> atomic() {
      return atomic;
    }

    @Override
    public Kind kind() {
      return Kind.EXPRESSION_ATOMIC;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(atomic);
    }
  }

  /** <code>builtin add a b</code> */
  public static class ExpressionBuiltin extends NodeFullExpression {
    private final String builtinName;
    private final WithMetaData<NodeContractTypeArguments> typeArguments;
    private final WithMetaData<NodeBuiltinArguments> arguments;

    /**
     * @param typeArguments null if absent
     */
    public ExpressionBuiltin(String builtinName,
                  WithMetaData<NodeContractTypeArguments> typeArguments,
                  WithMetaData<NodeBuiltinArguments> arguments) {
      this.builtinName = builtinName;
      this.typeArguments = typeArguments;
      this.arguments = arguments;
    }

    public String builtinName() {
      return builtinName;
    }

    public WithMetaData<NodeContractTypeArguments> typeArguments() {
      return typeArguments;
    }

    public WithMetaData<NodeBuiltinArguments> arguments() {
      return arguments;
    }

    @Override
    public Kind kind() {
      return Kind.EXPRESSION_BUILTIN;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(typeArguments, arguments);
    }
  }

  /** <code>{ _tag : "x"; _amount : amt }</code> */
  public static class Message extends NodeFullExpression {
    private final List<WithMetaData<NodeMessageEntry>> entries;

    public Message(List<WithMetaData<NodeMessageEntry>> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }

    public List<WithMetaData<NodeMessageEntry>> entries() {
      return entries;
    }

    @Override
    public Kind kind() {
      return Kind.MESSAGE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().addAll(entries).build();
    }
  }

  public static class Match extends NodeFullExpression {
    private final WithMetaData<NodeVariableIdentifier> matchExpression;
    private final List<WithMetaData<NodePatternMatchExpressionClause>> clauses;

    public Match(WithMetaData<NodeVariableIdentifier> matchExpression,
        List<WithMetaData<NodePatternMatchExpressionClause>> clauses) {
      this.matchExpression = matchExpression;
      this.clauses = ImmutableList.copyOf(clauses);
    }

    public WithMetaData<NodeVariableIdentifier> matchExpression() {
      return matchExpression;
    }

    public List<WithMetaData<NodePatternMatchExpressionClause>> clauses() {
      return clauses;
    }

    @Override
    public Kind kind() {
      return Kind.MATCH;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(matchExpression).addAll(clauses).build();
    }
  }

  /** e.g. <code>Some {Uint32} x</code> or <code>True</code> */
  public static class ConstructorCall extends NodeFullExpression {
    private final WithMetaData<NodeMetaIdentifier> identifierName;
    private final WithMetaData<NodeContractTypeArguments> typeArguments;
    private final List<WithMetaData<NodeVariableIdentifier>> argumentList;

    /**
     * @param typeArguments null if absent
     */
    public ConstructorCall(WithMetaData<NodeMetaIdentifier> identifierName,
                WithMetaData<NodeContractTypeArguments> typeArguments,
                List<WithMetaData<NodeVariableIdentifier>> argumentList) {
      this.identifierName = identifierName;
      this.typeArguments = typeArguments;
      this.argumentList = ImmutableList.copyOf(argumentList);
    }

    public WithMetaData<NodeMetaIdentifier> identifierName() {
      return identifierName;
    }

    public WithMetaData<NodeContractTypeArguments> typeArguments() {
      return typeArguments;
    }

    public List<WithMetaData<NodeVariableIdentifier>> argumentList() {
      return argumentList;
    }

    @Override
    public Kind kind() {
      return Kind.CONSTRUCTOR_CALL;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(identifierName).add(typeArguments)
                             .addAll(argumentList).build();
    }
  }

  /** <code>tfun 'A => e</code> */
  public static class TemplateFunction extends NodeFullExpression {
    private final String identifierName;
    private final WithMetaData<NodeFullExpression> expression;

    public TemplateFunction(String identifierName,
                            WithMetaData<NodeFullExpression> expression) {
      this.identifierName = identifierName;
      this.expression = expression;
    }

    public String identifierName() {
      return identifierName;
    }

    public WithMetaData<NodeFullExpression> expression() {
      return expression;
    }

    @Override
    public Kind kind() {
      return Kind.TEMPLATE_FUNCTION;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(expression);
    }
  }

  /** Type application: <code>@f Uint32</code> */
  public static class TApp extends NodeFullExpression {
    private final WithMetaData<NodeVariableIdentifier> identifierName;
    private final List<WithMetaData<NodeTypeArgument>> typeArguments;

    public TApp(WithMetaData<NodeVariableIdentifier> identifierName,
                List<WithMetaData<NodeTypeArgument>> typeArguments) {
      this.identifierName = identifierName;
      this.typeArguments = ImmutableList.copyOf(typeArguments);
    }

    public WithMetaData<NodeVariableIdentifier> identifierName() {
      return identifierName;
    }

    public List<WithMetaData<NodeTypeArgument>> typeArguments() {
      return typeArguments;
    }

    @Override
    public Kind kind() {
      return Kind.T_APP;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(identifierName).addAll(typeArguments)
                             .build();
    }
  }
}
