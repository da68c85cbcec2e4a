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
 * A statement in a transition or procedure body.  Names on the left
 * hand side are plain strings; the engine does not resolve them.
 */
public abstract class NodeStatement extends AstNode {
  public enum Kind {
    LOAD,
    REMOTE_FETCH,
    STORE,
    BIND,
    READ_FROM_BC,
    MAP_GET,
    MAP_GET_EXISTS,
    MAP_UPDATE,
    MAP_UPDATE_DELETE,
    ACCEPT,
    SEND,
    CREATE_EVNT,
    THROW,
    MATCH_STMT,
    CALL_PROC,
    ITERATE,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitStatement(mode, this);
  }

  /** <code>x <- field</code> */
  public static class Load extends NodeStatement {
    private final String leftHandSide;
    private final WithMetaData<NodeVariableIdentifier> rightHandSide;

    public Load(String leftHandSide,
                WithMetaData<NodeVariableIdentifier> rightHandSide) {
      this.leftHandSide = leftHandSide;
      this.rightHandSide = rightHandSide;
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public WithMetaData<NodeVariableIdentifier> rightHandSide() {
      return rightHandSide;
    }

    @Override
    public Kind kind() {
      return Kind.LOAD;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(rightHandSide);
    }
  }

  public static class RemoteFetch extends NodeStatement {
    private final WithMetaData<NodeRemoteFetchStatement> fetch;

    public RemoteFetch(WithMetaData<NodeRemoteFetchStatement> fetch) {
      this.fetch = fetch;
    }

    public WithMetaData<NodeRemoteFetchStatement> fetch() {
      return fetch;
    }

    @Override
    public Kind kind() {
      return Kind.REMOTE_FETCH;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(fetch);
    }
  }

  /** <code>field := x</code> */
  public static class Store extends NodeStatement {
    private final String leftHandSide;
    private final WithMetaData<NodeVariableIdentifier> rightHandSide;

    public Store(String leftHandSide,
                 WithMetaData<NodeVariableIdentifier> rightHandSide) {
      this.leftHandSide = leftHandSide;
      this.rightHandSide = rightHandSide;
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public WithMetaData<NodeVariableIdentifier> rightHandSide() {
      return rightHandSide;
    }

    @Override
    public Kind kind() {
      return Kind.STORE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(rightHandSide);
    }
  }

  /** <code>x = expression</code> */
  public static class Bind extends NodeStatement {
    private final String leftHandSide;
    private final WithMetaData<NodeFullExpression> rightHandSide;

    public Bind(String leftHandSide,
                WithMetaData<NodeFullExpression> rightHandSide) {
      this.leftHandSide = leftHandSide;
      this.rightHandSide = rightHandSide;
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public WithMetaData<NodeFullExpression> rightHandSide() {
      return rightHandSide;
    }

    @Override
    public Kind kind() {
      return Kind.BIND;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(rightHandSide);
    }
  }

  /** <code>x <- & BLOCKNUMBER</code> */
  public static class ReadFromBC extends NodeStatement {
    private final String leftHandSide;
    private final WithMetaData<NodeTypeNameIdentifier> typeName;
    private final WithMetaData<NodeBlockchainFetchArguments> arguments;

    /**
     * @param arguments null if absent
     */
    public ReadFromBC(String leftHandSide,
                WithMetaData<NodeTypeNameIdentifier> typeName,
                WithMetaData<NodeBlockchainFetchArguments> arguments) {
      this.leftHandSide = leftHandSide;
      this.typeName = typeName;
      this.arguments = arguments;
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public WithMetaData<NodeTypeNameIdentifier> typeName() {
      return typeName;
    }

    public WithMetaData<NodeBlockchainFetchArguments> arguments() {
      return arguments;
    }

    @Override
    public Kind kind() {
      return Kind.READ_FROM_BC;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(typeName, arguments);
    }
  }

  public abstract static class MapRead extends NodeStatement {
    private final String leftHandSide;
    private final List<WithMetaData<NodeMapAccess>> keys;
    private final String rightHandSide;

    private MapRead(String leftHandSide,
                    List<WithMetaData<NodeMapAccess>> keys,
                    String rightHandSide) {
      this.leftHandSide = leftHandSide;
      this.keys = ImmutableList.copyOf(keys);
      this.rightHandSide = rightHandSide;
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public List<WithMetaData<NodeMapAccess>> keys() {
      return keys;
    }

    /**
     * @return name of the map field
     */
    public String rightHandSide() {
      return rightHandSide;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().addAll(keys).build();
    }
  }

  /** <code>x <- m[k1][k2]</code> */
  public static class MapGet extends MapRead {
    public MapGet(String leftHandSide,
                  List<WithMetaData<NodeMapAccess>> keys,
                  String rightHandSide) {
      super(leftHandSide, keys, rightHandSide);
    }

    @Override
    public Kind kind() {
      return Kind.MAP_GET;
    }
  }

  /** <code>x <- exists m[k]</code> */
  public static class MapGetExists extends MapRead {
    public MapGetExists(String leftHandSide,
                        List<WithMetaData<NodeMapAccess>> keys,
                        String rightHandSide) {
      super(leftHandSide, keys, rightHandSide);
    }

    @Override
    public Kind kind() {
      return Kind.MAP_GET_EXISTS;
    }
  }

  /** <code>m[k] := v</code> */
  public static class MapUpdate extends NodeStatement {
    private final String leftHandSide;
    private final List<WithMetaData<NodeMapAccess>> keys;
    private final WithMetaData<NodeVariableIdentifier> rightHandSide;

    public MapUpdate(String leftHandSide,
                     List<WithMetaData<NodeMapAccess>> keys,
                     WithMetaData<NodeVariableIdentifier> rightHandSide) {
      this.leftHandSide = leftHandSide;
      this.keys = ImmutableList.copyOf(keys);
      this.rightHandSide = rightHandSide;
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public List<WithMetaData<NodeMapAccess>> keys() {
      return keys;
    }

    public WithMetaData<NodeVariableIdentifier> rightHandSide() {
      return rightHandSide;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_UPDATE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().addAll(keys).add(rightHandSide).build();
    }
  }

  /** <code>delete m[k]</code> */
  public static class MapUpdateDelete extends NodeStatement {
    private final String leftHandSide;
    private final List<WithMetaData<NodeMapAccess>> keys;

    public MapUpdateDelete(String leftHandSide,
                           List<WithMetaData<NodeMapAccess>> keys) {
      this.leftHandSide = leftHandSide;
      this.keys = ImmutableList.copyOf(keys);
    }

    public String leftHandSide() {
      return leftHandSide;
    }

    public List<WithMetaData<NodeMapAccess>> keys() {
      return keys;
    }

    @Override
    public Kind kind() {
      return Kind.MAP_UPDATE_DELETE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().addAll(keys).build();
    }
  }

  public static class Accept extends NodeStatement {
    @Override
    public Kind kind() {
      return Kind.ACCEPT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class Send extends NodeStatement {
    private final WithMetaData<NodeVariableIdentifier> identifierName;

    public Send(WithMetaData<NodeVariableIdentifier> identifierName) {
      this.identifierName = identifierName;
    }

    public WithMetaData<NodeVariableIdentifier> identifierName() {
      return identifierName;
    }

    @Override
    public Kind kind() {
      return Kind.SEND;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(identifierName);
    }
  }

  public static class CreateEvnt extends NodeStatement {
    private final WithMetaData<NodeVariableIdentifier> identifierName;

    public CreateEvnt(WithMetaData<NodeVariableIdentifier> identifierName) {
      this.identifierName = identifierName;
    }

    public WithMetaData<NodeVariableIdentifier> identifierName() {
      return identifierName;
    }

    @Override
    public Kind kind() {
      return Kind.CREATE_EVNT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(identifierName);
    }
  }

  public static class Throw extends NodeStatement {
    private final WithMetaData<NodeVariableIdentifier> errorVariable;

    /**
     * @param errorVariable null for a bare throw
     */
    public Throw(WithMetaData<NodeVariableIdentifier> errorVariable) {
      this.errorVariable = errorVariable;
    }

    public WithMetaData<NodeVariableIdentifier> errorVariable() {
      return errorVariable;
    }

    @Override
    public Kind kind() {
      return Kind.THROW;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(errorVariable);
    }
  }

  public static class MatchStmt extends NodeStatement {
    private final WithMetaData<NodeVariableIdentifier> variable;
    private final List<WithMetaData<NodePatternMatchClause>> clauses;

    public MatchStmt(WithMetaData<NodeVariableIdentifier> variable,
                     List<WithMetaData<NodePatternMatchClause>> clauses) {
      this.variable = variable;
      this.clauses = ImmutableList.copyOf(clauses);
    }

    public WithMetaData<NodeVariableIdentifier> variable() {
      return variable;
    }

    public List<WithMetaData<NodePatternMatchClause>> clauses() {
      return clauses;
    }

    @Override
    public Kind kind() {
      return Kind.MATCH_STMT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(variable).addAll(clauses).build();
    }
  }

  public static class CallProc extends NodeStatement {
    private final WithMetaData<NodeComponentId> componentId;
    private final List<WithMetaData<NodeVariableIdentifier>> arguments;

    public CallProc(WithMetaData<NodeComponentId> componentId,
                    List<WithMetaData<NodeVariableIdentifier>> arguments) {
      this.componentId = componentId;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public WithMetaData<NodeComponentId> componentId() {
      return componentId;
    }

    public List<WithMetaData<NodeVariableIdentifier>> arguments() {
      return arguments;
    }

    @Override
    public Kind kind() {
      return Kind.CALL_PROC;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(componentId).addAll(arguments).build();
    }
  }

  /** <code>forall list proc</code> */
  public static class Iterate extends NodeStatement {
    private final WithMetaData<NodeVariableIdentifier> identifierName;
    private final WithMetaData<NodeComponentId> componentId;

    public Iterate(WithMetaData<NodeVariableIdentifier> identifierName,
                   WithMetaData<NodeComponentId> componentId) {
      this.identifierName = identifierName;
      this.componentId = componentId;
    }

    public WithMetaData<NodeVariableIdentifier> identifierName() {
      return identifierName;
    }

    public WithMetaData<NodeComponentId> componentId() {
      return componentId;
    }

    @Override
    public Kind kind() {
      return Kind.ITERATE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(identifierName, componentId);
    }
  }
}
