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
package scilla.parser.ast;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import scilla.parser.ast.nodes.NodeAddressType;
import scilla.parser.ast.nodes.NodeAddressTypeField;
import scilla.parser.ast.nodes.NodeArgumentPattern;
import scilla.parser.ast.nodes.NodeAtomicExpression;
import scilla.parser.ast.nodes.NodeBlockchainFetchArguments;
import scilla.parser.ast.nodes.NodeBuiltinArguments;
import scilla.parser.ast.nodes.NodeByteStr;
import scilla.parser.ast.nodes.NodeComponentBody;
import scilla.parser.ast.nodes.NodeComponentDefinition;
import scilla.parser.ast.nodes.NodeComponentId;
import scilla.parser.ast.nodes.NodeComponentParameters;
import scilla.parser.ast.nodes.NodeContractDefinition;
import scilla.parser.ast.nodes.NodeContractField;
import scilla.parser.ast.nodes.NodeContractTypeArguments;
import scilla.parser.ast.nodes.NodeFullExpression;
import scilla.parser.ast.nodes.NodeImportDeclarations;
import scilla.parser.ast.nodes.NodeImportedName;
import scilla.parser.ast.nodes.NodeLibraryDefinition;
import scilla.parser.ast.nodes.NodeLibrarySingleDefinition;
import scilla.parser.ast.nodes.NodeMapAccess;
import scilla.parser.ast.nodes.NodeMessageEntry;
import scilla.parser.ast.nodes.NodeMetaIdentifier;
import scilla.parser.ast.nodes.NodeParameterPair;
import scilla.parser.ast.nodes.NodePattern;
import scilla.parser.ast.nodes.NodePatternMatchClause;
import scilla.parser.ast.nodes.NodePatternMatchExpressionClause;
import scilla.parser.ast.nodes.NodeProcedureDefinition;
import scilla.parser.ast.nodes.NodeProgram;
import scilla.parser.ast.nodes.NodeRemoteFetchStatement;
import scilla.parser.ast.nodes.NodeScillaType;
import scilla.parser.ast.nodes.NodeStatement;
import scilla.parser.ast.nodes.NodeStatementBlock;
import scilla.parser.ast.nodes.NodeTransitionDefinition;
import scilla.parser.ast.nodes.NodeTypeAlternativeClause;
import scilla.parser.ast.nodes.NodeTypeAnnotation;
import scilla.parser.ast.nodes.NodeTypeArgument;
import scilla.parser.ast.nodes.NodeTypeMapEntry;
import scilla.parser.ast.nodes.NodeTypeMapKey;
import scilla.parser.ast.nodes.NodeTypeMapValue;
import scilla.parser.ast.nodes.NodeTypeNameIdentifier;
import scilla.parser.ast.nodes.NodeTypedIdentifier;
import scilla.parser.ast.nodes.NodeValueLiteral;
import scilla.parser.ast.nodes.NodeVariableIdentifier;
import scilla.parser.ast.nodes.NodeWithConstraint;
import scilla.parser.common.exceptions.AstVisitException;

/**
 * Backend that records every hook call as "ENTER Kind" or "EXIT Kind".
 * Node kinds can be configured to skip their children, to stop the
 * walk on exit or to fail.
 */
public class RecordingEmitter implements AstConverting {

  public final List<String> calls = new ArrayList<String>();

  private final Set<String> skip = new HashSet<String>();
  private final Set<String> stopOnExit = new HashSet<String>();
  private String failOn = null;
  private TreeTraversalMode failMode = null;

  private int depth = 0;
  private int maxDepth = 0;
  public final List<SourcePosition> starts = new ArrayList<SourcePosition>();

  public RecordingEmitter skip(String kind) {
    skip.add(kind);
    return this;
  }

  /** Return SKIP_CHILDREN from the exit hook of this kind */
  public RecordingEmitter stopOnExit(String kind) {
    stopOnExit.add(kind);
    return this;
  }

  public RecordingEmitter failOn(String kind, TreeTraversalMode mode) {
    this.failOn = kind;
    this.failMode = mode;
    return this;
  }

  /** Outstanding position pushes */
  public int positionDepth() {
    return depth;
  }

  public int maxPositionDepth() {
    return maxDepth;
  }

  public int count(String call) {
    int n = 0;
    for (String c: calls) {
      if (c.equals(call)) {
        n++;
      }
    }
    return n;
  }

  private TraversalResult record(String kind, TreeTraversalMode mode)
                                          throws AstVisitException {
    calls.add(mode + " " + kind);
    if (kind.equals(failOn) && mode == failMode) {
      throw new AstVisitException("failing on " + mode + " " + kind);
    }
    if (mode == TreeTraversalMode.ENTER && skip.contains(kind)) {
      return TraversalResult.SKIP_CHILDREN;
    }
    if (mode == TreeTraversalMode.EXIT && stopOnExit.contains(kind)) {
      return TraversalResult.SKIP_CHILDREN;
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public void pushSourcePosition(SourcePosition start, SourcePosition end) {
    depth++;
    maxDepth = Math.max(depth, maxDepth);
    starts.add(start);
  }

  @Override
  public void popSourcePosition() {
    depth--;
  }

  @Override
  public TraversalResult emitByteStr(TreeTraversalMode mode, NodeByteStr node)
                                          throws AstVisitException {
    return record("ByteStr", mode);
  }

  @Override
  public TraversalResult emitTypeNameIdentifier(TreeTraversalMode mode, NodeTypeNameIdentifier node)
                                          throws AstVisitException {
    return record("TypeNameIdentifier", mode);
  }

  @Override
  public TraversalResult emitImportedName(TreeTraversalMode mode, NodeImportedName node)
                                          throws AstVisitException {
    return record("ImportedName", mode);
  }

  @Override
  public TraversalResult emitImportDeclarations(TreeTraversalMode mode, NodeImportDeclarations node)
                                          throws AstVisitException {
    return record("ImportDeclarations", mode);
  }

  @Override
  public TraversalResult emitMetaIdentifier(TreeTraversalMode mode, NodeMetaIdentifier node)
                                          throws AstVisitException {
    return record("MetaIdentifier", mode);
  }

  @Override
  public TraversalResult emitVariableIdentifier(TreeTraversalMode mode, NodeVariableIdentifier node)
                                          throws AstVisitException {
    return record("VariableIdentifier", mode);
  }

  @Override
  public TraversalResult emitBuiltinArguments(TreeTraversalMode mode, NodeBuiltinArguments node)
                                          throws AstVisitException {
    return record("BuiltinArguments", mode);
  }

  @Override
  public TraversalResult emitTypeMapKey(TreeTraversalMode mode, NodeTypeMapKey node)
                                          throws AstVisitException {
    return record("TypeMapKey", mode);
  }

  @Override
  public TraversalResult emitTypeMapValue(TreeTraversalMode mode, NodeTypeMapValue node)
                                          throws AstVisitException {
    return record("TypeMapValue", mode);
  }

  @Override
  public TraversalResult emitTypeArgument(TreeTraversalMode mode, NodeTypeArgument node)
                                          throws AstVisitException {
    return record("TypeArgument", mode);
  }

  @Override
  public TraversalResult emitScillaType(TreeTraversalMode mode, NodeScillaType node)
                                          throws AstVisitException {
    return record("ScillaType", mode);
  }

  @Override
  public TraversalResult emitTypeMapEntry(TreeTraversalMode mode, NodeTypeMapEntry node)
                                          throws AstVisitException {
    return record("TypeMapEntry", mode);
  }

  @Override
  public TraversalResult emitAddressTypeField(TreeTraversalMode mode, NodeAddressTypeField node)
                                          throws AstVisitException {
    return record("AddressTypeField", mode);
  }

  @Override
  public TraversalResult emitAddressType(TreeTraversalMode mode, NodeAddressType node)
                                          throws AstVisitException {
    return record("AddressType", mode);
  }

  @Override
  public TraversalResult emitFullExpression(TreeTraversalMode mode, NodeFullExpression node)
                                          throws AstVisitException {
    return record("FullExpression", mode);
  }

  @Override
  public TraversalResult emitMessageEntry(TreeTraversalMode mode, NodeMessageEntry node)
                                          throws AstVisitException {
    return record("MessageEntry", mode);
  }

  @Override
  public TraversalResult emitPatternMatchExpressionClause(TreeTraversalMode mode, NodePatternMatchExpressionClause node)
                                          throws AstVisitException {
    return record("PatternMatchExpressionClause", mode);
  }

  @Override
  public TraversalResult emitAtomicExpression(TreeTraversalMode mode, NodeAtomicExpression node)
                                          throws AstVisitException {
    return record("AtomicExpression", mode);
  }

  @Override
  public TraversalResult emitContractTypeArguments(TreeTraversalMode mode, NodeContractTypeArguments node)
                                          throws AstVisitException {
    return record("ContractTypeArguments", mode);
  }

  @Override
  public TraversalResult emitValueLiteral(TreeTraversalMode mode, NodeValueLiteral node)
                                          throws AstVisitException {
    return record("ValueLiteral", mode);
  }

  @Override
  public TraversalResult emitMapAccess(TreeTraversalMode mode, NodeMapAccess node)
                                          throws AstVisitException {
    return record("MapAccess", mode);
  }

  @Override
  public TraversalResult emitPattern(TreeTraversalMode mode, NodePattern node)
                                          throws AstVisitException {
    return record("Pattern", mode);
  }

  @Override
  public TraversalResult emitArgumentPattern(TreeTraversalMode mode, NodeArgumentPattern node)
                                          throws AstVisitException {
    return record("ArgumentPattern", mode);
  }

  @Override
  public TraversalResult emitPatternMatchClause(TreeTraversalMode mode, NodePatternMatchClause node)
                                          throws AstVisitException {
    return record("PatternMatchClause", mode);
  }

  @Override
  public TraversalResult emitBlockchainFetchArguments(TreeTraversalMode mode, NodeBlockchainFetchArguments node)
                                          throws AstVisitException {
    return record("BlockchainFetchArguments", mode);
  }

  @Override
  public TraversalResult emitStatement(TreeTraversalMode mode, NodeStatement node)
                                          throws AstVisitException {
    return record("Statement", mode);
  }

  @Override
  public TraversalResult emitRemoteFetchStatement(TreeTraversalMode mode, NodeRemoteFetchStatement node)
                                          throws AstVisitException {
    return record("RemoteFetchStatement", mode);
  }

  @Override
  public TraversalResult emitComponentId(TreeTraversalMode mode, NodeComponentId node)
                                          throws AstVisitException {
    return record("ComponentId", mode);
  }

  @Override
  public TraversalResult emitComponentParameters(TreeTraversalMode mode, NodeComponentParameters node)
                                          throws AstVisitException {
    return record("ComponentParameters", mode);
  }

  @Override
  public TraversalResult emitParameterPair(TreeTraversalMode mode, NodeParameterPair node)
                                          throws AstVisitException {
    return record("ParameterPair", mode);
  }

  @Override
  public TraversalResult emitComponentBody(TreeTraversalMode mode, NodeComponentBody node)
                                          throws AstVisitException {
    return record("ComponentBody", mode);
  }

  @Override
  public TraversalResult emitStatementBlock(TreeTraversalMode mode, NodeStatementBlock node)
                                          throws AstVisitException {
    return record("StatementBlock", mode);
  }

  @Override
  public TraversalResult emitTypedIdentifier(TreeTraversalMode mode, NodeTypedIdentifier node)
                                          throws AstVisitException {
    return record("TypedIdentifier", mode);
  }

  @Override
  public TraversalResult emitTypeAnnotation(TreeTraversalMode mode, NodeTypeAnnotation node)
                                          throws AstVisitException {
    return record("TypeAnnotation", mode);
  }

  @Override
  public TraversalResult emitProgram(TreeTraversalMode mode, NodeProgram node)
                                          throws AstVisitException {
    return record("Program", mode);
  }

  @Override
  public TraversalResult emitLibraryDefinition(TreeTraversalMode mode, NodeLibraryDefinition node)
                                          throws AstVisitException {
    return record("LibraryDefinition", mode);
  }

  @Override
  public TraversalResult emitLibrarySingleDefinition(TreeTraversalMode mode, NodeLibrarySingleDefinition node)
                                          throws AstVisitException {
    return record("LibrarySingleDefinition", mode);
  }

  @Override
  public TraversalResult emitContractDefinition(TreeTraversalMode mode, NodeContractDefinition node)
                                          throws AstVisitException {
    return record("ContractDefinition", mode);
  }

  @Override
  public TraversalResult emitContractField(TreeTraversalMode mode, NodeContractField node)
                                          throws AstVisitException {
    return record("ContractField", mode);
  }

  @Override
  public TraversalResult emitWithConstraint(TreeTraversalMode mode, NodeWithConstraint node)
                                          throws AstVisitException {
    return record("WithConstraint", mode);
  }

  @Override
  public TraversalResult emitComponentDefinition(TreeTraversalMode mode, NodeComponentDefinition node)
                                          throws AstVisitException {
    return record("ComponentDefinition", mode);
  }

  @Override
  public TraversalResult emitProcedureDefinition(TreeTraversalMode mode, NodeProcedureDefinition node)
                                          throws AstVisitException {
    return record("ProcedureDefinition", mode);
  }

  @Override
  public TraversalResult emitTransitionDefinition(TreeTraversalMode mode, NodeTransitionDefinition node)
                                          throws AstVisitException {
    return record("TransitionDefinition", mode);
  }

  @Override
  public TraversalResult emitTypeAlternativeClause(TreeTraversalMode mode, NodeTypeAlternativeClause node)
                                          throws AstVisitException {
    return record("TypeAlternativeClause", mode);
  }
}
