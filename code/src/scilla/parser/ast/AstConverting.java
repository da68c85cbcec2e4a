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
 * A pass over the contract AST.  There is one hook per node kind,
 * called with {@link TreeTraversalMode#ENTER} before the children of
 * the node are visited and with {@link TreeTraversalMode#EXIT} after.
 * Returning {@link TraversalResult#SKIP_CHILDREN} on entry means the
 * hook has handled the subtree itself: the children are not visited
 * and the exit hook is not called.
 *
 * A backend with nothing to do for a node kind returns
 * {@link TraversalResult#CONTINUE} in both modes.
 */
public interface AstConverting {

  /**
   * Called before descending into a node with a known source range.
   * Always matched by a call to {@link #popSourcePosition()}, also when
   * the visit fails.
   */
  public void pushSourcePosition(SourcePosition start, SourcePosition end);

  public void popSourcePosition();

  public TraversalResult emitByteStr(TreeTraversalMode mode,
      NodeByteStr node) throws AstVisitException;

  public TraversalResult emitTypeNameIdentifier(TreeTraversalMode mode,
      NodeTypeNameIdentifier node) throws AstVisitException;

  public TraversalResult emitImportedName(TreeTraversalMode mode,
      NodeImportedName node) throws AstVisitException;

  public TraversalResult emitImportDeclarations(TreeTraversalMode mode,
      NodeImportDeclarations node) throws AstVisitException;

  public TraversalResult emitMetaIdentifier(TreeTraversalMode mode,
      NodeMetaIdentifier node) throws AstVisitException;

  public TraversalResult emitVariableIdentifier(TreeTraversalMode mode,
      NodeVariableIdentifier node) throws AstVisitException;

  public TraversalResult emitBuiltinArguments(TreeTraversalMode mode,
      NodeBuiltinArguments node) throws AstVisitException;

  public TraversalResult emitTypeMapKey(TreeTraversalMode mode,
      NodeTypeMapKey node) throws AstVisitException;

  public TraversalResult emitTypeMapValue(TreeTraversalMode mode,
      NodeTypeMapValue node) throws AstVisitException;

  public TraversalResult emitTypeArgument(TreeTraversalMode mode,
      NodeTypeArgument node) throws AstVisitException;

  public TraversalResult emitScillaType(TreeTraversalMode mode,
      NodeScillaType node) throws AstVisitException;

  public TraversalResult emitTypeMapEntry(TreeTraversalMode mode,
      NodeTypeMapEntry node) throws AstVisitException;

  public TraversalResult emitAddressTypeField(TreeTraversalMode mode,
      NodeAddressTypeField node) throws AstVisitException;

  public TraversalResult emitAddressType(TreeTraversalMode mode,
      NodeAddressType node) throws AstVisitException;

  public TraversalResult emitFullExpression(TreeTraversalMode mode,
      NodeFullExpression node) throws AstVisitException;

  public TraversalResult emitMessageEntry(TreeTraversalMode mode,
      NodeMessageEntry node) throws AstVisitException;

  public TraversalResult emitPatternMatchExpressionClause(TreeTraversalMode mode,
      NodePatternMatchExpressionClause node) throws AstVisitException;

  public TraversalResult emitAtomicExpression(TreeTraversalMode mode,
      NodeAtomicExpression node) throws AstVisitException;

  public TraversalResult emitContractTypeArguments(TreeTraversalMode mode,
      NodeContractTypeArguments node) throws AstVisitException;

  public TraversalResult emitValueLiteral(TreeTraversalMode mode,
      NodeValueLiteral node) throws AstVisitException;

  public TraversalResult emitMapAccess(TreeTraversalMode mode,
      NodeMapAccess node) throws AstVisitException;

  public TraversalResult emitPattern(TreeTraversalMode mode,
      NodePattern node) throws AstVisitException;

  public TraversalResult emitArgumentPattern(TreeTraversalMode mode,
      NodeArgumentPattern node) throws AstVisitException;

  public TraversalResult emitPatternMatchClause(TreeTraversalMode mode,
      NodePatternMatchClause node) throws AstVisitException;

  public TraversalResult emitBlockchainFetchArguments(TreeTraversalMode mode,
      NodeBlockchainFetchArguments node) throws AstVisitException;

  public TraversalResult emitStatement(TreeTraversalMode mode,
      NodeStatement node) throws AstVisitException;

  public TraversalResult emitRemoteFetchStatement(TreeTraversalMode mode,
      NodeRemoteFetchStatement node) throws AstVisitException;

  public TraversalResult emitComponentId(TreeTraversalMode mode,
      NodeComponentId node) throws AstVisitException;

  public TraversalResult emitComponentParameters(TreeTraversalMode mode,
      NodeComponentParameters node) throws AstVisitException;

  public TraversalResult emitParameterPair(TreeTraversalMode mode,
      NodeParameterPair node) throws AstVisitException;

  public TraversalResult emitComponentBody(TreeTraversalMode mode,
      NodeComponentBody node) throws AstVisitException;

  public TraversalResult emitStatementBlock(TreeTraversalMode mode,
      NodeStatementBlock node) throws AstVisitException;

  public TraversalResult emitTypedIdentifier(TreeTraversalMode mode,
      NodeTypedIdentifier node) throws AstVisitException;

  public TraversalResult emitTypeAnnotation(TreeTraversalMode mode,
      NodeTypeAnnotation node) throws AstVisitException;

  public TraversalResult emitProgram(TreeTraversalMode mode,
      NodeProgram node) throws AstVisitException;

  public TraversalResult emitLibraryDefinition(TreeTraversalMode mode,
      NodeLibraryDefinition node) throws AstVisitException;

  public TraversalResult emitLibrarySingleDefinition(TreeTraversalMode mode,
      NodeLibrarySingleDefinition node) throws AstVisitException;

  public TraversalResult emitContractDefinition(TreeTraversalMode mode,
      NodeContractDefinition node) throws AstVisitException;

  public TraversalResult emitContractField(TreeTraversalMode mode,
      NodeContractField node) throws AstVisitException;

  public TraversalResult emitWithConstraint(TreeTraversalMode mode,
      NodeWithConstraint node) throws AstVisitException;

  public TraversalResult emitComponentDefinition(TreeTraversalMode mode,
      NodeComponentDefinition node) throws AstVisitException;

  public TraversalResult emitProcedureDefinition(TreeTraversalMode mode,
      NodeProcedureDefinition node) throws AstVisitException;

  public TraversalResult emitTransitionDefinition(TreeTraversalMode mode,
      NodeTransitionDefinition node) throws AstVisitException;

  public TraversalResult emitTypeAlternativeClause(TreeTraversalMode mode,
      NodeTypeAlternativeClause node) throws AstVisitException;
}
