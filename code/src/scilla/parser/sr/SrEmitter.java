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
package scilla.parser.sr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import scilla.parser.ast.AstConverting;
import scilla.parser.ast.SourcePosition;
import scilla.parser.ast.TraversalResult;
import scilla.parser.ast.TreeTraversalMode;
import scilla.parser.ast.WithMetaData;
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
import scilla.parser.common.Logging;
import scilla.parser.common.exceptions.AstVisitException;
import scilla.parser.common.exceptions.InvalidConstructException;
import scilla.parser.common.exceptions.StackMismatchException;
import scilla.parser.common.lang.Contract;
import scilla.parser.common.lang.Field;
import scilla.parser.common.lang.FieldList;
import scilla.parser.common.lang.Transition;
import scilla.parser.common.lang.TransitionList;
import scilla.parser.common.lang.Type;
import scilla.parser.common.util.Pair;
import scilla.parser.frontend.LogHelper;

/**
 * Lowers a program to the deployable surface of its contract in one
 * depth first pass.  Hooks communicate only through the operand stack:
 * names push identifiers, type constructs leave exactly one type
 * definition and typed identifiers leave exactly one variable
 * declaration.
 *
 * Hooks that need their operands in a particular order skip their
 * children and visit them by hand.  The results of those visits are not
 * checked: no hook here returns SKIP_CHILDREN on exit, so a subtree
 * visit either throws or finishes with CONTINUE.
 *
 * An instance lowers a single program.
 */
public class SrEmitter implements AstConverting {

  private static final Logger logger = Logging.getScillaLogger();

  private enum State {
    IDLE,
    TRAVERSING,
    DONE,
    FAILED,
  }

  private State state = State.IDLE;

  private final Deque<StackObject> stack = new ArrayDeque<StackObject>();

  /** Innermost library or contract on top */
  private final Deque<SrIdentifier> namespaces =
                                      new ArrayDeque<SrIdentifier>();

  private final Deque<Pair<SourcePosition, SourcePosition>> positions =
                    new ArrayDeque<Pair<SourcePosition, SourcePosition>>();

  private final List<SrIdentifier> definitions =
                                      new ArrayList<SrIdentifier>();
  private final List<SrIdentifier> imports = new ArrayList<SrIdentifier>();

  private String contractName = null;
  private FieldList initParams = new FieldList();
  private final FieldList fields = new FieldList();
  private final TransitionList transitions = new TransitionList();

  /**
   * Lower the program.
   * @param program
   * @return the contract surface
   * @throws AstVisitException on the first construct that cannot be
   *        lowered; no partial result is returned
   * @throws IllegalStateException if this emitter was already used
   */
  public Contract emit(WithMetaData<NodeProgram> program)
                                          throws AstVisitException {
    if (state != State.IDLE) {
      throw new IllegalStateException("emitter already used: " + state);
    }
    state = State.TRAVERSING;
    try {
      program.visit(this);
      checkBalanced();
    } catch (AstVisitException e) {
      state = State.FAILED;
      throw e;
    } catch (RuntimeException e) {
      state = State.FAILED;
      throw e;
    }
    state = State.DONE;

    Contract contract = new Contract(contractName, initParams, fields,
                                     transitions);
    LogHelper.debug(0, "lowered " + contract);
    return contract;
  }

  private void checkBalanced() throws StackMismatchException {
    if (!stack.isEmpty()) {
      throw new StackMismatchException("empty operand stack", stack.peek());
    }
    if (!namespaces.isEmpty()) {
      throw new StackMismatchException("empty namespace stack",
                                       namespaces.peek());
    }
    if (!positions.isEmpty()) {
      throw new StackMismatchException("empty position stack",
                                       positions.peek());
    }
    if (contractName == null) {
      throw new StackMismatchException("No contract definition lowered");
    }
  }

  public int operandStackSize() {
    return stack.size();
  }

  public int namespaceStackSize() {
    return namespaces.size();
  }

  public int positionStackSize() {
    return positions.size();
  }

  /**
   * @return names defined by the program in definition order
   */
  public List<SrIdentifier> getDefinitions() {
    return ImmutableList.copyOf(definitions);
  }

  /**
   * @return imported libraries, resolved to the library name, with the
   *         name used in this contract as the unresolved name
   */
  public List<SrIdentifier> getImports() {
    return ImmutableList.copyOf(imports);
  }

  /* Operand stack */

  private int depth() {
    return positions.size();
  }

  private SourcePosition currentPosition() {
    Pair<SourcePosition, SourcePosition> top = positions.peek();
    return top == null ? SourcePosition.UNKNOWN : top.val1;
  }

  private void push(StackObject obj) {
    if (logger.isTraceEnabled()) {
      LogHelper.trace(depth(), "push " + obj);
    }
    stack.push(obj);
  }

  private StackObject pop() {
    StackObject top = stack.poll();
    if (top != null && logger.isTraceEnabled()) {
      LogHelper.trace(depth(), "pop " + top);
    }
    return top;
  }

  private SrIdentifier popIdentifier() throws StackMismatchException {
    StackObject top = pop();
    if (top == null || top.kind() != StackObject.Kind.IDENTIFIER) {
      throw new StackMismatchException("identifier", top);
    }
    return top.identifier();
  }

  private Field popVariableDeclaration() throws StackMismatchException {
    StackObject top = pop();
    if (top == null || top.kind() != StackObject.Kind.VARIABLE_DECLARATION) {
      throw new StackMismatchException("variable declaration", top);
    }
    return top.declaration();
  }

  private SrType popTypeDefinition() throws StackMismatchException {
    StackObject top = pop();
    if (top == null || top.kind() != StackObject.Kind.TYPE_DEFINITION) {
      throw new StackMismatchException("type definition", top);
    }
    return top.typeDefinition();
  }

  private void pushIdentifier(String name, SrIdentifierKind kind) {
    push(StackObject.identifier(new SrIdentifier(name, kind)));
  }

  /**
   * Replace the identifier on top of the stack with a type definition
   */
  private void identifierToType() throws StackMismatchException {
    SrIdentifier identifier = popIdentifier();
    push(StackObject.typeDefinition(SrType.fromIdentifier(identifier)));
  }

  /**
   * Value on top, key below: replace both with a map type definition
   */
  private void buildMap() throws StackMismatchException {
    SrType value = popTypeDefinition();
    SrType key = popTypeDefinition();
    push(StackObject.typeDefinition(SrType.map(key, value)));
  }

  private Type resolveType(SrType type) throws InvalidConstructException {
    try {
      return type.toType();
    } catch (InvalidConstructException e) {
      throw new InvalidConstructException(currentPosition(), e.getMessage());
    }
  }

  private InvalidConstructException unsupported(String what) {
    return new InvalidConstructException(currentPosition(),
                              what + " cannot appear in a contract surface");
  }

  /* Namespaces and definitions */

  private String qualify(String name) {
    SrIdentifier ns = namespaces.peek();
    if (ns == null) {
      return name;
    }
    return ns.resolved() + "." + name;
  }

  private void pushNamespace(SrIdentifier name) {
    name.setKind(SrIdentifierKind.NAMESPACE);
    name.setResolved(qualify(name.unresolved()));
    namespaces.push(name);
    LogHelper.trace(depth(), "enter namespace " + name.resolved());
  }

  private void popNamespace() throws StackMismatchException {
    SrIdentifier ns = namespaces.poll();
    if (ns == null) {
      throw new StackMismatchException("namespace", null);
    }
    LogHelper.trace(depth(), "leave namespace " + ns.resolved());
  }

  private SrIdentifier define(SrIdentifier identifier,
                              SrIdentifierKind kind) {
    identifier.setKind(kind);
    identifier.setDefinition(true);
    identifier.setResolved(qualify(identifier.unresolved()));
    definitions.add(identifier);
    LogHelper.debug(depth(), "define " + identifier);
    return identifier;
  }

  /**
   * Visit each parameter, collecting the declaration each leaves
   */
  private FieldList lowerParameters(
              WithMetaData<NodeComponentParameters> parameters)
                                          throws AstVisitException {
    FieldList result = new FieldList();
    for (WithMetaData<NodeParameterPair> param:
                          parameters.node().parameters()) {
      param.visit(this);
      result.add(popVariableDeclaration());
    }
    return result;
  }

  /* Backend hooks */

  @Override
  public void pushSourcePosition(SourcePosition start, SourcePosition end) {
    positions.push(Pair.create(start, end));
  }

  @Override
  public void popSourcePosition() {
    positions.pop();
  }

  @Override
  public TraversalResult emitByteStr(TreeTraversalMode mode,
                                     NodeByteStr node) {
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitTypeNameIdentifier(TreeTraversalMode mode,
                                    NodeTypeNameIdentifier node) {
    if (mode == TreeTraversalMode.ENTER) {
      if (node.kind() == NodeTypeNameIdentifier.Kind.EVENT_TYPE) {
        pushIdentifier(node.toString(), SrIdentifierKind.EVENT);
      } else {
        pushIdentifier(node.toString(), SrIdentifierKind.UNKNOWN);
      }
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitImportedName(TreeTraversalMode mode,
                                          NodeImportedName node) {
    if (mode == TreeTraversalMode.ENTER) {
      SrIdentifier lib = new SrIdentifier(node.localName(),
                                          SrIdentifierKind.NAMESPACE);
      lib.setResolved(node.name().toString());
      imports.add(lib);
      LogHelper.debug(depth(), "import " + lib);
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitImportDeclarations(TreeTraversalMode mode,
                                        NodeImportDeclarations node) {
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitMetaIdentifier(TreeTraversalMode mode,
                                            NodeMetaIdentifier node) {
    if (mode == TreeTraversalMode.EXIT) {
      return TraversalResult.CONTINUE;
    }
    switch (node.kind()) {
      case META_NAME:
        // Type name child pushes the identifier
        return TraversalResult.CONTINUE;
      case META_NAME_IN_NAMESPACE:
      case META_NAME_IN_HEXSPACE:
      case BYTE_STRING:
        pushIdentifier(node.toString(), SrIdentifierKind.UNKNOWN);
        return TraversalResult.SKIP_CHILDREN;
      default:
        throw new IllegalStateException("Unknown kind " + node.kind());
    }
  }

  @Override
  public TraversalResult emitVariableIdentifier(TreeTraversalMode mode,
                                        NodeVariableIdentifier node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitBuiltinArguments(TreeTraversalMode mode,
                                          NodeBuiltinArguments node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitTypeMapKey(TreeTraversalMode mode,
                      NodeTypeMapKey node) throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT) {
      switch (node.kind()) {
        case GENERIC_MAP_KEY:
        case ENCLOSED_GENERIC_ID:
          identifierToType();
          break;
        default:
          // Address types leave a type definition
          break;
      }
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitTypeMapValue(TreeTraversalMode mode,
                      NodeTypeMapValue node) throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT && node.kind() ==
          NodeTypeMapValue.Kind.MAP_VALUE_TYPE_OR_ENUM_LIKE_IDENTIFIER) {
      identifierToType();
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitTypeArgument(TreeTraversalMode mode,
                      NodeTypeArgument node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      if (node.kind() == NodeTypeArgument.Kind.TEMPLATE_TYPE_ARGUMENT) {
        throw unsupported("Type variable "
                + ((NodeTypeArgument.TemplateTypeArgument)node).name());
      }
      return TraversalResult.CONTINUE;
    }

    switch (node.kind()) {
      case GENERIC_TYPE_ARGUMENT:
        identifierToType();
        break;
      case MAP_TYPE_ARGUMENT:
        buildMap();
        break;
      default:
        break;
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitScillaType(TreeTraversalMode mode,
                      NodeScillaType node) throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT) {
      if (node.kind() == NodeScillaType.Kind.MAP_TYPE) {
        buildMap();
      }
      return TraversalResult.CONTINUE;
    }

    switch (node.kind()) {
      case GENERIC_TYPE_WITH_ARGS: {
        NodeScillaType.GenericTypeWithArgs generic =
                              (NodeScillaType.GenericTypeWithArgs)node;
        generic.head().visit(this);
        SrType mainType = SrType.fromIdentifier(popIdentifier());
        for (WithMetaData<NodeTypeArgument> arg: generic.arguments()) {
          arg.visit(this);
          mainType.addSubType(popTypeDefinition());
        }
        push(StackObject.typeDefinition(mainType));
        return TraversalResult.SKIP_CHILDREN;
      }
      case FUNCTION_TYPE:
        throw unsupported("Function type");
      case POLY_FUNCTION_TYPE:
        throw unsupported("Polymorphic type");
      case TYPE_VAR_TYPE:
        throw unsupported("Type variable "
                          + ((NodeScillaType.TypeVarType)node).name());
      default:
        return TraversalResult.CONTINUE;
    }
  }

  @Override
  public TraversalResult emitTypeMapEntry(TreeTraversalMode mode,
                      NodeTypeMapEntry node) throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT) {
      buildMap();
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitAddressTypeField(TreeTraversalMode mode,
                  NodeAddressTypeField node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      node.typeName().visit(this);
      Type type = resolveType(popTypeDefinition());
      push(StackObject.variableDeclaration(
                  new Field(node.identifier().toString(), type)));
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitAddressType(TreeTraversalMode mode,
                      NodeAddressType node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      node.identifier().visit(this);
      SrType mainType = SrType.fromIdentifier(popIdentifier());
      FieldList addressFields = new FieldList();
      for (WithMetaData<NodeAddressTypeField> field: node.addressFields()) {
        field.visit(this);
        addressFields.add(popVariableDeclaration());
      }
      mainType.setAddressType(new AddressType(node.typeName(),
                                              addressFields));
      push(StackObject.typeDefinition(mainType));
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitFullExpression(TreeTraversalMode mode,
                                            NodeFullExpression node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitMessageEntry(TreeTraversalMode mode,
                                          NodeMessageEntry node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitPatternMatchExpressionClause(
          TreeTraversalMode mode, NodePatternMatchExpressionClause node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitAtomicExpression(TreeTraversalMode mode,
                                          NodeAtomicExpression node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitContractTypeArguments(TreeTraversalMode mode,
                                      NodeContractTypeArguments node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitValueLiteral(TreeTraversalMode mode,
                                          NodeValueLiteral node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitMapAccess(TreeTraversalMode mode,
                                       NodeMapAccess node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitPattern(TreeTraversalMode mode,
                                     NodePattern node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitArgumentPattern(TreeTraversalMode mode,
                                             NodeArgumentPattern node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitPatternMatchClause(TreeTraversalMode mode,
                                        NodePatternMatchClause node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitBlockchainFetchArguments(
          TreeTraversalMode mode, NodeBlockchainFetchArguments node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitStatement(TreeTraversalMode mode,
                                       NodeStatement node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitRemoteFetchStatement(TreeTraversalMode mode,
                                      NodeRemoteFetchStatement node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitComponentId(TreeTraversalMode mode,
                                         NodeComponentId node) {
    if (mode == TreeTraversalMode.ENTER) {
      pushIdentifier(node.toString(), SrIdentifierKind.COMPONENT_NAME);
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitComponentParameters(TreeTraversalMode mode,
                                        NodeComponentParameters node) {
    // Collected by the enclosing contract or component
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitParameterPair(TreeTraversalMode mode,
                                           NodeParameterPair node) {
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitComponentBody(TreeTraversalMode mode,
                                           NodeComponentBody node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitStatementBlock(TreeTraversalMode mode,
                                            NodeStatementBlock node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitTypedIdentifier(TreeTraversalMode mode,
                  NodeTypedIdentifier node) throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT) {
      Type type = resolveType(popTypeDefinition());
      push(StackObject.variableDeclaration(
                      new Field(node.identifierName(), type)));
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitTypeAnnotation(TreeTraversalMode mode,
                                            NodeTypeAnnotation node) {
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitProgram(TreeTraversalMode mode,
                                     NodeProgram node) {
    if (mode == TreeTraversalMode.ENTER) {
      LogHelper.debug(depth(), "lowering program, scilla_version "
                               + node.version());
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitLibraryDefinition(TreeTraversalMode mode,
              NodeLibraryDefinition node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      node.name().visit(this);
      pushNamespace(popIdentifier());
    } else {
      popNamespace();
    }
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitLibrarySingleDefinition(
      TreeTraversalMode mode, NodeLibrarySingleDefinition node)
                                          throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT) {
      return TraversalResult.CONTINUE;
    }
    switch (node.kind()) {
      case LET_DEFINITION: {
        NodeLibrarySingleDefinition.LetDefinition let =
                      (NodeLibrarySingleDefinition.LetDefinition)node;
        NodeFullExpression.Kind exprKind = let.expression().node().kind();
        SrIdentifierKind kind;
        if (exprKind == NodeFullExpression.Kind.FUNCTION_DECLARATION ||
            exprKind == NodeFullExpression.Kind.TEMPLATE_FUNCTION) {
          kind = SrIdentifierKind.FUNCTION_NAME;
        } else {
          kind = SrIdentifierKind.VIRTUAL_REGISTER;
        }
        define(new SrIdentifier(let.variableName(), kind), kind);
        break;
      }
      case TYPE_DEFINITION: {
        NodeLibrarySingleDefinition.TypeDefinition typeDef =
                      (NodeLibrarySingleDefinition.TypeDefinition)node;
        typeDef.name().visit(this);
        define(popIdentifier(), SrIdentifierKind.TYPE_NAME);
        break;
      }
      default:
        throw new IllegalStateException("Unknown kind " + node.kind());
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitContractDefinition(TreeTraversalMode mode,
              NodeContractDefinition node) throws AstVisitException {
    if (mode == TreeTraversalMode.EXIT) {
      return TraversalResult.CONTINUE;
    }
    node.contractName().visit(this);
    SrIdentifier name = popIdentifier();
    contractName = name.unresolved();
    pushNamespace(name);

    initParams = lowerParameters(node.parameters());
    LogHelper.debug(depth(), "contract " + contractName + " parameters "
                             + initParams);

    if (node.constraint() != null) {
      node.constraint().visit(this);
    }
    for (WithMetaData<NodeContractField> field: node.fields()) {
      field.visit(this);
    }
    for (WithMetaData<NodeComponentDefinition> component:
                                                node.components()) {
      component.visit(this);
    }

    popNamespace();
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitContractField(TreeTraversalMode mode,
                  NodeContractField node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      node.typedIdentifier().visit(this);
      Field field = popVariableDeclaration();
      node.rightHandSide().visit(this);

      fields.add(field);
      SrIdentifier state = new SrIdentifier(field.name(),
                                            SrIdentifierKind.STATE);
      state.setTypeReference(field.type().toString());
      define(state, SrIdentifierKind.STATE);
      LogHelper.debug(depth(), "field " + field);
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitWithConstraint(TreeTraversalMode mode,
                                            NodeWithConstraint node) {
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitComponentDefinition(TreeTraversalMode mode,
                                        NodeComponentDefinition node) {
    return TraversalResult.CONTINUE;
  }

  @Override
  public TraversalResult emitProcedureDefinition(TreeTraversalMode mode,
              NodeProcedureDefinition node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      node.name().visit(this);
      FieldList params = lowerParameters(node.parameters());
      SrIdentifier name = popComponentName();
      define(name, SrIdentifierKind.PROCEDURE_NAME);
      LogHelper.debug(depth(), "procedure " + name.unresolved()
                               + " parameters " + params);
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  @Override
  public TraversalResult emitTransitionDefinition(TreeTraversalMode mode,
              NodeTransitionDefinition node) throws AstVisitException {
    if (mode == TreeTraversalMode.ENTER) {
      node.name().visit(this);
      FieldList params = lowerParameters(node.parameters());
      SrIdentifier name = popComponentName();
      define(name, SrIdentifierKind.TRANSITION_NAME);

      Transition transition = new Transition(name.unresolved(), params);
      transitions.add(transition);
      LogHelper.debug(depth(), "transition " + transition);
    }
    return TraversalResult.SKIP_CHILDREN;
  }

  private SrIdentifier popComponentName() throws StackMismatchException {
    SrIdentifier name = popIdentifier();
    if (name.kind() != SrIdentifierKind.COMPONENT_NAME) {
      throw new StackMismatchException("component name", name);
    }
    return name;
  }

  @Override
  public TraversalResult emitTypeAlternativeClause(TreeTraversalMode mode,
                                      NodeTypeAlternativeClause node) {
    return TraversalResult.SKIP_CHILDREN;
  }
}
