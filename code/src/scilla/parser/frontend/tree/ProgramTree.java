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
package scilla.parser.frontend.tree;

import static scilla.parser.frontend.tree.Trees.located;

import java.util.ArrayList;
import java.util.List;

import scilla.parser.ast.ScillaAST;
import scilla.parser.ast.WithMetaData;
import scilla.parser.ast.antlr.ScillaParser;
import scilla.parser.ast.nodes.NodeComponentBody;
import scilla.parser.ast.nodes.NodeComponentDefinition;
import scilla.parser.ast.nodes.NodeComponentParameters;
import scilla.parser.ast.nodes.NodeContractDefinition;
import scilla.parser.ast.nodes.NodeContractField;
import scilla.parser.ast.nodes.NodeImportDeclarations;
import scilla.parser.ast.nodes.NodeImportedName;
import scilla.parser.ast.nodes.NodeLibraryDefinition;
import scilla.parser.ast.nodes.NodeLibrarySingleDefinition;
import scilla.parser.ast.nodes.NodeParameterPair;
import scilla.parser.ast.nodes.NodeProcedureDefinition;
import scilla.parser.ast.nodes.NodeProgram;
import scilla.parser.ast.nodes.NodeTransitionDefinition;
import scilla.parser.ast.nodes.NodeTypeAlternativeClause;
import scilla.parser.ast.nodes.NodeTypeAnnotation;
import scilla.parser.ast.nodes.NodeWithConstraint;
import scilla.parser.common.exceptions.ScillaRuntimeError;
import scilla.parser.frontend.LogHelper;

/**
 * Converts the tree produced by the ANTLR grammar into the typed node
 * model, starting from the PROGRAM root.
 */
public class ProgramTree {

  public static WithMetaData<NodeProgram> fromAST(ScillaAST tree) {
    assert(tree.getType() == ScillaParser.PROGRAM);
    assert(tree.childCount() >= 2);

    ScillaAST versionT = tree.child(0);
    assert(versionT.getType() == ScillaParser.VERSION);
    String version = versionT.child(0).getText();

    WithMetaData<NodeImportDeclarations> imports = null;
    WithMetaData<NodeLibraryDefinition> library = null;
    WithMetaData<NodeContractDefinition> contract = null;
    for (ScillaAST child: tree.children(1)) {
      switch (child.getType()) {
        case ScillaParser.IMPORTS:
          imports = imports(child);
          break;
        case ScillaParser.LIB:
          library = library(child);
          break;
        case ScillaParser.CONTRACT_DEF:
          contract = contract(child);
          break;
        default:
          throw Trees.unexpected("program", child);
      }
    }
    if (contract == null) {
      throw new ScillaRuntimeError("No contract in program tree");
    }
    LogHelper.trace(0, "built program tree for contract "
                        + contract.node().contractName());
    return located(new NodeProgram(version, imports, library, contract),
                   tree);
  }

  private static WithMetaData<NodeImportDeclarations> imports(
                                                  ScillaAST importsT) {
    List<WithMetaData<NodeImportedName>> names =
                    new ArrayList<WithMetaData<NodeImportedName>>();
    for (ScillaAST nameT: importsT.children()) {
      NodeImportedName name;
      if (nameT.getType() == ScillaParser.IMPORT_ALIAS) {
        name = new NodeImportedName.AliasedImport(
                      IdentifierTree.typeName(nameT.child(0)),
                      IdentifierTree.typeName(nameT.child(1)));
      } else {
        assert(nameT.getType() == ScillaParser.IMPORT_NAME);
        name = new NodeImportedName.RegularImport(
                      IdentifierTree.typeName(nameT.child(0)));
      }
      names.add(located(name, nameT));
    }
    return located(new NodeImportDeclarations(names), importsT);
  }

  private static WithMetaData<NodeLibraryDefinition> library(
                                                  ScillaAST libT) {
    List<WithMetaData<NodeLibrarySingleDefinition>> definitions =
          new ArrayList<WithMetaData<NodeLibrarySingleDefinition>>();
    for (ScillaAST entryT: libT.children(1)) {
      definitions.add(librarySingleDefinition(entryT));
    }
    return located(new NodeLibraryDefinition(
              IdentifierTree.typeName(libT.child(0)), definitions), libT);
  }

  private static WithMetaData<NodeLibrarySingleDefinition>
                      librarySingleDefinition(ScillaAST entryT) {
    NodeLibrarySingleDefinition node;
    switch (entryT.getType()) {
      case ScillaParser.LET_DEF: {
        // ID TYPE_ANNOT? expr
        WithMetaData<NodeTypeAnnotation> annotation = null;
        int pos = 1;
        if (entryT.child(pos).getType() == ScillaParser.TYPE_ANNOT) {
          annotation = TypeTree.typeAnnotation(entryT.child(pos));
          pos++;
        }
        node = new NodeLibrarySingleDefinition.LetDefinition(
                        entryT.child(0).getText(), annotation,
                        ExprTree.fullExpression(entryT.child(pos)));
        break;
      }
      case ScillaParser.TYPE_DEF: {
        List<WithMetaData<NodeTypeAlternativeClause>> clauses =
            new ArrayList<WithMetaData<NodeTypeAlternativeClause>>();
        for (ScillaAST clauseT: entryT.children(1)) {
          clauses.add(typeAlternativeClause(clauseT));
        }
        node = new NodeLibrarySingleDefinition.TypeDefinition(
                        IdentifierTree.typeName(entryT.child(0)), clauses);
        break;
      }
      default:
        throw Trees.unexpected("library", entryT);
    }
    return located(node, entryT);
  }

  private static WithMetaData<NodeTypeAlternativeClause>
                      typeAlternativeClause(ScillaAST clauseT) {
    assert(clauseT.getType() == ScillaParser.TYPE_CLAUSE);
    NodeTypeAlternativeClause node;
    if (clauseT.childCount() == 1) {
      node = new NodeTypeAlternativeClause.ClauseType(
                        IdentifierTree.typeName(clauseT.child(0)));
    } else {
      node = new NodeTypeAlternativeClause.ClauseTypeWithArgs(
                        IdentifierTree.typeName(clauseT.child(0)),
                        TypeTree.typeArguments(clauseT.children(1)));
    }
    return located(node, clauseT);
  }

  private static WithMetaData<NodeContractDefinition> contract(
                                                  ScillaAST contractT) {
    // CID PARAMS CONSTRAINT? FIELD_DEF* (TRANSITION_DEF|PROCEDURE_DEF)*
    assert(contractT.childCount() >= 2);
    WithMetaData<NodeComponentParameters> params =
                                      parameters(contractT.child(1));
    WithMetaData<NodeWithConstraint> constraint = null;
    List<WithMetaData<NodeContractField>> fields =
                    new ArrayList<WithMetaData<NodeContractField>>();
    List<WithMetaData<NodeComponentDefinition>> components =
                    new ArrayList<WithMetaData<NodeComponentDefinition>>();

    for (ScillaAST child: contractT.children(2)) {
      switch (child.getType()) {
        case ScillaParser.CONSTRAINT:
          constraint = located(new NodeWithConstraint(
                  ExprTree.fullExpression(child.child(0))), child);
          break;
        case ScillaParser.FIELD_DEF:
          assert(child.childCount() == 3);
          fields.add(located(new NodeContractField(
              TypeTree.typedIdentifier(child.child(0), child.child(1), child),
              ExprTree.fullExpression(child.child(2))), child));
          break;
        case ScillaParser.TRANSITION_DEF:
          components.add(located(new NodeComponentDefinition.TransitionComponent(
              located(new NodeTransitionDefinition(
                  IdentifierTree.componentId(child.child(0)),
                  parameters(child.child(1)), body(child.child(2))), child)),
              child));
          break;
        case ScillaParser.PROCEDURE_DEF:
          components.add(located(new NodeComponentDefinition.ProcedureComponent(
              located(new NodeProcedureDefinition(
                  IdentifierTree.componentId(child.child(0)),
                  parameters(child.child(1)), body(child.child(2))), child)),
              child));
          break;
        default:
          throw Trees.unexpected("contract", child);
      }
    }

    return located(new NodeContractDefinition(
                  IdentifierTree.typeName(contractT.child(0)),
                  params, constraint, fields, components), contractT);
  }

  /**
   * @param paramsT PARAMS subtree, possibly with no children
   */
  private static WithMetaData<NodeComponentParameters> parameters(
                                                  ScillaAST paramsT) {
    assert(paramsT.getType() == ScillaParser.PARAMS);
    List<WithMetaData<NodeParameterPair>> params =
                    new ArrayList<WithMetaData<NodeParameterPair>>();
    for (ScillaAST paramT: paramsT.children()) {
      assert(paramT.getType() == ScillaParser.PARAM);
      assert(paramT.childCount() == 2);
      params.add(located(new NodeParameterPair(TypeTree.typedIdentifier(
                     paramT.child(0), paramT.child(1), paramT)), paramT));
    }
    return located(new NodeComponentParameters(params), paramsT);
  }

  private static WithMetaData<NodeComponentBody> body(ScillaAST stmtsT) {
    return located(new NodeComponentBody(StmtTree.statementBlock(stmtsT)),
                   stmtsT);
  }
}
