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
import scilla.parser.ast.nodes.NodeAtomicExpression;
import scilla.parser.ast.nodes.NodeBuiltinArguments;
import scilla.parser.ast.nodes.NodeContractTypeArguments;
import scilla.parser.ast.nodes.NodeFullExpression;
import scilla.parser.ast.nodes.NodeMessageEntry;
import scilla.parser.ast.nodes.NodePatternMatchExpressionClause;
import scilla.parser.ast.nodes.NodeTypeAnnotation;
import scilla.parser.ast.nodes.NodeValueLiteral;

public class ExprTree {

  public static WithMetaData<NodeFullExpression> fullExpression(
                                                    ScillaAST exprT) {
    NodeFullExpression node;
    switch (exprT.getType()) {
      case ScillaParser.LET_EXPR:
        node = letExpression(exprT);
        break;
      case ScillaParser.FUN_EXPR:
        assert(exprT.childCount() == 3);
        node = new NodeFullExpression.FunctionDeclaration(
            TypeTree.typedIdentifier(exprT.child(0), exprT.child(1), exprT),
            fullExpression(exprT.child(2)));
        break;
      case ScillaParser.TFUN_EXPR:
        assert(exprT.childCount() == 2);
        node = new NodeFullExpression.TemplateFunction(
                  exprT.child(0).getText(), fullExpression(exprT.child(1)));
        break;
      case ScillaParser.BUILTIN_EXPR:
        node = builtin(exprT);
        break;
      case ScillaParser.MATCH_EXPR: {
        List<WithMetaData<NodePatternMatchExpressionClause>> clauses =
          new ArrayList<WithMetaData<NodePatternMatchExpressionClause>>();
        for (ScillaAST clauseT: exprT.children(1)) {
          assert(clauseT.getType() == ScillaParser.EXPR_CLAUSE);
          clauses.add(located(new NodePatternMatchExpressionClause(
                            PatternTree.pattern(clauseT.child(0)),
                            fullExpression(clauseT.child(1))), clauseT));
        }
        node = new NodeFullExpression.Match(
                  IdentifierTree.variable(exprT.child(0)), clauses);
        break;
      }
      case ScillaParser.MESSAGE: {
        List<WithMetaData<NodeMessageEntry>> entries =
                    new ArrayList<WithMetaData<NodeMessageEntry>>();
        for (ScillaAST entryT: exprT.children()) {
          entries.add(messageEntry(entryT));
        }
        node = new NodeFullExpression.Message(entries);
        break;
      }
      case ScillaParser.TAPP_EXPR:
        node = new NodeFullExpression.TApp(
                  IdentifierTree.variable(exprT.child(0)),
                  TypeTree.typeArguments(exprT.children(1)));
        break;
      case ScillaParser.ATOMIC_LIT:
        node = new NodeFullExpression.ExpressionAtomic(located(
            new NodeAtomicExpression.AtomicLit(literal(exprT.child(0))),
            exprT));
        break;
      case ScillaParser.ATOMIC_SID:
        node = new NodeFullExpression.ExpressionAtomic(located(
            new NodeAtomicExpression.AtomicSid(
                IdentifierTree.variable(exprT.child(0))), exprT));
        break;
      case ScillaParser.APP_EXPR:
        assert(exprT.childCount() >= 2);
        node = new NodeFullExpression.FunctionCall(
                  IdentifierTree.variable(exprT.child(0)),
                  IdentifierTree.variables(exprT.children(1)));
        break;
      case ScillaParser.CONSTR_EXPR:
        node = constructorCall(exprT);
        break;
      default:
        throw Trees.unexpected("expression", exprT);
    }
    return located(node, exprT);
  }

  private static NodeFullExpression letExpression(ScillaAST exprT) {
    // ID TYPE_ANNOT? expr expr
    int pos = 1;
    WithMetaData<NodeTypeAnnotation> annotation = null;
    if (exprT.child(pos).getType() == ScillaParser.TYPE_ANNOT) {
      annotation = TypeTree.typeAnnotation(exprT.child(pos));
      pos++;
    }
    assert(exprT.childCount() == pos + 2);
    return new NodeFullExpression.LocalVariableDeclaration(
                  exprT.child(0).getText(), annotation,
                  fullExpression(exprT.child(pos)),
                  fullExpression(exprT.child(pos + 1)));
  }

  private static NodeFullExpression builtin(ScillaAST exprT) {
    // ID TYPE_ARGS? BUILTIN_ARGS
    int pos = 1;
    WithMetaData<NodeContractTypeArguments> typeArgs = null;
    if (exprT.child(pos).getType() == ScillaParser.TYPE_ARGS) {
      typeArgs = TypeTree.contractTypeArguments(exprT.child(pos));
      pos++;
    }
    ScillaAST argsT = exprT.child(pos);
    assert(argsT.getType() == ScillaParser.BUILTIN_ARGS);
    WithMetaData<NodeBuiltinArguments> args = located(
        new NodeBuiltinArguments(IdentifierTree.variables(argsT.children())),
        argsT);
    return new NodeFullExpression.ExpressionBuiltin(
                          exprT.child(0).getText(), typeArgs, args);
  }

  private static NodeFullExpression constructorCall(ScillaAST exprT) {
    // meta TYPE_ARGS? sid*
    int pos = 1;
    WithMetaData<NodeContractTypeArguments> typeArgs = null;
    if (exprT.childCount() > pos &&
        exprT.child(pos).getType() == ScillaParser.TYPE_ARGS) {
      typeArgs = TypeTree.contractTypeArguments(exprT.child(pos));
      pos++;
    }
    return new NodeFullExpression.ConstructorCall(
                  IdentifierTree.metaIdentifier(exprT.child(0)), typeArgs,
                  IdentifierTree.variables(exprT.children(pos)));
  }

  private static WithMetaData<NodeMessageEntry> messageEntry(
                                                  ScillaAST entryT) {
    assert(entryT.childCount() == 2);
    NodeMessageEntry node;
    switch (entryT.getType()) {
      case ScillaParser.MSG_LITERAL:
        node = new NodeMessageEntry.MessageLiteral(
                  IdentifierTree.nameToken(entryT.child(0)),
                  literal(entryT.child(1)));
        break;
      case ScillaParser.MSG_VARIABLE:
        node = new NodeMessageEntry.MessageVariable(
                  IdentifierTree.nameToken(entryT.child(0)),
                  IdentifierTree.variable(entryT.child(1)));
        break;
      default:
        throw Trees.unexpected("message entry", entryT);
    }
    return located(node, entryT);
  }

  public static WithMetaData<NodeValueLiteral> literal(ScillaAST litT) {
    NodeValueLiteral node;
    switch (litT.getType()) {
      case ScillaParser.LIT_INT:
        assert(litT.childCount() == 2);
        node = new NodeValueLiteral.LiteralInt(
            IdentifierTree.typeName(litT.child(0)), litT.child(1).getText());
        break;
      case ScillaParser.LIT_STRING:
        node = new NodeValueLiteral.LiteralString(
                            Trees.unquote(litT.child(0).getText()));
        break;
      case ScillaParser.LIT_HEX:
        node = new NodeValueLiteral.LiteralHex(litT.child(0).getText());
        break;
      case ScillaParser.LIT_EMP:
        assert(litT.childCount() == 2);
        node = new NodeValueLiteral.LiteralEmptyMap(
                            TypeTree.mapKey(litT.child(0)),
                            TypeTree.mapValue(litT.child(1)));
        break;
      default:
        throw Trees.unexpected("literal", litT);
    }
    return located(node, litT);
  }
}
