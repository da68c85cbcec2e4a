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
import scilla.parser.ast.nodes.NodeBlockchainFetchArguments;
import scilla.parser.ast.nodes.NodeMapAccess;
import scilla.parser.ast.nodes.NodePatternMatchClause;
import scilla.parser.ast.nodes.NodeRemoteFetchStatement;
import scilla.parser.ast.nodes.NodeStatement;
import scilla.parser.ast.nodes.NodeStatementBlock;
import scilla.parser.ast.nodes.NodeVariableIdentifier;

public class StmtTree {

  /**
   * @param stmtsT STMTS subtree, possibly with no children
   */
  public static WithMetaData<NodeStatementBlock> statementBlock(
                                                    ScillaAST stmtsT) {
    assert(stmtsT.getType() == ScillaParser.STMTS);
    List<WithMetaData<NodeStatement>> statements =
                      new ArrayList<WithMetaData<NodeStatement>>();
    for (ScillaAST stmtT: stmtsT.children()) {
      statements.add(statement(stmtT));
    }
    return located(new NodeStatementBlock(statements), stmtsT);
  }

  public static WithMetaData<NodeStatement> statement(ScillaAST stmtT) {
    NodeStatement node;
    switch (stmtT.getType()) {
      case ScillaParser.LOAD_STMT: {
        ScillaAST fieldT = stmtT.child(1);
        node = new NodeStatement.Load(stmtT.child(0).getText(), located(
          new NodeVariableIdentifier.VariableName(fieldT.getText()), fieldT));
        break;
      }
      case ScillaParser.REMOTE_FETCH_STMT:
        assert(stmtT.childCount() == 2);
        node = new NodeStatement.RemoteFetch(
            remoteFetch(stmtT.child(0).getText(), stmtT.child(1)));
        break;
      case ScillaParser.STORE_STMT:
        node = new NodeStatement.Store(stmtT.child(0).getText(),
                        IdentifierTree.variable(stmtT.child(1)));
        break;
      case ScillaParser.BIND_STMT:
        node = new NodeStatement.Bind(stmtT.child(0).getText(),
                        ExprTree.fullExpression(stmtT.child(1)));
        break;
      case ScillaParser.READ_BC_STMT: {
        WithMetaData<NodeBlockchainFetchArguments> args = null;
        if (stmtT.childCount() == 3) {
          ScillaAST argsT = stmtT.child(2);
          assert(argsT.getType() == ScillaParser.BC_ARGS);
          args = located(new NodeBlockchainFetchArguments(
                    IdentifierTree.variables(argsT.children())), argsT);
        }
        node = new NodeStatement.ReadFromBC(stmtT.child(0).getText(),
                    IdentifierTree.typeName(stmtT.child(1)), args);
        break;
      }
      case ScillaParser.MAP_GET_STMT:
        node = new NodeStatement.MapGet(stmtT.child(0).getText(),
                    mapKeys(stmtT.child(2)), stmtT.child(1).getText());
        break;
      case ScillaParser.MAP_GET_EXISTS_STMT:
        node = new NodeStatement.MapGetExists(stmtT.child(0).getText(),
                    mapKeys(stmtT.child(2)), stmtT.child(1).getText());
        break;
      case ScillaParser.MAP_UPDATE_STMT:
        node = new NodeStatement.MapUpdate(stmtT.child(0).getText(),
                    mapKeys(stmtT.child(1)),
                    IdentifierTree.variable(stmtT.child(2)));
        break;
      case ScillaParser.MAP_DELETE_STMT:
        node = new NodeStatement.MapUpdateDelete(stmtT.child(0).getText(),
                    mapKeys(stmtT.child(1)));
        break;
      case ScillaParser.ACCEPT_STMT:
        node = new NodeStatement.Accept();
        break;
      case ScillaParser.SEND_STMT:
        node = new NodeStatement.Send(
                    IdentifierTree.variable(stmtT.child(0)));
        break;
      case ScillaParser.EVENT_STMT:
        node = new NodeStatement.CreateEvnt(
                    IdentifierTree.variable(stmtT.child(0)));
        break;
      case ScillaParser.THROW_STMT:
        node = new NodeStatement.Throw(stmtT.childCount() == 0 ? null :
                    IdentifierTree.variable(stmtT.child(0)));
        break;
      case ScillaParser.MATCH_STMT: {
        List<WithMetaData<NodePatternMatchClause>> clauses =
                  new ArrayList<WithMetaData<NodePatternMatchClause>>();
        for (ScillaAST clauseT: stmtT.children(1)) {
          assert(clauseT.getType() == ScillaParser.STMT_CLAUSE);
          clauses.add(located(new NodePatternMatchClause(
                          PatternTree.pattern(clauseT.child(0)),
                          statementBlock(clauseT.child(1))), clauseT));
        }
        node = new NodeStatement.MatchStmt(
                    IdentifierTree.variable(stmtT.child(0)), clauses);
        break;
      }
      case ScillaParser.ITERATE_STMT:
        node = new NodeStatement.Iterate(
                    IdentifierTree.variable(stmtT.child(0)),
                    IdentifierTree.componentId(stmtT.child(1)));
        break;
      case ScillaParser.CALL_PROC_STMT:
        node = new NodeStatement.CallProc(
                    IdentifierTree.componentId(stmtT.child(0)),
                    IdentifierTree.variables(stmtT.children(1)));
        break;
      default:
        throw Trees.unexpected("statement", stmtT);
    }
    return located(node, stmtT);
  }

  private static WithMetaData<NodeRemoteFetchStatement> remoteFetch(
                                      String lhs, ScillaAST fetchT) {
    NodeRemoteFetchStatement node;
    switch (fetchT.getType()) {
      case ScillaParser.RF_FIELD:
        node = new NodeRemoteFetchStatement.ReadStateMutable(lhs,
                    fetchT.child(0).getText(), fetchT.child(1).getText());
        break;
      case ScillaParser.RF_SPECIAL:
        node = new NodeRemoteFetchStatement.ReadStateMutableSpecialId(lhs,
                    fetchT.child(0).getText(), fetchT.child(1).getText());
        break;
      case ScillaParser.RF_MAP:
        node = new NodeRemoteFetchStatement.ReadStateMutableMapAccess(lhs,
                    fetchT.child(0).getText(), fetchT.child(1).getText(),
                    mapKeys(fetchT.child(2)));
        break;
      case ScillaParser.RF_MAP_EXISTS:
        node = new NodeRemoteFetchStatement.ReadStateMutableMapAccessExists(
                    lhs, fetchT.child(0).getText(), fetchT.child(1).getText(),
                    mapKeys(fetchT.child(2)));
        break;
      case ScillaParser.RF_CAST:
        node = new NodeRemoteFetchStatement.ReadStateMutableCastAddress(lhs,
                    IdentifierTree.variable(fetchT.child(0)),
                    TypeTree.addressType(fetchT.child(1)));
        break;
      default:
        throw Trees.unexpected("remote fetch", fetchT);
    }
    return located(node, fetchT);
  }

  /**
   * @param keysT MAP_KEYS subtree
   */
  private static List<WithMetaData<NodeMapAccess>> mapKeys(
                                                  ScillaAST keysT) {
    assert(keysT.getType() == ScillaParser.MAP_KEYS);
    List<WithMetaData<NodeMapAccess>> keys =
                      new ArrayList<WithMetaData<NodeMapAccess>>();
    for (ScillaAST keyT: keysT.children()) {
      keys.add(located(new NodeMapAccess(IdentifierTree.variable(keyT)),
                       keyT));
    }
    return keys;
  }
}
