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
import java.util.regex.Pattern;

import scilla.parser.ast.ScillaAST;
import scilla.parser.ast.WithMetaData;
import scilla.parser.ast.antlr.ScillaParser;
import scilla.parser.ast.nodes.NodeByteStr;
import scilla.parser.ast.nodes.NodeComponentId;
import scilla.parser.ast.nodes.NodeMetaIdentifier;
import scilla.parser.ast.nodes.NodeTypeNameIdentifier;
import scilla.parser.ast.nodes.NodeVariableIdentifier;

/**
 * Builds identifier nodes from name tokens and the small identifier
 * subtrees of the grammar.
 */
public class IdentifierTree {
  private static final Pattern SIZED_BYSTR = Pattern.compile("ByStr[0-9]+");

  /** Name of the unsized byte string type */
  public static final String BYSTR = "ByStr";

  /**
   * @param cidT a CID token
   */
  public static WithMetaData<NodeTypeNameIdentifier> typeName(ScillaAST cidT) {
    assert(cidT.getType() == ScillaParser.CID);
    String name = cidT.getText();
    NodeTypeNameIdentifier node;
    if (name.equals(NodeTypeNameIdentifier.EVENT)) {
      node = new NodeTypeNameIdentifier.EventType();
    } else if (SIZED_BYSTR.matcher(name).matches()) {
      node = new NodeTypeNameIdentifier.ByteStringType(
                        located(new NodeByteStr.Type(name), cidT));
    } else {
      node = new NodeTypeNameIdentifier.TypeOrEnumLikeIdentifier(name);
    }
    return located(node, cidT);
  }

  /**
   * @param tree a META, META_NS or META_HEX subtree
   */
  public static WithMetaData<NodeMetaIdentifier> metaIdentifier(
                                                  ScillaAST tree) {
    NodeMetaIdentifier node;
    switch (tree.getType()) {
      case ScillaParser.META: {
        assert(tree.childCount() == 1);
        ScillaAST cidT = tree.child(0);
        if (cidT.getText().equals(BYSTR)) {
          node = new NodeMetaIdentifier.ByteString();
        } else {
          node = new NodeMetaIdentifier.MetaName(typeName(cidT));
        }
        break;
      }
      case ScillaParser.META_NS:
        assert(tree.childCount() == 2);
        node = new NodeMetaIdentifier.MetaNameInNamespace(
                  typeName(tree.child(0)), typeName(tree.child(1)));
        break;
      case ScillaParser.META_HEX:
        assert(tree.childCount() == 2);
        node = new NodeMetaIdentifier.MetaNameInHexspace(
                  tree.child(0).getText(), typeName(tree.child(1)));
        break;
      default:
        throw Trees.unexpected("meta identifier", tree);
    }
    return located(node, tree);
  }

  /**
   * @param tree a VAR, VAR_NS or VAR_SPECIAL subtree
   */
  public static WithMetaData<NodeVariableIdentifier> variable(
                                                  ScillaAST tree) {
    NodeVariableIdentifier node;
    switch (tree.getType()) {
      case ScillaParser.VAR:
        node = new NodeVariableIdentifier.VariableName(
                                          tree.child(0).getText());
        break;
      case ScillaParser.VAR_SPECIAL:
        node = new NodeVariableIdentifier.SpecialIdentifier(
                                          tree.child(0).getText());
        break;
      case ScillaParser.VAR_NS:
        assert(tree.childCount() == 2);
        node = new NodeVariableIdentifier.VariableInNamespace(
                    typeName(tree.child(0)), tree.child(1).getText());
        break;
      default:
        throw Trees.unexpected("variable", tree);
    }
    return located(node, tree);
  }

  public static List<WithMetaData<NodeVariableIdentifier>> variables(
                                            List<ScillaAST> trees) {
    List<WithMetaData<NodeVariableIdentifier>> result =
              new ArrayList<WithMetaData<NodeVariableIdentifier>>();
    for (ScillaAST tree: trees) {
      result.add(variable(tree));
    }
    return result;
  }

  /**
   * Plain name token used as a variable, e.g. a message key
   * @param tree an ID or SPID token
   */
  public static WithMetaData<NodeVariableIdentifier> nameToken(
                                                  ScillaAST tree) {
    NodeVariableIdentifier node;
    if (tree.getType() == ScillaParser.SPID) {
      node = new NodeVariableIdentifier.SpecialIdentifier(tree.getText());
    } else if (tree.getType() == ScillaParser.ID) {
      node = new NodeVariableIdentifier.VariableName(tree.getText());
    } else {
      throw Trees.unexpected("name", tree);
    }
    return located(node, tree);
  }

  /**
   * @param tree a COMPONENT_CID or COMPONENT_ID subtree
   */
  public static WithMetaData<NodeComponentId> componentId(ScillaAST tree) {
    assert(tree.childCount() == 1);
    NodeComponentId node;
    switch (tree.getType()) {
      case ScillaParser.COMPONENT_CID:
        node = new NodeComponentId.WithTypeLikeName(typeName(tree.child(0)));
        break;
      case ScillaParser.COMPONENT_ID:
        node = new NodeComponentId.WithRegularId(tree.child(0).getText());
        break;
      default:
        throw Trees.unexpected("component name", tree);
    }
    return located(node, tree);
  }
}
