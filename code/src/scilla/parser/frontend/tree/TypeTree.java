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
import scilla.parser.ast.nodes.NodeAddressType;
import scilla.parser.ast.nodes.NodeAddressTypeField;
import scilla.parser.ast.nodes.NodeContractTypeArguments;
import scilla.parser.ast.nodes.NodeScillaType;
import scilla.parser.ast.nodes.NodeTypeAnnotation;
import scilla.parser.ast.nodes.NodeTypeArgument;
import scilla.parser.ast.nodes.NodeTypeMapEntry;
import scilla.parser.ast.nodes.NodeTypeMapKey;
import scilla.parser.ast.nodes.NodeTypeMapValue;
import scilla.parser.ast.nodes.NodeTypedIdentifier;
import scilla.parser.ast.nodes.NodeVariableIdentifier;

public class TypeTree {

  /**
   * Build a type from a subtree corresponding to a scilla_type rule
   * in the grammar
   */
  public static WithMetaData<NodeScillaType> scillaType(ScillaAST typeT) {
    NodeScillaType node;
    switch (typeT.getType()) {
      case ScillaParser.TYPE_APP: {
        assert(typeT.childCount() >= 1);
        node = new NodeScillaType.GenericTypeWithArgs(
                    IdentifierTree.metaIdentifier(typeT.child(0)),
                    typeArguments(typeT.children(1)));
        break;
      }
      case ScillaParser.MAP_TYPE:
        assert(typeT.childCount() == 2);
        node = new NodeScillaType.MapType(mapKey(typeT.child(0)),
                                          mapValue(typeT.child(1)));
        break;
      case ScillaParser.FUN_TYPE:
        assert(typeT.childCount() == 2);
        node = new NodeScillaType.FunctionType(scillaType(typeT.child(0)),
                                               scillaType(typeT.child(1)));
        break;
      case ScillaParser.POLY_TYPE:
        assert(typeT.childCount() == 2);
        node = new NodeScillaType.PolyFunctionType(typeT.child(0).getText(),
                                               scillaType(typeT.child(1)));
        break;
      case ScillaParser.PAREN_TYPE:
        assert(typeT.childCount() == 1);
        node = new NodeScillaType.EnclosedType(scillaType(typeT.child(0)));
        break;
      case ScillaParser.ADDR_TYPE:
        node = new NodeScillaType.AddressType(addressType(typeT));
        break;
      case ScillaParser.TYPE_VAR:
        node = new NodeScillaType.TypeVarType(typeT.child(0).getText());
        break;
      default:
        throw Trees.unexpected("type", typeT);
    }
    return located(node, typeT);
  }

  /**
   * @param addrT ADDR_TYPE subtree:
   *    base name, ADDR_KIND with optional kind word, then fields
   */
  public static WithMetaData<NodeAddressType> addressType(ScillaAST addrT) {
    assert(addrT.getType() == ScillaParser.ADDR_TYPE);
    assert(addrT.childCount() >= 2);
    ScillaAST kindT = addrT.child(1);
    assert(kindT.getType() == ScillaParser.ADDR_KIND);
    String kind = kindT.childCount() == 0 ? "" : kindT.child(0).getText();

    List<WithMetaData<NodeAddressTypeField>> fields =
                  new ArrayList<WithMetaData<NodeAddressTypeField>>();
    for (ScillaAST fieldT: addrT.children(2)) {
      assert(fieldT.getType() == ScillaParser.ADDR_FIELD);
      assert(fieldT.childCount() == 2);
      ScillaAST nameT = fieldT.child(0);
      WithMetaData<NodeVariableIdentifier> name = located(
          new NodeVariableIdentifier.VariableName(nameT.getText()), nameT);
      fields.add(located(new NodeAddressTypeField(name,
                                  scillaType(fieldT.child(1))), fieldT));
    }
    return located(new NodeAddressType(
            IdentifierTree.typeName(addrT.child(0)), kind, fields), addrT);
  }

  public static WithMetaData<NodeTypeArgument> typeArgument(ScillaAST argT) {
    NodeTypeArgument node;
    switch (argT.getType()) {
      case ScillaParser.TARG_ENCLOSED:
        node = new NodeTypeArgument.EnclosedTypeArgument(
                                        scillaType(argT.child(0)));
        break;
      case ScillaParser.TARG_META:
        node = new NodeTypeArgument.GenericTypeArgument(
                          IdentifierTree.metaIdentifier(argT.child(0)));
        break;
      case ScillaParser.TARG_TVAR:
        node = new NodeTypeArgument.TemplateTypeArgument(
                                        argT.child(0).getText());
        break;
      case ScillaParser.TARG_ADDRESS:
        node = new NodeTypeArgument.AddressTypeArgument(
                                        addressType(argT.child(0)));
        break;
      case ScillaParser.TARG_MAP:
        assert(argT.childCount() == 2);
        node = new NodeTypeArgument.MapTypeArgument(mapKey(argT.child(0)),
                                                    mapValue(argT.child(1)));
        break;
      default:
        throw Trees.unexpected("type argument", argT);
    }
    return located(node, argT);
  }

  public static List<WithMetaData<NodeTypeArgument>> typeArguments(
                                              List<ScillaAST> args) {
    List<WithMetaData<NodeTypeArgument>> result =
                  new ArrayList<WithMetaData<NodeTypeArgument>>();
    for (ScillaAST argT: args) {
      result.add(typeArgument(argT));
    }
    return result;
  }

  /**
   * @param argsT TYPE_ARGS subtree from a braced type argument list
   */
  public static WithMetaData<NodeContractTypeArguments>
                              contractTypeArguments(ScillaAST argsT) {
    assert(argsT.getType() == ScillaParser.TYPE_ARGS);
    return located(new NodeContractTypeArguments(
                          typeArguments(argsT.children())), argsT);
  }

  public static WithMetaData<NodeTypeMapKey> mapKey(ScillaAST keyT) {
    NodeTypeMapKey node;
    switch (keyT.getType()) {
      case ScillaParser.MKEY:
        node = new NodeTypeMapKey.GenericMapKey(
                        IdentifierTree.metaIdentifier(keyT.child(0)));
        break;
      case ScillaParser.MKEY_ENCLOSED:
        node = new NodeTypeMapKey.EnclosedGenericId(
                        IdentifierTree.metaIdentifier(keyT.child(0)));
        break;
      case ScillaParser.MKEY_ADDRESS:
        node = new NodeTypeMapKey.AddressMapKeyType(
                        addressType(keyT.child(0)));
        break;
      case ScillaParser.MKEY_ENCLOSED_ADDRESS:
        node = new NodeTypeMapKey.EnclosedAddressMapKeyType(
                        addressType(keyT.child(0)));
        break;
      default:
        throw Trees.unexpected("map key", keyT);
    }
    return located(node, keyT);
  }

  public static WithMetaData<NodeTypeMapValue> mapValue(ScillaAST valT) {
    NodeTypeMapValue node;
    switch (valT.getType()) {
      case ScillaParser.MVAL_META:
        node = new NodeTypeMapValue.MapValueTypeOrEnumLikeIdentifier(
                        IdentifierTree.metaIdentifier(valT.child(0)));
        break;
      case ScillaParser.MVAL_MAP: {
        assert(valT.childCount() == 2);
        NodeTypeMapEntry entry = new NodeTypeMapEntry(
                      mapKey(valT.child(0)), mapValue(valT.child(1)));
        node = new NodeTypeMapValue.MapKeyValue(located(entry, valT));
        break;
      }
      case ScillaParser.MVAL_PAREN:
        node = new NodeTypeMapValue.MapValueParenthesizedType(
                        scillaType(valT.child(0)));
        break;
      case ScillaParser.MVAL_ADDRESS:
        node = new NodeTypeMapValue.MapValueAddressType(
                        addressType(valT.child(0)));
        break;
      default:
        throw Trees.unexpected("map value", valT);
    }
    return located(node, valT);
  }

  /**
   * @param annotT TYPE_ANNOT subtree
   */
  public static WithMetaData<NodeTypeAnnotation> typeAnnotation(
                                                    ScillaAST annotT) {
    assert(annotT.getType() == ScillaParser.TYPE_ANNOT);
    return located(new NodeTypeAnnotation(scillaType(annotT.child(0))),
                   annotT);
  }

  /**
   * Name and type, as found in parameters, fields and function arguments
   * @param nameT ID token
   * @param typeT type subtree
   * @param declT subtree covering the whole declaration
   */
  public static WithMetaData<NodeTypedIdentifier> typedIdentifier(
              ScillaAST nameT, ScillaAST typeT, ScillaAST declT) {
    assert(nameT.getType() == ScillaParser.ID);
    WithMetaData<NodeTypeAnnotation> annotation =
          located(new NodeTypeAnnotation(scillaType(typeT)), typeT);
    return located(new NodeTypedIdentifier(nameT.getText(), annotation),
                   declT);
  }
}
