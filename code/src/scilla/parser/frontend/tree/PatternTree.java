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
import scilla.parser.ast.nodes.NodeArgumentPattern;
import scilla.parser.ast.nodes.NodePattern;

public class PatternTree {

  /**
   * Parenthesized patterns have already been unwrapped by the grammar.
   */
  public static WithMetaData<NodePattern> pattern(ScillaAST patT) {
    NodePattern node;
    switch (patT.getType()) {
      case ScillaParser.PAT_WILDCARD:
        node = new NodePattern.Wildcard();
        break;
      case ScillaParser.PAT_BINDER:
        node = new NodePattern.Binder(patT.child(0).getText());
        break;
      case ScillaParser.PAT_CONSTRUCTOR: {
        List<WithMetaData<NodeArgumentPattern>> args =
                  new ArrayList<WithMetaData<NodeArgumentPattern>>();
        for (ScillaAST argT: patT.children(1)) {
          args.add(argumentPattern(argT));
        }
        node = new NodePattern.Constructor(
                  IdentifierTree.metaIdentifier(patT.child(0)), args);
        break;
      }
      default:
        throw Trees.unexpected("pattern", patT);
    }
    return located(node, patT);
  }

  public static WithMetaData<NodeArgumentPattern> argumentPattern(
                                                    ScillaAST argT) {
    NodeArgumentPattern node;
    switch (argT.getType()) {
      case ScillaParser.ARG_WILDCARD:
        node = new NodeArgumentPattern.WildcardArgument();
        break;
      case ScillaParser.ARG_BINDER:
        node = new NodeArgumentPattern.BinderArgument(
                                          argT.child(0).getText());
        break;
      case ScillaParser.ARG_CONSTRUCTOR:
        node = new NodeArgumentPattern.ConstructorArgument(
                          IdentifierTree.metaIdentifier(argT.child(0)));
        break;
      case ScillaParser.ARG_PATTERN:
        node = new NodeArgumentPattern.PatternArgument(
                                          pattern(argT.child(0)));
        break;
      default:
        throw Trees.unexpected("argument pattern", argT);
    }
    return located(node, argT);
  }
}
