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

import scilla.parser.ast.AstConverting;
import scilla.parser.ast.AstNode;
import scilla.parser.ast.AstVisitor;
import scilla.parser.ast.Children;
import scilla.parser.ast.TraversalResult;
import scilla.parser.ast.TreeTraversalMode;
import scilla.parser.common.exceptions.AstVisitException;

/**
 * A byte string: either a hex constant or the name of a sized
 * byte string type such as ByStr20.
 */
public abstract class NodeByteStr extends AstNode {
  public enum Kind {
    CONSTANT,
    TYPE,
  }

  private final String value;

  private NodeByteStr(String value) {
    this.value = value;
  }

  public abstract Kind kind();

  public String value() {
    return value;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitByteStr(mode, this);
  }

  @Override
  protected List<AstVisitor> children() {
    return Children.NONE;
  }

  @Override
  public String toString() {
    return value;
  }

  public static class Constant extends NodeByteStr {
    public Constant(String hex) {
      super(hex);
    }

    @Override
    public Kind kind() {
      return Kind.CONSTANT;
    }
  }

  public static class Type extends NodeByteStr {
    public Type(String typeName) {
      super(typeName);
    }

    @Override
    public Kind kind() {
      return Kind.TYPE;
    }
  }
}
