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
import scilla.parser.ast.WithMetaData;
import scilla.parser.common.exceptions.AstVisitException;

public abstract class NodeValueLiteral extends AstNode {
  public enum Kind {
    LITERAL_INT,
    LITERAL_HEX,
    LITERAL_STRING,
    LITERAL_EMPTY_MAP,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitValueLiteral(mode, this);
  }

  /** e.g. <code>Uint128 42</code> */
  public static class LiteralInt extends NodeValueLiteral {
    private final WithMetaData<NodeTypeNameIdentifier> typeName;
    private final String value;

    public LiteralInt(WithMetaData<NodeTypeNameIdentifier> typeName,
                      String value) {
      this.typeName = typeName;
      this.value = value;
    }

    public WithMetaData<NodeTypeNameIdentifier> typeName() {
      return typeName;
    }

    public String value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL_INT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(typeName);
    }
  }

  public static class LiteralHex extends NodeValueLiteral {
    private final String value;

    public LiteralHex(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL_HEX;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class LiteralString extends NodeValueLiteral {
    private final String value;

    /**
     * @param value string contents without the surrounding quotes
     */
    public LiteralString(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL_STRING;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  /** <code>Emp K V</code> */
  public static class LiteralEmptyMap extends NodeValueLiteral {
    private final WithMetaData<NodeTypeMapKey> key;
    private final WithMetaData<NodeTypeMapValue> value;

    public LiteralEmptyMap(WithMetaData<NodeTypeMapKey> key,
                           WithMetaData<NodeTypeMapValue> value) {
      this.key = key;
      this.value = value;
    }

    public WithMetaData<NodeTypeMapKey> key() {
      return key;
    }

    public WithMetaData<NodeTypeMapValue> value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL_EMPTY_MAP;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(key, value);
    }
  }
}
