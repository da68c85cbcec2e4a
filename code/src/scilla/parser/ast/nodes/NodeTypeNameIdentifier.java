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

/**
 * A capitalized name: a type, a constructor, a contract or library
 * name, or the Event type.
 */
public abstract class NodeTypeNameIdentifier extends AstNode {
  public enum Kind {
    BYTE_STRING_TYPE,
    EVENT_TYPE,
    TYPE_OR_ENUM_LIKE_IDENTIFIER,
  }

  public static final String EVENT = "Event";

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitTypeNameIdentifier(mode, this);
  }

  public static class ByteStringType extends NodeTypeNameIdentifier {
    private final WithMetaData<NodeByteStr> byteStr;

    public ByteStringType(WithMetaData<NodeByteStr> byteStr) {
      this.byteStr = byteStr;
    }

    public WithMetaData<NodeByteStr> byteStr() {
      return byteStr;
    }

    @Override
    public Kind kind() {
      return Kind.BYTE_STRING_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(byteStr);
    }

    @Override
    public String toString() {
      return byteStr.node().value();
    }
  }

  public static class EventType extends NodeTypeNameIdentifier {
    @Override
    public Kind kind() {
      return Kind.EVENT_TYPE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }

    @Override
    public String toString() {
      return EVENT;
    }
  }

  public static class TypeOrEnumLikeIdentifier extends NodeTypeNameIdentifier {
    private final String name;

    public TypeOrEnumLikeIdentifier(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_OR_ENUM_LIKE_IDENTIFIER;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
