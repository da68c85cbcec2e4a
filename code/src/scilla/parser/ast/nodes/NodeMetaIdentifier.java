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
 * A type or constructor name, possibly qualified by the library or
 * address it comes from.
 */
public abstract class NodeMetaIdentifier extends AstNode {
  public enum Kind {
    META_NAME,
    META_NAME_IN_NAMESPACE,
    META_NAME_IN_HEXSPACE,
    /** The unsized ByStr type */
    BYTE_STRING,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitMetaIdentifier(mode, this);
  }

  public static class MetaName extends NodeMetaIdentifier {
    private final WithMetaData<NodeTypeNameIdentifier> name;

    public MetaName(WithMetaData<NodeTypeNameIdentifier> name) {
      this.name = name;
    }

    public WithMetaData<NodeTypeNameIdentifier> name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.META_NAME;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name);
    }

    @Override
    public String toString() {
      return name.toString();
    }
  }

  public static class MetaNameInNamespace extends NodeMetaIdentifier {
    private final WithMetaData<NodeTypeNameIdentifier> namespace;
    private final WithMetaData<NodeTypeNameIdentifier> name;

    public MetaNameInNamespace(WithMetaData<NodeTypeNameIdentifier> namespace,
                               WithMetaData<NodeTypeNameIdentifier> name) {
      this.namespace = namespace;
      this.name = name;
    }

    public WithMetaData<NodeTypeNameIdentifier> namespace() {
      return namespace;
    }

    public WithMetaData<NodeTypeNameIdentifier> name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.META_NAME_IN_NAMESPACE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(namespace, name);
    }

    @Override
    public String toString() {
      return namespace + "." + name;
    }
  }

  public static class MetaNameInHexspace extends NodeMetaIdentifier {
    private final String hexspace;
    private final WithMetaData<NodeTypeNameIdentifier> name;

    public MetaNameInHexspace(String hexspace,
                              WithMetaData<NodeTypeNameIdentifier> name) {
      this.hexspace = hexspace;
      this.name = name;
    }

    public String hexspace() {
      return hexspace;
    }

    public WithMetaData<NodeTypeNameIdentifier> name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.META_NAME_IN_HEXSPACE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name);
    }

    @Override
    public String toString() {
      return hexspace + "." + name;
    }
  }

  public static class ByteString extends NodeMetaIdentifier {
    @Override
    public Kind kind() {
      return Kind.BYTE_STRING;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }

    @Override
    public String toString() {
      return "ByStr";
    }
  }
}
