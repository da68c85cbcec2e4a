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
 * A lowercase variable name, a special identifier such as _sender, or a
 * variable qualified by its library.
 */
public abstract class NodeVariableIdentifier extends AstNode {
  public enum Kind {
    VARIABLE_NAME,
    SPECIAL_IDENTIFIER,
    VARIABLE_IN_NAMESPACE,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitVariableIdentifier(mode, this);
  }

  public static class VariableName extends NodeVariableIdentifier {
    private final String name;

    public VariableName(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE_NAME;
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

  public static class SpecialIdentifier extends NodeVariableIdentifier {
    private final String name;

    public SpecialIdentifier(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.SPECIAL_IDENTIFIER;
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

  public static class VariableInNamespace extends NodeVariableIdentifier {
    private final WithMetaData<NodeTypeNameIdentifier> namespace;
    private final String name;

    public VariableInNamespace(WithMetaData<NodeTypeNameIdentifier> namespace,
                               String name) {
      this.namespace = namespace;
      this.name = name;
    }

    public WithMetaData<NodeTypeNameIdentifier> namespace() {
      return namespace;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE_IN_NAMESPACE;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(namespace);
    }

    @Override
    public String toString() {
      return namespace + "." + name;
    }
  }
}
