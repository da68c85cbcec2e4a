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
 * Name of a transition or procedure, either capitalized or lowercase
 */
public abstract class NodeComponentId extends AstNode {
  public enum Kind {
    WITH_TYPE_LIKE_NAME,
    WITH_REGULAR_ID,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitComponentId(mode, this);
  }

  public static class WithTypeLikeName extends NodeComponentId {
    private final WithMetaData<NodeTypeNameIdentifier> name;

    public WithTypeLikeName(WithMetaData<NodeTypeNameIdentifier> name) {
      this.name = name;
    }

    public WithMetaData<NodeTypeNameIdentifier> name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.WITH_TYPE_LIKE_NAME;
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

  public static class WithRegularId extends NodeComponentId {
    private final String name;

    public WithRegularId(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.WITH_REGULAR_ID;
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
