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

import com.google.common.collect.ImmutableList;

import scilla.parser.ast.AstConverting;
import scilla.parser.ast.AstNode;
import scilla.parser.ast.AstVisitor;
import scilla.parser.ast.Children;
import scilla.parser.ast.TraversalResult;
import scilla.parser.ast.TreeTraversalMode;
import scilla.parser.ast.WithMetaData;
import scilla.parser.common.exceptions.AstVisitException;

public abstract class NodePattern extends AstNode {
  public enum Kind {
    WILDCARD,
    BINDER,
    CONSTRUCTOR,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitPattern(mode, this);
  }

  public static class Wildcard extends NodePattern {
    @Override
    public Kind kind() {
      return Kind.WILDCARD;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class Binder extends NodePattern {
    private final String name;

    public Binder(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.BINDER;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class Constructor extends NodePattern {
    private final WithMetaData<NodeMetaIdentifier> constructor;
    private final List<WithMetaData<NodeArgumentPattern>> arguments;

    public Constructor(WithMetaData<NodeMetaIdentifier> constructor,
                       List<WithMetaData<NodeArgumentPattern>> arguments) {
      this.constructor = constructor;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public WithMetaData<NodeMetaIdentifier> constructor() {
      return constructor;
    }

    public List<WithMetaData<NodeArgumentPattern>> arguments() {
      return arguments;
    }

    @Override
    public Kind kind() {
      return Kind.CONSTRUCTOR;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.start().add(constructor).addAll(arguments).build();
    }
  }
}
