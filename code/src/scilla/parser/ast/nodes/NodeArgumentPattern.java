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
 * Argument of a constructor pattern.  Nested constructor patterns
 * with arguments must be parenthesized.
 */
public abstract class NodeArgumentPattern extends AstNode {
  public enum Kind {
    WILDCARD_ARGUMENT,
    BINDER_ARGUMENT,
    CONSTRUCTOR_ARGUMENT,
    PATTERN_ARGUMENT,
  }

  public abstract Kind kind();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitArgumentPattern(mode, this);
  }

  public static class WildcardArgument extends NodeArgumentPattern {
    @Override
    public Kind kind() {
      return Kind.WILDCARD_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class BinderArgument extends NodeArgumentPattern {
    private final String name;

    public BinderArgument(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.BINDER_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.NONE;
    }
  }

  public static class ConstructorArgument extends NodeArgumentPattern {
    private final WithMetaData<NodeMetaIdentifier> constructor;

    public ConstructorArgument(WithMetaData<NodeMetaIdentifier> constructor) {
      this.constructor = constructor;
    }

    public WithMetaData<NodeMetaIdentifier> constructor() {
      return constructor;
    }

    @Override
    public Kind kind() {
      return Kind.CONSTRUCTOR_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(constructor);
    }
  }

  public static class PatternArgument extends NodeArgumentPattern {
    private final WithMetaData<NodePattern> pattern;

    public PatternArgument(WithMetaData<NodePattern> pattern) {
      this.pattern = pattern;
    }

    public WithMetaData<NodePattern> pattern() {
      return pattern;
    }

    @Override
    public Kind kind() {
      return Kind.PATTERN_ARGUMENT;
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(pattern);
    }
  }
}
