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
 * A library named in the import list, optionally renamed
 */
public abstract class NodeImportedName extends AstNode {
  public enum Kind {
    REGULAR_IMPORT,
    ALIASED_IMPORT,
  }

  private final WithMetaData<NodeTypeNameIdentifier> name;

  private NodeImportedName(WithMetaData<NodeTypeNameIdentifier> name) {
    this.name = name;
  }

  public abstract Kind kind();

  public WithMetaData<NodeTypeNameIdentifier> name() {
    return name;
  }

  /**
   * @return name the library is referred to by in this contract
   */
  public abstract String localName();

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitImportedName(mode, this);
  }

  public static class RegularImport extends NodeImportedName {
    public RegularImport(WithMetaData<NodeTypeNameIdentifier> name) {
      super(name);
    }

    @Override
    public Kind kind() {
      return Kind.REGULAR_IMPORT;
    }

    @Override
    public String localName() {
      return name().toString();
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name());
    }
  }

  public static class AliasedImport extends NodeImportedName {
    private final WithMetaData<NodeTypeNameIdentifier> alias;

    public AliasedImport(WithMetaData<NodeTypeNameIdentifier> name,
                         WithMetaData<NodeTypeNameIdentifier> alias) {
      super(name);
      this.alias = alias;
    }

    public WithMetaData<NodeTypeNameIdentifier> alias() {
      return alias;
    }

    @Override
    public Kind kind() {
      return Kind.ALIASED_IMPORT;
    }

    @Override
    public String localName() {
      return alias.toString();
    }

    @Override
    protected List<AstVisitor> children() {
      return Children.of(name(), alias);
    }
  }
}
