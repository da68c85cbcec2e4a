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
 * Root of a parsed contract source file
 */
public class NodeProgram extends AstNode {
  private final String version;
  private final WithMetaData<NodeImportDeclarations> importDeclarations;
  private final WithMetaData<NodeLibraryDefinition> libraryDefinition;
  private final WithMetaData<NodeContractDefinition> contractDefinition;

  /**
   * @param importDeclarations null if no imports
   * @param libraryDefinition null if no library
   */
  public NodeProgram(String version,
            WithMetaData<NodeImportDeclarations> importDeclarations,
            WithMetaData<NodeLibraryDefinition> libraryDefinition,
            WithMetaData<NodeContractDefinition> contractDefinition) {
    this.version = version;
    this.importDeclarations = importDeclarations;
    this.libraryDefinition = libraryDefinition;
    this.contractDefinition = contractDefinition;
  }

  public String version() {
    return version;
  }

  public WithMetaData<NodeImportDeclarations> importDeclarations() {
    return importDeclarations;
  }

  public WithMetaData<NodeLibraryDefinition> libraryDefinition() {
    return libraryDefinition;
  }

  public WithMetaData<NodeContractDefinition> contractDefinition() {
    return contractDefinition;
  }

  @Override
  protected TraversalResult emit(TreeTraversalMode mode,
      AstConverting emitter) throws AstVisitException {
    return emitter.emitProgram(mode, this);
  }

  @Override
  protected List<AstVisitor> children() {
    return Children.of(importDeclarations, libraryDefinition,
                       contractDefinition);
  }
}
