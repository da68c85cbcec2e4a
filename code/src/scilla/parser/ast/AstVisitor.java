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
package scilla.parser.ast;

import scilla.parser.common.exceptions.AstVisitException;

/**
 * Implemented by every node of the contract AST.
 */
public interface AstVisitor {

  /**
   * Walk this subtree, calling the backend's hook for each node on entry
   * and on exit.  A hook returning {@link TraversalResult#SKIP_CHILDREN}
   * on entry stops the walk from descending into that node.  The first
   * exception thrown by a hook aborts the walk.
   * @param emitter backend receiving the hooks
   * @return CONTINUE, or the first non-CONTINUE result from the children
   * @throws AstVisitException
   */
  public TraversalResult visit(AstConverting emitter) throws AstVisitException;
}
