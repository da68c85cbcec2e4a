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

import java.util.List;

import scilla.parser.common.exceptions.AstVisitException;

/**
 * Common traversal for all node kinds.  Subclasses supply the hook to
 * call and their children in declaration order.
 */
public abstract class AstNode implements AstVisitor {

  @Override
  public final TraversalResult visit(AstConverting emitter)
                                          throws AstVisitException {
    TraversalResult entered = emit(TreeTraversalMode.ENTER, emitter);
    if (entered == TraversalResult.SKIP_CHILDREN) {
      return TraversalResult.CONTINUE;
    }

    for (AstVisitor child: children()) {
      TraversalResult childResult = child.visit(emitter);
      if (childResult != TraversalResult.CONTINUE) {
        return childResult;
      }
    }

    return emit(TreeTraversalMode.EXIT, emitter);
  }

  /**
   * Call the backend hook for this node kind
   */
  protected abstract TraversalResult emit(TreeTraversalMode mode,
              AstConverting emitter) throws AstVisitException;

  /**
   * @return children in visiting order, absent optional children omitted
   */
  protected abstract List<AstVisitor> children();
}
