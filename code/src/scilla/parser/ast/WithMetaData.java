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
 * Envelope carrying the source range of a node.  Visiting it brackets
 * the visit of the node with a push and pop of the source position.
 * @param <T> node type
 */
public class WithMetaData<T extends AstVisitor> implements AstVisitor {
  private final T node;
  private final SourcePosition start;
  private final SourcePosition end;

  public WithMetaData(T node, SourcePosition start, SourcePosition end) {
    assert(node != null);
    this.node = node;
    this.start = start;
    this.end = end;
  }

  /**
   * Wrap a node with no known position.  Used for synthesized nodes.
   */
  public static <T extends AstVisitor> WithMetaData<T> unknown(T node) {
    return new WithMetaData<T>(node, SourcePosition.UNKNOWN,
                               SourcePosition.UNKNOWN);
  }

  public T node() {
    return node;
  }

  public SourcePosition start() {
    return start;
  }

  public SourcePosition end() {
    return end;
  }

  @Override
  public TraversalResult visit(AstConverting emitter) throws AstVisitException {
    emitter.pushSourcePosition(start, end);
    try {
      return node.visit(emitter);
    } finally {
      emitter.popSourcePosition();
    }
  }

  @Override
  public String toString() {
    return node.toString();
  }
}
