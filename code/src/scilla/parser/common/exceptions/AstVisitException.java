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
package scilla.parser.common.exceptions;

import scilla.parser.ast.SourcePosition;

/**
 * Raised by a conversion backend when it cannot handle the node it
 * is visiting.  Aborts the whole traversal.
 */
public class AstVisitException extends ScillaException {

  public AstVisitException(SourcePosition position, String message) {
    super(position, message);
  }

  public AstVisitException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
