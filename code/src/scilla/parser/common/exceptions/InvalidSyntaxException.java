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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Source text rejected by the lexer or parser.
 */
public class InvalidSyntaxException extends ScillaException {

  private final List<String> diagnostics;

  public InvalidSyntaxException(List<String> diagnostics) {
    super("Syntax error: " + StringUtils.join(diagnostics, "; "));
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public InvalidSyntaxException(String message) {
    super(message);
    this.diagnostics = ImmutableList.of(message);
  }

  /**
   * @return every diagnostic reported, in the order reported
   */
  public List<String> getDiagnostics() {
    return diagnostics;
  }

  private static final long serialVersionUID = 1060914609057739598L;
}
