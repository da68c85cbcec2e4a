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
package scilla.parser.sr;

import scilla.parser.common.lang.Field;

/**
 * Entry on the lowering engine's operand stack
 */
public class StackObject {
  public enum Kind {
    IDENTIFIER,
    VARIABLE_DECLARATION,
    TYPE_DEFINITION,
  }

  private final Kind kind;
  private final SrIdentifier identifier;
  private final Field declaration;
  private final SrType typeDefinition;

  private StackObject(Kind kind, SrIdentifier identifier,
                      Field declaration, SrType typeDefinition) {
    this.kind = kind;
    this.identifier = identifier;
    this.declaration = declaration;
    this.typeDefinition = typeDefinition;
  }

  public static StackObject identifier(SrIdentifier identifier) {
    return new StackObject(Kind.IDENTIFIER, identifier, null, null);
  }

  public static StackObject variableDeclaration(Field declaration) {
    return new StackObject(Kind.VARIABLE_DECLARATION, null, declaration,
                           null);
  }

  public static StackObject typeDefinition(SrType typeDefinition) {
    return new StackObject(Kind.TYPE_DEFINITION, null, null,
                           typeDefinition);
  }

  public Kind kind() {
    return kind;
  }

  public SrIdentifier identifier() {
    assert(kind == Kind.IDENTIFIER);
    return identifier;
  }

  public Field declaration() {
    assert(kind == Kind.VARIABLE_DECLARATION);
    return declaration;
  }

  public SrType typeDefinition() {
    assert(kind == Kind.TYPE_DEFINITION);
    return typeDefinition;
  }

  @Override
  public String toString() {
    switch (kind) {
      case IDENTIFIER:
        return "identifier " + identifier;
      case VARIABLE_DECLARATION:
        return "variable declaration " + declaration;
      default:
        return "type definition " + typeDefinition;
    }
  }
}
