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

/**
 * A name seen during lowering.  The kind and resolved name are filled
 * in once the surrounding construct is known.
 */
public class SrIdentifier {
  private final String unresolved;
  private String resolved;
  private String typeReference;
  private SrIdentifierKind kind;
  private boolean isDefinition;

  public SrIdentifier(String unresolved, SrIdentifierKind kind) {
    this.unresolved = unresolved;
    this.kind = kind;
    this.resolved = null;
    this.typeReference = null;
    this.isDefinition = false;
  }

  /**
   * @return name as spelled in the source
   */
  public String unresolved() {
    return unresolved;
  }

  /**
   * @return namespace qualified name, or null if not resolved yet
   */
  public String resolved() {
    return resolved;
  }

  public void setResolved(String resolved) {
    this.resolved = resolved;
  }

  /**
   * @return declared type of a state variable, or null
   */
  public String typeReference() {
    return typeReference;
  }

  public void setTypeReference(String typeReference) {
    this.typeReference = typeReference;
  }

  public SrIdentifierKind kind() {
    return kind;
  }

  public void setKind(SrIdentifierKind kind) {
    this.kind = kind;
  }

  public boolean isDefinition() {
    return isDefinition;
  }

  public void setDefinition(boolean isDefinition) {
    this.isDefinition = isDefinition;
  }

  /**
   * @return resolved name if known, otherwise the source name in brackets
   */
  public String qualifiedName() {
    if (resolved != null) {
      return resolved;
    }
    return "[" + unresolved + "]";
  }

  @Override
  public String toString() {
    return kind + " " + qualifiedName() + (isDefinition ? " (def)" : "");
  }
}
