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

import scilla.parser.common.lang.FieldList;

/**
 * Interface attached to an address type: the kind word and the
 * declared fields
 */
public class AddressType {
  private final String typeName;
  private final FieldList fields;

  /**
   * @param typeName "contract", "library" or ""
   */
  public AddressType(String typeName, FieldList fields) {
    this.typeName = typeName;
    this.fields = fields;
  }

  public String typeName() {
    return typeName;
  }

  public FieldList fields() {
    return fields;
  }

  @Override
  public String toString() {
    return "with " + typeName + " " + fields;
  }
}
