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
package scilla.parser.common.lang;

/**
 * The deployable surface of a parsed contract: its name, the
 * parameters needed to deploy it, its fields and its transitions.
 */
public class Contract {
  private final String name;
  private final FieldList initParams;
  private final FieldList fields;
  private final TransitionList transitions;

  public Contract(String name, FieldList initParams, FieldList fields,
                  TransitionList transitions) {
    this.name = name;
    this.initParams = initParams;
    this.fields = fields;
    this.transitions = transitions;
  }

  public String name() {
    return name;
  }

  /** Parameters needed to deploy the contract */
  public FieldList initParams() {
    return initParams;
  }

  public FieldList fields() {
    return fields;
  }

  public TransitionList transitions() {
    return transitions;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Contract)) {
      return false;
    }
    Contract other = (Contract)obj;
    return name.equals(other.name) && initParams.equals(other.initParams) &&
           fields.equals(other.fields) && transitions.equals(other.transitions);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = name.hashCode();
    result = prime * result + initParams.hashCode();
    result = prime * result + fields.hashCode();
    result = prime * result + transitions.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "Contract " + name + "\n  init params: " + initParams +
           "\n  fields: " + fields + "\n  transitions: " + transitions;
  }
}
