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

import org.apache.commons.lang3.StringUtils;

/**
 * Signature of a transition callable on a deployed contract
 */
public class Transition {
  private final String name;
  private final FieldList params;

  public Transition(String name, FieldList params) {
    this.name = name;
    this.params = params;
  }

  public static Transition withoutParams(String name) {
    return new Transition(name, new FieldList());
  }

  public String name() {
    return name;
  }

  public FieldList params() {
    return params;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition other = (Transition)obj;
    return name.equals(other.name) && params.equals(other.params);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + params.hashCode();
  }

  @Override
  public String toString() {
    return name + "(" + StringUtils.join(params.asList(), ", ") + ")";
  }
}
