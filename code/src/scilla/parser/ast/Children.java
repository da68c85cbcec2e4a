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

import com.google.common.collect.ImmutableList;

/**
 * Builds the ordered child list of a node, skipping absent children.
 */
public class Children {
  private final ImmutableList.Builder<AstVisitor> children =
                                          ImmutableList.builder();

  public static final List<AstVisitor> NONE = ImmutableList.of();

  public static Children start() {
    return new Children();
  }

  /**
   * @param child may be null if absent
   */
  public Children add(AstVisitor child) {
    if (child != null) {
      children.add(child);
    }
    return this;
  }

  public Children addAll(List<? extends AstVisitor> list) {
    children.addAll(list);
    return this;
  }

  public List<AstVisitor> build() {
    return children.build();
  }

  public static List<AstVisitor> of(AstVisitor ...list) {
    Children c = start();
    for (AstVisitor child: list) {
      c.add(child);
    }
    return c.build();
  }
}
