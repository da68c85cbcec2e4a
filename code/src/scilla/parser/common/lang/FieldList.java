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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Fields in declaration order.  Equality is order sensitive.
 */
public class FieldList implements Iterable<Field> {
  private final ArrayList<Field> fields;

  public FieldList() {
    this.fields = new ArrayList<Field>();
  }

  public FieldList(List<Field> fields) {
    this.fields = new ArrayList<Field>(fields);
  }

  public static FieldList of(Field ...fields) {
    FieldList result = new FieldList();
    for (Field f: fields) {
      result.add(f);
    }
    return result;
  }

  public void add(Field field) {
    fields.add(field);
  }

  public Field get(int i) {
    return fields.get(i);
  }

  public int size() {
    return fields.size();
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  public List<Field> asList() {
    return Collections.unmodifiableList(fields);
  }

  @Override
  public Iterator<Field> iterator() {
    return asList().iterator();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof FieldList && fields.equals(((FieldList)obj).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "[" + StringUtils.join(fields, ", ") + "]";
  }
}
