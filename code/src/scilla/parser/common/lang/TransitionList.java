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
 * Transitions in declaration order.  Equality is order sensitive.
 */
public class TransitionList implements Iterable<Transition> {
  private final ArrayList<Transition> transitions;

  public TransitionList() {
    this.transitions = new ArrayList<Transition>();
  }

  public TransitionList(List<Transition> transitions) {
    this.transitions = new ArrayList<Transition>(transitions);
  }

  public static TransitionList of(Transition ...transitions) {
    TransitionList result = new TransitionList();
    for (Transition t: transitions) {
      result.add(t);
    }
    return result;
  }

  public void add(Transition transition) {
    transitions.add(transition);
  }

  public Transition get(int i) {
    return transitions.get(i);
  }

  public int size() {
    return transitions.size();
  }

  public boolean isEmpty() {
    return transitions.isEmpty();
  }

  public List<Transition> asList() {
    return Collections.unmodifiableList(transitions);
  }

  @Override
  public Iterator<Transition> iterator() {
    return asList().iterator();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TransitionList &&
           transitions.equals(((TransitionList)obj).transitions);
  }

  @Override
  public int hashCode() {
    return transitions.hashCode();
  }

  @Override
  public String toString() {
    return "[" + StringUtils.join(transitions, ", ") + "]";
  }
}
