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
package exm.kopt.ast;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The set of loop iteration variables whose value an expression may vary
 * with.  Compared as a set, but remembers the order variables were first
 * seen in: the last one is taken as the fastest varying.
 */
public final class LoopDeps implements Iterable<String> {

  public static final LoopDeps NONE = new LoopDeps(ImmutableSet.<String>of());

  private final ImmutableSet<String> vars;

  private LoopDeps(ImmutableSet<String> vars) {
    this.vars = vars;
  }

  public static LoopDeps of(String ...vars) {
    return of(ImmutableList.copyOf(vars));
  }

  public static LoopDeps of(Collection<String> vars) {
    if (vars.isEmpty()) {
      return NONE;
    }
    return new LoopDeps(ImmutableSet.copyOf(vars));
  }

  public boolean isEmpty() {
    return vars.isEmpty();
  }

  public int size() {
    return vars.size();
  }

  public boolean contains(String var) {
    return vars.contains(var);
  }

  /**
   * @return variables in the order they were first seen
   */
  public List<String> asList() {
    return vars.asList();
  }

  public String last() {
    return vars.asList().get(vars.size() - 1);
  }

  @Override
  public Iterator<String> iterator() {
    return vars.iterator();
  }

  @Override
  public int hashCode() {
    return vars.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LoopDeps)) {
      return false;
    }
    return vars.equals(((LoopDeps)obj).vars);
  }

  @Override
  public String toString() {
    return vars.toString();
  }
}
