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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

/**
 * A named value, possibly an array.
 *
 * In a declaration the rank holds the size of each dimension, in an
 * expression it holds the index used for each dimension.  A symbol with
 * an empty rank is a scalar; numeric literals are represented as scalar
 * symbols too.
 *
 * Each symbol carries the set of loop variables it depends on.  Unless
 * given explicitly this is the identifiers used in the rank entries,
 * so a scalar loop variable used as a value, e.g. {@code x * i}, must be
 * created with its dependency passed in.
 */
public class Symbol extends Node {

  private static final Pattern IDENTIFIER =
                          Pattern.compile("\\b[A-Za-z_][A-Za-z_0-9]*");

  private final String name;
  private final ImmutableList<String> rank;
  private final LoopDeps loopDeps;

  public Symbol(String name) {
    this(name, ImmutableList.<String>of());
  }

  public Symbol(String name, List<String> rank) {
    this(name, rank, depsFromRank(rank));
  }

  public Symbol(String name, List<String> rank, LoopDeps loopDeps) {
    this.name = name;
    this.rank = ImmutableList.copyOf(rank);
    this.loopDeps = loopDeps;
  }

  /**
   * Shorthand for an array access or declaration
   */
  public static Symbol array(String name, String ...rank) {
    return new Symbol(name, ImmutableList.copyOf(rank));
  }

  private static LoopDeps depsFromRank(List<String> rank) {
    List<String> deps = new ArrayList<String>();
    for (String r: rank) {
      // Index may be an expression, e.g. i+1
      Matcher m = IDENTIFIER.matcher(r);
      while (m.find()) {
        deps.add(m.group());
      }
    }
    return LoopDeps.of(deps);
  }

  public String getName() {
    return name;
  }

  public List<String> getRank() {
    return rank;
  }

  public boolean isArray() {
    return !rank.isEmpty();
  }

  public LoopDeps getLoopDeps() {
    return loopDeps;
  }

  @Override
  public NodeType type() {
    return NodeType.SYMBOL;
  }

  @Override
  public Symbol copy() {
    return new Symbol(name, rank, loopDeps);
  }

  @Override
  public void appendTo(StringBuilder sb) {
    sb.append(name);
    for (String r: rank) {
      sb.append('[');
      sb.append(r);
      sb.append(']');
    }
  }
}
