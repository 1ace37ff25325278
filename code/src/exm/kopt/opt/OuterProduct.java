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
package exm.kopt.opt;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.kopt.ast.Block;
import exm.kopt.ast.Statement;

/**
 * Record of a statement marked as an outer product of two iteration
 * variables, a candidate for register tiling.  We only record these:
 * the tiling itself is done elsewhere.
 */
public class OuterProduct {
  public final Statement statement;
  /** the two iteration variables, in directive order */
  public final List<String> itVars;
  /** block holding the statement */
  public final Block parent;

  public OuterProduct(Statement statement, List<String> itVars,
                      Block parent) {
    this.statement = statement;
    this.itVars = ImmutableList.copyOf(itVars);
    this.parent = parent;
  }

  @Override
  public String toString() {
    return "outerproduct" + itVars;
  }
}
