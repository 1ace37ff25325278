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

/**
 * Increment of target by value, {@code target += value}
 */
public class Incr extends Statement {

  public Incr(Symbol target, Node value) {
    this(target, value, null);
  }

  public Incr(Symbol target, Node value, String directive) {
    super(target, value, directive);
  }

  @Override
  public NodeType type() {
    return NodeType.INCR;
  }

  @Override
  protected String assignOp() {
    return "+=";
  }

  @Override
  public Incr copy() {
    return new Incr(getTarget().copy(), getValue().copy(), getDirective());
  }
}
