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
 * Parenthesized expression
 */
public class Par extends Node {

  private Node child;

  public Par(Node child) {
    this.child = child;
  }

  public Node getChild() {
    return child;
  }

  public void setChild(Node child) {
    this.child = child;
  }

  @Override
  public NodeType type() {
    return NodeType.PAR;
  }

  @Override
  public Par copy() {
    return new Par(child.copy());
  }

  @Override
  public void appendTo(StringBuilder sb) {
    sb.append('(');
    child.appendTo(sb);
    sb.append(')');
  }
}
