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
 * A statement that writes an expression into a target symbol.
 * May carry a directive, e.g. {@code #pragma pyop2 outerproduct(j,k)},
 * rendered on the line before it.
 */
public abstract class Statement extends Node {

  private final Symbol target;
  private Node value;
  private String directive;

  protected Statement(Symbol target, Node value, String directive) {
    this.target = target;
    this.value = value;
    this.directive = directive;
  }

  public Symbol getTarget() {
    return target;
  }

  public Node getValue() {
    return value;
  }

  public void setValue(Node value) {
    this.value = value;
  }

  /**
   * @return directive text, or null if none
   */
  public String getDirective() {
    return directive;
  }

  public void setDirective(String directive) {
    this.directive = directive;
  }

  /**
   * @return operator joining target and value, e.g. "="
   */
  protected abstract String assignOp();

  public void appendInline(StringBuilder sb) {
    target.appendTo(sb);
    sb.append(' ');
    sb.append(assignOp());
    sb.append(' ');
    value.appendTo(sb);
  }

  @Override
  public void appendTo(StringBuilder sb) {
    if (directive != null) {
      indent(sb);
      sb.append(directive);
      sb.append('\n');
    }
    indent(sb);
    appendInline(sb);
    sb.append(";\n");
  }
}
