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
 * Declaration of a variable, optionally with an initial value,
 * e.g. {@code double A[3][3];} or {@code int i = 0}.
 */
public class Decl extends Node {

  private final String typ;
  private final Symbol sym;
  private final Node init;

  public Decl(String typ, Symbol sym) {
    this(typ, sym, null);
  }

  /**
   * @param typ C type, including any qualifiers
   * @param sym declared symbol; rank gives array dimensions
   * @param init initial value, or null
   */
  public Decl(String typ, Symbol sym, Node init) {
    this.typ = typ;
    this.sym = sym;
    this.init = init;
  }

  public String getType() {
    return typ;
  }

  public Symbol getSymbol() {
    return sym;
  }

  public String getName() {
    return sym.getName();
  }

  /**
   * @return initial value, or null if none
   */
  public Node getInit() {
    return init;
  }

  @Override
  public NodeType type() {
    return NodeType.DECL;
  }

  @Override
  public Decl copy() {
    return new Decl(typ, sym.copy(), init == null ? null : init.copy());
  }

  /**
   * Render without indentation or terminator, for loop headers
   */
  public void appendInline(StringBuilder sb) {
    sb.append(typ);
    sb.append(' ');
    sym.appendTo(sb);
    if (init != null) {
      sb.append(" = ");
      init.appendTo(sb);
    }
  }

  @Override
  public void appendTo(StringBuilder sb) {
    indent(sb);
    appendInline(sb);
    sb.append(";\n");
  }
}
