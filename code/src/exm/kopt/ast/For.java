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

import exm.kopt.ast.BinExpr.Operator;
import exm.kopt.common.exceptions.KOptRuntimeError;

/**
 * Counted C for loop, e.g.
 * <pre>
 * for (int i = 0; i &lt; 3; i += 1) { ... }
 * </pre>
 * The header is expected to be in the canonical form above: the init
 * declares the iteration variable with its start value, the condition
 * compares the iteration variable against the bound with {@code <} or
 * {@code <=}, and the increment adds the step.
 */
public class For extends Node {

  /**
   * Everything about the loop except its body.
   */
  public static class Header {
    public final Decl init;
    public final BinExpr cond;
    public final Incr incr;
    public final String directive;

    public Header(Decl init, BinExpr cond, Incr incr, String directive) {
      this.init = init;
      this.cond = cond;
      this.incr = incr;
      this.directive = directive;
    }

    public Header copy() {
      return new Header(init.copy(), cond.copy(), incr.copy(), directive);
    }
  }

  private Decl init;
  private BinExpr cond;
  private Incr incr;
  private String directive;
  private final Block body;

  public For(Decl init, BinExpr cond, Incr incr, Block body) {
    this(init, cond, incr, body, null);
  }

  public For(Decl init, BinExpr cond, Incr incr, Block body,
             String directive) {
    this.init = init;
    this.cond = cond;
    this.incr = incr;
    this.body = body;
    this.directive = directive;
  }

  /**
   * Loop {@code for (int var = start; var < bound; var += 1)}
   */
  public static For range(String var, String start, String bound,
                          Block body) {
    return new For(new Decl("int", new Symbol(var), new Symbol(start)),
                   new BinExpr(new Symbol(var), new Symbol(bound), Operator.LT),
                   new Incr(new Symbol(var), new Symbol("1")), body);
  }

  public Decl getInit() {
    return init;
  }

  public BinExpr getCond() {
    return cond;
  }

  public Incr getIncr() {
    return incr;
  }

  public Block getBody() {
    return body;
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
   * @return deep copy of header fields
   */
  public Header copyHeader() {
    return new Header(init, cond, incr, directive).copy();
  }

  /**
   * Replace header fields, leaving body alone
   */
  public void setHeader(Header header) {
    this.init = header.init;
    this.cond = header.cond;
    this.incr = header.incr;
    this.directive = header.directive;
  }

  public String itVar() {
    return init.getName();
  }

  public String start() {
    if (init.getInit() == null) {
      throw new KOptRuntimeError("Loop over " + itVar() +
                                 " has no start value");
    }
    return init.getInit().toString();
  }

  public String bound() {
    checkCond();
    return cond.getRight().toString();
  }

  public String step() {
    return incr.getValue().toString();
  }

  /**
   * @return number of elements an array indexed by the iteration variable
   *         must have, i.e. the exclusive upper bound.
   */
  public String size() {
    checkCond();
    String bound = bound();
    if (cond.getOp() == Operator.LT) {
      return bound;
    }
    try {
      return Integer.toString(Integer.parseInt(bound) + 1);
    } catch (NumberFormatException e) {
      return "(" + bound + " + 1)";
    }
  }

  private void checkCond() {
    if (cond.getOp() != Operator.LT && cond.getOp() != Operator.LTE) {
      throw new KOptRuntimeError("Unsupported loop condition: " + cond);
    }
  }

  /**
   * @return true if other iterates the same variable over the same range
   */
  public boolean sameHeader(For other) {
    return headerString().equals(other.headerString());
  }

  private String headerString() {
    StringBuilder sb = new StringBuilder();
    sb.append("for (");
    init.appendInline(sb);
    sb.append("; ");
    cond.appendTo(sb);
    sb.append("; ");
    incr.appendInline(sb);
    sb.append(")");
    return sb.toString();
  }

  @Override
  public NodeType type() {
    return NodeType.FOR;
  }

  @Override
  public For copy() {
    return new For(init.copy(), cond.copy(), incr.copy(), body.copy(),
                   directive);
  }

  @Override
  public void appendTo(StringBuilder sb) {
    if (directive != null) {
      indent(sb);
      sb.append(directive);
      sb.append('\n');
    }
    indent(sb);
    sb.append(headerString());
    sb.append(" {\n");
    body.setIndentation(indentation + indentWidth);
    body.appendChildren(sb);
    indent(sb);
    sb.append("}\n");
  }
}
