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
 * Binary arithmetic or comparison expression
 */
public class BinExpr extends Node {

  public static enum Operator {
    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    DIV("/"),
    LT("<"),
    LTE("<="),
    ;

    private final String symbol;

    private Operator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  private Node left;
  private Node right;
  private final Operator op;

  public BinExpr(Node left, Node right, Operator op) {
    this.left = left;
    this.right = right;
    this.op = op;
  }

  public static BinExpr plus(Node left, Node right) {
    return new BinExpr(left, right, Operator.PLUS);
  }

  public static BinExpr minus(Node left, Node right) {
    return new BinExpr(left, right, Operator.MINUS);
  }

  public static BinExpr mult(Node left, Node right) {
    return new BinExpr(left, right, Operator.MULT);
  }

  public static BinExpr div(Node left, Node right) {
    return new BinExpr(left, right, Operator.DIV);
  }

  public Node getLeft() {
    return left;
  }

  public void setLeft(Node left) {
    this.left = left;
  }

  public Node getRight() {
    return right;
  }

  public void setRight(Node right) {
    this.right = right;
  }

  public Operator getOp() {
    return op;
  }

  @Override
  public NodeType type() {
    return NodeType.BIN_EXPR;
  }

  @Override
  public BinExpr copy() {
    return new BinExpr(left.copy(), right.copy(), op);
  }

  @Override
  public void appendTo(StringBuilder sb) {
    left.appendTo(sb);
    sb.append(' ');
    sb.append(op.symbol());
    sb.append(' ');
    right.appendTo(sb);
  }
}
