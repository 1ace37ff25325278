package exm.kopt.opt;

import java.util.Arrays;

import exm.kopt.ast.BinExpr;
import exm.kopt.ast.Block;
import exm.kopt.ast.For;
import exm.kopt.ast.KernelInterpreter;
import exm.kopt.ast.Node;
import exm.kopt.ast.Par;
import exm.kopt.ast.Symbol;

/**
 * Helpers for building small kernels in tests
 */
class NestFixtures {

  static Symbol a(String name, String ...idx) {
    return Symbol.array(name, idx);
  }

  static Symbol s(String name) {
    return new Symbol(name);
  }

  static Node mul(Node l, Node r) {
    return BinExpr.mult(l, r);
  }

  static Node add(Node l, Node r) {
    return BinExpr.plus(l, r);
  }

  static Node par(Node n) {
    return new Par(n);
  }

  static For loop(String var, String bound, Node ...body) {
    return For.range(var, "0", bound, new Block(Arrays.asList(body)));
  }

  static Block preHeader(Node ...children) {
    return new Block(Arrays.asList(children));
  }

  /**
   * Fill array with distinct, non-trivial values
   */
  static void input(KernelInterpreter interp, String name, int ...shape) {
    int size = 1;
    for (int d: shape) {
      size *= d;
    }
    double[] data = new double[size];
    for (int i = 0; i < size; i++) {
      data[i] = 1.0 + (name.hashCode() % 7) * 0.25 + i * 0.5;
    }
    interp.setArray(name, shape, data);
  }

  static void output(KernelInterpreter interp, String name, int ...shape) {
    int size = 1;
    for (int d: shape) {
      size *= d;
    }
    interp.setArray(name, shape, new double[size]);
  }
}
