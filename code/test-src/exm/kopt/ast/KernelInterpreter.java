package exm.kopt.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.kopt.ast.BinExpr.Operator;

/**
 * Runs kernel code on doubles so that tests can check transformed code
 * computes the same thing as the untransformed kernel.
 *
 * Arrays are stored flattened, row major.  Integer scalars such as loop
 * variables and sizes live in the same scalar table as other values.
 */
public class KernelInterpreter {

  private final Map<String, Double> scalars = new HashMap<String, Double>();
  private final Map<String, double[]> arrays = new HashMap<String, double[]>();
  private final Map<String, int[]> shapes = new HashMap<String, int[]>();

  public void setScalar(String name, double val) {
    scalars.put(name, val);
  }

  public void setArray(String name, int[] shape, double[] data) {
    shapes.put(name, shape.clone());
    arrays.put(name, data.clone());
  }

  public double[] getArray(String name) {
    return arrays.get(name);
  }

  public void run(Node node) {
    switch (node.type()) {
      case BLOCK:
        for (Node child: ((Block)node).getChildren()) {
          run(child);
        }
        break;
      case FOR: {
        For loop = (For)node;
        String var = loop.itVar();
        scalars.put(var, eval(loop.getInit().getInit()));
        while (eval(loop.getCond()) != 0.0) {
          run(loop.getBody());
          scalars.put(var, scalars.get(var) +
                           eval(loop.getIncr().getValue()));
        }
        break;
      }
      case DECL: {
        Decl decl = (Decl)node;
        Symbol sym = decl.getSymbol();
        if (sym.isArray()) {
          List<String> rank = sym.getRank();
          int[] shape = new int[rank.size()];
          int size = 1;
          for (int i = 0; i < shape.length; i++) {
            shape[i] = index(rank.get(i));
            size *= shape[i];
          }
          setArray(sym.getName(), shape, new double[size]);
        } else if (decl.getInit() != null) {
          scalars.put(sym.getName(), eval(decl.getInit()));
        }
        break;
      }
      case ASSIGN:
      case INCR: {
        Statement stmt = (Statement)node;
        double val = eval(stmt.getValue());
        store(stmt.getTarget(), val, node.type() == NodeType.INCR);
        break;
      }
      default:
        throw new IllegalArgumentException("Can't run " + node.type());
    }
  }

  public double eval(Node node) {
    switch (node.type()) {
      case SYMBOL:
        return load((Symbol)node);
      case PAR:
        return eval(((Par)node).getChild());
      case BIN_EXPR: {
        BinExpr bin = (BinExpr)node;
        double l = eval(bin.getLeft());
        double r = eval(bin.getRight());
        Operator op = bin.getOp();
        switch (op) {
          case PLUS: return l + r;
          case MINUS: return l - r;
          case MULT: return l * r;
          case DIV: return l / r;
          case LT: return l < r ? 1.0 : 0.0;
          case LTE: return l <= r ? 1.0 : 0.0;
          default:
            throw new IllegalArgumentException("Unknown op " + op);
        }
      }
      default:
        throw new IllegalArgumentException("Can't evaluate " + node.type());
    }
  }

  private double load(Symbol sym) {
    if (!sym.isArray()) {
      Double val = scalars.get(sym.getName());
      if (val != null) {
        return val;
      }
      return Double.parseDouble(sym.getName());
    }
    return array(sym)[offset(sym)];
  }

  private void store(Symbol sym, double val, boolean incr) {
    if (!sym.isArray()) {
      double old = incr ? scalars.get(sym.getName()) : 0.0;
      scalars.put(sym.getName(), old + val);
      return;
    }
    double[] data = array(sym);
    int off = offset(sym);
    data[off] = incr ? data[off] + val : val;
  }

  private double[] array(Symbol sym) {
    double[] data = arrays.get(sym.getName());
    if (data == null) {
      throw new IllegalStateException("Undeclared array " + sym.getName());
    }
    return data;
  }

  private int offset(Symbol sym) {
    int[] shape = shapes.get(sym.getName());
    List<String> rank = sym.getRank();
    int off = 0;
    for (int i = 0; i < rank.size(); i++) {
      int ix = index(rank.get(i));
      if (ix < 0 || ix >= shape[i]) {
        throw new IndexOutOfBoundsException(sym + " dimension " + i);
      }
      off = off * shape[i] + ix;
    }
    return off;
  }

  private int index(String r) {
    Double val = scalars.get(r);
    if (val != null) {
      return (int)val.doubleValue();
    }
    return Integer.parseInt(r);
  }
}
