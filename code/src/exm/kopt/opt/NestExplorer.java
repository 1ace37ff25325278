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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.kopt.ast.BinExpr;
import exm.kopt.ast.Block;
import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Node;
import exm.kopt.ast.NodeType;
import exm.kopt.ast.Par;
import exm.kopt.ast.Statement;
import exm.kopt.ast.Symbol;
import exm.kopt.common.exceptions.ImperfectNestException;

/**
 * Explore a perfect loop nest in a single depth first walk, collecting
 * the loops, declarations, array symbols and statement directives.
 */
public class NestExplorer {

  private final Logger logger;
  private final DirectiveParser directives;

  public NestExplorer(Logger logger, String directiveNamespace) {
    this.logger = logger;
    this.directives = new DirectiveParser(logger, directiveNamespace);
  }

  /**
   * @param root outermost loop of nest
   * @param preHeader block holding the root
   * @return information about the nest
   * @throws ImperfectNestException if not a perfect nest directly inside
   *              preHeader
   */
  public LoopNest explore(For root, Block preHeader)
      throws ImperfectNestException {
    if (preHeader.indexOf(root) < 0) {
      throw new ImperfectNestException(root, "Loop over " + root.itVar() +
                          " is not a child of the pre-header block");
    }
    checkPerfect(root);

    LoopNest nest = new LoopNest(root, preHeader);
    inspect(nest, root, null);
    if (logger.isDebugEnabled()) {
      logger.debug("Explored nest of depth " + nest.depth() + " over " +
                   loopVars(nest.getLoops()) + ", arrays " +
                   nest.getSymbols());
    }
    return nest;
  }

  /**
   * Check that each loop body is either exactly one loop or
   * a block of statements without loops.
   * @param root
   * @return loops in the nest, outermost first
   * @throws ImperfectNestException
   */
  public static List<For> checkPerfect(For root)
      throws ImperfectNestException {
    List<For> loops = new ArrayList<For>();
    For curr = root;
    while (curr != null) {
      loops.add(curr);
      Block b = curr.getBody();
      if (b.size() == 1 && b.get(0).type() == NodeType.FOR) {
        curr = (For)b.get(0);
        continue;
      }
      for (Node child: b.getChildren()) {
        if (containsLoop(child)) {
          throw new ImperfectNestException(curr, "Body of loop over " +
              curr.itVar() + " holds a loop alongside other code or " +
              "inside a nested block");
        }
      }
      curr = null;
    }
    return loops;
  }

  private static boolean containsLoop(Node node) {
    switch (node.type()) {
      case FOR:
        return true;
      case BLOCK:
        for (Node child: ((Block)node).getChildren()) {
          if (containsLoop(child)) {
            return true;
          }
        }
        return false;
      default:
        return false;
    }
  }

  public static List<String> loopVars(List<For> loops) {
    List<String> vars = new ArrayList<String>(loops.size());
    for (For l: loops) {
      vars.add(l.itVar());
    }
    return vars;
  }

  private void inspect(LoopNest nest, Node node, Block parent) {
    switch (node.type()) {
      case BLOCK: {
        Block block = (Block)node;
        // Innermost visited wins
        nest.setBody(block);
        for (Node child: block.getChildren()) {
          inspect(nest, child, block);
        }
        break;
      }
      case FOR: {
        For loop = (For)node;
        nest.addLoop(loop);
        inspect(nest, loop.getBody(), parent);
        break;
      }
      case PAR:
        inspect(nest, ((Par)node).getChild(), parent);
        break;
      case DECL:
        nest.addDecl((Decl)node);
        break;
      case SYMBOL: {
        Symbol sym = (Symbol)node;
        if (sym.isArray()) {
          nest.addSymbol(sym.getName());
        }
        break;
      }
      case BIN_EXPR: {
        BinExpr expr = (BinExpr)node;
        inspect(nest, expr.getLeft(), parent);
        inspect(nest, expr.getRight(), parent);
        break;
      }
      case ASSIGN:
      case INCR: {
        Statement stmt = (Statement)node;
        OuterProduct op = directives.parse(stmt, parent,
                                           nest.diagnosticsList());
        if (op != null) {
          nest.addOuterProduct(op);
        }
        inspect(nest, stmt.getTarget(), parent);
        inspect(nest, stmt.getValue(), parent);
        break;
      }
      default:
        // Nothing else of interest
        break;
    }
  }
}
