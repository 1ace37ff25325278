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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;

import exm.kopt.ast.Assign;
import exm.kopt.ast.BinExpr;
import exm.kopt.ast.Block;
import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.LoopDeps;
import exm.kopt.ast.Node;
import exm.kopt.ast.NodeType;
import exm.kopt.ast.Par;
import exm.kopt.ast.Statement;
import exm.kopt.ast.Symbol;
import exm.kopt.common.exceptions.KOptRuntimeError;

/**
 * Loop invariant code motion tailored to assembly kernels.
 *
 * Unlike the usual approach of moving things out of the innermost loop,
 * the invariance of each read-only sub-expression is judged against the
 * whole nest.  Each invariant sub-expression is computed into a temporary
 * array, indexed by the loops it depends on, just outside the outermost
 * loop it doesn't depend on.  The computation keeps its own loops so that
 * it can be vectorized.
 *
 * E.g. in nest i-j-k, an expression depending on i and j goes in the body
 * of the i loop, wrapped by a copy of the j loop, and one depending only
 * on j goes before the whole nest, wrapped by a copy of the j loop.
 */
public class LoopHoister {

  /**
   * Where to put the computation of a group of invariant expressions
   */
  private static class Placement {
    final Block block;
    final int offset;
    /** loops to wrap computation in, innermost first */
    final List<For> wrappers;
    /** true if outside nest */
    final boolean inPreHeader;

    Placement(Block block, int offset, List<For> wrappers,
              boolean inPreHeader) {
      this.block = block;
      this.offset = offset;
      this.wrappers = wrappers;
      this.inPreHeader = inPreHeader;
    }
  }

  private final Logger logger;
  private final LoopNest nest;
  /** declarations from outside the nest, e.g. kernel parameters */
  private final Map<String, Decl> outerDecls;
  private final String tempPrefix;
  private final String defaultType;

  public LoopHoister(Logger logger, LoopNest nest,
                     Map<String, Decl> outerDecls, String tempPrefix,
                     String defaultType) {
    this.logger = logger;
    this.nest = nest;
    this.outerDecls = outerDecls;
    this.tempPrefix = tempPrefix;
    this.defaultType = defaultType;
  }

  /**
   * Hoist invariant sub-expressions out of all statements in the nest body
   * @return the hoisted loops placed before the nest, outside it
   */
  public List<For> hoist() {
    Block body = nest.getBody();
    Set<String> written = InvarianceAnalyzer.writtenVars(body);
    InvarianceAnalyzer analyzer = new InvarianceAnalyzer(logger, written);

    List<For> extLoops = new ArrayList<For>();
    for (Node n: body.getChildren()) {
      if (!n.type().isAssignment()) {
        continue;
      }
      Statement stmt = (Statement)n;
      ListMultimap<LoopDeps, Node> groups = analyzer.analyze(stmt);
      if (groups.isEmpty()) {
        continue;
      }
      String typ = tempType(stmt.getTarget().getName());
      Map<Node, Symbol> temps = new IdentityHashMap<Node, Symbol>();
      for (LoopDeps deps: groups.keySet()) {
        Placement place = findPlacement(deps);
        if (place == null) {
          continue;
        }
        For outer = hoistGroup(typ, groups.get(deps), place, temps);
        if (place.inPreHeader) {
          extLoops.add(outer);
        }
      }
      stmt.setValue(substitute(stmt.getValue(), temps));
    }
    return extLoops;
  }

  /**
   * @param deps
   * @return where to compute expressions with dependencies, or null if
   *         they shouldn't be hoisted
   */
  private Placement findPlacement(LoopDeps deps) {
    if (deps.isEmpty()) {
      logger.debug("Not hoisting constant expression");
      return null;
    }
    for (String v: deps) {
      if (nest.findLoop(v) == null) {
        logger.debug("Not hoisting expression depending on " + v +
                     ", not a loop of the nest");
        return null;
      }
    }

    List<For> loops = nest.getLoops();
    For nonDepFor = null;
    for (For l: loops) {
      if (!deps.contains(l.itVar())) {
        nonDepFor = l;
        break;
      }
    }
    if (nonDepFor == null) {
      logger.debug("Not hoisting expression varying with all loops " + deps);
      return null;
    }
    // Faster varying dimension
    For fastFor = nest.findLoop(deps.last());

    int preIdx = -1;
    for (int i = 0; i < loops.size(); i++) {
      For l = loops.get(i);
      if (l == fastFor || l == nonDepFor) {
        break;
      }
      preIdx = i;
    }

    if (preIdx >= 0) {
      // Loops enclosing preLoop's body are all dependencies: they are
      // fixed there, wrap with the remaining ones
      For preLoop = loops.get(preIdx);
      List<For> wrappers = new ArrayList<For>();
      for (String v: deps) {
        For l = nest.findLoop(v);
        if (loops.indexOf(l) > preIdx) {
          wrappers.add(l);
        }
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Placing " + deps + " in body of loop over " +
                     preLoop.itVar() + " wrapped by " +
                     NestExplorer.loopVars(wrappers));
      }
      return new Placement(preLoop.getBody(), 0, wrappers, false);
    } else {
      List<For> wrappers = new ArrayList<For>();
      for (String v: deps) {
        wrappers.add(nest.findLoop(v));
      }
      if (logger.isTraceEnabled()) {
        logger.trace("Placing " + deps + " in pre-header wrapped by " +
                     NestExplorer.loopVars(wrappers));
      }
      int ofs = nest.preHeader.indexOf(nest.root);
      if (ofs < 0) {
        throw new KOptRuntimeError("Nest root no longer in pre-header");
      }
      return new Placement(nest.preHeader, ofs, wrappers, true);
    }
  }

  /**
   * Create temporaries and loops computing exprs and splice them in.
   * @param temps updated with the temporary computing each expression
   * @return outermost new loop
   */
  private For hoistGroup(String typ, List<Node> exprs, Placement place,
                         Map<Node, Symbol> temps) {
    List<For> outerFirst = Lists.reverse(place.wrappers);
    List<String> dims = new ArrayList<String>();
    List<String> indices = new ArrayList<String>();
    for (For w: outerFirst) {
      dims.add(w.size());
      indices.add(w.itVar());
    }
    String innerVar = place.wrappers.get(0).itVar();

    List<Node> newDecls = new ArrayList<Node>();
    List<Node> assigns = new ArrayList<Node>();
    for (Node expr: exprs) {
      String name = freshName(innerVar);
      Decl decl = new Decl(typ, new Symbol(name, dims));
      newDecls.add(decl);
      nest.addDecl(decl);
      nest.addSymbol(name);

      assigns.add(new Assign(new Symbol(name, indices), expr));
      temps.put(expr, new Symbol(name, indices));
    }

    Block block = new Block(assigns, true);
    For loop = null;
    for (For w: place.wrappers) {
      For.Header h = w.copyHeader();
      loop = new For(h.init, h.cond, h.incr, block);
      block = new Block(ImmutableList.of(loop), true);
    }

    List<Node> spliced = new ArrayList<Node>(newDecls);
    spliced.add(loop);
    place.block.insert(place.offset, spliced);

    if (logger.isDebugEnabled()) {
      StringBuilder sb = new StringBuilder();
      for (Node n: spliced) {
        n.setIndentation(0);
        n.appendTo(sb);
      }
      logger.debug("Hoisted " + exprs.size() + " expression(s) " +
                   (place.inPreHeader ? "before nest" : "into nest") +
                   ":\n" + sb);
    }
    return loop;
  }

  /**
   * Replace hoisted sub-expressions with references to their temporary
   * @return node to use in place of node
   */
  private static Node substitute(Node node, Map<Node, Symbol> temps) {
    Symbol temp = temps.get(node);
    if (temp != null) {
      return temp.copy();
    }
    switch (node.type()) {
      case SYMBOL:
        return node;
      case PAR: {
        Par par = (Par)node;
        par.setChild(substitute(par.getChild(), temps));
        return par;
      }
      case BIN_EXPR: {
        BinExpr bin = (BinExpr)node;
        bin.setLeft(substitute(bin.getLeft(), temps));
        bin.setRight(substitute(bin.getRight(), temps));
        return bin;
      }
      default:
        throw new KOptRuntimeError("Unexpected node in expression: " +
                                   node.type());
    }
  }

  /**
   * @return name not declared in the nest, outside it, or in the
   *      pre-header, where other nests may have put their temporaries
   */
  private String freshName(String var) {
    for (int i = 0; ; i++) {
      String name = tempPrefix + "_" + var + "_" + i;
      if (!nest.getDecls().containsKey(name) &&
          !outerDecls.containsKey(name) &&
          !declaredIn(nest.preHeader, name)) {
        return name;
      }
    }
  }

  private static boolean declaredIn(Block block, String name) {
    for (Node n: block.getChildren()) {
      if (n.type() == NodeType.DECL && ((Decl)n).getName().equals(name)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Temporaries have the element type of the statement's target
   */
  private String tempType(String target) {
    Decl decl = nest.getDecls().get(target);
    if (decl == null) {
      decl = outerDecls.get(target);
    }
    if (decl == null) {
      logger.debug("No declaration for " + target + ", temporaries get " +
                   "type " + defaultType);
      return defaultType;
    }
    // Temporaries are written after declaration
    return decl.getType().replace("const ", "").trim();
  }
}
