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

import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import exm.kopt.ast.BinExpr;
import exm.kopt.ast.Block;
import exm.kopt.ast.LoopDeps;
import exm.kopt.ast.Node;
import exm.kopt.ast.NodeType;
import exm.kopt.ast.Par;
import exm.kopt.ast.Statement;
import exm.kopt.ast.Symbol;
import exm.kopt.common.exceptions.KOptRuntimeError;

/**
 * Find sub-expressions of a statement that don't depend on all loops of
 * the nest it sits in, grouped by the exact set of loops they do
 * depend on.
 *
 * Only read-only values are considered: any symbol written by some
 * statement of the nest body is treated as varying, and so is any
 * expression built over it.  This is a syntactic approximation, there is
 * no alias analysis.
 */
public class InvarianceAnalyzer {

  /**
   * Result of analyzing one sub-expression
   */
  public static class Dependency {
    public static final Dependency VARIANT =
                          new Dependency(LoopDeps.NONE, false);

    public final LoopDeps deps;
    /** true if the whole expression can be hoisted as one piece */
    public final boolean invariant;

    public Dependency(LoopDeps deps, boolean invariant) {
      this.deps = deps;
      this.invariant = invariant;
    }

    @Override
    public String toString() {
      return (invariant ? "invariant " : "variant ") + deps;
    }
  }

  private final Logger logger;

  /** symbols written in nest body */
  private final Set<String> written;

  public InvarianceAnalyzer(Logger logger, Set<String> written) {
    this.logger = logger;
    this.written = written;
  }

  /**
   * @return names of all targets of assignments in block
   */
  public static Set<String> writtenVars(Block body) {
    Set<String> written = new HashSet<String>();
    for (Node n: body.getChildren()) {
      if (n.type().isAssignment()) {
        written.add(((Statement)n).getTarget().getName());
      }
    }
    return written;
  }

  /**
   * Find maximal invariant sub-expressions of a statement's value.
   * @param stmt
   * @return map from dependency set to the invariant expressions with
   *      that set, in the order found.  The same node never appears twice.
   */
  public ListMultimap<LoopDeps, Node> analyze(Statement stmt) {
    ListMultimap<LoopDeps, Node> groups =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    Dependency top = computeDependency(stmt.getValue(), groups);
    if (logger.isTraceEnabled()) {
      logger.trace("Statement " + stmt.getTarget() + ": " + top +
                   ", invariant groups " + groups.keySet());
    }
    return groups;
  }

  /**
   * @param expr
   * @param groups add invariant sub-expressions of expr that are maximal,
   *               i.e. whose parent is not invariant, here
   * @return dependency of expr as a whole
   */
  public Dependency computeDependency(Node expr,
                          ListMultimap<LoopDeps, Node> groups) {
    switch (expr.type()) {
      case SYMBOL: {
        Symbol sym = (Symbol)expr;
        return new Dependency(sym.getLoopDeps(),
                              !written.contains(sym.getName()));
      }
      case PAR:
        return computeDependency(((Par)expr).getChild(), groups);
      case BIN_EXPR: {
        BinExpr bin = (BinExpr)expr;
        Node left = bin.getLeft();
        Node right = bin.getRight();
        Dependency l = computeDependency(left, groups);
        Dependency r = computeDependency(right, groups);

        if (l.invariant && r.invariant) {
          if (l.deps.equals(r.deps)) {
            // Children match up: may be part of a larger invariant
            // expression
            return new Dependency(l.deps, true);
          } else if (l.deps.isEmpty()) {
            return new Dependency(r.deps, true);
          } else if (r.deps.isEmpty()) {
            return new Dependency(l.deps, true);
          }
        }
        // Children can't be combined: each side that was invariant
        // on its own is maximal
        addGroup(groups, left, l);
        addGroup(groups, right, r);
        return Dependency.VARIANT;
      }
      default:
        throw new KOptRuntimeError("Unexpected node in expression: " +
                                   expr.type());
    }
  }

  private void addGroup(ListMultimap<LoopDeps, Node> groups, Node expr,
                        Dependency dep) {
    // Hoisting a bare symbol gains nothing
    if (dep.invariant && expr.type() != NodeType.SYMBOL) {
      groups.put(dep.deps, expr);
    }
  }
}
