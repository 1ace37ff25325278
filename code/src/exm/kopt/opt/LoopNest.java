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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.kopt.ast.Block;
import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Statement;

/**
 * What we know about a perfect loop nest: the loops, outermost first,
 * the innermost block of statements, declarations and array symbols seen,
 * and the directives found on statements.
 *
 * Transformations update this in place as they modify the tree.
 */
public class LoopNest {

  /** outermost loop of nest */
  public final For root;

  /** block holding the root */
  public final Block preHeader;

  private List<For> loops;

  /** innermost statement block */
  private Block body;

  private final Map<String, Decl> decls = new LinkedHashMap<String, Decl>();

  private final List<String> symbols = new ArrayList<String>();

  private final Map<Statement, OuterProduct> outerProducts =
                              new LinkedHashMap<Statement, OuterProduct>();

  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  LoopNest(For root, Block preHeader) {
    this.root = root;
    this.preHeader = preHeader;
    this.loops = new ArrayList<For>();
  }

  /**
   * @return loops in nest order, outermost first
   */
  public List<For> getLoops() {
    return Collections.unmodifiableList(loops);
  }

  public int depth() {
    return loops.size();
  }

  /**
   * @return loop with iteration variable, or null
   */
  public For findLoop(String itVar) {
    for (For loop: loops) {
      if (loop.itVar().equals(itVar)) {
        return loop;
      }
    }
    return null;
  }

  public Block getBody() {
    return body;
  }

  public Map<String, Decl> getDecls() {
    return Collections.unmodifiableMap(decls);
  }

  public List<String> getSymbols() {
    return Collections.unmodifiableList(symbols);
  }

  public Map<Statement, OuterProduct> getOuterProducts() {
    return Collections.unmodifiableMap(outerProducts);
  }

  public List<Diagnostic> getDiagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  void addLoop(For loop) {
    loops.add(loop);
  }

  void replaceLoops(List<For> newLoops) {
    this.loops = new ArrayList<For>(newLoops);
  }

  void setBody(Block body) {
    this.body = body;
  }

  void addDecl(Decl decl) {
    decls.put(decl.getName(), decl);
  }

  /**
   * Add symbol if not already present
   */
  void addSymbol(String name) {
    if (!symbols.contains(name)) {
      symbols.add(name);
    }
  }

  void addOuterProduct(OuterProduct op) {
    outerProducts.put(op.statement, op);
  }

  List<Diagnostic> diagnosticsList() {
    return diagnostics;
  }
}
