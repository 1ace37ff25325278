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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.kopt.ast.Block;
import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Statement;
import exm.kopt.common.Settings;
import exm.kopt.common.exceptions.ImperfectNestException;
import exm.kopt.common.exceptions.InvalidPermutationException;

/**
 * Optimizer for one perfect loop nest of an assembly kernel.
 *
 * The nest is explored once on construction.  The optimizer then owns
 * the nest and its pre-header: {@link #licm()} and
 * {@link #interchange(int[])} modify them in place, along with the
 * declaration and symbol tables.
 */
public class LoopOptimizer {

  private final Logger logger;
  private final LoopNest nest;
  private final Map<String, Decl> outerDecls;

  public LoopOptimizer(Logger logger, For loopNest, Block preHeader)
      throws ImperfectNestException {
    this(logger, loopNest, preHeader, Collections.<String, Decl>emptyMap());
  }

  /**
   * @param logger
   * @param loopNest outermost loop of a perfect nest
   * @param preHeader block holding loopNest
   * @param outerDecls declarations visible to the nest from outside it,
   *          e.g. kernel parameters
   * @throws ImperfectNestException
   */
  public LoopOptimizer(Logger logger, For loopNest, Block preHeader,
                       Map<String, Decl> outerDecls)
      throws ImperfectNestException {
    this.logger = logger;
    this.outerDecls = outerDecls;
    NestExplorer explorer = new NestExplorer(logger,
                            Settings.get(Settings.DIRECTIVE_NAMESPACE));
    this.nest = explorer.explore(loopNest, preHeader);
  }

  /**
   * Loop-invariant code motion over the whole nest.
   * @return loops computing temporaries that were placed in the
   *         pre-header, outside the nest.  Callers may fuse these with
   *         the ones from other nests.
   */
  public List<For> licm() {
    LoopHoister hoister = new LoopHoister(logger, nest, outerDecls,
        Settings.get(Settings.LICM_TEMP_PREFIX),
        Settings.get(Settings.LICM_DEFAULT_TYPE));
    return hoister.hoist();
  }

  /**
   * Permute the loops in the nest.
   * @param perm perm[p] is the loop to place at position p, e.g. if
   *        perm[0] = 1, the second loop becomes the outermost
   * @throws InvalidPermutationException if perm isn't a permutation;
   *        nothing is modified
   * @throws ImperfectNestException if licm() put code between the loops;
   *        nothing is modified
   */
  public void interchange(int ...perm)
      throws InvalidPermutationException, ImperfectNestException {
    new LoopInterchanger(logger, nest).interchange(perm);
  }

  public LoopNest getNest() {
    return nest;
  }

  public List<For> getLoops() {
    return nest.getLoops();
  }

  public Map<String, Decl> getDecls() {
    return nest.getDecls();
  }

  public List<String> getSymbols() {
    return nest.getSymbols();
  }

  public Map<Statement, OuterProduct> getOuterProducts() {
    return nest.getOuterProducts();
  }

  public List<Diagnostic> getDiagnostics() {
    return nest.getDiagnostics();
  }
}
