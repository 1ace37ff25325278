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

import exm.kopt.ast.For;
import exm.kopt.common.exceptions.ImperfectNestException;
import exm.kopt.common.exceptions.InvalidPermutationException;
import exm.kopt.common.exceptions.KOptRuntimeError;

/**
 * Permute the loops of a perfect nest.  Only the loop headers move:
 * each tree position keeps its node and body, and takes the bounds, step
 * and directive of the loop the permutation assigns to it.
 *
 * No dependence analysis is done: the caller is responsible for the
 * permutation being legal.
 */
public class LoopInterchanger {

  private final Logger logger;
  private final LoopNest nest;

  public LoopInterchanger(Logger logger, LoopNest nest) {
    this.logger = logger;
    this.nest = nest;
  }

  /**
   * @param perm perm[p] is the index (outermost = 0) of the loop that
   *        should end up at position p.  E.g. [1, 0] swaps two loops.
   * @throws InvalidPermutationException if perm is not a permutation of
   *        the loop indices.  Nothing is modified.
   * @throws ImperfectNestException if the nest is no longer perfect.
   *        Nothing is modified.
   */
  public void interchange(int[] perm)
      throws InvalidPermutationException, ImperfectNestException {
    List<For> loops = nest.getLoops();
    checkPermutation(perm, loops.size());

    // Hoisting may have put code inside loop bodies since exploration
    List<For> live = NestExplorer.checkPerfect(nest.root);
    if (live.size() != loops.size()) {
      throw new KOptRuntimeError("Nest depth changed from " + loops.size() +
                                 " to " + live.size());
    }

    List<For.Header> snapshot = new ArrayList<For.Header>(loops.size());
    for (For l: loops) {
      snapshot.add(l.copyHeader());
    }

    for (int pos = 0; pos < live.size(); pos++) {
      live.get(pos).setHeader(snapshot.get(perm[pos]));
    }
    nest.replaceLoops(live);

    if (logger.isDebugEnabled()) {
      logger.debug("Interchanged loops to " + NestExplorer.loopVars(live));
    }
  }

  static void checkPermutation(int[] perm, int loopCount)
      throws InvalidPermutationException {
    if (perm.length != loopCount) {
      throw new InvalidPermutationException(perm, loopCount,
          "expected " + loopCount + " entries");
    }
    boolean[] seen = new boolean[loopCount];
    for (int p: perm) {
      if (p < 0 || p >= loopCount) {
        throw new InvalidPermutationException(perm, loopCount,
            "index " + p + " out of range");
      }
      if (seen[p]) {
        throw new InvalidPermutationException(perm, loopCount,
            "index " + p + " repeated");
      }
      seen[p] = true;
    }
  }
}
