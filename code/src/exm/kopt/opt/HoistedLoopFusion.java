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
import java.util.Comparator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

import org.apache.log4j.Logger;

import exm.kopt.ast.Block;
import exm.kopt.ast.For;
import exm.kopt.ast.Node;
import exm.kopt.ast.NodeType;

/**
 * Fuse together loops hoisted into the same pre-header that iterate over
 * the same ranges, e.g. the loops computing invariant temporaries for
 * different statements.
 *
 * The hoisted loops only read values that are not written in the nest,
 * and each writes its own temporaries, so their order doesn't matter.
 * We merge an earlier loop into a later one: each temporary is declared
 * just before its loop, so the later loop comes after all of the
 * declarations.
 */
public class HoistedLoopFusion {

  /**
   * @param logger
   * @param preHeader block the hoisted loops were put in
   * @param hoisted hoisted loops, all children of preHeader
   * @return the hoisted loops remaining in the pre-header
   */
  public static List<For> fuse(Logger logger, final Block preHeader,
                               List<For> hoisted) {
    List<For> sorted = new ArrayList<For>(hoisted);
    Collections.sort(sorted, new Comparator<For>() {
      @Override
      public int compare(For a, For b) {
        return Integer.compare(preHeader.indexOf(a), preHeader.indexOf(b));
      }
    });

    LinkedList<For> mergeCands = new LinkedList<For>(sorted);
    List<For> result = new ArrayList<For>();
    ListIterator<For> it = sorted.listIterator();
    while (it.hasNext()) {
      For loop = it.next();
      mergeCands.removeFirst(); // Don't compare with itself
      For target = null;
      for (For cand: mergeCands) {
        if (fuseable(loop, cand)) {
          target = cand;
          break;
        }
      }
      if (target != null) {
        prependInnermost(loop, target);
        preHeader.remove(loop);
        logger.debug("Fused hoisted loop over " + loop.itVar());
      } else {
        result.add(loop);
      }
    }
    return result;
  }

  /**
   * @return true if both are chains of loops with same headers at each
   *         level, down to blocks of statements
   */
  private static boolean fuseable(For a, For b) {
    For currA = a;
    For currB = b;
    while (currA != null && currB != null) {
      if (!currA.sameHeader(currB)) {
        return false;
      }
      currA = innerLoop(currA);
      currB = innerLoop(currB);
    }
    return currA == null && currB == null;
  }

  /**
   * @return the single loop in loop's body, or null if its body is
   *         straight-line code
   */
  private static For innerLoop(For loop) {
    Block body = loop.getBody();
    if (body.size() == 1 && body.get(0).type() == NodeType.FOR) {
      return (For)body.get(0);
    }
    return null;
  }

  private static Block innermostBody(For loop) {
    For curr = loop;
    For inner;
    while ((inner = innerLoop(curr)) != null) {
      curr = inner;
    }
    return curr.getBody();
  }

  /**
   * Move statements of from into to, ahead of to's statements
   */
  private static void prependInnermost(For from, For to) {
    List<Node> stmts = new ArrayList<Node>(innermostBody(from).getChildren());
    innermostBody(to).insert(0, stmts);
  }
}
