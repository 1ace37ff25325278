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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Kernel;
import exm.kopt.ast.Node;
import exm.kopt.ast.NodeType;
import exm.kopt.common.exceptions.UserException;

/**
 * An optimizer pass
 */
public interface OptimizerPass {
  public abstract String getPassName();
  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public abstract String getConfigEnabledKey();
  public abstract void optimize(Logger logger, Kernel kernel)
                                              throws UserException;

  /**
   * Pass that works on each loop nest at the top level of the kernel body
   * separately
   */
  public static abstract class NestOptimizerPass implements OptimizerPass {

    @Override
    public void optimize(Logger logger, Kernel kernel) throws UserException {
      Map<String, Decl> params = new LinkedHashMap<String, Decl>();
      for (Decl p: kernel.getParams()) {
        params.put(p.getName(), p);
      }
      // Copy: passes insert hoisted code into body
      List<For> roots = new ArrayList<For>();
      for (Node n: kernel.getBody().getChildren()) {
        if (n.type() == NodeType.FOR) {
          roots.add((For)n);
        }
      }
      for (For root: roots) {
        optimize(logger, kernel, root, params);
      }
    }

    /**
     * @param root outermost loop of nest, child of kernel body
     * @param params kernel parameters by name
     */
    public abstract void optimize(Logger logger, Kernel kernel, For root,
                          Map<String, Decl> params) throws UserException;
  }
}
