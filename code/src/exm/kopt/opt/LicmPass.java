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

import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Kernel;
import exm.kopt.common.Settings;
import exm.kopt.common.exceptions.ImperfectNestException;
import exm.kopt.common.exceptions.InvalidOptionException;
import exm.kopt.opt.OptimizerPass.NestOptimizerPass;

/**
 * Hoist invariant sub-expressions out of each loop nest, then fuse the
 * loops computing them where possible.
 */
public class LicmPass extends NestOptimizerPass {

  @Override
  public String getPassName() {
    return "Loop invariant code motion";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_LICM;
  }

  @Override
  public void optimize(Logger logger, Kernel kernel, For root,
                       Map<String, Decl> params)
                           throws InvalidOptionException {
    LoopOptimizer opt;
    try {
      opt = new LoopOptimizer(logger, root, kernel.getBody(), params);
    } catch (ImperfectNestException e) {
      logger.warn("Skipping LICM for nest in " + kernel.getName() + ": " +
                  e.getMessage());
      return;
    }

    List<For> hoisted = opt.licm();
    logger.debug("Hoisted " + hoisted.size() + " loop(s) out of nest over " +
                 root.itVar() + " in " + kernel.getName());
    if (hoisted.size() > 1 && Settings.getBoolean(Settings.OPT_FUSE_HOISTED)) {
      HoistedLoopFusion.fuse(logger, kernel.getBody(), hoisted);
    }
  }
}
