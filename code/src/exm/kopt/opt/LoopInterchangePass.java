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

import java.util.Arrays;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Kernel;
import exm.kopt.common.Settings;
import exm.kopt.common.exceptions.ImperfectNestException;
import exm.kopt.common.exceptions.UserException;
import exm.kopt.opt.OptimizerPass.NestOptimizerPass;

/**
 * Permute the loops of every nest with depth matching the configured
 * permutation.
 */
public class LoopInterchangePass extends NestOptimizerPass {

  @Override
  public String getPassName() {
    return "Loop interchange";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_INTERCHANGE;
  }

  @Override
  public void optimize(Logger logger, Kernel kernel, For root,
                       Map<String, Decl> params) throws UserException {
    int[] perm = Settings.getPermutation(Settings.OPT_INTERCHANGE_PERM);
    if (perm == null) {
      return;
    }

    LoopOptimizer opt;
    try {
      opt = new LoopOptimizer(logger, root, kernel.getBody(), params);
    } catch (ImperfectNestException e) {
      logger.warn("Skipping interchange for nest in " + kernel.getName() +
                  ": " + e.getMessage());
      return;
    }
    if (opt.getLoops().size() != perm.length) {
      logger.warn("Skipping interchange for nest over " +
          NestExplorer.loopVars(opt.getLoops()) + " in " + kernel.getName() +
          ": permutation " + Arrays.toString(perm) + " is for depth " +
          perm.length);
      return;
    }
    opt.interchange(perm);
  }
}
