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

import exm.kopt.ast.Kernel;
import exm.kopt.common.Settings;
import exm.kopt.common.exceptions.InvalidOptionException;
import exm.kopt.common.exceptions.KOptRuntimeError;
import exm.kopt.common.exceptions.UserException;

public class OptimizerPipeline {

  private final List<OptimizerPass> passes = new ArrayList<OptimizerPass>();

  public void addPass(OptimizerPass pass) {
    passes.add(pass);
  }

  public void runPipeline(Logger logger, Kernel kernel) throws UserException {
    for (OptimizerPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Kernel: " + kernel.getName() + " Pass: "
                   + pass.getPassName());
        pass.optimize(logger, kernel);
        if (logger.isTraceEnabled()) {
          logger.trace("Kernel after " + pass.getPassName() + ":\n" +
                       kernel);
        }
      } else {
        logger.debug("Pass disabled: " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(OptimizerPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new KOptRuntimeError("Expected config key " +
          pass.getConfigEnabledKey() + " to exist: " + e.getMessage());
    }
  }
}
