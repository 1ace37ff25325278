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

import org.apache.log4j.Logger;

import exm.kopt.ast.Kernel;
import exm.kopt.common.exceptions.UserException;

public class KernelOptimizer {

  /**
   * Optimize the loop nests of the kernel in place.
   *
   * Interchange goes first: it needs perfect nests, which LICM may
   * break up by hoisting code into loop bodies.
   * @param logger
   * @param kernel
   * @throws UserException if a configured transformation can't be applied
   */
  public static void optimize(Logger logger, Kernel kernel)
      throws UserException {
    if (logger.isTraceEnabled()) {
      logger.trace("Kernel before optimization:\n" + kernel);
    }
    OptimizerPipeline pipeline = new OptimizerPipeline();
    pipeline.addPass(new LoopInterchangePass());
    pipeline.addPass(new LicmPass());
    pipeline.runPipeline(logger, kernel);
  }
}
