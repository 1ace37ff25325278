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
package exm.kopt.common.exceptions;

import exm.kopt.ast.Node;

/**
 * Raised when a loop nest handed to the optimizer is not perfectly nested,
 * i.e. some loop body holds something besides the next loop.
 */
public class ImperfectNestException extends UserException {

  private final Node offending;

  public ImperfectNestException(Node offending, String message) {
    super(message);
    this.offending = offending;
  }

  /**
   * @return the node at which the nest stopped being perfect
   */
  public Node getOffending() {
    return offending;
  }

  private static final long serialVersionUID = 1L;
}
