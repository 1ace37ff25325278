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

import java.util.Arrays;

/**
 * Loop interchange was requested with something that is not a permutation
 * of the loop indices.  Nothing was modified when this is thrown.
 */
public class InvalidPermutationException extends UserException {

  private final int[] permutation;
  private final int loopCount;

  public InvalidPermutationException(int[] permutation, int loopCount,
                                     String reason) {
    super("Invalid loop permutation " + Arrays.toString(permutation) +
          " for nest of depth " + loopCount + ": " + reason);
    this.permutation = permutation.clone();
    this.loopCount = loopCount;
  }

  public int[] getPermutation() {
    return permutation.clone();
  }

  public int getLoopCount() {
    return loopCount;
  }

  private static final long serialVersionUID = 1L;
}
