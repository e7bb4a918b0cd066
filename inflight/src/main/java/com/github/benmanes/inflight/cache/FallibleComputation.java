/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
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
 * limitations under the License.
 */
package com.github.benmanes.inflight.cache;

/**
 * A deferred unit of work that produces the value for an absent key or signals a failure by
 * throwing a checked exception.
 * <p>
 * The same ownership rules as {@link Computation} apply: the computation may be run on any thread
 * after the supplying method has returned, so it must be self-contained.
 * <p>
 * A checked exception is a normal failure: it is propagated verbatim to every caller waiting on the
 * key and nothing is stored. An unchecked exception, an error, or a {@code null} result is an
 * abnormal termination and is reported as an {@link AbortedComputationException}.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <V> the type of the computed value
 */
@FunctionalInterface
public interface FallibleComputation<V> {

  /**
   * Computes the value.
   *
   * @return the value to associate with the key
   * @throws Exception if the value could not be computed
   */
  V compute() throws Exception;
}
