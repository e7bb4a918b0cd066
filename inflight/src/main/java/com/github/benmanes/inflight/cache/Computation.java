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
 * A deferred unit of work that produces the value for an absent key and cannot fail normally.
 * <p>
 * A computation is handed to the cache's {@link Scheduler} and may be run on any thread, possibly
 * after the method that supplied it has returned. It must be self-contained: it owns, or shares
 * through thread-safe objects, everything it reads. The compiler enforces the part of this
 * contract that concerns the caller's frame, as a lambda may only capture effectively final local
 * variables and captures them by value.
 * <pre>{@code
 *   String name = request.name();
 *   Profile profile = cache.getOrInsertWith(id, () -> profiles.load(id, name));
 * }</pre>
 * Any exception thrown by {@link #compute} is treated as an abnormal termination and reported to
 * every waiting caller as an {@link AbortedComputationException}. Use a
 * {@link FallibleComputation} when failure is an expected result.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <V> the type of the computed value
 */
@FunctionalInterface
public interface Computation<V> {

  /**
   * Computes the value. A {@code null} result is treated as an abnormal termination.
   *
   * @return the value to associate with the key
   */
  V compute();
}
