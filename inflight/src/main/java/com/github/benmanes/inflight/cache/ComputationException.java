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

import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link Cache#getOrTryInsertWith} when the {@link FallibleComputation} for the key threw
 * a checked exception. The cause is the exception thrown by the computation; every caller that
 * waited on the same computation observes the same cause instance.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ComputationException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for the failure thrown by a computation.
   *
   * @param cause the exception thrown by the computation
   */
  public ComputationException(Throwable cause) {
    super(requireNonNull(cause));
  }
}
