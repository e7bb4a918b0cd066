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

import org.jspecify.annotations.Nullable;

/**
 * Signals that the computation for a key terminated abnormally, so no value was stored. This occurs
 * when the computation throws an unchecked exception or an error, returns {@code null}, is rejected
 * by the {@link Scheduler}, or its value could not be written to the {@link Store}.
 * <p>
 * This is distinct from a {@link ComputationException}, which reports a failure that the
 * computation signaled deliberately.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public class AbortedComputationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with the detail message and cause.
   *
   * @param message the detail message
   * @param cause the reason that the computation aborted, if known
   */
  public AbortedComputationException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
