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

import org.checkerframework.checker.index.qual.NonNegative;

/**
 * The clock that times computations for the {@link Inflight#recordStats() statistics}. Only
 * differences between two readings are meaningful.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@FunctionalInterface
public interface Ticker {

  /** Returns the current reading in nanoseconds. */
  long read();

  /**
   * Returns the nanoseconds elapsed since the {@code startTime} reading. A clock that moved
   * backwards yields zero rather than a negative duration.
   *
   * @param startTime a previous reading of this ticker
   * @return the non-negative elapsed time
   */
  default @NonNegative long elapsedSince(long startTime) {
    return Math.max(0L, read() - startTime);
  }

  /** Returns the ticker backed by {@link System#nanoTime}, used when statistics are recorded. */
  static Ticker systemTicker() {
    return SystemTicker.INSTANCE;
  }

  /** Returns a ticker that is always zero, used when computations are not timed. */
  static Ticker disabledTicker() {
    return DisabledTicker.INSTANCE;
  }
}

enum SystemTicker implements Ticker {
  INSTANCE;

  @Override public long read() {
    return System.nanoTime();
  }
}

enum DisabledTicker implements Ticker {
  INSTANCE;

  @Override public long read() {
    return 0L;
  }

  @Override public long elapsedSince(long startTime) {
    return 0L;
  }
}
