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
package com.github.benmanes.inflight.cache.stats;

import org.checkerframework.checker.index.qual.NonNegative;

import com.github.benmanes.inflight.cache.Cache;

/**
 * Accumulates statistics during the operation of a {@link Cache} for presentation by
 * {@link Cache#stats}. This is solely intended for consumption by {@code Cache} implementors.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface StatsCounter {

  /**
   * Records cache hits. This should be called when a lookup returns a committed value.
   *
   * @param count the number of hits to record
   */
  void recordHits(@NonNegative int count);

  /**
   * Records cache misses. This should be called by every caller whose lookup did not find a
   * committed value, whether it starts the computation or waits on one started by another caller.
   *
   * @param count the number of misses to record
   */
  void recordMisses(@NonNegative int count);

  /**
   * Records callers that attached to a computation already in progress for their key, in addition
   * to their miss.
   *
   * @param count the number of coalesced callers to record
   */
  void recordCoalesced(@NonNegative int count);

  /**
   * Records a computation whose value was stored. This should only be called once per computation,
   * regardless of how many callers were waiting on it.
   *
   * @param computeTime the number of nanoseconds spent computing the value
   */
  void recordComputeSuccess(@NonNegative long computeTime);

  /**
   * Records a computation that failed or terminated abnormally. This should only be called once per
   * computation, regardless of how many callers were waiting on it.
   *
   * @param computeTime the number of nanoseconds spent before the failure was observed
   */
  void recordComputeFailure(@NonNegative long computeTime);

  /**
   * Returns a snapshot of this counter's values. Note that this may be an inconsistent view, as it
   * may be interleaved with update operations.
   *
   * @return a snapshot of this counter's values
   */
  CacheStats snapshot();

  /**
   * Returns an accumulator that does not record any cache events.
   *
   * @return an accumulator that does not record metrics
   */
  static StatsCounter disabledStatsCounter() {
    return DisabledStatsCounter.INSTANCE;
  }

  /**
   * Returns an accumulator that suppresses and logs any exception thrown by the delegate
   * {@code statsCounter}.
   *
   * @param statsCounter the accumulator to delegate to
   * @return an accumulator that suppresses and logs any exception thrown by the delegate
   */
  static StatsCounter guardedStatsCounter(StatsCounter statsCounter) {
    return (statsCounter instanceof GuardedStatsCounter)
        ? statsCounter
        : new GuardedStatsCounter(statsCounter);
  }
}
