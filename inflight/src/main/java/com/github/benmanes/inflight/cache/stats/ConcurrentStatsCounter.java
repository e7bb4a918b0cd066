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

import java.util.concurrent.atomic.LongAdder;

/**
 * A thread-safe {@link StatsCounter} implementation backed by {@link LongAdder}s.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ConcurrentStatsCounter implements StatsCounter {
  private final LongAdder hitCount;
  private final LongAdder missCount;
  private final LongAdder coalescedCount;
  private final LongAdder computeSuccessCount;
  private final LongAdder computeFailureCount;
  private final LongAdder totalComputeTime;

  /**
   * Constructs an instance with all counts initialized to zero.
   */
  public ConcurrentStatsCounter() {
    hitCount = new LongAdder();
    missCount = new LongAdder();
    coalescedCount = new LongAdder();
    computeSuccessCount = new LongAdder();
    computeFailureCount = new LongAdder();
    totalComputeTime = new LongAdder();
  }

  @Override
  public void recordHits(int count) {
    hitCount.add(count);
  }

  @Override
  public void recordMisses(int count) {
    missCount.add(count);
  }

  @Override
  public void recordCoalesced(int count) {
    coalescedCount.add(count);
  }

  @Override
  public void recordComputeSuccess(long computeTime) {
    computeSuccessCount.increment();
    totalComputeTime.add(computeTime);
  }

  @Override
  public void recordComputeFailure(long computeTime) {
    computeFailureCount.increment();
    totalComputeTime.add(computeTime);
  }

  @Override
  public CacheStats snapshot() {
    return CacheStats.of(
        negativeToMaxValue(hitCount.sum()),
        negativeToMaxValue(missCount.sum()),
        negativeToMaxValue(coalescedCount.sum()),
        negativeToMaxValue(computeSuccessCount.sum()),
        negativeToMaxValue(computeFailureCount.sum()),
        negativeToMaxValue(totalComputeTime.sum()));
  }

  /** Returns {@code value}, if non-negative. Otherwise, returns {@link Long#MAX_VALUE}. */
  private static long negativeToMaxValue(long value) {
    return (value >= 0) ? value : Long.MAX_VALUE;
  }

  /**
   * Increments all counters by the values in {@code other}.
   *
   * @param other the counter to increment from
   */
  public void incrementBy(StatsCounter other) {
    CacheStats otherStats = other.snapshot();
    hitCount.add(otherStats.hitCount());
    missCount.add(otherStats.missCount());
    coalescedCount.add(otherStats.coalescedCount());
    computeSuccessCount.add(otherStats.computeSuccessCount());
    computeFailureCount.add(otherStats.computeFailureCount());
    totalComputeTime.add(otherStats.totalComputeTime());
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
