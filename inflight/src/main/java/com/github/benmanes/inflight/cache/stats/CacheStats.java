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

import java.util.Objects;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.benmanes.inflight.cache.Cache;
import com.google.errorprone.annotations.Immutable;

/**
 * Statistics about the performance of a {@link Cache}.
 * <p>
 * Cache statistics are incremented according to the following rules:
 * <ul>
 *   <li>When a lookup finds a committed value, {@code hitCount} is incremented.
 *   <li>When a lookup does not find a committed value, {@code missCount} is incremented.
 *   <ul>
 *     <li>If the caller starts the computation, then on completion either
 *         {@code computeSuccessCount} or {@code computeFailureCount} is incremented and the time
 *         spent, in nanoseconds, is added to {@code totalComputeTime}.
 *     <li>If the caller attaches to a computation started by another caller, then
 *         {@code coalescedCount} is incremented instead.
 *   </ul>
 *   <li>No stats are modified when a value is inserted or invalidated manually.
 * </ul>
 * <p>
 * A lookup is an invocation of {@link Cache#getIfPresent}, {@link Cache#getOrInsertWith}, or
 * {@link Cache#getOrTryInsertWith}. It is always the case that
 * {@code missCount >= computeCount + coalescedCount}, as a miss may also be resolved by a value
 * that arrived just before the computation would have started.
 * <p>
 * This is a <em>value-based</em> class; use of identity-sensitive operations (including reference
 * equality ({@code ==}), identity hash code, or synchronization) on instances of {@code CacheStats}
 * may have unpredictable results and should be avoided.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY_STATS = CacheStats.of(0L, 0L, 0L, 0L, 0L, 0L);

  private final long hitCount;
  private final long missCount;
  private final long coalescedCount;
  private final long computeSuccessCount;
  private final long computeFailureCount;
  private final long totalComputeTime;

  private CacheStats(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long coalescedCount, @NonNegative long computeSuccessCount,
      @NonNegative long computeFailureCount, @NonNegative long totalComputeTime) {
    if ((hitCount < 0) || (missCount < 0) || (coalescedCount < 0) || (computeSuccessCount < 0)
        || (computeFailureCount < 0) || (totalComputeTime < 0)) {
      throw new IllegalArgumentException();
    }
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.coalescedCount = coalescedCount;
    this.computeSuccessCount = computeSuccessCount;
    this.computeFailureCount = computeFailureCount;
    this.totalComputeTime = totalComputeTime;
  }

  /**
   * Returns a {@code CacheStats} representing the specified statistics.
   *
   * @param hitCount the number of cache hits
   * @param missCount the number of cache misses
   * @param coalescedCount the number of misses served by another caller's computation
   * @param computeSuccessCount the number of successful computations
   * @param computeFailureCount the number of failed or aborted computations
   * @param totalComputeTime the total computation time (success and failure)
   * @return a {@code CacheStats} representing the specified statistics
   */
  public static CacheStats of(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long coalescedCount, @NonNegative long computeSuccessCount,
      @NonNegative long computeFailureCount, @NonNegative long totalComputeTime) {
    return new CacheStats(hitCount, missCount, coalescedCount,
        computeSuccessCount, computeFailureCount, totalComputeTime);
  }

  /**
   * Returns a statistics instance where no cache events have been recorded.
   *
   * @return an empty statistics instance
   */
  public static CacheStats empty() {
    return EMPTY_STATS;
  }

  /**
   * Returns the number of lookups, defined as {@code hitCount + missCount}.
   *
   * @return the {@code hitCount + missCount}
   */
  public @NonNegative long requestCount() {
    return saturatedAdd(hitCount, missCount);
  }

  /**
   * Returns the number of lookups that found a committed value.
   *
   * @return the number of cache hits
   */
  public @NonNegative long hitCount() {
    return hitCount;
  }

  /**
   * Returns the ratio of lookups which were hits, or {@code 1.0} when {@code requestCount == 0}.
   *
   * @return the ratio of cache requests which were hits
   */
  public @NonNegative double hitRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
  }

  /**
   * Returns the number of lookups that did not find a committed value. Concurrent misses for the
   * same key are each counted, even though they share a single computation.
   *
   * @return the number of cache misses
   */
  public @NonNegative long missCount() {
    return missCount;
  }

  /**
   * Returns the ratio of lookups which were misses, or {@code 0.0} when {@code requestCount == 0}.
   *
   * @return the ratio of cache requests which were misses
   */
  public @NonNegative double missRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
  }

  /**
   * Returns the number of misses that attached to a computation started by another caller instead
   * of starting their own.
   *
   * @return the number of coalesced misses
   */
  public @NonNegative long coalescedCount() {
    return coalescedCount;
  }

  /**
   * Returns the number of computations that were run, defined as
   * {@code computeSuccessCount + computeFailureCount}.
   *
   * @return the {@code computeSuccessCount + computeFailureCount}
   */
  public @NonNegative long computeCount() {
    return saturatedAdd(computeSuccessCount, computeFailureCount);
  }

  /**
   * Returns the number of computations that produced a value which was stored.
   *
   * @return the number of successful computations
   */
  public @NonNegative long computeSuccessCount() {
    return computeSuccessCount;
  }

  /**
   * Returns the number of computations that failed or terminated abnormally.
   *
   * @return the number of unsuccessful computations
   */
  public @NonNegative long computeFailureCount() {
    return computeFailureCount;
  }

  /**
   * Returns the ratio of computations that were unsuccessful, or {@code 0.0} when none were run.
   *
   * @return the ratio of unsuccessful computations
   */
  public @NonNegative double computeFailureRate() {
    long computeCount = computeCount();
    return (computeCount == 0) ? 0.0 : (double) computeFailureCount / computeCount;
  }

  /**
   * Returns the total number of nanoseconds spent from the start of a computation until its outcome
   * was known.
   *
   * @return the total number of nanoseconds spent computing values
   */
  public @NonNegative long totalComputeTime() {
    return totalComputeTime;
  }

  /**
   * Returns the average number of nanoseconds spent per computation.
   *
   * @return the average number of nanoseconds spent computing values
   */
  public @NonNegative double averageComputePenalty() {
    long computeCount = computeCount();
    return (computeCount == 0) ? 0.0 : (double) totalComputeTime / computeCount;
  }

  /**
   * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
   * and {@code other}. Negative values are rounded up to zero.
   *
   * @param other the statistics to subtract with
   * @return the difference between this instance and {@code other}
   */
  public CacheStats minus(CacheStats other) {
    return CacheStats.of(
        Math.max(0L, saturatedSubtract(hitCount, other.hitCount)),
        Math.max(0L, saturatedSubtract(missCount, other.missCount)),
        Math.max(0L, saturatedSubtract(coalescedCount, other.coalescedCount)),
        Math.max(0L, saturatedSubtract(computeSuccessCount, other.computeSuccessCount)),
        Math.max(0L, saturatedSubtract(computeFailureCount, other.computeFailureCount)),
        Math.max(0L, saturatedSubtract(totalComputeTime, other.totalComputeTime)));
  }

  /**
   * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
   * {@code other}. The counts saturate at {@link Long#MAX_VALUE}.
   *
   * @param other the statistics to add with
   * @return the sum of the statistics
   */
  public CacheStats plus(CacheStats other) {
    return CacheStats.of(
        saturatedAdd(hitCount, other.hitCount),
        saturatedAdd(missCount, other.missCount),
        saturatedAdd(coalescedCount, other.coalescedCount),
        saturatedAdd(computeSuccessCount, other.computeSuccessCount),
        saturatedAdd(computeFailureCount, other.computeFailureCount),
        saturatedAdd(totalComputeTime, other.totalComputeTime));
  }

  /** Returns {@code a - b}, saturating at the long bounds instead of overflowing. */
  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedSubtract(long a, long b) {
    long naiveDifference = a - b;
    if ((a ^ b) >= 0 | (a ^ naiveDifference) >= 0) {
      return naiveDifference;
    }
    return Long.MAX_VALUE + ((naiveDifference >>> (Long.SIZE - 1)) ^ 1);
  }

  /** Returns {@code a + b}, saturating at the long bounds instead of overflowing. */
  @SuppressWarnings("ShortCircuitBoolean")
  private static long saturatedAdd(long a, long b) {
    long naiveSum = a + b;
    if ((a ^ b) < 0 | (a ^ naiveSum) >= 0) {
      return naiveSum;
    }
    return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hitCount, missCount, coalescedCount,
        computeSuccessCount, computeFailureCount, totalComputeTime);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheStats)) {
      return false;
    }
    CacheStats other = (CacheStats) o;
    return hitCount == other.hitCount
        && missCount == other.missCount
        && coalescedCount == other.coalescedCount
        && computeSuccessCount == other.computeSuccessCount
        && computeFailureCount == other.computeFailureCount
        && totalComputeTime == other.totalComputeTime;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "hitCount=" + hitCount + ", "
        + "missCount=" + missCount + ", "
        + "coalescedCount=" + coalescedCount + ", "
        + "computeSuccessCount=" + computeSuccessCount + ", "
        + "computeFailureCount=" + computeFailureCount + ", "
        + "totalComputeTime=" + totalComputeTime
        + '}';
  }
}
