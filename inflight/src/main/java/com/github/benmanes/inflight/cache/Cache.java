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

import java.util.concurrent.CompletionException;
import java.util.function.BiPredicate;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.benmanes.inflight.cache.stats.CacheStats;

/**
 * A mapping from keys to values where a missing value is computed on demand, at most once per key
 * regardless of how many threads request it concurrently. Values are stored until invalidated or
 * discarded by the {@link Store}.
 * <p>
 * Implementations of this interface are expected to be thread-safe, and can be safely accessed by
 * multiple concurrent threads.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

  /**
   * Returns the value associated with the {@code key} in this cache, or {@code null} if there is no
   * committed value for the {@code key}. A value that is still being computed is not visible.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped, or {@code null} if absent
   * @throws NullPointerException if the specified key is null
   */
  @Nullable
  V getIfPresent(K key);

  /**
   * Returns the value associated with the {@code key}, computing it with the {@code computation} if
   * necessary. If another thread is already computing the value for this key then the caller waits
   * for that result and its own {@code computation} is not run.
   * <p>
   * The computation may be run by the cache's {@link Scheduler} on another thread. It must not
   * attempt to compute the same key of this cache, and should not compute other keys.
   *
   * @param key the key with which the specified value is to be associated
   * @param computation the self-contained computation of the value
   * @return the current (existing or computed) value associated with the specified key
   * @throws NullPointerException if the specified key or computation is null
   * @throws AbortedComputationException if the computation terminated abnormally
   * @throws IllegalStateException if called from within the computation of the same key
   * @throws CompletionException if interrupted while waiting, with the interrupt status restored
   */
  V getOrInsertWith(K key, Computation<? extends V> computation);

  /**
   * Returns the value associated with the {@code key}, computing it with the fallible
   * {@code computation} if necessary. If another thread is already computing the value for this
   * key then the caller waits for that result and its own {@code computation} is not run.
   * <p>
   * If the computation throws a checked exception then nothing is stored and every caller waiting
   * on it receives a {@link ComputationException} with that exception as its cause. A later call
   * for the key starts a new computation; failures are not retried by the cache.
   *
   * @param key the key with which the specified value is to be associated
   * @param computation the self-contained computation of the value
   * @return the current (existing or computed) value associated with the specified key
   * @throws ComputationException if the computation threw a checked exception
   * @throws NullPointerException if the specified key or computation is null
   * @throws AbortedComputationException if the computation terminated abnormally
   * @throws IllegalStateException if called from within the computation of the same key
   * @throws CompletionException if interrupted while waiting, with the interrupt status restored
   */
  V getOrTryInsertWith(K key, FallibleComputation<? extends V> computation)
      throws ComputationException;

  /**
   * Associates the {@code value} with the {@code key} in this cache, replacing any committed value.
   * A computation in progress for the key is not affected and will replace this value when it
   * completes successfully.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   * @throws NullPointerException if the specified key or value is null
   */
  void insert(K key, V value);

  /**
   * Discards the committed value for the {@code key}. A computation in progress for the key is not
   * cancelled.
   *
   * @param key the key whose mapping is to be removed from the cache
   * @throws NullPointerException if the specified key is null
   */
  void invalidate(K key);

  /** Discards all committed values in the cache. Computations in progress are not cancelled. */
  void invalidateAll();

  /**
   * Discards every committed value whose entry satisfies the {@code predicate}. The predicate is
   * evaluated against the entries present during the call; a computation in progress is not
   * cancelled and its value is stored when it completes.
   *
   * @param predicate the condition that selects the entries to discard
   * @throws NullPointerException if the specified predicate is null
   */
  void invalidateEntriesIf(BiPredicate<? super K, ? super V> predicate);

  /**
   * Returns the approximate number of committed entries in this cache.
   *
   * @return the estimated number of mappings
   */
  @NonNegative
  long estimatedSize();

  /**
   * Returns the number of keys whose value is currently being computed.
   *
   * @return the number of computations in progress
   */
  @NonNegative
  int inFlightCount();

  /**
   * Returns a current snapshot of this cache's cumulative statistics, or a set of default values if
   * the cache is not recording statistics.
   *
   * @return the current snapshot of the statistics of this cache
   */
  CacheStats stats();
}
