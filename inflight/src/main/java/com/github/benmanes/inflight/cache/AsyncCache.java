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

import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.benmanes.inflight.cache.stats.CacheStats;

/**
 * A mapping from keys to values where a missing value is computed asynchronously, at most once per
 * key regardless of how many callers request it concurrently.
 * <p>
 * Each caller receives its own {@link CompletableFuture}. Cancelling it only stops that caller from
 * waiting; the computation continues and its value is stored for later requests. The returned
 * futures complete exceptionally with the checked exception thrown by a
 * {@link FallibleComputation}, or with an {@link AbortedComputationException} if the computation
 * terminated abnormally. All callers waiting on the same computation receive the same value or
 * exception instance.
 * <p>
 * Implementations of this interface are expected to be thread-safe, and can be safely accessed by
 * multiple concurrent threads.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface AsyncCache<K, V> {

  /**
   * Returns the committed value associated with the {@code key}, or {@code null} if there is none.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped, or {@code null} if absent
   * @throws NullPointerException if the specified key is null
   */
  @Nullable
  V getIfPresent(K key);

  /**
   * Returns a future of the value associated with the {@code key}, submitting the
   * {@code computation} to the {@link Scheduler} if the value is absent and not already being
   * computed.
   *
   * @param key the key with which the specified value is to be associated
   * @param computation the self-contained computation of the value
   * @return the caller's future of the current (existing or computed) value
   * @throws NullPointerException if the specified key or computation is null
   * @throws IllegalStateException if called from within the computation of the same key
   */
  CompletableFuture<V> getOrInsertWith(K key, Computation<? extends V> computation);

  /**
   * Returns a future of the value associated with the {@code key}, submitting the fallible
   * {@code computation} to the {@link Scheduler} if the value is absent and not already being
   * computed. If the computation throws a checked exception then the future fails with it and
   * nothing is stored.
   *
   * @param key the key with which the specified value is to be associated
   * @param computation the self-contained computation of the value
   * @return the caller's future of the current (existing or computed) value
   * @throws NullPointerException if the specified key or computation is null
   * @throws IllegalStateException if called from within the computation of the same key
   */
  CompletableFuture<V> getOrTryInsertWith(K key, FallibleComputation<? extends V> computation);

  /**
   * Associates the {@code value} with the {@code key}, replacing any committed value.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   * @throws NullPointerException if the specified key or value is null
   */
  void insert(K key, V value);

  /**
   * Discards the committed value for the {@code key}.
   *
   * @param key the key whose mapping is to be removed from the cache
   * @throws NullPointerException if the specified key is null
   */
  void invalidate(K key);

  /** Discards all committed values in the cache. */
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
   * Returns a current snapshot of this cache's cumulative statistics.
   *
   * @return the current snapshot of the statistics of this cache
   */
  CacheStats stats();

  /**
   * Returns a view of the entries stored in this cache as a synchronous {@link Cache}. Operations
   * on the view block until the caller's future completes.
   *
   * @return a thread-safe synchronous view of this cache
   */
  Cache<K, V> synchronous();
}
