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

import static com.github.benmanes.inflight.cache.Inflight.requireArgument;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiPredicate;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The storage engine that holds the committed key-value entries of a cache. A store only sees
 * computed values; the coordination of in-flight computations is performed by the cache.
 * <p>
 * Implementations must be thread-safe. A store is free to apply its own eviction or expiration
 * policy, in which case a {@link #lookup} may return {@code null} for a key that was previously
 * inserted and the cache will compute the value again on the next request.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <K> the type of keys maintained by this store
 * @param <V> the type of mapped values
 */
public interface Store<K, V> {

  /**
   * Returns the value associated with the {@code key}, or {@code null} if there is none.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped, or {@code null} if absent
   */
  @Nullable
  V lookup(K key);

  /**
   * Associates the {@code value} with the {@code key}, replacing any existing value.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   */
  void insert(K key, V value);

  /**
   * Discards the value associated with the {@code key}.
   *
   * @param key the key whose mapping is to be removed
   * @return the removed value, or {@code null} if there was no mapping
   */
  @Nullable
  @CanIgnoreReturnValue
  V remove(K key);

  /**
   * Discards every value whose entry satisfies the {@code predicate}. Each entry is removed only if
   * it is still mapped to the value that the predicate was evaluated against.
   *
   * @param predicate the condition that selects the entries to remove
   * @return if any entries were removed
   */
  @CanIgnoreReturnValue
  boolean removeIf(BiPredicate<? super K, ? super V> predicate);

  /** Discards all of the values in this store. */
  void clear();

  /**
   * Returns the approximate number of entries in this store.
   *
   * @return the estimated number of mappings
   */
  @NonNegative
  long size();

  /**
   * Returns a store backed by a new {@link ConcurrentHashMap}.
   *
   * @param initialCapacity the initial capacity of the hash table
   * @param <K> the type of keys
   * @param <V> the type of values
   * @return an unbounded store
   * @throws IllegalArgumentException if the {@code initialCapacity} is negative
   */
  static <K, V> Store<K, V> concurrentMap(@NonNegative int initialCapacity) {
    requireArgument(initialCapacity >= 0, "initial capacity must not be negative");
    return new ConcurrentMapStore<>(new ConcurrentHashMap<>(initialCapacity));
  }

  /**
   * Returns a store that reads and writes through the given map.
   *
   * @param map the backing map, which must not permit concurrent modification errors
   * @param <K> the type of keys
   * @param <V> the type of values
   * @return a store view of the map
   */
  static <K, V> Store<K, V> forMap(ConcurrentMap<K, V> map) {
    return new ConcurrentMapStore<>(map);
  }
}
