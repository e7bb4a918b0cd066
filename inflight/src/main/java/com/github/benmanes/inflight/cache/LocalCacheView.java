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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiPredicate;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.inflight.cache.stats.CacheStats;

/**
 * A synchronous view of a {@link LocalAsyncCache} whose operations block on the caller's future.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class LocalCacheView<K, V> implements Cache<K, V> {
  final LocalAsyncCache<K, V> asyncCache;

  LocalCacheView(LocalAsyncCache<K, V> asyncCache) {
    this.asyncCache = requireNonNull(asyncCache);
  }

  @Override
  public @Nullable V getIfPresent(K key) {
    return asyncCache.getIfPresent(key);
  }

  @Override
  public V getOrInsertWith(K key, Computation<? extends V> computation) {
    try {
      return resolve(asyncCache.getOrInsertWith(key, computation));
    } catch (ComputationException e) {
      // the key's computation was started by a fallible caller
      throw new CompletionException(e.getCause());
    }
  }

  @Override
  public V getOrTryInsertWith(K key, FallibleComputation<? extends V> computation)
      throws ComputationException {
    return resolve(asyncCache.getOrTryInsertWith(key, computation));
  }

  @Override
  public void insert(K key, V value) {
    asyncCache.insert(key, value);
  }

  @Override
  public void invalidate(K key) {
    asyncCache.invalidate(key);
  }

  @Override
  public void invalidateAll() {
    asyncCache.invalidateAll();
  }

  @Override
  public void invalidateEntriesIf(BiPredicate<? super K, ? super V> predicate) {
    asyncCache.invalidateEntriesIf(predicate);
  }

  @Override
  public long estimatedSize() {
    return asyncCache.estimatedSize();
  }

  @Override
  public int inFlightCount() {
    return asyncCache.inFlightCount();
  }

  @Override
  public CacheStats stats() {
    return asyncCache.stats();
  }

  /**
   * Waits for the caller's future and returns its value. An interrupted caller detaches from the
   * computation, which continues on behalf of the other callers.
   */
  static <V> V resolve(CompletableFuture<V> future) throws ComputationException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(/* mayInterruptIfRunning= */ false);
      Thread.currentThread().interrupt();
      throw new CompletionException(e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      } else if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new ComputationException(cause);
    }
  }

  @Override
  public String toString() {
    return asyncCache.toString();
  }
}
