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

import java.util.concurrent.ConcurrentMap;
import java.util.function.BiPredicate;

import org.jspecify.annotations.Nullable;

/**
 * A {@link Store} that delegates to a {@link ConcurrentMap}.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class ConcurrentMapStore<K, V> implements Store<K, V> {
  final ConcurrentMap<K, V> data;

  ConcurrentMapStore(ConcurrentMap<K, V> data) {
    this.data = requireNonNull(data);
  }

  @Override
  public @Nullable V lookup(K key) {
    return data.get(key);
  }

  @Override
  public void insert(K key, V value) {
    data.put(key, value);
  }

  @Override
  public @Nullable V remove(K key) {
    return data.remove(key);
  }

  @Override
  public boolean removeIf(BiPredicate<? super K, ? super V> predicate) {
    requireNonNull(predicate);
    return data.entrySet().removeIf(entry -> predicate.test(entry.getKey(), entry.getValue()));
  }

  @Override
  public void clear() {
    data.clear();
  }

  @Override
  public long size() {
    return data.size();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[size=" + data.size() + "]";
  }
}
