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

import java.util.concurrent.ConcurrentHashMap;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The registry of computations that are in progress, holding at most one {@link PendingEntry} per
 * key. The registry belongs to a single cache instance and lives as long as it does.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class InFlightRegistry<K, V> {
  final ConcurrentHashMap<K, PendingEntry<K, V>> entries;

  InFlightRegistry(@NonNegative int initialCapacity) {
    this.entries = new ConcurrentHashMap<>(initialCapacity);
  }

  /**
   * Registers a new pending entry for the key unless one is already present. The check and the
   * insertion are performed as a single atomic operation, so concurrent callers for the same key
   * observe exactly one initiator.
   *
   * @param key the key whose computation is requested
   * @return the registration whose entry the caller should attach to
   */
  Registration<K, V> tryBegin(K key) {
    requireNonNull(key);
    @SuppressWarnings({"rawtypes", "unchecked"})
    PendingEntry<K, V>[] created = new PendingEntry[1];
    PendingEntry<K, V> entry = entries.computeIfAbsent(key, k -> {
      created[0] = new PendingEntry<>(k);
      return created[0];
    });
    return new Registration<>(entry, /* initiator= */ (entry == created[0]));
  }

  /**
   * Removes the entry and then publishes the outcome to its subscribers. A caller that obtained the
   * entry before its removal observes the outcome when it attaches.
   *
   * @return if this call published the outcome
   */
  @CanIgnoreReturnValue
  boolean complete(PendingEntry<K, V> entry, Outcome<V> outcome) {
    entries.remove(entry.key, entry);
    return entry.publish(outcome);
  }

  /** Returns the entry for the key if a computation is in progress. */
  @Nullable PendingEntry<K, V> get(K key) {
    return entries.get(key);
  }

  /** Returns the number of computations in progress. */
  @NonNegative
  int size() {
    return entries.size();
  }

  /** The result of {@link #tryBegin}: the entry and whether the caller created it. */
  static final class Registration<K, V> {
    private final PendingEntry<K, V> entry;
    private final boolean initiator;

    Registration(PendingEntry<K, V> entry, boolean initiator) {
      this.entry = requireNonNull(entry);
      this.initiator = initiator;
    }

    /** Returns the pending entry for the key. */
    PendingEntry<K, V> entry() {
      return entry;
    }

    /** Returns if the caller won the race and must start the computation. */
    boolean isInitiator() {
      return initiator;
    }
  }
}
