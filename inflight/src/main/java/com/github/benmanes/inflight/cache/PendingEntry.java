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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * The handle of a computation for a key that is in progress or has completed. Any number of callers
 * may attach to the entry, each receiving its own subscription that is completed with the single
 * outcome of the computation.
 * <p>
 * A subscription is a separate future per caller, so a caller may cancel it to stop waiting
 * without affecting the computation or the other subscribers. The outcome is published exactly
 * once; a caller that attaches afterwards observes the terminal state immediately.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class PendingEntry<K, V> {
  final K key;

  @GuardedBy("this")
  @Nullable Outcome<V> outcome;
  @GuardedBy("this")
  List<CompletableFuture<V>> waiters;

  volatile @Nullable Thread runner;

  PendingEntry(K key) {
    this.key = requireNonNull(key);
    this.waiters = new ArrayList<>();
  }

  /**
   * Returns a subscription that is completed with the outcome of the computation. If the outcome
   * has already been published then the subscription is returned in its completed state.
   */
  @SuppressWarnings("FutureReturnValueIgnored")
  CompletableFuture<V> attach() {
    var subscription = new CompletableFuture<V>();
    Outcome<V> terminal;
    synchronized (this) {
      terminal = outcome;
      if (terminal == null) {
        waiters.add(subscription);
      }
    }
    if (terminal == null) {
      subscription.whenComplete((value, error) -> {
        if (subscription.isCancelled()) {
          detach(subscription);
        }
      });
    } else {
      terminal.complete(subscription);
    }
    return subscription;
  }

  /** Removes the subscription so that it is no longer notified. */
  synchronized void detach(CompletableFuture<V> subscription) {
    if (outcome == null) {
      waiters.remove(subscription);
    }
  }

  /**
   * Publishes the outcome to every subscription attached at this moment. Subscriptions that attach
   * concurrently either are included in the broadcast or observe the terminal state.
   *
   * @return if the outcome was published, or {@code false} if one was already published
   */
  @CanIgnoreReturnValue
  boolean publish(Outcome<V> result) {
    requireNonNull(result);
    List<CompletableFuture<V>> snapshot;
    synchronized (this) {
      if (outcome != null) {
        return false;
      }
      outcome = result;
      snapshot = waiters;
      waiters = Collections.emptyList();
    }
    for (var subscription : snapshot) {
      result.complete(subscription);
    }
    return true;
  }

  /** Returns the published outcome or {@code null} if the computation is still running. */
  synchronized @Nullable Outcome<V> outcome() {
    return outcome;
  }

  /** Returns if the outcome has been published. */
  synchronized boolean isDone() {
    return (outcome != null);
  }

  /** Returns the number of subscriptions awaiting the outcome. */
  synchronized int waiterCount() {
    return waiters.size();
  }

  /** Records the thread that is running the computation, or {@code null} when it returns. */
  void runningOn(@Nullable Thread thread) {
    runner = thread;
  }

  /** Returns if the computation is currently being run by the given thread. */
  boolean isRunningOn(Thread thread) {
    return (runner == thread);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[key=" + key + ", outcome=" + outcome() + "]";
  }
}
