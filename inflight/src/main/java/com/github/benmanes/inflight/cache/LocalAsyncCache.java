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

import static com.github.benmanes.inflight.cache.Inflight.requireState;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiPredicate;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.inflight.cache.stats.CacheStats;
import com.github.benmanes.inflight.cache.stats.StatsCounter;

/**
 * The coordinator of the compute-if-absent operations. A request is served from the {@link Store}
 * if the value is committed, joins the computation already in progress for the key if there is
 * one, or otherwise registers a new {@link PendingEntry} and submits the computation to the
 * {@link Scheduler}.
 * <p>
 * For a given key the successful value is written to the store before the entry is removed from
 * the {@link InFlightRegistry}, which happens before the waiting callers are released. A released
 * caller that immediately requests the key again therefore observes the committed value instead of
 * starting a duplicate computation.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class LocalAsyncCache<K, V> implements AsyncCache<K, V> {
  static final Logger logger = System.getLogger(LocalAsyncCache.class.getName());

  final InFlightRegistry<K, V> registry;
  final StatsCounter statsCounter;
  final Scheduler scheduler;
  final Store<K, V> store;
  final Ticker ticker;

  @Nullable LocalCacheView<K, V> cacheView;

  LocalAsyncCache(Inflight<K, V> builder) {
    this.registry = new InFlightRegistry<>(builder.getInitialCapacity());
    this.statsCounter = builder.getStatsCounterSupplier().get();
    this.scheduler = builder.getScheduler();
    this.ticker = builder.getTicker();
    this.store = builder.getStore();
  }

  @Override
  public @Nullable V getIfPresent(K key) {
    V value = store.lookup(requireNonNull(key));
    if (value == null) {
      statsCounter.recordMisses(1);
    } else {
      statsCounter.recordHits(1);
    }
    return value;
  }

  @Override
  public CompletableFuture<V> getOrInsertWith(K key, Computation<? extends V> computation) {
    requireNonNull(computation);
    return compute(key, computation::compute, /* fallible= */ false);
  }

  @Override
  public CompletableFuture<V> getOrTryInsertWith(
      K key, FallibleComputation<? extends V> computation) {
    return compute(key, computation, /* fallible= */ true);
  }

  /**
   * Returns the caller's future of the value, starting the computation if the caller is the first
   * to miss on the key.
   *
   * @param fallible whether a checked exception is a normal failure rather than an abort
   */
  CompletableFuture<V> compute(K key,
      FallibleComputation<? extends V> computation, boolean fallible) {
    requireNonNull(key);
    requireNonNull(computation);

    V value = store.lookup(key);
    if (value != null) {
      statsCounter.recordHits(1);
      return CompletableFuture.completedFuture(value);
    }
    statsCounter.recordMisses(1);

    var registration = registry.tryBegin(key);
    var entry = registration.entry();
    if (!registration.isInitiator()) {
      requireState(!entry.isRunningOn(Thread.currentThread()),
          "Recursive computation of a key from within its own computation");
      statsCounter.recordCoalesced(1);
      return entry.attach();
    }

    var subscription = entry.attach();
    start(entry, computation, fallible);
    return subscription;
  }

  /**
   * Submits the computation on behalf of all callers attached to the entry. If the computation
   * cannot be started then the entry is completed as aborted so that no caller waits on it.
   */
  @SuppressWarnings({"FutureReturnValueIgnored", "PMD.AvoidCatchingThrowable"})
  void start(PendingEntry<K, V> entry,
      FallibleComputation<? extends V> computation, boolean fallible) {
    try {
      // a value may have been committed between the initial lookup and the registration
      V existing = store.lookup(entry.key);
      if (existing != null) {
        registry.complete(entry, Outcome.success(existing));
        return;
      }

      long startTime = ticker.read();
      FallibleComputation<V> task = () -> {
        entry.runningOn(Thread.currentThread());
        try {
          return computation.compute();
        } finally {
          entry.runningOn(null);
        }
      };
      CompletableFuture<V> future = scheduler.submit(task);
      future.whenComplete((result, error) -> complete(entry, result, error, fallible, startTime));
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown when starting computation", t);
      registry.complete(entry, Outcome.aborted(new AbortedComputationException(
          "The computation could not be started", t)));
    }
  }

  /** Stores a successful value, then removes the entry and publishes the outcome to its waiters. */
  void complete(PendingEntry<K, V> entry, @Nullable V result,
      @Nullable Throwable error, boolean fallible, long startTime) {
    Outcome<V> outcome = toOutcome(entry.key, result, error, fallible);
    try {
      long computeTime = ticker.elapsedSince(startTime);
      if (outcome.isSuccess()) {
        statsCounter.recordComputeSuccess(computeTime);
      } else {
        statsCounter.recordComputeFailure(computeTime);
      }
    } finally {
      registry.complete(entry, outcome);
    }
  }

  /** Classifies the result of the computation, committing the value if successful. */
  @SuppressWarnings("PMD.AvoidCatchingThrowable")
  Outcome<V> toOutcome(K key, @Nullable V result, @Nullable Throwable error, boolean fallible) {
    if ((error == null) && (result != null)) {
      try {
        store.insert(key, result);
        return Outcome.success(result);
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Exception thrown when storing computed value", t);
        return Outcome.aborted(new AbortedComputationException(
            "The computed value could not be stored", t));
      }
    }

    Throwable cause = (error == null)
        ? new NullPointerException("The computation returned null")
        : unwrap(error);
    if (fallible && isChecked(cause)) {
      logger.log(Level.DEBUG, "Computation failed; propagating to waiting callers", cause);
      return Outcome.failure((Exception) cause);
    }
    logger.log(Level.WARNING, "Exception thrown during computation", cause);
    return Outcome.aborted(new AbortedComputationException(
        "The computation terminated abnormally", cause));
  }

  /** Returns the underlying cause if the error was wrapped by a dependent stage. */
  static Throwable unwrap(Throwable error) {
    return ((error instanceof CompletionException) && (error.getCause() != null))
        ? error.getCause()
        : error;
  }

  /** Returns if the throwable is a checked exception. */
  static boolean isChecked(Throwable error) {
    return (error instanceof Exception) && !(error instanceof RuntimeException);
  }

  @Override
  public void insert(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);
    store.insert(key, value);
  }

  @Override
  public void invalidate(K key) {
    store.remove(requireNonNull(key));
  }

  @Override
  public void invalidateAll() {
    store.clear();
  }

  @Override
  public void invalidateEntriesIf(BiPredicate<? super K, ? super V> predicate) {
    store.removeIf(requireNonNull(predicate));
  }

  @Override
  public long estimatedSize() {
    return store.size();
  }

  @Override
  public int inFlightCount() {
    return registry.size();
  }

  @Override
  public CacheStats stats() {
    return statsCounter.snapshot();
  }

  @Override
  public Cache<K, V> synchronous() {
    return (cacheView == null) ? (cacheView = new LocalCacheView<>(this)) : cacheView;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[estimatedSize=" + estimatedSize()
        + ", inFlight=" + inFlightCount() + "]";
  }
}
