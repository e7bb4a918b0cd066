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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.benmanes.inflight.cache.stats.CacheStats;
import com.github.benmanes.inflight.cache.stats.ConcurrentStatsCounter;
import com.github.benmanes.inflight.cache.stats.StatsCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * A builder of {@link Cache} and {@link AsyncCache} instances that coalesce concurrent
 * computations of the same absent key. For example:
 * <pre>{@code
 *   Cache<Key, Graph> graphs = Inflight.newBuilder()
 *       .executor(executor)
 *       .recordStats()
 *       .build();
 *
 *   Graph graph = graphs.getOrInsertWith(key, () -> createExpensiveGraph(key));
 * }</pre>
 * <p>
 * By default the committed values are held in an unbounded {@link Store} backed by a
 * {@link java.util.concurrent.ConcurrentHashMap}, and computations are run on
 * {@link ForkJoinPool#commonPool()}. A {@linkplain #store(Store) custom store} may apply its own
 * eviction policy.
 * <p>
 * Each setting may be configured at most once. The builder may be reused to create multiple
 * independent caches.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 * @param <K> the most general key type this builder will be able to create caches for
 * @param <V> the most general value type this builder will be able to create caches for
 */
public final class Inflight<K, V> {
  static final Logger logger = System.getLogger(Inflight.class.getName());
  static final Supplier<StatsCounter> ENABLED_STATS_COUNTER_SUPPLIER = ConcurrentStatsCounter::new;

  static final int UNSET_INT = -1;
  static final int DEFAULT_INITIAL_CAPACITY = 16;

  int initialCapacity = UNSET_INT;

  @Nullable Supplier<StatsCounter> statsCounterSupplier;
  @Nullable Store<? super K, ? super V> store;
  @Nullable Scheduler scheduler;
  @Nullable Executor executor;
  @Nullable Ticker ticker;

  private Inflight() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the argument expression is true. */
  static void requireArgument(boolean expression) {
    if (!expression) {
      throw new IllegalArgumentException();
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /**
   * Constructs a new {@code Inflight} instance with default settings: an unbounded store, the
   * common pool for computations, and no statistics.
   * <p>
   * Note that while this return type is {@code Inflight<Object, Object>}, type parameters on the
   * {@link #build} methods allow you to create a cache of any key and value type desired.
   *
   * @return a new instance with default settings
   */
  @CheckReturnValue
  public static Inflight<Object, Object> newBuilder() {
    return new Inflight<>();
  }

  /**
   * Constructs a new {@code Inflight} instance with the settings specified in {@code spec}.
   *
   * @param spec the specification to build from
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static Inflight<Object, Object> from(InflightSpec spec) {
    return spec.toBuilder();
  }

  /**
   * Constructs a new {@code Inflight} instance with the settings specified in {@code spec}.
   *
   * @param spec a String in the format specified by {@link InflightSpec}
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static Inflight<Object, Object> from(String spec) {
    return from(InflightSpec.parse(spec));
  }

  /**
   * Sets the minimum total size for the internal data structures, both the default store and the
   * table of in-flight computations.
   *
   * @param initialCapacity minimum total size for the internal data structures
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalArgumentException if {@code initialCapacity} is negative
   * @throws IllegalStateException if an initial capacity was already set
   */
  @CanIgnoreReturnValue
  public Inflight<K, V> initialCapacity(@NonNegative int initialCapacity) {
    requireState(this.initialCapacity == UNSET_INT,
        "initial capacity was already set to %s", this.initialCapacity);
    requireArgument(initialCapacity >= 0);
    this.initialCapacity = initialCapacity;
    return this;
  }

  boolean hasInitialCapacity() {
    return (initialCapacity != UNSET_INT);
  }

  int getInitialCapacity() {
    return hasInitialCapacity() ? initialCapacity : DEFAULT_INITIAL_CAPACITY;
  }

  /**
   * Specifies the executor that runs the computations. By default,
   * {@link ForkJoinPool#commonPool()} is used.
   * <p>
   * Beware that an executor which throws {@link java.util.concurrent.RejectedExecutionException}
   * causes the rejected computation to be aborted for every caller waiting on it.
   *
   * @param executor the executor to use for running computations
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalStateException if an executor or scheduler was already set
   * @throws NullPointerException if the specified executor is null
   */
  @CanIgnoreReturnValue
  public Inflight<K, V> executor(Executor executor) {
    requireState(this.executor == null, "executor was already set to %s", this.executor);
    requireState(this.scheduler == null, "executor may not be combined with a scheduler");
    this.executor = requireNonNull(executor);
    return this;
  }

  /**
   * Specifies the scheduler that runs the computations. This is an alternative to
   * {@link #executor(Executor)} for when the computation should be run in a custom manner, such as
   * {@linkplain Scheduler#sameThread() on the calling thread} in tests. Any exception thrown by the
   * scheduler is logged and aborts the computation.
   *
   * @param scheduler the scheduler to use for running computations
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalStateException if a scheduler or executor was already set
   * @throws NullPointerException if the specified scheduler is null
   */
  @CanIgnoreReturnValue
  public Inflight<K, V> scheduler(Scheduler scheduler) {
    requireState(this.scheduler == null, "scheduler was already set to %s", this.scheduler);
    requireState(this.executor == null, "scheduler may not be combined with an executor");
    this.scheduler = requireNonNull(scheduler);
    return this;
  }

  Scheduler getScheduler() {
    if (scheduler != null) {
      return Scheduler.guardedScheduler(scheduler);
    } else if (executor != null) {
      return Scheduler.guardedScheduler(Scheduler.forExecutor(executor));
    }
    return Scheduler.guardedScheduler(Scheduler.commonPool());
  }

  /**
   * Specifies the store that holds the committed values. By default, an unbounded store backed by
   * a {@link java.util.concurrent.ConcurrentHashMap} is used. The store is shared by every cache
   * built from this builder.
   *
   * @param store the store of committed values
   * @param <K1> the key type of the store
   * @param <V1> the value type of the store
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalStateException if a store was already set
   * @throws NullPointerException if the specified store is null
   */
  @CanIgnoreReturnValue
  public <K1 extends K, V1 extends V> Inflight<K1, V1> store(Store<K1, V1> store) {
    requireState(this.store == null, "store was already set to %s", this.store);

    @SuppressWarnings("unchecked")
    Inflight<K1, V1> self = (Inflight<K1, V1>) this;
    self.store = requireNonNull(store);
    return self;
  }

  @SuppressWarnings("unchecked")
  <K1 extends K, V1 extends V> Store<K1, V1> getStore() {
    if (store == null) {
      return Store.concurrentMap(getInitialCapacity());
    } else if (hasInitialCapacity()) {
      logger.log(Level.WARNING, "ignoring initialCapacity specified with a custom store");
    }
    return (Store<K1, V1>) store;
  }

  /**
   * Specifies a nanosecond-precision time source for measuring the computation time recorded in
   * the {@link CacheStats}. By default, {@link System#nanoTime} is used.
   *
   * @param ticker a nanosecond-precision time source
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalStateException if a ticker was already set
   * @throws NullPointerException if the specified ticker is null
   */
  @CanIgnoreReturnValue
  public Inflight<K, V> ticker(Ticker ticker) {
    requireState(this.ticker == null, "Ticker was already set to %s", this.ticker);
    this.ticker = requireNonNull(ticker);
    return this;
  }

  Ticker getTicker() {
    if (!isRecordingStats()) {
      if (ticker != null) {
        logger.log(Level.WARNING, "ignoring ticker specified without recordStats");
      }
      return Ticker.disabledTicker();
    }
    return (ticker == null) ? Ticker.systemTicker() : ticker;
  }

  /**
   * Enables the accumulation of {@link CacheStats} during the operation of the cache. Without this
   * {@link Cache#stats} will return zero for all statistics.
   *
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalStateException if statistics recording was already set
   */
  @CanIgnoreReturnValue
  public Inflight<K, V> recordStats() {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    statsCounterSupplier = ENABLED_STATS_COUNTER_SUPPLIER;
    return this;
  }

  /**
   * Enables the accumulation of {@link CacheStats} into the supplied {@link StatsCounter}. Any
   * exception thrown by the counter will be suppressed and logged.
   *
   * @param statsCounterSupplier a supplier instance that returns a new {@link StatsCounter}
   * @return this {@code Inflight} instance (for chaining)
   * @throws IllegalStateException if statistics recording was already set
   * @throws NullPointerException if the specified supplier is null
   */
  @CanIgnoreReturnValue
  public Inflight<K, V> recordStats(Supplier<? extends StatsCounter> statsCounterSupplier) {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    requireNonNull(statsCounterSupplier);
    this.statsCounterSupplier = () -> StatsCounter.guardedStatsCounter(statsCounterSupplier.get());
    return this;
  }

  boolean isRecordingStats() {
    return (statsCounterSupplier != null);
  }

  Supplier<StatsCounter> getStatsCounterSupplier() {
    return (statsCounterSupplier == null)
        ? StatsCounter::disabledStatsCounter
        : statsCounterSupplier;
  }

  /**
   * Builds a cache which blocks the calling thread until the value of an absent key is computed,
   * either by its own computation or by the one already in progress for that key.
   * <p>
   * This method does not alter the state of this {@code Inflight} instance, so it can be invoked
   * again to create multiple independent caches.
   *
   * @param <K1> the key type of the cache
   * @param <V1> the value type of the cache
   * @return a cache having the requested features
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> Cache<K1, V1> build() {
    return this.<K1, V1>buildAsync().synchronous();
  }

  /**
   * Builds a cache which returns a {@link java.util.concurrent.CompletableFuture} of the value,
   * either already committed or being computed for the given key.
   * <p>
   * This method does not alter the state of this {@code Inflight} instance, so it can be invoked
   * again to create multiple independent caches.
   *
   * @param <K1> the key type of the cache
   * @param <V1> the value type of the cache
   * @return a cache having the requested features
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> AsyncCache<K1, V1> buildAsync() {
    @SuppressWarnings("unchecked")
    Inflight<K1, V1> self = (Inflight<K1, V1>) this;
    return new LocalAsyncCache<>(self);
  }

  /**
   * Returns a string representation for this Inflight instance. The exact form of the returned
   * string is not specified.
   */
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder(64);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (initialCapacity != UNSET_INT) {
      s.append("initialCapacity=").append(initialCapacity).append(", ");
    }
    if (scheduler != null) {
      s.append("scheduler=").append(scheduler).append(", ");
    }
    if (executor != null) {
      s.append("executor, ");
    }
    if (store != null) {
      s.append("store, ");
    }
    if (statsCounterSupplier != null) {
      s.append("recordStats, ");
    }
    if (s.length() > baseLength) {
      s.deleteCharAt(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
