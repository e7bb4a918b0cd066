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

import static com.github.benmanes.inflight.testing.ConcurrentTestHarness.executor;
import static com.github.benmanes.inflight.testing.ConcurrentTestHarness.timeTasks;
import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.expectThrows;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.awaitility.Awaitility;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.github.valfirst.slf4jtest.TestLoggerFactory;
import com.google.common.testing.NullPointerTester;
import com.google.common.util.concurrent.Uninterruptibles;

/**
 * The test cases for the {@link Cache} interface, where callers block on computations that run on
 * a thread pool.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CacheTest {
  private static final int NUMBER_OF_THREADS = 16;

  private Cache<Integer, String> cache;

  @BeforeMethod
  public void before() {
    cache = Inflight.newBuilder()
        .executor(executor)
        .recordStats()
        .build();
  }

  @AfterMethod
  public void after() {
    TestLoggerFactory.clear();
  }

  /** Waits until the given number of callers have missed on the cache. */
  private void awaitMisses(long count) {
    Awaitility.with()
        .pollInterval(Duration.ofMillis(1))
        .pollExecutorService(executor)
        .atMost(Duration.ofSeconds(10))
        .until(() -> cache.stats().missCount() == count);
  }

  /** Waits until the given number of callers have joined the computation in progress. */
  private void awaitWaiters(long count) {
    Awaitility.with()
        .pollInterval(Duration.ofMillis(1))
        .pollExecutorService(executor)
        .atMost(Duration.ofSeconds(10))
        .until(() -> cache.stats().coalescedCount() == count);
  }

  @Test
  public void nullParameters() {
    var tester = new NullPointerTester();
    tester.setDefault(Computation.class, (Computation<String>) () -> "a");
    tester.setDefault(FallibleComputation.class, (FallibleComputation<String>) () -> "a");
    tester.testAllPublicInstanceMethods(cache);
  }

  @Test
  public void getOrInsertWith_computesOnce() {
    var counter = new AtomicInteger();
    Computation<String> computation = () -> {
      counter.incrementAndGet();
      return "x";
    };

    assertThat(cache.getOrInsertWith(42, computation)).isEqualTo("x");
    assertThat(cache.getOrInsertWith(42, computation)).isEqualTo("x");
    assertThat(counter.get()).isEqualTo(1);
    assertThat(cache.getIfPresent(42)).isEqualTo("x");
  }

  @Test
  public void getOrInsertWith_concurrent_computesOnce() {
    var invocations = new AtomicInteger();
    var result = timeTasks(NUMBER_OF_THREADS, () -> cache.getOrInsertWith(1, () -> {
      invocations.incrementAndGet();
      awaitMisses(NUMBER_OF_THREADS);
      return new String("x");
    }));

    assertThat(invocations.get()).isEqualTo(1);
    assertThat(result.results()).hasSize(NUMBER_OF_THREADS);
    var first = result.results().get(0);
    assertThat(first).isEqualTo("x");
    for (var value : result.results()) {
      assertThat(value).isSameInstanceAs(first);
    }
    assertThat(cache.inFlightCount()).isEqualTo(0);
  }

  @Test
  public void getOrInsertWith_waiterBlocksUntilComputed() {
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var waiterInvoked = new AtomicInteger();

    var initiator = CompletableFuture.supplyAsync(() -> cache.getOrInsertWith(1, () -> {
      started.countDown();
      Uninterruptibles.awaitUninterruptibly(release);
      return "a";
    }), executor);
    Uninterruptibles.awaitUninterruptibly(started);

    var waiter = CompletableFuture.supplyAsync(() -> cache.getOrInsertWith(1, () -> {
      waiterInvoked.incrementAndGet();
      return "b";
    }), executor);
    awaitWaiters(1);
    assertThat(waiter.isDone()).isFalse();

    release.countDown();
    assertThat(initiator.join()).isEqualTo("a");
    assertThat(waiter.join()).isEqualTo("a");
    assertThat(waiterInvoked.get()).isEqualTo(0);
  }

  @Test
  public void getOrInsertWith_aborted_sameInstance() {
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var initiator = CompletableFuture.runAsync(() -> cache.getOrInsertWith(1, () -> {
      started.countDown();
      Uninterruptibles.awaitUninterruptibly(release);
      throw new IllegalStateException();
    }), executor);
    Uninterruptibles.awaitUninterruptibly(started);

    var waiterError = new AtomicReference<Throwable>();
    var waiter = CompletableFuture.runAsync(() -> {
      try {
        cache.getOrInsertWith(1, () -> "b");
      } catch (AbortedComputationException e) {
        waiterError.set(e);
      }
    }, executor);
    awaitWaiters(1);
    release.countDown();

    var e = expectThrows(CompletionException.class, initiator::join);
    waiter.join();
    assertThat(e).hasCauseThat().isInstanceOf(AbortedComputationException.class);
    assertThat(e.getCause()).hasCauseThat().isInstanceOf(IllegalStateException.class);
    assertThat(waiterError.get()).isSameInstanceAs(e.getCause());
    assertThat(cache.getIfPresent(1)).isNull();
  }

  @Test
  public void getOrTryInsertWith_failure() {
    var failure = new IOException();
    var e = expectThrows(ComputationException.class,
        () -> cache.getOrTryInsertWith(1, () -> { throw failure; }));
    assertThat(e).hasCauseThat().isSameInstanceAs(failure);
    assertThat(cache.getIfPresent(1)).isNull();
  }

  @Test
  public void getOrTryInsertWith_failureThenSuccess() throws ComputationException {
    var attempts = new AtomicInteger();
    FallibleComputation<String> flaky = () -> {
      if (attempts.incrementAndGet() == 1) {
        throw new IOException();
      }
      return "a";
    };

    expectThrows(ComputationException.class, () -> cache.getOrTryInsertWith(1, flaky));
    assertThat(cache.getOrTryInsertWith(1, flaky)).isEqualTo("a");
    assertThat(attempts.get()).isEqualTo(2);
  }

  @Test
  public void getOrTryInsertWith_failure_waitersShareCause() throws InterruptedException {
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var failure = new IOException();
    FallibleComputation<String> computation = () -> {
      started.countDown();
      Uninterruptibles.awaitUninterruptibly(release);
      throw failure;
    };

    var initiator = failingCaller(computation);
    started.await();
    var waiter = failingCaller(computation);
    awaitWaiters(1);
    release.countDown();

    assertThat(initiator.join()).isSameInstanceAs(failure);
    assertThat(waiter.join()).isSameInstanceAs(failure);
  }

  /** Returns the cause of the {@link ComputationException} thrown to the caller. */
  private CompletableFuture<Throwable> failingCaller(FallibleComputation<String> computation) {
    return CompletableFuture.supplyAsync(() -> {
      try {
        cache.getOrTryInsertWith(1, computation);
      } catch (ComputationException e) {
        return e.getCause();
      }
      throw new AssertionError("Expected the computation to fail");
    }, executor);
  }

  @Test
  public void getOrInsertWith_fallibleFailureSeenByInfallibleWaiter() {
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var failure = new IOException();
    var initiator = CompletableFuture.runAsync(() -> {
      try {
        cache.getOrTryInsertWith(1, () -> {
          started.countDown();
          Uninterruptibles.awaitUninterruptibly(release);
          throw failure;
        });
      } catch (ComputationException e) {
        throw new CompletionException(e);
      }
    }, executor);
    Uninterruptibles.awaitUninterruptibly(started);

    var waiter = CompletableFuture.supplyAsync(() -> cache.getOrInsertWith(1, () -> "b"), executor);
    awaitWaiters(1);
    release.countDown();

    expectThrows(CompletionException.class, initiator::join);
    var e = expectThrows(CompletionException.class, waiter::join);
    assertThat(e).hasCauseThat().isSameInstanceAs(failure);
  }

  @Test
  public void getOrInsertWith_interrupted() throws InterruptedException {
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var initiator = CompletableFuture.supplyAsync(() -> cache.getOrInsertWith(1, () -> {
      started.countDown();
      Uninterruptibles.awaitUninterruptibly(release);
      return "a";
    }), executor);
    started.await();

    var error = new AtomicReference<Throwable>();
    var interrupted = new AtomicReference<Boolean>();
    var waiter = new Thread(() -> {
      try {
        cache.getOrInsertWith(1, () -> "b");
      } catch (CompletionException e) {
        error.set(e);
        interrupted.set(Thread.currentThread().isInterrupted());
      }
    });
    waiter.start();
    awaitWaiters(1);
    waiter.interrupt();
    waiter.join();

    assertThat(error.get()).hasCauseThat().isInstanceOf(InterruptedException.class);
    assertThat(interrupted.get()).isTrue();

    release.countDown();
    assertThat(initiator.join()).isEqualTo("a");
    assertThat(cache.getIfPresent(1)).isEqualTo("a");
  }

  @Test
  public void reentrant_sameKey_fails() {
    Cache<Integer, String> direct = Inflight.newBuilder()
        .scheduler(Scheduler.sameThread())
        .build();
    var e = expectThrows(AbortedComputationException.class, () ->
        direct.getOrInsertWith(1, () -> direct.getOrInsertWith(1, () -> "b")));
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void insert_and_invalidate() {
    cache.insert(1, "a");
    assertThat(cache.getOrInsertWith(1, () -> "b")).isEqualTo("a");
    assertThat(cache.estimatedSize()).isEqualTo(1);

    cache.invalidate(1);
    assertThat(cache.getOrInsertWith(1, () -> "b")).isEqualTo("b");

    cache.invalidateAll();
    assertThat(cache.estimatedSize()).isEqualTo(0);
  }

  @Test
  public void invalidateEntriesIf() {
    for (int i = 0; i < 10; i++) {
      int key = i;
      cache.getOrInsertWith(key, () -> "v" + key);
    }
    cache.invalidateEntriesIf((key, value) -> (key % 2) == 0);

    assertThat(cache.estimatedSize()).isEqualTo(5);
    assertThat(cache.getIfPresent(2)).isNull();
    assertThat(cache.getIfPresent(3)).isEqualTo("v3");
    assertThat(cache.getOrInsertWith(2, () -> "w2")).isEqualTo("w2");
  }

  @Test
  public void stats() {
    cache.getOrInsertWith(1, () -> "a");
    cache.getOrInsertWith(1, () -> "a");
    var stats = cache.stats();
    assertThat(stats.hitCount()).isEqualTo(1);
    assertThat(stats.missCount()).isEqualTo(1);
    assertThat(stats.computeSuccessCount()).isEqualTo(1);
  }
}
