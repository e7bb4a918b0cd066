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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * A scheduler that runs a computation to completion, possibly on a thread other than the caller's,
 * and reports its result through a future.
 * <p>
 * The cache submits at most one computation per absent key. Once submitted, the computation is not
 * cancelled even if every caller waiting on it gives up, as its result is shared.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface Scheduler {

  /**
   * Returns a future that is completed with the computation's value, or exceptionally with the
   * exception that it threw.
   *
   * @param computation the self-contained computation to run
   * @param <V> the type of the computed value
   * @return a future representing the pending result of the computation
   * @throws java.util.concurrent.RejectedExecutionException if the computation cannot be accepted
   */
  <V> CompletableFuture<V> submit(FallibleComputation<? extends V> computation);

  /**
   * Returns a scheduler that runs computations on the {@code executor}.
   *
   * @param executor the executor to run the computations
   * @return a scheduler that delegates to the executor
   */
  static Scheduler forExecutor(Executor executor) {
    return new ExecutorScheduler(executor);
  }

  /**
   * Returns a scheduler that runs computations on {@link ForkJoinPool#commonPool()}.
   *
   * @return a scheduler that uses the common pool
   */
  static Scheduler commonPool() {
    return CommonPoolScheduler.INSTANCE;
  }

  /**
   * Returns a scheduler that runs each computation on the calling thread before returning. This is
   * primarily useful for tests.
   *
   * @return a scheduler that runs computations directly
   */
  static Scheduler sameThread() {
    return SameThreadScheduler.INSTANCE;
  }

  /**
   * Returns a scheduler that converts any exception thrown by the delegate {@code scheduler}, or a
   * {@code null} future, into a failed future and logs the problem.
   *
   * @param scheduler the scheduler to delegate to
   * @return a scheduler that never throws when submitting
   */
  static Scheduler guardedScheduler(Scheduler scheduler) {
    return (scheduler instanceof GuardedScheduler) ? scheduler : new GuardedScheduler(scheduler);
  }
}

final class ExecutorScheduler implements Scheduler {
  final Executor executor;

  ExecutorScheduler(Executor executor) {
    this.executor = requireNonNull(executor);
  }

  @Override
  public <V> CompletableFuture<V> submit(FallibleComputation<? extends V> computation) {
    requireNonNull(computation);
    var future = new CompletableFuture<V>();
    executor.execute(() -> run(computation, future));
    return future;
  }

  /** Runs the computation and completes the future with its result. */
  @SuppressWarnings("PMD.AvoidCatchingThrowable")
  static <V> void run(FallibleComputation<? extends V> computation, CompletableFuture<V> future) {
    try {
      future.complete(computation.compute());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.completeExceptionally(e);
    } catch (Throwable t) {
      future.completeExceptionally(t);
    }
  }

  @Override
  public String toString() {
    return "ExecutorScheduler[" + executor + "]";
  }
}

enum CommonPoolScheduler implements Scheduler {
  INSTANCE;

  @Override
  public <V> CompletableFuture<V> submit(FallibleComputation<? extends V> computation) {
    requireNonNull(computation);
    var future = new CompletableFuture<V>();
    ForkJoinPool.commonPool().execute(() -> ExecutorScheduler.run(computation, future));
    return future;
  }
}

enum SameThreadScheduler implements Scheduler {
  INSTANCE;

  @Override
  public <V> CompletableFuture<V> submit(FallibleComputation<? extends V> computation) {
    requireNonNull(computation);
    var future = new CompletableFuture<V>();
    ExecutorScheduler.run(computation, future);
    return future;
  }
}

final class GuardedScheduler implements Scheduler {
  private static final Logger logger = System.getLogger(GuardedScheduler.class.getName());

  final Scheduler delegate;

  GuardedScheduler(Scheduler delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  @SuppressWarnings("PMD.AvoidCatchingThrowable")
  public <V> CompletableFuture<V> submit(FallibleComputation<? extends V> computation) {
    requireNonNull(computation);
    try {
      CompletableFuture<V> future = delegate.submit(computation);
      if (future == null) {
        logger.log(Level.WARNING, "Scheduler returned a null future; aborted computation");
        return CompletableFuture.failedFuture(
            new NullPointerException("Scheduler returned a null future"));
      }
      return future;
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by scheduler; aborted computation", t);
      return CompletableFuture.failedFuture(t);
    }
  }

  @Override
  public String toString() {
    return "GuardedScheduler[" + delegate + "]";
  }
}
