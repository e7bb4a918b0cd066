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
package com.github.benmanes.inflight.cache.stats;

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * A {@link StatsCounter} implementation that suppresses and logs any exception thrown by the
 * delegate <tt>statsCounter</tt>, so that a faulty metrics backend cannot break a computation.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@SuppressWarnings({"PMD.AvoidCatchingThrowable", "PMD.AvoidDuplicateLiterals"})
final class GuardedStatsCounter implements StatsCounter {
  static final Logger logger = System.getLogger(GuardedStatsCounter.class.getName());

  final StatsCounter delegate;

  GuardedStatsCounter(StatsCounter delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  public void recordHits(int count) {
    try {
      delegate.recordHits(count);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
    }
  }

  @Override
  public void recordMisses(int count) {
    try {
      delegate.recordMisses(count);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
    }
  }

  @Override
  public void recordCoalesced(int count) {
    try {
      delegate.recordCoalesced(count);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
    }
  }

  @Override
  public void recordComputeSuccess(long computeTime) {
    try {
      delegate.recordComputeSuccess(computeTime);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
    }
  }

  @Override
  public void recordComputeFailure(long computeTime) {
    try {
      delegate.recordComputeFailure(computeTime);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
    }
  }

  @Override
  public CacheStats snapshot() {
    try {
      return delegate.snapshot();
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by stats counter", t);
      return CacheStats.empty();
    }
  }

  @Override
  public String toString() {
    return delegate.toString();
  }
}
