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

/**
 * This package contains a concurrent compute-if-absent cache. All cache variants are configured
 * and created using the {@link com.github.benmanes.inflight.cache.Inflight} builder.
 * <p>
 * A {@link com.github.benmanes.inflight.cache.Cache} returns the value associated with a key,
 * computing it on a miss. Concurrent misses for the same key are coalesced so that only one
 * {@link com.github.benmanes.inflight.cache.Computation} runs, and every caller receives its
 * outcome. An {@link com.github.benmanes.inflight.cache.AsyncCache} offers the same operations
 * but returns a {@link java.util.concurrent.CompletableFuture} instead of blocking.
 * <p>
 * Computations are handed to a {@link com.github.benmanes.inflight.cache.Scheduler} and may run
 * on another thread after the calling method has returned. They must therefore be
 * self-contained: everything a computation reads is captured by value when it is created.
 * <p>
 * Committed values are held by a {@link com.github.benmanes.inflight.cache.Store}, which may be
 * replaced to plug in a bounded or expiring storage engine.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.inflight.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
