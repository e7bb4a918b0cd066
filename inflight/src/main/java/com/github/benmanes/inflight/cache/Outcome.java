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

import org.jspecify.annotations.Nullable;

/**
 * The terminal result of a computation: the value, the checked exception that the computation
 * threw, or the signal that it terminated abnormally.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class Outcome<V> {
  enum Kind { SUCCESS, FAILURE, ABORTED }

  final Kind kind;
  final @Nullable V value;
  final @Nullable Throwable error;

  private Outcome(Kind kind, @Nullable V value, @Nullable Throwable error) {
    this.value = value;
    this.error = error;
    this.kind = kind;
  }

  static <V> Outcome<V> success(V value) {
    return new Outcome<>(Kind.SUCCESS, requireNonNull(value), /* error= */ null);
  }

  static <V> Outcome<V> failure(Exception error) {
    return new Outcome<>(Kind.FAILURE, /* value= */ null, requireNonNull(error));
  }

  static <V> Outcome<V> aborted(AbortedComputationException error) {
    return new Outcome<>(Kind.ABORTED, /* value= */ null, requireNonNull(error));
  }

  boolean isSuccess() {
    return (kind == Kind.SUCCESS);
  }

  /** Returns the value, which is only present if successful. */
  @SuppressWarnings("NullAway")
  V value() {
    return value;
  }

  /** Returns the error, which is only present if unsuccessful. */
  @SuppressWarnings("NullAway")
  Throwable error() {
    return error;
  }

  /** Completes the future with this outcome. */
  @SuppressWarnings("FutureReturnValueIgnored")
  void complete(CompletableFuture<V> future) {
    if (isSuccess()) {
      future.complete(value());
    } else {
      future.completeExceptionally(error());
    }
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "Outcome[" + kind + "]"
        : "Outcome[" + kind + ", " + error + "]";
  }
}
