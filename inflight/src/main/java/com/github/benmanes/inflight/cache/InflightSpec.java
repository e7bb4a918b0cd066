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

import static com.github.benmanes.inflight.cache.Inflight.UNSET_INT;
import static com.github.benmanes.inflight.cache.Inflight.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A specification of an {@link Inflight} builder configuration.
 * <p>
 * {@code InflightSpec} supports parsing configuration off of a string, which makes it especially
 * useful for command-line configuration of an {@code Inflight} builder.
 * <p>
 * The string syntax is a series of comma-separated keys or key-value pairs, each corresponding to an
 * {@code Inflight} builder method.
 * <ul>
 *   <li>{@code initialCapacity=[integer]}: sets {@link Inflight#initialCapacity}.
 *   <li>{@code scheduler=[commonPool|sameThread]}: sets {@link Inflight#scheduler}.
 *   <li>{@code recordStats}: sets {@link Inflight#recordStats}.
 * </ul>
 * <p>
 * Whitespace before and after commas and equal signs is ignored. Keys may not be repeated.
 * <p>
 * {@code InflightSpec} does not support configuring {@code Inflight} methods with non-value
 * parameters. These must be configured in code.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class InflightSpec {
  static final String SPLIT_OPTIONS = ",";
  static final String SPLIT_KEY_VALUE = "=";

  final String specification;

  int initialCapacity = UNSET_INT;
  @Nullable String scheduler;
  boolean recordStats;

  private InflightSpec(String specification) {
    this.specification = requireNonNull(specification);
  }

  /**
   * Returns an {@link Inflight} builder configured according to this specification.
   *
   * @return a builder configured to the specification
   */
  Inflight<Object, Object> toBuilder() {
    Inflight<Object, Object> builder = Inflight.newBuilder();
    if (initialCapacity != UNSET_INT) {
      builder.initialCapacity(initialCapacity);
    }
    if (scheduler != null) {
      builder.scheduler(scheduler.equals("sameThread")
          ? Scheduler.sameThread()
          : Scheduler.commonPool());
    }
    if (recordStats) {
      builder.recordStats();
    }
    return builder;
  }

  /**
   * Creates an InflightSpec from a string.
   *
   * @param specification the string form
   * @return the parsed specification
   * @throws IllegalArgumentException if the string has an unknown, repeated or malformed option
   */
  @SuppressWarnings("StringSplitter")
  public static InflightSpec parse(String specification) {
    InflightSpec spec = new InflightSpec(specification);
    for (String option : specification.split(SPLIT_OPTIONS)) {
      spec.parseOption(option.trim());
    }
    return spec;
  }

  /** Parses and applies the configuration option. */
  void parseOption(String option) {
    if (option.isEmpty()) {
      return;
    }

    @SuppressWarnings("StringSplitter")
    String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
    requireArgument(keyAndValue.length <= 2,
        "key-value pair %s with more than one equals sign", option);

    String key = keyAndValue[0].trim();
    String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();

    configure(key, value);
  }

  /** Configures the setting. */
  void configure(String key, @Nullable String value) {
    switch (key) {
      case "initialCapacity":
        initialCapacity(key, value);
        return;
      case "scheduler":
        scheduler(key, value);
        return;
      case "recordStats":
        recordStats(value);
        return;
      default:
        throw new IllegalArgumentException("Unknown key " + key);
    }
  }

  /** Configures the initial capacity. */
  void initialCapacity(String key, @Nullable String value) {
    requireArgument(initialCapacity == UNSET_INT,
        "initial capacity was already set to %,d", initialCapacity);
    initialCapacity = parseInt(key, value);
  }

  /** Configures the scheduler by name. */
  void scheduler(String key, @Nullable String value) {
    requireArgument(scheduler == null, "scheduler was already set to %s", scheduler);
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    requireArgument(value.equals("commonPool") || value.equals("sameThread"),
        "key %s value was set to %s, must be commonPool or sameThread", key, value);
    scheduler = value;
  }

  /** Configures statistics recording. */
  void recordStats(@Nullable String value) {
    requireArgument(value == null, "record stats does not take a value");
    requireArgument(!recordStats, "record stats was already set");
    recordStats = true;
  }

  /** Returns a parsed int value. */
  static int parseInt(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be an integer", key, value), e);
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof InflightSpec)) {
      return false;
    }
    InflightSpec spec = (InflightSpec) o;
    return (initialCapacity == spec.initialCapacity)
        && (recordStats == spec.recordStats)
        && Objects.equals(scheduler, spec.scheduler);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initialCapacity, scheduler, recordStats);
  }

  /**
   * Returns a string that can be used to parse an equivalent {@code InflightSpec}. The order and
   * form of this representation is not guaranteed, except that parsing its output will produce an
   * {@code InflightSpec} equal to this instance.
   *
   * @return a string representation of this specification
   */
  public String toParsableString() {
    return specification;
  }

  /**
   * Returns a string representation for this {@code InflightSpec} instance. The form of this
   * representation is not guaranteed.
   */
  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + toParsableString() + '}';
  }
}
