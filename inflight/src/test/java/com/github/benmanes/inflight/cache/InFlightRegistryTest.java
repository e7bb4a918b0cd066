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

import static com.github.benmanes.inflight.testing.ConcurrentTestHarness.timeTasks;
import static com.google.common.truth.Truth.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.testng.annotations.Test;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class InFlightRegistryTest {
  private static final int NUMBER_OF_THREADS = 16;

  @Test
  public void tryBegin_initiator() {
    var registry = new InFlightRegistry<Integer, String>(16);
    var registration = registry.tryBegin(1);

    assertThat(registration.isInitiator()).isTrue();
    assertThat(registry.get(1)).isSameInstanceAs(registration.entry());
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  public void tryBegin_joinsExisting() {
    var registry = new InFlightRegistry<Integer, String>(16);
    var first = registry.tryBegin(1);
    var second = registry.tryBegin(1);

    assertThat(second.isInitiator()).isFalse();
    assertThat(second.entry()).isSameInstanceAs(first.entry());
  }

  @Test
  public void tryBegin_distinctKeys() {
    var registry = new InFlightRegistry<Integer, String>(16);
    assertThat(registry.tryBegin(1).isInitiator()).isTrue();
    assertThat(registry.tryBegin(2).isInitiator()).isTrue();
    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  public void tryBegin_concurrent_singleInitiator() {
    var registry = new InFlightRegistry<Integer, String>(16);
    var initiators = new AtomicInteger();
    timeTasks(NUMBER_OF_THREADS, () -> {
      if (registry.tryBegin(1).isInitiator()) {
        initiators.incrementAndGet();
      }
    });
    assertThat(initiators.get()).isEqualTo(1);
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  public void complete_removesThenPublishes() {
    var registry = new InFlightRegistry<Integer, String>(16);
    var entry = registry.tryBegin(1).entry();
    var subscription = entry.attach();
    var observed = new AtomicReference<PendingEntry<Integer, String>>(entry);
    var unused = subscription.thenRun(() -> observed.set(registry.get(1)));

    assertThat(registry.complete(entry, Outcome.success("a"))).isTrue();
    assertThat(subscription.join()).isEqualTo("a");
    assertThat(observed.get()).isNull();
    assertThat(registry.size()).isEqualTo(0);
  }

  @Test
  public void complete_startsNewEntry() {
    var registry = new InFlightRegistry<Integer, String>(16);
    var entry = registry.tryBegin(1).entry();
    registry.complete(entry, Outcome.success("a"));

    var next = registry.tryBegin(1);
    assertThat(next.isInitiator()).isTrue();
    assertThat(next.entry()).isNotSameInstanceAs(entry);
  }

  @Test
  public void complete_doesNotRemoveSuccessor() {
    var registry = new InFlightRegistry<Integer, String>(16);
    var entry = registry.tryBegin(1).entry();
    registry.complete(entry, Outcome.success("a"));
    var successor = registry.tryBegin(1).entry();

    assertThat(registry.complete(entry, Outcome.success("b"))).isFalse();
    assertThat(registry.get(1)).isSameInstanceAs(successor);
  }
}
