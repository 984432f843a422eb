/*
 * Copyright © Chris Vest (mr.chrisvest@gmail.com)
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
package slotvault.tests.blackbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.RegisterExtension;
import slotvault.SlotHandle;
import slotvault.SlotPool;
import slotvault.tests.extensions.ExecutorExtension;
import testkits.Entry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static testkits.UnitKit.runConcurrently;

/**
 * Runs a 1024 slot pool through rounds of concurrent filling, mutation and
 * draining from eight threads, and checks that nothing is lost or counted
 * twice along the way.
 */
@Timeout(120)
class FillModifyDrainTest {
  private static final int CAPACITY = 1024;
  private static final int THREADS = 8;
  private static final int PER_THREAD = CAPACITY / THREADS;
  private static final int MODIFICATIONS = 200;

  @RegisterExtension
  final ExecutorExtension executorExtension = new ExecutorExtension();

  private ExecutorService executor;
  private SlotPool<Entry> pool;

  @BeforeEach
  void setUp() {
    executor = executorExtension.getExecutorService();
    pool = SlotPool.from(Entry.ALLOCATOR).setCapacity(CAPACITY).build();
  }

  private void fillConcurrently(String prefix, int perThread) {
    runConcurrently(executor, THREADS, worker -> {
      for (int n = 0; n < perThread; n++) {
        try (SlotHandle<Entry> handle = pool.allocate()) {
          handle.get().set(prefix + (worker + 1) + "_" + (n + 1), 0);
        }
        Thread.yield();
      }
      return null;
    });
  }

  private List<String> dump() {
    List<String> tags = new ArrayList<>();
    pool.forEachAllocated((index, e) -> tags.add(e.tag));
    return tags;
  }

  @Test
  void concurrentFillMustOccupyEverySlotWithDistinctTags() {
    fillConcurrently("", PER_THREAD);

    List<String> tags = dump();
    assertThat(tags).hasSize(CAPACITY);
    assertThat(new HashSet<>(tags)).hasSize(CAPACITY);
    assertThat(tags).contains("1_1", "8_128");
  }

  @Test
  void concurrentMultiFieldModificationsMustAllBeCounted() {
    fillConcurrently("", PER_THREAD);

    runConcurrently(executor, THREADS, worker -> {
      ThreadLocalRandom rng = ThreadLocalRandom.current();
      for (int k = 0; k < MODIFICATIONS; k++) {
        try (SlotHandle<Entry> handle = pool.view(rng.nextInt(CAPACITY))) {
          Entry entry = handle.get();
          entry.counter++;
          entry.tag = entry.tag + "_" + (worker + 1);
        }
        Thread.yield();
      }
      return null;
    });

    AtomicInteger sum = new AtomicInteger();
    AtomicInteger suffixes = new AtomicInteger();
    pool.forEachAllocated((index, e) -> {
      sum.addAndGet(e.counter);
      // Every modification appends exactly one "_worker" suffix to a tag that
      // started out as "thread_item".
      suffixes.addAndGet(e.tag.split("_").length - 2);
    });
    assertEquals(THREADS * MODIFICATIONS, sum.get());
    assertEquals(THREADS * MODIFICATIONS, suffixes.get());
  }

  @Test
  void overlappingIndexReleasesMustFreeEverySlotOnce() {
    fillConcurrently("", PER_THREAD);

    List<Integer> released = runConcurrently(executor, THREADS, worker -> {
      int count = 0;
      for (int index = worker; index < CAPACITY; index += 2) {
        if (pool.release(index)) {
          count++;
        }
        Thread.yield();
      }
      return count;
    });

    assertEquals(CAPACITY, released.stream().mapToInt(Integer::intValue).sum());
    assertThat(dump()).isEmpty();
  }

  @Test
  void drainByPrefixThenRefillSparseSlots() {
    fillConcurrently("", PER_THREAD);

    List<Integer> drained = runConcurrently(executor, THREADS, worker -> {
      int count = 0;
      while (pool.release((Entry e) -> e.tag.startsWith("2_"))) {
        count++;
        Thread.yield();
      }
      return count;
    });
    int total = drained.stream().mapToInt(Integer::intValue).sum();
    assertEquals(PER_THREAD, total);
    assertEquals(CAPACITY - PER_THREAD, pool.allocatedCount());
    assertThat(dump()).noneMatch(tag -> tag.startsWith("2_"));

    fillConcurrently("additional ", total / THREADS);

    List<String> tags = dump();
    assertThat(tags).hasSize(CAPACITY);
    Set<String> additional = new HashSet<>();
    for (String tag : tags) {
      if (tag.startsWith("additional ")) {
        additional.add(tag);
      }
    }
    assertThat(additional).hasSize(PER_THREAD);
    assertEquals(CAPACITY + PER_THREAD, pool.getManagedPool().getAllocationCount());
  }
}
