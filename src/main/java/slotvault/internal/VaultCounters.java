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
package slotvault.internal;

import slotvault.ManagedSlotPool;

import java.util.concurrent.atomic.LongAdder;

/**
 * The {@link ManagedSlotPool} of a {@link VaultPool}.
 */
public final class VaultCounters implements ManagedSlotPool {
  private final VaultPool<?> pool;
  final LongAdder allocations = new LongAdder();
  final LongAdder exhausted = new LongAdder();
  final LongAdder views = new LongAdder();
  final LongAdder indexReleases = new LongAdder();
  final LongAdder predicateReleases = new LongAdder();

  VaultCounters(VaultPool<?> pool) {
    this.pool = pool;
  }

  @Override
  public int getCapacity() {
    return pool.capacity();
  }

  @Override
  public int getAllocatedCount() {
    return pool.allocatedCount();
  }

  @Override
  public long getAllocationCount() {
    return allocations.sum();
  }

  @Override
  public long getExhaustedCount() {
    return exhausted.sum();
  }

  @Override
  public long getViewCount() {
    return views.sum();
  }

  @Override
  public long getIndexReleaseCount() {
    return indexReleases.sum();
  }

  @Override
  public long getPredicateReleaseCount() {
    return predicateReleases.sum();
  }
}
