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
import slotvault.PayloadAllocator;
import slotvault.PoolException;
import slotvault.PoolExhaustedException;
import slotvault.SlotHandle;
import slotvault.SlotNotAllocatedException;
import slotvault.SlotPool;
import slotvault.SlotVisitor;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * The {@link SlotPool} implementation: an array of independently locked
 * slots, and a scan lock for the two operations that search the array.
 * <p>
 * Lock order is always the scan lock first, then at most one slot lock. The
 * slot lock is released before the scan lock in predicate release, and in
 * allocation the scan lock is released while the new handle keeps the slot
 * lock. Predicate release skips slots locked by the calling thread.
 *
 * @param <T> The payload type.
 */
public final class VaultPool<T> implements SlotPool<T> {
  private final VSlot<T>[] slots;
  private final ReentrantLock scanLock;
  private final VaultCounters counters;

  /**
   * Build a pool from the configuration of the given builder.
   * @param builder The builder to read the capacity and allocator from.
   * @throws PoolException if the allocator fails.
   */
  @SuppressWarnings("unchecked")
  public VaultPool(SlotPoolBuilderImpl<T> builder) {
    int capacity;
    PayloadAllocator<T> allocator;
    synchronized (builder) {
      capacity = builder.getCapacity();
      allocator = builder.getAllocator();
    }
    slots = new VSlot[capacity];
    for (int i = 0; i < capacity; i++) {
      T payload;
      try {
        payload = allocator.allocate(i);
      } catch (Exception e) {
        throw new PoolException("Failed to allocate payload for slot " + i + ".", e);
      }
      slots[i] = new VSlot<>(i, payload);
    }
    scanLock = new ReentrantLock();
    counters = new VaultCounters(this);
  }

  @Override
  public SlotHandle<T> allocate() throws PoolExhaustedException {
    scanLock.lock();
    try {
      for (VSlot<T> slot : slots) {
        if (slot.isOccupied()) {
          continue;
        }
        slot.lock();
        if (slot.isOccupied()) {
          slot.unlock();
          continue;
        }
        slot.markOccupied();
        counters.allocations.increment();
        return new VSlotHandle<>(slot);
      }
    } finally {
      scanLock.unlock();
    }
    counters.exhausted.increment();
    throw new PoolExhaustedException(slots.length);
  }

  @Override
  public SlotHandle<T> view(int index) {
    VSlot<T> slot = slot(index);
    slot.lock();
    if (!slot.isOccupied()) {
      slot.unlock();
      throw new SlotNotAllocatedException(index);
    }
    counters.views.increment();
    return new VSlotHandle<>(slot);
  }

  @Override
  public boolean release(int index) {
    VSlot<T> slot = slot(index);
    slot.lock();
    try {
      boolean released = slot.clearOccupied();
      if (released) {
        counters.indexReleases.increment();
      }
      return released;
    } finally {
      slot.unlock();
    }
  }

  @Override
  public boolean release(Predicate<? super T> predicate) {
    requireNonNull(predicate, "Predicate cannot be null.");
    scanLock.lock();
    try {
      for (VSlot<T> slot : slots) {
        // Slots held by the calling thread are not candidates.
        if (!slot.isOccupied() || slot.isHeldByCurrentThread()) {
          continue;
        }
        slot.lock();
        try {
          if (slot.isOccupied() && predicate.test(slot.payload)) {
            slot.clearOccupied();
            counters.predicateReleases.increment();
            return true;
          }
        } finally {
          slot.unlock();
        }
      }
    } finally {
      scanLock.unlock();
    }
    return false;
  }

  @Override
  public void forEachAllocated(SlotVisitor<? super T> visitor) {
    requireNonNull(visitor, "Visitor cannot be null.");
    for (VSlot<T> slot : slots) {
      if (!slot.isOccupied()) {
        continue;
      }
      if (slot.isHeldByCurrentThread()) {
        visitor.visit(slot.index, slot.payload);
        continue;
      }
      slot.lock();
      try {
        if (slot.isOccupied()) {
          visitor.visit(slot.index, slot.payload);
        }
      } finally {
        slot.unlock();
      }
    }
  }

  @Override
  public int capacity() {
    return slots.length;
  }

  @Override
  public int allocatedCount() {
    int count = 0;
    for (VSlot<T> slot : slots) {
      if (slot.isOccupied()) {
        count++;
      }
    }
    return count;
  }

  @Override
  public ManagedSlotPool getManagedPool() {
    return counters;
  }

  private VSlot<T> slot(int index) {
    return slots[Objects.checkIndex(index, slots.length)];
  }

  @Override
  public String toString() {
    return "VaultPool[capacity = " + slots.length + ", allocated = " + allocatedCount() + "]";
  }
}
