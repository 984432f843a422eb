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

import java.util.concurrent.locks.ReentrantLock;

/**
 * The VSlot is one slot of a {@link VaultPool}: a payload, the lock that
 * protects it, and the occupancy flag.
 * <p>
 * The occupancy flag may be read without holding the lock, but only as a
 * hint. It is only ever written with the lock held, and every decision based
 * on it is re-validated with the lock held.
 *
 * @param <T> The payload type.
 */
public final class VSlot<T> {
  private final ReentrantLock lock;
  private volatile boolean occupied;
  final int index;
  /**
   * The payload. Guarded by the slot lock.
   */
  T payload;

  /**
   * Create a new, free slot.
   * @param index The index of the slot in its pool.
   * @param payload The initial payload of the slot.
   */
  public VSlot(int index, T payload) {
    this.index = index;
    this.payload = payload;
    lock = new ReentrantLock();
  }

  /**
   * Block until the lock of this slot is acquired.
   * @throws IllegalStateException if the current thread already holds the lock.
   */
  void lock() {
    checkNotHeldByCurrentThread();
    lock.lock();
  }

  void unlock() {
    lock.unlock();
  }

  boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  private void checkNotHeldByCurrentThread() {
    // The lock is reentrant, so a second acquisition by the owner would hand
    // out a second handle to the same slot.
    if (lock.isHeldByCurrentThread()) {
      throw new IllegalStateException(
          "Slot " + index + " is already held by the current thread.");
    }
  }

  /**
   * Read the occupancy flag. Only authoritative with the lock held.
   * @return {@code true} if the slot is allocated.
   */
  boolean isOccupied() {
    return occupied;
  }

  void markOccupied() {
    assert lock.isHeldByCurrentThread();
    occupied = true;
  }

  /**
   * Clear the occupancy flag.
   * @return The value the flag had before it was cleared.
   */
  boolean clearOccupied() {
    assert lock.isHeldByCurrentThread();
    boolean wasOccupied = occupied;
    occupied = false;
    return wasOccupied;
  }

  @Override
  public String toString() {
    return "VSlot[" + index + ", " + (occupied ? "OCCUPIED" : "FREE") +
        (lock.isLocked() ? ", LOCKED" : "") + "]";
  }
}
