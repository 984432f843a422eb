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

import slotvault.SlotHandle;

/**
 * The {@link SlotHandle} implementation. Created with the slot lock already
 * held, and unlocks it on the first {@link #close()}.
 * <p>
 * Instances are confined to the thread that owns the slot lock, so the open
 * flag needs no synchronisation.
 *
 * @param <T> The payload type.
 */
public final class VSlotHandle<T> implements SlotHandle<T> {
  private final VSlot<T> slot;
  private boolean open;

  VSlotHandle(VSlot<T> slot) {
    assert slot.isHeldByCurrentThread();
    this.slot = slot;
    open = true;
  }

  @Override
  public int index() {
    return slot.index;
  }

  @Override
  public T get() {
    checkAccess();
    return slot.payload;
  }

  @Override
  public void set(T payload) {
    checkAccess();
    slot.payload = payload;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    if (open) {
      checkOwner();
      open = false;
      slot.unlock();
    }
  }

  private void checkAccess() {
    if (!open) {
      throw new IllegalStateException("The handle to slot " + slot.index + " is closed.");
    }
    checkOwner();
  }

  private void checkOwner() {
    if (!slot.isHeldByCurrentThread()) {
      throw new IllegalStateException("The handle to slot " + slot.index +
          " belongs to another thread.");
    }
  }

  @Override
  public String toString() {
    return "SlotHandle[" + slot.index + (open ? "" : ", closed") + "]";
  }
}
