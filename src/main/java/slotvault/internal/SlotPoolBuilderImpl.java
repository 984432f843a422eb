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

import slotvault.PayloadAllocator;
import slotvault.SlotPool;
import slotvault.SlotPoolBuilder;

import static java.util.Objects.requireNonNull;

/**
 * The {@link SlotPoolBuilder} implementation.
 * @param <T> The payload type.
 */
public final class SlotPoolBuilderImpl<T> implements SlotPoolBuilder<T> {
  private PayloadAllocator<T> allocator;
  private int capacity = DEFAULT_CAPACITY;

  /**
   * Build a new {@code SlotPoolBuilder} with the default capacity.
   * @param allocator The payload allocator to use.
   */
  public SlotPoolBuilderImpl(PayloadAllocator<T> allocator) {
    requireNonNull(allocator, "The PayloadAllocator cannot be null.");
    this.allocator = allocator;
  }

  @Override
  public synchronized SlotPoolBuilder<T> setCapacity(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException(
          "Capacity must be at least 1, but was " + capacity + ".");
    }
    this.capacity = capacity;
    return this;
  }

  @Override
  public synchronized int getCapacity() {
    return capacity;
  }

  @SuppressWarnings("unchecked")
  @Override
  public synchronized <X> SlotPoolBuilder<X> setAllocator(PayloadAllocator<X> allocator) {
    requireNonNull(allocator, "The PayloadAllocator cannot be null.");
    this.allocator = (PayloadAllocator<T>) allocator;
    return (SlotPoolBuilderImpl<X>) this;
  }

  @Override
  public synchronized PayloadAllocator<T> getAllocator() {
    return allocator;
  }

  @Override
  public synchronized SlotPool<T> build() {
    return new VaultPool<>(this);
  }
}
