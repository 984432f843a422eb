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
package slotvault;

/**
 * The {@code SlotPoolBuilder} collects the capacity of a pool and the
 * allocator of its payloads, and finally acts as the factory for the pool
 * instances themselves, with the {@link #build()} method.
 * <p>
 * Builders are obtained by calling {@link SlotPool#from(PayloadAllocator)}.
 * <p>
 * This class is made thread-safe by having the fields be protected by the
 * intrinsic object lock on the builder object itself.
 * <p>
 * The various {@code set*} methods return the builder instance itself, so
 * that the method calls may be chained if so desired.
 *
 * @param <T> The type of payload held by the slots of the pools being built.
 */
public interface SlotPoolBuilder<T> {
  /**
   * The capacity a builder starts out with.
   */
  int DEFAULT_CAPACITY = 1024;

  /**
   * Set the capacity of the pool we are building.
   * <p>
   * The capacity is fixed once the pool is built. Pools cannot be resized.
   *
   * @param capacity The number of slots in the pool. Must be at least 1.
   * @return This {@code SlotPoolBuilder} instance.
   * @throws IllegalArgumentException if the capacity is less than 1.
   */
  SlotPoolBuilder<T> setCapacity(int capacity);

  /**
   * Get the currently configured capacity. The default is
   * {@value #DEFAULT_CAPACITY}.
   * @return The configured capacity.
   */
  int getCapacity();

  /**
   * Set the allocator used for creating the initial payload of every slot.
   *
   * @param allocator The allocator to use. Cannot be {@code null}.
   * @param <X> The payload type of the given allocator.
   * @return This {@code SlotPoolBuilder} instance, typed for the new payload type.
   */
  <X> SlotPoolBuilder<X> setAllocator(PayloadAllocator<X> allocator);

  /**
   * @return The configured payload allocator.
   */
  PayloadAllocator<T> getAllocator();

  /**
   * Build a new pool from the current configuration.
   * <p>
   * The payload of every slot is allocated before this method returns, and
   * every slot starts out free.
   *
   * @return A new pool.
   * @throws PoolException if the allocator failed to create a payload.
   */
  SlotPool<T> build();
}
