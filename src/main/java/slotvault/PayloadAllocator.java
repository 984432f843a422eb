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
 * A PayloadAllocator creates the initial payload of every slot, when a
 * {@link SlotPool} is built.
 * <p>
 * The slots of a pool are never destroyed, and neither are their payloads.
 * Allocating and releasing slots only flips their occupancy; the payload
 * object created here is reused for as long as the pool lives, unless it is
 * replaced through {@link SlotHandle#set(Object)}.
 * <p>
 * Mutable payload types are the common case, such as a record-like class
 * whose fields are overwritten by whoever allocates the slot.
 *
 * @param <T> The type of payload held by the slots of the pool.
 */
@FunctionalInterface
public interface PayloadAllocator<T> {
  /**
   * Create the initial payload for the slot with the given index.
   * <p>
   * Exceptions thrown from here are wrapped in a {@link PoolException} and
   * thrown from {@link SlotPoolBuilder#build()}.
   *
   * @param index The index of the slot the payload is created for.
   * @return The initial payload. May be {@code null}.
   * @throws Exception if the payload could not be created.
   */
  T allocate(int index) throws Exception;
}
