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
 * A SlotHandle grants exclusive access to the payload of one slot in a
 * {@link SlotPool}, for as long as the handle is open.
 * <p>
 * The handle owns the lock of its slot. No other handle to the same slot can
 * exist while this one is open, so the payload can be read and written
 * freely through {@link #get()} and {@link #set(Object)}. The slot is
 * unlocked when the handle is {@linkplain #close() closed}, which is best done
 * with the try-with-resources syntax:
 * <pre>{@code
 * try (SlotHandle<Order> handle = pool.allocate()) {
 *   handle.get().customer = "ACME";
 *   handle.get().quantity = 0;
 * }
 * }</pre>
 * <p>
 * Handles are bound to the thread that obtained them, and must be closed by
 * that same thread. A handle is never re-bound to another slot.
 *
 * @param <T> The type of payload held by the slot.
 */
public interface SlotHandle<T> extends AutoCloseable {
  /**
   * @return The index of the slot this handle is bound to.
   */
  int index();

  /**
   * Get the payload of the slot.
   * <p>
   * The payload keeps whatever value it had from prior use of the slot.
   * Nothing is reset when a slot is allocated anew.
   *
   * @return The current payload of the slot.
   * @throws IllegalStateException if the handle has been closed.
   */
  T get();

  /**
   * Replace the payload of the slot.
   * @param payload The new payload.
   * @throws IllegalStateException if the handle has been closed.
   */
  void set(T payload);

  /**
   * @return {@code true} if this handle is still open, otherwise {@code false}.
   */
  boolean isOpen();

  /**
   * Unlock the slot. Only the first call has any effect.
   */
  @Override
  void close();
}
