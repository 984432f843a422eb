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

import slotvault.internal.SlotPoolBuilderImpl;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A SlotPool is a fixed number of slots, each holding one payload, from which
 * one can allocate slots, get exclusive access to their payloads, and release
 * them again.
 * <p>
 * Every slot has its own lock, and an occupancy flag telling whether the slot
 * is allocated. Exclusive access to a payload is given through a
 * {@link SlotHandle}, which holds the slot lock until it is closed. On top of
 * that, the pool has a single pool-wide lock, which is only taken while
 * searching for a slot: in {@link #allocate()} and in
 * {@link #release(Predicate)}. It is never held while a caller has access to
 * a payload.
 * <p>
 * Operations on different slots run in parallel. Operations on the same slot
 * are serialised by the slot lock, in no particular order.
 * <p>
 * The handles are bound to the thread that obtained them. The usual idiom is
 * try-with-resources:
 * <pre>{@code
 * int index;
 * try (SlotHandle<Order> handle = pool.allocate()) {
 *   handle.get().customer = "ACME";
 *   index = handle.index();
 * }
 * try (SlotHandle<Order> handle = pool.view(index)) {
 *   handle.get().quantity++;
 * }
 * pool.release(index);
 * }</pre>
 * A thread that holds a handle must not ask for the same slot again, through
 * {@link #view(int)} or {@link #release(int)}. This is detected, and fails
 * with an {@link IllegalStateException}.
 * <p>
 * Handles should be closed before the enclosing operation completes. In
 * particular, a thread that holds a handle must not call {@link #allocate()}
 * or {@link #release(Predicate)} while other threads use the pool: both
 * operations wait for slot locks while holding the pool-wide lock, and can
 * deadlock with a handle holder that waits for the pool-wide lock.
 *
 * @author Chris Vest
 * @param <T> The type of payload held by the slots.
 */
public interface SlotPool<T> {
  /**
   * Get a {@link SlotPoolBuilder} based on the given {@link PayloadAllocator},
   * which can then in turn be used to {@linkplain SlotPoolBuilder#build() build}
   * a {@link SlotPool} instance with the desired capacity.
   *
   * @param allocator The allocator of the initial slot payloads. This cannot
   * be {@code null}.
   * @param <T> The type of payload created by the allocator.
   * @return A {@link SlotPoolBuilder} that admits additional configuration,
   * before the pool instance is built.
   */
  static <T> SlotPoolBuilder<T> from(PayloadAllocator<T> allocator) {
    return new SlotPoolBuilderImpl<>(allocator);
  }

  /**
   * Build a pool with the given capacity, and payloads from the given allocator.
   *
   * @param capacity The number of slots in the pool. Must be at least 1.
   * @param allocator The allocator of the initial slot payloads.
   * @param <T> The type of payload created by the allocator.
   * @return A new pool where every slot is free.
   * @see #from(PayloadAllocator)
   */
  static <T> SlotPool<T> of(int capacity, PayloadAllocator<T> allocator) {
    return from(allocator).setCapacity(capacity).build();
  }

  /**
   * Allocate the first free slot in the pool.
   * <p>
   * The slot is marked as allocated, and a handle to it is returned with the
   * slot lock already held. The payload is not reset; it has the value it was
   * left with by the previous user of the slot, so the caller must overwrite
   * whatever it cares about.
   * <p>
   * The search for a free slot is done under the pool-wide lock, so two
   * concurrent allocations never claim the same slot.
   *
   * @return A handle to the newly allocated slot.
   * @throws PoolExhaustedException if no slot was free.
   */
  SlotHandle<T> allocate() throws PoolExhaustedException;

  /**
   * Get exclusive access to the payload of the allocated slot at the given
   * index, waiting for the slot lock if necessary.
   * <p>
   * The pool-wide lock is not taken, so views of different slots never wait
   * for each other, nor for allocations.
   *
   * @param index The index of the slot.
   * @return A handle to the slot.
   * @throws IndexOutOfBoundsException if the index is negative, or not less
   * than the {@linkplain #capacity() capacity}.
   * @throws SlotNotAllocatedException if the slot is free.
   * @throws IllegalStateException if the current thread already holds a
   * handle to the slot.
   */
  SlotHandle<T> view(int index);

  /**
   * Release the slot at the given index, making it free for allocation.
   * <p>
   * Releasing a free slot does nothing, and is not an error. This method
   * waits for any open handle to the slot to be closed, but does not take
   * the pool-wide lock.
   *
   * @param index The index of the slot.
   * @return {@code true} if the slot was allocated and has now been released,
   * {@code false} if it was already free.
   * @throws IndexOutOfBoundsException if the index is negative, or not less
   * than the {@linkplain #capacity() capacity}.
   * @throws IllegalStateException if the current thread holds a handle to
   * the slot.
   */
  boolean release(int index);

  /**
   * Release the first allocated slot, in index order, whose payload matches
   * the given predicate.
   * <p>
   * The predicate is called with the slot lock held, and must not have side
   * effects. The search happens under the pool-wide lock, which is held until
   * the slot lock of each candidate has been acquired, so a candidate that is
   * in use by another thread is waited for rather than passed over. This
   * makes it the most expensive operation of the pool. It is meant to be
   * called in a loop until it returns {@code false}, which drains the pool of
   * matching slots; {@link #releaseAll(Predicate)} does exactly that.
   * <p>
   * Slots the calling thread holds handles to are skipped, and never
   * released by this method.
   *
   * @param predicate The condition a payload must meet for its slot to be
   * released. Cannot be {@code null}.
   * @return {@code true} if a slot was released, {@code false} if no
   * allocated slot matched.
   */
  boolean release(Predicate<? super T> predicate);

  /**
   * Release every allocated slot whose payload matches the given predicate,
   * by calling {@link #release(Predicate)} until it returns {@code false}.
   *
   * @param predicate The condition a payload must meet for its slot to be
   * released. Cannot be {@code null}.
   * @return The number of slots released by this call.
   */
  default int releaseAll(Predicate<? super T> predicate) {
    Objects.requireNonNull(predicate, "Predicate cannot be null.");
    int released = 0;
    while (release(predicate)) {
      released++;
    }
    return released;
  }

  /**
   * View the slot at the given index, apply the given function to its
   * payload, and close the handle again.
   *
   * @param index The index of the slot.
   * @param function The function to apply to the payload.
   * @param <R> The return type of the function.
   * @return The value returned by the function.
   * @see #view(int) The {@code view} method for the failure modes.
   */
  default <R> R apply(int index, Function<? super T, R> function) {
    Objects.requireNonNull(function, "Function cannot be null.");
    try (SlotHandle<T> handle = view(index)) {
      return function.apply(handle.get());
    }
  }

  /**
   * View the slot at the given index, pass its payload to the given consumer,
   * and close the handle again.
   *
   * @param index The index of the slot.
   * @param consumer The consumer of the payload.
   * @see #view(int) The {@code view} method for the failure modes.
   */
  default void supply(int index, Consumer<? super T> consumer) {
    Objects.requireNonNull(consumer, "Consumer cannot be null.");
    try (SlotHandle<T> handle = view(index)) {
      consumer.accept(handle.get());
    }
  }

  /**
   * Visit the payload of every allocated slot, in index order.
   * <p>
   * Each slot is locked while it is visited, but the slots are visited one at
   * a time. Slots that are allocated or released while the visit is in
   * progress may or may not be included. Slots the calling thread holds
   * handles to are visited as well.
   *
   * @param visitor The visitor to call for each allocated slot.
   */
  void forEachAllocated(SlotVisitor<? super T> visitor);

  /**
   * @return The fixed number of slots in this pool.
   */
  int capacity();

  /**
   * Count the slots that appear to be allocated. The count is taken without
   * locking, and is only a hint when other threads use the pool concurrently.
   *
   * @return The approximate number of allocated slots.
   */
  int allocatedCount();

  /**
   * Get the {@link ManagedSlotPool} of this pool, with its counters.
   * @return The management interface of this pool.
   */
  ManagedSlotPool getManagedPool();
}
