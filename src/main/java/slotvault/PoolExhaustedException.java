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

import java.io.Serial;

/**
 * Thrown by {@link SlotPool#allocate()} when every slot in the pool was
 * allocated at the time the pool was scanned.
 * <p>
 * The pool does not wait for a slot to become free, and it does not retry.
 * Backing off and trying again is up to the caller.
 */
public class PoolExhaustedException extends PoolException {
  @Serial
  private static final long serialVersionUID = 3390286547811472103L;

  private final int capacity;

  /**
   * Create a new exception for a pool of the given capacity.
   * @param capacity The capacity of the exhausted pool.
   */
  public PoolExhaustedException(int capacity) {
    super("No free slot found; all " + capacity + " slots are allocated.");
    this.capacity = capacity;
  }

  /**
   * @return The capacity of the pool that had no free slots.
   */
  public int getCapacity() {
    return capacity;
  }
}
