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
 * Thrown when a slot is accessed by index, but the slot is not currently
 * allocated. This usually means the index is stale; the slot has been
 * released since the index was obtained.
 */
public class SlotNotAllocatedException extends PoolException {
  @Serial
  private static final long serialVersionUID = -6072514428839015275L;

  private final int index;

  /**
   * Create a new exception for the slot at the given index.
   * @param index The index of the slot that was not allocated.
   */
  public SlotNotAllocatedException(int index) {
    super("Slot " + index + " is not allocated.");
    this.index = index;
  }

  /**
   * @return The index of the slot that was not allocated.
   */
  public int getIndex() {
    return index;
  }
}
