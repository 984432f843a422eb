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
 * Callback for {@link SlotPool#forEachAllocated(SlotVisitor)}.
 *
 * @param <T> The type of payload held by the slots of the pool.
 */
@FunctionalInterface
public interface SlotVisitor<T> {
  /**
   * Visit one allocated slot. The slot is locked for the duration of the call.
   * @param index The index of the slot.
   * @param payload The payload of the slot.
   */
  void visit(int index, T payload);
}
