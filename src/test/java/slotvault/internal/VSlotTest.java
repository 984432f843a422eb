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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VSlotTest {

  @Test
  void toStringForVSlot() {
    VSlot<String> slot = new VSlot<>(3, "poke");
    assertThat(slot.toString()).isEqualTo("VSlot[3, FREE]");
    slot.lock();
    assertThat(slot.toString()).isEqualTo("VSlot[3, FREE, LOCKED]");
    slot.markOccupied();
    assertThat(slot.toString()).isEqualTo("VSlot[3, OCCUPIED, LOCKED]");
    slot.unlock();
    assertThat(slot.toString()).isEqualTo("VSlot[3, OCCUPIED]");
  }

  @Test
  void clearOccupiedReportsPreviousState() {
    VSlot<String> slot = new VSlot<>(0, null);
    slot.lock();
    try {
      assertFalse(slot.clearOccupied());
      slot.markOccupied();
      assertTrue(slot.isOccupied());
      assertTrue(slot.clearOccupied());
      assertFalse(slot.isOccupied());
    } finally {
      slot.unlock();
    }
  }

  @Test
  void lockingTwiceFromSameThreadMustThrow() {
    VSlot<String> slot = new VSlot<>(1, null);
    slot.lock();
    try {
      IllegalStateException e = assertThrows(IllegalStateException.class, slot::lock);
      assertThat(e).hasMessageContaining("Slot 1");
      assertTrue(slot.isHeldByCurrentThread());
    } finally {
      slot.unlock();
    }
    assertFalse(slot.isHeldByCurrentThread());
  }

  @Test
  void handleMustUnlockSlotExactlyOnce() {
    VSlot<String> slot = new VSlot<>(2, "payload");
    slot.lock();
    VSlotHandle<String> handle = new VSlotHandle<>(slot);
    assertThat(handle.get()).isEqualTo("payload");
    handle.set("changed");
    handle.close();
    handle.close();
    assertFalse(slot.isHeldByCurrentThread());
    assertThat(slot.payload).isEqualTo("changed");
  }
}
