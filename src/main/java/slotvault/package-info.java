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
/**
 * SlotVault is a fixed-capacity, thread-safe pool of lockable slots.
 * <p>
 * A pool implements the {@link slotvault.SlotPool} interface, and is built
 * from a {@link slotvault.PayloadAllocator} that creates the payload of every
 * slot up front. Slots are then allocated, viewed and released concurrently,
 * with exclusive access to a payload given through a
 * {@link slotvault.SlotHandle}.
 */
package slotvault;
