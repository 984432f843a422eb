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

import javax.management.MXBean;

/**
 * This is the JMX management interface for slot pools.
 * <p>
 * Instances are obtained from {@link SlotPool#getManagedPool()}, and can be
 * registered with an {@link javax.management.MBeanServer}:
 * <pre>{@code
 * MBeanServer server = ManagementFactory.getPlatformMBeanServer();
 * ObjectName name = new ObjectName("com.myapp:slotpool=orders");
 * server.registerMBean(pool.getManagedPool(), name);
 * }</pre>
 * <p>
 * All the counters are monotonic, and are read without any locking, so
 * a reading is never a consistent snapshot of the pool as a whole.
 *
 * @author Chris Vest
 */
@MXBean
public interface ManagedSlotPool {
  /**
   * @return The fixed number of slots in the pool.
   */
  int getCapacity();

  /**
   * Count the slots that appear to be allocated, right now.
   * <p>
   * The count is taken without locking any slots, and may be off by the
   * number of allocations and releases running concurrently.
   *
   * @return The approximate number of allocated slots.
   */
  int getAllocatedCount();

  /**
   * @return The number of successful {@link SlotPool#allocate()} calls.
   */
  long getAllocationCount();

  /**
   * @return The number of {@link SlotPool#allocate()} calls that failed with
   * a {@link PoolExhaustedException}.
   */
  long getExhaustedCount();

  /**
   * @return The number of handles handed out by {@link SlotPool#view(int)}.
   */
  long getViewCount();

  /**
   * @return The number of slots freed by {@link SlotPool#release(int)}.
   */
  long getIndexReleaseCount();

  /**
   * @return The number of slots freed by
   * {@link SlotPool#release(java.util.function.Predicate)}.
   */
  long getPredicateReleaseCount();
}
