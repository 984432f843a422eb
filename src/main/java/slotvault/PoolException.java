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
 * The PoolException is the root of the exceptions thrown by a
 * {@link SlotPool} when an operation cannot be carried out:
 * <ul>
 *   <li>{@link PoolExhaustedException} if {@link SlotPool#allocate()} finds
 *   no free slot.</li>
 *   <li>{@link SlotNotAllocatedException} if {@link SlotPool#view(int)} is
 *   called for a slot that is not currently allocated.</li>
 *   <li>A plain PoolException if a {@link PayloadAllocator} fails while the
 *   pool is being built.</li>
 * </ul>
 * Indexes outside the capacity of the pool are reported with the standard
 * {@link IndexOutOfBoundsException} instead.
 *
 * @author Chris Vest
 */
public class PoolException extends RuntimeException {
  @Serial
  private static final long serialVersionUID = -1908093409167496640L;

  /**
   * Construct a new PoolException with the given message.
   * @param message A description of the exception to be returned from
   * {@link #getMessage()}.
   * @see RuntimeException#RuntimeException(String)
   */
  public PoolException(String message) {
    super(message);
  }

  /**
   * Construct a new PoolException with the given message and cause.
   * @param message A description for the exception to be returned form
   * {@link #getMessage()}.
   * @param cause The underlying cause of this exception, as to be shown in the
   * stack trace, and available through {@link #getCause()}.
   * @see RuntimeException#RuntimeException(String, Throwable)
   */
  public PoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
