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

import static java.util.Objects.requireNonNull;

/**
 * An abstract wrapper for {@link PayloadAllocator} instances, that adds a
 * logging callback when payload allocation fails.
 * <p>
 * The pools themselves never log. Subclass this to route allocation failures
 * to the logging framework of your choice, and pass the subclass to
 * {@link SlotPool#from(PayloadAllocator)}.
 *
 * @param <T> The type of payload being allocated.
 */
public abstract class LoggingPayloadAllocator<T> implements PayloadAllocator<T> {
  /**
   * Indicates an exception was thrown by {@link PayloadAllocator#allocate(int)}.
   */
  public static final String ALLOCATION_FAILED = "Payload allocation failed";

  private final PayloadAllocator<T> allocator;

  /**
   * Constructs a LoggingPayloadAllocator by wrapping the provided allocator.
   * @param allocator The allocator to wrap. It must not be {@code null}.
   */
  protected LoggingPayloadAllocator(PayloadAllocator<T> allocator) {
    this.allocator = requireNonNull(allocator, "The PayloadAllocator cannot be null.");
  }

  @Override
  public T allocate(int index) throws Exception {
    try {
      return allocator.allocate(index);
    } catch (Exception e) {
      logMessage(ALLOCATION_FAILED + " for slot " + index, e);
      throw e;
    }
  }

  /**
   * Logs a message and an associated throwable.
   * The message always starts with one of the string constants defined on the
   * {@link LoggingPayloadAllocator} class.
   * <p>
   * Subclasses must implement this method and delegate to their preferred
   * logging framework.
   *
   * @param message   The log message to record, never {@code null}.
   * @param throwable The throwable associated with the log message, never
   *                  {@code null}.
   */
  protected abstract void logMessage(String message, Throwable throwable);
}
