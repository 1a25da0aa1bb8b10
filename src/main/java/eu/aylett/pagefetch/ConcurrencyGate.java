/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.pagefetch;

import org.jspecify.annotations.Nullable;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Limits how many requests may be outstanding at once. A capacity of zero
 * means there is no limit.
 * <p>
 * Permits are {@link AutoCloseable} and should be taken in a
 * try-with-resources block.
 * </p>
 */
final class ConcurrencyGate {
  private final int capacity;
  private final @Nullable Semaphore permits;
  private final AtomicInteger inUse = new AtomicInteger();

  ConcurrencyGate(int capacity) {
    checkArgument(capacity >= 0, "capacity cannot be negative, was %s", capacity);
    this.capacity = capacity;
    this.permits = capacity > 0 ? new Semaphore(capacity, true) : null;
  }

  /**
   * Block until a permit is available.
   *
   * @throws java.util.concurrent.CancellationException
   *           if the signal is cancelled first, in which case no permit is held.
   */
  Permit acquire(CancellationSignal signal) throws InterruptedException {
    var semaphore = permits;
    if (semaphore != null) {
      signal.interruptibly(() -> {
        semaphore.acquire();
        return null;
      });
    }
    inUse.incrementAndGet();
    return new Permit(semaphore);
  }

  int capacity() {
    return capacity;
  }

  int inUse() {
    return inUse.get();
  }

  final class Permit implements AutoCloseable {
    private final @Nullable Semaphore semaphore;
    private final AtomicBoolean released = new AtomicBoolean();

    private Permit(@Nullable Semaphore semaphore) {
      this.semaphore = semaphore;
    }

    /**
     * Give the permit back. Only the first call has any effect.
     */
    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        inUse.decrementAndGet();
        if (semaphore != null) {
          semaphore.release();
        }
      }
    }
  }
}
