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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The instant before which no caller of a dispatcher should send another
 * request, because the server told us to back off.
 */
final class BackoffWindow {
  private static final Logger log = LoggerFactory.getLogger(BackoffWindow.class);

  private final InstantSource clock;
  private final ReentrantLock lock = new ReentrantLock();
  // Guarded by lock.
  private Instant deadline;

  BackoffWindow(InstantSource clock) {
    this.clock = clock;
    this.deadline = clock.instant();
  }

  /**
   * How long callers must still wait; zero once the window has passed.
   */
  Duration remaining() {
    lock.lock();
    try {
      var remaining = Duration.between(clock.instant(), deadline);
      return remaining.isNegative() ? Duration.ZERO : remaining;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Close the window until {@code retryAfter} from now.
   * <p>
   * The new deadline replaces the old one even if it is earlier, so a short
   * retry interval can cut an active window short.
   * </p>
   *
   * @return the new deadline
   */
  Instant backOff(Duration retryAfter) {
    lock.lock();
    try {
      var previous = deadline;
      var next = clock.instant().plus(retryAfter);
      if (next.isBefore(previous)) {
        log.warn("Rate limit window shortened from {} to {}", previous, next);
      }
      deadline = next;
      return next;
    } finally {
      lock.unlock();
    }
  }

  Instant deadline() {
    lock.lock();
    try {
      return deadline;
    } finally {
      lock.unlock();
    }
  }
}
