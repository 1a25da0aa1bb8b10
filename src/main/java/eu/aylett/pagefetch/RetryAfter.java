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

/**
 * Reads the delay a rate-limited response asks us to wait.
 */
final class RetryAfter {
  private static final Logger log = LoggerFactory.getLogger(RetryAfter.class);
  static final String HEADER = "Retry-After";
  // Lower bound on every backoff, including an explicit zero.
  static final Duration MINIMUM = Duration.ofSeconds(1);

  private RetryAfter() {
  }

  /**
   * The {@code Retry-After} header as delta-seconds, or {@code fallback} if the
   * header is missing or is not a non-negative integer. Never less than
   * {@link #MINIMUM}.
   */
  static Duration from(ApiResponse response, Duration fallback) {
    var delay = parse(response, fallback);
    return delay.compareTo(MINIMUM) < 0 ? MINIMUM : delay;
  }

  private static Duration parse(ApiResponse response, Duration fallback) {
    var header = response.headers().firstValue(HEADER);
    if (header.isEmpty()) {
      return fallback;
    }
    try {
      var seconds = Long.parseLong(header.get().trim());
      if (seconds >= 0) {
        return Duration.ofSeconds(seconds);
      }
    } catch (NumberFormatException e) {
      log.debug("Ignoring unparseable {} header '{}'", HEADER, header.get());
      return fallback;
    }
    log.debug("Ignoring negative {} header '{}'", HEADER, header.get());
    return fallback;
  }
}
