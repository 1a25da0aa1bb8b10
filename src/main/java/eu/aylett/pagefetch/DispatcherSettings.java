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

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tuning for a {@link RateLimitedDispatcher}.
 *
 * @param maxConcurrentRequests
 *          how many requests may be in flight at once; zero for no limit
 * @param cacheTtl
 *          how long successful responses are served from the cache
 * @param defaultRetryAfter
 *          how long to back off when a 429 response doesn't say
 */
public record DispatcherSettings(int maxConcurrentRequests, Duration cacheTtl, Duration defaultRetryAfter) {
  public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(60);
  public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);

  /**
   * @throws IllegalArgumentException
   *           if the concurrency limit is negative, or either duration is not
   *           positive
   */
  public DispatcherSettings {
    checkArgument(maxConcurrentRequests >= 0, "maxConcurrentRequests cannot be negative");
    checkArgument(cacheTtl.compareTo(Duration.ZERO) > 0, "cacheTtl must be positive");
    checkArgument(defaultRetryAfter.compareTo(Duration.ZERO) > 0, "defaultRetryAfter must be positive");
  }

  /**
   * No concurrency limit, a one hour cache and a one minute default backoff.
   */
  public static DispatcherSettings defaults() {
    return new DispatcherSettings(0, DEFAULT_CACHE_TTL, DEFAULT_RETRY_AFTER);
  }

  /**
   * These settings with a different concurrency limit.
   */
  public DispatcherSettings withMaxConcurrentRequests(int maxConcurrentRequests) {
    return new DispatcherSettings(maxConcurrentRequests, cacheTtl, defaultRetryAfter);
  }
}
