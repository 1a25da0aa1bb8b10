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

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.InstantSource;
import java.util.concurrent.CancellationException;

/**
 * Sends GET requests to a service that rate limits its clients.
 * <p>
 * At most {@link DispatcherSettings#maxConcurrentRequests()} requests are in
 * flight at once. When the service answers 429, every caller of this
 * dispatcher waits out the server's retry interval before sending anything
 * else, and the rate-limited request is retried without giving up its permit.
 * Other failures are not retried.
 * </p>
 * <p>
 * Successful responses are cached by URL, so repeating a request within the
 * cache TTL doesn't touch the network, even while the service is rate limiting
 * us. Concurrent requests for the same URL share a single call.
 * </p>
 */
public class RateLimitedDispatcher {
  private static final Logger log = LoggerFactory.getLogger(RateLimitedDispatcher.class);

  private final Transport transport;
  private final ResponseCache<String, ApiResponse> cache;
  private final DispatcherSettings settings;
  private final ConcurrencyGate gate;
  private final BackoffWindow backoff;

  /**
   * A fully configurable dispatcher.
   *
   * @param transport
   *          sends the requests that miss the cache
   * @param cache
   *          where successful responses are kept, keyed by URL
   * @param settings
   *          concurrency limit, cache TTL and default backoff
   * @param clock
   *          the time source for the backoff window (mainly for testing)
   */
  public RateLimitedDispatcher(Transport transport, ResponseCache<String, ApiResponse> cache,
      DispatcherSettings settings, InstantSource clock) {
    this.transport = transport;
    this.cache = cache;
    this.settings = settings;
    this.gate = new ConcurrencyGate(settings.maxConcurrentRequests());
    this.backoff = new BackoffWindow(clock);
  }

  /**
   * A dispatcher with its own cache and the default settings, apart from the
   * concurrency limit.
   *
   * @param maxConcurrentRequests
   *          how many requests may be in flight at once; zero for no limit
   */
  public RateLimitedDispatcher(Transport transport, int maxConcurrentRequests) {
    this(transport, new ResponseCache<>(Clock.systemUTC()),
        DispatcherSettings.defaults().withMaxConcurrentRequests(maxConcurrentRequests), Clock.systemUTC());
  }

  /**
   * Fetch {@code url}, from the cache if possible.
   *
   * @return a successful response
   * @throws HttpStatusException
   *           if the service answers with any failure status other than 429
   * @throws CancellationException
   *           if {@code signal} is cancelled before a response arrives
   */
  public ApiResponse get(String url, CancellationSignal signal) throws IOException, InterruptedException {
    try {
      return cache.getOrAdd(url, () -> send(url, signal), settings.cacheTtl(), signal);
    } catch (IOException | InterruptedException | RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Unexpected failure fetching " + url, e);
    }
  }

  private ApiResponse send(String url, CancellationSignal signal) throws IOException, InterruptedException {
    try (var ignored = gate.acquire(signal)) {
      while (true) {
        Duration wait;
        while (!(wait = backoff.remaining()).isZero()) {
          log.debug("Waiting {} for the rate limit window before GET {}", wait, url);
          signal.sleep(wait);
        }
        signal.throwIfCancelled();

        var response = signal.interruptibly(() -> transport.get(url));
        if (response.isRateLimited()) {
          var retryAfter = RetryAfter.from(response, settings.defaultRetryAfter());
          var until = backoff.backOff(retryAfter);
          log.warn("GET {} was rate limited, holding all requests for {} until {}", url, retryAfter, until);
          continue;
        }
        if (!response.isSuccess()) {
          throw new HttpStatusException(url, response.statusCode());
        }
        return response;
      }
    }
  }

  /**
   * How long new requests will be held back by the current rate limit window.
   */
  public Duration remainingBackoff() {
    return backoff.remaining();
  }

  /**
   * How many requests currently hold a concurrency permit.
   */
  public int requestsInFlight() {
    return gate.inUse();
  }

  /**
   * The settings this dispatcher was built with.
   */
  public DispatcherSettings settings() {
    return settings;
  }
}
