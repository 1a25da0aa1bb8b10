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

import java.time.Clock;
import java.time.Duration;
import java.time.InstantSource;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutionException;

import static com.google.common.base.Preconditions.checkArgument;
import static eu.aylett.pagefetch.SneakyThrows.sneakyThrow;

/**
 * A thread-safe map from keys to values that expire, which only ever runs one
 * load per key at a time.
 * <p>
 * Callers that ask for a key while another caller is loading it wait for, and
 * share, that caller's result. Failures are not cached: everyone waiting sees
 * the failure, and the next request for the key tries again.
 * </p>
 */
public final class ResponseCache<K, V> {
  private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

  private final InstantSource clock;
  // Only successfully completed futures stay in the map: a failed load removes
  // its future before completing it.
  private final ConcurrentHashMap<K, CompletableFuture<CacheEntry<K, V>>> entries = new ConcurrentHashMap<>();
  private final DelayQueue<CacheEntry<K, V>> expiries = new DelayQueue<>();

  /**
   * @param clock
   *          the time source used to expire entries (mainly for testing)
   */
  public ResponseCache(InstantSource clock) {
    this.clock = clock;
  }

  /**
   * A cache whose entries expire by the system clock.
   */
  public ResponseCache() {
    this(Clock.systemUTC());
  }

  /**
   * Return the live value for {@code key}, loading it with {@code factory} if
   * there isn't one.
   *
   * @param ttl
   *          how long a freshly loaded value stays live, measured from when its
   *          load completes
   * @param signal
   *          cancels waiting for another caller's load, and is the signal
   *          {@code factory} is expected to honour
   * @throws CancellationException
   *           if {@code signal} is cancelled while waiting
   * @throws Exception
   *           whatever {@code factory} threw, whether it ran on this thread or
   *           another caller's.
   */
  public V getOrAdd(K key, Callable<V> factory, Duration ttl, CancellationSignal signal) throws Exception {
    checkArgument(ttl.compareTo(Duration.ZERO) > 0, "ttl must be positive, was %s", ttl);
    evictExpired();

    while (true) {
      signal.throwIfCancelled();
      var existing = entries.get(key);
      if (existing == null) {
        var pending = new CompletableFuture<CacheEntry<K, V>>();
        existing = entries.putIfAbsent(key, pending);
        if (existing == null) {
          return load(key, pending, factory, ttl);
        }
      }

      if (existing.isDone() && !existing.isCompletedExceptionally()) {
        var entry = existing.join();
        if (!entry.isExpired()) {
          return entry.value;
        }
        log.debug("Cached value for {} expired at {}", key, entry.expiry());
        entries.remove(key, existing);
        continue;
      }

      try {
        return signal.await(existing).value;
      } catch (CancellationException e) {
        if (signal.isCancelled()) {
          throw e;
        }
        // The caller that owned the load gave up; ours is still wanted.
        log.debug("Shared load of {} was cancelled by its owner, retrying", key);
      } catch (ExecutionException e) {
        throw sneakyThrow(e.getCause());
      }
    }
  }

  private V load(K key, CompletableFuture<CacheEntry<K, V>> pending, Callable<V> factory, Duration ttl)
      throws Exception {
    log.debug("Loading {}", key);
    try {
      var entry = new CacheEntry<>(key, factory.call(), ttl, clock);
      expiries.offer(entry);
      pending.complete(entry);
      return entry.value;
    } catch (Throwable t) {
      entries.remove(key, pending);
      pending.completeExceptionally(t);
      throw t;
    }
  }

  private void evictExpired() {
    CacheEntry<K, V> expired;
    while ((expired = expiries.poll()) != null) {
      var entry = expired;
      entries.computeIfPresent(entry.key, (key, future) -> holds(future, entry) ? null : future);
    }
  }

  private static <K, V> boolean holds(CompletableFuture<CacheEntry<K, V>> future, CacheEntry<K, V> entry) {
    return future.isDone() && !future.isCompletedExceptionally() && future.join() == entry;
  }

  /**
   * The number of keys currently loaded or loading, which may include expired
   * entries that have not yet been noticed.
   */
  public int size() {
    return entries.size();
  }

  /**
   * Forget every completed entry. Loads already in flight still deliver their
   * result to the callers waiting for them.
   */
  public void invalidateAll() {
    entries.values().removeIf(future -> future.isDone());
    expiries.clear();
  }
}
