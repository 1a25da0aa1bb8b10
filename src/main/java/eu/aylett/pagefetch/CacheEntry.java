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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Objects;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * A successfully loaded value held by a {@link ResponseCache}, along with the
 * instant after which it must no longer be served.
 */
final class CacheEntry<K, V> implements Delayed {
  final K key;
  final V value;
  private final InstantSource clock;
  private final Instant expiry;

  CacheEntry(K key, V value, Duration ttl, InstantSource clock) {
    this.key = key;
    this.value = value;
    this.clock = clock;
    this.expiry = clock.instant().plus(ttl);
  }

  boolean isExpired() {
    return !clock.instant().isBefore(expiry);
  }

  Instant expiry() {
    return expiry;
  }

  @Override
  public long getDelay(TimeUnit unit) {
    return clock.instant().until(expiry, unit.toChronoUnit());
  }

  @Override
  public int compareTo(Delayed o) {
    if (o instanceof CacheEntry<?, ?> other) {
      return expiry.compareTo(other.expiry);
    }
    return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof CacheEntry<?, ?> that) {
      return key.equals(that.key) && value.equals(that.value) && expiry.equals(that.expiry);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value, expiry);
  }
}
