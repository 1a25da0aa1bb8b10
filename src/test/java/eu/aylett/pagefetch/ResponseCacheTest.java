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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResponseCacheTest {
  private static final Duration TTL = Duration.ofMinutes(60);

  @Test
  void returnsCachedValueWithoutCallingFactory() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var calls = new AtomicInteger();

    var first = cache.getOrAdd("key", () -> "value" + calls.incrementAndGet(), TTL, CancellationSignal.none());
    var second = cache.getOrAdd("key", () -> "value" + calls.incrementAndGet(), TTL, CancellationSignal.none());

    assertThat(first, equalTo("value1"));
    assertThat(second, equalTo("value1"));
    assertThat(calls.get(), equalTo(1));
  }

  @Test
  void keysAreIndependent() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    assertThat(cache.getOrAdd("a", () -> "1", TTL, CancellationSignal.none()), equalTo("1"));
    assertThat(cache.getOrAdd("b", () -> "2", TTL, CancellationSignal.none()), equalTo("2"));
    assertThat(cache.size(), equalTo(2));
  }

  @Test
  void reloadsAfterTtl() throws Exception {
    var clock = mock(InstantSource.class);
    var instantAnswer = new CacheEntryTest.InstantAnswer();
    when(clock.instant()).thenAnswer(instantAnswer);
    var cache = new ResponseCache<String, String>(clock);
    var calls = new AtomicInteger();

    assertThat(cache.getOrAdd("key", () -> "v" + calls.incrementAndGet(), TTL, CancellationSignal.none()),
        equalTo("v1"));
    instantAnswer.plusSeconds(3599);
    assertThat(cache.getOrAdd("key", () -> "v" + calls.incrementAndGet(), TTL, CancellationSignal.none()),
        equalTo("v1"));
    instantAnswer.plusSeconds(1);
    assertThat(cache.getOrAdd("key", () -> "v" + calls.incrementAndGet(), TTL, CancellationSignal.none()),
        equalTo("v2"));
    assertThat(calls.get(), equalTo(2));
  }

  @Test
  void expiredEntriesAreEvicted() throws Exception {
    var clock = mock(InstantSource.class);
    var instantAnswer = new CacheEntryTest.InstantAnswer();
    when(clock.instant()).thenAnswer(instantAnswer);
    var cache = new ResponseCache<String, String>(clock);

    cache.getOrAdd("a", () -> "1", Duration.ofSeconds(10), CancellationSignal.none());
    cache.getOrAdd("b", () -> "2", TTL, CancellationSignal.none());
    assertThat(cache.size(), equalTo(2));

    instantAnswer.plusSeconds(10);
    cache.getOrAdd("c", () -> "3", TTL, CancellationSignal.none());
    // "a" was swept without being asked for again
    assertThat(cache.size(), equalTo(2));
  }

  @Test
  void failuresAreNotCached() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var failure = new IOException("boom");

    var thrown = assertThrows(IOException.class, () -> cache.getOrAdd("key", () -> {
      throw failure;
    }, TTL, CancellationSignal.none()));
    assertThat(thrown, sameInstance(failure));
    assertThat(cache.size(), equalTo(0));

    assertThat(cache.getOrAdd("key", () -> "recovered", TTL, CancellationSignal.none()), equalTo("recovered"));
  }

  @Test
  void concurrentCallersShareOneLoad() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var calls = new AtomicInteger();
    var loading = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(8);
    try {
      var futures = new ArrayList<Future<String>>();
      futures.add(executor.submit(() -> cache.getOrAdd("key", () -> {
        calls.incrementAndGet();
        loading.countDown();
        release.await();
        return "shared";
      }, TTL, CancellationSignal.none())));
      loading.await();
      for (var i = 0; i < 7; i++) {
        futures.add(executor.submit(() -> cache.getOrAdd("key", () -> {
          calls.incrementAndGet();
          return "duplicate";
        }, TTL, CancellationSignal.none())));
      }
      release.countDown();

      for (var future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS), equalTo("shared"));
      }
      assertThat(calls.get(), equalTo(1));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void waitersSeeTheOwnersFailure() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var loading = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var waiterCalls = new AtomicInteger();
    var executor = Executors.newFixedThreadPool(2);
    try {
      var owner = executor.submit(() -> cache.getOrAdd("key", () -> {
        loading.countDown();
        release.await();
        throw new IllegalStateException("owner failed");
      }, TTL, CancellationSignal.none()));
      loading.await();
      var waiter = executor.submit(() -> cache.getOrAdd("key", () -> {
        waiterCalls.incrementAndGet();
        return "unexpected";
      }, TTL, CancellationSignal.none()));
      // Give the waiter time to start waiting on the owner's load.
      Thread.sleep(100);
      release.countDown();

      var ownerFailure = assertThrows(ExecutionException.class, () -> owner.get(10, TimeUnit.SECONDS));
      assertThat(ownerFailure.getCause(), instanceOf(IllegalStateException.class));
      var waiterFailure = assertThrows(ExecutionException.class, () -> waiter.get(10, TimeUnit.SECONDS));
      assertThat(waiterFailure.getCause(), sameInstance(ownerFailure.getCause()));
      assertThat(waiterCalls.get(), equalTo(0));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void waiterRetriesWhenOwnerIsCancelled() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var ownerSignal = CancellationSignal.none();
    var loading = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(2);
    try {
      var owner = executor.submit(() -> cache.getOrAdd("key", () -> {
        loading.countDown();
        ownerSignal.sleep(Duration.ofMinutes(1));
        return "never";
      }, TTL, ownerSignal));
      loading.await();
      var waiter = executor.submit(() -> cache.getOrAdd("key", () -> "fresh", TTL, CancellationSignal.none()));
      Thread.sleep(100);
      ownerSignal.cancel();

      var ownerFailure = assertThrows(ExecutionException.class, () -> owner.get(10, TimeUnit.SECONDS));
      assertThat(ownerFailure.getCause(), instanceOf(CancellationException.class));
      assertThat(waiter.get(10, TimeUnit.SECONDS), equalTo("fresh"));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void cancelledWaiterStopsWaiting() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var loading = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var waiterSignal = CancellationSignal.none();
    var executor = Executors.newFixedThreadPool(2);
    try {
      var owner = executor.submit(() -> cache.getOrAdd("key", () -> {
        loading.countDown();
        release.await();
        return "value";
      }, TTL, CancellationSignal.none()));
      loading.await();
      var waiter = executor.submit(() -> cache.getOrAdd("key", () -> "unexpected", TTL, waiterSignal));
      Thread.sleep(100);
      waiterSignal.cancel();

      var waiterFailure = assertThrows(ExecutionException.class, () -> waiter.get(10, TimeUnit.SECONDS));
      assertThat(waiterFailure.getCause(), instanceOf(CancellationException.class));

      release.countDown();
      assertThat(owner.get(10, TimeUnit.SECONDS), equalTo("value"));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void invalidateAllForgetsCompletedEntries() throws Exception {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    var calls = new AtomicInteger();
    cache.getOrAdd("key", () -> "v" + calls.incrementAndGet(), TTL, CancellationSignal.none());
    cache.invalidateAll();
    assertThat(cache.size(), is(0));
    assertThat(cache.getOrAdd("key", () -> "v" + calls.incrementAndGet(), TTL, CancellationSignal.none()),
        equalTo("v2"));
  }

  @Test
  void rejectsNonPositiveTtl() {
    var cache = new ResponseCache<String, String>(Clock.systemUTC());
    assertThrows(IllegalArgumentException.class,
        () -> cache.getOrAdd("key", () -> "v", Duration.ZERO, CancellationSignal.none()));
  }
}
