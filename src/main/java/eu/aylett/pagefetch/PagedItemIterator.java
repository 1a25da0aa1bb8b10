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

import com.google.common.collect.AbstractIterator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * The items of a paginated collection, in order, fetching each page while the
 * one before it is consumed.
 * <p>
 * Single pass and not thread-safe. Once a page fails to load, or the signal is
 * cancelled, the iterator throws and stays failed. Close it to stop an
 * unfinished traversal early; that cancels any fetch still running for it.
 * </p>
 */
public final class PagedItemIterator<T> extends AbstractIterator<T> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PagedItemIterator.class);

  enum State {
    FETCHING_FIRST, YIELDING_WITH_LOOKAHEAD, EXHAUSTED,
  }

  /**
   * Loads the page that starts at {@code cursor}, or the first page if it is
   * null.
   */
  @FunctionalInterface
  interface PageLoader<T> {
    Page<T> load(@Nullable String cursor, CancellationSignal signal) throws IOException, InterruptedException;
  }

  private final PageLoader<T> loader;
  private final Executor executor;
  private final CancellationSignal signal;

  private State state = State.FETCHING_FIRST;
  private Iterator<T> items = Collections.emptyIterator();
  private @Nullable CompletableFuture<Page<T>> lookahead;

  /**
   * @param signal
   *          owned by this iterator; cancelled when it is closed, and detached
   *          from its parent once the traversal is over
   */
  PagedItemIterator(PageLoader<T> loader, Executor executor, CancellationSignal signal) {
    this.loader = loader;
    this.executor = executor;
    this.signal = signal;
  }

  @Override
  protected T computeNext() {
    try {
      return advance();
    } catch (RuntimeException | Error e) {
      close();
      throw e;
    }
  }

  private T advance() {
    if (state == State.FETCHING_FIRST) {
      signal.throwIfCancelled();
      startPage(load(null));
    }
    while (state == State.YIELDING_WITH_LOOKAHEAD) {
      signal.throwIfCancelled();
      if (items.hasNext()) {
        return items.next();
      }
      var next = lookahead;
      if (next == null) {
        state = State.EXHAUSTED;
        signal.detach();
      } else {
        lookahead = null;
        startPage(await(next));
      }
    }
    return endOfData();
  }

  private void startPage(Page<T> page) {
    state = State.YIELDING_WITH_LOOKAHEAD;
    items = page.items().iterator();
    if (page.hasNext()) {
      signal.throwIfCancelled();
      var cursor = page.nextCursor();
      log.debug("Fetching the page after cursor {} ahead of time", cursor);
      lookahead = CompletableFuture.supplyAsync(() -> load(cursor), executor);
    }
  }

  private Page<T> load(@Nullable String cursor) {
    try {
      return loader.load(cursor, signal);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw interrupted(e);
    }
  }

  private Page<T> await(CompletableFuture<Page<T>> next) {
    try {
      return signal.await(next);
    } catch (ExecutionException e) {
      var cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new CompletionException(cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw interrupted(e);
    }
  }

  private static CancellationException interrupted(InterruptedException e) {
    var cancellation = new CancellationException("Interrupted while fetching pages");
    cancellation.initCause(e);
    return cancellation;
  }

  State state() {
    return state;
  }

  /**
   * Stop the traversal, cancelling any page fetch still in flight. Idempotent.
   */
  @Override
  public void close() {
    state = State.EXHAUSTED;
    signal.cancel();
    signal.detach();
    lookahead = null;
  }
}
