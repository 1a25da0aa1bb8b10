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

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * A cooperative request to stop work.
 * <p>
 * Every blocking step of a fetch goes through {@link #interruptibly}, so that
 * calling {@link #cancel()} wakes threads that are waiting for a permit, for a
 * rate limit window to pass, for a network response or for another caller's
 * result. They see a {@link CancellationException}, never a generic failure.
 * </p>
 * <p>
 * A signal is not reentrant: a thread should not block inside the same signal
 * twice at once.
 * </p>
 */
public final class CancellationSignal {
  private final @Nullable CancellationSignal parent;
  private final CompletableFuture<@Nullable Void> cancelled = new CompletableFuture<>();
  private final Set<CancellationSignal> children = ConcurrentHashMap.newKeySet();
  // Both guarded by blocked.
  private final Set<Thread> blocked = new HashSet<>();
  private final Set<Thread> interruptedByCancel = new HashSet<>();

  private CancellationSignal(@Nullable CancellationSignal parent) {
    this.parent = parent;
  }

  /**
   * A fresh signal that nothing else holds, so will only be cancelled by the
   * caller.
   */
  public static CancellationSignal none() {
    return new CancellationSignal(null);
  }

  /**
   * Request cancellation. Idempotent; threads currently blocked inside this
   * signal are interrupted, and every attached child is cancelled too.
   */
  public void cancel() {
    if (cancelled.complete(null)) {
      synchronized (blocked) {
        for (var thread : blocked) {
          // An interrupt that is already pending came from someone else.
          if (!thread.isInterrupted()) {
            thread.interrupt();
            interruptedByCancel.add(thread);
          }
        }
      }
      children.forEach(CancellationSignal::cancel);
    }
  }

  /**
   * Whether {@link #cancel()} has been called on this signal or on one of the
   * parents it is still attached to.
   */
  public boolean isCancelled() {
    return cancelled.isDone();
  }

  /**
   * @throws CancellationException
   *           if {@link #cancel()} has been called.
   */
  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException("Operation was cancelled");
    }
  }

  /**
   * A signal that is cancelled whenever this one is, but which may also be
   * cancelled on its own without affecting this one.
   * <p>
   * This signal holds on to the child until the child is {@link #detach()
   * detached}, so short-lived children of a long-lived signal should be
   * detached once their work is over.
   * </p>
   */
  public CancellationSignal newChild() {
    var child = new CancellationSignal(this);
    children.add(child);
    // cancel() may have run between construction and registration.
    if (isCancelled()) {
      child.cancel();
    }
    return child;
  }

  /**
   * Stop following this signal's parent, if it has one. Cancelling the parent
   * afterwards no longer cancels this signal. Idempotent.
   */
  public void detach() {
    if (parent != null) {
      parent.children.remove(this);
    }
  }

  int childCount() {
    return children.size();
  }

  /**
   * Sleep for the given duration, returning early by throwing if cancelled.
   */
  public void sleep(Duration duration) throws InterruptedException {
    interruptibly(() -> {
      TimeUnit.NANOSECONDS.sleep(duration.toNanos());
      return null;
    });
  }

  /**
   * Wait for a future to complete, or for this signal to be cancelled.
   */
  public <T> T await(Future<T> future) throws InterruptedException, ExecutionException {
    return interruptibly(future::get);
  }

  /**
   * Run a blocking call such that cancelling this signal interrupts it.
   *
   * @throws CancellationException
   *           if the signal is cancelled before or during the call.
   * @throws InterruptedException
   *           if the thread is interrupted for any other reason.
   */
  public <T, E extends Exception> T interruptibly(Blocking<T, E> call) throws InterruptedException, E {
    var thread = Thread.currentThread();
    synchronized (blocked) {
      throwIfCancelled();
      blocked.add(thread);
    }
    try {
      return call.call();
    } catch (InterruptedException e) {
      if (isCancelled()) {
        var cancellation = new CancellationException("Operation was cancelled while waiting");
        cancellation.initCause(e);
        throw cancellation;
      }
      throw e;
    } finally {
      synchronized (blocked) {
        blocked.remove(thread);
        if (interruptedByCancel.remove(thread)) {
          // Our own interrupt may still be pending if the call returned before
          // noticing it; the caller learns about it via isCancelled instead.
          var ignored = Thread.interrupted();
        }
      }
    }
  }

  /**
   * A call that may block, and may be unblocked by interruption.
   */
  @FunctionalInterface
  public interface Blocking<T, E extends Exception> {
    T call() throws InterruptedException, E;
  }
}
