/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;

/**
 * A non-reentrant, asynchronous mutex that serializes identity key generation. Waiters are granted the lock in the
 * order they asked for it; a waiter that is not granted the lock within the timeout fails with a
 * {@link RegenerationLockTimeoutException} and gives up its place in the queue.
 */
public class IdentityRegenerationLock {

  private final Duration timeout;

  private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
  private boolean locked = false;

  private static final String TIMEOUT_COUNTER_NAME = MetricsUtil.name(IdentityRegenerationLock.class, "timeout");

  private static final Logger logger = LoggerFactory.getLogger(IdentityRegenerationLock.class);

  public IdentityRegenerationLock(final Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * Runs the given task once the lock has been acquired and releases the lock when the task's future completes by any
   * means.
   *
   * @param task supplies the work to perform while holding the lock
   *
   * @return a future that yields the task's result, or fails with a {@link RegenerationLockTimeoutException} if the lock
   * could not be acquired in time
   */
  public <T> CompletableFuture<T> withLock(final Supplier<CompletableFuture<T>> task) {
    return acquire().thenCompose(ignored -> {
      final CompletableFuture<T> taskFuture;

      try {
        taskFuture = task.get();
      } catch (final RuntimeException e) {
        release();
        return CompletableFuture.failedFuture(e);
      }

      return taskFuture.whenComplete((result, throwable) -> release());
    });
  }

  public CompletableFuture<Void> acquire() {
    final CompletableFuture<Void> waiter;

    synchronized (this) {
      if (!locked) {
        locked = true;
        return CompletableFuture.completedFuture(null);
      }

      waiter = new CompletableFuture<>();
      waiters.addLast(waiter);
      logger.debug("Identity regeneration in progress; {} waiter(s) queued", waiters.size());
    }

    return waiter
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((ignored, throwable) -> {
          if (throwable != null) {
            synchronized (this) {
              waiters.remove(waiter);
            }
          }
        })
        .exceptionally(ExceptionUtils.marshal(TimeoutException.class, e -> {
          Metrics.counter(TIMEOUT_COUNTER_NAME).increment();
          logger.warn("Gave up waiting for identity regeneration after {}", timeout);
          return new RegenerationLockTimeoutException(timeout);
        }));
  }

  /**
   * Hands the lock to the longest-waiting live waiter, or unlocks if there is none.
   */
  public void release() {
    final CompletableFuture<Void> next;

    synchronized (this) {
      CompletableFuture<Void> candidate = waiters.pollFirst();

      // Skip waiters that timed out but have not yet left the queue
      while (candidate != null && candidate.isDone()) {
        candidate = waiters.pollFirst();
      }

      if (candidate == null) {
        locked = false;
        return;
      }

      next = candidate;
    }

    // Complete outside the monitor; the waiter's continuation runs on this thread
    if (!next.complete(null)) {
      // Timed out between the poll and now; pass the lock on
      release();
    }
  }

  public synchronized boolean isLocked() {
    return locked;
  }

  public synchronized int getQueueLength() {
    return waiters.size();
  }
}
