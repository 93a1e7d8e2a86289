/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.health;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observable, in-memory health of a single key store. Each store owns one instance; the key manager exposes them to
 * callers, who may {@link #subscribe(KeyHealthListener)} to be told about every change. Nothing here is persisted.
 */
public class KeyHealthState {

  private final Clock clock;
  private final List<KeyHealthListener> listeners = new CopyOnWriteArrayList<>();

  private volatile KeyHealthSnapshot snapshot;

  private static final Logger logger = LoggerFactory.getLogger(KeyHealthState.class);

  public KeyHealthState(final String store, final Clock clock) {
    this.clock = clock;
    this.snapshot = new KeyHealthSnapshot(store, KeyHealthStatus.UNINITIALIZED, 0, false, null, null, null);
  }

  public KeyHealthSnapshot snapshot() {
    return snapshot;
  }

  /**
   * Registers a listener for future changes.
   *
   * @return a handle that removes the listener when run
   */
  public Runnable subscribe(final KeyHealthListener listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public void updateCount(final int count, final KeyHealthStatus status) {
    final Instant now = clock.instant();
    update(current -> new KeyHealthSnapshot(current.store(), status, count, current.busy(), current.lastError(), now,
        current.lastGenerationTime()));
  }

  public void markBusy(final KeyHealthStatus status) {
    update(current -> new KeyHealthSnapshot(current.store(), status, current.count(), true, current.lastError(),
        current.lastCheckTime(), current.lastGenerationTime()));
  }

  public void markGenerationComplete(final int count, final KeyHealthStatus status) {
    final Instant now = clock.instant();
    update(current -> new KeyHealthSnapshot(current.store(), status, count, false, null, now, now));
  }

  /**
   * Records a successful check or publication: clears the busy flag and any previous error.
   */
  public void markSynced(final int count, final KeyHealthStatus status) {
    final Instant now = clock.instant();
    update(current -> new KeyHealthSnapshot(current.store(), status, count, false, null, now,
        current.lastGenerationTime()));
  }

  public void markError(final Throwable throwable) {
    markError(throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
  }

  public void markError(final String message) {
    update(current -> new KeyHealthSnapshot(current.store(), KeyHealthStatus.ERROR, current.count(), false, message,
        current.lastCheckTime(), current.lastGenerationTime()));
  }

  public void reset() {
    update(current -> new KeyHealthSnapshot(current.store(), KeyHealthStatus.UNINITIALIZED, 0, false, null, null,
        null));
  }

  private void update(final UnaryOperator<KeyHealthSnapshot> mutation) {
    final KeyHealthSnapshot updated;

    synchronized (this) {
      updated = mutation.apply(snapshot);
      snapshot = updated;
    }

    for (final KeyHealthListener listener : listeners) {
      try {
        listener.onHealthChanged(updated);
      } catch (final RuntimeException e) {
        logger.warn("Health listener for {} failed", updated.store(), e);
      }
    }
  }
}
