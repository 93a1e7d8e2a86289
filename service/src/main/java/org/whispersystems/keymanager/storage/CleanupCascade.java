/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import io.micrometer.core.instrument.Metrics;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;

/**
 * Purges all key material that depends on the identity key, locally and then on the key server, before a regenerated
 * identity key is published.
 * <p>
 * Steps run strictly in order: every local category, then the remote wipe, then the identity upload. Each cleanup step
 * is best-effort; its failure is logged and counted and the next step runs regardless. The upload's outcome is the
 * outcome of the whole cascade.
 */
public class CleanupCascade {

  private final List<LocalKeyMaterial> localKeyMaterial;
  private final KeyServerClient keyServerClient;

  private final List<Consumer<CleanupCascadeState>> listeners = new CopyOnWriteArrayList<>();
  private volatile CleanupCascadeState state = CleanupCascadeState.IDLE;

  private static final String STEP_FAILED_COUNTER_NAME = MetricsUtil.name(CleanupCascade.class, "stepFailed");

  private static final Logger logger = LoggerFactory.getLogger(CleanupCascade.class);

  /**
   * @param localKeyMaterial local categories to purge, in the order they should be purged
   * @param keyServerClient the client used to wipe remote key material
   */
  public CleanupCascade(final List<LocalKeyMaterial> localKeyMaterial, final KeyServerClient keyServerClient) {
    this.localKeyMaterial = List.copyOf(localKeyMaterial);
    this.keyServerClient = keyServerClient;
  }

  /**
   * Runs the cascade and then publishes the new identity.
   *
   * @param publishIdentity uploads the regenerated identity key; only invoked once every cleanup step was attempted
   *
   * @return a future that completes when the identity has been published, or fails if publication failed
   */
  public CompletableFuture<Void> execute(final Supplier<CompletableFuture<Void>> publishIdentity) {
    transitionTo(CleanupCascadeState.CLEANING_LOCAL);

    CompletableFuture<Void> cascade = CompletableFuture.completedFuture(null);

    for (final LocalKeyMaterial material : localKeyMaterial) {
      cascade = cascade.thenCompose(ignored -> bestEffort("delete local " + material.description(),
          material::deleteAllLocal));
    }

    return cascade
        .thenCompose(ignored -> {
          transitionTo(CleanupCascadeState.CLEANING_REMOTE);
          return bestEffort("delete server keys", keyServerClient::deleteAllKeys);
        })
        .thenCompose(ignored -> {
          transitionTo(CleanupCascadeState.UPLOADING);
          return publishIdentity.get();
        })
        .whenComplete((ignored, throwable) -> {
          if (throwable == null) {
            logger.info("Cleanup cascade complete; existing sessions must be re-established");
          }

          transitionTo(CleanupCascadeState.IDLE);
        });
  }

  public CleanupCascadeState getState() {
    return state;
  }

  /**
   * @return a handle that removes the listener when run
   */
  public Runnable subscribe(final Consumer<CleanupCascadeState> listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  private CompletableFuture<Void> bestEffort(final String step, final Supplier<CompletableFuture<Void>> action) {
    logger.info("Cleanup cascade: {}", step);

    CompletableFuture<Void> stepFuture;

    try {
      stepFuture = action.get();
    } catch (final RuntimeException e) {
      stepFuture = CompletableFuture.failedFuture(e);
    }

    return stepFuture.exceptionally(throwable -> {
      logger.warn("Cleanup cascade step \"{}\" failed; continuing", step, ExceptionUtils.unwrap(throwable));
      Metrics.counter(STEP_FAILED_COUNTER_NAME, "step", step).increment();
      return null;
    });
  }

  private void transitionTo(final CleanupCascadeState newState) {
    state = newState;
    listeners.forEach(listener -> listener.accept(newState));
  }
}
