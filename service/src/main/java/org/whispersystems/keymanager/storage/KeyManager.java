/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.signal.libsignal.protocol.IdentityKey;
import org.signal.libsignal.protocol.state.PreKeyRecord;
import org.signal.libsignal.protocol.state.SessionRecord;
import org.signal.libsignal.protocol.state.SignedPreKeyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.KeyManagerConfiguration;
import org.whispersystems.keymanager.entities.KeyServerStatus;
import org.whispersystems.keymanager.events.KeyServerEventChannel;
import org.whispersystems.keymanager.health.KeyHealthListener;
import org.whispersystems.keymanager.health.KeyHealthSnapshot;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;

/**
 * Composes the identity, signed pre-key, pre-key and session stores for one key server and coordinates the work that
 * spans them: initialization, identity regeneration and reconciliation with the server.
 */
public class KeyManager implements AutoCloseable {

  private final IdentityKeyStore identityKeyStore;
  private final SignedPreKeyStore signedPreKeyStore;
  private final PreKeyStore preKeyStore;
  private final SessionStore sessionStore;
  private final CleanupCascade cleanupCascade;
  private final KeyServerClient keyServerClient;

  private final KeyHealthState identityHealth;
  private final KeyHealthState signedPreKeyHealth;
  private final KeyHealthState preKeyHealth;
  private final KeyHealthState sessionHealth;

  @Nullable
  private volatile Runnable eventSubscription;

  private static final String IDENTITY_MISMATCH_COUNTER_NAME = MetricsUtil.name(KeyManager.class, "identityMismatch");

  private static final Logger logger = LoggerFactory.getLogger(KeyManager.class);

  public KeyManager(final EncryptedKeyValueStore storage,
      final KeyServerClient keyServerClient,
      final Duration regenerationLockTimeout,
      final boolean senderKeysEnabled,
      final Clock clock) {

    this.keyServerClient = keyServerClient;

    this.identityHealth = new KeyHealthState("identity", clock);
    this.signedPreKeyHealth = new KeyHealthState("signedPreKeys", clock);
    this.preKeyHealth = new KeyHealthState("preKeys", clock);
    this.sessionHealth = new KeyHealthState("sessions", clock);

    this.identityKeyStore = new IdentityKeyStore(storage, keyServerClient,
        new IdentityRegenerationLock(regenerationLockTimeout), identityHealth);
    this.signedPreKeyStore = new SignedPreKeyStore(storage, keyServerClient, identityKeyStore, signedPreKeyHealth, clock);
    this.preKeyStore = new PreKeyStore(storage, keyServerClient, preKeyHealth);
    this.sessionStore = new SessionStore(storage, sessionHealth);

    // Deletion order matters: nothing signed by the old identity may outlive it
    final List<LocalKeyMaterial> dependentKeyMaterial =
        new ArrayList<>(List.of(preKeyStore, signedPreKeyStore, sessionStore));

    if (senderKeysEnabled) {
      dependentKeyMaterial.add(
          new StorageCollectionKeyMaterial(storage, StorageCollectionKeyMaterial.SENDER_KEY_COLLECTION));
    }

    this.cleanupCascade = new CleanupCascade(dependentKeyMaterial, keyServerClient);
  }

  public static KeyManager create(final KeyManagerConfiguration configuration,
      final EncryptedKeyValueStore storage,
      final Executor httpExecutor,
      final ScheduledExecutorService retryExecutor,
      final Clock clock) {

    return new KeyManager(storage,
        new KeyServerClient(configuration.getKeyServer(), httpExecutor, retryExecutor),
        configuration.getRegenerationLockTimeout(),
        configuration.isSenderKeysEnabled(),
        clock);
  }

  /**
   * Brings every store into a usable state, in dependency order: identity, signed pre-key (rotating it if due),
   * pre-keys (trimming an oversized pool, then refilling a low one) and finally the session count.
   *
   * @param eventChannel the real-time channel to watch for a missing signed pre-key, if connected
   */
  public CompletableFuture<Void> initialize(@Nullable final KeyServerEventChannel eventChannel) {
    logger.info("Initializing key stores");

    if (eventChannel != null && eventSubscription == null) {
      eventSubscription = signedPreKeyStore.subscribe(eventChannel);
    }

    return identityKeyStore.getIdentityKeyPair()
        .thenCompose(ignored -> signedPreKeyStore.getCurrentSignedPreKey())
        .thenCompose(ignored -> preKeyStore.trimExcessPreKeys())
        .thenCompose(ignored -> preKeyStore.ensureSufficientPreKeys())
        .thenCompose(ignored -> sessionStore.refreshCount())
        .whenComplete((ignored, throwable) -> {
          if (throwable != null) {
            logger.error("Key store initialization failed", ExceptionUtils.unwrap(throwable));
          } else {
            logger.info("Key stores initialized");
          }
        });
  }

  /**
   * Replaces the identity key pair. Every key and session that depends on the old identity is deleted locally and on
   * the server before the new identity is published; a fresh signed pre-key and pre-key pool are generated afterwards.
   * <p>
   * This is destructive: peers will see a changed identity and all sessions must be re-established.
   */
  public CompletableFuture<LocalIdentity> regenerateIdentityKeyPair() {
    return identityKeyStore.regenerateIdentityKeyPair(cleanupCascade)
        .thenCompose(identity -> signedPreKeyStore.getCurrentSignedPreKey()
            .thenCompose(ignored -> preKeyStore.ensureSufficientPreKeys())
            .thenApply(ignored -> identity));
  }

  /**
   * Publishes the identity, the newest signed pre-key and every pre-key, generating the latter two if there are none.
   */
  public CompletableFuture<Void> uploadAllKeysToServer() {
    logger.info("Publishing all keys");

    return identityKeyStore.publishIdentity()
        .thenCompose(ignored -> signedPreKeyStore.publishCurrent())
        .thenCompose(ignored -> regenerateIfAllPreKeysCorrupted(preKeyStore.publishAll(), 0))
        .thenCompose(published -> published == 0
            ? preKeyStore.ensureSufficientPreKeys().thenAccept(ignored -> {})
            : CompletableFuture.completedFuture(null));
  }

  public CompletableFuture<KeyServerStatus> fetchServerStatus() {
    return keyServerClient.getStatus();
  }

  /**
   * Compares the server's view of this device's keys with local state and repairs what differs.
   * <p>
   * An identity key on the server that differs from the local one is a protocol violation: it is recorded in the
   * identity health state and reported in the result, then resolved by publishing the local keys again. A missing
   * identity is resolved the same way. Otherwise pre-keys are checked: when the server reports fingerprints, keys that
   * differ are published again and keys only the server holds are deleted from it; without fingerprints a server pool
   * below the minimum is topped up from local keys. If every local pre-key turns out to be unreadable the pool is
   * regenerated. Finally the advertised signed pre-key is validated.
   */
  public CompletableFuture<KeySyncResult> validateAndSyncKeys(final KeyServerStatus status) {
    return identityKeyStore.getIdentityKeyPair().thenCompose(identity -> {
      final boolean identityMissing = !status.identity() || status.identityPublicKey() == null;
      final boolean identityMismatch = !identityMissing
          && !matches(identity.identityKey(), status.identityPublicKey());

      if (identityMismatch) {
        final IdentityKeyMismatchException mismatch =
            new IdentityKeyMismatchException(identity.encodedPublicKey(), status.identityPublicKey());

        logger.error("Server advertises a different identity key; republishing local keys", mismatch);
        Metrics.counter(IDENTITY_MISMATCH_COUNTER_NAME).increment();
        identityHealth.markError(mismatch);
      }

      if (identityMissing || identityMismatch) {
        if (identityMissing) {
          logger.warn("Server holds no identity key for this device; republishing local keys");
        }

        return uploadAllKeysToServer()
            .thenApply(ignored -> new KeySyncResult(identityMismatch, true, 0, 0, 0, true));
      }

      final PreKeyFingerprintCheck unchecked = new PreKeyFingerprintCheck(0, 0, 0);
      final CompletableFuture<PreKeyFingerprintCheck> preKeyCheck;

      if (status.preKeyFingerprints() != null && !status.preKeyFingerprints().isEmpty()) {
        preKeyCheck = preKeyStore.verifyFingerprints(status.preKeyFingerprints());
      } else if (status.preKeys() < PreKeyStore.MIN_PRE_KEYS) {
        preKeyCheck = preKeyStore.publishAll().thenApply(uploaded -> new PreKeyFingerprintCheck(0, uploaded, 0));
      } else {
        preKeyCheck = CompletableFuture.completedFuture(unchecked);
      }

      return regenerateIfAllPreKeysCorrupted(preKeyCheck, unchecked)
          .thenCompose(check -> preKeyStore.ensureSufficientPreKeys()
              .thenCompose(generated -> signedPreKeyStore.validateAgainstServer(status.signedPreKey())
                  .thenApply(signedPreKeyValid -> new KeySyncResult(false, false, check.republished(), generated,
                      status.preKeyFingerprints() != null ? check.mismatches() : 0, signedPreKeyValid))));
    });
  }

  /**
   * Lets a pre-key operation fail over to regeneration when every stored pre-key was unreadable; the unreadable keys
   * have been purged by then, so the next {@link PreKeyStore#ensureSufficientPreKeys()} refills the pool.
   */
  private static <T> CompletableFuture<T> regenerateIfAllPreKeysCorrupted(final CompletableFuture<T> operation,
      final T fallback) {

    return operation.exceptionallyCompose(throwable -> {
      if (ExceptionUtils.unwrap(throwable) instanceof AllPreKeysCorruptedException) {
        logger.warn("Every stored pre-key was unreadable; regenerating the pool");
        return CompletableFuture.completedFuture(fallback);
      }

      return CompletableFuture.failedFuture(throwable);
    });
  }

  /**
   * Makes sure the server holds every pre-key this device holds.
   */
  public CompletableFuture<PreKeyReconciliation> syncPreKeyIds(final Collection<Integer> serverPreKeyIds) {
    return preKeyStore.reconcileWithServer(serverPreKeyIds);
  }

  public CompletableFuture<LocalIdentity> getIdentityKeyPair() {
    return identityKeyStore.getIdentityKeyPair();
  }

  public CompletableFuture<Integer> getLocalRegistrationId() {
    return identityKeyStore.getLocalRegistrationId();
  }

  public CompletableFuture<Boolean> isTrusted(final String peerId, final int deviceId,
      @Nullable final IdentityKey identityKey) {
    return identityKeyStore.isTrusted(peerId, deviceId, identityKey);
  }

  public CompletableFuture<Boolean> saveIdentity(final String peerId, final int deviceId, final IdentityKey identityKey) {
    return identityKeyStore.saveIdentity(peerId, deviceId, identityKey);
  }

  public CompletableFuture<Optional<IdentityKey>> getIdentity(final String peerId, final int deviceId) {
    return identityKeyStore.getIdentity(peerId, deviceId);
  }

  public CompletableFuture<Void> removeIdentity(final String peerId, final int deviceId) {
    return identityKeyStore.removeIdentity(peerId, deviceId);
  }

  public CompletableFuture<Integer> ensureSufficientPreKeys() {
    return preKeyStore.ensureSufficientPreKeys();
  }

  public CompletableFuture<PreKeyRecord> loadPreKey(final int preKeyId) {
    return preKeyStore.loadPreKey(preKeyId);
  }

  public CompletableFuture<Void> consumePreKey(final int preKeyId, final boolean notifyServer) {
    return preKeyStore.consume(preKeyId, notifyServer);
  }

  public CompletableFuture<SignedPreKeyRecord> getCurrentSignedPreKey() {
    return signedPreKeyStore.getCurrentSignedPreKey();
  }

  public CompletableFuture<SignedPreKeyRecord> loadSignedPreKey(final int signedPreKeyId) {
    return signedPreKeyStore.loadSignedPreKey(signedPreKeyId);
  }

  public CompletableFuture<SessionRecord> loadSession(final String peerId, final int deviceId) {
    return sessionStore.loadSession(peerId, deviceId);
  }

  public CompletableFuture<Void> storeSession(final String peerId, final int deviceId, final SessionRecord session) {
    return sessionStore.storeSession(peerId, deviceId, session);
  }

  public CompletableFuture<Void> deleteSession(final String peerId, final int deviceId) {
    return sessionStore.deleteSession(peerId, deviceId);
  }

  public CompletableFuture<Void> deleteAllSessionsForPeer(final String peerId) {
    return sessionStore.deleteAllSessionsForPeer(peerId);
  }

  public CompletableFuture<Void> deleteAllSessions() {
    return sessionStore.deleteAllSessions();
  }

  public CompletableFuture<List<Integer>> listDevices(final String peerId, final boolean includePrimary) {
    return sessionStore.listDevices(peerId, includePrimary);
  }

  /**
   * @return the current health of every store, keyed by store name
   */
  public Map<String, KeyHealthSnapshot> getHealth() {
    final Map<String, KeyHealthSnapshot> health = new LinkedHashMap<>();

    for (final KeyHealthState state : List.of(identityHealth, signedPreKeyHealth, preKeyHealth, sessionHealth)) {
      final KeyHealthSnapshot snapshot = state.snapshot();
      health.put(snapshot.store(), snapshot);
    }

    return health;
  }

  /**
   * Subscribes a listener to the health of every store.
   *
   * @return a handle that removes all of the listener's subscriptions when run
   */
  public Runnable subscribeToHealth(final KeyHealthListener listener) {
    final List<Runnable> subscriptions = List.of(identityHealth.subscribe(listener),
        signedPreKeyHealth.subscribe(listener),
        preKeyHealth.subscribe(listener),
        sessionHealth.subscribe(listener));

    return () -> subscriptions.forEach(Runnable::run);
  }

  public CleanupCascadeState getCleanupState() {
    return cleanupCascade.getState();
  }

  public Runnable subscribeToCleanupState(final Consumer<CleanupCascadeState> listener) {
    return cleanupCascade.subscribe(listener);
  }

  public boolean isRegenerating() {
    return identityKeyStore.isRegenerating();
  }

  public IdentityKeyStore getIdentityKeyStore() {
    return identityKeyStore;
  }

  public SignedPreKeyStore getSignedPreKeyStore() {
    return signedPreKeyStore;
  }

  public PreKeyStore getPreKeyStore() {
    return preKeyStore;
  }

  public SessionStore getSessionStore() {
    return sessionStore;
  }

  @Override
  public void close() {
    final Runnable subscription = eventSubscription;

    if (subscription != null) {
      subscription.run();
      eventSubscription = null;
    }
  }

  @VisibleForTesting
  static boolean matches(final IdentityKey identityKey, final String encodedPublicKey) {
    try {
      return Arrays.equals(identityKey.serialize(), Base64.getDecoder().decode(encodedPublicKey));
    } catch (final IllegalArgumentException e) {
      return false;
    }
  }
}
