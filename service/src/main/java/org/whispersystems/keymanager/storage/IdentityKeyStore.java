/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;
import org.signal.libsignal.protocol.IdentityKey;
import org.signal.libsignal.protocol.IdentityKeyPair;
import org.signal.libsignal.protocol.util.KeyHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.health.KeyHealthStatus;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;
import org.whispersystems.keymanager.util.SystemMapper;

/**
 * Owns this device's identity key pair and the identity keys of remote peers.
 * <p>
 * The identity key pair is created lazily on first access and published to the key server. Creating or regenerating it
 * happens under an {@link IdentityRegenerationLock}, so concurrent callers on an empty store observe exactly one
 * generated key pair and one upload.
 * <p>
 * Remote identities follow trust-on-first-use: an unknown peer device is trusted, a known one must present exactly the
 * key recorded for it.
 */
public class IdentityKeyStore {

  static final String IDENTITY_COLLECTION = "identityKeys";
  static final String IDENTITY_KEY_PAIR_KEY = "identityKeyPair";
  static final String TRUSTED_IDENTITY_COLLECTION = "trustedIdentities";

  private final EncryptedKeyValueStore storage;
  private final KeyServerClient keyServerClient;
  private final IdentityRegenerationLock regenerationLock;
  private final KeyHealthState healthState;

  @Nullable
  private volatile LocalIdentity cachedIdentity;

  private static final String GENERATED_COUNTER_NAME = MetricsUtil.name(IdentityKeyStore.class, "generated");
  private static final String IDENTITY_CHANGED_COUNTER_NAME = MetricsUtil.name(IdentityKeyStore.class, "remoteIdentityChanged");
  private static final String CORRUPTED_COUNTER_NAME = MetricsUtil.name(IdentityKeyStore.class, "corrupted");

  private static final Logger logger = LoggerFactory.getLogger(IdentityKeyStore.class);

  public IdentityKeyStore(final EncryptedKeyValueStore storage,
      final KeyServerClient keyServerClient,
      final IdentityRegenerationLock regenerationLock,
      final KeyHealthState healthState) {

    this.storage = storage;
    this.keyServerClient = keyServerClient;
    this.regenerationLock = regenerationLock;
    this.healthState = healthState;
  }

  /**
   * Returns this device's identity, loading it from storage or generating and publishing a new one if none exists.
   *
   * @return a future that yields the local identity; fails with an {@link IdentityKeyCorruptedException} if the stored
   * identity is unreadable, or with a {@link org.whispersystems.keymanager.http.KeyServerException} if a newly generated
   * identity could not be published (it is still persisted and cached in that case)
   */
  public CompletableFuture<LocalIdentity> getIdentityKeyPair() {
    final LocalIdentity cached = cachedIdentity;

    if (cached != null) {
      return CompletableFuture.completedFuture(cached);
    }

    return regenerationLock.withLock(() -> {
      final LocalIdentity cachedUnderLock = cachedIdentity;

      if (cachedUnderLock != null) {
        return CompletableFuture.completedFuture(cachedUnderLock);
      }

      return loadStoredIdentity().thenCompose(maybeIdentity -> maybeIdentity
          .map(identity -> {
            cachedIdentity = identity;
            healthState.updateCount(1, KeyHealthStatus.READY);
            return CompletableFuture.completedFuture(identity);
          })
          .orElseGet(() -> {
            logger.info("No identity key pair stored; generating a new one");
            return generateAndPersist().thenCompose(identity -> publish(identity).thenApply(ignored -> identity));
          }));
    });
  }

  /**
   * Destroys the current identity and replaces it with a new one. All key material that depends on the identity is
   * purged by the given cascade before the new identity is published.
   */
  public CompletableFuture<LocalIdentity> regenerateIdentityKeyPair(final CleanupCascade cleanupCascade) {
    return regenerationLock.withLock(() -> {
      logger.warn("Regenerating identity key pair; all dependent key material will be discarded");

      cachedIdentity = null;
      healthState.reset();

      return storage.delete(IDENTITY_COLLECTION, IDENTITY_KEY_PAIR_KEY)
          .thenCompose(ignored -> generateAndPersist())
          .thenCompose(identity -> cleanupCascade.execute(() -> publish(identity))
              .thenApply(ignored -> identity));
    });
  }

  /**
   * Uploads the current identity public key and registration ID. If there is no identity yet, one is generated and
   * published once.
   */
  public CompletableFuture<Void> publishIdentity() {
    return hasIdentityKeyPair().thenCompose(exists -> exists
        ? getIdentityKeyPair().thenCompose(this::publish)
        : getIdentityKeyPair().thenAccept(ignored -> {}));
  }

  public CompletableFuture<Integer> getLocalRegistrationId() {
    return getIdentityKeyPair().thenApply(LocalIdentity::registrationId);
  }

  public CompletableFuture<String> getIdentityPublicKey() {
    return getIdentityKeyPair().thenApply(LocalIdentity::encodedPublicKey);
  }

  public CompletableFuture<Boolean> hasIdentityKeyPair() {
    if (cachedIdentity != null) {
      return CompletableFuture.completedFuture(true);
    }

    return storage.get(IDENTITY_COLLECTION, IDENTITY_KEY_PAIR_KEY).thenApply(Optional::isPresent);
  }

  public boolean isRegenerating() {
    return regenerationLock.isLocked();
  }

  public boolean isCached() {
    return cachedIdentity != null;
  }

  /**
   * Drops the in-memory copy of the identity; the next access reloads it from storage.
   */
  public void clearCache() {
    cachedIdentity = null;
  }

  /**
   * Checks a remote identity key under trust-on-first-use.
   *
   * @return {@code true} if no key is recorded for the peer device or the candidate matches the recorded key exactly;
   * {@code false} if the candidate is absent or differs from the recorded key
   */
  public CompletableFuture<Boolean> isTrusted(final String peerId, final int deviceId,
      @Nullable final IdentityKey candidate) {

    if (candidate == null) {
      return CompletableFuture.completedFuture(false);
    }

    return getIdentity(peerId, deviceId).thenApply(maybeTrusted -> maybeTrusted
        .map(trusted -> Arrays.equals(trusted.serialize(), candidate.serialize()))
        .orElse(true));
  }

  /**
   * Records a remote identity key.
   *
   * @return {@code true} if the peer device was unknown or its recorded key was replaced, {@code false} if the same key
   * was already recorded
   */
  public CompletableFuture<Boolean> saveIdentity(final String peerId, final int deviceId, final IdentityKey identityKey) {
    return getIdentity(peerId, deviceId).thenCompose(maybeExisting -> {
      if (maybeExisting.isPresent() && Arrays.equals(maybeExisting.get().serialize(), identityKey.serialize())) {
        return CompletableFuture.completedFuture(false);
      }

      if (maybeExisting.isPresent()) {
        // Surfaced to the caller through the return value; never rejected here
        logger.warn("Identity key for {}.{} changed; peer rotated or replaced their identity", peerId, deviceId);
        Metrics.counter(IDENTITY_CHANGED_COUNTER_NAME).increment();
      }

      return storage.put(TRUSTED_IDENTITY_COLLECTION, trustedIdentityKey(peerId, deviceId), identityKey.serialize())
          .thenApply(ignored -> true);
    });
  }

  /**
   * Returns the identity key recorded for a peer device. A record that cannot be read is purged and treated as absent.
   */
  public CompletableFuture<Optional<IdentityKey>> getIdentity(final String peerId, final int deviceId) {
    final String key = trustedIdentityKey(peerId, deviceId);

    return storage.get(TRUSTED_IDENTITY_COLLECTION, key)
        .thenApply(maybeBytes -> maybeBytes.map(bytes -> {
          try {
            return new IdentityKey(bytes);
          } catch (final Exception e) {
            throw ExceptionUtils.wrap(new KeyStorageCorruptedException(TRUSTED_IDENTITY_COLLECTION, key, e));
          }
        }))
        .exceptionallyCompose(throwable -> {
          logger.warn("Purging unreadable identity record for {}.{}", peerId, deviceId, ExceptionUtils.unwrap(throwable));
          Metrics.counter(CORRUPTED_COUNTER_NAME, "collection", TRUSTED_IDENTITY_COLLECTION).increment();

          return storage.delete(TRUSTED_IDENTITY_COLLECTION, key).thenApply(ignored -> Optional.empty());
        });
  }

  public CompletableFuture<Void> removeIdentity(final String peerId, final int deviceId) {
    return storage.delete(TRUSTED_IDENTITY_COLLECTION, trustedIdentityKey(peerId, deviceId));
  }

  private CompletableFuture<Optional<LocalIdentity>> loadStoredIdentity() {
    return storage.get(IDENTITY_COLLECTION, IDENTITY_KEY_PAIR_KEY)
        .handle((maybeBytes, throwable) -> {
          if (throwable != null) {
            throw corrupted(throwable);
          }

          return maybeBytes.map(bytes -> {
            try {
              final StoredIdentity stored = SystemMapper.jsonMapper().readValue(bytes, StoredIdentity.class);
              return new LocalIdentity(new IdentityKeyPair(stored.identityKeyPair()), stored.registrationId());
            } catch (final Exception e) {
              throw corrupted(e);
            }
          });
        });
  }

  private RuntimeException corrupted(final Throwable cause) {
    logger.error("Stored identity key pair is unreadable", ExceptionUtils.unwrap(cause));
    Metrics.counter(CORRUPTED_COUNTER_NAME, "collection", IDENTITY_COLLECTION).increment();
    healthState.markError("Identity key pair is unreadable");

    return ExceptionUtils.wrap(
        new IdentityKeyCorruptedException(IDENTITY_COLLECTION, IDENTITY_KEY_PAIR_KEY, ExceptionUtils.unwrap(cause)));
  }

  private CompletableFuture<LocalIdentity> generateAndPersist() {
    healthState.markBusy(KeyHealthStatus.GENERATING);

    final LocalIdentity identity = generateIdentity();
    final byte[] serialized;

    try {
      serialized = SystemMapper.jsonMapper().writeValueAsBytes(
          new StoredIdentity(identity.identityKeyPair().serialize(), identity.registrationId()));
    } catch (final IOException e) {
      throw new IllegalStateException("Could not serialize identity key pair", e);
    }

    return storage.put(IDENTITY_COLLECTION, IDENTITY_KEY_PAIR_KEY, serialized)
        .thenApply(ignored -> {
          cachedIdentity = identity;
          healthState.markGenerationComplete(1, KeyHealthStatus.SYNCING);
          Metrics.counter(GENERATED_COUNTER_NAME).increment();
          logger.info("Generated identity key pair with registration ID {}", identity.registrationId());

          return identity;
        });
  }

  private CompletableFuture<Void> publish(final LocalIdentity identity) {
    healthState.markBusy(KeyHealthStatus.SYNCING);

    return keyServerClient.uploadIdentity(identity.identityKey(), identity.registrationId())
        .whenComplete((ignored, throwable) -> {
          if (throwable != null) {
            logger.error("Failed to publish identity key", ExceptionUtils.unwrap(throwable));
            healthState.markError(ExceptionUtils.unwrap(throwable));
          } else {
            healthState.markSynced(1, KeyHealthStatus.READY);
          }
        });
  }

  @VisibleForTesting
  static LocalIdentity generateIdentity() {
    return new LocalIdentity(IdentityKeyPair.generate(), KeyHelper.generateRegistrationId(false));
  }

  private static String trustedIdentityKey(final String peerId, final int deviceId) {
    return "identity_" + peerId + "_" + deviceId;
  }
}
