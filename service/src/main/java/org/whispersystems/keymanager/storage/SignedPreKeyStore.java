/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.signal.libsignal.protocol.IdentityKey;
import org.signal.libsignal.protocol.IdentityKeyPair;
import org.signal.libsignal.protocol.InvalidKeyIdException;
import org.signal.libsignal.protocol.ecc.Curve;
import org.signal.libsignal.protocol.ecc.ECKeyPair;
import org.signal.libsignal.protocol.ecc.ECPublicKey;
import org.signal.libsignal.protocol.state.SignedPreKeyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.entities.KeyServerStatus;
import org.whispersystems.keymanager.entities.SignedPreKeyEntity;
import org.whispersystems.keymanager.events.KeyServerEventChannel;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.health.KeyHealthStatus;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;
import org.whispersystems.keymanager.util.SystemMapper;

/**
 * Owns the signed pre-key and its rotation.
 * <p>
 * Rotation is evaluated lazily whenever the current key is requested: once the newest key is
 * {@link #ROTATION_INTERVAL} old (or has no creation time) a new key with the next ID is generated, signed with the
 * identity key and published. Afterwards at most {@value #MAX_LOCAL_SIGNED_PRE_KEYS} keys are kept locally, so that
 * messages encrypted against a recently replaced key can still be decrypted, and at most
 * {@value #MAX_SERVER_SIGNED_PRE_KEYS} on the server, so that a bundle fetched just before rotation stays usable.
 * <p>
 * The creation time is the timestamp embedded in each {@link SignedPreKeyRecord}; a timestamp of zero or less counts
 * as missing.
 */
public class SignedPreKeyStore implements LocalKeyMaterial {

  public static final Duration ROTATION_INTERVAL = Duration.ofDays(7);
  public static final int MAX_LOCAL_SIGNED_PRE_KEYS = 3;
  public static final int MAX_SERVER_SIGNED_PRE_KEYS = 2;
  public static final int MAX_SIGNED_PRE_KEY_ID = 0xFFFFFF;

  public static final String SIGNED_PRE_KEYS_RESPONSE_EVENT = "getSignedPreKeysResponse";

  static final String COLLECTION = "signedPreKeys";
  static final String KEY_PREFIX = "signedprekey_";

  /**
   * Newest first: by creation time, then by ID.
   */
  private static final Comparator<SignedPreKeyRecord> NEWEST_FIRST =
      Comparator.comparingLong(SignedPreKeyRecord::getTimestamp)
          .thenComparingInt(SignedPreKeyRecord::getId)
          .reversed();

  private final EncryptedKeyValueStore storage;
  private final KeyServerClient keyServerClient;
  private final IdentityKeyStore identityKeyStore;
  private final KeyHealthState healthState;
  private final Clock clock;

  private final AtomicReference<CompletableFuture<SignedPreKeyRecord>> pendingGeneration = new AtomicReference<>();

  private static final String ROTATED_COUNTER_NAME = MetricsUtil.name(SignedPreKeyStore.class, "rotated");
  private static final String INVALID_SERVER_KEY_COUNTER_NAME =
      MetricsUtil.name(SignedPreKeyStore.class, "invalidServerKey");
  private static final String CORRUPTED_COUNTER_NAME = MetricsUtil.name(SignedPreKeyStore.class, "corrupted");

  private static final Logger logger = LoggerFactory.getLogger(SignedPreKeyStore.class);

  public SignedPreKeyStore(final EncryptedKeyValueStore storage,
      final KeyServerClient keyServerClient,
      final IdentityKeyStore identityKeyStore,
      final KeyHealthState healthState,
      final Clock clock) {

    this.storage = storage;
    this.keyServerClient = keyServerClient;
    this.identityKeyStore = identityKeyStore;
    this.healthState = healthState;
    this.clock = clock;
  }

  /**
   * Registers for the server's signed pre-key listing. An empty listing means the server has no signed pre-key for
   * this device, which is repaired by generating and publishing key 0.
   *
   * @return a handle that removes the subscription when run
   */
  public Runnable subscribe(final KeyServerEventChannel eventChannel) {
    return eventChannel.subscribe(SIGNED_PRE_KEYS_RESPONSE_EVENT, this::handleSignedPreKeysResponse);
  }

  @VisibleForTesting
  void handleSignedPreKeysResponse(final String json) {
    final JsonNode listing;

    try {
      listing = SystemMapper.jsonMapper().readTree(json);
    } catch (final JsonProcessingException e) {
      logger.warn("Ignoring malformed {} event", SIGNED_PRE_KEYS_RESPONSE_EVENT, e);
      return;
    }

    if (listing == null || !listing.isArray()) {
      logger.warn("Ignoring {} event without a key listing", SIGNED_PRE_KEYS_RESPONSE_EVENT);
      return;
    }

    if (listing.isEmpty()) {
      logger.info("Server holds no signed pre-key; generating key 0");

      generateOnce(() -> generateAndPublish(0))
          .thenCompose(record -> pruneLocal().thenApply(ignored -> record))
          .whenComplete((record, throwable) -> {
            if (throwable != null) {
              logger.warn("Failed to restore signed pre-key on server", ExceptionUtils.unwrap(throwable));
            }
          });
    }
  }

  /**
   * Returns the newest signed pre-key, generating key 0 if there is none and rotating it if it is due. Excess local keys
   * are pruned before returning.
   */
  public CompletableFuture<SignedPreKeyRecord> getCurrentSignedPreKey() {
    return loadAll().thenCompose(records -> {
      if (records.isEmpty()) {
        logger.info("No signed pre-key stored; generating key 0");
        return generateOnce(() -> generateAndPublish(0))
            .thenCompose(record -> pruneLocal().thenApply(ignored -> record));
      }

      final SignedPreKeyRecord newest = records.get(0);

      if (isRotationDue(newest)) {
        return rotate();
      }

      return pruneLocal().thenApply(ignored -> {
        healthState.updateCount(Math.min(records.size(), MAX_LOCAL_SIGNED_PRE_KEYS), KeyHealthStatus.READY);
        return newest;
      });
    });
  }

  /**
   * Generates a signed pre-key with the next ID, publishes it, and prunes older keys locally and on the server. If
   * publication fails nothing is stored and the previous key remains current.
   */
  public CompletableFuture<SignedPreKeyRecord> rotate() {
    return generateOnce(() -> loadAll().thenCompose(records -> {
      final int nextId = records.stream()
          .mapToInt(SignedPreKeyRecord::getId)
          .max()
          .stream()
          .map(maxId -> (maxId + 1) % (MAX_SIGNED_PRE_KEY_ID + 1))
          .findFirst()
          .orElse(0);

      logger.info("Rotating signed pre-key to {}", nextId);
      Metrics.counter(ROTATED_COUNTER_NAME).increment();

      return generateAndPublish(nextId);
    }))
        .thenCompose(record -> pruneLocal()
            .thenCompose(ignored -> pruneServer())
            .thenApply(ignored -> record));
  }

  /**
   * @return {@code true} if there is no signed pre-key, the newest has no creation time, or it is at least
   * {@link #ROTATION_INTERVAL} old
   */
  public CompletableFuture<Boolean> needsRotation() {
    return loadAll().thenApply(records -> records.isEmpty() || isRotationDue(records.get(0)));
  }

  /**
   * Checks the signed pre-key the server advertises against the local identity key. Missing fields, undecodable data,
   * a signature that is not {@value org.whispersystems.keymanager.entities.SignedPreKey#SIGNATURE_LENGTH} bytes long or
   * one that does not verify all lead to key 0 being regenerated and published.
   *
   * @return a future that yields {@code true} if the advertised key was valid, {@code false} if it was replaced
   */
  public CompletableFuture<Boolean> validateAgainstServer(@Nullable final KeyServerStatus.SignedPreKeyStatus advertised) {
    healthState.markBusy(KeyHealthStatus.VALIDATING);

    return identityKeyStore.getIdentityKeyPair().thenCompose(identity -> {
      final Optional<String> problem = findProblem(advertised, identity.identityKey());

      if (problem.isEmpty()) {
        healthState.markSynced(healthState.snapshot().count(), KeyHealthStatus.READY);
        return CompletableFuture.completedFuture(true);
      }

      logger.warn("Server signed pre-key is invalid ({}); regenerating key 0", problem.get());
      Metrics.counter(INVALID_SERVER_KEY_COUNTER_NAME, "reason", problem.get()).increment();
      healthState.markBusy(KeyHealthStatus.HEALING);

      return generateOnce(() -> generateAndPublish(0))
          .thenCompose(record -> pruneLocal())
          .thenCompose(ignored -> pruneServer())
          .thenApply(ignored -> false);
    });
  }

  @VisibleForTesting
  static Optional<String> findProblem(@Nullable final KeyServerStatus.SignedPreKeyStatus advertised,
      final IdentityKey identityKey) {

    if (advertised == null || advertised.id() == null || advertised.publicKey() == null
        || advertised.signature() == null) {
      return Optional.of("missing");
    }

    final SignedPreKeyEntity entity;

    try {
      entity = new SignedPreKeyEntity(advertised.id(),
          new ECPublicKey(Base64.getDecoder().decode(advertised.publicKey())),
          Base64.getDecoder().decode(advertised.signature()));
    } catch (final Exception e) {
      return Optional.of("malformed");
    }

    if (!entity.signatureWellFormed()) {
      return Optional.of("signatureLength");
    }

    return entity.signatureValid(identityKey) ? Optional.empty() : Optional.of("badSignature");
  }

  /**
   * Re-uploads the newest signed pre-key, generating key 0 if there is none.
   */
  public CompletableFuture<SignedPreKeyRecord> publishCurrent() {
    return loadAll().thenCompose(records -> {
      if (records.isEmpty()) {
        return generateOnce(() -> generateAndPublish(0));
      }

      final SignedPreKeyRecord newest = records.get(0);
      return keyServerClient.uploadSignedPreKey(toEntity(newest)).thenApply(ignored -> newest);
    });
  }

  /**
   * @return a future that yields the key, or fails with {@link InvalidKeyIdException} if there is none (the sender used
   * a bundle with a key this device no longer holds) or {@link KeyStorageCorruptedException} if it was unreadable
   */
  public CompletableFuture<SignedPreKeyRecord> loadSignedPreKey(final int signedPreKeyId) {
    return readSignedPreKey(signedPreKeyId).thenApply(maybeRecord -> maybeRecord.orElseThrow(() ->
        ExceptionUtils.wrap(new InvalidKeyIdException("No such signed pre-key: " + signedPreKeyId))));
  }

  /**
   * @return every readable signed pre-key, newest first; unreadable ones are purged
   */
  public CompletableFuture<List<SignedPreKeyRecord>> loadAll() {
    return getAllSignedPreKeyIds().thenCompose(ids -> {
      final List<SignedPreKeyRecord> records = Collections.synchronizedList(new ArrayList<>());

      return CompletableFuture.allOf(ids.stream()
              .map(id -> readSignedPreKey(id)
                  .thenAccept(maybeRecord -> maybeRecord.ifPresent(records::add))
                  .exceptionally(throwable -> null))
              .toArray(CompletableFuture[]::new))
          .thenApply(ignored -> records.stream().sorted(NEWEST_FIRST).toList());
    });
  }

  public CompletableFuture<Integer> getSignedPreKeyCount() {
    return getAllSignedPreKeyIds().thenApply(List::size);
  }

  /**
   * Deletes a signed pre-key locally and on the server. A failure to reach the server is logged only.
   */
  public CompletableFuture<Void> removeSignedPreKey(final int signedPreKeyId) {
    return storage.delete(COLLECTION, storageKey(signedPreKeyId))
        .thenCompose(ignored -> keyServerClient.deleteSignedPreKey(signedPreKeyId))
        .exceptionally(throwable -> {
          logger.warn("Failed to delete signed pre-key {} from server", signedPreKeyId,
              ExceptionUtils.unwrap(throwable));
          return null;
        });
  }

  @Override
  public String description() {
    return "signed pre-keys";
  }

  @Override
  public CompletableFuture<Void> deleteAllLocal() {
    return getAllSignedPreKeyIds()
        .thenCompose(ids -> CompletableFuture.allOf(ids.stream()
            .map(id -> storage.delete(COLLECTION, storageKey(id)))
            .toArray(CompletableFuture[]::new)))
        .thenRun(() -> healthState.updateCount(0, KeyHealthStatus.UNINITIALIZED));
  }

  public KeyHealthState getHealthState() {
    return healthState;
  }

  private boolean isRotationDue(final SignedPreKeyRecord record) {
    if (record.getTimestamp() <= 0) {
      logger.warn("Signed pre-key {} has no creation time", record.getId());
      return true;
    }

    return !clock.instant().isBefore(Instant.ofEpochMilli(record.getTimestamp()).plus(ROTATION_INTERVAL));
  }

  private CompletableFuture<SignedPreKeyRecord> generateOnce(
      final Supplier<CompletableFuture<SignedPreKeyRecord>> generator) {

    final CompletableFuture<SignedPreKeyRecord> generation = new CompletableFuture<>();
    final CompletableFuture<SignedPreKeyRecord> pending = pendingGeneration.compareAndExchange(null, generation);

    if (pending != null) {
      logger.debug("Signed pre-key generation already in progress");
      return pending;
    }

    CompletableFuture<SignedPreKeyRecord> generated;

    try {
      generated = generator.get();
    } catch (final RuntimeException e) {
      generated = CompletableFuture.failedFuture(e);
    }

    generated.whenComplete((record, throwable) -> {
      pendingGeneration.set(null);

      if (throwable != null) {
        generation.completeExceptionally(throwable);
      } else {
        generation.complete(record);
      }
    });

    return generation;
  }

  /**
   * Generates a signed pre-key with the given ID, publishes it and, once the server has acknowledged it, stores it
   * locally.
   */
  private CompletableFuture<SignedPreKeyRecord> generateAndPublish(final int signedPreKeyId) {
    healthState.markBusy(KeyHealthStatus.GENERATING);

    return identityKeyStore.getIdentityKeyPair()
        .thenApply(identity -> generateSignedPreKey(signedPreKeyId, identity.identityKeyPair(), clock))
        .thenCompose(record -> keyServerClient.uploadSignedPreKey(toEntity(record))
            .thenCompose(ignored -> storage.put(COLLECTION, storageKey(signedPreKeyId), record.serialize()))
            .thenApply(ignored -> record))
        .whenComplete((record, throwable) -> {
          if (throwable != null) {
            logger.error("Failed to publish signed pre-key {}", signedPreKeyId, ExceptionUtils.unwrap(throwable));
            healthState.markError(ExceptionUtils.unwrap(throwable));
          } else {
            logger.info("Published signed pre-key {}", signedPreKeyId);
            healthState.markGenerationComplete(healthState.snapshot().count() + 1, KeyHealthStatus.READY);
          }
        });
  }

  @VisibleForTesting
  static SignedPreKeyRecord generateSignedPreKey(final int signedPreKeyId, final IdentityKeyPair identityKeyPair,
      final Clock clock) {

    final ECKeyPair keyPair = Curve.generateKeyPair();
    final byte[] signature = identityKeyPair.getPrivateKey().calculateSignature(keyPair.getPublicKey().serialize());

    return new SignedPreKeyRecord(signedPreKeyId, clock.millis(), keyPair, signature);
  }

  private CompletableFuture<Void> pruneLocal() {
    return loadAll().thenCompose(records -> {
      final List<SignedPreKeyRecord> excess = records.size() > MAX_LOCAL_SIGNED_PRE_KEYS
          ? records.subList(MAX_LOCAL_SIGNED_PRE_KEYS, records.size())
          : List.of();

      if (!excess.isEmpty()) {
        logger.debug("Pruning {} old signed pre-keys", excess.size());
      }

      return CompletableFuture.allOf(excess.stream()
              .map(record -> storage.delete(COLLECTION, storageKey(record.getId())))
              .toArray(CompletableFuture[]::new))
          .thenRun(() -> healthState.updateCount(records.size() - excess.size(), KeyHealthStatus.READY));
    });
  }

  /**
   * Deletes every server-side signed pre-key except the newest {@value #MAX_SERVER_SIGNED_PRE_KEYS} local ones.
   * Best-effort: a stale key left on the server is still correctly signed.
   */
  private CompletableFuture<Void> pruneServer() {
    return loadAll()
        .thenCombine(keyServerClient.getSignedPreKeys(), (local, remote) -> {
          final Set<Integer> retained = local.stream()
              .limit(MAX_SERVER_SIGNED_PRE_KEYS)
              .map(SignedPreKeyRecord::getId)
              .collect(Collectors.toSet());

          return remote.stream()
              .map(SignedPreKeyEntity::keyId)
              .filter(id -> !retained.contains(id))
              .distinct()
              .toList();
        })
        .thenCompose(stale -> CompletableFuture.allOf(stale.stream()
            .map(id -> keyServerClient.deleteSignedPreKey(id)
                .whenComplete((ignored, throwable) -> {
                  if (throwable == null) {
                    logger.debug("Removed signed pre-key {} from server", id);
                  }
                }))
            .toArray(CompletableFuture[]::new)))
        .exceptionally(throwable -> {
          logger.warn("Failed to prune signed pre-keys on server", ExceptionUtils.unwrap(throwable));
          return null;
        });
  }

  private CompletableFuture<List<Integer>> getAllSignedPreKeyIds() {
    return storage.listKeys(COLLECTION).thenApply(keys -> keys.stream()
        .filter(key -> key.startsWith(KEY_PREFIX))
        .map(key -> {
          try {
            return Optional.of(Integer.parseInt(key.substring(KEY_PREFIX.length())));
          } catch (final NumberFormatException e) {
            return Optional.<Integer>empty();
          }
        })
        .flatMap(Optional::stream)
        .sorted()
        .toList());
  }

  private CompletableFuture<Optional<SignedPreKeyRecord>> readSignedPreKey(final int signedPreKeyId) {
    final String key = storageKey(signedPreKeyId);

    return storage.get(COLLECTION, key)
        .thenApply(maybeBytes -> maybeBytes.map(bytes -> {
          try {
            return new SignedPreKeyRecord(bytes);
          } catch (final Exception e) {
            throw ExceptionUtils.wrap(new KeyStorageCorruptedException(COLLECTION, key, e));
          }
        }))
        .exceptionallyCompose(throwable -> {
          final Throwable cause = ExceptionUtils.unwrap(throwable);
          final KeyStorageCorruptedException corrupted = cause instanceof KeyStorageCorruptedException e
              ? e
              : new KeyStorageCorruptedException(COLLECTION, key, cause);

          logger.warn("Purging unreadable signed pre-key {}", signedPreKeyId, cause);
          Metrics.counter(CORRUPTED_COUNTER_NAME).increment();

          return storage.delete(COLLECTION, key)
              .thenCompose(ignored -> CompletableFuture.<Optional<SignedPreKeyRecord>>failedFuture(corrupted));
        });
  }

  private static SignedPreKeyEntity toEntity(final SignedPreKeyRecord record) {
    try {
      return new SignedPreKeyEntity(record.getId(), record.getKeyPair().getPublicKey(), record.getSignature());
    } catch (final Exception e) {
      throw ExceptionUtils.wrap(new KeyStorageCorruptedException(COLLECTION, storageKey(record.getId()), e));
    }
  }

  private static String storageKey(final int signedPreKeyId) {
    return KEY_PREFIX + signedPreKeyId;
  }
}
