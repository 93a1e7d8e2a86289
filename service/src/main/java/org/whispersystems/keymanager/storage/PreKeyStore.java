/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;
import org.signal.libsignal.protocol.InvalidKeyIdException;
import org.signal.libsignal.protocol.ecc.Curve;
import org.signal.libsignal.protocol.state.PreKeyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.entities.PreKeyEntity;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.health.KeyHealthStatus;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;

/**
 * Maintains the pool of one-time pre-keys, locally and on the key server.
 * <p>
 * The pool is refilled to {@value #TARGET_PRE_KEYS} keys whenever it drops below {@value #MIN_PRE_KEYS}. New keys get
 * consecutive IDs above the current maximum until that maximum reaches {@value #WRAP_THRESHOLD}; from then on the lowest
 * unused IDs are reused, on the assumption that keys that old have long been consumed.
 */
public class PreKeyStore implements LocalKeyMaterial {

  public static final int MIN_PRE_KEYS = 20;
  public static final int TARGET_PRE_KEYS = 110;
  public static final int MAX_PRE_KEY_ID = 0xFFFFFF;
  public static final int WRAP_THRESHOLD = 16_000_000;

  static final String COLLECTION = "preKeys";
  static final String KEY_PREFIX = "prekey_";

  private final EncryptedKeyValueStore storage;
  private final KeyServerClient keyServerClient;
  private final KeyHealthState healthState;

  private final AtomicBoolean checkInProgress = new AtomicBoolean(false);
  private final Set<Integer> unpublishedIds = ConcurrentHashMap.newKeySet();
  private volatile CompletableFuture<Void> backgroundCheck = CompletableFuture.completedFuture(null);

  private static final String GENERATED_COUNTER_NAME = MetricsUtil.name(PreKeyStore.class, "generated");
  private static final String UPLOAD_FAILED_COUNTER_NAME = MetricsUtil.name(PreKeyStore.class, "uploadFailed");
  private static final String CORRUPTED_COUNTER_NAME = MetricsUtil.name(PreKeyStore.class, "corrupted");
  private static final String WRAP_COUNTER_NAME = MetricsUtil.name(PreKeyStore.class, "idWrap");

  private static final Logger logger = LoggerFactory.getLogger(PreKeyStore.class);

  public PreKeyStore(final EncryptedKeyValueStore storage,
      final KeyServerClient keyServerClient,
      final KeyHealthState healthState) {

    this.storage = storage;
    this.keyServerClient = keyServerClient;
    this.healthState = healthState;
  }

  /**
   * Refills the pool if it holds fewer than {@value #MIN_PRE_KEYS} keys. New keys are stored locally first and then
   * published in a single batch; if publication fails the local keys are kept, remembered as unpublished and the
   * returned future fails with a {@link org.whispersystems.keymanager.http.KeyServerException}. Every call publishes
   * keys left unpublished by an earlier failure before it completes.
   * <p>
   * Only one check runs at a time. A call made while another is in flight returns immediately.
   *
   * @return a future that yields the number of keys generated
   */
  public CompletableFuture<Integer> ensureSufficientPreKeys() {
    if (!checkInProgress.compareAndSet(false, true)) {
      logger.debug("Pre-key check already in progress");
      return CompletableFuture.completedFuture(0);
    }

    CompletableFuture<Integer> check;

    try {
      check = getAllPreKeyIds().thenCompose(ids -> {
        if (ids.size() >= MIN_PRE_KEYS) {
          if (unpublishedIds.isEmpty()) {
            healthState.updateCount(ids.size(), statusFor(ids.size()));
            return CompletableFuture.completedFuture(0);
          }

          logger.info("Publishing {} pre-keys left over from a failed upload", unpublishedIds.size());

          return publishPending().thenApply(ignored -> {
            healthState.markSynced(ids.size(), statusFor(ids.size()));
            return 0;
          });
        }

        healthState.updateCount(ids.size(), statusFor(ids.size()));

        logger.info("Pre-key pool low ({}/{}); generating {}", ids.size(), TARGET_PRE_KEYS,
            TARGET_PRE_KEYS - ids.size());

        healthState.markBusy(KeyHealthStatus.GENERATING);

        final List<Integer> newIds = assignIds(ids, TARGET_PRE_KEYS - ids.size());

        return generateAndStore(newIds)
            .thenCompose(records -> publishPending().thenApply(ignored -> {
              final int count = ids.size() + records.size();
              healthState.markGenerationComplete(count, statusFor(count));

              return records.size();
            }));
      });
    } catch (final RuntimeException e) {
      check = CompletableFuture.failedFuture(e);
    }

    return check.whenComplete((generated, throwable) -> {
      checkInProgress.set(false);

      if (throwable != null) {
        logger.warn("Pre-key check failed", ExceptionUtils.unwrap(throwable));
        healthState.markError(ExceptionUtils.unwrap(throwable));
      }
    });
  }

  /**
   * Deletes a pre-key that has been used to establish a session. The returned future completes once the key is gone
   * locally; notifying the server and re-checking the pool happen in the background and report failures through the
   * store's health state.
   *
   * @param preKeyId the consumed key
   * @param notifyServer whether to ask the server to delete its copy too
   */
  public CompletableFuture<Void> consume(final int preKeyId, final boolean notifyServer) {
    return storage.delete(COLLECTION, storageKey(preKeyId))
        .thenRun(() -> {
          logger.debug("Consumed pre-key {}", preKeyId);
          unpublishedIds.remove(preKeyId);
          backgroundCheck = startBackgroundCheck(preKeyId, notifyServer);
        });
  }

  private CompletableFuture<Void> startBackgroundCheck(final int preKeyId, final boolean notifyServer) {
    final CompletableFuture<Void> serverNotification = notifyServer
        ? keyServerClient.deletePreKey(preKeyId).exceptionally(throwable -> {
            logger.warn("Failed to delete pre-key {} from server", preKeyId, ExceptionUtils.unwrap(throwable));
            return null;
          })
        : CompletableFuture.completedFuture(null);

    return serverNotification
        .thenCompose(ignored -> ensureSufficientPreKeys())
        .handle((generated, throwable) -> {
          if (throwable != null) {
            // Already recorded in the health state by ensureSufficientPreKeys
            logger.debug("Background pre-key check after consuming {} failed", preKeyId);
          }
          return null;
        });
  }

  /**
   * Makes sure the server holds every pre-key this device holds. Local keys the server lacks are uploaded; local keys
   * that cannot be read are purged and the pool is refilled, since publishing a bundle for an unreadable key would
   * break session setup for the peer who fetches it.
   *
   * @param serverIds the pre-key IDs the server reports for this device
   */
  public CompletableFuture<PreKeyReconciliation> reconcileWithServer(final Collection<Integer> serverIds) {
    final Set<Integer> onServer = new HashSet<>(serverIds);

    return getAllPreKeyIds().thenCompose(localIds -> {
      final List<Integer> missing = localIds.stream().filter(id -> !onServer.contains(id)).toList();

      if (missing.isEmpty()) {
        logger.debug("Server holds all {} local pre-keys", localIds.size());
        return CompletableFuture.completedFuture(new PreKeyReconciliation(0, 0, 0));
      }

      logger.info("Server is missing {} of {} local pre-keys", missing.size(), localIds.size());

      final List<PreKeyRecord> readable = Collections.synchronizedList(new ArrayList<>());
      final List<Integer> purged = Collections.synchronizedList(new ArrayList<>());

      return CompletableFuture.allOf(missing.stream()
              .map(id -> readPreKey(id)
                  .thenAccept(maybeRecord -> maybeRecord.ifPresent(readable::add))
                  .exceptionally(throwable -> {
                    purged.add(id);
                    return null;
                  }))
              .toArray(CompletableFuture[]::new))
          .thenCompose(ignored -> readable.isEmpty()
              ? CompletableFuture.completedFuture(null)
              : publish(readable))
          .thenCompose(ignored -> purged.isEmpty()
              ? CompletableFuture.completedFuture(0)
              : ensureSufficientPreKeys())
          .thenApply(regenerated -> new PreKeyReconciliation(readable.size(), purged.size(), regenerated));
    });
  }

  /**
   * Deletes the highest-numbered keys until the pool holds at most {@value #TARGET_PRE_KEYS}, notifying the server.
   *
   * @return a future that yields the number of keys removed
   */
  public CompletableFuture<Integer> trimExcessPreKeys() {
    return getAllPreKeyIds().thenCompose(ids -> {
      if (ids.size() <= TARGET_PRE_KEYS) {
        return CompletableFuture.completedFuture(0);
      }

      final List<Integer> excess = ids.subList(TARGET_PRE_KEYS, ids.size());
      logger.info("Trimming {} excess pre-keys", excess.size());

      return CompletableFuture.allOf(excess.stream()
              .map(id -> storage.delete(COLLECTION, storageKey(id))
                  .thenCompose(ignored -> keyServerClient.deletePreKey(id))
                  .exceptionally(throwable -> {
                    logger.warn("Failed to delete excess pre-key {} from server", id, ExceptionUtils.unwrap(throwable));
                    return null;
                  }))
              .toArray(CompletableFuture[]::new))
          .thenApply(ignored -> {
            healthState.updateCount(TARGET_PRE_KEYS, statusFor(TARGET_PRE_KEYS));
            return excess.size();
          });
    });
  }

  /**
   * Stores a single pre-key locally and optionally publishes it on its own.
   */
  public CompletableFuture<Void> storePreKey(final PreKeyRecord record, final boolean upload) {
    final CompletableFuture<Void> stored = storage.put(COLLECTION, storageKey(record.getId()), record.serialize());

    return upload
        ? stored.thenCompose(ignored -> keyServerClient.uploadPreKey(toEntity(record)))
        : stored;
  }

  /**
   * @return the IDs of all locally stored pre-keys in ascending order, without decoding any of them
   */
  public CompletableFuture<List<Integer>> getAllPreKeyIds() {
    return storage.listKeys(COLLECTION).thenApply(keys -> keys.stream()
        .filter(key -> key.startsWith(KEY_PREFIX))
        .map(key -> parseId(key.substring(KEY_PREFIX.length())))
        .flatMap(Optional::stream)
        .sorted()
        .toList());
  }

  public CompletableFuture<Integer> getPreKeyCount() {
    return getAllPreKeyIds().thenApply(List::size);
  }

  /**
   * @return {@code true} if a readable pre-key with the given ID exists; an unreadable one is purged
   */
  public CompletableFuture<Boolean> containsPreKey(final int preKeyId) {
    return readPreKey(preKeyId)
        .thenApply(Optional::isPresent)
        .exceptionally(throwable -> false);
  }

  /**
   * @return a future that yields the pre-key, or fails with {@link InvalidKeyIdException} if there is none or a
   * {@link KeyStorageCorruptedException} if it could not be read (it has been purged in that case)
   */
  public CompletableFuture<PreKeyRecord> loadPreKey(final int preKeyId) {
    return readPreKey(preKeyId).thenApply(maybeRecord -> maybeRecord.orElseThrow(() ->
        ExceptionUtils.wrap(new InvalidKeyIdException("No such pre-key: " + preKeyId))));
  }

  /**
   * Loads every readable pre-key. Unreadable keys are purged and skipped, unless every stored key is unreadable, in
   * which case the future fails with an {@link AllPreKeysCorruptedException}.
   */
  public CompletableFuture<List<PreKeyRecord>> getAllPreKeys() {
    return getAllPreKeyIds().thenCompose(ids -> {
      final List<Optional<PreKeyRecord>> results = Collections.synchronizedList(new ArrayList<>());
      final List<Integer> corrupted = Collections.synchronizedList(new ArrayList<>());

      return CompletableFuture.allOf(ids.stream()
              .map(id -> readPreKey(id)
                  .thenAccept(results::add)
                  .exceptionally(throwable -> {
                    corrupted.add(id);
                    return null;
                  }))
              .toArray(CompletableFuture[]::new))
          .thenApply(ignored -> {
            final List<PreKeyRecord> records = results.stream()
                .flatMap(Optional::stream)
                .sorted((a, b) -> Integer.compare(a.getId(), b.getId()))
                .toList();

            if (records.isEmpty() && !corrupted.isEmpty()) {
              healthState.markError("All pre-keys are unreadable");
              throw ExceptionUtils.wrap(new AllPreKeysCorruptedException(COLLECTION, corrupted.size()));
            }

            return records;
          });
    });
  }

  /**
   * @return the base64-encoded public key of every readable pre-key, by ID
   */
  public CompletableFuture<Map<Integer, String>> getPreKeyFingerprints() {
    return getAllPreKeys().thenApply(records -> {
      final Map<Integer, String> fingerprints = new LinkedHashMap<>();
      records.forEach(record -> fingerprints.put(record.getId(),
          Base64.getEncoder().encodeToString(toEntity(record).serializedPublicKey())));

      return fingerprints;
    });
  }

  /**
   * Compares the server's pre-key fingerprints with the local ones. Keys the server lacks or holds with a different
   * public key are published again; keys only the server holds are deleted from the server, since no peer could
   * complete a session with them.
   *
   * @param serverFingerprints the base64-encoded public key of every pre-key the server holds, by ID
   */
  public CompletableFuture<PreKeyFingerprintCheck> verifyFingerprints(final Map<Integer, String> serverFingerprints) {
    return getPreKeyFingerprints().thenCompose(localFingerprints -> {
      final List<Integer> onlyOnServer = serverFingerprints.keySet().stream()
          .filter(id -> !localFingerprints.containsKey(id))
          .sorted()
          .toList();

      final Set<Integer> toPublish = new HashSet<>();
      int matched = 0;

      for (final Map.Entry<Integer, String> local : localFingerprints.entrySet()) {
        final String onServer = serverFingerprints.get(local.getKey());

        if (local.getValue().equals(onServer)) {
          matched++;
        } else {
          if (onServer != null) {
            logger.warn("Pre-key {} on the server does not match the local key", local.getKey());
          }
          toPublish.add(local.getKey());
        }
      }

      final int matchedCount = matched;

      if (toPublish.isEmpty() && onlyOnServer.isEmpty()) {
        logger.debug("All {} pre-key fingerprints match", matchedCount);
        return CompletableFuture.completedFuture(new PreKeyFingerprintCheck(matchedCount, 0, 0));
      }

      logger.info("Pre-key fingerprints: {} matched, {} to publish, {} only on server", matchedCount,
          toPublish.size(), onlyOnServer.size());

      unpublishedIds.addAll(toPublish);

      return publishPending()
          .thenCompose(ignored -> CompletableFuture.allOf(onlyOnServer.stream()
                  .map(id -> keyServerClient.deletePreKey(id).exceptionally(throwable -> {
                    logger.warn("Failed to delete pre-key {} from server", id, ExceptionUtils.unwrap(throwable));
                    return null;
                  }))
                  .toArray(CompletableFuture[]::new)))
          .thenApply(ignored -> new PreKeyFingerprintCheck(matchedCount, toPublish.size(), onlyOnServer.size()));
    });
  }

  /**
   * Publishes every local pre-key, e.g. after the server lost its copies.
   *
   * @return a future that yields the number of keys published
   */
  public CompletableFuture<Integer> publishAll() {
    return getAllPreKeys().thenCompose(records -> records.isEmpty()
        ? CompletableFuture.completedFuture(0)
        : publish(records).thenApply(ignored -> records.size()));
  }

  @Override
  public String description() {
    return "pre-keys";
  }

  @Override
  public CompletableFuture<Void> deleteAllLocal() {
    return getAllPreKeyIds()
        .thenCompose(ids -> CompletableFuture.allOf(ids.stream()
            .map(id -> storage.delete(COLLECTION, storageKey(id)))
            .toArray(CompletableFuture[]::new)))
        .thenRun(() -> {
          unpublishedIds.clear();
          healthState.updateCount(0, KeyHealthStatus.LOW);
        });
  }

  public KeyHealthState getHealthState() {
    return healthState;
  }

  @VisibleForTesting
  Set<Integer> getUnpublishedIds() {
    return Set.copyOf(unpublishedIds);
  }

  @VisibleForTesting
  CompletableFuture<Void> getBackgroundCheck() {
    return backgroundCheck;
  }

  /**
   * Chooses IDs for {@code needed} new keys given the IDs already in use.
   */
  @VisibleForTesting
  static List<Integer> assignIds(final List<Integer> existingIds, final int needed) {
    final int maxId = existingIds.stream().mapToInt(Integer::intValue).max().orElse(-1);

    if (maxId >= WRAP_THRESHOLD) {
      logger.warn("Pre-key IDs reached {}; reusing unused IDs from 0", maxId);
      Metrics.counter(WRAP_COUNTER_NAME).increment();

      return findGapsFromZero(existingIds, needed);
    }

    return IntStream.range(maxId + 1, maxId + 1 + needed).boxed().toList();
  }

  @VisibleForTesting
  static List<Integer> findGapsFromZero(final Collection<Integer> existingIds, final int needed) {
    final Set<Integer> used = new HashSet<>(existingIds);
    final List<Integer> gaps = new ArrayList<>(needed);

    for (int id = 0; gaps.size() < needed && id <= MAX_PRE_KEY_ID; id++) {
      if (!used.contains(id)) {
        gaps.add(id);
      }
    }

    return gaps;
  }

  /**
   * Groups IDs into maximal runs of consecutive values, e.g. {@code [1, 2, 3, 7, 8, 15]} becomes
   * {@code [1..3], [7..8], [15..15]}.
   */
  @VisibleForTesting
  static List<IdRange> contiguousRanges(final List<Integer> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }

    final List<Integer> sorted = ids.stream().sorted().toList();
    final List<IdRange> ranges = new ArrayList<>();

    int start = sorted.get(0);
    int end = start;

    for (final int id : sorted.subList(1, sorted.size())) {
      if (id == end + 1) {
        end = id;
      } else {
        ranges.add(new IdRange(start, end));
        start = id;
        end = id;
      }
    }

    ranges.add(new IdRange(start, end));
    return ranges;
  }

  @VisibleForTesting
  record IdRange(int start, int end) {

    int size() {
      return end - start + 1;
    }
  }

  private CompletableFuture<List<PreKeyRecord>> generateAndStore(final List<Integer> ids) {
    final List<PreKeyRecord> records = new ArrayList<>(ids.size());

    for (final IdRange range : contiguousRanges(ids)) {
      logger.debug("Generating pre-keys {}-{}", range.start(), range.end());

      for (int id = range.start(); id <= range.end(); id++) {
        records.add(new PreKeyRecord(id, Curve.generateKeyPair()));
      }
    }

    Metrics.counter(GENERATED_COUNTER_NAME).increment(records.size());
    records.forEach(record -> unpublishedIds.add(record.getId()));

    return CompletableFuture.allOf(records.stream()
            .map(record -> storage.put(COLLECTION, storageKey(record.getId()), record.serialize()))
            .toArray(CompletableFuture[]::new))
        .thenApply(ignored -> records);
  }

  /**
   * Publishes the keys a failed upload left behind, along with freshly generated ones. IDs that are no longer stored or
   * cannot be read are dropped.
   */
  private CompletableFuture<Void> publishPending() {
    if (unpublishedIds.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }

    final List<Integer> pending = unpublishedIds.stream().sorted().toList();
    final List<PreKeyRecord> readable = Collections.synchronizedList(new ArrayList<>());

    return CompletableFuture.allOf(pending.stream()
            .map(id -> readPreKey(id)
                .thenAccept(maybeRecord -> maybeRecord.ifPresentOrElse(readable::add,
                    () -> unpublishedIds.remove(id)))
                .exceptionally(throwable -> {
                  unpublishedIds.remove(id);
                  return null;
                }))
            .toArray(CompletableFuture[]::new))
        .thenCompose(ignored -> {
          if (readable.isEmpty()) {
            return CompletableFuture.completedFuture(null);
          }

          readable.sort((a, b) -> Integer.compare(a.getId(), b.getId()));
          return publish(readable);
        });
  }

  private CompletableFuture<Void> publish(final List<PreKeyRecord> records) {
    final List<PreKeyEntity> entities = records.stream().map(PreKeyStore::toEntity).toList();
    final List<Integer> ids = records.stream().map(PreKeyRecord::getId).toList();

    return keyServerClient.uploadPreKeys(entities).whenComplete((ignored, throwable) -> {
      if (throwable != null) {
        unpublishedIds.addAll(ids);
        Metrics.counter(UPLOAD_FAILED_COUNTER_NAME).increment();
        logger.error("Failed to publish {} pre-keys; they remain stored locally", entities.size());
      } else {
        ids.forEach(unpublishedIds::remove);
        logger.info("Published {} pre-keys", entities.size());
      }
    });
  }

  /**
   * Reads and decodes a pre-key. An unreadable record is purged and the future fails with a
   * {@link KeyStorageCorruptedException}.
   */
  private CompletableFuture<Optional<PreKeyRecord>> readPreKey(final int preKeyId) {
    final String key = storageKey(preKeyId);

    return storage.get(COLLECTION, key)
        .thenApply(maybeBytes -> maybeBytes.map(bytes -> {
          try {
            return new PreKeyRecord(bytes);
          } catch (final Exception e) {
            throw ExceptionUtils.wrap(new KeyStorageCorruptedException(COLLECTION, key, e));
          }
        }))
        .exceptionallyCompose(throwable -> {
          final Throwable cause = ExceptionUtils.unwrap(throwable);
          final KeyStorageCorruptedException corrupted = cause instanceof KeyStorageCorruptedException e
              ? e
              : new KeyStorageCorruptedException(COLLECTION, key, cause);

          logger.warn("Purging unreadable pre-key {}", preKeyId, cause);
          Metrics.counter(CORRUPTED_COUNTER_NAME).increment();

          return storage.delete(COLLECTION, key)
              .thenCompose(ignored -> CompletableFuture.<Optional<PreKeyRecord>>failedFuture(corrupted));
        });
  }

  private static PreKeyEntity toEntity(final PreKeyRecord record) {
    try {
      return new PreKeyEntity(record.getId(), record.getKeyPair().getPublicKey());
    } catch (final Exception e) {
      throw ExceptionUtils.wrap(new KeyStorageCorruptedException(COLLECTION, storageKey(record.getId()), e));
    }
  }

  private static KeyHealthStatus statusFor(final int count) {
    if (count < MIN_PRE_KEYS) {
      return KeyHealthStatus.LOW;
    }

    return count > TARGET_PRE_KEYS ? KeyHealthStatus.EXCESS : KeyHealthStatus.READY;
  }

  private static Optional<Integer> parseId(final String suffix) {
    try {
      return Optional.of(Integer.parseInt(suffix));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static String storageKey(final int preKeyId) {
    return KEY_PREFIX + preKeyId;
  }
}
