/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import org.signal.libsignal.protocol.state.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.health.KeyHealthStatus;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;

/**
 * Persists ratchet session state per peer device. Records are opaque here; an unreadable record is purged and the
 * session treated as never established.
 */
public class SessionStore implements LocalKeyMaterial {

  public static final int PRIMARY_DEVICE_ID = 1;

  static final String COLLECTION = "sessions";
  static final String KEY_PREFIX = "session_";

  private final EncryptedKeyValueStore storage;
  private final KeyHealthState healthState;

  private static final String CORRUPTED_COUNTER_NAME = MetricsUtil.name(SessionStore.class, "corrupted");

  private static final Logger logger = LoggerFactory.getLogger(SessionStore.class);

  public SessionStore(final EncryptedKeyValueStore storage, final KeyHealthState healthState) {
    this.storage = storage;
    this.healthState = healthState;
  }

  /**
   * @return the stored session, or a fresh empty record if none exists or the stored one is unreadable
   */
  public CompletableFuture<SessionRecord> loadSession(final String peerId, final int deviceId) {
    return readSession(peerId, deviceId).thenApply(maybeSession -> maybeSession.orElseGet(SessionRecord::new));
  }

  public CompletableFuture<Void> storeSession(final String peerId, final int deviceId, final SessionRecord session) {
    return storage.put(COLLECTION, storageKey(peerId, deviceId), session.serialize())
        .thenCompose(ignored -> refreshCount());
  }

  public CompletableFuture<Boolean> containsSession(final String peerId, final int deviceId) {
    return readSession(peerId, deviceId).thenApply(Optional::isPresent);
  }

  public CompletableFuture<Void> deleteSession(final String peerId, final int deviceId) {
    return storage.delete(COLLECTION, storageKey(peerId, deviceId))
        .thenCompose(ignored -> refreshCount());
  }

  /**
   * Deletes the sessions with every device of a peer, e.g. when the peer is blocked or removed.
   */
  public CompletableFuture<Void> deleteAllSessionsForPeer(final String peerId) {
    return listAddresses().thenCompose(addresses -> CompletableFuture.allOf(addresses.stream()
            .filter(address -> address.peerId().equals(peerId))
            .map(address -> storage.delete(COLLECTION, storageKey(address.peerId(), address.deviceId())))
            .toArray(CompletableFuture[]::new)))
        .thenCompose(ignored -> refreshCount());
  }

  public CompletableFuture<Void> deleteAllSessions() {
    return deleteAllLocal();
  }

  /**
   * Lists the devices of a peer this device has a session with, in ascending order.
   *
   * @param includePrimary whether to include the peer's primary device ({@value #PRIMARY_DEVICE_ID})
   */
  public CompletableFuture<List<Integer>> listDevices(final String peerId, final boolean includePrimary) {
    return listAddresses().thenApply(addresses -> addresses.stream()
        .filter(address -> address.peerId().equals(peerId))
        .map(SessionAddress::deviceId)
        .filter(deviceId -> includePrimary || deviceId != PRIMARY_DEVICE_ID)
        .sorted()
        .toList());
  }

  public CompletableFuture<Integer> getSessionCount() {
    return listAddresses().thenApply(List::size);
  }

  public CompletableFuture<Boolean> hasSessionsWith(final String peerId) {
    return listAddresses().thenApply(addresses -> addresses.stream()
        .anyMatch(address -> address.peerId().equals(peerId)));
  }

  public CompletableFuture<SortedSet<String>> getAllSessionPeers() {
    return listAddresses().thenApply(addresses -> {
      final SortedSet<String> peers = new TreeSet<>();
      addresses.forEach(address -> peers.add(address.peerId()));

      return peers;
    });
  }

  /**
   * @return every readable session with the given peer, by device ID
   */
  public CompletableFuture<SortedMap<Integer, SessionRecord>> getAllDeviceSessions(final String peerId) {
    return listDevices(peerId, true).thenCompose(deviceIds -> {
      final Map<Integer, SessionRecord> sessions = Collections.synchronizedMap(new TreeMap<>());

      return CompletableFuture.allOf(deviceIds.stream()
              .map(deviceId -> readSession(peerId, deviceId)
                  .thenAccept(maybeSession -> maybeSession.ifPresent(session -> sessions.put(deviceId, session))))
              .toArray(CompletableFuture[]::new))
          .thenApply(ignored -> new TreeMap<>(sessions));
    });
  }

  @Override
  public String description() {
    return "sessions";
  }

  @Override
  public CompletableFuture<Void> deleteAllLocal() {
    return storage.listKeys(COLLECTION)
        .thenCompose(keys -> CompletableFuture.allOf(keys.stream()
            .filter(key -> key.startsWith(KEY_PREFIX))
            .map(key -> storage.delete(COLLECTION, key))
            .toArray(CompletableFuture[]::new)))
        .thenRun(() -> healthState.updateCount(0, KeyHealthStatus.READY));
  }

  /**
   * Recounts stored sessions into the health state.
   */
  public CompletableFuture<Void> refreshCount() {
    return getSessionCount().thenAccept(count -> healthState.updateCount(count, KeyHealthStatus.READY));
  }

  public KeyHealthState getHealthState() {
    return healthState;
  }

  private CompletableFuture<Optional<SessionRecord>> readSession(final String peerId, final int deviceId) {
    final String key = storageKey(peerId, deviceId);

    return storage.get(COLLECTION, key)
        .thenApply(maybeBytes -> maybeBytes.map(bytes -> {
          try {
            return new SessionRecord(bytes);
          } catch (final Exception e) {
            throw ExceptionUtils.wrap(new KeyStorageCorruptedException(COLLECTION, key, e));
          }
        }))
        .exceptionallyCompose(throwable -> {
          logger.warn("Purging unreadable session with {}.{}", peerId, deviceId, ExceptionUtils.unwrap(throwable));
          Metrics.counter(CORRUPTED_COUNTER_NAME).increment();

          return storage.delete(COLLECTION, key).thenApply(ignored -> Optional.empty());
        });
  }

  private CompletableFuture<List<SessionAddress>> listAddresses() {
    return storage.listKeys(COLLECTION).thenApply(keys -> {
      final List<SessionAddress> addresses = new ArrayList<>();
      keys.forEach(key -> SessionAddress.fromStorageKey(key).ifPresent(addresses::add));

      return addresses;
    });
  }

  private static String storageKey(final String peerId, final int deviceId) {
    return KEY_PREFIX + peerId + "_" + deviceId;
  }

  private record SessionAddress(String peerId, int deviceId) {

    /**
     * Peer IDs may themselves contain underscores; the device ID follows the last one.
     */
    static Optional<SessionAddress> fromStorageKey(final String key) {
      if (!key.startsWith(KEY_PREFIX)) {
        return Optional.empty();
      }

      final String address = key.substring(KEY_PREFIX.length());
      final int separator = address.lastIndexOf('_');

      if (separator <= 0) {
        return Optional.empty();
      }

      try {
        return Optional.of(new SessionAddress(address.substring(0, separator),
            Integer.parseInt(address.substring(separator + 1))));
      } catch (final NumberFormatException e) {
        return Optional.empty();
      }
    }
  }
}
