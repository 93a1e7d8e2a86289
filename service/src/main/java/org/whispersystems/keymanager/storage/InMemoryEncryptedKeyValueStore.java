/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A volatile {@link EncryptedKeyValueStore} that keeps values in memory. Suitable for tests and for ephemeral devices;
 * it does not encrypt anything.
 */
public class InMemoryEncryptedKeyValueStore implements EncryptedKeyValueStore {

  private final Map<String, Map<String, byte[]>> collections = new ConcurrentHashMap<>();

  @Override
  public CompletableFuture<Optional<byte[]>> get(final String collection, final String key) {
    return CompletableFuture.completedFuture(Optional.ofNullable(collection(collection).get(key))
        .map(byte[]::clone));
  }

  @Override
  public CompletableFuture<Void> put(final String collection, final String key, final byte[] value) {
    collection(collection).put(key, value.clone());
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Void> delete(final String collection, final String key) {
    collection(collection).remove(key);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<List<String>> listKeys(final String collection) {
    return CompletableFuture.completedFuture(List.copyOf(collection(collection).keySet()));
  }

  private Map<String, byte[]> collection(final String name) {
    return collections.computeIfAbsent(name, ignored -> new ConcurrentHashMap<>());
  }
}
