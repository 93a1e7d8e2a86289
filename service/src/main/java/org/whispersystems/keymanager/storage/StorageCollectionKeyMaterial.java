/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import java.util.concurrent.CompletableFuture;

/**
 * Key material held by some other component in a dedicated storage collection, e.g. group sender keys. Clearing it
 * deletes every key in that collection.
 */
public class StorageCollectionKeyMaterial implements LocalKeyMaterial {

  public static final String SENDER_KEY_COLLECTION = "senderKeys";

  private final EncryptedKeyValueStore storage;
  private final String collection;

  public StorageCollectionKeyMaterial(final EncryptedKeyValueStore storage, final String collection) {
    this.storage = storage;
    this.collection = collection;
  }

  @Override
  public String description() {
    return collection;
  }

  @Override
  public CompletableFuture<Void> deleteAllLocal() {
    return storage.listKeys(collection)
        .thenCompose(keys -> CompletableFuture.allOf(keys.stream()
            .map(key -> storage.delete(collection, key))
            .toArray(CompletableFuture[]::new)));
  }
}
