/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An encrypted, device-local key-value store. Values are encrypted on write and decrypted on read by the
 * implementation; a value that cannot be decrypted causes {@link #get(String, String)} to complete exceptionally.
 * Keys are namespaced by collection. There are no transactions: every call is independent.
 */
public interface EncryptedKeyValueStore {

  CompletableFuture<Optional<byte[]>> get(String collection, String key);

  CompletableFuture<Void> put(String collection, String key, byte[] value);

  CompletableFuture<Void> delete(String collection, String key);

  CompletableFuture<List<String>> listKeys(String collection);
}
