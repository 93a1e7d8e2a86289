/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import org.whispersystems.keymanager.KeyLifecycleException;

/**
 * A stored record could not be decrypted or decoded.
 */
public class KeyStorageCorruptedException extends KeyLifecycleException {

  private final String collection;
  private final String key;

  public KeyStorageCorruptedException(final String collection, final String key, final Throwable cause) {
    super("Corrupted record " + collection + "/" + key, cause);

    this.collection = collection;
    this.key = key;
  }

  protected KeyStorageCorruptedException(final String collection, final String key, final String message) {
    super(message);

    this.collection = collection;
    this.key = key;
  }

  public String getCollection() {
    return collection;
  }

  public String getKey() {
    return key;
  }
}
