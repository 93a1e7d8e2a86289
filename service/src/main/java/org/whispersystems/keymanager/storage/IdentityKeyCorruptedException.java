/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

/**
 * The device's own identity key pair is unreadable. Recovering from this means regenerating the identity and losing all
 * dependent key material, so it is never done automatically.
 */
public class IdentityKeyCorruptedException extends KeyStorageCorruptedException {

  public IdentityKeyCorruptedException(final String collection, final String key, final Throwable cause) {
    super(collection, key, cause);
  }
}
