/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import java.util.concurrent.CompletableFuture;

/**
 * A category of locally stored key material that becomes invalid when the identity key changes.
 */
public interface LocalKeyMaterial {

  String description();

  /**
   * Deletes every locally stored record of this category without notifying the key server.
   */
  CompletableFuture<Void> deleteAllLocal();
}
