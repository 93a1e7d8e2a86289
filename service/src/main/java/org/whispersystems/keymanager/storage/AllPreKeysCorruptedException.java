/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

public class AllPreKeysCorruptedException extends KeyStorageCorruptedException {

  private final int corruptedCount;

  public AllPreKeysCorruptedException(final String collection, final int corruptedCount) {
    super(collection, "*", "All " + corruptedCount + " stored pre-keys are unreadable");

    this.corruptedCount = corruptedCount;
  }

  public int getCorruptedCount() {
    return corruptedCount;
  }
}
