/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

/**
 * Outcome of comparing the server's pre-key fingerprints with the local pool.
 *
 * @param matched keys held identically on both sides
 * @param republished local keys the server lacked or held with a different public key
 * @param removedFromServer keys only the server held
 */
public record PreKeyFingerprintCheck(int matched, int republished, int removedFromServer) {

  public int mismatches() {
    return republished + removedFromServer;
  }
}
