/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import org.whispersystems.keymanager.KeyLifecycleException;

/**
 * The key server advertises an identity key for this device that differs from the one held locally.
 */
public class IdentityKeyMismatchException extends KeyLifecycleException {

  public IdentityKeyMismatchException(final String localPublicKey, final String serverPublicKey) {
    super("Server identity key " + abbreviate(serverPublicKey) + " does not match local identity key "
        + abbreviate(localPublicKey));
  }

  private static String abbreviate(final String base64) {
    return base64.length() > 8 ? base64.substring(0, 8) + "..." : base64;
  }
}
