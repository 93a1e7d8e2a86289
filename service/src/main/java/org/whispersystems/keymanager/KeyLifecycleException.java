/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager;

/**
 * Base type for every typed failure a key store or the key manager reports to its callers.
 */
public abstract class KeyLifecycleException extends Exception {

  protected KeyLifecycleException(final String message) {
    super(message);
  }

  protected KeyLifecycleException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
