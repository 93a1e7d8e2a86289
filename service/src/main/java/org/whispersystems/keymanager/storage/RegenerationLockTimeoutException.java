/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import java.time.Duration;
import org.whispersystems.keymanager.KeyLifecycleException;

/**
 * A caller waited longer than the configured timeout for an in-flight identity regeneration to finish.
 */
public class RegenerationLockTimeoutException extends KeyLifecycleException {

  public RegenerationLockTimeoutException(final Duration timeout) {
    super("Timed out after " + timeout + " waiting for identity key regeneration");
  }
}
