/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

public enum CleanupCascadeState {
  IDLE,
  CLEANING_LOCAL,
  CLEANING_REMOTE,
  UPLOADING
}
