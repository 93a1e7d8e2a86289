/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.health;

public enum KeyHealthStatus {
  UNINITIALIZED,
  GENERATING,
  SYNCING,
  VALIDATING,
  HEALING,
  READY,
  /// fewer keys than the store's minimum
  LOW,
  /// more keys than the store's target
  EXCESS,
  ERROR
}
