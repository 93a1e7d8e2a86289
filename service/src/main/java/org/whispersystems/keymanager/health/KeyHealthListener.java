/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.health;

@FunctionalInterface
public interface KeyHealthListener {

  void onHealthChanged(KeyHealthSnapshot snapshot);
}
