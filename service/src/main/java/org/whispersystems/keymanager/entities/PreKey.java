/*
 * Copyright 2023 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.entities;

public interface PreKey<K> {

  int keyId();

  K publicKey();

  byte[] serializedPublicKey();
}
