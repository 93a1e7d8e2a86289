/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import java.util.Base64;
import org.signal.libsignal.protocol.IdentityKey;
import org.signal.libsignal.protocol.IdentityKeyPair;

/**
 * This device's long-term identity: its identity key pair and the registration ID published alongside it.
 */
public record LocalIdentity(IdentityKeyPair identityKeyPair, int registrationId) {

  public IdentityKey identityKey() {
    return identityKeyPair.getPublicKey();
  }

  /**
   * @return the serialized identity public key, base64-encoded as the key server reports it
   */
  public String encodedPublicKey() {
    return Base64.getEncoder().encodeToString(identityKey().serialize());
  }
}
