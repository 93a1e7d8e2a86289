/*
 * Copyright 2023 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.entities;

import org.signal.libsignal.protocol.IdentityKey;

public interface SignedPreKey<K> extends PreKey<K> {

  /**
   * Length in bytes of a well-formed XEdDSA signature.
   */
  int SIGNATURE_LENGTH = 64;

  byte[] signature();

  default boolean signatureValid(final IdentityKey identityKey) {
    try {
      return identityKey.getPublicKey().verifySignature(serializedPublicKey(), signature());
    } catch (final Exception e) {
      return false;
    }
  }

  default boolean signatureWellFormed() {
    return signature() != null && signature().length == SIGNATURE_LENGTH;
  }
}
