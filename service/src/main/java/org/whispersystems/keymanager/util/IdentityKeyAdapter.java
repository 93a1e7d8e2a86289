/*
 * Copyright 2023 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.util;

import org.signal.libsignal.protocol.IdentityKey;
import org.signal.libsignal.protocol.InvalidKeyException;

public class IdentityKeyAdapter {

  public static class Serializer extends AbstractPublicKeySerializer<IdentityKey> {

    @Override
    protected byte[] serializePublicKey(final IdentityKey identityKey) {
      return identityKey.serialize();
    }
  }

  public static class Deserializer extends AbstractPublicKeyDeserializer<IdentityKey> {

    @Override
    protected IdentityKey deserializePublicKey(final byte[] publicKeyBytes) throws InvalidKeyException {
      return new IdentityKey(publicKeyBytes);
    }
  }
}
