/*
 * Copyright 2023 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.signal.libsignal.protocol.ecc.ECPublicKey;
import org.whispersystems.keymanager.util.ECPublicKeyAdapter;

/**
 * The public half of a one-time pre-key as published to the key server.
 *
 * @param keyId the pre-key ID, in {@code [0, 2^24)}
 * @param publicKey the public key, serialized in libsignal's elliptic-curve format and base64-encoded on the wire
 */
public record PreKeyEntity(
    @JsonProperty("id")
    int keyId,

    @JsonProperty("data")
    @JsonSerialize(using = ECPublicKeyAdapter.Serializer.class)
    @JsonDeserialize(using = ECPublicKeyAdapter.Deserializer.class)
    ECPublicKey publicKey) implements PreKey<ECPublicKey> {

  @Override
  public byte[] serializedPublicKey() {
    return publicKey().serialize();
  }
}
