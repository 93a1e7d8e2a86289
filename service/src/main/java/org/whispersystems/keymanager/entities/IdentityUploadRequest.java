/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.entities;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.signal.libsignal.protocol.IdentityKey;
import org.whispersystems.keymanager.util.IdentityKeyAdapter;

/**
 * Publishes this device's identity public key and registration ID. The server expects the registration ID as a string.
 */
public record IdentityUploadRequest(
    @JsonProperty("publicKey")
    @JsonSerialize(using = IdentityKeyAdapter.Serializer.class)
    @JsonDeserialize(using = IdentityKeyAdapter.Deserializer.class)
    IdentityKey publicKey,

    @JsonProperty("registrationId")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    int registrationId) {
}
