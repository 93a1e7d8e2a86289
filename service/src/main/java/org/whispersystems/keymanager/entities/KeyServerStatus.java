/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The key server's summary of the key material it holds for this device.
 *
 * @param identity whether the server holds any identity key for this device
 * @param identityPublicKey the base64-encoded identity key the server advertises, if any
 * @param preKeys the number of one-time pre-keys the server still holds
 * @param signedPreKey the signed pre-key the server advertises, if any
 * @param preKeyFingerprints the base64-encoded public key of each pre-key the server holds, by ID, if reported
 */
public record KeyServerStatus(
    @JsonProperty("identity")
    boolean identity,

    @JsonProperty("identityPublicKey")
    @Nullable
    String identityPublicKey,

    @JsonProperty("preKeys")
    int preKeys,

    @JsonProperty("signedPreKey")
    @Nullable
    SignedPreKeyStatus signedPreKey,

    @JsonProperty("preKeyFingerprints")
    @Nullable
    Map<Integer, String> preKeyFingerprints) {

  /**
   * Fields are kept as raw base64 strings so that malformed server data can be detected and healed rather than
   * rejected at parse time.
   */
  public record SignedPreKeyStatus(
      @JsonProperty("signed_prekey_id")
      @Nullable
      Integer id,

      @JsonProperty("signed_prekey_data")
      @Nullable
      String publicKey,

      @JsonProperty("signed_prekey_signature")
      @Nullable
      String signature) {
  }
}
