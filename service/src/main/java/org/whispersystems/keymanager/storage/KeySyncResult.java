/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

/**
 * What {@link KeyManager#validateAndSyncKeys} found and did.
 *
 * @param identityMismatch the server advertised an identity key other than this device's
 * @param keysRepublished the identity and all keys were published again
 * @param preKeysUploaded number of local pre-keys published to top up the server's pool
 * @param preKeysGenerated number of pre-keys generated to refill the local pool
 * @param preKeyMismatches number of pre-keys whose server copy was missing, different or unknown locally
 * @param signedPreKeyValid whether the server's signed pre-key checked out; {@code true} when it was just republished
 */
public record KeySyncResult(boolean identityMismatch,
                            boolean keysRepublished,
                            int preKeysUploaded,
                            int preKeysGenerated,
                            int preKeyMismatches,
                            boolean signedPreKeyValid) {
}
