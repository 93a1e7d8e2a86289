/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

/**
 * Outcome of reconciling the local pre-key pool with the IDs the key server holds.
 *
 * @param uploaded number of local pre-keys the server was missing and that were uploaded
 * @param purged number of local pre-keys that could not be read and were deleted
 * @param regenerated number of pre-keys generated to replace purged ones
 */
public record PreKeyReconciliation(int uploaded, int purged, int regenerated) {
}
