/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.health;

import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * An immutable view of one store's health at a point in time.
 *
 * @param store the name of the store this snapshot describes
 * @param status the store's current status
 * @param count the number of keys (or sessions) the store holds locally
 * @param busy whether the store is generating or rotating keys right now
 * @param lastError the message of the most recent failure, cleared by the next successful generation
 * @param lastCheckTime when the store last checked its own health
 * @param lastGenerationTime when the store last finished generating key material
 */
public record KeyHealthSnapshot(String store,
                                KeyHealthStatus status,
                                int count,
                                boolean busy,
                                @Nullable String lastError,
                                @Nullable Instant lastCheckTime,
                                @Nullable Instant lastGenerationTime) {

  public Optional<String> error() {
    return Optional.ofNullable(lastError);
  }
}
