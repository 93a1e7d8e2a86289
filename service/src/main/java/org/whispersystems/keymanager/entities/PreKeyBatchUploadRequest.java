/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record PreKeyBatchUploadRequest(@JsonProperty("preKeys") List<PreKeyEntity> preKeys) {
}
