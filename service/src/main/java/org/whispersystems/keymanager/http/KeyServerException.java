/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.http;

import java.util.OptionalInt;
import javax.annotation.Nullable;
import org.whispersystems.keymanager.KeyLifecycleException;

/**
 * Indicates that the key server could not be reached or did not acknowledge a request, after any configured retries.
 */
public class KeyServerException extends KeyLifecycleException {

  private final String endpoint;

  @Nullable
  private final Integer statusCode;

  public KeyServerException(final String endpoint, final int statusCode) {
    super(endpoint + " was not acknowledged (status " + statusCode + ")");

    this.endpoint = endpoint;
    this.statusCode = statusCode;
  }

  public KeyServerException(final String endpoint, final Throwable cause) {
    super(endpoint + " failed: " + cause.getMessage(), cause);

    this.endpoint = endpoint;
    this.statusCode = null;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public OptionalInt getStatusCode() {
    return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
  }
}
