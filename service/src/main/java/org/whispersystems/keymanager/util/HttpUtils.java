/*
 * Copyright 2023 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.util;

public final class HttpUtils {

  private HttpUtils() {
    // utility class
  }

  /**
   * The key server acknowledges publications with 200, or with 202 when the write has been queued.
   */
  public static boolean isAcknowledged(final int statusCode) {
    return statusCode == 200 || statusCode == 202;
  }

  /**
   * Deletions are also acknowledged with 204.
   */
  public static boolean isDeletionAcknowledged(final int statusCode) {
    return isAcknowledged(statusCode) || statusCode == 204;
  }

  public static boolean isServerError(final int statusCode) {
    return statusCode >= 500 || statusCode == 429;
  }
}
