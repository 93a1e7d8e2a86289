/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.events;

import java.util.function.Consumer;

/**
 * The inbound side of the real-time connection to the key server. Events carry a name and a JSON payload.
 */
public interface KeyServerEventChannel {

  /**
   * Registers a handler for the named event. Handlers are invoked on the channel's delivery thread and must not block.
   *
   * @param event the event name, e.g. {@code getSignedPreKeysResponse}
   * @param handler receives the raw JSON payload of each matching event
   *
   * @return a handle that removes the subscription when run
   */
  Runnable subscribe(String event, Consumer<String> handler);
}
