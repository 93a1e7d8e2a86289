/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.configuration;

import java.util.List;
import org.whispersystems.keymanager.KeyLifecycleException;

public class InvalidConfigurationException extends KeyLifecycleException {

  private final List<String> violations;

  public InvalidConfigurationException(final List<String> violations) {
    super("Invalid configuration: " + String.join(", ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
