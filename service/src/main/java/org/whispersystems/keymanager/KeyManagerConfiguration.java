/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Valid;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotNull;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.whispersystems.keymanager.configuration.InvalidConfigurationException;
import org.whispersystems.keymanager.configuration.KeyServerClientConfiguration;
import org.whispersystems.keymanager.util.SystemMapper;

/**
 * Top-level configuration of a {@link org.whispersystems.keymanager.storage.KeyManager}, usually read from YAML.
 */
public class KeyManagerConfiguration {

  @JsonProperty
  @NotNull
  @Valid
  private KeyServerClientConfiguration keyServer;

  /**
   * How long a caller waits for an in-progress identity generation or regeneration before giving up.
   */
  @JsonProperty
  @NotNull
  private Duration regenerationLockTimeout = Duration.ofSeconds(30);

  /**
   * Whether sender-group keys are stored and must be purged along with the identity.
   */
  @JsonProperty
  private boolean senderKeysEnabled = false;

  public KeyManagerConfiguration() {
  }

  public KeyManagerConfiguration(final KeyServerClientConfiguration keyServer) {
    this.keyServer = keyServer;
  }

  public KeyServerClientConfiguration getKeyServer() {
    return keyServer;
  }

  public Duration getRegenerationLockTimeout() {
    return regenerationLockTimeout;
  }

  public void setRegenerationLockTimeout(final Duration regenerationLockTimeout) {
    this.regenerationLockTimeout = regenerationLockTimeout;
  }

  public boolean isSenderKeysEnabled() {
    return senderKeysEnabled;
  }

  public void setSenderKeysEnabled(final boolean senderKeysEnabled) {
    this.senderKeysEnabled = senderKeysEnabled;
  }

  /**
   * Reads and validates a YAML configuration.
   *
   * @throws IOException if the document cannot be read or parsed
   * @throws InvalidConfigurationException if the parsed configuration violates a constraint
   */
  public static KeyManagerConfiguration load(final InputStream yaml) throws IOException, InvalidConfigurationException {
    final KeyManagerConfiguration configuration =
        SystemMapper.yamlMapper().readValue(yaml, KeyManagerConfiguration.class);

    try (final ValidatorFactory validatorFactory = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory()) {

      final Validator validator = validatorFactory.getValidator();
      final Set<ConstraintViolation<KeyManagerConfiguration>> violations = validator.validate(configuration);

      if (!violations.isEmpty()) {
        throw new InvalidConfigurationException(violations.stream()
            .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
            .sorted(Comparator.naturalOrder())
            .collect(Collectors.toList()));
      }
    }

    return configuration;
  }
}
