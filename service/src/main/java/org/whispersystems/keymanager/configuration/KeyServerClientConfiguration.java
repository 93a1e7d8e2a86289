/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import javax.annotation.Nullable;

public class KeyServerClientConfiguration {

  @JsonProperty
  @NotNull
  private URI baseUri;

  /**
   * Bearer token sent with every request; omitted when absent.
   */
  @JsonProperty
  @Nullable
  private String authToken;

  @JsonProperty
  @NotNull
  private Duration connectTimeout = Duration.ofSeconds(10);

  @JsonProperty
  @NotNull
  private Duration requestTimeout = Duration.ofSeconds(30);

  /**
   * How long to wait after a {@code 202 Accepted} before treating the queued write as done.
   */
  @JsonProperty
  @NotNull
  private Duration acceptedSettleTime = Duration.ofSeconds(2);

  @JsonProperty
  @NotNull
  @Valid
  private RetryConfiguration retry = new RetryConfiguration();

  @JsonProperty
  @NotNull
  @Valid
  private CircuitBreakerConfiguration circuitBreaker = new CircuitBreakerConfiguration();

  public KeyServerClientConfiguration() {
  }

  public KeyServerClientConfiguration(final URI baseUri, @Nullable final String authToken) {
    this.baseUri = baseUri;
    this.authToken = authToken;
  }

  public URI getBaseUri() {
    return baseUri;
  }

  @Nullable
  public String getAuthToken() {
    return authToken;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public Duration getAcceptedSettleTime() {
    return acceptedSettleTime;
  }

  public RetryConfiguration getRetry() {
    return retry;
  }

  public void setRetry(final RetryConfiguration retry) {
    this.retry = retry;
  }

  public CircuitBreakerConfiguration getCircuitBreaker() {
    return circuitBreaker;
  }
}
