/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class CircuitBreakerConfiguration {

  @JsonProperty
  @Min(1)
  @Max(100)
  private int failureRateThreshold = 50;

  @JsonProperty
  @Min(1)
  private int permittedNumberOfCallsInHalfOpenState = 5;

  @JsonProperty
  @Min(1)
  private int slidingWindowSize = 20;

  @JsonProperty
  @Min(1)
  private int slidingWindowMinimumNumberOfCalls = 20;

  @JsonProperty
  @NotNull
  private Duration waitDurationInOpenState = Duration.ofSeconds(10);

  public int getFailureRateThreshold() {
    return failureRateThreshold;
  }

  public int getPermittedNumberOfCallsInHalfOpenState() {
    return permittedNumberOfCallsInHalfOpenState;
  }

  public int getSlidingWindowSize() {
    return slidingWindowSize;
  }

  public int getSlidingWindowMinimumNumberOfCalls() {
    return slidingWindowMinimumNumberOfCalls;
  }

  public Duration getWaitDurationInOpenState() {
    return waitDurationInOpenState;
  }

  @VisibleForTesting
  public void setFailureRateThreshold(int failureRateThreshold) {
    this.failureRateThreshold = failureRateThreshold;
  }

  @VisibleForTesting
  public void setPermittedNumberOfCallsInHalfOpenState(int permittedNumberOfCallsInHalfOpenState) {
    this.permittedNumberOfCallsInHalfOpenState = permittedNumberOfCallsInHalfOpenState;
  }

  @VisibleForTesting
  public void setSlidingWindowSize(int size) {
    this.slidingWindowSize = size;
  }

  @VisibleForTesting
  public void setSlidingWindowMinimumNumberOfCalls(int size) {
    this.slidingWindowMinimumNumberOfCalls = size;
  }

  @VisibleForTesting
  public void setWaitDurationInOpenState(Duration duration) {
    this.waitDurationInOpenState = duration;
  }

  public CircuitBreakerConfig toCircuitBreakerConfig() {
    return CircuitBreakerConfig.custom()
        .failureRateThreshold(getFailureRateThreshold())
        .permittedNumberOfCallsInHalfOpenState(getPermittedNumberOfCallsInHalfOpenState())
        .waitDurationInOpenState(getWaitDurationInOpenState())
        .slidingWindow(getSlidingWindowSize(), getSlidingWindowMinimumNumberOfCalls(),
            CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .build();
  }
}
