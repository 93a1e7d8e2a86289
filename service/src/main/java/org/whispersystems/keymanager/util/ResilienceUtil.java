/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.util;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;
import org.whispersystems.keymanager.configuration.CircuitBreakerConfiguration;
import org.whispersystems.keymanager.configuration.RetryConfiguration;
import org.whispersystems.keymanager.metrics.MetricsUtil;

public class ResilienceUtil {

  private static final CircuitBreakerRegistry CIRCUIT_BREAKER_REGISTRY =
      CircuitBreakerRegistry.of(new CircuitBreakerConfiguration().toCircuitBreakerConfig());

  private static final RetryRegistry RETRY_REGISTRY =
      RetryRegistry.of(new RetryConfiguration().toRetryConfigBuilder().build());

  private static final ConcurrentMap<String, Set<Meter.Id>> METER_IDS_BY_BREAKER_NAME = new ConcurrentHashMap<>();
  private static final ConcurrentMap<String, Set<Meter.Id>> METER_IDS_BY_RETRY_NAME = new ConcurrentHashMap<>();

  private static final String BREAKER_CALL_COUNTER_NAME = MetricsUtil.name(ResilienceUtil.class, "breaker", "call");
  private static final String BREAKER_STATE_GAUGE_NAME = MetricsUtil.name(ResilienceUtil.class, "breaker", "state");
  private static final String RETRY_CALL_COUNTER_NAME = MetricsUtil.name(ResilienceUtil.class, "retry", "call");

  private static final String BREAKER_NAME_TAG_NAME = "breakerName";
  private static final String RETRY_NAME_TAG = "retryName";
  private static final String OUTCOME_TAG_NAME = "outcome";

  static {
    CIRCUIT_BREAKER_REGISTRY.getEventPublisher()
        .onEntryAdded(event -> addMetrics(event.getAddedEntry()))
        .onEntryRemoved(event -> removeMetrics(event.getRemovedEntry()))
        .onEntryReplaced(event -> {
          removeMetrics(event.getOldEntry());
          addMetrics(event.getNewEntry());
        });

    RETRY_REGISTRY.getEventPublisher()
        .onEntryAdded(event -> addMetrics(event.getAddedEntry()))
        .onEntryRemoved(event -> removeMetrics(event.getRemovedEntry()))
        .onEntryReplaced(event -> {
          removeMetrics(event.getOldEntry());
          addMetrics(event.getNewEntry());
        });
  }

  public static CircuitBreakerRegistry getCircuitBreakerRegistry() {
    return CIRCUIT_BREAKER_REGISTRY;
  }

  public static RetryRegistry getRetryRegistry() {
    return RETRY_REGISTRY;
  }

  /// Generates a standardized name for a `CircuitBreaker` or `Retry`.
  ///
  /// @param clazz the class to which the circuit breaker or retry belongs
  /// @param name the name of the circuit breaker or retry; may be `null`
  ///
  /// @return a standardized name for a `CircuitBreaker` or `Retry`
  public static String name(final Class<?> clazz, @Nullable final String name) {
    return name != null
        ? clazz.getSimpleName() + "/" + name
        : clazz.getSimpleName();
  }

  private static void addMetrics(final CircuitBreaker circuitBreaker) {
    final Set<Meter.Id> meterIds = new HashSet<>();

    meterIds.add(Gauge.builder(BREAKER_STATE_GAUGE_NAME, circuitBreaker, breaker -> switch (breaker.getState()) {
          case OPEN, HALF_OPEN, FORCED_OPEN -> 1;
          default -> 0;
        })
        .tag(BREAKER_NAME_TAG_NAME, circuitBreaker.getName())
        .register(Metrics.globalRegistry)
        .getId());

    final Counter successCounter = outcomeCounter(BREAKER_CALL_COUNTER_NAME, BREAKER_NAME_TAG_NAME,
        circuitBreaker.getName(), "success");
    final Counter failureCounter = outcomeCounter(BREAKER_CALL_COUNTER_NAME, BREAKER_NAME_TAG_NAME,
        circuitBreaker.getName(), "failure");
    final Counter unpermittedCounter = outcomeCounter(BREAKER_CALL_COUNTER_NAME, BREAKER_NAME_TAG_NAME,
        circuitBreaker.getName(), "unpermitted");

    circuitBreaker.getEventPublisher()
        .onSuccess(event -> successCounter.increment())
        .onError(event -> failureCounter.increment())
        .onCallNotPermitted(event -> unpermittedCounter.increment());

    meterIds.add(successCounter.getId());
    meterIds.add(failureCounter.getId());
    meterIds.add(unpermittedCounter.getId());

    METER_IDS_BY_BREAKER_NAME.put(circuitBreaker.getName(), meterIds);
  }

  private static void addMetrics(final Retry retry) {
    final Set<Meter.Id> meterIds = new HashSet<>();

    final Counter successCounter = outcomeCounter(RETRY_CALL_COUNTER_NAME, RETRY_NAME_TAG, retry.getName(), "success");
    final Counter retryCounter = outcomeCounter(RETRY_CALL_COUNTER_NAME, RETRY_NAME_TAG, retry.getName(), "retry");
    final Counter errorCounter = outcomeCounter(RETRY_CALL_COUNTER_NAME, RETRY_NAME_TAG, retry.getName(), "error");

    retry.getEventPublisher()
        .onSuccess(event -> successCounter.increment())
        .onRetry(event -> retryCounter.increment())
        .onError(event -> errorCounter.increment());

    meterIds.add(successCounter.getId());
    meterIds.add(retryCounter.getId());
    meterIds.add(errorCounter.getId());

    METER_IDS_BY_RETRY_NAME.put(retry.getName(), meterIds);
  }

  private static Counter outcomeCounter(final String counterName, final String nameTag, final String name,
      final String outcome) {

    return Counter.builder(counterName)
        .tag(nameTag, name)
        .tag(OUTCOME_TAG_NAME, outcome)
        .register(Metrics.globalRegistry);
  }

  private static void removeMetrics(final CircuitBreaker circuitBreaker) {
    removeMetrics(METER_IDS_BY_BREAKER_NAME.remove(circuitBreaker.getName()));
  }

  private static void removeMetrics(final Retry retry) {
    removeMetrics(METER_IDS_BY_RETRY_NAME.remove(retry.getName()));
  }

  private static void removeMetrics(@Nullable final Set<Meter.Id> meterIds) {
    if (meterIds != null) {
      meterIds.forEach(Metrics.globalRegistry::remove);
    }
  }
}
