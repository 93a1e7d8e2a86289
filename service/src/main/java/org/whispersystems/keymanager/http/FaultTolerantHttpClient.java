/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.http;

import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.whispersystems.keymanager.configuration.CircuitBreakerConfiguration;
import org.whispersystems.keymanager.configuration.RetryConfiguration;
import org.whispersystems.keymanager.util.ExceptionUtils;
import org.whispersystems.keymanager.util.HttpUtils;
import org.whispersystems.keymanager.util.ResilienceUtil;

/**
 * An asynchronous HTTP client whose requests pass through a circuit breaker and, optionally, a bounded retry. Requests
 * are retried when the server answers with a 5xx or 429 status or when sending fails with an {@link IOException}.
 */
public class FaultTolerantHttpClient {

  private final HttpClient httpClient;
  private final Duration defaultRequestTimeout;
  @Nullable private final ScheduledExecutorService retryExecutor;
  @Nullable private final Retry retry;
  private final CircuitBreaker breaker;

  public static Builder newBuilder(final String name, final Executor executor) {
    return new Builder(name, executor);
  }

  @VisibleForTesting
  FaultTolerantHttpClient(final HttpClient httpClient,
      final Duration defaultRequestTimeout,
      @Nullable final ScheduledExecutorService retryExecutor,
      @Nullable final Retry retry,
      final CircuitBreaker circuitBreaker) {

    this.httpClient = httpClient;
    this.defaultRequestTimeout = defaultRequestTimeout;
    this.retryExecutor = retryExecutor;
    this.retry = retry;
    this.breaker = circuitBreaker;
  }

  public <T> CompletableFuture<HttpResponse<T>> sendAsync(HttpRequest request,
      final HttpResponse.BodyHandler<T> bodyHandler) {

    if (request.timeout().isEmpty()) {
      request = HttpRequest.newBuilder(request, (name, value) -> true)
          .timeout(defaultRequestTimeout)
          .build();
    }

    final Supplier<CompletionStage<HttpResponse<T>>> asyncRequestSupplier = sendAsync(request, bodyHandler, httpClient);

    if (retry != null) {
      assert retryExecutor != null;

      return breaker.executeCompletionStage(retry.decorateCompletionStage(retryExecutor, asyncRequestSupplier))
          .toCompletableFuture();
    } else {
      return breaker.executeCompletionStage(asyncRequestSupplier).toCompletableFuture();
    }
  }

  private static <T> Supplier<CompletionStage<HttpResponse<T>>> sendAsync(final HttpRequest request,
      final HttpResponse.BodyHandler<T> bodyHandler, final HttpClient client) {

    return () -> client.sendAsync(request, bodyHandler);
  }

  public static class Builder {

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(60);

    private final String name;
    private final Executor executor;
    @Nullable private RetryConfiguration retryConfiguration;
    @Nullable private ScheduledExecutorService retryExecutor;
    @Nullable private CircuitBreakerConfiguration circuitBreakerConfiguration;

    private Builder(final String name, final Executor executor) {
      this.name = Objects.requireNonNull(name);
      this.executor = Objects.requireNonNull(executor);
    }

    public Builder withConnectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder withRequestTimeout(final Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder withRetry(final RetryConfiguration retryConfiguration,
        final ScheduledExecutorService retryExecutor) {

      this.retryConfiguration = retryConfiguration;
      this.retryExecutor = retryExecutor;

      return this;
    }

    public Builder withCircuitBreaker(@Nullable final CircuitBreakerConfiguration circuitBreakerConfiguration) {
      this.circuitBreakerConfiguration = circuitBreakerConfiguration;
      return this;
    }

    public FaultTolerantHttpClient build() {
      final HttpClient httpClient = HttpClient.newBuilder()
          .connectTimeout(connectTimeout)
          .followRedirects(HttpClient.Redirect.NEVER)
          .version(HttpClient.Version.HTTP_1_1)
          .executor(executor)
          .build();

      final String resilienceName = ResilienceUtil.name(FaultTolerantHttpClient.class, name);

      @Nullable final Retry retry;

      if (retryExecutor != null && retryConfiguration != null) {
        final RetryConfig.Builder<HttpResponse<?>> retryConfigBuilder = retryConfiguration.toRetryConfigBuilder();
        retryConfigBuilder.retryOnResult(response -> HttpUtils.isServerError(response.statusCode()));
        retryConfigBuilder.retryOnException(throwable -> ExceptionUtils.unwrap(throwable) instanceof IOException);

        retry = ResilienceUtil.getRetryRegistry().retry(resilienceName, retryConfigBuilder.build());
      } else {
        retry = null;
      }

      final CircuitBreaker circuitBreaker = circuitBreakerConfiguration != null
          ? ResilienceUtil.getCircuitBreakerRegistry()
              .circuitBreaker(resilienceName, circuitBreakerConfiguration.toCircuitBreakerConfig())
          : ResilienceUtil.getCircuitBreakerRegistry().circuitBreaker(resilienceName);

      return new FaultTolerantHttpClient(httpClient, requestTimeout, retryExecutor, retry, circuitBreaker);
    }
  }
}
