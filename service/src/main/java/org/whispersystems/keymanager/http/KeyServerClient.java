/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.net.HttpHeaders;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntPredicate;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.signal.libsignal.protocol.IdentityKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.configuration.KeyServerClientConfiguration;
import org.whispersystems.keymanager.entities.IdentityUploadRequest;
import org.whispersystems.keymanager.entities.KeyServerStatus;
import org.whispersystems.keymanager.entities.PreKeyBatchUploadRequest;
import org.whispersystems.keymanager.entities.PreKeyEntity;
import org.whispersystems.keymanager.entities.SignedPreKeyEntity;
import org.whispersystems.keymanager.metrics.MetricsUtil;
import org.whispersystems.keymanager.util.ExceptionUtils;
import org.whispersystems.keymanager.util.HttpUtils;
import org.whispersystems.keymanager.util.SystemMapper;

/**
 * Typed, asynchronous access to the key server's REST endpoints. Every returned future either completes normally once
 * the server has acknowledged the request or fails with a {@link KeyServerException}.
 * <p>
 * A {@code 202 Accepted} means the server queued the write. It counts as success, but the returned future completes
 * only after a short settle time so that a status check issued right afterwards sees the write.
 */
public class KeyServerClient {

  private final FaultTolerantHttpClient httpClient;
  private final String baseUri;
  @Nullable private final String authToken;
  private final Duration acceptedSettleTime;

  private static final String REQUEST_COUNTER_NAME = MetricsUtil.name(KeyServerClient.class, "request");

  private static final TypeReference<List<SignedPreKeyEntity>> SIGNED_PRE_KEY_LIST = new TypeReference<>() {
  };

  private static final Logger logger = LoggerFactory.getLogger(KeyServerClient.class);

  public KeyServerClient(final KeyServerClientConfiguration configuration,
      final Executor httpExecutor,
      final ScheduledExecutorService retryExecutor) {

    this(FaultTolerantHttpClient.newBuilder("keyServer", httpExecutor)
            .withConnectTimeout(configuration.getConnectTimeout())
            .withRequestTimeout(configuration.getRequestTimeout())
            .withRetry(configuration.getRetry(), retryExecutor)
            .withCircuitBreaker(configuration.getCircuitBreaker())
            .build(),
        configuration.getBaseUri(),
        configuration.getAuthToken(),
        configuration.getAcceptedSettleTime());
  }

  @VisibleForTesting
  KeyServerClient(final FaultTolerantHttpClient httpClient,
      final URI baseUri,
      @Nullable final String authToken,
      final Duration acceptedSettleTime) {

    this.httpClient = httpClient;
    this.baseUri = StringUtils.removeEnd(baseUri.toString(), "/");
    this.authToken = authToken;
    this.acceptedSettleTime = acceptedSettleTime;
  }

  public CompletableFuture<Void> uploadIdentity(final IdentityKey identityKey, final int registrationId) {
    return send("POST", "/signal/identity", new IdentityUploadRequest(identityKey, registrationId),
        HttpUtils::isAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<Void> uploadPreKey(final PreKeyEntity preKey) {
    return send("POST", "/signal/prekey", preKey, HttpUtils::isAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<Void> uploadPreKeys(final List<PreKeyEntity> preKeys) {
    return send("POST", "/signal/prekeys/batch", new PreKeyBatchUploadRequest(preKeys), HttpUtils::isAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<Void> deletePreKey(final int preKeyId) {
    return send("DELETE", "/signal/prekey/" + preKeyId, null, HttpUtils::isDeletionAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<Void> uploadSignedPreKey(final SignedPreKeyEntity signedPreKey) {
    return send("POST", "/signal/signedprekey", signedPreKey, HttpUtils::isAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<Void> deleteSignedPreKey(final int signedPreKeyId) {
    return send("DELETE", "/signal/signedprekey/" + signedPreKeyId, null, HttpUtils::isDeletionAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<List<SignedPreKeyEntity>> getSignedPreKeys() {
    return send("GET", "/signal/signedprekeys", null, HttpUtils::isAcknowledged)
        .thenApply(response -> parse("GET /signal/signedprekeys", response.body(), SIGNED_PRE_KEY_LIST));
  }

  /**
   * Asks the server to delete every key (identity, signed pre-keys and pre-keys) it holds for this device.
   */
  public CompletableFuture<Void> deleteAllKeys() {
    return send("DELETE", "/api/signal/keys", null, HttpUtils::isDeletionAcknowledged)
        .thenAccept(ignored -> {});
  }

  public CompletableFuture<KeyServerStatus> getStatus() {
    return send("GET", "/signal/status/minimal", null, HttpUtils::isAcknowledged)
        .thenApply(response -> parse("GET /signal/status/minimal", response.body(),
            new TypeReference<KeyServerStatus>() {
            }));
  }

  private CompletableFuture<HttpResponse<String>> send(final String method,
      final String path,
      @Nullable final Object body,
      final IntPredicate acknowledged) {

    final String endpoint = method + " " + path;

    final HttpRequest.BodyPublisher bodyPublisher;

    try {
      bodyPublisher = body != null
          ? HttpRequest.BodyPublishers.ofString(SystemMapper.jsonMapper().writeValueAsString(body))
          : HttpRequest.BodyPublishers.noBody();
    } catch (final JsonProcessingException e) {
      // Only reachable if an entity's serializer is broken
      throw new IllegalArgumentException("Could not serialize request body for " + endpoint, e);
    }

    final HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
        .uri(URI.create(baseUri + path))
        .method(method, bodyPublisher)
        .header(HttpHeaders.ACCEPT, "application/json");

    if (body != null) {
      requestBuilder.header(HttpHeaders.CONTENT_TYPE, "application/json");
    }

    if (authToken != null) {
      requestBuilder.header(HttpHeaders.AUTHORIZATION, "Bearer " + authToken);
    }

    logger.debug("Sending {}", endpoint);

    return httpClient.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString())
        .handle((response, throwable) -> {
          if (throwable != null) {
            countRequest(method, path, "error");
            logger.warn("{} failed", endpoint, ExceptionUtils.unwrap(throwable));
            throw ExceptionUtils.wrap(new KeyServerException(endpoint, ExceptionUtils.unwrap(throwable)));
          }

          if (!acknowledged.test(response.statusCode())) {
            countRequest(method, path, "rejected");
            logger.warn("{} was not acknowledged; status {}", endpoint, response.statusCode());
            throw ExceptionUtils.wrap(new KeyServerException(endpoint, response.statusCode()));
          }

          countRequest(method, path, "success");
          return response;
        })
        .thenCompose(response -> {
          if (response.statusCode() != 202 || acceptedSettleTime.isZero()) {
            return CompletableFuture.completedFuture(response);
          }

          logger.debug("{} accepted for deferred processing; waiting {}", endpoint, acceptedSettleTime);

          return CompletableFuture.supplyAsync(() -> response,
              CompletableFuture.delayedExecutor(acceptedSettleTime.toMillis(), TimeUnit.MILLISECONDS));
        });
  }

  private static <T> T parse(final String endpoint, final String body, final TypeReference<T> type) {
    try {
      return SystemMapper.jsonMapper().readValue(body, type);
    } catch (final JsonProcessingException e) {
      throw ExceptionUtils.wrap(new KeyServerException(endpoint, e));
    }
  }

  private static void countRequest(final String method, final String path, final String outcome) {
    // Strip IDs from paths to keep tag cardinality bounded
    final String route = path.replaceAll("/\\d+$", "/{id}");
    Metrics.counter(REQUEST_COUNTER_NAME, Tags.of("method", method, "route", route, "outcome", outcome)).increment();
  }
}
