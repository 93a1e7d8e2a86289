/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import java.net.URI;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.signal.libsignal.protocol.IdentityKeyPair;
import org.signal.libsignal.protocol.ecc.Curve;
import org.signal.libsignal.protocol.ecc.ECKeyPair;
import org.whispersystems.keymanager.configuration.RetryConfiguration;
import org.whispersystems.keymanager.entities.KeyServerStatus;
import org.whispersystems.keymanager.entities.PreKeyEntity;
import org.whispersystems.keymanager.entities.SignedPreKeyEntity;

class KeyServerClientTest {

  @RegisterExtension
  private final WireMockExtension wireMock = WireMockExtension.newInstance()
      .options(wireMockConfig().dynamicPort())
      .build();

  private ExecutorService httpExecutor;
  private ScheduledExecutorService retryExecutor;

  private FaultTolerantHttpClient httpClient;
  private KeyServerClient keyServerClient;

  private static final String AUTH_TOKEN = "secret-token";

  @BeforeEach
  void setUp() {
    httpExecutor = Executors.newSingleThreadExecutor();
    retryExecutor = Executors.newSingleThreadScheduledExecutor();

    final RetryConfiguration retryConfiguration = new RetryConfiguration();
    retryConfiguration.setWaitDuration(10);

    httpClient = FaultTolerantHttpClient.newBuilder("keyServerClientTest-" + UUID.randomUUID(), httpExecutor)
            .withRetry(retryConfiguration, retryExecutor)
            .build();

    keyServerClient =
        new KeyServerClient(httpClient, baseUri(), AUTH_TOKEN, Duration.ZERO);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    httpExecutor.shutdown();
    httpExecutor.awaitTermination(1, TimeUnit.SECONDS);
    retryExecutor.shutdown();
    retryExecutor.awaitTermination(1, TimeUnit.SECONDS);
  }

  @Test
  void uploadIdentity() {
    final IdentityKeyPair identityKeyPair = IdentityKeyPair.generate();
    final String encodedKey = Base64.getEncoder().encodeToString(identityKeyPair.getPublicKey().serialize());

    wireMock.stubFor(post(urlEqualTo("/signal/identity")).willReturn(aResponse().withStatus(200)));

    keyServerClient.uploadIdentity(identityKeyPair.getPublicKey(), 1234).join();

    wireMock.verify(1, postRequestedFor(urlEqualTo("/signal/identity"))
        .withHeader("Authorization", equalTo("Bearer " + AUTH_TOKEN))
        .withHeader("Content-Type", equalTo("application/json"))
        .withRequestBody(equalToJson("{\"publicKey\":\"" + encodedKey + "\",\"registrationId\":\"1234\"}")));
  }

  @Test
  void uploadPreKeysBatch() {
    final ECKeyPair first = Curve.generateKeyPair();
    final ECKeyPair second = Curve.generateKeyPair();

    wireMock.stubFor(post(urlEqualTo("/signal/prekeys/batch")).willReturn(aResponse().withStatus(202)));

    keyServerClient.uploadPreKeys(List.of(
        new PreKeyEntity(7, first.getPublicKey()),
        new PreKeyEntity(8, second.getPublicKey()))).join();

    wireMock.verify(1, postRequestedFor(urlEqualTo("/signal/prekeys/batch"))
        .withRequestBody(equalToJson("{\"preKeys\":["
            + "{\"id\":7,\"data\":\"" + encode(first.getPublicKey().serialize()) + "\"},"
            + "{\"id\":8,\"data\":\"" + encode(second.getPublicKey().serialize()) + "\"}]}")));
  }

  @Test
  void acceptedWaitsForSettleTime() {
    final KeyServerClient settlingClient =
        new KeyServerClient(httpClient, baseUri(), AUTH_TOKEN, Duration.ofMillis(300));

    wireMock.stubFor(post(urlEqualTo("/signal/prekeys/batch")).willReturn(aResponse().withStatus(202)));

    final long start = System.nanoTime();
    settlingClient.uploadPreKeys(List.of(new PreKeyEntity(1, Curve.generateKeyPair().getPublicKey()))).join();

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(300));
    wireMock.verify(1, postRequestedFor(urlEqualTo("/signal/prekeys/batch")));
  }

  @Test
  void okDoesNotWaitForSettleTime() {
    final KeyServerClient settlingClient =
        new KeyServerClient(httpClient, baseUri(), AUTH_TOKEN, Duration.ofMinutes(5));

    wireMock.stubFor(post(urlEqualTo("/signal/prekeys/batch")).willReturn(aResponse().withStatus(200)));

    assertThat(settlingClient.uploadPreKeys(List.of(new PreKeyEntity(1, Curve.generateKeyPair().getPublicKey()))))
        .succeedsWithin(Duration.ofSeconds(10));
  }

  @Test
  void uploadSignedPreKey() {
    final ECKeyPair keyPair = Curve.generateKeyPair();
    final byte[] signature = new byte[64];

    wireMock.stubFor(post(urlEqualTo("/signal/signedprekey")).willReturn(aResponse().withStatus(200)));

    keyServerClient.uploadSignedPreKey(new SignedPreKeyEntity(3, keyPair.getPublicKey(), signature)).join();

    wireMock.verify(1, postRequestedFor(urlEqualTo("/signal/signedprekey"))
        .withRequestBody(equalToJson("{\"id\":3,\"data\":\"" + encode(keyPair.getPublicKey().serialize())
            + "\",\"signature\":\"" + encode(signature) + "\"}")));
  }

  @ParameterizedTest
  @ValueSource(ints = {200, 202, 204})
  void deletePreKeyAcknowledged(final int status) {
    wireMock.stubFor(delete(urlEqualTo("/signal/prekey/17")).willReturn(aResponse().withStatus(status)));

    keyServerClient.deletePreKey(17).join();

    wireMock.verify(1, deleteRequestedFor(urlEqualTo("/signal/prekey/17")));
  }

  @Test
  void deleteAllKeys() {
    wireMock.stubFor(delete(urlEqualTo("/api/signal/keys")).willReturn(aResponse().withStatus(200)));

    keyServerClient.deleteAllKeys().join();

    wireMock.verify(1, deleteRequestedFor(urlEqualTo("/api/signal/keys")));
  }

  @Test
  void rejectedRequest() {
    wireMock.stubFor(post(urlEqualTo("/signal/prekey")).willReturn(aResponse().withStatus(400)));

    assertThatThrownBy(() -> keyServerClient.uploadPreKey(new PreKeyEntity(1, Curve.generateKeyPair().getPublicKey()))
        .join())
        .isInstanceOf(CompletionException.class)
        .satisfies(e -> {
          final KeyServerException keyServerException = (KeyServerException) e.getCause();
          assertThat(keyServerException.getEndpoint()).isEqualTo("POST /signal/prekey");
          assertThat(keyServerException.getStatusCode()).hasValue(400);
        });

    wireMock.verify(1, postRequestedFor(urlEqualTo("/signal/prekey")));
  }

  @Test
  void serverErrorRetriedThenFails() {
    wireMock.stubFor(post(urlEqualTo("/signal/prekeys/batch")).willReturn(aResponse().withStatus(503)));

    assertThatThrownBy(() -> keyServerClient.uploadPreKeys(List.of()).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(KeyServerException.class);

    wireMock.verify(3, postRequestedFor(urlEqualTo("/signal/prekeys/batch")));
  }

  @Test
  void getSignedPreKeys() {
    final ECKeyPair keyPair = Curve.generateKeyPair();
    final byte[] signature = new byte[64];
    signature[0] = 1;

    wireMock.stubFor(get(urlEqualTo("/signal/signedprekeys")).willReturn(aResponse()
        .withStatus(200)
        .withHeader("Content-Type", "application/json")
        .withBody("[{\"id\":4,\"data\":\"" + encode(keyPair.getPublicKey().serialize())
            + "\",\"signature\":\"" + encode(signature) + "\"}]")));

    assertThat(keyServerClient.getSignedPreKeys().join())
        .containsExactly(new SignedPreKeyEntity(4, keyPair.getPublicKey(), signature));
  }

  @Test
  void getStatus() {
    wireMock.stubFor(get(urlEqualTo("/signal/status/minimal")).willReturn(aResponse()
        .withStatus(200)
        .withHeader("Content-Type", "application/json")
        .withBody("""
            {
              "identity": true,
              "identityPublicKey": "BQ==",
              "preKeys": 42,
              "signedPreKey": {
                "signed_prekey_id": 3,
                "signed_prekey_data": "abc",
                "signed_prekey_signature": "def"
              },
              "preKeyFingerprints": {
                "1": "BQE=",
                "2": "BQI="
              },
              "unknownField": "ignored"
            }
            """)));

    final KeyServerStatus status = keyServerClient.getStatus().join();

    assertThat(status.identity()).isTrue();
    assertThat(status.identityPublicKey()).isEqualTo("BQ==");
    assertThat(status.preKeys()).isEqualTo(42);
    assertThat(status.signedPreKey()).isEqualTo(new KeyServerStatus.SignedPreKeyStatus(3, "abc", "def"));
    assertThat(status.preKeyFingerprints()).isEqualTo(Map.of(1, "BQE=", 2, "BQI="));
  }

  @Test
  void malformedResponse() {
    wireMock.stubFor(get(urlEqualTo("/signal/status/minimal")).willReturn(aResponse()
        .withStatus(200)
        .withBody("not json")));

    assertThatThrownBy(() -> keyServerClient.getStatus().join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(KeyServerException.class);
  }

  private URI baseUri() {
    return URI.create("http://localhost:" + wireMock.getPort() + "/");
  }

  private static String encode(final byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }
}
