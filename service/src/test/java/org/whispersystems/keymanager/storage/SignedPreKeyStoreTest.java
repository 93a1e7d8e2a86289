/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.signal.libsignal.protocol.IdentityKeyPair;
import org.signal.libsignal.protocol.InvalidKeyIdException;
import org.signal.libsignal.protocol.ecc.Curve;
import org.signal.libsignal.protocol.ecc.ECKeyPair;
import org.signal.libsignal.protocol.state.SignedPreKeyRecord;
import org.slf4j.LoggerFactory;
import org.whispersystems.keymanager.entities.KeyServerStatus;
import org.whispersystems.keymanager.entities.SignedPreKeyEntity;
import org.whispersystems.keymanager.events.KeyServerEventChannel;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.health.KeyHealthStatus;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.http.KeyServerException;
import org.whispersystems.keymanager.util.MutableClock;

class SignedPreKeyStoreTest {

  private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
  private static final IdentityKeyPair IDENTITY = IdentityKeyPair.generate();

  private MutableClock clock;
  private InMemoryEncryptedKeyValueStore storage;
  private KeyServerClient keyServerClient;
  private List<SignedPreKeyEntity> serverSignedPreKeys;
  private KeyHealthState healthState;

  private IdentityKeyStore identityKeyStore;
  private SignedPreKeyStore signedPreKeyStore;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    storage = new InMemoryEncryptedKeyValueStore();
    keyServerClient = mock(KeyServerClient.class);
    serverSignedPreKeys = new CopyOnWriteArrayList<>();
    healthState = new KeyHealthState("signedPreKeys", clock);

    when(keyServerClient.uploadIdentity(any(), anyInt())).thenReturn(CompletableFuture.completedFuture(null));
    when(keyServerClient.uploadSignedPreKey(any())).thenAnswer(invocation -> {
      final SignedPreKeyEntity uploaded = invocation.getArgument(0);
      serverSignedPreKeys.removeIf(entity -> entity.keyId() == uploaded.keyId());
      serverSignedPreKeys.add(uploaded);
      return CompletableFuture.completedFuture(null);
    });
    when(keyServerClient.deleteSignedPreKey(anyInt())).thenAnswer(invocation -> {
      final int id = invocation.getArgument(0);
      serverSignedPreKeys.removeIf(entity -> entity.keyId() == id);
      return CompletableFuture.completedFuture(null);
    });
    when(keyServerClient.getSignedPreKeys())
        .thenAnswer(invocation -> CompletableFuture.completedFuture(new ArrayList<>(serverSignedPreKeys)));

    identityKeyStore = new IdentityKeyStore(storage, keyServerClient,
        new IdentityRegenerationLock(Duration.ofSeconds(30)), new KeyHealthState("identity", clock));

    signedPreKeyStore = new SignedPreKeyStore(storage, keyServerClient, identityKeyStore, healthState, clock);
  }

  @Test
  void getCurrentGeneratesKeyZero() throws Exception {
    final SignedPreKeyRecord current = signedPreKeyStore.getCurrentSignedPreKey().join();

    assertThat(current.getId()).isZero();
    assertThat(current.getTimestamp()).isEqualTo(START.toEpochMilli());

    final IdentityKeyPair identity = identityKeyStore.getIdentityKeyPair().join().identityKeyPair();
    assertThat(identity.getPublicKey().getPublicKey()
        .verifySignature(current.getKeyPair().getPublicKey().serialize(), current.getSignature())).isTrue();

    verify(keyServerClient, times(1)).uploadSignedPreKey(any());
    assertThat(serverSignedPreKeys).extracting(SignedPreKeyEntity::keyId).containsExactly(0);
    assertThat(healthState.snapshot().status()).isEqualTo(KeyHealthStatus.READY);
  }

  @Test
  void getCurrentReturnsExistingKey() {
    final SignedPreKeyRecord first = signedPreKeyStore.getCurrentSignedPreKey().join();
    final SignedPreKeyRecord second = signedPreKeyStore.getCurrentSignedPreKey().join();

    assertThat(second.getId()).isEqualTo(first.getId());
    assertThat(second.serialize()).isEqualTo(first.serialize());
    verify(keyServerClient, times(1)).uploadSignedPreKey(any());
  }

  @Test
  void rotationBoundary() {
    assertThat(signedPreKeyStore.getCurrentSignedPreKey().join().getId()).isZero();

    clock.increment(Duration.ofDays(6).plusHours(23));
    assertThat(signedPreKeyStore.needsRotation().join()).isFalse();
    assertThat(signedPreKeyStore.getCurrentSignedPreKey().join().getId()).isZero();

    clock.increment(Duration.ofHours(2));
    assertThat(signedPreKeyStore.needsRotation().join()).isTrue();

    final SignedPreKeyRecord rotated = signedPreKeyStore.getCurrentSignedPreKey().join();
    assertThat(rotated.getId()).isEqualTo(1);
    assertThat(rotated.getTimestamp()).isEqualTo(clock.millis());
    assertThat(signedPreKeyStore.needsRotation().join()).isFalse();
  }

  @Test
  void retentionCaps() {
    signedPreKeyStore.getCurrentSignedPreKey().join();

    for (int i = 0; i < 5; i++) {
      clock.increment(Duration.ofDays(8));
      signedPreKeyStore.getCurrentSignedPreKey().join();

      assertThat(signedPreKeyStore.getSignedPreKeyCount().join())
          .isLessThanOrEqualTo(SignedPreKeyStore.MAX_LOCAL_SIGNED_PRE_KEYS);
      assertThat(serverSignedPreKeys.size()).isLessThanOrEqualTo(SignedPreKeyStore.MAX_SERVER_SIGNED_PRE_KEYS);
    }

    assertThat(signedPreKeyStore.loadAll().join()).extracting(SignedPreKeyRecord::getId).containsExactly(5, 4, 3);
    assertThat(serverSignedPreKeys).extracting(SignedPreKeyEntity::keyId).containsExactlyInAnyOrder(5, 4);
    assertThat(healthState.snapshot().count()).isEqualTo(3);
  }

  @Test
  void failedServerPruneIsNotReportedAsRemoved() {
    final Logger logger = (Logger) LoggerFactory.getLogger(SignedPreKeyStore.class);
    final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    try {
      when(keyServerClient.deleteSignedPreKey(anyInt()))
          .thenReturn(CompletableFuture.failedFuture(new KeyServerException("DELETE /signal/signedprekey/0", 500)));

      signedPreKeyStore.getCurrentSignedPreKey().join();
      clock.increment(Duration.ofDays(8));
      signedPreKeyStore.getCurrentSignedPreKey().join();
      clock.increment(Duration.ofDays(8));

      assertThat(signedPreKeyStore.getCurrentSignedPreKey().join().getId()).isEqualTo(2);
      verify(keyServerClient).deleteSignedPreKey(0);
      assertThat(serverSignedPreKeys).extracting(SignedPreKeyEntity::keyId).containsExactlyInAnyOrder(0, 1, 2);

      assertThat(appender.list)
          .extracting(ILoggingEvent::getFormattedMessage)
          .noneMatch(message -> message.startsWith("Removed signed pre-key"));

      assertThat(appender.list)
          .filteredOn(event -> event.getLevel() == Level.WARN)
          .isNotEmpty();
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void missingTimestampTriggersRotation() {
    final IdentityKeyPair identity = identityKeyStore.getIdentityKeyPair().join().identityKeyPair();
    final ECKeyPair keyPair = Curve.generateKeyPair();
    final SignedPreKeyRecord undated = new SignedPreKeyRecord(4, 0, keyPair,
        identity.getPrivateKey().calculateSignature(keyPair.getPublicKey().serialize()));

    storage.put(SignedPreKeyStore.COLLECTION, "signedprekey_4", undated.serialize()).join();

    assertThat(signedPreKeyStore.needsRotation().join()).isTrue();
    assertThat(signedPreKeyStore.getCurrentSignedPreKey().join().getId()).isEqualTo(5);
  }

  @Test
  void rotationUploadFailureKeepsCurrentKey() {
    final SignedPreKeyRecord original = signedPreKeyStore.getCurrentSignedPreKey().join();

    clock.increment(Duration.ofDays(7));
    when(keyServerClient.uploadSignedPreKey(any()))
        .thenReturn(CompletableFuture.failedFuture(new KeyServerException("POST /signal/signedprekey", 500)));

    assertThatThrownBy(() -> signedPreKeyStore.getCurrentSignedPreKey().join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(KeyServerException.class);

    assertThat(signedPreKeyStore.loadAll().join()).extracting(SignedPreKeyRecord::getId)
        .containsExactly(original.getId());
    assertThat(healthState.snapshot().status()).isEqualTo(KeyHealthStatus.ERROR);
  }

  @Test
  void validateAgainstServerAcceptsValidKey() throws Exception {
    final SignedPreKeyRecord current = signedPreKeyStore.getCurrentSignedPreKey().join();

    final KeyServerStatus.SignedPreKeyStatus advertised = new KeyServerStatus.SignedPreKeyStatus(current.getId(),
        encode(current.getKeyPair().getPublicKey().serialize()),
        encode(current.getSignature()));

    assertThat(signedPreKeyStore.validateAgainstServer(advertised).join()).isTrue();
    verify(keyServerClient, times(1)).uploadSignedPreKey(any());
  }

  @Test
  void validateAgainstServerRegeneratesInvalidKey() {
    clock.increment(Duration.ofMinutes(1));
    signedPreKeyStore.getCurrentSignedPreKey().join();
    clock.increment(Duration.ofDays(8));
    signedPreKeyStore.getCurrentSignedPreKey().join();

    final ECKeyPair keyPair = Curve.generateKeyPair();
    final KeyServerStatus.SignedPreKeyStatus advertised = new KeyServerStatus.SignedPreKeyStatus(1,
        encode(keyPair.getPublicKey().serialize()), encode(new byte[64]));

    clock.increment(Duration.ofMinutes(1));
    assertThat(signedPreKeyStore.validateAgainstServer(advertised).join()).isFalse();

    final ArgumentCaptor<SignedPreKeyEntity> uploadCaptor = ArgumentCaptor.forClass(SignedPreKeyEntity.class);
    verify(keyServerClient, times(3)).uploadSignedPreKey(uploadCaptor.capture());
    assertThat(uploadCaptor.getValue().keyId()).isZero();

    final SignedPreKeyRecord current = signedPreKeyStore.getCurrentSignedPreKey().join();
    assertThat(current.getId()).isZero();
    assertThat(current.getTimestamp()).isEqualTo(clock.millis());
  }

  @ParameterizedTest
  @MethodSource
  void findProblem(@Nullable final KeyServerStatus.SignedPreKeyStatus advertised, final Optional<String> expected) {
    assertThat(SignedPreKeyStore.findProblem(advertised, IDENTITY.getPublicKey())).isEqualTo(expected);
  }

  private static List<Arguments> findProblem() {
    final ECKeyPair keyPair = Curve.generateKeyPair();
    final String publicKey = encode(keyPair.getPublicKey().serialize());
    final byte[] signature = IDENTITY.getPrivateKey().calculateSignature(keyPair.getPublicKey().serialize());

    final byte[] truncated = new byte[63];
    System.arraycopy(signature, 0, truncated, 0, truncated.length);

    final byte[] tampered = signature.clone();
    tampered[10] ^= 0x01;

    return List.of(
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(7, publicKey, encode(signature)), Optional.empty()),
        Arguments.of(null, Optional.of("missing")),
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(null, publicKey, encode(signature)), Optional.of("missing")),
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(7, publicKey, null), Optional.of("missing")),
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(7, "not base64!", encode(signature)),
            Optional.of("malformed")),
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(7, encode(new byte[]{1, 2}), encode(signature)),
            Optional.of("malformed")),
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(7, publicKey, encode(truncated)),
            Optional.of("signatureLength")),
        Arguments.of(new KeyServerStatus.SignedPreKeyStatus(7, publicKey, encode(tampered)),
            Optional.of("badSignature")));
  }

  @Test
  void emptySignedPreKeyListingGeneratesKeyZero() {
    final KeyServerEventChannel eventChannel = mock(KeyServerEventChannel.class);
    when(eventChannel.subscribe(any(), any())).thenReturn(() -> {});

    signedPreKeyStore.subscribe(eventChannel);
    verify(eventChannel).subscribe(eq(SignedPreKeyStore.SIGNED_PRE_KEYS_RESPONSE_EVENT), any());

    signedPreKeyStore.handleSignedPreKeysResponse("[{\"id\":3}]");
    signedPreKeyStore.handleSignedPreKeysResponse("{\"not\":\"a listing\"}");
    signedPreKeyStore.handleSignedPreKeysResponse("not json");
    verify(keyServerClient, never()).uploadSignedPreKey(any());

    signedPreKeyStore.handleSignedPreKeysResponse("[]");

    assertThat(serverSignedPreKeys).extracting(SignedPreKeyEntity::keyId).containsExactly(0);
    assertThat(signedPreKeyStore.loadSignedPreKey(0).join().getId()).isZero();
  }

  @Test
  void loadSignedPreKey() {
    signedPreKeyStore.getCurrentSignedPreKey().join();

    assertThat(signedPreKeyStore.loadSignedPreKey(0).join().getId()).isZero();

    assertThatThrownBy(() -> signedPreKeyStore.loadSignedPreKey(9).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(InvalidKeyIdException.class);
  }

  @Test
  void corruptedSignedPreKeyPurged() {
    storage.put(SignedPreKeyStore.COLLECTION, "signedprekey_2", new byte[]{1, 2, 3}).join();

    assertThatThrownBy(() -> signedPreKeyStore.loadSignedPreKey(2).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(KeyStorageCorruptedException.class);

    assertThat(signedPreKeyStore.getSignedPreKeyCount().join()).isZero();
  }

  @Test
  void removeSignedPreKey() {
    signedPreKeyStore.getCurrentSignedPreKey().join();

    signedPreKeyStore.removeSignedPreKey(0).join();

    assertThat(signedPreKeyStore.getSignedPreKeyCount().join()).isZero();
    assertThat(serverSignedPreKeys).isEmpty();
  }

  @Test
  void publishCurrent() {
    final SignedPreKeyRecord generated = signedPreKeyStore.publishCurrent().join();
    final SignedPreKeyRecord republished = signedPreKeyStore.publishCurrent().join();

    assertThat(republished.getId()).isEqualTo(generated.getId());
    verify(keyServerClient, times(2)).uploadSignedPreKey(any());
  }

  @Test
  void deleteAllLocal() {
    signedPreKeyStore.getCurrentSignedPreKey().join();

    signedPreKeyStore.deleteAllLocal().join();

    assertThat(signedPreKeyStore.getSignedPreKeyCount().join()).isZero();
    assertThat(serverSignedPreKeys).hasSize(1);
  }

  private static String encode(final byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }
}
