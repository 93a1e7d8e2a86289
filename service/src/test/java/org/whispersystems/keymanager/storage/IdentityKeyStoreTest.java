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

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.signal.libsignal.protocol.IdentityKey;
import org.signal.libsignal.protocol.IdentityKeyPair;
import org.whispersystems.keymanager.health.KeyHealthState;
import org.whispersystems.keymanager.health.KeyHealthStatus;
import org.whispersystems.keymanager.http.KeyServerClient;
import org.whispersystems.keymanager.http.KeyServerException;

class IdentityKeyStoreTest {

  private InMemoryEncryptedKeyValueStore storage;
  private KeyServerClient keyServerClient;
  private KeyHealthState healthState;

  private IdentityKeyStore identityKeyStore;

  @BeforeEach
  void setUp() {
    storage = new InMemoryEncryptedKeyValueStore();
    keyServerClient = mock(KeyServerClient.class);
    healthState = new KeyHealthState("identity", Clock.systemUTC());

    when(keyServerClient.uploadIdentity(any(), anyInt())).thenReturn(CompletableFuture.completedFuture(null));
    when(keyServerClient.deleteAllKeys()).thenReturn(CompletableFuture.completedFuture(null));

    identityKeyStore = new IdentityKeyStore(storage, keyServerClient,
        new IdentityRegenerationLock(Duration.ofSeconds(30)), healthState);
  }

  @Test
  void getIdentityKeyPairGeneratesOnce() {
    final LocalIdentity first = identityKeyStore.getIdentityKeyPair().join();
    final LocalIdentity second = identityKeyStore.getIdentityKeyPair().join();

    assertThat(second).isSameAs(first);
    verify(keyServerClient).uploadIdentity(first.identityKey(), first.registrationId());

    assertThat(healthState.snapshot().status()).isEqualTo(KeyHealthStatus.READY);
    assertThat(healthState.snapshot().count()).isEqualTo(1);
  }

  @Test
  void getIdentityKeyPairLoadsPersistedIdentity() {
    final LocalIdentity generated = identityKeyStore.getIdentityKeyPair().join();

    final IdentityKeyStore reopened = new IdentityKeyStore(storage, keyServerClient,
        new IdentityRegenerationLock(Duration.ofSeconds(30)), new KeyHealthState("identity", Clock.systemUTC()));

    final LocalIdentity loaded = reopened.getIdentityKeyPair().join();

    assertThat(loaded.identityKey()).isEqualTo(generated.identityKey());
    assertThat(loaded.registrationId()).isEqualTo(generated.registrationId());
    verify(keyServerClient, times(1)).uploadIdentity(any(), anyInt());
  }

  @Test
  void concurrentCallsGenerateOnce() {
    final CompletableFuture<Void> upload = new CompletableFuture<>();
    when(keyServerClient.uploadIdentity(any(), anyInt())).thenReturn(upload);

    final CompletableFuture<LocalIdentity> first = identityKeyStore.getIdentityKeyPair();
    final CompletableFuture<LocalIdentity> second = identityKeyStore.getIdentityKeyPair();

    upload.complete(null);

    assertThat(first.join().identityKey()).isEqualTo(second.join().identityKey());
    verify(keyServerClient, times(1)).uploadIdentity(any(), anyInt());
  }

  @Test
  void publicationFailureKeepsIdentity() {
    when(keyServerClient.uploadIdentity(any(), anyInt()))
        .thenReturn(CompletableFuture.failedFuture(new KeyServerException("POST /signal/identity", 500)));

    assertThatThrownBy(() -> identityKeyStore.getIdentityKeyPair().join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(KeyServerException.class);

    assertThat(healthState.snapshot().status()).isEqualTo(KeyHealthStatus.ERROR);
    assertThat(identityKeyStore.hasIdentityKeyPair().join()).isTrue();

    // Persisted and cached despite the failed upload
    assertThat(identityKeyStore.getIdentityKeyPair().join()).isNotNull();
  }

  @Test
  void corruptedIdentity() {
    storage.put(IdentityKeyStore.IDENTITY_COLLECTION, IdentityKeyStore.IDENTITY_KEY_PAIR_KEY,
        "garbage".getBytes(StandardCharsets.UTF_8)).join();

    assertThatThrownBy(() -> identityKeyStore.getIdentityKeyPair().join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(IdentityKeyCorruptedException.class);

    assertThat(healthState.snapshot().status()).isEqualTo(KeyHealthStatus.ERROR);
    verify(keyServerClient, never()).uploadIdentity(any(), anyInt());

    // The corrupted identity is not replaced silently
    assertThat(identityKeyStore.hasIdentityKeyPair().join()).isTrue();
  }

  @Test
  void regenerateIdentityKeyPair() {
    final LocalIdentity original = identityKeyStore.getIdentityKeyPair().join();

    final LocalIdentity regenerated =
        identityKeyStore.regenerateIdentityKeyPair(new CleanupCascade(List.of(), keyServerClient)).join();

    assertThat(regenerated.identityKey()).isNotEqualTo(original.identityKey());
    assertThat(identityKeyStore.getIdentityKeyPair().join()).isSameAs(regenerated);
    assertThat(identityKeyStore.isRegenerating()).isFalse();

    verify(keyServerClient).deleteAllKeys();
    verify(keyServerClient).uploadIdentity(eq(regenerated.identityKey()), anyInt());
  }

  @Test
  void clearCacheReloads() {
    final LocalIdentity generated = identityKeyStore.getIdentityKeyPair().join();
    assertThat(identityKeyStore.isCached()).isTrue();

    identityKeyStore.clearCache();
    assertThat(identityKeyStore.isCached()).isFalse();

    assertThat(identityKeyStore.getIdentityKeyPair().join().identityKey()).isEqualTo(generated.identityKey());
    assertThat(identityKeyStore.getLocalRegistrationId().join()).isEqualTo(generated.registrationId());
    assertThat(identityKeyStore.getIdentityPublicKey().join()).isEqualTo(generated.encodedPublicKey());
  }

  @Test
  void trustOnFirstUse() {
    final IdentityKey first = IdentityKeyPair.generate().getPublicKey();
    final IdentityKey second = IdentityKeyPair.generate().getPublicKey();

    assertThat(identityKeyStore.isTrusted("alice", 1, first).join()).isTrue();
    assertThat(identityKeyStore.saveIdentity("alice", 1, first).join()).isTrue();

    assertThat(identityKeyStore.isTrusted("alice", 1, first).join()).isTrue();
    assertThat(identityKeyStore.isTrusted("alice", 1, second).join()).isFalse();
    assertThat(identityKeyStore.isTrusted("alice", 2, second).join()).isTrue();
    assertThat(identityKeyStore.isTrusted("alice", 1, null).join()).isFalse();
  }

  @Test
  void saveIdentityReportsChanges() {
    final IdentityKey first = IdentityKeyPair.generate().getPublicKey();
    final IdentityKey second = IdentityKeyPair.generate().getPublicKey();

    assertThat(identityKeyStore.saveIdentity("bob", 1, first).join()).isTrue();
    assertThat(identityKeyStore.saveIdentity("bob", 1, first).join()).isFalse();
    assertThat(identityKeyStore.saveIdentity("bob", 1, second).join()).isTrue();

    assertThat(identityKeyStore.getIdentity("bob", 1).join()).hasValue(second);

    identityKeyStore.removeIdentity("bob", 1).join();
    assertThat(identityKeyStore.getIdentity("bob", 1).join()).isEmpty();
  }

  @Test
  void corruptedRemoteIdentityPurged() {
    storage.put(IdentityKeyStore.TRUSTED_IDENTITY_COLLECTION, "identity_carol_1",
        new byte[]{1, 2, 3}).join();

    assertThat(identityKeyStore.getIdentity("carol", 1).join()).isEmpty();
    assertThat(storage.listKeys(IdentityKeyStore.TRUSTED_IDENTITY_COLLECTION).join()).isEmpty();
    assertThat(identityKeyStore.isTrusted("carol", 1, IdentityKeyPair.generate().getPublicKey()).join()).isTrue();
  }
}
