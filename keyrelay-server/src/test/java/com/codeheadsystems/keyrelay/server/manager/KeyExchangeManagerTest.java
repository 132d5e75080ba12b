package com.codeheadsystems.keyrelay.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.model.ErrorCode;
import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.model.KeyExchangeStatus;
import com.codeheadsystems.keyrelay.server.MutableClock;
import com.codeheadsystems.keyrelay.server.dispatch.NotificationDispatcher;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.KeyExchangeRequest;
import com.codeheadsystems.keyrelay.server.store.InMemoryKeyExchangeStore;
import com.codeheadsystems.keyrelay.server.store.KeyExchangeStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class KeyExchangeManagerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Duration TTL = Duration.ofMinutes(5);
  private static final Duration RETENTION = Duration.ofHours(1);

  @Mock private NotificationDispatcher dispatcher;

  private MutableClock clock;
  private InMemoryKeyExchangeStore store;
  private KeyExchangeManager manager;

  private static void assertCode(ThrowableAssert.ThrowingCallable call, ErrorCode code) {
    assertThatThrownBy(call)
        .isInstanceOfSatisfying(KeyRelayException.class, e -> assertThat(e.code()).isEqualTo(code));
  }

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    store = new InMemoryKeyExchangeStore();
    manager = new KeyExchangeManager(store, dispatcher, clock, TTL, RETENTION);
    when(dispatcher.deliver(any(), any(), anyMap())).thenReturn(DeliveryOutcome.UNDELIVERABLE);
  }

  @Test
  void scenario_initiateAcceptThenReject() {
    KeyExchangeReceipt receipt = manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    assertThat(receipt).isEqualTo(new KeyExchangeReceipt("req1", DeliveryOutcome.UNDELIVERABLE));
    assertThat(manager.find("req1")).get()
        .extracting(KeyExchangeRequest::status).isEqualTo(KeyExchangeStatus.PENDING);

    manager.accept("req1", "S-bob", "edata2");

    KeyExchangeRequest accepted = manager.find("req1").orElseThrow();
    assertThat(accepted.status()).isEqualTo(KeyExchangeStatus.ACCEPTED);
    assertThat(accepted.encryptedUserData()).isEqualTo("edata2");
    assertThat(accepted.respondedAt()).isEqualTo(T0);

    assertCode(() -> manager.reject("req1", "S-bob"), ErrorCode.INVALID_STATE);
    assertCode(() -> manager.accept("req1", "S-bob", "edata3"), ErrorCode.INVALID_STATE);
  }

  @Test
  void initiate_deliversRequestToRecipient() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    verify(dispatcher).deliver("S-bob", EventKind.KEY_EXCHANGE_REQUEST, Map.of(
        "requestId", "req1",
        "senderId", "S-alice",
        "publicKey", "pk1",
        "encryptedUserData", "edata1"));
  }

  @Test
  void initiate_withoutRequestId_assignsOne() {
    KeyExchangeReceipt receipt = manager.initiate("S-alice", "S-bob", "pk1", "edata1");

    assertThat(receipt.requestId()).isNotBlank();
    assertThat(manager.find(receipt.requestId())).isPresent();
  }

  @Test
  void initiate_sameParticipants_isInvalid() {
    assertCode(() -> manager.initiate("S-alice", "S-alice", "pk", "e"),
        ErrorCode.INVALID_PARTICIPANTS);
    verifyNoInteractions(dispatcher);
  }

  @Test
  void initiate_missingField_isInvalidRequest() {
    assertCode(() -> manager.initiate("S-alice", "S-bob", null, "e"), ErrorCode.INVALID_REQUEST);
    assertCode(() -> manager.initiate("S-alice", " ", "pk", "e"), ErrorCode.INVALID_REQUEST);
  }

  @Test
  void initiate_pendingPairEitherDirection_isDuplicate() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    assertCode(() -> manager.initiate("S-alice", "S-bob", "pk", "e"), ErrorCode.DUPLICATE_PENDING);
    assertCode(() -> manager.initiate("S-bob", "S-alice", "pk", "e"), ErrorCode.DUPLICATE_PENDING);
    assertThat(manager.find("req1")).get()
        .extracting(KeyExchangeRequest::senderId).isEqualTo("S-alice");
  }

  @Test
  void initiate_reusedRequestId_isDuplicateRequestId() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    assertCode(() -> manager.initiate("req1", "S-carol", "S-dave", "pk", "e"),
        ErrorCode.DUPLICATE_REQUEST_ID);
  }

  @Test
  void accept_unknownRequest_isNotFound() {
    assertCode(() -> manager.accept("nope", "S-bob", null), ErrorCode.NOT_FOUND);
    assertCode(() -> manager.reject("nope", "S-bob"), ErrorCode.NOT_FOUND);
  }

  @Test
  void accept_wrongRecipient_isNotRecipient() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    assertCode(() -> manager.accept("req1", "S-alice", null), ErrorCode.NOT_RECIPIENT);
    assertCode(() -> manager.reject("req1", "S-mallory"), ErrorCode.NOT_RECIPIENT);
    assertThat(manager.find("req1")).get().extracting(KeyExchangeRequest::isPending).isEqualTo(true);
  }

  @Test
  void accept_notifiesSenderWithRecipientPayload() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");
    when(dispatcher.deliver(eq("S-alice"), eq(EventKind.KEY_EXCHANGE_ACCEPTED), anyMap()))
        .thenReturn(DeliveryOutcome.DELIVERED);

    DeliveryOutcome outcome = manager.accept("req1", "S-bob", "edata2");

    assertThat(outcome).isEqualTo(DeliveryOutcome.DELIVERED);
    verify(dispatcher).deliver("S-alice", EventKind.KEY_EXCHANGE_ACCEPTED, Map.of(
        "requestId", "req1", "recipientId", "S-bob", "encryptedUserData", "edata2"));
  }

  @Test
  void accept_withoutPayload_keepsStoredData() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    manager.accept("req1", "S-bob", null);

    assertThat(manager.find("req1").orElseThrow().encryptedUserData()).isEqualTo("edata1");
    verify(dispatcher).deliver("S-alice", EventKind.KEY_EXCHANGE_ACCEPTED,
        Map.of("requestId", "req1", "recipientId", "S-bob"));
  }

  @Test
  void reject_notifiesSenderWithoutPayload() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");

    manager.reject("req1", "S-bob");

    assertThat(manager.find("req1").orElseThrow().status()).isEqualTo(KeyExchangeStatus.REJECTED);
    verify(dispatcher).deliver("S-alice", EventKind.KEY_EXCHANGE_REJECTED,
        Map.of("requestId", "req1", "recipientId", "S-bob"));
  }

  @Test
  void terminalRequest_freesPairForNewInitiate() {
    manager.initiate("req1", "S-alice", "S-bob", "pk1", "edata1");
    manager.reject("req1", "S-bob");

    assertThat(manager.initiate("req2", "S-bob", "S-alice", "pk2", "edata2").requestId())
        .isEqualTo("req2");
  }

  @Test
  void expire_sweepsOnlyRequestsPastTtl_silently() {
    manager.initiate("old", "S-alice", "S-bob", "pk", "e");
    clock.advance(Duration.ofMinutes(4));
    manager.initiate("fresh", "S-carol", "S-bob", "pk", "e");
    clock.advance(Duration.ofMinutes(2));

    assertThat(manager.expire(clock.instant())).isEqualTo(1);
    assertThat(manager.expire(clock.instant())).isZero();

    KeyExchangeRequest old = manager.find("old").orElseThrow();
    assertThat(old.status()).isEqualTo(KeyExchangeStatus.EXPIRED);
    assertThat(old.respondedAt()).isEqualTo(clock.instant());
    assertThat(manager.find("fresh").orElseThrow().isPending()).isTrue();
    assertCode(() -> manager.accept("old", "S-bob", null), ErrorCode.INVALID_STATE);
    assertCode(() -> manager.reject("old", "S-bob"), ErrorCode.INVALID_STATE);
    verify(dispatcher, never()).deliver(eq("S-alice"), any(), anyMap());
    assertThat(manager.lastSweepAt()).contains(clock.instant());
  }

  @Test
  void expire_purgesTerminalRecordsPastRetention() {
    manager.initiate("req1", "S-alice", "S-bob", "pk", "e");
    manager.reject("req1", "S-bob");
    clock.advance(RETENTION.plusSeconds(1));

    manager.expire(clock.instant());

    assertThat(manager.find("req1")).isEmpty();
  }

  @Test
  void accept_pastTtlBeforeSweep_expiresLazily() {
    manager.initiate("req1", "S-alice", "S-bob", "pk", "e");
    clock.advance(TTL.plusSeconds(1));

    assertCode(() -> manager.accept("req1", "S-bob", "e2"), ErrorCode.INVALID_STATE);
    assertThat(manager.find("req1").orElseThrow().status()).isEqualTo(KeyExchangeStatus.EXPIRED);
    verify(dispatcher, never()).deliver(eq("S-alice"), any(), anyMap());
  }

  @Test
  @SuppressWarnings("unchecked")
  void pendingFor_andRedeliver() {
    manager.initiate("r1", "S-alice", "S-bob", "pk", "e");
    clock.advance(Duration.ofSeconds(1));
    manager.initiate("r2", "S-carol", "S-bob", "pk", "e");
    manager.initiate("r3", "S-bob", "S-dave", "pk", "e");

    assertThat(manager.pendingFor("S-bob"))
        .extracting(KeyExchangeRequest::requestId).containsExactly("r1", "r2");

    assertThat(manager.redeliverPending("S-bob")).isEqualTo(2);
    ArgumentCaptor<Map<String, String>> payloads = ArgumentCaptor.forClass(Map.class);
    verify(dispatcher, times(4))
        .deliver(eq("S-bob"), eq(EventKind.KEY_EXCHANGE_REQUEST), payloads.capture());
    assertThat(payloads.getAllValues()).extracting(p -> p.get("requestId"))
        .containsExactly("r1", "r2", "r1", "r2");
  }

  @Test
  void concurrentAcceptAndReject_exactlyOneWins() throws Exception {
    for (int round = 0; round < 50; round++) {
      String id = "race-" + round;
      manager.initiate(id, "S-alice", "S-bob", "pk", "e");
      CountDownLatch start = new CountDownLatch(1);
      ExecutorService pool = Executors.newFixedThreadPool(2);
      try {
        List<Callable<Boolean>> calls = List.of(
            () -> attempt(start, () -> manager.accept(id, "S-bob", "e2")),
            () -> attempt(start, () -> manager.reject(id, "S-bob")));
        List<Future<Boolean>> futures = new ArrayList<>();
        calls.forEach(call -> futures.add(pool.submit(call)));
        start.countDown();

        int wins = 0;
        for (Future<Boolean> future : futures) {
          wins += future.get() ? 1 : 0;
        }
        assertThat(wins).isEqualTo(1);
        assertThat(manager.find(id).orElseThrow().isPending()).isFalse();
      } finally {
        pool.shutdownNow();
      }
      manager.expire(clock.instant().plus(RETENTION).plus(RETENTION));
    }
  }

  @Test
  void expire_whileAnotherSweepRuns_returnsZeroWithoutTouchingStore() throws Exception {
    KeyExchangeStore blockingStore = mock(KeyExchangeStore.class);
    KeyExchangeManager sweeping =
        new KeyExchangeManager(blockingStore, dispatcher, clock, TTL, RETENTION);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(blockingStore.findPendingCreatedBefore(any())).thenAnswer(invocation -> {
      entered.countDown();
      release.await();
      return List.of();
    });

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<Integer> first = pool.submit(() -> sweeping.expire(T0));
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(sweeping.expire(T0)).isZero();
      verify(blockingStore, times(1)).findPendingCreatedBefore(any());
      verify(blockingStore, never()).findTerminalRespondedBefore(any());
      assertThat(sweeping.lastSweepAt()).isEmpty();

      release.countDown();
      assertThat(first.get(5, TimeUnit.SECONDS)).isZero();
      assertThat(sweeping.lastSweepAt()).contains(T0);
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
  }

  private boolean attempt(CountDownLatch start, Runnable action) throws InterruptedException {
    start.await();
    try {
      action.run();
      return true;
    } catch (KeyRelayException e) {
      assertThat(e.code()).isEqualTo(ErrorCode.INVALID_STATE);
      return false;
    }
  }
}
