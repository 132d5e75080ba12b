package com.codeheadsystems.keyrelay.server.manager;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.model.KeyExchangeStatus;
import com.codeheadsystems.keyrelay.server.dispatch.NotificationDispatcher;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.KeyExchangeRequest;
import com.codeheadsystems.keyrelay.server.store.KeyExchangeStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic key exchange registry.
 * <p>
 * Owns the {@code pending -> accepted | rejected | expired} lifecycle of every request and
 * notifies the other party through the {@link NotificationDispatcher} once a transition has
 * committed. Delivery outcomes are returned to the caller; they never undo a transition.
 * <p>
 * <strong>Exception contract</strong>: every validation failure is a {@link KeyRelayException}
 * carrying one of {@code INVALID_REQUEST}, {@code INVALID_PARTICIPANTS},
 * {@code DUPLICATE_PENDING}, {@code DUPLICATE_REQUEST_ID}, {@code NOT_FOUND},
 * {@code NOT_RECIPIENT} or {@code INVALID_STATE}.
 */
public class KeyExchangeManager {

  private static final Logger log = LoggerFactory.getLogger(KeyExchangeManager.class);

  private final KeyExchangeStore store;
  private final NotificationDispatcher dispatcher;
  private final Clock clock;
  private final Duration ttl;
  private final Duration retention;
  private final ReentrantLock sweepLock = new ReentrantLock();
  private volatile Instant lastSweepAt;

  /**
   * Instantiates a new Key exchange manager.
   *
   * @param store      request storage
   * @param dispatcher delivers events to sessions
   * @param clock      time source
   * @param ttl        how long a request may stay pending
   * @param retention  how long terminal requests are kept before purging
   */
  public KeyExchangeManager(final KeyExchangeStore store,
                            final NotificationDispatcher dispatcher,
                            final Clock clock,
                            final Duration ttl,
                            final Duration retention) {
    this.store = store;
    this.dispatcher = dispatcher;
    this.clock = clock;
    this.ttl = ttl;
    this.retention = retention;
    log.info("KeyExchangeManager({}, ttl={}, retention={})", store, ttl, retention);
  }

  private static void requireField(String name, String value) {
    if (value == null || value.isBlank()) {
      throw KeyRelayException.invalidRequest("Missing required field: " + name);
    }
  }

  /**
   * Initiates a key exchange with a server-assigned request identifier.
   *
   * @see #initiate(String, String, String, String, String)
   */
  public KeyExchangeReceipt initiate(String senderId, String recipientId, String publicKey,
                                     String encryptedUserData) {
    return initiate(null, senderId, recipientId, publicKey, encryptedUserData);
  }

  /**
   * Initiates a key exchange and delivers it to the recipient.
   *
   * @param requestId         client-suggested identifier, or null to have one assigned
   * @param senderId          initiating session
   * @param recipientId       addressed session
   * @param publicKey         sender's public key material
   * @param encryptedUserData sender's payload
   * @return the request identifier and the delivery outcome
   */
  public KeyExchangeReceipt initiate(String requestId, String senderId, String recipientId,
                                     String publicKey, String encryptedUserData) {
    requireField("senderId", senderId);
    requireField("recipientId", recipientId);
    requireField("publicKey", publicKey);
    requireField("encryptedUserData", encryptedUserData);
    if (senderId.equals(recipientId)) {
      throw KeyRelayException.invalidParticipants(senderId);
    }
    String id = (requestId == null || requestId.isBlank())
        ? UUID.randomUUID().toString()
        : requestId;

    KeyExchangeRequest request = KeyExchangeRequest.pending(id, senderId, recipientId, publicKey,
        encryptedUserData, clock.instant());
    switch (store.insertPending(request)) {
      case DUPLICATE_PENDING -> throw KeyRelayException.duplicatePending(senderId, recipientId);
      case DUPLICATE_REQUEST_ID -> throw KeyRelayException.duplicateRequestId(id);
      case INSERTED -> log.debug("initiate(requestId={}, sender={}, recipient={})",
          id, senderId, recipientId);
      default -> throw new IllegalStateException("Unhandled insert result");
    }

    DeliveryOutcome outcome = dispatcher.deliver(recipientId, EventKind.KEY_EXCHANGE_REQUEST,
        requestPayload(request));
    return new KeyExchangeReceipt(id, outcome);
  }

  /**
   * Accepts a pending request and notifies the sender.
   *
   * @param requestId         the request
   * @param recipientId       the caller; must be the stored recipient
   * @param encryptedUserData recipient's reciprocal payload, or null to keep the stored payload
   * @return how the acceptance reached the sender
   */
  public DeliveryOutcome accept(String requestId, String recipientId, String encryptedUserData) {
    KeyExchangeRequest accepted = respond(requestId, recipientId,
        (current, now) -> current.accepted(encryptedUserData, now));
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put("requestId", accepted.requestId());
    payload.put("recipientId", accepted.recipientId());
    if (encryptedUserData != null) {
      payload.put("encryptedUserData", encryptedUserData);
    }
    return dispatcher.deliver(accepted.senderId(), EventKind.KEY_EXCHANGE_ACCEPTED, payload);
  }

  /**
   * Rejects a pending request and notifies the sender.
   *
   * @param requestId   the request
   * @param recipientId the caller; must be the stored recipient
   * @return how the rejection reached the sender
   */
  public DeliveryOutcome reject(String requestId, String recipientId) {
    KeyExchangeRequest rejected = respond(requestId, recipientId,
        (current, now) -> current.rejected(now));
    return dispatcher.deliver(rejected.senderId(), EventKind.KEY_EXCHANGE_REJECTED,
        Map.of("requestId", rejected.requestId(), "recipientId", rejected.recipientId()));
  }

  private KeyExchangeRequest respond(String requestId, String recipientId,
                                     BiFunction<KeyExchangeRequest, Instant, KeyExchangeRequest> transition) {
    requireField("requestId", requestId);
    requireField("recipientId", recipientId);
    KeyExchangeRequest current = store.load(requestId)
        .orElseThrow(() -> KeyRelayException.notFound(requestId));
    if (!current.recipientId().equals(recipientId)) {
      throw KeyRelayException.notRecipient(requestId);
    }
    if (!current.isPending()) {
      throw KeyRelayException.invalidState(requestId, current.status().wireName());
    }
    Instant now = clock.instant();
    if (isPastTtl(current, now)) {
      // Whether this swap or a concurrent sweep wins, the request is no longer pending.
      store.replace(current, current.expired(now));
      log.debug("respond(requestId={}) found request past its TTL", requestId);
      throw KeyRelayException.invalidState(requestId, KeyExchangeStatus.EXPIRED.wireName());
    }
    KeyExchangeRequest updated = transition.apply(current, now);
    if (!store.replace(current, updated)) {
      String status = store.load(requestId)
          .map(r -> r.status().wireName())
          .orElse(KeyExchangeStatus.EXPIRED.wireName());
      throw KeyRelayException.invalidState(requestId, status);
    }
    log.debug("respond(requestId={}) -> {}", requestId, updated.status().wireName());
    return updated;
  }

  private boolean isPastTtl(KeyExchangeRequest request, Instant now) {
    return request.createdAt().isBefore(now.minus(ttl));
  }

  /**
   * Moves every pending request older than the TTL to {@code expired} and purges terminal
   * requests past the retention window. Sends no notifications.
   * <p>
   * Never runs concurrently with itself; an overlapping call returns 0 without doing anything.
   *
   * @param now the reference time
   * @return the number of requests expired by this call
   */
  public int expire(Instant now) {
    if (!sweepLock.tryLock()) {
      log.debug("expire() already running, skipping");
      return 0;
    }
    try {
      int expired = 0;
      for (KeyExchangeRequest request : store.findPendingCreatedBefore(now.minus(ttl))) {
        if (store.replace(request, request.expired(now))) {
          expired++;
        }
      }
      List<KeyExchangeRequest> purgeable = store.findTerminalRespondedBefore(now.minus(retention));
      purgeable.forEach(request -> store.delete(request.requestId()));
      lastSweepAt = clock.instant();
      if (expired > 0 || !purgeable.isEmpty()) {
        log.info("expire(): expired={}, purged={}", expired, purgeable.size());
      }
      return expired;
    } finally {
      sweepLock.unlock();
    }
  }

  /**
   * Read-only lookup.
   *
   * @param requestId the request
   * @return the current snapshot, empty if unknown or purged
   */
  public Optional<KeyExchangeRequest> find(String requestId) {
    return store.load(requestId);
  }

  /**
   * Pending requests addressed to a session, oldest first.
   *
   * @param sessionId the recipient
   * @return the pending requests
   */
  public List<KeyExchangeRequest> pendingFor(String sessionId) {
    return store.findPendingForRecipient(sessionId);
  }

  /**
   * Delivers every still-valid pending request addressed to a session again. Used when a
   * session reconnects.
   *
   * @param sessionId the recipient
   * @return the number of requests delivered
   */
  public int redeliverPending(String sessionId) {
    Instant now = clock.instant();
    int delivered = 0;
    for (KeyExchangeRequest request : store.findPendingForRecipient(sessionId)) {
      if (isPastTtl(request, now)) {
        continue;
      }
      DeliveryOutcome outcome = dispatcher.deliver(sessionId, EventKind.KEY_EXCHANGE_REQUEST,
          requestPayload(request));
      log.debug("redeliverPending(requestId={}) -> {}", request.requestId(), outcome);
      delivered++;
    }
    return delivered;
  }

  /**
   * When the last sweep finished, if one has run.
   *
   * @return the completion time of the last sweep
   */
  public Optional<Instant> lastSweepAt() {
    return Optional.ofNullable(lastSweepAt);
  }

  private Map<String, String> requestPayload(KeyExchangeRequest request) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put("requestId", request.requestId());
    payload.put("senderId", request.senderId());
    payload.put("publicKey", request.publicKey());
    payload.put("encryptedUserData", request.encryptedUserData());
    return payload;
  }
}
