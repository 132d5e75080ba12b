package com.codeheadsystems.keyrelay.server.store;

import com.codeheadsystems.keyrelay.server.model.KeyExchangeRequest;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link KeyExchangeStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * All requests are lost on server restart. Suitable for development and integration testing,
 * or for deployments that accept losing in-flight handshakes on restart.
 */
public class InMemoryKeyExchangeStore implements KeyExchangeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyExchangeStore.class);

  private final ConcurrentHashMap<String, KeyExchangeRequest> requests = new ConcurrentHashMap<>();
  // Unordered pair -> id of the pending request for that pair. Entries may briefly point at a
  // request that has already left pending; insertPending treats those as free.
  private final ConcurrentHashMap<ParticipantPair, String> pendingByPair = new ConcurrentHashMap<>();

  @Override
  public InsertResult insertPending(KeyExchangeRequest request) {
    ParticipantPair pair = ParticipantPair.of(request.senderId(), request.recipientId());
    InsertResult[] result = {InsertResult.INSERTED};
    pendingByPair.compute(pair, (key, existingId) -> {
      if (existingId != null) {
        KeyExchangeRequest existing = requests.get(existingId);
        if (existing != null && existing.isPending()) {
          result[0] = InsertResult.DUPLICATE_PENDING;
          return existingId;
        }
      }
      if (requests.putIfAbsent(request.requestId(), request) != null) {
        result[0] = InsertResult.DUPLICATE_REQUEST_ID;
        return existingId;
      }
      return request.requestId();
    });
    log.debug("insertPending(requestId={}) -> {}", request.requestId(), result[0]);
    return result[0];
  }

  @Override
  public Optional<KeyExchangeRequest> load(String requestId) {
    return Optional.ofNullable(requests.get(requestId));
  }

  @Override
  public boolean replace(KeyExchangeRequest expected, KeyExchangeRequest updated) {
    if (!expected.requestId().equals(updated.requestId())) {
      throw new IllegalArgumentException("Cannot replace across request identifiers");
    }
    boolean swapped = requests.replace(expected.requestId(), expected, updated);
    if (swapped && !updated.isPending()) {
      pendingByPair.remove(ParticipantPair.of(updated.senderId(), updated.recipientId()),
          updated.requestId());
    }
    return swapped;
  }

  @Override
  public List<KeyExchangeRequest> findPendingCreatedBefore(Instant cutoff) {
    return find(r -> r.isPending() && r.createdAt().isBefore(cutoff));
  }

  @Override
  public List<KeyExchangeRequest> findTerminalRespondedBefore(Instant cutoff) {
    return find(r -> !r.isPending() && r.respondedAt() != null && r.respondedAt().isBefore(cutoff));
  }

  @Override
  public List<KeyExchangeRequest> findPendingForRecipient(String recipientId) {
    return find(r -> r.isPending() && r.recipientId().equals(recipientId));
  }

  @Override
  public void delete(String requestId) {
    KeyExchangeRequest removed = requests.remove(requestId);
    if (removed != null) {
      pendingByPair.remove(ParticipantPair.of(removed.senderId(), removed.recipientId()), requestId);
      log.debug("Deleted requestId={}", requestId);
    }
  }

  private List<KeyExchangeRequest> find(Predicate<KeyExchangeRequest> filter) {
    return requests.values().stream()
        .filter(filter)
        .sorted(Comparator.comparing(KeyExchangeRequest::createdAt))
        .toList();
  }

  // Order-independent key so {A,B} and {B,A} collide.
  private record ParticipantPair(String first, String second) {

    static ParticipantPair of(String a, String b) {
      return a.compareTo(b) <= 0 ? new ParticipantPair(a, b) : new ParticipantPair(b, a);
    }
  }
}
