package com.codeheadsystems.keyrelay.server.store;

import com.codeheadsystems.keyrelay.server.model.KeyExchangeRequest;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for key exchange requests.
 * <p>
 * Implementations must be thread-safe and must provide two atomic primitives:
 * <ul>
 *   <li>{@link #insertPending} checks the unordered participant pair for an existing pending
 *       request and inserts in one step, so two concurrent initiations for the same pair
 *       cannot both succeed.</li>
 *   <li>{@link #replace} is a compare-and-set on the whole snapshot, which makes
 *       accept/reject/expire races deterministic: exactly one writer observes the pending
 *       snapshot it read.</li>
 * </ul>
 * Database-backed implementations typically map these to a unique partial index on the pair
 * (where status is pending) and a conditional update on a version or status column.
 */
public interface KeyExchangeStore {

  /**
   * Result of {@link #insertPending}.
   */
  enum InsertResult {
    INSERTED,
    DUPLICATE_PENDING,
    DUPLICATE_REQUEST_ID
  }

  /**
   * Inserts a new pending request unless the pair already has one or the id is taken.
   *
   * @param request a request in {@code pending} state
   * @return what happened
   */
  InsertResult insertPending(KeyExchangeRequest request);

  /**
   * Loads a request by id.
   *
   * @param requestId the request identifier
   * @return the current snapshot, or empty if unknown or purged
   */
  Optional<KeyExchangeRequest> load(String requestId);

  /**
   * Atomically replaces {@code expected} with {@code updated}.
   *
   * @param expected the snapshot the caller read
   * @param updated  the new snapshot, same request id
   * @return false if the stored snapshot no longer equals {@code expected}
   */
  boolean replace(KeyExchangeRequest expected, KeyExchangeRequest updated);

  /**
   * Pending requests created strictly before {@code cutoff}.
   */
  List<KeyExchangeRequest> findPendingCreatedBefore(Instant cutoff);

  /**
   * Terminal requests whose terminal transition happened strictly before {@code cutoff}.
   */
  List<KeyExchangeRequest> findTerminalRespondedBefore(Instant cutoff);

  /**
   * Pending requests addressed to a recipient, oldest first.
   */
  List<KeyExchangeRequest> findPendingForRecipient(String recipientId);

  /**
   * Removes a request, if present.
   *
   * @param requestId the request identifier
   */
  void delete(String requestId);
}
