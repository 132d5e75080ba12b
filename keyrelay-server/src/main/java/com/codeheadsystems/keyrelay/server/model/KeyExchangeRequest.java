package com.codeheadsystems.keyrelay.server.model;

import com.codeheadsystems.keyrelay.model.KeyExchangeStatus;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a key exchange request.
 * <p>
 * Every transition produces a new instance; stores swap snapshots with compare-and-set, so two
 * callers racing on the same pending request cannot both win.
 *
 * @param requestId         unique request identifier
 * @param senderId          initiating session
 * @param recipientId       addressed session
 * @param publicKey         sender's public key material
 * @param encryptedUserData sender's payload, replaced by the recipient's payload on accept
 * @param status            lifecycle state
 * @param createdAt         creation time
 * @param respondedAt       time of the terminal transition, null while pending
 */
public record KeyExchangeRequest(
    String requestId,
    String senderId,
    String recipientId,
    String publicKey,
    String encryptedUserData,
    KeyExchangeStatus status,
    Instant createdAt,
    Instant respondedAt) {

  public KeyExchangeRequest {
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(senderId, "senderId");
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * Creates a new pending request.
   */
  public static KeyExchangeRequest pending(String requestId, String senderId, String recipientId,
                                           String publicKey, String encryptedUserData,
                                           Instant createdAt) {
    return new KeyExchangeRequest(requestId, senderId, recipientId, publicKey, encryptedUserData,
        KeyExchangeStatus.PENDING, createdAt, null);
  }

  public boolean isPending() {
    return status == KeyExchangeStatus.PENDING;
  }

  /**
   * Accepted copy. A null {@code recipientUserData} keeps the stored payload.
   */
  public KeyExchangeRequest accepted(String recipientUserData, Instant at) {
    String data = recipientUserData != null ? recipientUserData : encryptedUserData;
    return new KeyExchangeRequest(requestId, senderId, recipientId, publicKey, data,
        KeyExchangeStatus.ACCEPTED, createdAt, at);
  }

  public KeyExchangeRequest rejected(Instant at) {
    return terminal(KeyExchangeStatus.REJECTED, at);
  }

  public KeyExchangeRequest expired(Instant at) {
    return terminal(KeyExchangeStatus.EXPIRED, at);
  }

  private KeyExchangeRequest terminal(KeyExchangeStatus terminalStatus, Instant at) {
    return new KeyExchangeRequest(requestId, senderId, recipientId, publicKey, encryptedUserData,
        terminalStatus, createdAt, at);
  }
}
