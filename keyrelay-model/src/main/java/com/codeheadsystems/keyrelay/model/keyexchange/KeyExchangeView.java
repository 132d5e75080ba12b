package com.codeheadsystems.keyrelay.model.keyexchange;

import com.codeheadsystems.keyrelay.model.KeyExchangeStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read view of a stored key exchange request. Timestamps are epoch milliseconds.
 *
 * @param requestId         request identifier
 * @param senderId          initiating session
 * @param recipientId       addressed session
 * @param publicKey         sender's public key
 * @param encryptedUserData sender's payload while pending, recipient's payload once accepted with one
 * @param status            lifecycle state
 * @param createdAt         creation time
 * @param respondedAt       time of the terminal transition, null while pending
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyExchangeView(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("senderId") String senderId,
    @JsonProperty("recipientId") String recipientId,
    @JsonProperty("publicKey") String publicKey,
    @JsonProperty("encryptedUserData") String encryptedUserData,
    @JsonProperty("status") KeyExchangeStatus status,
    @JsonProperty("createdAt") long createdAt,
    @JsonProperty("respondedAt") Long respondedAt) {
}
