package com.codeheadsystems.keyrelay.model.keyexchange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the first message of the handshake: the sender offers its public key to a
 * recipient.
 * <p>
 * The server stores the request as {@code pending} and delivers it to the recipient, directly
 * when the recipient holds a live connection and by push otherwise. At most one pending
 * request may exist between any two sessions, in either direction.
 * <p>
 * Clients may suggest their own {@code requestId} (the mobile client generates a UUID); when
 * absent the server assigns one. Unknown fields such as {@code timestamp}, {@code version} or
 * {@code requestPhrase} are accepted and ignored.
 * <p>
 * Used by: {@code POST /key-exchange/request}
 *
 * @param requestId         optional client-suggested request identifier
 * @param senderId          session identifier of the initiating peer
 * @param recipientId       session identifier of the peer being asked; must differ from sender
 * @param publicKey         the sender's key-exchange public key, opaque to the server
 * @param encryptedUserData the sender's encrypted profile payload, opaque to the server
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyExchangeInitiateRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("senderId") String senderId,
    @JsonProperty("recipientId") String recipientId,
    @JsonProperty("publicKey") String publicKey,
    @JsonProperty("encryptedUserData") String encryptedUserData) {
}
