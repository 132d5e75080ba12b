package com.codeheadsystems.keyrelay.server.exception;

import com.codeheadsystems.keyrelay.model.ErrorCode;

/**
 * Validation failure raised synchronously by the registry, the token directory and the
 * transport. Resources translate it to an HTTP response via {@code KeyRelayExceptionMapper}.
 * <p>
 * Delivery problems are never reported with this exception; they are returned as a
 * {@link com.codeheadsystems.keyrelay.model.DeliveryOutcome}.
 */
public class KeyRelayException extends RuntimeException {

  private final ErrorCode code;

  /**
   * Instantiates a new Key relay exception.
   *
   * @param code    the error code
   * @param message the message
   */
  public KeyRelayException(final ErrorCode code, final String message) {
    super(message);
    this.code = code;
  }

  public static KeyRelayException invalidParticipants(String sessionId) {
    return new KeyRelayException(ErrorCode.INVALID_PARTICIPANTS,
        "Sender and recipient must differ: " + sessionId);
  }

  public static KeyRelayException duplicatePending(String senderId, String recipientId) {
    return new KeyRelayException(ErrorCode.DUPLICATE_PENDING,
        "A key exchange is already pending between " + senderId + " and " + recipientId);
  }

  public static KeyRelayException duplicateRequestId(String requestId) {
    return new KeyRelayException(ErrorCode.DUPLICATE_REQUEST_ID,
        "Request identifier already in use: " + requestId);
  }

  public static KeyRelayException notFound(String requestId) {
    return new KeyRelayException(ErrorCode.NOT_FOUND, "No key exchange request: " + requestId);
  }

  public static KeyRelayException notRecipient(String requestId) {
    return new KeyRelayException(ErrorCode.NOT_RECIPIENT,
        "Caller is not the recipient of request: " + requestId);
  }

  public static KeyRelayException invalidState(String requestId, Object status) {
    return new KeyRelayException(ErrorCode.INVALID_STATE,
        "Request " + requestId + " is " + status + ", not pending");
  }

  public static KeyRelayException unknownToken(String token) {
    return new KeyRelayException(ErrorCode.UNKNOWN_TOKEN, "Token is not registered");
  }

  public static KeyRelayException invalidRequest(String message) {
    return new KeyRelayException(ErrorCode.INVALID_REQUEST, message);
  }

  public static KeyRelayException staleConnection(String sessionId) {
    return new KeyRelayException(ErrorCode.STALE_CONNECTION,
        "Connection handle is no longer current for session: " + sessionId);
  }

  /**
   * The error code.
   *
   * @return the code
   */
  public ErrorCode code() {
    return code;
  }
}
