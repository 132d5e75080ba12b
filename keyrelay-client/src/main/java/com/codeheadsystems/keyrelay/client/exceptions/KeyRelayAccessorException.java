package com.codeheadsystems.keyrelay.client.exceptions;

import com.codeheadsystems.keyrelay.model.ErrorCode;
import java.util.Optional;

/**
 * Raised when a KeyRelay call fails, either on the wire or with an HTTP error status.
 */
public class KeyRelayAccessorException extends RuntimeException {

  private final int statusCode;
  private final ErrorCode errorCode;

  /**
   * Instantiates an exception for a transport failure.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyRelayAccessorException(final String message, final Throwable cause) {
    this(message, 0, null, cause);
  }

  /**
   * Instantiates an exception for an HTTP error response.
   *
   * @param message    the message
   * @param statusCode the HTTP status
   * @param errorCode  the server's error code, null if the body carried none
   * @param cause      the cause, may be null
   */
  public KeyRelayAccessorException(final String message,
                                   final int statusCode,
                                   final ErrorCode errorCode,
                                   final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  /**
   * HTTP status of the failed call, 0 when no response was received.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }

  public Optional<ErrorCode> errorCode() {
    return Optional.ofNullable(errorCode);
  }
}
