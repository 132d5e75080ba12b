package com.codeheadsystems.keyrelay.model;

/**
 * Machine-readable error codes returned in {@link ErrorResponse#code()}.
 */
public enum ErrorCode {
  INVALID_PARTICIPANTS,
  DUPLICATE_PENDING,
  DUPLICATE_REQUEST_ID,
  NOT_FOUND,
  NOT_RECIPIENT,
  INVALID_STATE,
  UNKNOWN_TOKEN,
  INVALID_REQUEST,
  STALE_CONNECTION
}
