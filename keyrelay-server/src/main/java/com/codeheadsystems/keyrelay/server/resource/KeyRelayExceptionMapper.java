package com.codeheadsystems.keyrelay.server.resource;

import com.codeheadsystems.keyrelay.model.ErrorCode;
import com.codeheadsystems.keyrelay.model.ErrorResponse;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link KeyRelayException} to a JSON {@link ErrorResponse} with a status derived from its
 * {@link ErrorCode}.
 */
@Provider
public class KeyRelayExceptionMapper implements ExceptionMapper<KeyRelayException> {

  private static final Logger log = LoggerFactory.getLogger(KeyRelayExceptionMapper.class);

  /**
   * HTTP status for an error code.
   *
   * @param code the code
   * @return the status
   */
  public static Response.Status statusFor(ErrorCode code) {
    return switch (code) {
      case INVALID_PARTICIPANTS, INVALID_REQUEST -> Response.Status.BAD_REQUEST;
      case NOT_RECIPIENT -> Response.Status.FORBIDDEN;
      case NOT_FOUND, UNKNOWN_TOKEN -> Response.Status.NOT_FOUND;
      case DUPLICATE_PENDING, DUPLICATE_REQUEST_ID, INVALID_STATE -> Response.Status.CONFLICT;
      case STALE_CONNECTION -> Response.Status.GONE;
    };
  }

  @Override
  public Response toResponse(KeyRelayException exception) {
    Response.Status status = statusFor(exception.code());
    log.debug("{} -> {}: {}", exception.code(), status.getStatusCode(), exception.getMessage());
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(exception.code(), exception.getMessage()))
        .build();
  }
}
