package com.codeheadsystems.keyrelay.model.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Links a registered token to a session, or unlinks it.
 * <p>
 * Used by: {@code POST /api/v2/sessions/link} and {@code POST /api/v2/sessions/unlink}
 * (where {@code session_id} is ignored).
 *
 * @param token     a previously registered token
 * @param sessionId the session to link to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionLinkRequest(
    @JsonProperty("token") String token,
    @JsonProperty("session_id") String sessionId) {
}
