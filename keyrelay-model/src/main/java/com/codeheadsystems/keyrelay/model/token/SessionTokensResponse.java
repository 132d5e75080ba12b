package com.codeheadsystems.keyrelay.model.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Tokens currently linked to a session. An empty list means the session cannot be reached by
 * push.
 *
 * @param sessionId the session
 * @param tokens    linked tokens
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionTokensResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("tokens") List<TokenView> tokens) {
}
