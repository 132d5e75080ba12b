package com.codeheadsystems.keyrelay.model.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for registering a device push token.
 * <p>
 * Field names follow the push relay's existing registration call, so the mobile client can
 * post the same body here. Registration is an idempotent upsert keyed by {@code token}.
 * When {@code user_id} is present the token is also linked to that session.
 * <p>
 * Used by: {@code POST /api/v2/tokens}
 *
 * @param token   opaque token issued by APNs or FCM
 * @param device  {@code ios} or {@code android}
 * @param channel {@code default} or {@code silent}; defaults to {@code default}
 * @param userId  optional session identifier to link the token to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenRegistrationRequest(
    @JsonProperty("token") String token,
    @JsonProperty("device") String device,
    @JsonProperty("channel") String channel,
    @JsonProperty("user_id") String userId) {
}
