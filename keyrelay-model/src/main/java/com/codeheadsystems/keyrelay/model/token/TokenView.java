package com.codeheadsystems.keyrelay.model.token;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read view of a registered device token.
 *
 * @param token     the token
 * @param device    its platform
 * @param channel   its delivery channel
 * @param sessionId the linked session, or null when unlinked
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenView(
    @JsonProperty("token") String token,
    @JsonProperty("device") Platform device,
    @JsonProperty("channel") DeliveryChannel channel,
    @JsonProperty("session_id") String sessionId) {
}
