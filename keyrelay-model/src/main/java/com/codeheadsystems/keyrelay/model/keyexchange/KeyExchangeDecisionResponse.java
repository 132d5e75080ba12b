package com.codeheadsystems.keyrelay.model.keyexchange;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.model.KeyExchangeStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to an accept or reject call.
 *
 * @param requestId the request that was decided
 * @param status    the terminal status now stored
 * @param delivery  how the decision reached the original sender
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyExchangeDecisionResponse(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("status") KeyExchangeStatus status,
    @JsonProperty("delivery") DeliveryOutcome delivery) {
}
