package com.codeheadsystems.keyrelay.model.keyexchange;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code POST /key-exchange/request}.
 *
 * @param requestId the identifier to quote in accept/reject calls and status lookups
 * @param delivery  how the request reached the recipient
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyExchangeInitiateResponse(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("delivery") DeliveryOutcome delivery) {
}
