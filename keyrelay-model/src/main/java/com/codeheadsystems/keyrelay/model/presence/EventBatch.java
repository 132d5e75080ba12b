package com.codeheadsystems.keyrelay.model.presence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Events drained from a connection's mailbox, in delivery order.
 *
 * @param events the events; empty when nothing is waiting
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventBatch(
    @JsonProperty("events") List<EventEnvelope> events) {
}
