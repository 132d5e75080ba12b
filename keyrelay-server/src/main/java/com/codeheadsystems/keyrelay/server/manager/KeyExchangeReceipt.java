package com.codeheadsystems.keyrelay.server.manager;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;

/**
 * Result of initiating a key exchange.
 *
 * @param requestId the stored request identifier
 * @param delivery  how the request reached the recipient
 */
public record KeyExchangeReceipt(String requestId, DeliveryOutcome delivery) {
}
