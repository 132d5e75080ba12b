package com.codeheadsystems.keyrelay.server.resource;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.model.KeyExchangeStatus;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeAcceptRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeDecisionResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeRejectRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeView;
import com.codeheadsystems.keyrelay.model.keyexchange.PendingKeyExchangesResponse;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.manager.KeyExchangeManager;
import com.codeheadsystems.keyrelay.server.manager.KeyExchangeReceipt;
import com.codeheadsystems.keyrelay.server.model.KeyExchangeRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the key exchange handshake.
 * <p>
 * Thin adapter over {@link KeyExchangeManager}; failures propagate as
 * {@link KeyRelayException} and are rendered by {@link KeyRelayExceptionMapper}.
 */
@Singleton
@Path("/key-exchange")
@Produces(MediaType.APPLICATION_JSON)
public class KeyExchangeResource {

  private static final Logger log = LoggerFactory.getLogger(KeyExchangeResource.class);

  private final KeyExchangeManager manager;

  /**
   * Instantiates a new Key exchange resource.
   *
   * @param manager the key exchange manager
   */
  @Inject
  public KeyExchangeResource(final KeyExchangeManager manager) {
    this.manager = manager;
    log.info("KeyExchangeResource({})", manager);
  }

  static KeyExchangeView toView(KeyExchangeRequest request) {
    return new KeyExchangeView(
        request.requestId(),
        request.senderId(),
        request.recipientId(),
        request.publicKey(),
        request.encryptedUserData(),
        request.status(),
        request.createdAt().toEpochMilli(),
        request.respondedAt() == null ? null : request.respondedAt().toEpochMilli());
  }

  private static void requireBody(Object body) {
    if (body == null) {
      throw KeyRelayException.invalidRequest("Missing request body");
    }
  }

  /**
   * Initiate a key exchange.
   *
   * @param request the request
   * @return the request id and delivery outcome
   */
  @POST
  @Path("/request")
  @Consumes(MediaType.APPLICATION_JSON)
  public KeyExchangeInitiateResponse initiate(final KeyExchangeInitiateRequest request) {
    requireBody(request);
    log.trace("initiate(sender={}, recipient={})", request.senderId(), request.recipientId());
    KeyExchangeReceipt receipt = manager.initiate(request.requestId(), request.senderId(),
        request.recipientId(), request.publicKey(), request.encryptedUserData());
    return new KeyExchangeInitiateResponse(receipt.requestId(), receipt.delivery());
  }

  /**
   * Accept a pending key exchange.
   *
   * @param request the request
   * @return the decision
   */
  @POST
  @Path("/accept")
  @Consumes(MediaType.APPLICATION_JSON)
  public KeyExchangeDecisionResponse accept(final KeyExchangeAcceptRequest request) {
    requireBody(request);
    log.trace("accept(requestId={})", request.requestId());
    DeliveryOutcome delivery = manager.accept(request.requestId(), request.recipientId(),
        request.encryptedUserData());
    return new KeyExchangeDecisionResponse(request.requestId(), KeyExchangeStatus.ACCEPTED,
        delivery);
  }

  /**
   * Reject a pending key exchange.
   *
   * @param request the request
   * @return the decision
   */
  @POST
  @Path("/reject")
  @Consumes(MediaType.APPLICATION_JSON)
  public KeyExchangeDecisionResponse reject(final KeyExchangeRejectRequest request) {
    requireBody(request);
    log.trace("reject(requestId={})", request.requestId());
    DeliveryOutcome delivery = manager.reject(request.requestId(), request.recipientId());
    return new KeyExchangeDecisionResponse(request.requestId(), KeyExchangeStatus.REJECTED,
        delivery);
  }

  @GET
  @Path("/{requestId}")
  public KeyExchangeView status(@PathParam("requestId") final String requestId) {
    return manager.find(requestId)
        .map(KeyExchangeResource::toView)
        .orElseThrow(() -> KeyRelayException.notFound(requestId));
  }

  @GET
  @Path("/pending/{sessionId}")
  public PendingKeyExchangesResponse pending(@PathParam("sessionId") final String sessionId) {
    return new PendingKeyExchangesResponse(sessionId,
        manager.pendingFor(sessionId).stream().map(KeyExchangeResource::toView).toList());
  }
}
