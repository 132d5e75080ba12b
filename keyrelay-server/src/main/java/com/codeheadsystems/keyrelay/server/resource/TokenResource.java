package com.codeheadsystems.keyrelay.server.resource;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.Platform;
import com.codeheadsystems.keyrelay.model.token.SessionLinkRequest;
import com.codeheadsystems.keyrelay.model.token.SessionTokensResponse;
import com.codeheadsystems.keyrelay.model.token.TokenRegistrationRequest;
import com.codeheadsystems.keyrelay.model.token.TokenView;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import com.codeheadsystems.keyrelay.server.store.TokenDirectory;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Comparator;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for device token registration and session links.
 * <p>
 * Paths and field names match the push relay's v2 API so existing clients can point here.
 */
@Singleton
@Path("/api/v2")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

  private static final Logger log = LoggerFactory.getLogger(TokenResource.class);

  private final TokenDirectory tokenDirectory;

  /**
   * Instantiates a new Token resource.
   *
   * @param tokenDirectory the token directory
   */
  @Inject
  public TokenResource(final TokenDirectory tokenDirectory) {
    this.tokenDirectory = tokenDirectory;
    log.info("TokenResource({})", tokenDirectory);
  }

  static TokenView toView(DeviceTokenRecord record) {
    return new TokenView(record.token(), record.platform(), record.channel(), record.sessionId());
  }

  private static void requireBody(Object body) {
    if (body == null) {
      throw KeyRelayException.invalidRequest("Missing request body");
    }
  }

  private static void requireField(String name, String value) {
    if (value == null || value.isBlank()) {
      throw KeyRelayException.invalidRequest("Missing required field: " + name);
    }
  }

  /**
   * Register (or re-register) a token; links it when {@code user_id} is present.
   *
   * @param request the request
   * @return the stored token
   */
  @POST
  @Path("/tokens")
  @Consumes(MediaType.APPLICATION_JSON)
  public TokenView register(final TokenRegistrationRequest request) {
    requireBody(request);
    requireField("token", request.token());
    requireField("device", request.device());
    final Platform platform;
    final DeliveryChannel channel;
    try {
      platform = Platform.fromWire(request.device());
      channel = DeliveryChannel.fromWire(request.channel());
    } catch (IllegalArgumentException e) {
      throw KeyRelayException.invalidRequest(e.getMessage());
    }
    DeviceTokenRecord record = tokenDirectory.register(request.token(), platform, channel);
    if (request.userId() != null && !request.userId().isBlank()) {
      record = tokenDirectory.link(request.token(), request.userId());
    }
    return toView(record);
  }

  @DELETE
  @Path("/tokens/{token}")
  public void remove(@PathParam("token") final String token) {
    if (!tokenDirectory.remove(token)) {
      throw KeyRelayException.unknownToken(token);
    }
  }

  @POST
  @Path("/sessions/link")
  @Consumes(MediaType.APPLICATION_JSON)
  public void link(final SessionLinkRequest request) {
    requireBody(request);
    requireField("token", request.token());
    requireField("session_id", request.sessionId());
    tokenDirectory.link(request.token(), request.sessionId());
  }

  @POST
  @Path("/sessions/unlink")
  @Consumes(MediaType.APPLICATION_JSON)
  public void unlink(final SessionLinkRequest request) {
    requireBody(request);
    requireField("token", request.token());
    tokenDirectory.unlink(request.token());
  }

  @GET
  @Path("/sessions/{sessionId}/tokens")
  public SessionTokensResponse tokensFor(@PathParam("sessionId") final String sessionId) {
    return new SessionTokensResponse(sessionId, tokenDirectory.tokensFor(sessionId).stream()
        .sorted(Comparator.comparing(DeviceTokenRecord::token))
        .map(TokenResource::toView)
        .toList());
  }
}
