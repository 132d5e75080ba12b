package com.codeheadsystems.keyrelay.server.resource;

import com.codeheadsystems.keyrelay.model.presence.ConnectResponse;
import com.codeheadsystems.keyrelay.model.presence.EventBatch;
import com.codeheadsystems.keyrelay.model.presence.PresenceView;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import com.codeheadsystems.keyrelay.server.model.SessionPresence;
import com.codeheadsystems.keyrelay.server.store.SessionDirectory;
import com.codeheadsystems.keyrelay.server.transport.MailboxTransport;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing the {@link MailboxTransport}: clients connect, poll their mailbox
 * for direct deliveries, and disconnect.
 */
@Singleton
@Path("/presence")
@Produces(MediaType.APPLICATION_JSON)
public class PresenceResource {

  private static final Logger log = LoggerFactory.getLogger(PresenceResource.class);

  private final MailboxTransport transport;
  private final SessionDirectory sessionDirectory;

  /**
   * Instantiates a new Presence resource.
   *
   * @param transport        the mailbox transport
   * @param sessionDirectory the session directory
   */
  @Inject
  public PresenceResource(final MailboxTransport transport,
                          final SessionDirectory sessionDirectory) {
    this.transport = transport;
    this.sessionDirectory = sessionDirectory;
    log.info("PresenceResource({}, {})", transport, sessionDirectory);
  }

  private static ConnectionHandle requireHandle(String handle) {
    if (handle == null || handle.isBlank()) {
      throw KeyRelayException.invalidRequest("Missing required query parameter: handle");
    }
    return new ConnectionHandle(handle);
  }

  @POST
  @Path("/{sessionId}/connect")
  public ConnectResponse connect(@PathParam("sessionId") final String sessionId) {
    ConnectionHandle handle = transport.open(sessionId);
    log.trace("connect(sessionId={})", sessionId);
    return new ConnectResponse(sessionId, handle.value());
  }

  @POST
  @Path("/{sessionId}/disconnect")
  public void disconnect(@PathParam("sessionId") final String sessionId,
                         @QueryParam("handle") final String handle) {
    transport.close(sessionId, requireHandle(handle));
  }

  @GET
  @Path("/{sessionId}")
  public PresenceView presence(@PathParam("sessionId") final String sessionId) {
    Optional<SessionPresence> presence = sessionDirectory.presence(sessionId);
    return new PresenceView(sessionId, presence.isPresent(),
        presence.map(p -> p.lastSeenAt().toEpochMilli()).orElse(null));
  }

  /**
   * Drain queued events for the connection.
   *
   * @param sessionId the session
   * @param handle    its current connection handle
   * @return queued events, possibly empty
   */
  @GET
  @Path("/{sessionId}/events")
  public EventBatch events(@PathParam("sessionId") final String sessionId,
                           @QueryParam("handle") final String handle) {
    return new EventBatch(transport.poll(sessionId, requireHandle(handle)));
  }
}
