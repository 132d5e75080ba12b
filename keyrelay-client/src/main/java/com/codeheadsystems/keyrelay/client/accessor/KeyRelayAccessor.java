package com.codeheadsystems.keyrelay.client.accessor;

import com.codeheadsystems.keyrelay.client.exceptions.KeyRelayAccessorException;
import com.codeheadsystems.keyrelay.client.model.ServerConnectionInfo;
import com.codeheadsystems.keyrelay.model.ErrorResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeAcceptRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeDecisionResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeRejectRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeView;
import com.codeheadsystems.keyrelay.model.keyexchange.PendingKeyExchangesResponse;
import com.codeheadsystems.keyrelay.model.presence.ConnectResponse;
import com.codeheadsystems.keyrelay.model.presence.EventBatch;
import com.codeheadsystems.keyrelay.model.presence.PresenceView;
import com.codeheadsystems.keyrelay.model.token.SessionLinkRequest;
import com.codeheadsystems.keyrelay.model.token.SessionTokensResponse;
import com.codeheadsystems.keyrelay.model.token.TokenRegistrationRequest;
import com.codeheadsystems.keyrelay.model.token.TokenView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP accessor for the KeyRelay API.
 * <p>
 * Every call is synchronous. Failures surface as {@link KeyRelayAccessorException}; for HTTP
 * errors the server's {@code ErrorCode} is carried when the body contains one.
 */
@Singleton
public class KeyRelayAccessor {

  private static final Logger log = LoggerFactory.getLogger(KeyRelayAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo serverConnectionInfo;

  /**
   * Instantiates a new Key relay accessor.
   *
   * @param httpClient           the http client
   * @param objectMapper         the object mapper
   * @param serverConnectionInfo the server connection info
   */
  @Inject
  public KeyRelayAccessor(final HttpClient httpClient,
                          final ObjectMapper objectMapper,
                          final ServerConnectionInfo serverConnectionInfo) {
    log.info("KeyRelayAccessor({})", serverConnectionInfo);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverConnectionInfo = serverConnectionInfo;
  }

  private static String segment(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  // Key exchange

  public KeyExchangeInitiateResponse initiate(final KeyExchangeInitiateRequest request) {
    return post("/key-exchange/request", request, KeyExchangeInitiateResponse.class);
  }

  public KeyExchangeDecisionResponse accept(final KeyExchangeAcceptRequest request) {
    return post("/key-exchange/accept", request, KeyExchangeDecisionResponse.class);
  }

  public KeyExchangeDecisionResponse reject(final KeyExchangeRejectRequest request) {
    return post("/key-exchange/reject", request, KeyExchangeDecisionResponse.class);
  }

  public KeyExchangeView status(final String requestId) {
    return get("/key-exchange/" + segment(requestId), KeyExchangeView.class);
  }

  public PendingKeyExchangesResponse pending(final String sessionId) {
    return get("/key-exchange/pending/" + segment(sessionId), PendingKeyExchangesResponse.class);
  }

  // Tokens

  public TokenView registerToken(final TokenRegistrationRequest request) {
    return post("/api/v2/tokens", request, TokenView.class);
  }

  public void removeToken(final String token) {
    send(HttpRequest.newBuilder(uri("/api/v2/tokens/" + segment(token))).DELETE(), Void.class);
  }

  public void link(final String token, final String sessionId) {
    post("/api/v2/sessions/link", new SessionLinkRequest(token, sessionId), Void.class);
  }

  public void unlink(final String token) {
    post("/api/v2/sessions/unlink", new SessionLinkRequest(token, null), Void.class);
  }

  public SessionTokensResponse tokensFor(final String sessionId) {
    return get("/api/v2/sessions/" + segment(sessionId) + "/tokens", SessionTokensResponse.class);
  }

  // Presence

  public ConnectResponse connect(final String sessionId) {
    return send(HttpRequest.newBuilder(uri("/presence/" + segment(sessionId) + "/connect"))
        .POST(HttpRequest.BodyPublishers.noBody()), ConnectResponse.class);
  }

  public void disconnect(final String sessionId, final String connectionHandle) {
    send(HttpRequest.newBuilder(uri("/presence/" + segment(sessionId) + "/disconnect?handle="
        + segment(connectionHandle))).POST(HttpRequest.BodyPublishers.noBody()), Void.class);
  }

  public PresenceView presence(final String sessionId) {
    return get("/presence/" + segment(sessionId), PresenceView.class);
  }

  /**
   * Drains queued events for a connection.
   *
   * @param sessionId        the session
   * @param connectionHandle handle returned by {@link #connect}
   * @return the queued events
   * @throws KeyRelayAccessorException with status 410 once the handle has been superseded
   */
  public EventBatch poll(final String sessionId, final String connectionHandle) {
    return get("/presence/" + segment(sessionId) + "/events?handle=" + segment(connectionHandle),
        EventBatch.class);
  }

  private URI uri(String path) {
    return serverConnectionInfo.resolve(path);
  }

  private <T> T get(String path, Class<T> responseType) {
    return send(HttpRequest.newBuilder(uri(path)).GET(), responseType);
  }

  private <T> T post(String path, Object body, Class<T> responseType) {
    final String requestBody;
    try {
      requestBody = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new KeyRelayAccessorException("Unable to serialize request for " + path, e);
    }
    return send(HttpRequest.newBuilder(uri(path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody)), responseType);
  }

  private <T> T send(HttpRequest.Builder builder, Class<T> responseType) {
    final HttpRequest httpRequest = builder.header("Accept", "application/json").build();
    log.trace("send({} {})", httpRequest.method(), httpRequest.uri());
    try {
      final HttpResponse<String> httpResponse =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      checkStatus(httpRequest, httpResponse);
      if (responseType == Void.class) {
        return null;
      }
      return objectMapper.readValue(httpResponse.body(), responseType);
    } catch (IOException e) {
      throw new KeyRelayAccessorException("HTTP request failed: " + httpRequest.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new KeyRelayAccessorException("HTTP request interrupted: " + httpRequest.uri(), e);
    }
  }

  private void checkStatus(HttpRequest request, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 400) {
      return;
    }
    ErrorResponse error = null;
    JsonProcessingException parseFailure = null;
    String body = response.body();
    if (body != null && !body.isBlank()) {
      try {
        error = objectMapper.readValue(body, ErrorResponse.class);
      } catch (JsonProcessingException e) {
        parseFailure = e;
      }
    }
    String detail = error != null && error.message() != null ? ": " + error.message() : "";
    throw new KeyRelayAccessorException(
        "Server returned HTTP " + statusCode + " for " + request.uri() + detail,
        statusCode,
        error != null ? error.code() : null,
        parseFailure);
  }
}
