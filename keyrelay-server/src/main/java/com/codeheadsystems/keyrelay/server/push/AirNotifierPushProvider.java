package com.codeheadsystems.keyrelay.server.push;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PushProvider} that posts to an AirNotifier relay, which forwards to APNs and FCM.
 * <p>
 * Sends {@code POST {baseUri}/api/v2/push} with the {@code X-An-App-Name} and
 * {@code X-An-App-Key} headers. Tokens on the {@code silent} channel get a data-only push; all
 * others get an alert with a title and sound chosen by event kind.
 * <p>
 * HTTP 404 and 410 mean the relay no longer knows the token and map to
 * {@link PushResult.Reason#INVALID_TOKEN}. Other non-2xx responses map to
 * {@link PushResult.Reason#REJECTED}; I/O failures map to {@link PushResult.Reason#UNAVAILABLE}.
 */
public class AirNotifierPushProvider implements PushProvider {

  private static final Logger log = LoggerFactory.getLogger(AirNotifierPushProvider.class);

  static final String PUSH_PATH = "/api/v2/push";
  static final String APP_NAME_HEADER = "X-An-App-Name";
  static final String APP_KEY_HEADER = "X-An-App-Key";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI pushUri;
  private final String appName;
  private final String appKey;
  private final Duration timeout;

  /**
   * Instantiates a new AirNotifier push provider.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param baseUri      relay base URI, e.g. {@code https://push.example.org}
   * @param appName      AirNotifier application name
   * @param appKey       AirNotifier application key
   * @param timeout      per-request timeout
   */
  public AirNotifierPushProvider(final HttpClient httpClient,
                                 final ObjectMapper objectMapper,
                                 final URI baseUri,
                                 final String appName,
                                 final String appKey,
                                 final Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.pushUri = URI.create(stripTrailingSlash(baseUri.toString()) + PUSH_PATH);
    this.appName = appName;
    this.appKey = appKey;
    this.timeout = timeout;
    log.info("AirNotifierPushProvider({}, appName={})", pushUri, appName);
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  @Override
  public PushResult push(DeviceTokenRecord token, EventKind kind, Map<String, String> payload) {
    final String body;
    try {
      body = objectMapper.writeValueAsString(buildMessage(token, kind, payload));
    } catch (JsonProcessingException e) {
      log.error("Unable to serialize push for kind={}", kind.wireName(), e);
      return PushResult.rejected(PushResult.Reason.REJECTED);
    }
    HttpRequest request = HttpRequest.newBuilder(pushUri)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .header(APP_NAME_HEADER, appName)
        .header(APP_KEY_HEADER, appKey)
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return toResult(response.statusCode(), kind);
    } catch (IOException e) {
      log.warn("Push relay unreachable for kind={}: {}", kind.wireName(), e.getMessage());
      return PushResult.rejected(PushResult.Reason.UNAVAILABLE);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PushResult.rejected(PushResult.Reason.UNAVAILABLE);
    }
  }

  private PushResult toResult(int status, EventKind kind) {
    if (status >= 200 && status < 300) {
      return PushResult.ok();
    }
    if (status == 404 || status == 410) {
      log.debug("Relay reports token invalid (HTTP {}) for kind={}", status, kind.wireName());
      return PushResult.rejected(PushResult.Reason.INVALID_TOKEN);
    }
    log.warn("Relay rejected push with HTTP {} for kind={}", status, kind.wireName());
    return PushResult.rejected(PushResult.Reason.REJECTED);
  }

  Map<String, Object> buildMessage(DeviceTokenRecord token, EventKind kind,
                                   Map<String, String> payload) {
    Map<String, Object> data = new LinkedHashMap<>(payload);
    data.put("type", kind.wireName());

    Map<String, Object> message = new LinkedHashMap<>();
    message.put("device", token.platform().wireName());
    message.put("token", token.token());
    message.put("channel", token.channel().wireName());
    message.put("data", data);
    if (token.channel() == DeliveryChannel.SILENT) {
      message.put("extra", Map.of("content-available", 1));
      return message;
    }
    Alert alert = Alert.forKind(kind);
    message.put("alert", Map.of("title", alert.title(), "body", alert.body()));
    message.put("sound", alert.sound());
    return message;
  }

  record Alert(String title, String body, String sound) {

    static Alert forKind(EventKind kind) {
      return switch (kind) {
        case KEY_EXCHANGE_REQUEST ->
            new Alert("New contact request", "Someone wants to connect with you", "invitation.wav");
        case KEY_EXCHANGE_ACCEPTED ->
            new Alert("Contact request accepted", "Your contact request was accepted", "accepted.wav");
        case KEY_EXCHANGE_REJECTED ->
            new Alert("Contact request declined", "Your contact request was declined", "declined.wav");
      };
    }
  }
}
