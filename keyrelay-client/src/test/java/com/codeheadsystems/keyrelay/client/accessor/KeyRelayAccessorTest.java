package com.codeheadsystems.keyrelay.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keyrelay.client.exceptions.KeyRelayAccessorException;
import com.codeheadsystems.keyrelay.client.model.ServerConnectionInfo;
import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.model.ErrorCode;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeRejectRequest;
import com.codeheadsystems.keyrelay.model.presence.EventBatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyRelayAccessorTest {

  private static final URI BASE = URI.create("http://localhost:8080/");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private KeyRelayAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new KeyRelayAccessor(httpClient, new ObjectMapper(), new ServerConnectionInfo(BASE));
  }

  @SuppressWarnings("unchecked")
  private HttpRequest sentRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }

  @Test
  @SuppressWarnings("unchecked")
  void initiate_postsAndParsesResponse() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{\"requestId\":\"req1\",\"delivery\":\"undeliverable\"}");

    KeyExchangeInitiateResponse response = accessor.initiate(
        new KeyExchangeInitiateRequest(null, "S-alice", "S-bob", "pk1", "edata1"));

    assertThat(response).isEqualTo(
        new KeyExchangeInitiateResponse("req1", DeliveryOutcome.UNDELIVERABLE));
    HttpRequest sent = sentRequest();
    assertThat(sent.uri()).isEqualTo(URI.create("http://localhost:8080/key-exchange/request"));
    assertThat(sent.method()).isEqualTo("POST");
  }

  @Test
  @SuppressWarnings("unchecked")
  void poll_encodesHandleAsQueryParam() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{\"events\":[]}");

    EventBatch batch = accessor.poll("S bob", "h/1");

    assertThat(batch.events()).isEmpty();
    assertThat(sentRequest().uri().getRawPath()).isEqualTo("/presence/S%20bob/events");
    assertThat(sentRequest().uri().getRawQuery()).isEqualTo("handle=h%2F1");
  }

  @Test
  @SuppressWarnings("unchecked")
  void errorStatus_carriesServerErrorCode() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(409);
    when(httpResponse.body())
        .thenReturn("{\"code\":\"INVALID_STATE\",\"message\":\"Request req1 is accepted\"}");

    assertThatThrownBy(() -> accessor.reject(new KeyExchangeRejectRequest("req1", "S-bob")))
        .isInstanceOfSatisfying(KeyRelayAccessorException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(409);
          assertThat(e.errorCode()).contains(ErrorCode.INVALID_STATE);
          assertThat(e.getMessage()).contains("Request req1 is accepted");
        });
  }

  @Test
  @SuppressWarnings("unchecked")
  void errorStatus_withoutErrorBody_hasNoCode() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(500);
    when(httpResponse.body()).thenReturn("<html>oops</html>");

    assertThatThrownBy(() -> accessor.status("req1"))
        .isInstanceOfSatisfying(KeyRelayAccessorException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(500);
          assertThat(e.errorCode()).isEmpty();
        });
  }

  @Test
  @SuppressWarnings("unchecked")
  void unlink_noContent_returnsNormally() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(204);

    accessor.unlink("tok");

    assertThat(sentRequest().uri().getPath()).isEqualTo("/api/v2/sessions/unlink");
  }

  @Test
  @SuppressWarnings("unchecked")
  void ioException_isWrapped() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new IOException("network error"));

    assertThatThrownBy(() -> accessor.tokensFor("S-bob"))
        .isInstanceOf(KeyRelayAccessorException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void interruptedException_isWrapped_andFlagRestored() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new InterruptedException("interrupted"));

    assertThatThrownBy(() -> accessor.presence("S-bob"))
        .isInstanceOf(KeyRelayAccessorException.class)
        .hasCauseInstanceOf(InterruptedException.class);

    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    Thread.interrupted(); // clear the flag so it doesn't bleed into other tests
  }
}
