package com.codeheadsystems.keyrelay.testserver.cli;

import com.codeheadsystems.keyrelay.client.accessor.KeyRelayAccessor;
import com.codeheadsystems.keyrelay.client.exceptions.KeyRelayAccessorException;
import com.codeheadsystems.keyrelay.client.model.ServerConnectionInfo;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeAcceptRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeDecisionResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateRequest;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeInitiateResponse;
import com.codeheadsystems.keyrelay.model.keyexchange.KeyExchangeRejectRequest;
import com.codeheadsystems.keyrelay.model.presence.ConnectResponse;
import com.codeheadsystems.keyrelay.model.presence.EventEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line client that plays both sides of a key exchange against a running testserver.
 *
 * <pre>
 * Usage:
 *   HandshakeCli accept|reject &lt;senderId&gt; &lt;recipientId&gt; [--server &lt;url&gt;]
 *
 * Commands:
 *   accept   Connect both sessions, send a request, accept it and print what each side received.
 *   reject   Same, but the recipient declines.
 *
 * Options:
 *   --server &lt;url&gt;   Server base URL (default: http://localhost:8080)
 * </pre>
 */
public class HandshakeCli {

  private static final String DEFAULT_SERVER = "http://localhost:8080";

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    String server = DEFAULT_SERVER;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--server" -> server = args[++i];
        default -> positional.add(args[i]);
      }
    }

    if (positional.size() < 3) {
      printUsage();
      System.exit(1);
    }

    String command = positional.get(0);
    String senderId = positional.get(1);
    String recipientId = positional.get(2);

    KeyRelayAccessor accessor = new KeyRelayAccessor(HttpClient.newHttpClient(),
        new ObjectMapper(), new ServerConnectionInfo(URI.create(server)));

    try {
      switch (command) {
        case "accept" -> runHandshake(accessor, senderId, recipientId, true);
        case "reject" -> runHandshake(accessor, senderId, recipientId, false);
        default -> {
          System.err.println("Unknown command: " + command);
          printUsage();
          System.exit(1);
        }
      }
    } catch (KeyRelayAccessorException e) {
      System.err.println("Server refused (HTTP " + e.statusCode() + ", "
          + e.errorCode().map(Enum::name).orElse("no code") + "): " + e.getMessage());
      System.exit(2);
    } catch (Exception e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  private static void runHandshake(KeyRelayAccessor accessor, String senderId,
                                   String recipientId, boolean accept) {
    ConnectResponse sender = accessor.connect(senderId);
    ConnectResponse recipient = accessor.connect(recipientId);
    System.out.println("Connected " + senderId + " and " + recipientId + ".");

    KeyExchangeInitiateResponse initiated = accessor.initiate(new KeyExchangeInitiateRequest(
        null, senderId, recipientId, "cli-public-key", "cli-encrypted-user-data"));
    System.out.println("Request " + initiated.requestId() + " : " + initiated.delivery());
    printEvents(recipientId, accessor.poll(recipientId, recipient.connectionHandle()).events());

    KeyExchangeDecisionResponse decision = accept
        ? accessor.accept(new KeyExchangeAcceptRequest(
            initiated.requestId(), recipientId, "cli-reply-data"))
        : accessor.reject(new KeyExchangeRejectRequest(initiated.requestId(), recipientId));
    System.out.println("Decision " + decision.status() + " : " + decision.delivery());
    printEvents(senderId, accessor.poll(senderId, sender.connectionHandle()).events());

    accessor.disconnect(senderId, sender.connectionHandle());
    accessor.disconnect(recipientId, recipient.connectionHandle());
  }

  private static void printEvents(String sessionId, List<EventEnvelope> events) {
    System.out.println("  " + sessionId + " received " + events.size() + " event(s)");
    for (EventEnvelope event : events) {
      System.out.println("    " + event.kind() + " " + event.payload());
    }
  }

  private static void printUsage() {
    System.err.println("Usage: HandshakeCli accept|reject <senderId> <recipientId> [options]");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --server <url>   Server base URL (default: " + DEFAULT_SERVER + ")");
  }
}
