package com.codeheadsystems.keyrelay.dropwizard;

import com.codeheadsystems.keyrelay.dropwizard.health.KeyExchangeSweepHealthCheck;
import com.codeheadsystems.keyrelay.server.dispatch.DirectDeliveryStage;
import com.codeheadsystems.keyrelay.server.dispatch.NotificationDispatcher;
import com.codeheadsystems.keyrelay.server.dispatch.PushDeliveryStage;
import com.codeheadsystems.keyrelay.server.manager.KeyExchangeManager;
import com.codeheadsystems.keyrelay.server.manager.KeyExchangeSweeper;
import com.codeheadsystems.keyrelay.server.manager.PendingRequestReplayer;
import com.codeheadsystems.keyrelay.server.push.AirNotifierPushProvider;
import com.codeheadsystems.keyrelay.server.push.LoggingPushProvider;
import com.codeheadsystems.keyrelay.server.push.PushProvider;
import com.codeheadsystems.keyrelay.server.resource.KeyExchangeResource;
import com.codeheadsystems.keyrelay.server.resource.KeyRelayExceptionMapper;
import com.codeheadsystems.keyrelay.server.resource.PresenceResource;
import com.codeheadsystems.keyrelay.server.resource.TokenResource;
import com.codeheadsystems.keyrelay.server.store.InMemoryKeyExchangeStore;
import com.codeheadsystems.keyrelay.server.store.InMemorySessionDirectory;
import com.codeheadsystems.keyrelay.server.store.InMemoryTokenDirectory;
import com.codeheadsystems.keyrelay.server.store.KeyExchangeStore;
import com.codeheadsystems.keyrelay.server.store.SessionDirectory;
import com.codeheadsystems.keyrelay.server.store.TokenDirectory;
import com.codeheadsystems.keyrelay.server.transport.MailboxTransport;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the KeyRelay server into an existing Dropwizard application.
 * <p>
 * Registers the key exchange, token and presence resources, the error mapper, the expiry
 * sweeper (as a managed lifecycle object) and its health check. Requires a
 * {@link KeyRelayConfiguration} in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new KeyRelayBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores and, optionally, your own push provider:
 * <pre>{@code
 *   bootstrap.addBundle(new KeyRelayBundle<>(myKeyExchangeStore, myTokenDirectory, myPushProvider));
 * }</pre>
 * A null push provider selects one from configuration: AirNotifier when
 * {@code airNotifierBaseUrl} is set, otherwise a provider that only logs.
 */
@Singleton
public class KeyRelayBundle<C extends KeyRelayConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(KeyRelayBundle.class);

  private final KeyExchangeStore keyExchangeStore;
  private final TokenDirectory tokenDirectory;
  private final PushProvider pushProvider;
  private final Clock clock;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only: pending key exchanges and token registrations are lost on restart.
   */
  public KeyRelayBundle() {
    this(new InMemoryKeyExchangeStore(), new InMemoryTokenDirectory(), null);
    log.warn("""
        #################################################################
        # WARNING: Using in-memory key exchange and token stores.       #
        # Pending requests and device tokens are lost on restart.       #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param keyExchangeStore key exchange request storage
   * @param tokenDirectory   device token storage
   * @param pushProvider     push provider, or null to choose one from configuration
   */
  @Inject
  public KeyRelayBundle(KeyExchangeStore keyExchangeStore,
                        TokenDirectory tokenDirectory,
                        PushProvider pushProvider) {
    this.keyExchangeStore = keyExchangeStore;
    this.tokenDirectory = tokenDirectory;
    this.pushProvider = pushProvider;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    SessionDirectory sessionDirectory = new InMemorySessionDirectory(clock);
    MailboxTransport transport =
        new MailboxTransport(sessionDirectory, clock, configuration.getMailboxCapacity());

    NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(
        new DirectDeliveryStage(sessionDirectory, transport),
        new PushDeliveryStage(tokenDirectory,
            pushProvider != null ? pushProvider : buildPushProvider(configuration, environment),
            configuration.getPushThreads(),
            Duration.ofMillis(configuration.getPushTimeoutMillis()),
            configuration.isPruneInvalidTokens())));

    KeyExchangeManager manager = new KeyExchangeManager(keyExchangeStore, dispatcher, clock,
        Duration.ofSeconds(configuration.getRequestTtlSeconds()),
        Duration.ofSeconds(configuration.getRetentionSeconds()));
    if (configuration.isReplayPendingOnConnect()) {
      sessionDirectory.addListener(new PendingRequestReplayer(manager));
      log.info("Pending key exchange requests will be replayed on connect");
    }

    Duration sweepInterval = Duration.ofSeconds(configuration.getSweepIntervalSeconds());
    KeyExchangeSweeper sweeper = new KeyExchangeSweeper(manager, clock, sweepInterval);
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        sweeper.start();
      }

      @Override
      public void stop() {
        sweeper.shutdown();
        dispatcher.shutdown();
      }
    });

    environment.jersey().register(new KeyRelayExceptionMapper());
    environment.jersey().register(new KeyExchangeResource(manager));
    environment.jersey().register(new TokenResource(tokenDirectory));
    environment.jersey().register(new PresenceResource(transport, sessionDirectory));
    environment.healthChecks().register("key-exchange-sweeper",
        new KeyExchangeSweepHealthCheck(manager, clock, sweepInterval));
  }

  private PushProvider buildPushProvider(C configuration, Environment environment) {
    String baseUrl = configuration.getAirNotifierBaseUrl();
    if (baseUrl == null || baseUrl.isEmpty()) {
      log.warn("No airNotifierBaseUrl configured; push notifications will only be logged. "
          + "Do not use in production.");
      return new LoggingPushProvider();
    }
    Duration timeout = Duration.ofMillis(configuration.getPushTimeoutMillis());
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    return new AirNotifierPushProvider(httpClient, environment.getObjectMapper(),
        URI.create(baseUrl), configuration.getAirNotifierAppName(),
        configuration.getAirNotifierAppKey(), timeout);
  }
}
