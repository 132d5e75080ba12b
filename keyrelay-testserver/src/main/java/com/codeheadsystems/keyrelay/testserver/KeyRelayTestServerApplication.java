package com.codeheadsystems.keyrelay.testserver;

import com.codeheadsystems.keyrelay.dropwizard.KeyRelayBundle;
import com.codeheadsystems.keyrelay.dropwizard.KeyRelayConfiguration;
import com.codeheadsystems.keyrelay.server.store.InMemoryKeyExchangeStore;
import com.codeheadsystems.keyrelay.server.store.InMemoryTokenDirectory;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Local KeyRelay server for trying out clients and {@code HandshakeCli}.
 * <p>
 * Start with {@code server config/config.yml}. Pending requests and device tokens are held in
 * memory only. Every tunable in the YAML reads a {@code KEYRELAY_*} or {@code AIRNOTIFIER_*}
 * environment variable first; leave {@code AIRNOTIFIER_BASE_URL} unset to log pushes instead of
 * sending them.
 */
public class KeyRelayTestServerApplication extends Application<KeyRelayConfiguration> {

  public static void main(String[] args) throws Exception {
    new KeyRelayTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "keyrelay-testserver";
  }

  @Override
  public void initialize(Bootstrap<KeyRelayConfiguration> bootstrap) {
    // Non-strict: variables without a default and not set in the environment stay literal.
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
    // Explicit stores skip the in-memory warning banner; a null provider defers to config.
    bootstrap.addBundle(new KeyRelayBundle<>(
        new InMemoryKeyExchangeStore(), new InMemoryTokenDirectory(), null));
  }

  @Override
  public void run(KeyRelayConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
