package com.codeheadsystems.keyrelay.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keyrelay.server.manager.KeyExchangeManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyExchangeSweepHealthCheckTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:10:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Mock private KeyExchangeManager manager;

  @Test
  void recentSweep_isHealthy() {
    when(manager.lastSweepAt()).thenReturn(Optional.of(NOW.minusSeconds(45)));

    HealthCheck.Result result =
        new KeyExchangeSweepHealthCheck(manager, CLOCK, Duration.ofSeconds(30)).execute();

    assertThat(result.isHealthy()).isTrue();
  }

  @Test
  void staleSweep_isUnhealthy() {
    when(manager.lastSweepAt()).thenReturn(Optional.of(NOW.minusSeconds(91)));

    HealthCheck.Result result =
        new KeyExchangeSweepHealthCheck(manager, CLOCK, Duration.ofSeconds(30)).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getMessage()).contains("91s");
  }

  @Test
  void noSweepYet_isHealthyWithinGracePeriod() {
    when(manager.lastSweepAt()).thenReturn(Optional.empty());

    assertThat(new KeyExchangeSweepHealthCheck(manager, CLOCK, Duration.ofSeconds(30))
        .execute().isHealthy()).isTrue();
  }
}
