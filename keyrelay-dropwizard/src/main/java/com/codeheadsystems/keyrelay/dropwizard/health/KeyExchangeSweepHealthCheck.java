package com.codeheadsystems.keyrelay.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keyrelay.server.manager.KeyExchangeManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Health check that verifies the expiry sweep is still running.
 * <p>
 * Unhealthy when the last completed sweep (or, before the first one, the check's creation) is
 * more than three sweep intervals in the past.
 */
public class KeyExchangeSweepHealthCheck extends HealthCheck {

  private static final int MISSED_INTERVALS = 3;

  private final KeyExchangeManager manager;
  private final Clock clock;
  private final Duration maxAge;
  private final Instant createdAt;

  /**
   * Instantiates a new Key exchange sweep health check.
   *
   * @param manager       the manager whose sweeps are tracked
   * @param clock         the clock
   * @param sweepInterval the configured sweep interval
   */
  public KeyExchangeSweepHealthCheck(KeyExchangeManager manager, Clock clock,
                                     Duration sweepInterval) {
    this.manager = manager;
    this.clock = clock;
    this.maxAge = sweepInterval.multipliedBy(MISSED_INTERVALS);
    this.createdAt = clock.instant();
  }

  @Override
  protected Result check() {
    Instant reference = manager.lastSweepAt().orElse(createdAt);
    Duration age = Duration.between(reference, clock.instant());
    if (age.compareTo(maxAge) > 0) {
      return Result.unhealthy("Last expiry sweep was %ds ago (limit %ds)",
          age.toSeconds(), maxAge.toSeconds());
    }
    return Result.healthy("last sweep %ds ago", age.toSeconds());
  }
}
