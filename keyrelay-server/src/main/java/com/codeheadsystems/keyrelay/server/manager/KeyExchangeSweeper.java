package com.codeheadsystems.keyrelay.server.manager;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link KeyExchangeManager#expire} on a fixed delay from a single daemon thread.
 * <p>
 * A failed sweep is logged and retried on the next tick. Call {@link #shutdown()} on
 * application shutdown; in Dropwizard, register it as a {@code Managed} component.
 */
public class KeyExchangeSweeper {

  private static final Logger log = LoggerFactory.getLogger(KeyExchangeSweeper.class);

  private final KeyExchangeManager manager;
  private final Clock clock;
  private final Duration interval;
  private final ScheduledExecutorService executor =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "key-exchange-sweeper");
        t.setDaemon(true);
        return t;
      });

  public KeyExchangeSweeper(final KeyExchangeManager manager,
                            final Clock clock,
                            final Duration interval) {
    this.manager = manager;
    this.clock = clock;
    this.interval = interval;
  }

  /**
   * Schedules the sweep. The first run happens immediately.
   */
  public void start() {
    executor.scheduleWithFixedDelay(this::sweep, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("KeyExchangeSweeper started, interval={}", interval);
  }

  void sweep() {
    try {
      manager.expire(clock.instant());
    } catch (RuntimeException e) {
      log.error("Key exchange sweep failed, retrying in {}", interval, e);
    }
  }

  /**
   * Stops the sweep thread.
   */
  public void shutdown() {
    executor.shutdownNow();
    log.info("KeyExchangeSweeper stopped");
  }
}
