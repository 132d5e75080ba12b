package com.codeheadsystems.keyrelay.server.dispatch;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import com.codeheadsystems.keyrelay.server.push.PushProvider;
import com.codeheadsystems.keyrelay.server.push.PushResult;
import com.codeheadsystems.keyrelay.server.store.TokenDirectory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal stage: pushes to every token linked to the session and aggregates the results.
 * <p>
 * No tokens gives {@link DeliveryOutcome#UNDELIVERABLE}. Otherwise all accepted gives
 * {@link DeliveryOutcome#DELIVERED}, none accepted gives {@link DeliveryOutcome#FAILED}, and
 * anything in between gives {@link DeliveryOutcome#PARTIAL_FAILURE}. Provider calls run on a
 * bounded pool; a call that exceeds the timeout, or throws, counts as a failed token.
 */
public class PushDeliveryStage implements DeliveryStage {

  private static final Logger log = LoggerFactory.getLogger(PushDeliveryStage.class);

  private final TokenDirectory tokenDirectory;
  private final PushProvider pushProvider;
  private final ExecutorService executor;
  private final Duration timeout;
  private final boolean pruneInvalidTokens;

  /**
   * Creates a stage with its own daemon worker pool.
   *
   * @param tokenDirectory     the token directory
   * @param pushProvider       the push provider
   * @param threads            worker pool size
   * @param timeout            per-call timeout
   * @param pruneInvalidTokens whether to remove tokens the provider reports invalid
   */
  public PushDeliveryStage(final TokenDirectory tokenDirectory,
                           final PushProvider pushProvider,
                           final int threads,
                           final Duration timeout,
                           final boolean pruneInvalidTokens) {
    this(tokenDirectory, pushProvider, newWorkerPool(threads), timeout, pruneInvalidTokens);
  }

  public PushDeliveryStage(final TokenDirectory tokenDirectory,
                           final PushProvider pushProvider,
                           final ExecutorService executor,
                           final Duration timeout,
                           final boolean pruneInvalidTokens) {
    this.tokenDirectory = tokenDirectory;
    this.pushProvider = pushProvider;
    this.executor = executor;
    this.timeout = timeout;
    this.pruneInvalidTokens = pruneInvalidTokens;
    log.info("PushDeliveryStage({}, timeout={}, prune={})",
        pushProvider.getClass().getSimpleName(), timeout, pruneInvalidTokens);
  }

  private static ExecutorService newWorkerPool(int threads) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(threads, runnable -> {
      Thread thread = new Thread(runnable, "push-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public Optional<DeliveryOutcome> attempt(Delivery delivery) {
    Set<DeviceTokenRecord> tokens = tokenDirectory.tokensFor(delivery.sessionId());
    if (tokens.isEmpty()) {
      log.debug("No tokens for sessionId={}, {} undeliverable", delivery.sessionId(),
          delivery.kind().wireName());
      return Optional.of(DeliveryOutcome.UNDELIVERABLE);
    }

    List<Map.Entry<DeviceTokenRecord, Future<PushResult>>> calls = new ArrayList<>();
    for (DeviceTokenRecord token : tokens) {
      calls.add(Map.entry(token,
          executor.submit(() -> pushProvider.push(token, delivery.kind(), delivery.payload()))));
    }

    // One deadline for the whole fan-out, so a slow provider cannot multiply the wait.
    long deadline = System.nanoTime() + timeout.toNanos();
    int accepted = 0;
    for (Map.Entry<DeviceTokenRecord, Future<PushResult>> call : calls) {
      PushResult result = await(call.getValue(), deadline);
      if (result.accepted()) {
        accepted++;
      } else {
        handleRejection(call.getKey(), result);
      }
    }

    DeliveryOutcome outcome;
    if (accepted == calls.size()) {
      outcome = DeliveryOutcome.DELIVERED;
    } else if (accepted == 0) {
      outcome = DeliveryOutcome.FAILED;
    } else {
      outcome = DeliveryOutcome.PARTIAL_FAILURE;
    }
    log.debug("Pushed {} to sessionId={}: {}/{} accepted -> {}", delivery.kind().wireName(),
        delivery.sessionId(), accepted, calls.size(), outcome);
    return Optional.of(outcome);
  }

  private PushResult await(Future<PushResult> future, long deadline) {
    long remaining = deadline - System.nanoTime();
    try {
      PushResult result = future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
      return result != null ? result : PushResult.rejected(PushResult.Reason.REJECTED);
    } catch (TimeoutException e) {
      future.cancel(true);
      return PushResult.rejected(PushResult.Reason.TIMEOUT);
    } catch (ExecutionException e) {
      log.warn("Push provider failed", e.getCause());
      return PushResult.rejected(PushResult.Reason.UNAVAILABLE);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return PushResult.rejected(PushResult.Reason.UNAVAILABLE);
    }
  }

  private void handleRejection(DeviceTokenRecord token, PushResult result) {
    log.debug("Push rejected for sessionId={}: {}", token.sessionId(), result.reason());
    if (pruneInvalidTokens && result.reason() == PushResult.Reason.INVALID_TOKEN) {
      if (tokenDirectory.remove(token.token())) {
        log.info("Pruned invalid {} token from sessionId={}", token.platform().wireName(),
            token.sessionId());
      }
    }
  }

  @Override
  public void shutdown() {
    executor.shutdownNow();
  }
}
