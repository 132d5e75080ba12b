package com.codeheadsystems.keyrelay.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;

/**
 * Dropwizard configuration for the KeyRelay server.
 * <p>
 * Every property has a working default, so an empty block starts a development server that
 * logs push notifications instead of sending them. For production, set
 * {@code airNotifierBaseUrl}, {@code airNotifierAppName} and {@code airNotifierAppKey}.
 */
public class KeyRelayConfiguration extends Configuration {

  /**
   * How long a key exchange request may stay pending before the sweep expires it.
   */
  @Min(1)
  private long requestTtlSeconds = 300;

  /**
   * Delay between expiry sweeps. The health check reports unhealthy when no sweep has
   * completed within three intervals.
   */
  @Min(1)
  private long sweepIntervalSeconds = 30;

  /**
   * How long accepted, rejected and expired requests are kept (for status lookups) before
   * the sweep purges them.
   */
  @Min(0)
  private long retentionSeconds = 3600;

  /**
   * Upper bound on one push fan-out. Tokens whose provider call has not answered by then
   * count as failed.
   */
  @Min(1)
  private long pushTimeoutMillis = 5000;

  /**
   * Worker threads for push provider calls.
   */
  @Min(1)
  private int pushThreads = 4;

  /**
   * Remove tokens the push provider reports as invalid.
   */
  private boolean pruneInvalidTokens = true;

  /**
   * Re-deliver pending requests to a session as soon as it connects. Off by default;
   * clients can fetch {@code GET /key-exchange/pending/{sessionId}} instead.
   */
  private boolean replayPendingOnConnect = false;

  /**
   * Maximum undrained direct deliveries per connection. A full mailbox makes the dispatcher
   * fall back to push.
   */
  @Min(1)
  private int mailboxCapacity = 256;

  /**
   * Base URL of the AirNotifier push relay, e.g. {@code https://push.example.org}.
   * Leave empty to log notifications instead of sending them (dev only).
   */
  private String airNotifierBaseUrl = "";

  /**
   * AirNotifier application name, sent as {@code X-An-App-Name}.
   */
  private String airNotifierAppName = "";

  /**
   * AirNotifier application key, sent as {@code X-An-App-Key}.
   */
  private String airNotifierAppKey = "";

  /**
   * Gets request ttl seconds.
   *
   * @return the request ttl seconds
   */
  @JsonProperty
  public long getRequestTtlSeconds() {
    return requestTtlSeconds;
  }

  /**
   * Sets request ttl seconds.
   *
   * @param requestTtlSeconds the request ttl seconds
   */
  @JsonProperty
  public void setRequestTtlSeconds(long requestTtlSeconds) {
    this.requestTtlSeconds = requestTtlSeconds;
  }

  /**
   * Gets sweep interval seconds.
   *
   * @return the sweep interval seconds
   */
  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  /**
   * Sets sweep interval seconds.
   *
   * @param sweepIntervalSeconds the sweep interval seconds
   */
  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }

  /**
   * Gets retention seconds.
   *
   * @return the retention seconds
   */
  @JsonProperty
  public long getRetentionSeconds() {
    return retentionSeconds;
  }

  /**
   * Sets retention seconds.
   *
   * @param retentionSeconds the retention seconds
   */
  @JsonProperty
  public void setRetentionSeconds(long retentionSeconds) {
    this.retentionSeconds = retentionSeconds;
  }

  /**
   * Gets push timeout millis.
   *
   * @return the push timeout millis
   */
  @JsonProperty
  public long getPushTimeoutMillis() {
    return pushTimeoutMillis;
  }

  /**
   * Sets push timeout millis.
   *
   * @param pushTimeoutMillis the push timeout millis
   */
  @JsonProperty
  public void setPushTimeoutMillis(long pushTimeoutMillis) {
    this.pushTimeoutMillis = pushTimeoutMillis;
  }

  /**
   * Gets push threads.
   *
   * @return the push threads
   */
  @JsonProperty
  public int getPushThreads() {
    return pushThreads;
  }

  /**
   * Sets push threads.
   *
   * @param pushThreads the push threads
   */
  @JsonProperty
  public void setPushThreads(int pushThreads) {
    this.pushThreads = pushThreads;
  }

  /**
   * Gets prune invalid tokens.
   *
   * @return the prune invalid tokens
   */
  @JsonProperty
  public boolean isPruneInvalidTokens() {
    return pruneInvalidTokens;
  }

  /**
   * Sets prune invalid tokens.
   *
   * @param pruneInvalidTokens the prune invalid tokens
   */
  @JsonProperty
  public void setPruneInvalidTokens(boolean pruneInvalidTokens) {
    this.pruneInvalidTokens = pruneInvalidTokens;
  }

  /**
   * Gets replay pending on connect.
   *
   * @return the replay pending on connect
   */
  @JsonProperty
  public boolean isReplayPendingOnConnect() {
    return replayPendingOnConnect;
  }

  /**
   * Sets replay pending on connect.
   *
   * @param replayPendingOnConnect the replay pending on connect
   */
  @JsonProperty
  public void setReplayPendingOnConnect(boolean replayPendingOnConnect) {
    this.replayPendingOnConnect = replayPendingOnConnect;
  }

  /**
   * Gets mailbox capacity.
   *
   * @return the mailbox capacity
   */
  @JsonProperty
  public int getMailboxCapacity() {
    return mailboxCapacity;
  }

  /**
   * Sets mailbox capacity.
   *
   * @param mailboxCapacity the mailbox capacity
   */
  @JsonProperty
  public void setMailboxCapacity(int mailboxCapacity) {
    this.mailboxCapacity = mailboxCapacity;
  }

  /**
   * Gets air notifier base url.
   *
   * @return the air notifier base url
   */
  @JsonProperty
  public String getAirNotifierBaseUrl() {
    return airNotifierBaseUrl;
  }

  /**
   * Sets air notifier base url.
   *
   * @param airNotifierBaseUrl the air notifier base url
   */
  @JsonProperty
  public void setAirNotifierBaseUrl(String airNotifierBaseUrl) {
    this.airNotifierBaseUrl = airNotifierBaseUrl;
  }

  /**
   * Gets air notifier app name.
   *
   * @return the air notifier app name
   */
  @JsonProperty
  public String getAirNotifierAppName() {
    return airNotifierAppName;
  }

  /**
   * Sets air notifier app name.
   *
   * @param airNotifierAppName the air notifier app name
   */
  @JsonProperty
  public void setAirNotifierAppName(String airNotifierAppName) {
    this.airNotifierAppName = airNotifierAppName;
  }

  /**
   * Gets air notifier app key.
   *
   * @return the air notifier app key
   */
  @JsonProperty
  public String getAirNotifierAppKey() {
    return airNotifierAppKey;
  }

  /**
   * Sets air notifier app key.
   *
   * @param airNotifierAppKey the air notifier app key
   */
  @JsonProperty
  public void setAirNotifierAppKey(String airNotifierAppKey) {
    this.airNotifierAppKey = airNotifierAppKey;
  }
}
