package com.codeheadsystems.keyrelay.server.store;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.Platform;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TokenDirectory} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All registrations are lost on server restart; clients re-register on their next launch.
 */
public class InMemoryTokenDirectory implements TokenDirectory {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenDirectory.class);

  private final ConcurrentHashMap<String, DeviceTokenRecord> records = new ConcurrentHashMap<>();
  // Reverse index: sessionId -> tokens. Every add and remove runs inside the session's compute,
  // nested in the token's compute.
  private final ConcurrentHashMap<String, Set<String>> sessionTokens = new ConcurrentHashMap<>();

  @Override
  public DeviceTokenRecord register(String token, Platform platform, DeliveryChannel channel) {
    DeviceTokenRecord stored = records.compute(token, (key, existing) -> existing == null
        ? new DeviceTokenRecord(token, null, platform, channel)
        : existing.withRegistration(platform, channel));
    log.debug("Registered token platform={} channel={}", platform.wireName(), channel.wireName());
    return stored;
  }

  @Override
  public DeviceTokenRecord link(String token, String sessionId) {
    DeviceTokenRecord stored = records.computeIfPresent(token, (key, existing) -> {
      if (sessionId.equals(existing.sessionId())) {
        return existing;
      }
      detach(existing);
      sessionTokens.compute(sessionId, (k, tokens) -> {
        Set<String> linked = tokens == null ? ConcurrentHashMap.newKeySet() : tokens;
        linked.add(token);
        return linked;
      });
      return existing.withSession(sessionId);
    });
    if (stored == null) {
      throw KeyRelayException.unknownToken(token);
    }
    log.debug("Linked token to session={}", sessionId);
    return stored;
  }

  @Override
  public DeviceTokenRecord unlink(String token) {
    DeviceTokenRecord stored = records.computeIfPresent(token, (key, existing) -> {
      detach(existing);
      return existing.withSession(null);
    });
    if (stored == null) {
      throw KeyRelayException.unknownToken(token);
    }
    return stored;
  }

  @Override
  public boolean remove(String token) {
    boolean[] removed = {false};
    records.computeIfPresent(token, (key, existing) -> {
      detach(existing);
      removed[0] = true;
      return null;
    });
    if (removed[0]) {
      log.debug("Removed token");
    }
    return removed[0];
  }

  @Override
  public Optional<DeviceTokenRecord> find(String token) {
    return Optional.ofNullable(records.get(token));
  }

  @Override
  public Set<DeviceTokenRecord> tokensFor(String sessionId) {
    Set<String> tokens = sessionTokens.get(sessionId);
    if (tokens == null) {
      return Set.of();
    }
    return tokens.stream()
        .map(records::get)
        .filter(Objects::nonNull)
        .filter(record -> sessionId.equals(record.sessionId()))
        .collect(Collectors.toUnmodifiableSet());
  }

  private void detach(DeviceTokenRecord record) {
    if (!record.isLinked()) {
      return;
    }
    sessionTokens.computeIfPresent(record.sessionId(), (key, tokens) -> {
      tokens.remove(record.token());
      return tokens.isEmpty() ? null : tokens;
    });
  }
}
