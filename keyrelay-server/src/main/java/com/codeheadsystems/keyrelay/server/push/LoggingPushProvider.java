package com.codeheadsystems.keyrelay.server.push;

import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Development {@link PushProvider} that logs each notification and reports it accepted.
 */
public class LoggingPushProvider implements PushProvider {

  private static final Logger log = LoggerFactory.getLogger(LoggingPushProvider.class);

  public LoggingPushProvider() {
    log.warn("LoggingPushProvider in use: push notifications are logged, not sent");
  }

  @Override
  public PushResult push(DeviceTokenRecord token, EventKind kind, Map<String, String> payload) {
    log.info("push(session={}, platform={}, channel={}, kind={}, fields={})",
        token.sessionId(), token.platform().wireName(), token.channel().wireName(),
        kind.wireName(), payload.keySet());
    return PushResult.ok();
  }
}
