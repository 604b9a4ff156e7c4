/*
 * どこで: Notification 送信層
 * 何を: CI/Test 専用で、特定の宛先プレフィックスに対して送信失敗/遅延を注入する Sender
 * なぜ: 実コード経路を汚さずに FAILED 遷移とタイムアウト経路を E2E で再現するため
 */
package com.medsafe.safety.notification;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "medsafe.notification.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationSender implements NotificationSender {

  private static final Logger logger =
      LoggerFactory.getLogger(FailureInjectingNotificationSender.class);

  /** How a matching recipient fails. */
  public enum Mode {
    /** The transport throws, as a crashed client would. */
    THROW,
    /** The transport answers with a negative result. */
    REJECT,
    /** The transport stalls for the configured delay before delegating. */
    DELAY
  }

  private final LocalNotificationSender delegate;
  private final String recipientPrefix;
  private final Mode mode;
  private final Duration delay;

  public FailureInjectingNotificationSender(
      LocalNotificationSender delegate,
      @Value("${medsafe.notification.failure-injection.recipient-prefix:}") String recipientPrefix,
      @Value("${medsafe.notification.failure-injection.mode:REJECT}") Mode mode,
      @Value("${medsafe.notification.failure-injection.delay:0ms}") Duration delay) {
    this.delegate = delegate;
    this.recipientPrefix = recipientPrefix == null ? "" : recipientPrefix.trim();
    this.mode = mode;
    this.delay = delay;
  }

  @Override
  public SendResult send(String recipient, String body) {
    if (!matches(recipient)) {
      return delegate.send(recipient, body);
    }
    logger.info("notification failure injected recipient={} mode={}", recipient, mode);
    switch (mode) {
      case THROW:
        throw new IllegalStateException(
            "notification delivery failure injection matched recipient=" + recipient);
      case DELAY:
        stall();
        return delegate.send(recipient, body);
      case REJECT:
      default:
        return SendResult.failure("injected rejection for recipient=" + recipient);
    }
  }

  private boolean matches(String recipient) {
    return !recipientPrefix.isEmpty() && recipient.startsWith(recipientPrefix);
  }

  private void stall() {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException ex) {
      // 送信タイムアウトで cancel(true) された場合はここに来る
      Thread.currentThread().interrupt();
      throw new IllegalStateException("injected delay interrupted", ex);
    }
  }
}
