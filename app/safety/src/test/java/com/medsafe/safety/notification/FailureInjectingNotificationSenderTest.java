/*
 * どこで: Notification 送信層のユニットテスト
 * 何を: CI/Test 専用失敗注入 Sender のモードごとの分岐を検証する
 * なぜ: FAILED 遷移/タイムアウト検証シナリオの前提が壊れないようにするため
 */
package com.medsafe.safety.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.medsafe.safety.notification.FailureInjectingNotificationSender.Mode;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class FailureInjectingNotificationSenderTest {

  private final LocalNotificationSender delegate = mock(LocalNotificationSender.class);

  @Test
  void throwModeRaisesForMatchingRecipient() {
    final FailureInjectingNotificationSender sender = sender("+1999", Mode.THROW, Duration.ZERO);

    assertThatThrownBy(() -> sender.send("+19990001111", "body"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failure injection");
    verify(delegate, never()).send("+19990001111", "body");
  }

  @Test
  void rejectModeReturnsNegativeResult() {
    final FailureInjectingNotificationSender sender = sender("+1999", Mode.REJECT, Duration.ZERO);

    final SendResult result = sender.send("+19990001111", "body");

    assertThat(result.delivered()).isFalse();
    assertThat(result.failureReason()).contains("injected rejection");
  }

  @Test
  void delayModeStallsThenDelegates() {
    when(delegate.send("+19990001111", "body")).thenReturn(SendResult.success());
    final FailureInjectingNotificationSender sender =
        sender("+1999", Mode.DELAY, Duration.ofMillis(20));

    final long started = System.nanoTime();
    final SendResult result = sender.send("+19990001111", "body");

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(20));
    assertThat(result.delivered()).isTrue();
  }

  @Test
  void nonMatchingOrBlankPrefixDelegates() {
    when(delegate.send("+15550001111", "body")).thenReturn(SendResult.success());

    assertThat(sender("+1999", Mode.THROW, Duration.ZERO).send("+15550001111", "body").delivered())
        .isTrue();
    assertThat(sender(" ", Mode.THROW, Duration.ZERO).send("+15550001111", "body").delivered())
        .isTrue();
  }

  private FailureInjectingNotificationSender sender(String prefix, Mode mode, Duration delay) {
    return new FailureInjectingNotificationSender(delegate, prefix, mode, delay);
  }
}
