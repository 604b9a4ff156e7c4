/*
 * どこで: Safety アプリの設定バインド
 * 何を: 通知のデバウンス待機/バッチ間隔/送信タイムアウト設定を保持する
 * なぜ: 運用パラメータを外部化し、不正な Duration を起動時に弾くため
 */
package com.medsafe.safety.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "medsafe.notification")
@Validated
public record NotificationDeliveryProperties(
    @NotNull Duration settleDelay,
    @NotNull Duration staggerSpacing,
    @NotNull Duration sendTimeout,
    @Min(1) int errorMessageMaxLength) {

  @AssertTrue(message = "medsafe.notification.settle-delay must not be negative")
  public boolean isSettleDelayValid() {
    return settleDelay != null && !settleDelay.isNegative();
  }

  @AssertTrue(message = "medsafe.notification.stagger-spacing must not be negative")
  public boolean isStaggerSpacingValid() {
    return staggerSpacing != null && !staggerSpacing.isNegative();
  }

  @AssertTrue(message = "medsafe.notification.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    // 無制限待機を避けるため、ゼロ/負値は許可しない。
    return sendTimeout != null && !sendTimeout.isZero() && !sendTimeout.isNegative();
  }
}
