/*
 * どこで: Notification メトリクステスト
 * 何を: 送信結果/送信遅延/デバウンス破棄/履歴件数メトリクスが記録されることを検証する
 * なぜ: 通知の計測回帰を防ぐため
 */
package com.medsafe.safety.notification;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  @Test
  void recordsDispatchAndDebounceMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    final Instant createdAt = Instant.parse("2026-01-17T00:00:00Z");
    final Instant completedAt = Instant.parse("2026-01-17T00:00:02Z");

    metrics.recordDispatchResult("delivered");
    metrics.recordDispatchResult("timeout");
    metrics.recordDispatchLatency(createdAt, completedAt);
    // 逆転した時刻は記録しない
    metrics.recordDispatchLatency(completedAt, createdAt);
    metrics.recordDebounceSuperseded();
    metrics.updateHistoryCurrent(4);

    final Counter delivered =
        registry.get("medsafe.notification.dispatch.total").tag("result", "delivered").counter();
    final Counter timeout =
        registry.get("medsafe.notification.dispatch.total").tag("result", "timeout").counter();
    final Timer latency = registry.get("medsafe.notification.dispatch.latency").timer();
    final Counter superseded =
        registry.get("medsafe.notification.debounce.superseded.total").counter();
    final Gauge history = registry.get("medsafe.notification.history.current").gauge();

    assertThat(delivered.count()).isEqualTo(1.0d);
    assertThat(timeout.count()).isEqualTo(1.0d);
    assertThat(latency.count()).isEqualTo(1L);
    assertThat(superseded.count()).isEqualTo(1.0d);
    assertThat(history.value()).isEqualTo(4.0d);
  }
}
