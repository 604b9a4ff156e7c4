/*
 * どこで: Notification サービス層
 * 何を: 送信結果/送信遅延/デバウンス破棄件数/履歴件数のメトリクスを記録する
 * なぜ: タイムアウトや送信先不達の発生状況を Prometheus から直接観測できるようにするため
 */
package com.medsafe.safety.notification;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "medsafe.notification.dispatch.total";
  private static final String METRIC_DISPATCH_LATENCY = "medsafe.notification.dispatch.latency";
  private static final String METRIC_DEBOUNCE_SUPERSEDED_TOTAL =
      "medsafe.notification.debounce.superseded.total";
  private static final String METRIC_HISTORY_CURRENT = "medsafe.notification.history.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger historyCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final Counter debounceSupersededCounter;
  private final Timer dispatchLatencyTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_HISTORY_CURRENT, historyCurrent, AtomicInteger::get)
        .description("Current number of notification events in history")
        .register(meterRegistry);
    this.debounceSupersededCounter =
        Counter.builder(METRIC_DEBOUNCE_SUPERSEDED_TOTAL)
            .description("Pending verification dispatches cancelled by a newer phone number")
            .register(meterRegistry);
    this.dispatchLatencyTimer =
        Timer.builder(METRIC_DISPATCH_LATENCY)
            .description("Delay from event creation to terminal delivery state")
            .register(meterRegistry);
  }

  public void recordDispatchResult(String result) {
    dispatchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Notification dispatch outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDispatchLatency(Instant createdAt, Instant completedAt) {
    if (createdAt == null || completedAt == null || completedAt.isBefore(createdAt)) {
      return;
    }
    dispatchLatencyTimer.record(Duration.between(createdAt, completedAt));
  }

  public void recordDebounceSuperseded() {
    debounceSupersededCounter.increment();
  }

  public void updateHistoryCurrent(int count) {
    historyCurrent.set(Math.max(count, 0));
  }
}
