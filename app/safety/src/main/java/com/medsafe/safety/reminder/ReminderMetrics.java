/*
 * どこで: リマインダーサービス層
 * 何を: 発火件数/重複抑止件数/有効リマインダー数のメトリクスを記録する
 * なぜ: 二重発火の抑止が実際に働いているかを Prometheus から観測するため
 */
package com.medsafe.safety.reminder;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ReminderMetrics {

  private static final String METRIC_FIRED_TOTAL = "medsafe.reminder.fired.total";
  private static final String METRIC_DUPLICATE_SUPPRESSED_TOTAL =
      "medsafe.reminder.duplicate.suppressed.total";
  private static final String METRIC_ACTIVE_CURRENT = "medsafe.reminder.active.current";

  private final AtomicInteger activeCurrent = new AtomicInteger(0);
  private final Counter firedCounter;
  private final Counter duplicateSuppressedCounter;

  public ReminderMetrics(MeterRegistry meterRegistry) {
    Gauge.builder(METRIC_ACTIVE_CURRENT, activeCurrent, AtomicInteger::get)
        .description("Current number of enabled reminders")
        .register(meterRegistry);
    this.firedCounter =
        Counter.builder(METRIC_FIRED_TOTAL)
            .description("Total number of reminder due events emitted")
            .register(meterRegistry);
    this.duplicateSuppressedCounter =
        Counter.builder(METRIC_DUPLICATE_SUPPRESSED_TOTAL)
            .description("Ticks that skipped a reminder already fired in the same minute")
            .register(meterRegistry);
  }

  public void recordFired() {
    firedCounter.increment();
  }

  public void recordDuplicateSuppressed() {
    duplicateSuppressedCounter.increment();
  }

  public void updateActiveCurrent(int count) {
    activeCurrent.set(Math.max(count, 0));
  }
}
