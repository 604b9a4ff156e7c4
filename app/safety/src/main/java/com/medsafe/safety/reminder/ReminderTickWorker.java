/*
 * どこで: リマインダー発火ワーカー
 * 何を: スケジュールで発火判定を起動し、期限到来の通知を送る
 * なぜ: 時刻起点の状態変更を単一の定期実行に集約するため
 */
package com.medsafe.safety.reminder;

import com.medsafe.safety.notification.NotificationDispatcher;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "medsafe.reminder.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderTickWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReminderTickWorker.class);

  private final ReminderScheduler scheduler;
  private final NotificationDispatcher dispatcher;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${medsafe.reminder.tick-interval}")
  public void run() {
    final List<ReminderDueEvent> due = scheduler.tick(Instant.now(clock));
    for (ReminderDueEvent event : due) {
      try {
        dispatcher.notifyReminderDue(event);
      } catch (RuntimeException ex) {
        // 1 件の失敗で同じ分の他のリマインダーを止めない
        logger.warn("reminder notification failed id={}", event.reminderId(), ex);
      }
    }
  }
}
