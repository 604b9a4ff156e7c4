/*
 * どこで: Safety API レスポンス DTO
 * 何を: リマインダー 1 件の表示用表現を定義する
 * なぜ: 内部の発火管理項目(lastFiredMinute)をクライアントへ露出しないため
 */
package com.medsafe.safety.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.medsafe.safety.reminder.Reminder;
import java.time.format.DateTimeFormatter;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReminderResponse(
    String id,
    String medication,
    String time,
    String frequency,
    boolean enabled,
    boolean autoCreated,
    String nextDueAt) {

  private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("HH:mm");

  public static ReminderResponse from(Reminder reminder) {
    return new ReminderResponse(
        reminder.id().toString(),
        reminder.medication(),
        DISPLAY_TIME.format(reminder.timeOfDay()),
        reminder.frequency().label(),
        reminder.enabled(),
        reminder.autoCreated(),
        reminder.nextDueAt() == null ? null : reminder.nextDueAt().toString());
  }
}
