/*
 * どこで: リマインダードメインモデル
 * 何を: リマインダーのスナップショット
 * なぜ: 状態変更を新しい値の置き換えとして扱い、スケジューラだけが発火時刻を更新できるようにするため
 */
package com.medsafe.safety.reminder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

public record Reminder(
    UUID id,
    String medication,
    LocalTime timeOfDay,
    ReminderFrequency frequency,
    boolean enabled,
    boolean autoCreated,
    Instant createdAt,
    Instant nextDueAt,
    LocalDateTime lastFiredMinute) {

  Reminder withEnabled(boolean value, Instant nextDue) {
    return new Reminder(
        id, medication, timeOfDay, frequency, value, autoCreated, createdAt, nextDue,
        lastFiredMinute);
  }

  Reminder withFired(LocalDateTime minute, Instant nextDue) {
    return new Reminder(
        id, medication, timeOfDay, frequency, enabled, autoCreated, createdAt, nextDue, minute);
  }
}
