/*
 * どこで: リマインダーサービス層
 * 何を: リマインダーの登録/切替/削除と、分単位の発火判定を行う
 * なぜ: 共有状態の変更をここに集約し、同一分での二重発火を構造的に防ぐため
 */
package com.medsafe.safety.reminder;

import com.google.common.annotations.VisibleForTesting;
import com.medsafe.safety.analysis.MedicationEntry;
import com.medsafe.safety.analysis.PrescriptionAnalysis;
import com.medsafe.safety.api.InvalidReminderRequestException;
import com.medsafe.safety.config.ReminderScheduleProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ReminderScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ReminderScheduler.class);

  static final LocalTime DEFAULT_TIME = LocalTime.of(8, 0);
  private static final Pattern TIME_TOKEN =
      Pattern.compile("(\\d{1,2})\\s*(am|pm)", Pattern.CASE_INSENSITIVE);
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

  private final ReminderRepository repository;
  private final ReminderMetrics metrics;
  private final ZoneId zone;
  private final Clock clock;
  // add/toggle/delete/tick を相互排他にし、分単位の発火判定を直列化する
  private final ReentrantLock lock = new ReentrantLock();

  public ReminderScheduler(
      ReminderRepository repository,
      ReminderMetrics metrics,
      ReminderScheduleProperties properties,
      Clock clock) {
    this.repository = repository;
    this.metrics = metrics;
    this.zone = properties.zone();
    this.clock = clock;
  }

  public Reminder addReminder(String medication, String time, String frequency) {
    if (medication == null || medication.isBlank()) {
      throw new InvalidReminderRequestException("medication is required");
    }
    if (time == null || time.isBlank()) {
      throw new InvalidReminderRequestException("time is required");
    }
    final LocalTime timeOfDay = parseTime(time);
    final ReminderFrequency parsedFrequency = parseFrequency(frequency);
    lock.lock();
    try {
      final Reminder reminder = create(medication.trim(), timeOfDay, parsedFrequency, false);
      logger.info(
          "reminder added id={} time={} frequency={}",
          reminder.id(),
          reminder.timeOfDay(),
          reminder.frequency());
      return reminder;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: 解析結果の各薬剤からリマインダーを自動生成する。
   * 動作: 頻度テキストの「数字+am/pm」から時刻を導出し(無ければ 08:00)、既存の手動登録とは重複排除しない。
   */
  public List<Reminder> autoCreateFromAnalysis(PrescriptionAnalysis analysis) {
    if (analysis == null || analysis.medications().isEmpty()) {
      return List.of();
    }
    lock.lock();
    try {
      final List<Reminder> created = new ArrayList<>();
      for (MedicationEntry entry : analysis.medications()) {
        final String label = (entry.name() + " " + entry.dosage()).trim();
        created.add(
            create(
                label,
                deriveTimeOfDay(entry.frequency()),
                deriveFrequency(entry.frequency()),
                true));
      }
      logger.info("reminders auto-created count={}", created.size());
      return List.copyOf(created);
    } finally {
      lock.unlock();
    }
  }

  public Optional<Reminder> toggle(UUID id) {
    lock.lock();
    try {
      final Optional<Reminder> current = repository.findById(id);
      if (current.isEmpty()) {
        logger.debug("reminder toggle ignored for missing id={}", id);
        return Optional.empty();
      }
      final Reminder reminder = current.get();
      final boolean enabled = !reminder.enabled();
      final Instant nextDue =
          enabled
              ? nextDue(reminder.timeOfDay(), reminder.frequency(), now()).toInstant()
              : null;
      final Reminder updated = repository.save(reminder.withEnabled(enabled, nextDue));
      metrics.updateActiveCurrent(repository.countEnabled());
      logger.info("reminder toggled id={} enabled={}", id, enabled);
      return Optional.of(updated);
    } finally {
      lock.unlock();
    }
  }

  public boolean delete(UUID id) {
    lock.lock();
    try {
      final boolean deleted = repository.deleteById(id);
      if (deleted) {
        metrics.updateActiveCurrent(repository.countEnabled());
        logger.info("reminder deleted id={}", id);
      }
      return deleted;
    } finally {
      lock.unlock();
    }
  }

  public List<Reminder> list() {
    return repository.findAll();
  }

  /**
   * 役割: 現在の壁時計の分に一致する有効なリマインダーの発火イベントを生成する。
   * 動作: lastFiredMinute が同じ分のものはスキップするため、同一分内の複数回呼び出しでも 1 回だけ発火する。
   */
  public List<ReminderDueEvent> tick(Instant now) {
    final ZonedDateTime zonedNow = now.atZone(zone);
    final LocalDateTime minute = zonedNow.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES);
    lock.lock();
    try {
      final List<ReminderDueEvent> due = new ArrayList<>();
      for (Reminder reminder : repository.findAll()) {
        if (!isDueAt(reminder, minute)) {
          continue;
        }
        if (minute.equals(reminder.lastFiredMinute())) {
          metrics.recordDuplicateSuppressed();
          logger.debug("reminder already fired id={} minute={}", reminder.id(), minute);
          continue;
        }
        final Instant nextDue =
            nextDue(reminder.timeOfDay(), reminder.frequency(), zonedNow).toInstant();
        repository.save(reminder.withFired(minute, nextDue));
        due.add(
            new ReminderDueEvent(
                reminder.id(),
                reminder.medication(),
                reminder.timeOfDay(),
                reminder.frequency(),
                minute));
        metrics.recordFired();
        logger.info("reminder fired id={} minute={}", reminder.id(), minute);
      }
      return List.copyOf(due);
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: 指定時刻の次回予定日時を算出する。
   * 動作: 今日の該当時刻が now 以前なら翌日へ繰り越し、WEEKLY は now と同じ曜日になるまで日を進める。
   */
  public ZonedDateTime nextDue(LocalTime time, ReminderFrequency frequency, ZonedDateTime now) {
    ZonedDateTime candidate = now.truncatedTo(ChronoUnit.DAYS).with(time);
    if (!candidate.isAfter(now)) {
      candidate = candidate.plusDays(1);
    }
    if (frequency == ReminderFrequency.WEEKLY) {
      while (candidate.getDayOfWeek() != now.getDayOfWeek()) {
        candidate = candidate.plusDays(1);
      }
    }
    return candidate;
  }

  @VisibleForTesting
  static LocalTime deriveTimeOfDay(String frequencyText) {
    if (frequencyText == null) {
      return DEFAULT_TIME;
    }
    final Matcher matcher = TIME_TOKEN.matcher(frequencyText);
    if (!matcher.find()) {
      return DEFAULT_TIME;
    }
    int hour = Integer.parseInt(matcher.group(1));
    if (hour < 1 || hour > 12) {
      return DEFAULT_TIME;
    }
    final boolean pm = matcher.group(2).equalsIgnoreCase("pm");
    if (pm && hour != 12) {
      hour += 12;
    } else if (!pm && hour == 12) {
      hour = 0;
    }
    return LocalTime.of(hour, 0);
  }

  @VisibleForTesting
  static ReminderFrequency deriveFrequency(String frequencyText) {
    final String lower = frequencyText == null ? "" : frequencyText.toLowerCase(Locale.ROOT);
    if (lower.contains("twice")) {
      return ReminderFrequency.TWICE_DAILY;
    }
    if (lower.contains("three")) {
      return ReminderFrequency.THREE_TIMES_DAILY;
    }
    return ReminderFrequency.DAILY;
  }

  private Reminder create(
      String medication, LocalTime timeOfDay, ReminderFrequency frequency, boolean autoCreated) {
    final ZonedDateTime now = now();
    final Reminder reminder =
        new Reminder(
            UUID.randomUUID(),
            medication,
            timeOfDay,
            frequency,
            true,
            autoCreated,
            now.toInstant(),
            nextDue(timeOfDay, frequency, now).toInstant(),
            null);
    repository.save(reminder);
    metrics.updateActiveCurrent(repository.countEnabled());
    return reminder;
  }

  private boolean isDueAt(Reminder reminder, LocalDateTime minute) {
    if (!reminder.enabled() || !reminder.timeOfDay().equals(minute.toLocalTime())) {
      return false;
    }
    if (reminder.frequency() == ReminderFrequency.AS_NEEDED) {
      return false;
    }
    if (reminder.frequency() == ReminderFrequency.WEEKLY) {
      return reminder.createdAt().atZone(zone).getDayOfWeek() == minute.getDayOfWeek();
    }
    return true;
  }

  private LocalTime parseTime(String time) {
    try {
      return LocalTime.parse(time.trim(), TIME_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new InvalidReminderRequestException("time must be HH:MM: " + time);
    }
  }

  private ReminderFrequency parseFrequency(String frequency) {
    if (frequency == null || frequency.isBlank()) {
      return ReminderFrequency.DAILY;
    }
    try {
      return ReminderFrequency.fromValue(frequency);
    } catch (IllegalArgumentException ex) {
      throw new InvalidReminderRequestException(ex.getMessage());
    }
  }

  private ZonedDateTime now() {
    return ZonedDateTime.now(clock).withZoneSameInstant(zone);
  }
}
