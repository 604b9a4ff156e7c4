/*
 * どこで: リマインダーリポジトリ
 * 何を: 登録順を保つインメモリ実装
 * なぜ: 永続化の耐久性を要求しないため、プロセス内の順序付きコレクションで十分とする
 */
package com.medsafe.safety.reminder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryReminderRepository implements ReminderRepository {

  private final Map<UUID, Reminder> reminders = new LinkedHashMap<>();

  @Override
  public synchronized Reminder save(Reminder reminder) {
    reminders.put(reminder.id(), reminder);
    return reminder;
  }

  @Override
  public synchronized Optional<Reminder> findById(UUID id) {
    return Optional.ofNullable(reminders.get(id));
  }

  @Override
  public synchronized List<Reminder> findAll() {
    return List.copyOf(reminders.values());
  }

  @Override
  public synchronized boolean deleteById(UUID id) {
    return reminders.remove(id) != null;
  }

  @Override
  public synchronized int countEnabled() {
    return (int) reminders.values().stream().filter(Reminder::enabled).count();
  }
}
