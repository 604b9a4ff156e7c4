/*
 * どこで: リマインダーリポジトリ
 * 何を: リマインダーの保存/検索/削除を抽象化する
 * なぜ: 永続化方式を差し替え可能にし、スケジューラを保存先から独立させるため
 */
package com.medsafe.safety.reminder;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReminderRepository {

  /** Inserts or replaces by id, keeping the original insertion position. */
  Reminder save(Reminder reminder);

  Optional<Reminder> findById(UUID id);

  List<Reminder> findAll();

  boolean deleteById(UUID id);

  int countEnabled();
}
