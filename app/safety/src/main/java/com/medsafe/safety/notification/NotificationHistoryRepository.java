/*
 * どこで: Notification 永続化層
 * 何を: 通知履歴の追記と配送状態の遷移を扱う
 * なぜ: 履歴の順序と一方向の状態遷移を保存先に依存せず保証するため
 */
package com.medsafe.safety.notification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationHistoryRepository {

  /**
   * Appends a PENDING event stamped with its recording instant and returns the stored snapshot.
   * The stored {@code createdAt} never precedes the previous entry's, so the history stays ordered
   * by creation time. Rejects an id that is already in the history.
   */
  NotificationEvent append(NotificationEvent event, Instant recordedAt);

  /** Moves a PENDING event to a terminal state and returns the updated snapshot. */
  NotificationEvent transition(UUID id, DeliveryState state, String failureReason, Instant at);

  Optional<NotificationEvent> findById(UUID id);

  List<NotificationEvent> findAll();

  int size();
}
