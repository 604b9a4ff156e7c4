/*
 * どこで: Notification 永続化層
 * 何を: プロセス内メモリに通知履歴を保持する
 * なぜ: 単一ユーザーのセッション内で履歴を参照できれば十分なため
 */
package com.medsafe.safety.notification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryNotificationHistoryRepository implements NotificationHistoryRepository {

  private final List<UUID> order = new ArrayList<>();
  private final Map<UUID, NotificationEvent> events = new HashMap<>();
  private Instant lastCreatedAt = Instant.EPOCH;

  @Override
  public synchronized NotificationEvent append(NotificationEvent event, Instant recordedAt) {
    if (event.deliveryState() != DeliveryState.PENDING) {
      throw new IllegalArgumentException("only pending events can be appended id=" + event.id());
    }
    if (events.containsKey(event.id())) {
      throw new IllegalStateException("notification already dispatched id=" + event.id());
    }
    // 時計が巻き戻っても履歴の createdAt 順は崩さない
    final Instant createdAt = recordedAt.isBefore(lastCreatedAt) ? lastCreatedAt : recordedAt;
    final NotificationEvent recorded = event.withCreatedAt(createdAt);
    events.put(recorded.id(), recorded);
    order.add(recorded.id());
    lastCreatedAt = createdAt;
    return recorded;
  }

  @Override
  public synchronized NotificationEvent transition(
      UUID id, DeliveryState state, String failureReason, Instant at) {
    final NotificationEvent current = events.get(id);
    if (current == null) {
      throw new IllegalStateException("unknown notification id=" + id);
    }
    if (current.deliveryState().isTerminal()) {
      throw new IllegalStateException(
          "notification already in terminal state id=" + id + " state=" + current.deliveryState());
    }
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("target state must be terminal: " + state);
    }
    final NotificationEvent updated = current.withOutcome(state, failureReason, at);
    events.put(id, updated);
    return updated;
  }

  @Override
  public synchronized Optional<NotificationEvent> findById(UUID id) {
    return Optional.ofNullable(events.get(id));
  }

  @Override
  public synchronized List<NotificationEvent> findAll() {
    final List<NotificationEvent> snapshot = new ArrayList<>(order.size());
    for (UUID id : order) {
      snapshot.add(events.get(id));
    }
    return List.copyOf(snapshot);
  }

  @Override
  public synchronized int size() {
    return order.size();
  }
}
