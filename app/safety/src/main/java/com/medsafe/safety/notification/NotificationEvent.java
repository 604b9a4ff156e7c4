/*
 * どこで: Notification ドメインモデル
 * 何を: 送信対象の通知イベントのスナップショット
 * なぜ: 履歴は追記のみとし、配送状態の遷移だけを新しい値で置き換えるため
 */
package com.medsafe.safety.notification;

import java.time.Instant;
import java.util.UUID;

public record NotificationEvent(
    UUID id,
    String recipient,
    MessageType messageType,
    String composedBody,
    Instant createdAt,
    DeliveryState deliveryState,
    String failureReason,
    Instant completedAt) {

  public static NotificationEvent pending(
      String recipient, MessageType messageType, String composedBody, Instant createdAt) {
    return new NotificationEvent(
        UUID.randomUUID(),
        recipient,
        messageType,
        composedBody,
        createdAt,
        DeliveryState.PENDING,
        null,
        null);
  }

  NotificationEvent withCreatedAt(Instant at) {
    return new NotificationEvent(
        id, recipient, messageType, composedBody, at, deliveryState, failureReason, completedAt);
  }

  NotificationEvent withOutcome(DeliveryState state, String reason, Instant at) {
    return new NotificationEvent(
        id, recipient, messageType, composedBody, createdAt, state, reason, at);
  }
}
