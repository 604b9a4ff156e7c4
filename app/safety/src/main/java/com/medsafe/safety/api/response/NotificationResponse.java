package com.medsafe.safety.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.medsafe.safety.notification.NotificationEvent;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    String id,
    String recipient,
    String messageType,
    String body,
    String deliveryState,
    String failureReason,
    String createdAt,
    String completedAt) {

  public static NotificationResponse from(NotificationEvent event) {
    return new NotificationResponse(
        event.id().toString(),
        event.recipient(),
        event.messageType().name(),
        event.composedBody(),
        event.deliveryState().name(),
        event.failureReason(),
        event.createdAt().toString(),
        event.completedAt() == null ? null : event.completedAt().toString());
  }
}
