package com.medsafe.safety.notification;

/** Outcome reported by a {@link NotificationSender}. {@code failureReason} is null when delivered. */
public record SendResult(boolean delivered, String failureReason) {

  public static SendResult success() {
    return new SendResult(true, null);
  }

  public static SendResult failure(String reason) {
    return new SendResult(false, reason);
  }
}
