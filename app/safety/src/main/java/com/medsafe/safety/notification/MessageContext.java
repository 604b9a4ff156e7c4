package com.medsafe.safety.notification;

import java.util.List;

/** Recipient-specific fields interpolated into a message template. Unused fields are null. */
public record MessageContext(
    String recipient,
    String medication,
    String time,
    String frequency,
    Integer safetyScore,
    List<String> details) {

  public MessageContext {
    details = details == null ? List.of() : List.copyOf(details);
  }

  public static MessageContext welcome(String recipient) {
    return new MessageContext(recipient, null, null, null, null, List.of());
  }

  public static MessageContext reminder(
      String recipient, String medication, String time, String frequency) {
    return new MessageContext(recipient, medication, time, frequency, null, List.of());
  }

  public static MessageContext summary(String recipient, int safetyScore, List<String> details) {
    return new MessageContext(recipient, null, null, null, safetyScore, details);
  }
}
