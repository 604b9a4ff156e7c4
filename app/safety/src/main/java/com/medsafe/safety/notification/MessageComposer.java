/*
 * どこで: Notification サービス層
 * 何を: 種別ごとのテンプレートから送信本文を組み立てる
 * なぜ: 本文生成を副作用のない処理に分離し、送信処理から独立して検証するため
 */
package com.medsafe.safety.notification;

import org.springframework.stereotype.Component;

@Component
public class MessageComposer {

  static final int SAFE_SCORE_THRESHOLD = 70;
  private static final String SIGNATURE = "MedSafe - Your Health Companion";

  public String compose(MessageType type, MessageContext context) {
    return switch (type) {
      case WELCOME -> welcome(context);
      case CONFIRMATION -> confirmation(context);
      case REMINDER_TRIGGER -> reminderTrigger(context);
      case SUMMARY_REPORT -> summaryReport(context);
    };
  }

  private String welcome(MessageContext context) {
    return "Welcome to MedSafe!\n\n"
        + "Phone Number Verified: " + context.recipient() + "\n"
        + "Notifications: Enabled\n\n"
        + "You'll receive medication reminders with dosage instructions and timing alerts.\n"
        + "Reply to any reminder with: TAKEN | SNOOZE | SKIP | INFO\n\n"
        + SIGNATURE;
  }

  private String confirmation(MessageContext context) {
    return "Reminder Activated\n\n"
        + "Medication: " + context.medication() + "\n"
        + "Time: " + context.time() + "\n"
        + "Frequency: " + context.frequency() + "\n\n"
        + "Reply STOP to disable this reminder\n\n"
        + SIGNATURE;
  }

  private String reminderTrigger(MessageContext context) {
    return "MEDICATION REMINDER\n\n"
        + "Time to take: " + context.medication() + "\n"
        + "Scheduled for: " + context.time() + "\n"
        + "Frequency: " + context.frequency() + "\n\n"
        + "Please take your medication now\n"
        + "Reply with: TAKEN - mark as taken | SNOOZE - remind in 15 minutes | SKIP - skip this dose\n\n"
        + SIGNATURE;
  }

  private String summaryReport(MessageContext context) {
    final StringBuilder body = new StringBuilder("Prescription Analysis Complete\n\n");
    if (!context.details().isEmpty()) {
      body.append("Medications:\n");
      for (int i = 0; i < context.details().size(); i++) {
        body.append(i + 1).append(". ").append(context.details().get(i)).append('\n');
      }
      body.append('\n');
    }
    final int score = context.safetyScore() == null ? 0 : context.safetyScore();
    body.append("Safety Score: ").append(score).append("/100\n");
    body.append(
        score < SAFE_SCORE_THRESHOLD
            ? "Please consult your doctor about potential risks\n\n"
            : "Prescription appears safe\n\n");
    body.append(SIGNATURE);
    return body.toString();
  }
}
