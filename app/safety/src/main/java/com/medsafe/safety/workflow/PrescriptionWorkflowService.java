/*
 * どこで: Safety ワークフロー層
 * 何を: 解析 -> リマインダー自動生成 -> 通知送信の流れを束ねる
 * なぜ: 各コンポーネントを互いに依存させず、呼び出し順をここだけで管理するため
 */
package com.medsafe.safety.workflow;

import com.medsafe.safety.analysis.DosageVerification;
import com.medsafe.safety.analysis.InteractionFinding;
import com.medsafe.safety.analysis.MedicationEntry;
import com.medsafe.safety.analysis.PatientSignalDetector;
import com.medsafe.safety.analysis.PatientSignals;
import com.medsafe.safety.analysis.PrescriptionAnalysis;
import com.medsafe.safety.analysis.RuleEvaluationEngine;
import com.medsafe.safety.api.InvalidAnalysisRequestException;
import com.medsafe.safety.notification.MessageContext;
import com.medsafe.safety.notification.MessageType;
import com.medsafe.safety.notification.NotificationDispatcher;
import com.medsafe.safety.notification.NotificationEvent;
import com.medsafe.safety.parser.MedicationMention;
import com.medsafe.safety.parser.MedicationMentionParser;
import com.medsafe.safety.reminder.Reminder;
import com.medsafe.safety.reminder.ReminderScheduler;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PrescriptionWorkflowService {

  private static final Logger logger = LoggerFactory.getLogger(PrescriptionWorkflowService.class);
  private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("HH:mm");

  private final MedicationMentionParser parser;
  private final PatientSignalDetector signalDetector;
  private final RuleEvaluationEngine engine;
  private final ReminderScheduler reminderScheduler;
  private final NotificationDispatcher dispatcher;

  /**
   * 役割: 処方テキストを解析し、薬剤ごとのリマインダーを自動生成する。
   * 動作: 送信先が確認済みなら、サマリーと各リマインダーの確認メッセージを間隔を空けて送信する。
   */
  public AnalysisResult analyze(String text, Double confidence) {
    if (text == null || text.isBlank()) {
      throw new InvalidAnalysisRequestException("text is required");
    }
    final double extractionConfidence =
        confidence == null ? PatientSignals.FULL_CONFIDENCE : confidence;
    if (extractionConfidence < 0.0d || extractionConfidence > 1.0d) {
      throw new InvalidAnalysisRequestException("confidence must be within [0,1]");
    }
    final List<MedicationMention> mentions = parser.parse(text);
    final PatientSignals signals = signalDetector.detect(text, extractionConfidence);
    final PrescriptionAnalysis analysis = engine.evaluate(mentions, signals);
    final List<Reminder> reminders = reminderScheduler.autoCreateFromAnalysis(analysis);

    final Optional<String> recipient = dispatcher.activeRecipient();
    if (recipient.isEmpty()) {
      logger.debug("analysis notifications skipped without active recipient");
      return new AnalysisResult(analysis, reminders, List.of());
    }
    final List<NotificationEvent> batch = new ArrayList<>();
    batch.add(
        dispatcher.prepare(
            MessageType.SUMMARY_REPORT,
            MessageContext.summary(
                recipient.get(), analysis.safetyScore(), summaryLines(analysis))));
    for (Reminder reminder : reminders) {
      batch.add(dispatcher.prepare(MessageType.CONFIRMATION, confirmation(recipient.get(), reminder)));
    }
    final List<Instant> slots = dispatcher.dispatchBatch(batch);
    return new AnalysisResult(analysis, reminders, slots);
  }

  /** Registers a manual reminder and, with a verified recipient, queues its confirmation. */
  public Reminder registerReminder(String medication, String time, String frequency) {
    final Reminder reminder = reminderScheduler.addReminder(medication, time, frequency);
    dispatcher
        .activeRecipient()
        .ifPresent(
            recipient ->
                dispatcher.dispatchBatch(
                    List.of(
                        dispatcher.prepare(
                            MessageType.CONFIRMATION, confirmation(recipient, reminder)))));
    return reminder;
  }

  public List<InteractionFinding> checkInteractions(List<String> medications) {
    if (medications == null || medications.isEmpty()) {
      throw new InvalidAnalysisRequestException("medications are required");
    }
    for (String medication : medications) {
      if (medication == null || medication.isBlank()) {
        throw new InvalidAnalysisRequestException("medication names must not be blank");
      }
    }
    return engine.findInteractions(medications);
  }

  public DosageVerification verifyDosage(String medication, double amount) {
    if (medication == null || medication.isBlank()) {
      throw new InvalidAnalysisRequestException("medication is required");
    }
    if (amount < 0.0d || Double.isNaN(amount)) {
      throw new InvalidAnalysisRequestException("amount must not be negative");
    }
    return engine.verifyDosage(medication, amount);
  }

  private MessageContext confirmation(String recipient, Reminder reminder) {
    return MessageContext.reminder(
        recipient,
        reminder.medication(),
        DISPLAY_TIME.format(reminder.timeOfDay()),
        reminder.frequency().label());
  }

  private List<String> summaryLines(PrescriptionAnalysis analysis) {
    final List<String> lines = new ArrayList<>();
    for (MedicationEntry entry : analysis.medications()) {
      lines.add(entry.name() + " " + entry.dosage() + " - " + entry.frequency());
    }
    return lines;
  }
}
