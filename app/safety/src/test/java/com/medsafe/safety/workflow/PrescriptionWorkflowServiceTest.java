/*
 * どこで: Safety ワークフローのユニットテスト
 * 何を: 解析 -> リマインダー自動生成 -> 通知バッチの流れと入力検証を検証する
 * なぜ: コンポーネント間の呼び出し順と、送信先未確認時に通知しない契約を保証するため
 */
package com.medsafe.safety.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medsafe.safety.analysis.DosageStatus;
import com.medsafe.safety.analysis.PatientSignalDetector;
import com.medsafe.safety.analysis.RuleEvaluationEngine;
import com.medsafe.safety.api.InvalidAnalysisRequestException;
import com.medsafe.safety.config.ReminderScheduleProperties;
import com.medsafe.safety.config.SafetyAnalysisProperties;
import com.medsafe.safety.knowledge.DrugKnowledgeLoader;
import com.medsafe.safety.knowledge.Severity;
import com.medsafe.safety.notification.MessageContext;
import com.medsafe.safety.notification.MessageType;
import com.medsafe.safety.notification.NotificationDispatcher;
import com.medsafe.safety.notification.NotificationEvent;
import com.medsafe.safety.parser.MedicationMentionParser;
import com.medsafe.safety.reminder.InMemoryReminderRepository;
import com.medsafe.safety.reminder.Reminder;
import com.medsafe.safety.reminder.ReminderMetrics;
import com.medsafe.safety.reminder.ReminderScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

@ExtendWith(MockitoExtension.class)
class PrescriptionWorkflowServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T07:00:00Z");
  private static final String RECIPIENT = "+15550001111";

  @Mock private NotificationDispatcher dispatcher;

  private ReminderScheduler reminderScheduler;
  private PrescriptionWorkflowService service;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    final RuleEvaluationEngine engine =
        new RuleEvaluationEngine(
            DrugKnowledgeLoader.load(
                new ObjectMapper(), new ClassPathResource("knowledge/drug-knowledge.json")),
            new SafetyAnalysisProperties(
                90, 10, 3, 5, 5, 5, 0.6d, 65, "classpath:knowledge/drug-knowledge.json"),
            clock);
    reminderScheduler =
        new ReminderScheduler(
            new InMemoryReminderRepository(),
            new ReminderMetrics(new SimpleMeterRegistry()),
            new ReminderScheduleProperties(true, Duration.ofMinutes(1), ZoneOffset.UTC),
            clock);
    service =
        new PrescriptionWorkflowService(
            new MedicationMentionParser(),
            new PatientSignalDetector(),
            engine,
            reminderScheduler,
            dispatcher);
  }

  @Test
  void analyzeWarfarinAndAspirinCreatesRemindersWithoutRecipient() {
    when(dispatcher.activeRecipient()).thenReturn(Optional.empty());

    final AnalysisResult result = service.analyze("Warfarin 5mg daily\nAspirin 100mg daily", null);

    assertThat(result.analysis().interactions()).hasSize(1);
    assertThat(result.analysis().interactions().get(0).severity()).isEqualTo(Severity.MAJOR);
    assertThat(result.analysis().safetyScore()).isEqualTo(80);
    assertThat(result.analysis().medications())
        .allMatch(entry -> entry.dosageStatus() == DosageStatus.NORMAL);
    assertThat(result.reminders())
        .extracting(Reminder::medication)
        .containsExactly("Warfarin 5mg", "Aspirin 100mg");
    assertThat(result.reminders())
        .extracting(Reminder::timeOfDay)
        .containsOnly(LocalTime.of(8, 0));
    assertThat(result.notificationSlots()).isEmpty();
    // 送信先が未確認なら通知は作らない
    verify(dispatcher, never()).dispatchBatch(anyList());
  }

  @Test
  void analyzeWithRecipientQueuesSummaryThenConfirmations() {
    when(dispatcher.activeRecipient()).thenReturn(Optional.of(RECIPIENT));
    when(dispatcher.prepare(any(MessageType.class), any(MessageContext.class)))
        .thenAnswer(
            invocation ->
                NotificationEvent.pending(
                    RECIPIENT, invocation.getArgument(0), "body", FIXED_NOW));
    when(dispatcher.dispatchBatch(anyList()))
        .thenReturn(List.of(FIXED_NOW, FIXED_NOW.plusMillis(1500), FIXED_NOW.plusMillis(3000)));

    final AnalysisResult result = service.analyze("Warfarin 5mg daily\nAspirin 100mg daily", 0.95d);

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<List<NotificationEvent>> batch = ArgumentCaptor.forClass(List.class);
    verify(dispatcher).dispatchBatch(batch.capture());
    assertThat(batch.getValue())
        .extracting(NotificationEvent::messageType)
        .containsExactly(
            MessageType.SUMMARY_REPORT, MessageType.CONFIRMATION, MessageType.CONFIRMATION);
    assertThat(result.notificationSlots()).hasSize(3);
  }

  @Test
  void registerReminderQueuesConfirmationForVerifiedRecipient() {
    when(dispatcher.activeRecipient()).thenReturn(Optional.of(RECIPIENT));
    when(dispatcher.prepare(any(MessageType.class), any(MessageContext.class)))
        .thenAnswer(
            invocation ->
                NotificationEvent.pending(
                    RECIPIENT, invocation.getArgument(0), "body", FIXED_NOW));

    final Reminder reminder = service.registerReminder("Metformin 500mg", "20:00", "Twice daily");

    final ArgumentCaptor<MessageContext> context = ArgumentCaptor.forClass(MessageContext.class);
    verify(dispatcher).prepare(any(MessageType.class), context.capture());
    assertThat(context.getValue().medication()).isEqualTo("Metformin 500mg");
    assertThat(context.getValue().time()).isEqualTo("20:00");
    assertThat(context.getValue().frequency()).isEqualTo("Twice daily");
    verify(dispatcher).dispatchBatch(anyList());
    assertThat(reminderScheduler.list()).containsExactly(reminder);
  }

  @Test
  void analyzeRejectsBlankTextAndOutOfRangeConfidence() {
    assertThatThrownBy(() -> service.analyze("  ", null))
        .isInstanceOf(InvalidAnalysisRequestException.class);
    assertThatThrownBy(() -> service.analyze("Warfarin 5mg", 1.5d))
        .isInstanceOf(InvalidAnalysisRequestException.class);
    assertThat(reminderScheduler.list()).isEmpty();
  }

  @Test
  void standaloneToolsValidateInput() {
    assertThatThrownBy(() -> service.checkInteractions(List.of()))
        .isInstanceOf(InvalidAnalysisRequestException.class);
    assertThatThrownBy(() -> service.verifyDosage("lisinopril", -1.0d))
        .isInstanceOf(InvalidAnalysisRequestException.class);
    assertThat(service.checkInteractions(List.of("Lisinopril", "Spironolactone"))).hasSize(1);
    assertThat(service.verifyDosage("lisinopril", 40.0d).status()).isEqualTo(DosageStatus.NORMAL);
  }
}
