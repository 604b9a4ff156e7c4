package com.medsafe.safety.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.medsafe.safety.analysis.DosageStatus;
import com.medsafe.safety.analysis.DosageVerification;
import com.medsafe.safety.analysis.InteractionFinding;
import com.medsafe.safety.analysis.MedicationEntry;
import com.medsafe.safety.analysis.PrescriptionAnalysis;
import com.medsafe.safety.analysis.RiskLevel;
import com.medsafe.safety.knowledge.Severity;
import com.medsafe.safety.reminder.Reminder;
import com.medsafe.safety.reminder.ReminderFrequency;
import com.medsafe.safety.workflow.AnalysisResult;
import com.medsafe.safety.workflow.PrescriptionWorkflowService;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AnalysisController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AnalysisControllerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T07:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PrescriptionWorkflowService workflowService;

  @Test
  void analyzeReturnsSnakeCaseAnalysis() throws Exception {
    final PrescriptionAnalysis analysis =
        new PrescriptionAnalysis(
            List.of(
                new MedicationEntry(
                    "Warfarin",
                    "5mg",
                    "daily",
                    RiskLevel.HIGH,
                    DosageStatus.NORMAL,
                    List.of("apixaban"),
                    List.of("Bleeding"))),
            List.of(new InteractionFinding("aspirin", "warfarin", Severity.MAJOR, "bleeding")),
            List.of("Follow up"),
            80,
            FIXED_NOW);
    final Reminder reminder =
        new Reminder(
            UUID.randomUUID(),
            "Warfarin 5mg",
            LocalTime.of(8, 0),
            ReminderFrequency.DAILY,
            true,
            true,
            FIXED_NOW,
            Instant.parse("2026-01-17T08:00:00Z"),
            null);
    when(workflowService.analyze("Warfarin 5mg daily", null))
        .thenReturn(new AnalysisResult(analysis, List.of(reminder), List.of()));

    mockMvc
        .perform(
            post("/v1/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text":"Warfarin 5mg daily"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.safety_score").value(80))
        .andExpect(jsonPath("$.medications[0].risk_level").value("HIGH"))
        .andExpect(jsonPath("$.interactions[0].drug_a").value("aspirin"))
        .andExpect(jsonPath("$.interactions[0].severity").value("MAJOR"))
        .andExpect(jsonPath("$.reminders[0].time").value("08:00"))
        .andExpect(jsonPath("$.notifications_scheduled").value(0));
  }

  @Test
  void analyzeRejectsBlankText() throws Exception {
    mockMvc
        .perform(
            post("/v1/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text":"  "}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SAFETY_VALIDATION_ERROR"));
  }

  @Test
  void serviceValidationErrorMapsTo400() throws Exception {
    when(workflowService.analyze(any(), any()))
        .thenThrow(new InvalidAnalysisRequestException("confidence must be within [0,1]"));

    mockMvc
        .perform(
            post("/v1/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"text":"Warfarin 5mg","confidence":0.5}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ANALYSIS_BAD_REQUEST"));
  }

  @Test
  void interactionsEndpointReturnsFindings() throws Exception {
    when(workflowService.checkInteractions(anyList()))
        .thenReturn(
            List.of(new InteractionFinding("aspirin", "warfarin", Severity.MAJOR, "bleeding")));

    mockMvc
        .perform(
            post("/v1/analysis/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"medications":["warfarin","aspirin"]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.interactions[0].drug_b").value("warfarin"));
  }

  @Test
  void dosageEndpointReturnsClassification() throws Exception {
    when(workflowService.verifyDosage("lisinopril", 2.4d))
        .thenReturn(
            new DosageVerification(DosageStatus.LOW, "Dosage below recommended minimum (2.5mg)"));

    mockMvc
        .perform(
            post("/v1/analysis/dosage")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"medication":"lisinopril","amount":2.4}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("LOW"))
        .andExpect(jsonPath("$.message").value("Dosage below recommended minimum (2.5mg)"));
  }
}
