/*
 * どこで: Safety API レスポンス DTO
 * 何を: 解析 API の応答を定義する
 * なぜ: 解析結果と自動生成リマインダーを 1 回の応答で返すため
 */
package com.medsafe.safety.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.medsafe.safety.analysis.PrescriptionAnalysis;
import com.medsafe.safety.workflow.AnalysisResult;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResponse(
    List<MedicationResponse> medications,
    List<InteractionResponse> interactions,
    List<String> warnings,
    int safetyScore,
    String generatedAt,
    List<ReminderResponse> reminders,
    int notificationsScheduled) {

  public static AnalysisResponse from(AnalysisResult result) {
    final PrescriptionAnalysis analysis = result.analysis();
    return new AnalysisResponse(
        analysis.medications().stream().map(MedicationResponse::from).toList(),
        analysis.interactions().stream().map(InteractionResponse::from).toList(),
        analysis.warnings(),
        analysis.safetyScore(),
        analysis.generatedAt().toString(),
        result.reminders().stream().map(ReminderResponse::from).toList(),
        result.notificationSlots().size());
  }
}
