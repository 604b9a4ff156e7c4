package com.medsafe.safety.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.medsafe.safety.analysis.MedicationEntry;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MedicationResponse(
    String name,
    String dosage,
    String frequency,
    String riskLevel,
    String dosageStatus,
    List<String> alternatives,
    List<String> sideEffects) {

  public static MedicationResponse from(MedicationEntry entry) {
    return new MedicationResponse(
        entry.name(),
        entry.dosage(),
        entry.frequency(),
        entry.riskLevel().name(),
        entry.dosageStatus().name(),
        entry.alternatives(),
        entry.sideEffects());
  }
}
