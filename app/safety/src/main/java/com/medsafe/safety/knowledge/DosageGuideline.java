package com.medsafe.safety.knowledge;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DosageGuideline(
    String drug, double minDose, double maxDose, String unit, String frequency) {

  public DosageGuideline {
    if (minDose > maxDose) {
      throw new IllegalArgumentException("min_dose exceeds max_dose for " + drug);
    }
  }
}
