package com.medsafe.safety.analysis;

/**
 * Patient-risk signals found in the free text plus the extraction confidence reported by the
 * upstream text extractor. Missing values are {@code null}.
 */
public record PatientSignals(
    Integer age, Integer systolic, Integer diastolic, double extractionConfidence) {

  public static final double FULL_CONFIDENCE = 1.0d;

  public PatientSignals {
    if (extractionConfidence < 0.0d || extractionConfidence > 1.0d) {
      throw new IllegalArgumentException("extractionConfidence must be within [0,1]");
    }
  }

  public static PatientSignals none() {
    return new PatientSignals(null, null, null, FULL_CONFIDENCE);
  }

  public boolean hasBloodPressure() {
    return systolic != null && diastolic != null;
  }

  public boolean isHypertensive() {
    return hasBloodPressure() && (systolic >= 140 || diastolic >= 90);
  }
}
