package com.medsafe.safety.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.medsafe.safety.analysis.InteractionFinding;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InteractionResponse(
    String drugA, String drugB, String severity, String description) {

  public static InteractionResponse from(InteractionFinding finding) {
    return new InteractionResponse(
        finding.drugA(), finding.drugB(), finding.severity().name(), finding.description());
  }
}
