/*
 * どこで: Safety アプリの設定バインド
 * 何を: 安全スコアの基準値/減点幅と知識テーブルの配置を保持する
 * なぜ: 評価ルールの定数を外部化し、起動時に妥当性を検証するため
 */
package com.medsafe.safety.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "medsafe.analysis")
@Validated
public record SafetyAnalysisProperties(
    @Min(0) @Max(100) int baselineScore,
    @PositiveOrZero int interactionPenalty,
    @PositiveOrZero int polypharmacyThreshold,
    @PositiveOrZero int polypharmacyPenalty,
    @PositiveOrZero int hypertensionPenalty,
    @PositiveOrZero int dosagePenalty,
    double lowConfidenceThreshold,
    @PositiveOrZero int elderlyAgeThreshold,
    @NotBlank String knowledgeLocation) {

  @AssertTrue(message = "medsafe.analysis.low-confidence-threshold must be within [0,1]")
  public boolean isLowConfidenceThresholdInRange() {
    return lowConfidenceThreshold >= 0.0d && lowConfidenceThreshold <= 1.0d;
  }
}
