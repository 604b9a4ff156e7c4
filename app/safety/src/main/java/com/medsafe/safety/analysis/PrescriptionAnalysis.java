/*
 * どこで: ルール評価エンジン
 * 何を: 1 回の解析結果(薬剤/相互作用/警告/安全スコア)
 * なぜ: 生成後は読み取り専用として呼び出し側へ所有権を渡すため
 */
package com.medsafe.safety.analysis;

import java.time.Instant;
import java.util.List;

public record PrescriptionAnalysis(
    List<MedicationEntry> medications,
    List<InteractionFinding> interactions,
    List<String> warnings,
    int safetyScore,
    Instant generatedAt) {

  public PrescriptionAnalysis {
    medications = List.copyOf(medications);
    interactions = List.copyOf(interactions);
    warnings = List.copyOf(warnings);
    if (safetyScore < 0 || safetyScore > 100) {
      throw new IllegalArgumentException("safetyScore out of range: " + safetyScore);
    }
  }
}
