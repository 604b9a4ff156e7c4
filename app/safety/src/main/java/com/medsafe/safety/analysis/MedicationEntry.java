/*
 * どこで: ルール評価エンジン
 * 何を: 知識テーブルでエンリッチした薬剤エントリ
 * なぜ: 表示層とリマインダー自動生成へ同じ値を渡すため
 */
package com.medsafe.safety.analysis;

import java.util.List;

public record MedicationEntry(
    String name,
    String dosage,
    String frequency,
    RiskLevel riskLevel,
    DosageStatus dosageStatus,
    List<String> alternatives,
    List<String> sideEffects) {

  public MedicationEntry {
    alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
  }
}
