/*
 * どこで: 処方テキスト解析
 * 何を: テキストから抽出した薬剤の言及(エンリッチ前)
 * なぜ: パーサとルール評価エンジンの受け渡しを不変値で固定するため
 */
package com.medsafe.safety.parser;

import java.util.Optional;

public record MedicationMention(
    String name, String dosageText, String frequencyText, int sourceLineHint) {

  public MedicationMention {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("mention name is required");
    }
    dosageText = dosageText == null ? "" : dosageText;
    frequencyText = frequencyText == null ? "" : frequencyText;
  }

  public Optional<Dosage> dosage() {
    return Dosage.parse(dosageText);
  }
}
