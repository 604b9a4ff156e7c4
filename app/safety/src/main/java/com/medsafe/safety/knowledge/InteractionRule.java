/*
 * どこで: 薬剤知識テーブル
 * 何を: 薬剤ペアの相互作用ルール
 * なぜ: JSON 定義から読み込んだ静的データを型付きで扱うため
 */
package com.medsafe.safety.knowledge;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InteractionRule(
    String drugA, String drugB, Severity severity, String description) {

  public DrugPair pair() {
    return DrugPair.of(drugA, drugB);
  }
}
