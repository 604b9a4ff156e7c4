/*
 * どこで: ルール評価エンジン
 * 何を: 2 薬剤間で検出した相互作用
 * なぜ: 薬剤名を辞書順に固定し、入力順に依存しない結果にするため
 */
package com.medsafe.safety.analysis;

import com.medsafe.safety.knowledge.Severity;

public record InteractionFinding(
    String drugA, String drugB, Severity severity, String description) {

  public boolean involves(String normalizedName) {
    return drugA.equals(normalizedName) || drugB.equals(normalizedName);
  }
}
