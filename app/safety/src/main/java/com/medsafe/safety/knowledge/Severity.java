/*
 * どこで: 薬剤知識テーブル
 * 何を: 相互作用の重大度を表す列挙
 * なぜ: 並び順とスコア計算で重みを共通化するため
 */
package com.medsafe.safety.knowledge;

public enum Severity {
  MINOR(1),
  MODERATE(2),
  MAJOR(3);

  private final int weight;

  Severity(int weight) {
    this.weight = weight;
  }

  public int weight() {
    return weight;
  }
}
