/*
 * どこで: 薬剤知識テーブル
 * 何を: 順序を持たない薬剤ペアのキー
 * なぜ: (A,B) と (B,A) を同一キーとして扱うため
 */
package com.medsafe.safety.knowledge;

public record DrugPair(String first, String second) {

  public DrugPair {
    if (first == null || first.isBlank() || second == null || second.isBlank()) {
      throw new IllegalArgumentException("drug pair requires two names");
    }
  }

  /**
   * 役割: 2 つの薬剤名から正規化済みのペアキーを作る。
   * 動作: 小文字化した上で辞書順に並べ、同一薬剤の組は IllegalArgumentException とする。
   */
  public static DrugPair of(String left, String right) {
    final String a = DrugNames.normalize(left);
    final String b = DrugNames.normalize(right);
    if (a.equals(b)) {
      throw new IllegalArgumentException("self pair is not allowed: " + a);
    }
    return a.compareTo(b) < 0 ? new DrugPair(a, b) : new DrugPair(b, a);
  }
}
