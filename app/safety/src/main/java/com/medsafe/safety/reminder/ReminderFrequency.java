/*
 * どこで: リマインダードメインモデル
 * 何を: リマインダーの服用頻度を定義する
 * なぜ: 入力文字列の揺れ(Daily/Twice daily/TWICE_DAILY)を列挙型で固定するため
 */
package com.medsafe.safety.reminder;

import java.util.Locale;

public enum ReminderFrequency {
  DAILY("Daily"),
  TWICE_DAILY("Twice daily"),
  THREE_TIMES_DAILY("Three times daily"),
  WEEKLY("Weekly"),
  AS_NEEDED("As needed");

  private final String label;

  ReminderFrequency(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * 役割: API や画面から受け取った頻度文字列を内部列挙型へ変換する。
   * 動作: 英字以外を除去し大文字小文字を無視して比較し、未対応値は IllegalArgumentException を送出する。
   */
  public static ReminderFrequency fromValue(String value) {
    final String key = compact(value);
    for (ReminderFrequency frequency : values()) {
      if (compact(frequency.name()).equals(key) || compact(frequency.label).equals(key)) {
        return frequency;
      }
    }
    throw new IllegalArgumentException("unsupported frequency: " + value);
  }

  private static String compact(String value) {
    if (value == null) {
      return "";
    }
    return value.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
  }
}
