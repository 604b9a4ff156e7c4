/*
 * どこで: Safety API
 * 何を: リマインダー入力の妥当性エラーを表現する
 * なぜ: 必須項目の欠落や書式不正を 400 へ正規化するため
 */
package com.medsafe.safety.api;

public class InvalidReminderRequestException extends RuntimeException {
  public InvalidReminderRequestException(String message) {
    super(message);
  }
}
