/*
 * どこで: Safety API
 * 何を: 電話番号の書式エラーを表現する
 * なぜ: 送信先の妥当性エラーを再試行せず即時に呼び出し側へ返すため
 */
package com.medsafe.safety.api;

public class InvalidPhoneNumberException extends RuntimeException {
  public InvalidPhoneNumberException(String message) {
    super(message);
  }
}
