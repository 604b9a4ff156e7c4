/*
 * どこで: Safety API
 * 何を: FAILED 以外の通知に対する再送要求を表現する
 * なぜ: 送信済み/送信中の通知を二重送信させないため
 */
package com.medsafe.safety.api;

public class NotificationRetryNotAllowedException extends RuntimeException {
  public NotificationRetryNotAllowedException(String message) {
    super(message);
  }
}
