/*
 * どこで: Notification サービス層
 * 何を: 通知送信の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.medsafe.safety.notification;

public interface NotificationSender {

  /**
   * Hands one composed message to the transport. Implementations may report a failure either by
   * returning {@link SendResult#failure(String)} or by throwing.
   */
  SendResult send(String recipient, String body);
}
