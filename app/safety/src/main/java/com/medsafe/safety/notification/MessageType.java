/*
 * どこで: Notification ドメインモデル
 * 何を: 通知メッセージの種別を表す列挙
 * なぜ: テンプレート選択と履歴表示の種別を一致させるため
 */
package com.medsafe.safety.notification;

public enum MessageType {
  WELCOME,
  CONFIRMATION,
  REMINDER_TRIGGER,
  SUMMARY_REPORT
}
