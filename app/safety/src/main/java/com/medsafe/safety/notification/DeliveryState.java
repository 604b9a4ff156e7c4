/*
 * どこで: Notification ドメインモデル
 * 何を: 通知の配送状態を表す列挙
 * なぜ: PENDING から DELIVERED/FAILED への一方向遷移を型で表すため
 */
package com.medsafe.safety.notification;

public enum DeliveryState {
  PENDING,
  DELIVERED,
  FAILED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
