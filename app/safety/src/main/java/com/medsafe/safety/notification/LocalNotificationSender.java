/*
 * どこで: Notification サービス層
 * 何を: 通知送信を模擬する実装
 * なぜ: 外部 SMS 送信を伴わずに配送状態の遷移を確認するため
 */
package com.medsafe.safety.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);

  @Override
  public SendResult send(String recipient, String body) {
    // 実送信は行わず、ログに残すだけとする
    logger.info("notification simulated send recipient={} length={}", recipient, body.length());
    return SendResult.success();
  }
}
