/*
 * どこで: Safety API
 * 何を: 送信先電話番号の登録と通知履歴/再送のエンドポイントを公開する
 * なぜ: 送信失敗を履歴で確認し、利用者が明示的に再送できるようにするため
 */
package com.medsafe.safety.api;

import com.medsafe.safety.api.request.RecipientRequest;
import com.medsafe.safety.api.response.NotificationHistoryResponse;
import com.medsafe.safety.api.response.NotificationResponse;
import com.medsafe.safety.api.response.RecipientResponse;
import com.medsafe.safety.notification.NotificationDispatcher;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  static final String STATUS_PENDING_VERIFICATION = "PENDING_VERIFICATION";

  private final NotificationDispatcher dispatcher;

  @PutMapping("/recipient")
  public ResponseEntity<RecipientResponse> changeRecipient(
      @Valid @RequestBody RecipientRequest request) {
    final String normalized = dispatcher.onPhoneNumberChanged(request.phoneNumber());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new RecipientResponse(normalized, STATUS_PENDING_VERIFICATION));
  }

  @GetMapping("/history")
  public ResponseEntity<NotificationHistoryResponse> history() {
    return ResponseEntity.ok(
        new NotificationHistoryResponse(
            dispatcher.activeRecipient().orElse(null),
            dispatcher.history().stream().map(NotificationResponse::from).toList()));
  }

  @PostMapping("/{notificationId}/retry")
  public ResponseEntity<NotificationResponse> retry(
      @PathVariable("notificationId") UUID notificationId) {
    return ResponseEntity.ok(NotificationResponse.from(dispatcher.retry(notificationId)));
  }
}
