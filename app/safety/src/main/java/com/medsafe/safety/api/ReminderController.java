/*
 * どこで: Safety API
 * 何を: リマインダーの一覧/登録/切替/削除エンドポイントを公開する
 * なぜ: 自動生成分に加えて利用者が手動で管理できるようにするため
 */
package com.medsafe.safety.api;

import com.medsafe.safety.api.request.ReminderRequest;
import com.medsafe.safety.api.response.ReminderResponse;
import com.medsafe.safety.api.response.RemindersResponse;
import com.medsafe.safety.reminder.ReminderScheduler;
import com.medsafe.safety.workflow.PrescriptionWorkflowService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reminders")
@RequiredArgsConstructor
public class ReminderController {

  private final ReminderScheduler reminderScheduler;
  private final PrescriptionWorkflowService workflowService;

  @GetMapping
  public ResponseEntity<RemindersResponse> list() {
    return ResponseEntity.ok(
        new RemindersResponse(
            reminderScheduler.list().stream().map(ReminderResponse::from).toList()));
  }

  @PostMapping
  public ResponseEntity<ReminderResponse> create(@Valid @RequestBody ReminderRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            ReminderResponse.from(
                workflowService.registerReminder(
                    request.medication(), request.time(), request.frequency())));
  }

  @PostMapping("/{reminderId}/toggle")
  public ResponseEntity<ReminderResponse> toggle(@PathVariable("reminderId") UUID reminderId) {
    return reminderScheduler
        .toggle(reminderId)
        .map(reminder -> ResponseEntity.ok(ReminderResponse.from(reminder)))
        .orElseThrow(() -> new ReminderNotFoundException(reminderId));
  }

  @DeleteMapping("/{reminderId}")
  public ResponseEntity<Void> delete(@PathVariable("reminderId") UUID reminderId) {
    if (!reminderScheduler.delete(reminderId)) {
      throw new ReminderNotFoundException(reminderId);
    }
    return ResponseEntity.noContent().build();
  }
}
