/*
 * どこで: Notification サービス層
 * 何を: 通知の送信/履歴記録/電話番号変更のデバウンス/バッチ送信の間隔制御を行う
 * なぜ: 1 イベント 1 送信と、入力途中の番号への無駄な送信の抑止をここで保証するため
 */
package com.medsafe.safety.notification;

import com.google.common.annotations.VisibleForTesting;
import com.medsafe.safety.api.InvalidPhoneNumberException;
import com.medsafe.safety.api.NotificationNotFoundException;
import com.medsafe.safety.api.NotificationRetryNotAllowedException;
import com.medsafe.safety.config.NotificationDeliveryProperties;
import com.medsafe.safety.reminder.ReminderDueEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  static final String VERIFICATION_KEY = "recipient-verification";
  static final String RESULT_DELIVERED = "delivered";
  static final String RESULT_FAILED = "failed";
  static final String RESULT_TIMEOUT = "timeout";
  private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("HH:mm");

  private final NotificationSender sender;
  private final NotificationHistoryRepository historyRepository;
  private final MessageComposer composer;
  private final PhoneNumberValidator phoneNumberValidator;
  private final NotificationMetrics metrics;
  private final NotificationDeliveryProperties properties;
  private final TaskScheduler taskScheduler;
  private final ExecutorService transportExecutor;
  private final Clock clock;

  private final AtomicReference<String> activeRecipient = new AtomicReference<>();
  private final ConcurrentMap<String, ScheduledFuture<?>> pendingTasks = new ConcurrentHashMap<>();
  private final Object verificationLock = new Object();
  private long verificationGeneration;
  private final Object batchLock = new Object();
  private Instant nextBatchSlot = Instant.EPOCH;

  public NotificationDispatcher(
      NotificationSender sender,
      NotificationHistoryRepository historyRepository,
      MessageComposer composer,
      PhoneNumberValidator phoneNumberValidator,
      NotificationMetrics metrics,
      NotificationDeliveryProperties properties,
      TaskScheduler taskScheduler,
      @Qualifier("transportExecutor") ExecutorService transportExecutor,
      Clock clock) {
    this.sender = sender;
    this.historyRepository = historyRepository;
    this.composer = composer;
    this.phoneNumberValidator = phoneNumberValidator;
    this.metrics = metrics;
    this.properties = properties;
    this.taskScheduler = taskScheduler;
    this.transportExecutor = transportExecutor;
    this.clock = clock;
  }

  public Optional<String> activeRecipient() {
    return Optional.ofNullable(activeRecipient.get());
  }

  public List<NotificationEvent> history() {
    return historyRepository.findAll();
  }

  /**
   * Composes a new PENDING event; nothing is recorded until it is dispatched, and the recorded
   * {@code createdAt} is the moment the event enters the history.
   */
  public NotificationEvent prepare(MessageType type, MessageContext context) {
    return NotificationEvent.pending(
        context.recipient(), type, composer.compose(type, context), Instant.now(clock));
  }

  /**
   * 役割: 1 件の通知を送信し、結果を履歴へ記録する。
   * 動作: 送信前に PENDING で追記するため同一 id の 2 回目は IllegalStateException となる。
   * createdAt は追記時刻で付け直すため、バッチの遅延送信を挟んでも履歴は作成時刻順に並ぶ。
   * 送信はタイムアウト付きで待ち、超過時は FAILED に遷移させる。
   */
  public NotificationEvent dispatch(NotificationEvent prepared) {
    final NotificationEvent event = historyRepository.append(prepared, Instant.now(clock));
    metrics.updateHistoryCurrent(historyRepository.size());
    final TransportOutcome outcome = sendWithTimeout(event);
    final Instant completedAt = Instant.now(clock);
    final NotificationEvent updated;
    if (outcome.result().delivered()) {
      updated =
          historyRepository.transition(event.id(), DeliveryState.DELIVERED, null, completedAt);
      logger.info(
          "notification delivered id={} type={} recipient={}",
          event.id(),
          event.messageType(),
          event.recipient());
    } else {
      final String reason = truncateError(outcome.result().failureReason());
      updated =
          historyRepository.transition(event.id(), DeliveryState.FAILED, reason, completedAt);
      logger.warn(
          "notification failed id={} type={} recipient={} reason={}",
          event.id(),
          event.messageType(),
          event.recipient(),
          reason);
    }
    metrics.recordDispatchResult(outcome.metricResult());
    metrics.recordDispatchLatency(event.createdAt(), completedAt);
    return updated;
  }

  /**
   * 役割: 複数の通知を最小間隔を空けて順番に送信する。
   * 動作: 直前のバッチの最終スロットからも間隔を保つようにスロットを割り当て、各スロットの Instant を返す。
   */
  public List<Instant> dispatchBatch(List<NotificationEvent> events) {
    if (events.isEmpty()) {
      return List.of();
    }
    for (NotificationEvent event : events) {
      if (historyRepository.findById(event.id()).isPresent()) {
        throw new IllegalStateException("notification already dispatched id=" + event.id());
      }
    }
    final Duration spacing = properties.staggerSpacing();
    final List<Instant> slots = new ArrayList<>(events.size());
    synchronized (batchLock) {
      final Instant now = Instant.now(clock);
      Instant slot = nextBatchSlot.isAfter(now) ? nextBatchSlot : now;
      for (NotificationEvent event : events) {
        slots.add(slot);
        taskScheduler.schedule(() -> dispatchQuietly(event), slot);
        slot = slot.plus(spacing);
      }
      nextBatchSlot = slot;
    }
    logger.info("notification batch scheduled size={} first={}", events.size(), slots.get(0));
    return List.copyOf(slots);
  }

  /**
   * 役割: 電話番号の変更を受け付け、設定された待機時間後に確認メッセージを送る。
   * 動作: 待機中の送信があればキャンセルして置き換えるため、連続した変更では最後の番号だけが送信される。
   * 不正な番号は待機中の送信も取り消したうえで InvalidPhoneNumberException を送出する。
   */
  public String onPhoneNumberChanged(String rawPhoneNumber) {
    synchronized (verificationLock) {
      verificationGeneration++;
      final String normalized;
      try {
        normalized = phoneNumberValidator.requireValid(rawPhoneNumber);
      } catch (InvalidPhoneNumberException ex) {
        cancelPendingVerification();
        throw ex;
      }
      final long generation = verificationGeneration;
      final Instant runAt = Instant.now(clock).plus(properties.settleDelay());
      pendingTasks.compute(
          VERIFICATION_KEY,
          (key, previous) -> {
            supersede(previous);
            return taskScheduler.schedule(
                () -> completeVerification(normalized, generation), runAt);
          });
      logger.info("recipient verification scheduled recipient={} runAt={}", normalized, runAt);
      return normalized;
    }
  }

  public Optional<NotificationEvent> notifyReminderDue(ReminderDueEvent due) {
    final String recipient = activeRecipient.get();
    if (recipient == null) {
      logger.debug("reminder due without active recipient id={}", due.reminderId());
      return Optional.empty();
    }
    final MessageContext context =
        MessageContext.reminder(
            recipient,
            due.medication(),
            DISPLAY_TIME.format(due.timeOfDay()),
            due.frequency().label());
    return Optional.of(dispatch(prepare(MessageType.REMINDER_TRIGGER, context)));
  }

  /** Sends a copy of a FAILED event as a new event; the original stays in history unchanged. */
  public NotificationEvent retry(UUID failedEventId) {
    final NotificationEvent failed =
        historyRepository
            .findById(failedEventId)
            .orElseThrow(() -> new NotificationNotFoundException(failedEventId));
    if (failed.deliveryState() != DeliveryState.FAILED) {
      throw new NotificationRetryNotAllowedException(
          "only failed notifications can be retried id="
              + failedEventId
              + " state="
              + failed.deliveryState());
    }
    logger.info("notification retry requested id={}", failedEventId);
    return dispatch(
        NotificationEvent.pending(
            failed.recipient(), failed.messageType(), failed.composedBody(), Instant.now(clock)));
  }

  @VisibleForTesting
  void completeVerification(String recipient, long generation) {
    synchronized (verificationLock) {
      if (generation != verificationGeneration) {
        logger.debug("recipient verification superseded recipient={}", recipient);
        return;
      }
      activeRecipient.set(recipient);
    }
    logger.info("recipient verified recipient={}", recipient);
    dispatchQuietly(prepare(MessageType.WELCOME, MessageContext.welcome(recipient)));
  }

  private void cancelPendingVerification() {
    pendingTasks.computeIfPresent(
        VERIFICATION_KEY,
        (key, previous) -> {
          supersede(previous);
          return null;
        });
  }

  private void supersede(ScheduledFuture<?> previous) {
    if (previous != null && previous.cancel(false)) {
      metrics.recordDebounceSuperseded();
      logger.debug("pending recipient verification cancelled");
    }
  }

  private void dispatchQuietly(NotificationEvent event) {
    try {
      dispatch(event);
    } catch (RuntimeException ex) {
      // スケジューラスレッド上での失敗は後続タスクへ波及させない
      logger.warn("scheduled notification dispatch failed id={}", event.id(), ex);
    }
  }

  private TransportOutcome sendWithTimeout(NotificationEvent event) {
    final Duration timeout = properties.sendTimeout();
    final Future<SendResult> future;
    try {
      future = transportExecutor.submit(() -> sender.send(event.recipient(), event.composedBody()));
    } catch (RejectedExecutionException ex) {
      logger.warn("notification transport rejected id={}", event.id(), ex);
      return new TransportOutcome(
          SendResult.failure("transport rejected: " + ex.getMessage()), RESULT_FAILED);
    }
    try {
      final SendResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result == null) {
        return new TransportOutcome(
            SendResult.failure("transport returned no result"), RESULT_FAILED);
      }
      return new TransportOutcome(result, result.delivered() ? RESULT_DELIVERED : RESULT_FAILED);
    } catch (TimeoutException ex) {
      future.cancel(true);
      return new TransportOutcome(
          SendResult.failure("transport timed out after " + timeout.toMillis() + "ms"),
          RESULT_TIMEOUT);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.warn("notification transport error id={}", event.id(), cause);
      final String message =
          cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
      return new TransportOutcome(SendResult.failure(message), RESULT_FAILED);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return new TransportOutcome(
          SendResult.failure("interrupted while waiting for transport"), RESULT_FAILED);
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private record TransportOutcome(SendResult result, String metricResult) {}
}
