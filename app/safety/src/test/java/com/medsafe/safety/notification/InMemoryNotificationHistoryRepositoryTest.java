package com.medsafe.safety.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryNotificationHistoryRepositoryTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final Instant COMPLETED_AT = Instant.parse("2026-01-17T00:00:01Z");

  private final InMemoryNotificationHistoryRepository repository =
      new InMemoryNotificationHistoryRepository();

  @Test
  void keepsAppendOrderAndReplacesStateOnTransition() {
    final NotificationEvent first = event();
    final NotificationEvent second = event();
    repository.append(first, CREATED_AT);
    repository.append(second, CREATED_AT);

    final NotificationEvent delivered =
        repository.transition(second.id(), DeliveryState.DELIVERED, null, COMPLETED_AT);

    assertThat(delivered.deliveryState()).isEqualTo(DeliveryState.DELIVERED);
    assertThat(delivered.completedAt()).isEqualTo(COMPLETED_AT);
    assertThat(delivered.composedBody()).isEqualTo(second.composedBody());
    assertThat(repository.findAll())
        .extracting(NotificationEvent::id)
        .containsExactly(first.id(), second.id());
    assertThat(repository.findAll().get(1).deliveryState()).isEqualTo(DeliveryState.DELIVERED);
  }

  @Test
  void rejectsSecondAppendOfSameEvent() {
    final NotificationEvent event = event();
    repository.append(event, CREATED_AT);

    assertThatThrownBy(() -> repository.append(event, CREATED_AT)).isInstanceOf(IllegalStateException.class);
    assertThat(repository.size()).isEqualTo(1);
  }

  @Test
  void terminalStateCannotTransitionAgain() {
    final NotificationEvent event = event();
    repository.append(event, CREATED_AT);
    repository.transition(event.id(), DeliveryState.FAILED, "timeout", COMPLETED_AT);

    assertThatThrownBy(
            () -> repository.transition(event.id(), DeliveryState.DELIVERED, null, COMPLETED_AT))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("terminal");
  }

  @Test
  void appendStampsRecordingInstantAndNeverGoesBackwards() {
    final Instant later = CREATED_AT.plusSeconds(5);
    final NotificationEvent first = repository.append(event(), later);
    // 古い createdAt を持つイベントが後から追記されても順序は崩れない
    final NotificationEvent second = repository.append(event(), CREATED_AT);

    assertThat(first.createdAt()).isEqualTo(later);
    assertThat(second.createdAt()).isEqualTo(later);
    assertThat(repository.findAll()).extracting(NotificationEvent::createdAt).isSorted();
  }

  private NotificationEvent event() {
    return NotificationEvent.pending("+15550001111", MessageType.WELCOME, "body", CREATED_AT);
  }
}
