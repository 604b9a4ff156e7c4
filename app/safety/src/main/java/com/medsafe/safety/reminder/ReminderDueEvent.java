package com.medsafe.safety.reminder;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

public record ReminderDueEvent(
    UUID reminderId,
    String medication,
    LocalTime timeOfDay,
    ReminderFrequency frequency,
    LocalDateTime firedMinute) {}
