package com.medsafe.safety.api;

import java.util.UUID;

public class ReminderNotFoundException extends RuntimeException {
  public ReminderNotFoundException(UUID id) {
    super("reminder not found id=" + id);
  }
}
