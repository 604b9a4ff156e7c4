package com.medsafe.safety.api;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {
  public NotificationNotFoundException(UUID id) {
    super("notification not found id=" + id);
  }
}
