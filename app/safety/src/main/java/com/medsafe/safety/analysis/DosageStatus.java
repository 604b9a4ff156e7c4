package com.medsafe.safety.analysis;

public enum DosageStatus {
  UNKNOWN,
  LOW,
  NORMAL,
  HIGH;

  public boolean isOutOfRange() {
    return this == LOW || this == HIGH;
  }
}
