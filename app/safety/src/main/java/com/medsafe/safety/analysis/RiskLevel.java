package com.medsafe.safety.analysis;

public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH
}
