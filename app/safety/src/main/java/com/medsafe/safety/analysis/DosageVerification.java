package com.medsafe.safety.analysis;

public record DosageVerification(DosageStatus status, String message) {}
