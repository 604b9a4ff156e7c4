package com.medsafe.safety.api;

public class InvalidAnalysisRequestException extends RuntimeException {
  public InvalidAnalysisRequestException(String message) {
    super(message);
  }
}
