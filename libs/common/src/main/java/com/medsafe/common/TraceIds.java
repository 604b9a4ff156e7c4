package com.medsafe.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  static final int MAX_LENGTH = 128;
  // ログへそのまま出すため、改行や空白を含む値は受け付けない
  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the inbound id when it is safe to log, otherwise a freshly generated one. */
  public static String resolve(String candidate) {
    if (candidate == null) {
      return newTraceId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty()
        || trimmed.length() > MAX_LENGTH
        || !ALLOWED.matcher(trimmed).matches()) {
      return newTraceId();
    }
    return trimmed;
  }
}
