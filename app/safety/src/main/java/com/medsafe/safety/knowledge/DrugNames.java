package com.medsafe.safety.knowledge;

import java.util.Locale;

public final class DrugNames {
  private DrugNames() {}

  /** Lookup key for a drug name: trimmed, lower-case, single-spaced. */
  public static String normalize(String name) {
    if (name == null) {
      return "";
    }
    return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
