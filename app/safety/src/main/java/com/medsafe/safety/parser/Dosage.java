package com.medsafe.safety.parser;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Single-component dosage such as {@code 10mg}; combination strengths are not parsed. */
public record Dosage(double amount, String unit) {

  private static final Pattern SINGLE =
      Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*(mcg|mg|g|ml|iu|units?)\\s*$", Pattern.CASE_INSENSITIVE);

  public static Optional<Dosage> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    final Matcher matcher = SINGLE.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new Dosage(Double.parseDouble(matcher.group(1)), matcher.group(2).toLowerCase(Locale.ROOT)));
  }
}
