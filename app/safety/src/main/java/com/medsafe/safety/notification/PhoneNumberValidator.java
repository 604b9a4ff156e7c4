/*
 * どこで: Notification サービス層
 * 何を: 電話番号の書式検証と正規化を行う
 * なぜ: 送信先を統一された表記で扱い、不正な番号を送信前に弾くため
 */
package com.medsafe.safety.notification;

import com.medsafe.safety.api.InvalidPhoneNumberException;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class PhoneNumberValidator {

  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()]");
  private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{0,15}$");

  /** Strips spaces, hyphens and parentheses; empty when the result is not a valid number. */
  public Optional<String> normalize(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    final String cleaned = SEPARATORS.matcher(raw).replaceAll("");
    if (!PHONE.matcher(cleaned).matches()) {
      return Optional.empty();
    }
    return Optional.of(cleaned);
  }

  public String requireValid(String raw) {
    return normalize(raw)
        .orElseThrow(() -> new InvalidPhoneNumberException("invalid phone number: " + raw));
  }
}
