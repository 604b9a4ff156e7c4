/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にし、medsafe.clock.fixed-instant 指定時は固定時刻を返す
 * なぜ: リマインダー判定や通知時刻を同一の時刻源から取得し、デモ環境で時刻を固定できるようにするため
 */
package com.medsafe.common.config;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${medsafe.clock.fixed-instant:}") String fixedInstant) {
    if (fixedInstant == null || fixedInstant.isBlank()) {
      return Clock.systemUTC();
    }
    try {
      return Clock.fixed(Instant.parse(fixedInstant.trim()), ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      throw new IllegalStateException(
          "medsafe.clock.fixed-instant must be an ISO-8601 instant: " + fixedInstant, ex);
    }
  }
}
