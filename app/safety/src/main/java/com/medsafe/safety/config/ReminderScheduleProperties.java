/*
 * Where: Safety application configuration binding
 * What: Holds the reminder tick cadence and the wall-clock zone for time-of-day matching
 * Why: Keep the trigger schedule tunable per environment and validated at startup
 */
package com.medsafe.safety.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "medsafe.reminder")
@Validated
public record ReminderScheduleProperties(
    boolean enabled, @NotNull Duration tickInterval, @NotNull ZoneId zone) {

  @AssertTrue(message = "medsafe.reminder.tick-interval must be positive")
  public boolean isTickIntervalPositive() {
    // Duration には @Positive が使えないため、ゼロ/負値を明示的に弾く。
    return tickInterval != null && !tickInterval.isZero() && !tickInterval.isNegative();
  }
}
