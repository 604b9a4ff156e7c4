package com.medsafe.safety.workflow;

import com.medsafe.safety.analysis.PrescriptionAnalysis;
import com.medsafe.safety.reminder.Reminder;
import java.time.Instant;
import java.util.List;

/** Analysis plus the reminders it created and the send slots of any follow-up notifications. */
public record AnalysisResult(
    PrescriptionAnalysis analysis, List<Reminder> reminders, List<Instant> notificationSlots) {

  public AnalysisResult {
    reminders = List.copyOf(reminders);
    notificationSlots = List.copyOf(notificationSlots);
  }
}
