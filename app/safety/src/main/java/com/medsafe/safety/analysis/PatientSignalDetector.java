/*
 * どこで: ルール評価エンジン
 * 何を: 自由記述から年齢/血圧などのリスクシグナルを検出する
 * なぜ: スコア減点と警告生成の入力を明示的な値にするため
 */
package com.medsafe.safety.analysis;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class PatientSignalDetector {

  private static final Pattern BLOOD_PRESSURE =
      Pattern.compile("(?<![\\d/])(\\d{2,3})\\s*/\\s*(\\d{2,3})(?![\\d/])");
  private static final Pattern AGE_LABEL =
      Pattern.compile("\\bage\\s*[:=]?\\s*(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern AGE_SHORT =
      Pattern.compile("\\b(\\d{1,3})\\s*(?:y|yrs?|years?)(?:\\s*/\\s*[mf])?\\b", Pattern.CASE_INSENSITIVE);

  public PatientSignals detect(String text, double extractionConfidence) {
    if (text == null || text.isBlank()) {
      return new PatientSignals(null, null, null, extractionConfidence);
    }
    Integer systolic = null;
    Integer diastolic = null;
    final Matcher bp = BLOOD_PRESSURE.matcher(text);
    while (bp.find()) {
      final int high = Integer.parseInt(bp.group(1));
      final int low = Integer.parseInt(bp.group(2));
      // 用量表記(40/12.5 など)と区別するため、血圧として妥当な範囲のみ採用する
      if (high >= 70 && high <= 260 && low >= 40 && low <= 160 && high > low) {
        systolic = high;
        diastolic = low;
        break;
      }
    }
    return new PatientSignals(detectAge(text), systolic, diastolic, extractionConfidence);
  }

  private Integer detectAge(String text) {
    final Matcher labelled = AGE_LABEL.matcher(text);
    if (labelled.find()) {
      return Integer.valueOf(labelled.group(1));
    }
    final Matcher shortForm = AGE_SHORT.matcher(text);
    if (shortForm.find()) {
      return Integer.valueOf(shortForm.group(1));
    }
    return null;
  }
}
