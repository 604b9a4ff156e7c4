/*
 * どこで: 処方テキスト解析
 * 何を: 生テキストを行単位で走査し、薬剤名/用量/服用頻度を抽出する
 * なぜ: 抽出元(OCR/手入力)に依存せず決定的に解析結果を得るため
 */
package com.medsafe.safety.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MedicationMentionParser {

  private static final Logger logger = LoggerFactory.getLogger(MedicationMentionParser.class);

  static final String DEFAULT_DOSAGE = "As prescribed";
  static final String DEFAULT_FREQUENCY = "As directed";

  private static final Pattern DOSAGE =
      Pattern.compile(
          "(\\d+(?:\\.\\d+)?(?:\\s*(?:mcg|mg|g|ml)?\\s*/\\s*\\d+(?:\\.\\d+)?)*)\\s*(mcg|mg|g|ml|iu|units?)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern FORM_KEYWORD =
      Pattern.compile("\\b(tab|tabs|tablet|tablets|cap|caps|capsule|capsules)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern TIME_TOKEN =
      Pattern.compile("\\b\\d{1,2}\\s*(am|pm)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*\\u2022]+|\\d+[.)])$");
  private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

  private static final Set<String> FORM_PREFIXES =
      Set.of("tab", "tab.", "tabs", "tablet", "cap", "cap.", "caps", "capsule", "inj", "inj.", "syp", "syp.");
  // 服用指示の行(SIG/TAKE など)は薬剤行として扱わない
  private static final Set<String> INSTRUCTION_WORDS =
      Set.of("sig", "take", "disp", "directions", "quantity", "qty", "refills", "use", "apply", "dosage");

  /**
   * 役割: 処方テキストから薬剤の言及を抽出する。
   * 動作: 単位トークンまたは錠剤/カプセルのキーワードを含む行のみ対象とし、先頭の名前トークンを薬剤名とする。
   * 前提: 空/不正な入力でも例外は投げず、空リストを返す。
   */
  public List<MedicationMention> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    final String[] lines = text.split("\\R");
    final List<MedicationMention> mentions = new ArrayList<>();
    for (int i = 0; i < lines.length; i++) {
      final String line = lines[i].trim();
      if (line.isEmpty()) {
        continue;
      }
      final Matcher dosage = DOSAGE.matcher(line);
      final boolean hasDosage = dosage.find();
      if (!hasDosage && !FORM_KEYWORD.matcher(line).find()) {
        continue;
      }
      final NameToken nameToken = leadingName(line);
      if (nameToken == null) {
        logger.debug("medication line skipped without name line={}", i + 1);
        continue;
      }
      final String dosageText;
      final String remainder;
      if (hasDosage) {
        dosageText = dosage.group().replaceAll("\\s+", "");
        remainder =
            dosage.start() >= nameToken.end()
                ? line.substring(dosage.end())
                : line.substring(nameToken.end());
      } else {
        dosageText = DEFAULT_DOSAGE;
        remainder = line.substring(nameToken.end());
      }
      mentions.add(
          new MedicationMention(nameToken.name(), dosageText, frequencyText(remainder, line), i + 1));
    }
    return List.copyOf(mentions);
  }

  private NameToken leadingName(String line) {
    int offset = 0;
    for (String rawToken : line.split("\\s+")) {
      final int start = line.indexOf(rawToken, offset);
      offset = start + rawToken.length();
      final String lower = rawToken.toLowerCase(Locale.ROOT);
      if (LIST_MARKER.matcher(rawToken).matches()
          || FORM_PREFIXES.contains(lower)
          || Character.isDigit(rawToken.charAt(0))) {
        continue;
      }
      if (rawToken.endsWith(":") && !INSTRUCTION_WORDS.contains(stripPunctuation(lower))) {
        // "Medications:" のようなラベルは読み飛ばす
        continue;
      }
      final String name = stripPunctuation(rawToken);
      if (INSTRUCTION_WORDS.contains(name.toLowerCase(Locale.ROOT))) {
        return null;
      }
      if (name.isEmpty() || !HAS_LETTER.matcher(name).find()) {
        return null;
      }
      return new NameToken(name, offset);
    }
    return null;
  }

  private String frequencyText(String remainder, String line) {
    final String cleaned = remainder.replaceAll("^[\\s,;:\\-]+", "").trim();
    if (!cleaned.isEmpty()) {
      return cleaned;
    }
    final Matcher time = TIME_TOKEN.matcher(line);
    return time.find() ? time.group() : DEFAULT_FREQUENCY;
  }

  private static String stripPunctuation(String token) {
    return token.replaceAll("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$", "");
  }

  private record NameToken(String name, int end) {}
}
