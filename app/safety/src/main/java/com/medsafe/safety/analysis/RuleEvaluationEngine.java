/*
 * どこで: ルール評価エンジン
 * 何を: 薬剤の言及から相互作用/用量判定/警告/安全スコアを算出する
 * なぜ: 解析を副作用なしの決定的な関数として提供し、任意のスレッドから呼べるようにするため
 */
package com.medsafe.safety.analysis;

import com.google.common.annotations.VisibleForTesting;
import com.medsafe.safety.config.SafetyAnalysisProperties;
import com.medsafe.safety.knowledge.DosageGuideline;
import com.medsafe.safety.knowledge.DrugKnowledgeBase;
import com.medsafe.safety.knowledge.DrugNames;
import com.medsafe.safety.knowledge.DrugPair;
import com.medsafe.safety.knowledge.Severity;
import com.medsafe.safety.parser.Dosage;
import com.medsafe.safety.parser.MedicationMention;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RuleEvaluationEngine {

  private static final Logger logger = LoggerFactory.getLogger(RuleEvaluationEngine.class);

  static final String FOLLOW_UP_WARNING =
      "Follow up required as per prescription - regular checkup scheduled";
  static final String ACE_INHIBITOR_WARNING =
      "ACE inhibitor therapy - monitor kidney function and potassium levels";

  private static final Comparator<InteractionFinding> FINDING_ORDER =
      Comparator.comparingInt((InteractionFinding finding) -> finding.severity().weight())
          .reversed()
          .thenComparing(InteractionFinding::drugA)
          .thenComparing(InteractionFinding::drugB);

  private final DrugKnowledgeBase knowledgeBase;
  private final SafetyAnalysisProperties properties;
  private final Clock clock;

  /**
   * 役割: 言及リストと患者シグナルから解析結果を生成する。
   * 動作: 相互作用は重複を除いた薬剤集合の非順序ペアで 1 件ずつ検出し、スコアは検出順に依存しない。
   */
  public PrescriptionAnalysis evaluate(List<MedicationMention> mentions, PatientSignals signals) {
    final List<MedicationMention> safeMentions = mentions == null ? List.of() : mentions;
    final PatientSignals safeSignals = signals == null ? PatientSignals.none() : signals;

    final List<InteractionFinding> interactions =
        findInteractions(safeMentions.stream().map(MedicationMention::name).toList());

    final List<MedicationEntry> entries = new ArrayList<>();
    final List<String> dosageWarnings = new ArrayList<>();
    for (MedicationMention mention : safeMentions) {
      final DosageVerification verification = verifyMention(mention);
      if (verification.status().isOutOfRange()) {
        dosageWarnings.add(mention.name() + ": " + verification.message());
      }
      entries.add(enrich(mention, verification.status(), interactions));
    }

    final int distinctCount = distinctNames(safeMentions).size();
    final int outOfRangeCount =
        (int) entries.stream().filter(entry -> entry.dosageStatus().isOutOfRange()).count();
    final int score = score(distinctCount, interactions.size(), outOfRangeCount, safeSignals);
    final List<String> warnings = warnings(safeMentions, interactions, dosageWarnings, safeSignals);

    logger.info(
        "prescription evaluated medications={} interactions={} score={}",
        entries.size(),
        interactions.size(),
        score);
    return new PrescriptionAnalysis(entries, interactions, warnings, score, Instant.now(clock));
  }

  /** Checks every unordered pair of distinct names once; result order is severity then name. */
  public List<InteractionFinding> findInteractions(Collection<String> names) {
    final List<String> distinct = new ArrayList<>(distinctNormalized(names));
    final List<InteractionFinding> findings = new ArrayList<>();
    for (int i = 0; i < distinct.size(); i++) {
      for (int j = i + 1; j < distinct.size(); j++) {
        final DrugPair pair = DrugPair.of(distinct.get(i), distinct.get(j));
        knowledgeBase
            .findInteraction(pair.first(), pair.second())
            .ifPresent(
                rule ->
                    findings.add(
                        new InteractionFinding(
                            pair.first(), pair.second(), rule.severity(), rule.description())));
      }
    }
    findings.sort(FINDING_ORDER);
    return List.copyOf(findings);
  }

  /** Guideline range is inclusive on both ends; unknown drugs degrade to {@code UNKNOWN}. */
  public DosageVerification verifyDosage(String name, double amount) {
    final Optional<DosageGuideline> guideline = knowledgeBase.findGuideline(name);
    if (guideline.isEmpty()) {
      return new DosageVerification(DosageStatus.UNKNOWN, "Medication not in database");
    }
    final DosageGuideline g = guideline.get();
    if (amount < g.minDose()) {
      return new DosageVerification(
          DosageStatus.LOW,
          "Dosage below recommended minimum (" + format(g.minDose()) + g.unit() + ")");
    }
    if (amount > g.maxDose()) {
      return new DosageVerification(
          DosageStatus.HIGH,
          "Dosage exceeds recommended maximum (" + format(g.maxDose()) + g.unit() + ")");
    }
    return new DosageVerification(
        DosageStatus.NORMAL,
        "Dosage within normal range ("
            + format(g.minDose())
            + "-"
            + format(g.maxDose())
            + g.unit()
            + ")");
  }

  @VisibleForTesting
  int score(int medicationCount, int interactionCount, int outOfRangeCount, PatientSignals signals) {
    int score = properties.baselineScore();
    if (interactionCount > 0) {
      score -= properties.interactionPenalty();
    }
    if (medicationCount > properties.polypharmacyThreshold()) {
      score -= properties.polypharmacyPenalty();
    }
    if (signals.isHypertensive()) {
      score -= properties.hypertensionPenalty();
    }
    if (outOfRangeCount > 0) {
      score -= properties.dosagePenalty();
    }
    return Math.max(0, Math.min(100, score));
  }

  private DosageVerification verifyMention(MedicationMention mention) {
    final Optional<Dosage> dosage = mention.dosage();
    final Optional<DosageGuideline> guideline = knowledgeBase.findGuideline(mention.name());
    if (dosage.isEmpty() || guideline.isEmpty()) {
      return new DosageVerification(DosageStatus.UNKNOWN, "Dosage not verifiable");
    }
    if (!dosage.get().unit().equalsIgnoreCase(guideline.get().unit())) {
      // 単位換算は行わず、判定不能として扱う
      return new DosageVerification(DosageStatus.UNKNOWN, "Dosage unit differs from guideline");
    }
    return verifyDosage(mention.name(), dosage.get().amount());
  }

  private MedicationEntry enrich(
      MedicationMention mention, DosageStatus dosageStatus, List<InteractionFinding> interactions) {
    final String normalized = DrugNames.normalize(mention.name());
    return new MedicationEntry(
        mention.name(),
        mention.dosageText(),
        mention.frequencyText(),
        riskLevel(normalized, dosageStatus, interactions),
        dosageStatus,
        knowledgeBase.alternativesFor(normalized),
        knowledgeBase.sideEffectsFor(normalized));
  }

  private RiskLevel riskLevel(
      String normalized, DosageStatus dosageStatus, List<InteractionFinding> interactions) {
    final Severity worst =
        interactions.stream()
            .filter(finding -> finding.involves(normalized))
            .map(InteractionFinding::severity)
            .max(Comparator.comparingInt(Severity::weight))
            .orElse(null);
    if (worst == Severity.MAJOR || dosageStatus == DosageStatus.HIGH) {
      return RiskLevel.HIGH;
    }
    if (worst == Severity.MODERATE || dosageStatus == DosageStatus.LOW) {
      return RiskLevel.MEDIUM;
    }
    return RiskLevel.LOW;
  }

  private List<String> warnings(
      List<MedicationMention> mentions,
      List<InteractionFinding> interactions,
      List<String> dosageWarnings,
      PatientSignals signals) {
    final List<String> warnings = new ArrayList<>();
    if (signals.extractionConfidence() < properties.lowConfidenceThreshold()) {
      warnings.add(
          String.format(
              Locale.ROOT,
              "Prescription text extraction confidence is low (%d%%) - verify medications against the original prescription",
              Math.round(signals.extractionConfidence() * 100)));
    }
    if (signals.age() != null && signals.age() >= properties.elderlyAgeThreshold()) {
      warnings.add(
          "Patient is " + signals.age() + " years old - monitor for age-related medication effects");
    }
    if (signals.isHypertensive()) {
      warnings.add(
          "Hypertension detected (BP: "
              + signals.systolic()
              + "/"
              + signals.diastolic()
              + ") - monitor blood pressure regularly");
    }
    if (mentions.stream().anyMatch(mention -> knowledgeBase.isAceInhibitor(mention.name()))) {
      warnings.add(ACE_INHIBITOR_WARNING);
    }
    for (InteractionFinding finding : interactions) {
      if (finding.severity() == Severity.MAJOR) {
        warnings.add(
            "Major interaction between "
                + finding.drugA()
                + " and "
                + finding.drugB()
                + " - consult your doctor before combining");
      }
    }
    warnings.addAll(dosageWarnings);
    warnings.add(FOLLOW_UP_WARNING);
    return warnings;
  }

  private static Set<String> distinctNames(List<MedicationMention> mentions) {
    return distinctNormalized(mentions.stream().map(MedicationMention::name).toList());
  }

  private static Set<String> distinctNormalized(Collection<String> names) {
    final Set<String> distinct = new LinkedHashSet<>();
    if (names == null) {
      return distinct;
    }
    for (String name : names) {
      final String normalized = DrugNames.normalize(name);
      if (!normalized.isEmpty()) {
        distinct.add(normalized);
      }
    }
    return distinct;
  }

  private static String format(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
