/*
 * どこで: 薬剤知識テーブルのユニットテスト
 * 何を: 相互作用の対称性/自己ペア拒否/未知薬剤の既定値/重複定義検出を検証する
 * なぜ: ルール評価エンジンの前提となるテーブルの性質を固定するため
 */
package com.medsafe.safety.knowledge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class DrugKnowledgeBaseTest {

  private static DrugKnowledgeBase knowledgeBase;

  @BeforeAll
  static void loadKnowledge() {
    knowledgeBase =
        DrugKnowledgeLoader.load(
            new ObjectMapper(), new ClassPathResource("knowledge/drug-knowledge.json"));
  }

  @Test
  void findInteractionIsSymmetricAndCaseInsensitive() {
    final InteractionRule forward = knowledgeBase.findInteraction("warfarin", "aspirin").orElseThrow();
    final InteractionRule reverse = knowledgeBase.findInteraction(" ASPIRIN ", "Warfarin").orElseThrow();

    assertThat(forward).isEqualTo(reverse);
    assertThat(forward.severity()).isEqualTo(Severity.MAJOR);
  }

  @Test
  void findInteractionNeverMatchesSameDrug() {
    // 同一薬剤の重複記載は相互作用として扱わない
    assertThat(knowledgeBase.findInteraction("warfarin", "Warfarin")).isEmpty();
  }

  @Test
  void unknownDrugFallsBackToAdvisoryDefaults() {
    assertThat(knowledgeBase.findGuideline("unobtainium")).isEmpty();
    assertThat(knowledgeBase.alternativesFor("unobtainium"))
        .containsExactly("Consult physician for alternatives");
    assertThat(knowledgeBase.sideEffectsFor("unobtainium"))
        .containsExactly("Consult physician for side effects");
  }

  @Test
  void loadsGuidelinesAndAceInhibitors() {
    final DosageGuideline lisinopril = knowledgeBase.findGuideline("Lisinopril").orElseThrow();

    assertThat(lisinopril.minDose()).isEqualTo(2.5d);
    assertThat(lisinopril.maxDose()).isEqualTo(40.0d);
    assertThat(lisinopril.unit()).isEqualTo("mg");
    assertThat(knowledgeBase.isAceInhibitor("lisinopril")).isTrue();
    assertThat(knowledgeBase.isAceInhibitor("metformin")).isFalse();
  }

  @Test
  void rejectsDuplicatePairInEitherOrder() {
    final DrugKnowledgeDocument document =
        new DrugKnowledgeDocument(
            List.of(
                new InteractionRule("warfarin", "aspirin", Severity.MAJOR, "bleeding"),
                new InteractionRule("aspirin", "warfarin", Severity.MINOR, "duplicate")),
            List.of(),
            Map.of(),
            Map.of(),
            List.of(),
            Map.of(),
            List.of());

    assertThatThrownBy(() -> new DrugKnowledgeBase(document))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate");
  }

  @Test
  void drugPairRejectsSelfPairAndOrdersNames() {
    assertThatThrownBy(() -> DrugPair.of("Aspirin", "aspirin"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(DrugPair.of("warfarin", "Aspirin")).isEqualTo(new DrugPair("aspirin", "warfarin"));
  }

  @Test
  void classCombinationCoversPairsMissingFromExplicitTable() {
    final InteractionRule aceWithDiuretic =
        knowledgeBase.findInteraction("Enalapril", "furosemide").orElseThrow();
    final InteractionRule reversed =
        knowledgeBase.findInteraction("furosemide", "enalapril").orElseThrow();

    assertThat(aceWithDiuretic).isEqualTo(reversed);
    assertThat(aceWithDiuretic.drugA()).isEqualTo("enalapril");
    assertThat(aceWithDiuretic.drugB()).isEqualTo("furosemide");
    assertThat(aceWithDiuretic.severity()).isEqualTo(Severity.MAJOR);
    assertThat(aceWithDiuretic.description()).isEqualTo("Risk of hypotension and hyperkalemia");
    assertThat(knowledgeBase.findInteraction("heparin", "aspirin")).isPresent();
    assertThat(knowledgeBase.findInteraction("lorazepam", "morphine").orElseThrow().severity())
        .isEqualTo(Severity.MAJOR);
  }

  @Test
  void explicitPairTakesPrecedenceOverClassCombination() {
    // lisinopril + hydrochlorothiazide は個別表で MODERATE、分類表では MAJOR
    assertThat(knowledgeBase.findInteraction("lisinopril", "hydrochlorothiazide").orElseThrow().severity())
        .isEqualTo(Severity.MODERATE);
  }

  @Test
  void classCombinationFallsBackToModerateRules() {
    final InteractionRule rule = knowledgeBase.findInteraction("diclofenac", "amiloride").orElseThrow();

    assertThat(rule.severity()).isEqualTo(Severity.MODERATE);
  }

  @Test
  void classRulesStayIrreflexiveAndIgnoreUnclassifiedDrugs() {
    // 同じ分類の 2 剤でも組み合わせルールがなければ相互作用なし
    assertThat(knowledgeBase.findInteraction("heparin", "heparin")).isEmpty();
    assertThat(knowledgeBase.findInteraction("heparin", "apixaban")).isEmpty();
    assertThat(knowledgeBase.findInteraction("heparin", "unobtainium")).isEmpty();
    assertThat(knowledgeBase.classesOf("Heparin")).containsExactly("anticoagulants");
  }

  @Test
  void rejectsClassRuleReferencingUnknownClass() {
    final DrugKnowledgeDocument document =
        new DrugKnowledgeDocument(
            List.of(),
            List.of(),
            Map.of(),
            Map.of(),
            List.of(),
            Map.of("opioids", List.of("morphine")),
            List.of(
                new ClassInteractionRule(
                    List.of("benzodiazepines"), List.of("opioids"), Severity.MAJOR, "cns")));

    assertThatThrownBy(() -> new DrugKnowledgeBase(document))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("benzodiazepines");
  }
}
