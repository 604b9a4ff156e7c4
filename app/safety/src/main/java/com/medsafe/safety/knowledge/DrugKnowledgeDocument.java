/*
 * どこで: 薬剤知識テーブル
 * 何を: drug-knowledge.json のルート構造(個別ペア表と薬効分類表)
 * なぜ: Jackson で一括バインドし、起動時に一度だけ読み込むため
 */
package com.medsafe.safety.knowledge;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DrugKnowledgeDocument(
    List<InteractionRule> interactions,
    List<DosageGuideline> dosageGuidelines,
    Map<String, List<String>> alternatives,
    Map<String, List<String>> sideEffects,
    List<String> aceInhibitors,
    Map<String, List<String>> drugClasses,
    List<ClassInteractionRule> classInteractions) {}
