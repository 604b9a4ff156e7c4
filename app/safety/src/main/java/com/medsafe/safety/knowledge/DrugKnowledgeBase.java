/*
 * どこで: 薬剤知識テーブル
 * 何を: 相互作用(個別ペア/薬効分類)/用量ガイドライン/代替薬/副作用の不変テーブルを保持する
 * なぜ: ルール評価エンジンから共有状態なしで安全に参照できるようにするため
 */
package com.medsafe.safety.knowledge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class DrugKnowledgeBase {

  static final List<String> DEFAULT_ALTERNATIVES = List.of("Consult physician for alternatives");
  static final List<String> DEFAULT_SIDE_EFFECTS = List.of("Consult physician for side effects");

  private final Map<DrugPair, InteractionRule> interactions;
  private final Map<String, DosageGuideline> guidelines;
  private final Map<String, List<String>> alternatives;
  private final Map<String, List<String>> sideEffects;
  private final Set<String> aceInhibitors;
  private final Map<String, Set<String>> classesByDrug;
  private final List<ClassInteractionRule> classInteractions;

  public DrugKnowledgeBase(DrugKnowledgeDocument document) {
    this.interactions = indexInteractions(nullSafe(document.interactions()));
    this.guidelines = indexGuidelines(nullSafe(document.dosageGuidelines()));
    this.alternatives = indexLists(document.alternatives());
    this.sideEffects = indexLists(document.sideEffects());
    final Set<String> ace = new HashSet<>();
    for (String name : nullSafe(document.aceInhibitors())) {
      ace.add(DrugNames.normalize(name));
    }
    this.aceInhibitors = Collections.unmodifiableSet(ace);
    this.classesByDrug = indexClasses(document.drugClasses());
    this.classInteractions =
        validateClassRules(nullSafe(document.classInteractions()), document.drugClasses());
  }

  /**
   * Symmetric lookup; identical names never match. An explicit pair wins; otherwise the first
   * class rule (in table order) matching the two drugs' classes yields a rule for this pair.
   */
  public Optional<InteractionRule> findInteraction(String drugA, String drugB) {
    final String a = DrugNames.normalize(drugA);
    final String b = DrugNames.normalize(drugB);
    if (a.isEmpty() || b.isEmpty() || a.equals(b)) {
      return Optional.empty();
    }
    final DrugPair pair = DrugPair.of(a, b);
    final InteractionRule explicit = interactions.get(pair);
    if (explicit != null) {
      return Optional.of(explicit);
    }
    return findClassInteraction(pair);
  }

  public Set<String> classesOf(String drug) {
    return classesByDrug.getOrDefault(DrugNames.normalize(drug), Set.of());
  }

  public Optional<DosageGuideline> findGuideline(String drug) {
    return Optional.ofNullable(guidelines.get(DrugNames.normalize(drug)));
  }

  public List<String> alternativesFor(String drug) {
    return alternatives.getOrDefault(DrugNames.normalize(drug), DEFAULT_ALTERNATIVES);
  }

  public List<String> sideEffectsFor(String drug) {
    return sideEffects.getOrDefault(DrugNames.normalize(drug), DEFAULT_SIDE_EFFECTS);
  }

  public boolean isAceInhibitor(String drug) {
    return aceInhibitors.contains(DrugNames.normalize(drug));
  }

  public int interactionCount() {
    return interactions.size();
  }

  private Optional<InteractionRule> findClassInteraction(DrugPair pair) {
    final Set<String> first = classesOf(pair.first());
    final Set<String> second = classesOf(pair.second());
    if (first.isEmpty() || second.isEmpty()) {
      return Optional.empty();
    }
    for (ClassInteractionRule rule : classInteractions) {
      if (rule.matches(first, second)) {
        return Optional.of(
            new InteractionRule(pair.first(), pair.second(), rule.severity(), rule.description()));
      }
    }
    return Optional.empty();
  }

  private static Map<String, Set<String>> indexClasses(Map<String, List<String>> source) {
    if (source == null) {
      return Map.of();
    }
    final Map<String, Set<String>> index = new HashMap<>();
    source.forEach(
        (drugClass, members) -> {
          for (String member : nullSafe(members)) {
            index
                .computeIfAbsent(DrugNames.normalize(member), key -> new HashSet<>())
                .add(drugClass);
          }
        });
    final Map<String, Set<String>> frozen = new HashMap<>();
    index.forEach((drug, classes) -> frozen.put(drug, Set.copyOf(classes)));
    return Collections.unmodifiableMap(frozen);
  }

  private static List<ClassInteractionRule> validateClassRules(
      List<ClassInteractionRule> rules, Map<String, List<String>> drugClasses) {
    final Set<String> known = drugClasses == null ? Set.of() : drugClasses.keySet();
    for (ClassInteractionRule rule : rules) {
      if (rule.severity() == null) {
        throw new IllegalStateException("class interaction severity is required rule=" + rule);
      }
      if (rule.classesA().isEmpty() || rule.classesB().isEmpty()) {
        throw new IllegalStateException(
            "class interaction needs classes on both sides rule=" + rule);
      }
      for (String drugClass : concat(rule.classesA(), rule.classesB())) {
        if (!known.contains(drugClass)) {
          throw new IllegalStateException("unknown drug class in interaction rule: " + drugClass);
        }
      }
    }
    return List.copyOf(rules);
  }

  private static List<String> concat(List<String> left, List<String> right) {
    final List<String> all = new ArrayList<>(left);
    all.addAll(right);
    return all;
  }

  private static Map<DrugPair, InteractionRule> indexInteractions(List<InteractionRule> rules) {
    final Map<DrugPair, InteractionRule> index = new HashMap<>();
    for (InteractionRule rule : rules) {
      // 自己ペアは DrugPair.of が拒否するため、ここでは重複定義のみ検出する
      final DrugPair pair = rule.pair();
      if (rule.severity() == null) {
        throw new IllegalStateException("interaction severity is required pair=" + pair);
      }
      if (index.putIfAbsent(pair, rule) != null) {
        throw new IllegalStateException("duplicate interaction definition pair=" + pair);
      }
    }
    return Collections.unmodifiableMap(index);
  }

  private static Map<String, DosageGuideline> indexGuidelines(List<DosageGuideline> source) {
    final Map<String, DosageGuideline> index = new HashMap<>();
    for (DosageGuideline guideline : source) {
      index.put(DrugNames.normalize(guideline.drug()), guideline);
    }
    return Collections.unmodifiableMap(index);
  }

  private static Map<String, List<String>> indexLists(Map<String, List<String>> source) {
    if (source == null) {
      return Map.of();
    }
    final Map<String, List<String>> index = new HashMap<>();
    source.forEach(
        (drug, values) ->
            index.put(
                DrugNames.normalize(drug),
                Collections.unmodifiableList(new ArrayList<>(nullSafe(values)))));
    return Collections.unmodifiableMap(index);
  }

  private static <T> List<T> nullSafe(List<T> values) {
    return values == null ? List.of() : values;
  }
}
