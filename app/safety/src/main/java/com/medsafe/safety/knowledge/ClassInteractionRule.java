/*
 * どこで: 薬剤知識テーブル
 * 何を: 薬効分類どうしの組み合わせに対する相互作用ルール
 * なぜ: 個別ペアが未登録の薬剤でも、分類の組み合わせから相互作用を検出するため
 */
package com.medsafe.safety.knowledge;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClassInteractionRule(
    List<String> classesA, List<String> classesB, Severity severity, String description) {

  public ClassInteractionRule {
    classesA = classesA == null ? List.of() : List.copyOf(classesA);
    classesB = classesB == null ? List.of() : List.copyOf(classesB);
  }

  /** True when one side is in {@code classesA} and the other in {@code classesB}, either order. */
  boolean matches(Set<String> left, Set<String> right) {
    return (intersects(classesA, left) && intersects(classesB, right))
        || (intersects(classesB, left) && intersects(classesA, right));
  }

  private static boolean intersects(List<String> classes, Set<String> memberships) {
    for (String drugClass : classes) {
      if (memberships.contains(drugClass)) {
        return true;
      }
    }
    return false;
  }
}
