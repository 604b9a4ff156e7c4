/*
 * どこで: Safety アプリの設定
 * 何を: 薬剤知識テーブルを Bean として一度だけ読み込む
 * なぜ: ルール評価エンジンとリマインダー生成で同じテーブルを共有するため
 */
package com.medsafe.safety.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medsafe.safety.knowledge.DrugKnowledgeBase;
import com.medsafe.safety.knowledge.DrugKnowledgeLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class KnowledgeConfig {

  @Bean
  public DrugKnowledgeBase drugKnowledgeBase(
      ObjectMapper objectMapper, ResourceLoader resourceLoader, SafetyAnalysisProperties properties) {
    return DrugKnowledgeLoader.load(
        objectMapper, resourceLoader.getResource(properties.knowledgeLocation()));
  }
}
