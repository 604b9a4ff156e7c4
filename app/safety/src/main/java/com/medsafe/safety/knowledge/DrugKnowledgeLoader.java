/*
 * どこで: 薬剤知識テーブル
 * 何を: JSON リソースから DrugKnowledgeBase を構築する
 * なぜ: 静的データをコードから分離し、起動時に一度だけ読み込むため
 */
package com.medsafe.safety.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

public final class DrugKnowledgeLoader {

  private static final Logger logger = LoggerFactory.getLogger(DrugKnowledgeLoader.class);

  private DrugKnowledgeLoader() {}

  public static DrugKnowledgeBase load(ObjectMapper objectMapper, Resource resource) {
    if (!resource.exists()) {
      throw new IllegalStateException("drug knowledge resource not found: " + resource);
    }
    try (InputStream in = resource.getInputStream()) {
      final DrugKnowledgeDocument document = objectMapper.readValue(in, DrugKnowledgeDocument.class);
      final DrugKnowledgeBase knowledgeBase = new DrugKnowledgeBase(document);
      logger.info(
          "drug knowledge loaded resource={} interactions={}",
          resource.getDescription(),
          knowledgeBase.interactionCount());
      return knowledgeBase;
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read drug knowledge resource " + resource, ex);
    }
  }
}
