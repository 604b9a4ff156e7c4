/*
 * どこで: Safety API リクエスト DTO
 * 何を: 処方テキスト解析 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.medsafe.safety.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisRequest(
    @NotBlank String text, @DecimalMin("0.0") @DecimalMax("1.0") Double confidence) {}
