/*
 * どこで: Safety API リクエスト DTO
 * 何を: 手動リマインダー登録 API の入力を定義する
 * なぜ: 時刻/頻度の書式検証はサービス層に任せ、必須項目だけをここで弾くため
 */
package com.medsafe.safety.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReminderRequest(@NotBlank String medication, @NotBlank String time, String frequency) {}
