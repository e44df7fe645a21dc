/*
 * どこで: Monitoring API リクエスト DTO
 * 何を: プラン版の公開の入力を定義する
 * なぜ: include_models 省略時に現メンバーのスナップショットを付ける既定を持たせるため
 */
package com.example.monitoring.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublishPlanVersionRequest(
    @Size(max = 255, message = "version_name must be at most 255 characters") String versionName,
    Boolean includeModels) {

  public boolean includeModelsOrDefault() {
    return includeModels == null || includeModels;
  }
}
