package com.scholary.captioner.api;

import com.scholary.captioner.job.GenerationSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Per-request changes to the default generation settings. Null fields keep the default.
 */
public record SettingsOverride(
    String modelId,
    String dtype,
    @Min(1) @Max(128) Integer maxFrames,
    @Min(224) @Max(672) Integer frameSize,
    @Min(64) @Max(2048) Integer maxTokens,
    @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
    String prompt,
    Boolean includeMetadata,
    @Min(1) @Max(8) Integer batchSize) {

  /** Apply these overrides on top of {@code defaults}. */
  public GenerationSettings applyTo(GenerationSettings defaults) {
    return new GenerationSettings(
        isBlank(modelId) ? defaults.modelId() : modelId,
        isBlank(dtype) ? defaults.dtype() : dtype,
        maxFrames != null ? maxFrames : defaults.maxFrames(),
        frameSize != null ? frameSize : defaults.frameSize(),
        maxTokens != null ? maxTokens : defaults.maxTokens(),
        temperature != null ? temperature : defaults.temperature(),
        isBlank(prompt) ? defaults.prompt() : prompt,
        includeMetadata != null ? includeMetadata : defaults.includeMetadata(),
        batchSize != null ? batchSize : defaults.batchSize());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
