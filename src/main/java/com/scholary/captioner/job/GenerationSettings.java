package com.scholary.captioner.job;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Immutable snapshot of the generation parameters used by one job.
 *
 * <p>The defaults come from {@code captioner.defaults} in application.yml. A start request can
 * override individual fields; the merged result is frozen into the job so later changes to the
 * defaults never affect a run in flight.
 */
public record GenerationSettings(
    @NotBlank String modelId,
    @NotBlank String dtype,
    @Min(1) @Max(128) int maxFrames,
    @Min(224) @Max(672) int frameSize,
    @Min(64) @Max(2048) int maxTokens,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @NotBlank String prompt,
    boolean includeMetadata,
    @Min(1) @Max(8) int batchSize) {

  /** Copy of these settings with a different prompt. Blank prompts are ignored. */
  public GenerationSettings withPrompt(String newPrompt) {
    if (newPrompt == null || newPrompt.isBlank()) {
      return this;
    }
    return new GenerationSettings(
        modelId,
        dtype,
        maxFrames,
        frameSize,
        maxTokens,
        temperature,
        newPrompt,
        includeMetadata,
        batchSize);
  }
}
