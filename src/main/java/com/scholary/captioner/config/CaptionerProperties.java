package com.scholary.captioner.config;

import com.scholary.captioner.job.GenerationSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for caption processing.
 *
 * <p>Controls where videos are found, which devices are available, the default generation
 * settings and how progress is reported.
 */
@ConfigurationProperties(prefix = "captioner")
@Validated
public record CaptionerProperties(
    @NotBlank String workingDirectory,
    boolean traverseSubfolders,
    @NotEmpty List<String> videoExtensions,
    @NotBlank String outputExtension,
    @NotEmpty List<String> devices,
    @Valid @NotNull GenerationSettings defaults,
    @Valid @NotNull ProgressProperties progress,
    @Positive int stopTimeoutSeconds,
    @NotBlank String tempDir) {

  public record ProgressProperties(
      @Positive int eventQueueCapacity,
      @Positive long broadcastIntervalMillis,
      @Positive long sseTimeoutMinutes) {}
}
