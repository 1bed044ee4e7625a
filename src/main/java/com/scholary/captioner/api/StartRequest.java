package com.scholary.captioner.api;

import com.scholary.captioner.job.GenerationSettings;
import jakarta.validation.Valid;
import java.util.List;

/**
 * Request to start captioning.
 *
 * <p>An empty or missing {@code videoNames} selects every video in the working directory. {@code
 * prompt} takes precedence over a prompt in {@code settingsOverride}.
 */
public record StartRequest(
    List<String> videoNames, String prompt, @Valid SettingsOverride settingsOverride) {

  /** Merge this request into the default settings. */
  public GenerationSettings resolveSettings(GenerationSettings defaults) {
    GenerationSettings merged =
        settingsOverride == null ? defaults : settingsOverride.applyTo(defaults);
    return merged.withPrompt(prompt);
  }
}
