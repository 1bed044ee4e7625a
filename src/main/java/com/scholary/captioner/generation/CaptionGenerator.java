package com.scholary.captioner.generation;

import java.util.List;

/**
 * Interface for caption generation services.
 *
 * <p>This abstraction lets the device pipeline stay the same whether the model runs behind an
 * HTTP server or anywhere else.
 */
public interface CaptionGenerator {

  /**
   * Generate a caption for a set of encoded frames.
   *
   * @param device the device whose model instance should run the request
   * @param encodedFrames base64 JPEG frames in presentation order
   * @param prompt the instruction for the model
   * @param maxTokens the generation budget
   * @param temperature the sampling temperature
   * @param listener notified after every generated token; may throw to abort generation
   * @return the generated caption
   * @throws GenerationException if generation fails for this request
   * @throws DeviceUnavailableException if the device can no longer serve requests
   */
  GenerationResult generate(
      String device,
      List<String> encodedFrames,
      String prompt,
      int maxTokens,
      double temperature,
      TokenProgressListener listener);

  /** Callback for token-level generation progress. */
  @FunctionalInterface
  interface TokenProgressListener {
    void onToken(int tokensGenerated, int maxTokens);
  }
}
