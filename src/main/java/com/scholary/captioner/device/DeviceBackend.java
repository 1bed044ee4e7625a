package com.scholary.captioner.device;

import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.GenerationSettings;

/**
 * A model instance bound to one compute device.
 *
 * <p>The scheduler only talks to this interface, so workers do not care what hosts the model. A
 * backend is used by exactly one worker thread between {@link #prepare} and {@link #shutdown}.
 */
public interface DeviceBackend {

  String device();

  /**
   * Load the model onto the device.
   *
   * @throws com.scholary.captioner.generation.ModelLoadException if the device cannot be prepared
   */
  void prepare(GenerationSettings settings);

  /**
   * Run extract, encode and generate for one task.
   *
   * @param task the task being processed
   * @param settings the job's settings
   * @param listener progress callback, also the cancellation checkpoint
   * @return the generated caption
   * @throws com.scholary.captioner.frames.DecodeException if the video cannot be decoded
   * @throws com.scholary.captioner.generation.GenerationException if generation fails for this
   *     video
   * @throws com.scholary.captioner.generation.DeviceUnavailableException if the device is gone
   * @throws TaskCancelledException if the listener abandoned the task
   */
  PipelineResult runPipeline(
      CaptionTask task, GenerationSettings settings, PipelineListener listener);

  /** Release the model. Never throws. */
  void shutdown();
}
