package com.scholary.captioner.device;

import com.scholary.captioner.frames.DecodeException;
import com.scholary.captioner.frames.ExtractedFrames;
import com.scholary.captioner.frames.FrameExtractor;
import com.scholary.captioner.generation.GenerationResult;
import com.scholary.captioner.generation.ModelServerClient;
import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.GenerationSettings;
import com.scholary.captioner.job.WorkerSubstage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Device backend whose model lives in the model server.
 *
 * <p>Pipeline for one task:
 *
 * <ol>
 *   <li>extract frames locally with the frame extractor
 *   <li>encode each JPEG to base64
 *   <li>stream a caption from the model instance loaded for this device
 * </ol>
 *
 * <p>Extracted frames are deleted when the pipeline returns, whatever the outcome.
 */
public class ModelServerDeviceBackend implements DeviceBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelServerDeviceBackend.class);

  private final String device;
  private final FrameExtractor frameExtractor;
  private final ModelServerClient modelServerClient;

  private volatile boolean prepared;

  public ModelServerDeviceBackend(
      String device, FrameExtractor frameExtractor, ModelServerClient modelServerClient) {
    this.device = device;
    this.frameExtractor = frameExtractor;
    this.modelServerClient = modelServerClient;
  }

  @Override
  public String device() {
    return device;
  }

  @Override
  public void prepare(GenerationSettings settings) {
    modelServerClient.loadModel(device, settings);
    prepared = true;
  }

  @Override
  public PipelineResult runPipeline(
      CaptionTask task, GenerationSettings settings, PipelineListener listener) {
    if (!prepared) {
      throw new IllegalStateException("Backend for " + device + " was not prepared");
    }

    listener.onProgress(WorkerSubstage.EXTRACTING_FRAMES, 0.0);
    try (ExtractedFrames frames =
        frameExtractor.extractFrames(
            task.getPath(),
            settings.maxFrames(),
            settings.frameSize(),
            (extracted, total) ->
                listener.onProgress(WorkerSubstage.EXTRACTING_FRAMES, ratio(extracted, total)))) {

      if (frames.count() == 0) {
        throw new DecodeException("No frames decoded from " + task.getVideoName());
      }

      listener.onProgress(WorkerSubstage.ENCODING, 0.0);
      List<String> encoded = encodeFrames(frames.frames(), listener);

      listener.onProgress(WorkerSubstage.GENERATING, 0.0);
      GenerationResult result =
          modelServerClient.generate(
              device,
              encoded,
              settings.prompt(),
              settings.maxTokens(),
              settings.temperature(),
              (tokens, maxTokens) ->
                  listener.onProgress(WorkerSubstage.GENERATING, ratio(tokens, maxTokens)));

      LOGGER.debug(
          "Caption generated for {} on {}: {} tokens at {} tok/s",
          task.getVideoName(),
          device,
          result.outputTokens(),
          result.tokensPerSec());

      return new PipelineResult(
          result.text(), result.outputTokens(), result.tokensPerSec(), frames.count());
    }
  }

  @Override
  public void shutdown() {
    if (prepared) {
      prepared = false;
      modelServerClient.unloadModel(device);
    }
  }

  private List<String> encodeFrames(List<Path> frames, PipelineListener listener) {
    Base64.Encoder encoder = Base64.getEncoder();
    List<String> encoded = new ArrayList<>(frames.size());
    for (Path frame : frames) {
      try {
        encoded.add(encoder.encodeToString(Files.readAllBytes(frame)));
      } catch (IOException e) {
        throw new DecodeException("Failed to read extracted frame " + frame, e);
      }
      listener.onProgress(WorkerSubstage.ENCODING, ratio(encoded.size(), frames.size()));
    }
    return encoded;
  }

  private static double ratio(int done, int total) {
    return total <= 0 ? 1.0 : Math.min(1.0, (double) done / total);
  }
}
