package com.scholary.captioner.frames;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Extracts video frames using ffprobe and ffmpeg.
 *
 * <p>Two steps:
 *
 * <ol>
 *   <li>ffprobe reads duration and resolution of the first video stream
 *   <li>ffmpeg seeks to each sampled timestamp and writes a single scaled JPEG
 * </ol>
 *
 * <p>Frames are decoded one ffmpeg call at a time so progress can be reported per frame and a stop
 * request takes effect before the next frame.
 */
@Component
public class FfmpegFrameExtractor implements FrameExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameExtractor.class);

  private final FfmpegProperties properties;
  private final ObjectMapper objectMapper;
  private final Path tempDir;

  public FfmpegFrameExtractor(
      FfmpegProperties properties,
      ObjectMapper objectMapper,
      @Value("${captioner.tempDir}") String tempDir) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.tempDir = Paths.get(tempDir);

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new RuntimeException("Failed to create temp directory: " + tempDir, e);
    }
  }

  @Override
  public ExtractedFrames extractFrames(
      Path video, int maxFrames, int frameSize, FrameProgressListener listener) {
    if (!Files.isRegularFile(video)) {
      throw new DecodeException("Cannot open video: " + video);
    }

    VideoMetadata metadata = readMetadata(video);
    List<Double> timestamps = sampleTimestamps(metadata.durationSeconds(), maxFrames);
    LOGGER.debug(
        "Extracting {} frames from {} (duration={}s, {}x{})",
        timestamps.size(),
        video.getFileName(),
        metadata.durationSeconds(),
        metadata.width(),
        metadata.height());

    Path workDir;
    try {
      workDir = Files.createTempDirectory(tempDir, "frames-");
    } catch (IOException e) {
      throw new DecodeException("Failed to create frame directory for " + video, e);
    }

    List<Path> frames = new ArrayList<>(timestamps.size());
    try {
      for (int i = 0; i < timestamps.size(); i++) {
        Path frame = workDir.resolve(String.format("frame_%04d.jpg", i));
        extractFrame(video, timestamps.get(i), frameSize, frame);
        frames.add(frame);
        listener.onFrame(i + 1, timestamps.size());
      }
    } catch (RuntimeException e) {
      ExtractedFrames.deleteQuietly(workDir);
      throw e;
    }

    return new ExtractedFrames(List.copyOf(frames), metadata, workDir);
  }

  /**
   * Read duration and resolution with ffprobe.
   *
   * @throws DecodeException if ffprobe fails or the file has no video stream
   */
  VideoMetadata readMetadata(Path video) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-select_streams", "v:0",
            "-show_entries", "stream=width,height:format=duration",
            "-of", "json",
            video.toString());

    try {
      return parseMetadataOutput(runProcess(command));
    } catch (IOException e) {
      throw new DecodeException("ffprobe failed for " + video.getFileName(), e);
    }
  }

  /**
   * Parse ffprobe JSON output.
   *
   * <p>Example: {@code {"streams":[{"width":1920,"height":1080}],"format":{"duration":"12.5"}}}.
   * Images report no duration.
   */
  VideoMetadata parseMetadataOutput(String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    JsonNode streams = root.path("streams");
    if (!streams.isArray() || streams.isEmpty()) {
      throw new DecodeException("No video stream found");
    }
    JsonNode stream = streams.get(0);
    double duration = root.path("format").path("duration").asDouble(0.0);
    return new VideoMetadata(
        duration, stream.path("width").asInt(0), stream.path("height").asInt(0));
  }

  /**
   * Choose uniformly spaced timestamps, each at the centre of its slice of the video.
   *
   * <p>A video with no duration (a still image) yields a single frame at zero.
   */
  static List<Double> sampleTimestamps(double durationSeconds, int maxFrames) {
    if (maxFrames < 1) {
      throw new IllegalArgumentException("maxFrames must be positive");
    }
    if (durationSeconds <= 0) {
      return List.of(0.0);
    }
    List<Double> timestamps = new ArrayList<>(maxFrames);
    for (int i = 0; i < maxFrames; i++) {
      timestamps.add(durationSeconds * (i + 0.5) / maxFrames);
    }
    return timestamps;
  }

  private void extractFrame(Path video, double timestamp, int frameSize, Path output) {
    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-v", "error",
            "-ss", String.format(Locale.ROOT, "%.3f", timestamp),
            "-i", video.toString(),
            "-frames:v", "1",
            "-vf", "scale=" + frameSize + ":" + frameSize + ":force_original_aspect_ratio=decrease",
            "-q:v", String.valueOf(properties.jpegQuality()),
            "-y", output.toString());

    try {
      runProcess(command);
    } catch (IOException e) {
      throw new DecodeException(
          String.format("ffmpeg failed at %.3fs in %s", timestamp, video.getFileName()), e);
    }

    if (!Files.isRegularFile(output)) {
      throw new DecodeException(
          String.format("No frame decoded at %.3fs in %s", timestamp, video.getFileName()));
    }
  }

  private String runProcess(List<String> command) throws IOException {
    LOGGER.trace("Executing: {}", command);

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    Process process = pb.start();

    try {
      byte[] outputBytes = process.getInputStream().readAllBytes();
      if (!process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            "Process timed out after "
                + properties.processTimeoutSeconds()
                + "s: "
                + command.get(0));
      }
      String output = new String(outputBytes, StandardCharsets.UTF_8).trim();
      if (process.exitValue() != 0) {
        throw new IOException(
            "Process exited with code " + process.exitValue() + ", output: " + output);
      }
      return output;
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException("Process interrupted", e);
    }
  }
}
