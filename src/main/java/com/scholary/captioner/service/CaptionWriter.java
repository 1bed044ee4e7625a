package com.scholary.captioner.service;

import com.scholary.captioner.config.CaptionerProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Writes captions next to the videos they describe.
 *
 * <p>{@code clips/beach.mp4} gets {@code clips/beach.txt}. An existing caption is overwritten.
 */
@Component
public class CaptionWriter {

  private static final String SEPARATOR = "=".repeat(60);

  private final String outputExtension;

  public CaptionWriter(CaptionerProperties properties) {
    this.outputExtension = properties.outputExtension();
  }

  /**
   * Format a caption file.
   *
   * <p>Format with metadata:
   *
   * <pre>
   * A dog runs along the beach.
   *
   * ============================================================
   * METADATA
   * ============================================================
   * Video: beach.mp4
   * Worker: 0 (cuda:0)
   * Frames processed: 16
   * Output tokens: 42
   * Tokens/sec: 38.5
   * </pre>
   */
  public String formatCaption(String caption, CaptionMetadata metadata, boolean includeMetadata) {
    StringBuilder text = new StringBuilder(caption);

    if (includeMetadata && metadata != null) {
      text.append("\n\n").append(SEPARATOR).append("\n");
      text.append("METADATA\n");
      text.append(SEPARATOR).append("\n");
      text.append("Video: ").append(metadata.videoName()).append("\n");
      text.append("Worker: ")
          .append(metadata.workerId())
          .append(" (")
          .append(metadata.device())
          .append(")\n");
      text.append("Frames processed: ").append(metadata.framesProcessed()).append("\n");
      text.append("Output tokens: ").append(metadata.outputTokens()).append("\n");
      text.append("Tokens/sec: ")
          .append(String.format(Locale.ROOT, "%.1f", metadata.tokensPerSec()))
          .append("\n");
    }

    return text.toString();
  }

  /**
   * Save a caption next to its video.
   *
   * @param videoPath the captioned video
   * @param caption the caption text
   * @param metadata generation details
   * @param includeMetadata whether to append the metadata block
   * @return the path of the caption file
   * @throws IOException if the file cannot be written
   */
  public Path saveCaption(
      Path videoPath, String caption, CaptionMetadata metadata, boolean includeMetadata)
      throws IOException {
    Path output = outputPathFor(videoPath);
    Files.writeString(
        output, formatCaption(caption, metadata, includeMetadata), StandardCharsets.UTF_8);
    return output;
  }

  /** Caption path for a video: same directory, same stem, output extension. */
  public Path outputPathFor(Path videoPath) {
    String fileName = videoPath.getFileName().toString();
    String stem = fileName.replaceAll("\\.[^.]+$", ""); // Remove extension
    return videoPath.resolveSibling(stem + outputExtension);
  }
}
