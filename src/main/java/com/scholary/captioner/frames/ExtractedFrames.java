package com.scholary.captioner.frames;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frames decoded from one video, in presentation order.
 *
 * <p>The JPEG files live in a private work directory that {@link #close()} removes. A directory
 * that cannot be removed is logged and left behind, so cleanup never fails the caption.
 */
public record ExtractedFrames(List<Path> frames, VideoMetadata metadata, Path workDir)
    implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractedFrames.class);

  public int count() {
    return frames.size();
  }

  @Override
  public void close() {
    deleteQuietly(workDir);
  }

  /** Delete a frame directory, logging instead of throwing when that fails. */
  static void deleteQuietly(Path dir) {
    try {
      deleteRecursively(dir);
    } catch (UncheckedIOException e) {
      LOGGER.warn("Failed to clean up frames in {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteRecursively(Path dir) {
    if (dir == null || !Files.exists(dir)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(dir)) {
      walk.sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                try {
                  Files.deleteIfExists(path);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete frame directory " + dir, e);
    }
  }
}
