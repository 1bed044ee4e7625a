package com.scholary.captioner.service;

import com.scholary.captioner.config.CaptionerProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the videos in the working directory.
 *
 * <p>Videos are named by their path relative to the working directory, with forward slashes
 * ({@code trips/beach.mp4}). Requested names are matched case-insensitively against that name.
 */
@Component
public class MediaLibrary {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaLibrary.class);

  private final Path workingDirectory;
  private final boolean traverseSubfolders;
  private final Set<String> videoExtensions;

  public MediaLibrary(CaptionerProperties properties) {
    this.workingDirectory = Paths.get(properties.workingDirectory()).toAbsolutePath().normalize();
    this.traverseSubfolders = properties.traverseSubfolders();
    this.videoExtensions =
        properties.videoExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
  }

  /** A video found in the library. */
  public record MediaFile(String name, Path path) {}

  /**
   * List every video in the working directory, sorted by name.
   *
   * @throws UncheckedIOException if the directory cannot be read
   */
  public List<MediaFile> listVideos() {
    if (!Files.isDirectory(workingDirectory)) {
      LOGGER.warn("Working directory does not exist: {}", workingDirectory);
      return List.of();
    }

    int depth = traverseSubfolders ? Integer.MAX_VALUE : 1;
    try (Stream<Path> walk = Files.walk(workingDirectory, depth)) {
      return walk.filter(Files::isRegularFile)
          .filter(this::isVideo)
          .map(path -> new MediaFile(relativeName(path), path))
          .sorted((a, b) -> a.name().compareToIgnoreCase(b.name()))
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list videos in " + workingDirectory, e);
    }
  }

  /**
   * Resolve requested names to videos.
   *
   * <p>Null or empty selects every video. Otherwise the result keeps request order, drops names
   * that match nothing and drops repeats.
   */
  public List<MediaFile> resolve(Collection<String> requestedNames) {
    List<MediaFile> available = listVideos();
    if (requestedNames == null || requestedNames.isEmpty()) {
      return available;
    }

    Map<String, MediaFile> byKey = new LinkedHashMap<>();
    for (MediaFile file : available) {
      byKey.put(matchKey(file.name()), file);
    }

    Map<String, MediaFile> selected = new LinkedHashMap<>();
    for (String requested : requestedNames) {
      if (requested == null) {
        continue;
      }
      String key = matchKey(requested);
      MediaFile file = byKey.get(key);
      if (file == null) {
        LOGGER.debug("Requested video not found: {}", requested);
      } else {
        selected.putIfAbsent(key, file);
      }
    }
    return new ArrayList<>(selected.values());
  }

  private boolean isVideo(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    return dot >= 0 && videoExtensions.contains(name.substring(dot));
  }

  private String relativeName(Path path) {
    return workingDirectory.relativize(path).toString().replace('\\', '/');
  }

  private static String matchKey(String name) {
    return name.replace('\\', '/').toLowerCase(Locale.ROOT);
  }
}
