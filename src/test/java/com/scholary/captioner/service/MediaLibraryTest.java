package com.scholary.captioner.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captioner.TestFixtures;
import com.scholary.captioner.config.CaptionerProperties;
import com.scholary.captioner.service.MediaLibrary.MediaFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MediaLibraryTest {

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() throws Exception {
    Files.writeString(tempDir.resolve("b.mp4"), "video");
    Files.writeString(tempDir.resolve("A.MKV"), "video");
    Files.writeString(tempDir.resolve("notes.txt"), "text");
    Path nested = Files.createDirectories(tempDir.resolve("trips"));
    Files.writeString(nested.resolve("beach.avi"), "video");
  }

  private MediaLibrary library(boolean traverse) {
    CaptionerProperties base = TestFixtures.properties(tempDir, List.of("cuda:0"));
    return new MediaLibrary(
        new CaptionerProperties(
            base.workingDirectory(),
            traverse,
            base.videoExtensions(),
            base.outputExtension(),
            base.devices(),
            base.defaults(),
            base.progress(),
            base.stopTimeoutSeconds(),
            base.tempDir()));
  }

  @Test
  void listVideos_shouldOnlyListTopLevelVideosByDefault() {
    List<MediaFile> videos = library(false).listVideos();

    assertThat(videos).extracting(MediaFile::name).containsExactly("A.MKV", "b.mp4");
  }

  @Test
  void listVideos_shouldTraverseSubfoldersWhenEnabled() {
    List<MediaFile> videos = library(true).listVideos();

    assertThat(videos)
        .extracting(MediaFile::name)
        .containsExactlyInAnyOrder("A.MKV", "b.mp4", "trips/beach.avi");
  }

  @Test
  void resolve_shouldSelectEverythingForEmptyRequest() {
    assertThat(library(false).resolve(null)).hasSize(2);
    assertThat(library(false).resolve(List.of())).hasSize(2);
  }

  @Test
  void resolve_shouldMatchCaseInsensitivelyKeepOrderAndDropDuplicates() {
    List<MediaFile> videos =
        library(true)
            .resolve(
                Arrays.asList("TRIPS\\Beach.avi", "a.mkv", "missing.mp4", "trips/beach.avi"));

    assertThat(videos).extracting(MediaFile::name).containsExactly("trips/beach.avi", "A.MKV");
    assertThat(videos.get(0).path()).isEqualTo(tempDir.resolve("trips/beach.avi"));
  }

  @Test
  void resolve_shouldReturnNothingWhenNoNameMatches() {
    assertThat(library(false).resolve(List.of("other.mp4"))).isEmpty();
  }
}
