package com.scholary.captioner.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captioner.TestFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CaptionWriterTest {

  @TempDir Path tempDir;

  private CaptionWriter writer;

  @BeforeEach
  void setUp() {
    writer = new CaptionWriter(TestFixtures.properties(tempDir, List.of("cuda:0")));
  }

  @Test
  void saveCaption_shouldWriteTextFileNextToVideo() throws Exception {
    Path video = Files.createDirectories(tempDir.resolve("trips")).resolve("beach.final.mp4");

    Path output = writer.saveCaption(video, "A dog runs along the beach.", null, false);

    assertThat(output).isEqualTo(tempDir.resolve("trips/beach.final.txt"));
    assertThat(Files.readString(output)).isEqualTo("A dog runs along the beach.");
  }

  @Test
  void formatCaption_shouldAppendMetadataBlock() {
    CaptionMetadata metadata = new CaptionMetadata("beach.mp4", 1, "cuda:1", 16, 42, 38.46);

    String text = writer.formatCaption("A dog runs.", metadata, true);

    assertThat(text).startsWith("A dog runs.\n\n" + "=".repeat(60) + "\nMETADATA\n");
    assertThat(text).contains("Video: beach.mp4\n");
    assertThat(text).contains("Worker: 1 (cuda:1)\n");
    assertThat(text).contains("Frames processed: 16\n");
    assertThat(text).contains("Output tokens: 42\n");
    assertThat(text).contains("Tokens/sec: 38.5\n");
  }

  @Test
  void formatCaption_shouldSkipMetadataWhenDisabled() {
    CaptionMetadata metadata = new CaptionMetadata("beach.mp4", 0, "cuda:0", 16, 42, 38.5);

    assertThat(writer.formatCaption("A dog runs.", metadata, false)).isEqualTo("A dog runs.");
  }

  @Test
  void saveCaption_shouldOverwriteExistingCaption() throws Exception {
    Path video = tempDir.resolve("clip.mp4");
    Files.writeString(tempDir.resolve("clip.txt"), "old caption");

    writer.saveCaption(video, "new caption", null, false);

    assertThat(Files.readString(tempDir.resolve("clip.txt"))).isEqualTo("new caption");
  }
}
