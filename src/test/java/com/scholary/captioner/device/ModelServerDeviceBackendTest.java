package com.scholary.captioner.device;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.captioner.TestFixtures;
import com.scholary.captioner.frames.DecodeException;
import com.scholary.captioner.frames.ExtractedFrames;
import com.scholary.captioner.frames.FrameExtractor;
import com.scholary.captioner.frames.FrameExtractor.FrameProgressListener;
import com.scholary.captioner.frames.VideoMetadata;
import com.scholary.captioner.generation.CaptionGenerator.TokenProgressListener;
import com.scholary.captioner.generation.GenerationResult;
import com.scholary.captioner.generation.ModelServerClient;
import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.GenerationSettings;
import com.scholary.captioner.job.WorkerSubstage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ModelServerDeviceBackendTest {

  @Mock private FrameExtractor frameExtractor;
  @Mock private ModelServerClient modelServerClient;

  @TempDir Path tempDir;

  private final GenerationSettings settings = TestFixtures.settings();
  private ModelServerDeviceBackend backend;
  private CaptionTask task;

  @BeforeEach
  void setUp() {
    backend = new ModelServerDeviceBackend("cuda:0", frameExtractor, modelServerClient);
    task = new CaptionTask("beach.mp4", tempDir.resolve("beach.mp4"));
  }

  private record Step(WorkerSubstage substage, double progress) {}

  @Test
  void runPipeline_shouldExtractEncodeAndGenerateInOrder() throws Exception {
    Path workDir = Files.createDirectory(tempDir.resolve("frames-1"));
    Path frame1 = Files.write(workDir.resolve("frame_0000.jpg"), new byte[] {1, 2, 3});
    Path frame2 = Files.write(workDir.resolve("frame_0001.jpg"), new byte[] {4, 5, 6});

    when(frameExtractor.extractFrames(eq(task.getPath()), eq(8), eq(336), any()))
        .thenAnswer(
            invocation -> {
              FrameProgressListener listener = invocation.getArgument(3);
              listener.onFrame(1, 2);
              listener.onFrame(2, 2);
              return new ExtractedFrames(
                  List.of(frame1, frame2), new VideoMetadata(4.0, 640, 480), workDir);
            });
    when(modelServerClient.generate(
            eq("cuda:0"), anyList(), anyString(), anyInt(), anyDouble(), any()))
        .thenAnswer(
            invocation -> {
              TokenProgressListener listener = invocation.getArgument(5);
              listener.onToken(50, 100);
              listener.onToken(100, 100);
              return new GenerationResult("A dog runs.", 100, 40.0);
            });

    List<Step> steps = new ArrayList<>();
    backend.prepare(settings);
    PipelineResult result =
        backend.runPipeline(
            task, settings, (substage, progress) -> steps.add(new Step(substage, progress)));

    assertThat(result.text()).isEqualTo("A dog runs.");
    assertThat(result.outputTokens()).isEqualTo(100);
    assertThat(result.framesProcessed()).isEqualTo(2);
    assertThat(steps)
        .containsExactly(
            new Step(WorkerSubstage.EXTRACTING_FRAMES, 0.0),
            new Step(WorkerSubstage.EXTRACTING_FRAMES, 0.5),
            new Step(WorkerSubstage.EXTRACTING_FRAMES, 1.0),
            new Step(WorkerSubstage.ENCODING, 0.0),
            new Step(WorkerSubstage.ENCODING, 0.5),
            new Step(WorkerSubstage.ENCODING, 1.0),
            new Step(WorkerSubstage.GENERATING, 0.0),
            new Step(WorkerSubstage.GENERATING, 0.5),
            new Step(WorkerSubstage.GENERATING, 1.0));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> frames = ArgumentCaptor.forClass(List.class);
    verify(modelServerClient)
        .generate(
            eq("cuda:0"),
            frames.capture(),
            eq(settings.prompt()),
            eq(settings.maxTokens()),
            eq(settings.temperature()),
            any());
    assertThat(frames.getValue())
        .containsExactly(
            Base64.getEncoder().encodeToString(new byte[] {1, 2, 3}),
            Base64.getEncoder().encodeToString(new byte[] {4, 5, 6}));
    assertThat(workDir).doesNotExist();
  }

  @Test
  void runPipeline_shouldFailWhenNoFramesDecoded() throws Exception {
    Path workDir = Files.createDirectory(tempDir.resolve("frames-empty"));
    when(frameExtractor.extractFrames(any(), anyInt(), anyInt(), any()))
        .thenReturn(new ExtractedFrames(List.of(), new VideoMetadata(0.0, 0, 0), workDir));

    backend.prepare(settings);

    assertThatThrownBy(() -> backend.runPipeline(task, settings, (substage, progress) -> {}))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("beach.mp4");
    verify(modelServerClient, never())
        .generate(anyString(), anyList(), anyString(), anyInt(), anyDouble(), any());
    assertThat(workDir).doesNotExist();
  }

  @Test
  void runPipeline_shouldRequirePreparedBackend() {
    assertThatThrownBy(() -> backend.runPipeline(task, settings, (substage, progress) -> {}))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shutdown_shouldUnloadOnlyPreparedModel() {
    backend.shutdown();
    verify(modelServerClient, never()).unloadModel("cuda:0");

    backend.prepare(settings);
    backend.shutdown();
    backend.shutdown();

    verify(modelServerClient).loadModel("cuda:0", settings);
    verify(modelServerClient).unloadModel("cuda:0");
  }
}
