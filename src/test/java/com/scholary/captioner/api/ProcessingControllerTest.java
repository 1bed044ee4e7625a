package com.scholary.captioner.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.scholary.captioner.TestFixtures;
import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.Job;
import com.scholary.captioner.job.JobStage;
import com.scholary.captioner.monitoring.KibanaUrlGenerator;
import com.scholary.captioner.progress.ProgressBroadcaster;
import com.scholary.captioner.progress.ProgressSnapshot;
import com.scholary.captioner.service.JobConflictException;
import com.scholary.captioner.service.NoVideosException;
import com.scholary.captioner.service.NotProcessingException;
import com.scholary.captioner.service.ProcessingManager;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ProcessingControllerTest {

  @Mock private ProcessingManager processingManager;
  @Mock private ProgressBroadcaster broadcaster;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    ProcessingController controller =
        new ProcessingController(
            processingManager,
            broadcaster,
            new KibanaUrlGenerator("http://kibana:5601", "captioner-logs-*"),
            TestFixtures.properties(Path.of("videos"), List.of("cuda:0")));
    ObjectMapper objectMapper =
        Jackson2ObjectMapperBuilder.json()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .build();
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
  }

  @Test
  void start_shouldAcceptJobWithoutBody() throws Exception {
    when(processingManager.start(null))
        .thenReturn(new StartResponse(true, 3, "job-1", "http://kibana:5601/app/discover"));

    mockMvc
        .perform(post("/api/process/start"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.accepted").value(true))
        .andExpect(jsonPath("$.total_videos").value(3))
        .andExpect(jsonPath("$.job_id").value("job-1"));
  }

  @Test
  void start_shouldAcceptEmptyFormPostAsDefaultJob() throws Exception {
    when(processingManager.start(null))
        .thenReturn(new StartResponse(true, 3, "job-1", "http://kibana:5601/app/discover"));

    mockMvc
        .perform(post("/api/process/start").contentType(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.job_id").value("job-1"));
  }

  @Test
  void start_shouldRejectBodyThatIsNotJson() throws Exception {
    mockMvc
        .perform(
            post("/api/process/start")
                .contentType(MediaType.TEXT_PLAIN)
                .content("beach.mp4"))
        .andExpect(status().isUnsupportedMediaType());

    verify(processingManager, never()).start(any());
  }

  @Test
  void start_shouldPassRequestedVideosAndOverrides() throws Exception {
    when(processingManager.start(any()))
        .thenReturn(new StartResponse(true, 1, "job-1", "http://kibana:5601/app/discover"));

    mockMvc
        .perform(
            post("/api/process/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"video_names\":[\"beach.mp4\"],\"prompt\":\"Describe briefly.\","
                        + "\"settings_override\":{\"max_frames\":4,\"temperature\":0.7}}"))
        .andExpect(status().isAccepted());

    ArgumentCaptor<StartRequest> captor = ArgumentCaptor.forClass(StartRequest.class);
    verify(processingManager).start(captor.capture());
    StartRequest request = captor.getValue();
    assertThat(request.videoNames()).containsExactly("beach.mp4");
    assertThat(request.prompt()).isEqualTo("Describe briefly.");
    assertThat(request.settingsOverride().maxFrames()).isEqualTo(4);
    assertThat(request.settingsOverride().temperature()).isEqualTo(0.7);
  }

  @Test
  void start_shouldRejectOutOfRangeOverride() throws Exception {
    mockMvc
        .perform(
            post("/api/process/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"settings_override\":{\"max_frames\":0}}"))
        .andExpect(status().isBadRequest());

    verify(processingManager, never()).start(any());
  }

  @Test
  void start_shouldReturnConflictWhileJobRuns() throws Exception {
    when(processingManager.start(null))
        .thenThrow(new JobConflictException("A captioning job is already running"));

    mockMvc.perform(post("/api/process/start")).andExpect(status().isConflict());
  }

  @Test
  void start_shouldReturnBadRequestWithoutVideos() throws Exception {
    when(processingManager.start(null)).thenThrow(new NoVideosException("No matching videos"));

    mockMvc.perform(post("/api/process/start")).andExpect(status().isBadRequest());
  }

  @Test
  void stop_shouldReturnFinalCounts() throws Exception {
    when(processingManager.stop()).thenReturn(new StopResponse(3, 7, true));

    mockMvc
        .perform(post("/api/process/stop"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.videos_completed").value(3))
        .andExpect(jsonPath("$.videos_remaining").value(7))
        .andExpect(jsonPath("$.stopped").value(true));
  }

  @Test
  void stop_shouldReturnConflictWhenIdle() throws Exception {
    when(processingManager.stop()).thenThrow(new NotProcessingException("No job"));

    mockMvc.perform(post("/api/process/stop")).andExpect(status().isConflict());
  }

  @Test
  void status_shouldReturnSnapshotInSnakeCase() throws Exception {
    when(processingManager.status()).thenReturn(ProgressSnapshot.idle());

    mockMvc
        .perform(get("/api/process/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.stage").value("idle"))
        .andExpect(jsonPath("$.overall_progress").value(0.0))
        .andExpect(jsonPath("$.terminal").doesNotExist());
  }

  @Test
  void getJob_shouldReturnPerVideoSummary() throws Exception {
    Job job =
        new Job(
            "job-1",
            List.of(new CaptionTask("beach.mp4", Path.of("videos/beach.mp4"))),
            TestFixtures.settings(),
            List.of("cuda:0"));
    job.setStage(JobStage.LOADING_MODEL);
    when(processingManager.findJob("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.job_id").value("job-1"))
        .andExpect(jsonPath("$.stage").value("loading_model"))
        .andExpect(jsonPath("$.tasks[0].video_name").value("beach.mp4"))
        .andExpect(jsonPath("$.tasks[0].status").value("queued"));
  }

  @Test
  void getJob_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(processingManager.findJob("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void events_shouldSubscribeStreamToBroadcaster() throws Exception {
    when(broadcaster.subscribe(any())).thenReturn(() -> {});

    mockMvc.perform(get("/api/process/events")).andExpect(request().asyncStarted());

    verify(broadcaster).subscribe(any(SseProgressSubscriber.class));
  }
}
