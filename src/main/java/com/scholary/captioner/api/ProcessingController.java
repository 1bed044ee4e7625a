package com.scholary.captioner.api;

import com.scholary.captioner.config.CaptionerProperties;
import com.scholary.captioner.monitoring.KibanaUrlGenerator;
import com.scholary.captioner.progress.ProgressBroadcaster;
import com.scholary.captioner.progress.ProgressSnapshot;
import com.scholary.captioner.service.JobConflictException;
import com.scholary.captioner.service.NoVideosException;
import com.scholary.captioner.service.NotProcessingException;
import com.scholary.captioner.service.ProcessingManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for caption processing.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting and stopping a captioning job
 *   <li>Polling the current progress snapshot
 *   <li>Streaming progress snapshots over Server-Sent Events
 *   <li>Per-video summary of a job
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Processing", description = "Batch video captioning")
public class ProcessingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingController.class);

  private final ProcessingManager processingManager;
  private final ProgressBroadcaster broadcaster;
  private final KibanaUrlGenerator kibanaUrlGenerator;
  private final Duration sseTimeout;

  public ProcessingController(
      ProcessingManager processingManager,
      ProgressBroadcaster broadcaster,
      KibanaUrlGenerator kibanaUrlGenerator,
      CaptionerProperties properties) {
    this.processingManager = processingManager;
    this.broadcaster = broadcaster;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
    this.sseTimeout = Duration.ofMinutes(properties.progress().sseTimeoutMinutes());
  }

  /**
   * Start captioning.
   *
   * <p>Returns immediately with the job ID. Progress is available from the status and events
   * endpoints.
   */
  @PostMapping(path = "/process/start", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Start a captioning job",
      description =
          "Caption the requested videos (or every video in the working directory) on the "
              + "configured devices. Returns 409 if a job is already running.")
  public ResponseEntity<StartResponse> start(
      @Valid @RequestBody(required = false) StartRequest request) {
    try {
      StartResponse response = processingManager.start(request);
      LOGGER.info("Job {} started with {} videos", response.jobId(), response.totalVideos());
      return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);

    } catch (JobConflictException e) {
      LOGGER.warn("Start rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    } catch (NoVideosException e) {
      LOGGER.warn("Start rejected: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    }
  }

  /**
   * Start captioning every video with default settings.
   *
   * <p>Matches a start request that carries no JSON body, whatever content type the client sends
   * with it. A non-JSON body is rejected.
   */
  @PostMapping("/process/start")
  @Operation(summary = "Start a captioning job with default settings")
  public ResponseEntity<StartResponse> startWithDefaults(HttpServletRequest request) {
    if (request.getContentLengthLong() > 0) {
      LOGGER.warn("Start rejected: body is not JSON");
      return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).build();
    }
    return start(null);
  }

  @PostMapping("/process/stop")
  @Operation(
      summary = "Stop the running job",
      description =
          "Abandons in-flight videos at their next checkpoint and waits for every worker to exit.")
  public ResponseEntity<StopResponse> stop() {
    try {
      return ResponseEntity.ok(processingManager.stop());
    } catch (NotProcessingException e) {
      LOGGER.warn("Stop rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
  }

  @GetMapping("/process/status")
  @Operation(summary = "Get the current progress snapshot")
  public ResponseEntity<ProgressSnapshot> status() {
    return ResponseEntity.ok(processingManager.status());
  }

  @GetMapping("/process/events")
  @Operation(
      summary = "Stream progress snapshots",
      description = "Server-Sent Events stream; the current snapshot is sent on connect.")
  public SseEmitter events() {
    SseEmitter emitter = new SseEmitter(sseTimeout.toMillis());
    Runnable unsubscribe = broadcaster.subscribe(new SseProgressSubscriber(emitter));
    emitter.onCompletion(unsubscribe);
    emitter.onTimeout(unsubscribe);
    emitter.onError(e -> unsubscribe.run());
    return emitter;
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get per-video results of a job")
  public ResponseEntity<JobSummaryResponse> getJob(@PathVariable String jobId) {
    return processingManager
        .findJob(jobId)
        .map(job -> JobSummaryResponse.from(job, kibanaUrlGenerator.generateJobUrl(jobId)))
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
