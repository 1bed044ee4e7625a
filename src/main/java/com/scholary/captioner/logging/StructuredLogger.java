package com.scholary.captioner.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event is tagged with an {@code event_type} field so runs can be queried in Kibana. Job
 * and worker context live in MDC for the lifetime of the thread doing the work; event fields are
 * removed right after the line is written.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job accepted event. */
  public void logJobAccepted(String jobId, int totalVideos, int devices, String modelId) {
    try {
      MDC.put("event_type", "job_accepted");
      MDC.put("jobId", jobId);
      MDC.put("totalVideos", String.valueOf(totalVideos));
      MDC.put("deviceCount", String.valueOf(devices));
      MDC.put("modelId", modelId);

      logger.info(
          "Job accepted: jobId={}, videos={}, devices={}, model={}",
          jobId,
          totalVideos,
          devices,
          modelId);
    } finally {
      clearEventFields();
    }
  }

  /** Log model loaded event. */
  public void logModelLoaded(String device, String modelId, long loadMs) {
    try {
      MDC.put("event_type", "model_loaded");
      MDC.put("device", device);
      MDC.put("modelId", modelId);
      MDC.put("loadMs", String.valueOf(loadMs));

      logger.info("Model loaded: device={}, model={}, load={}ms", device, modelId, loadMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log task started event. */
  public void logTaskStarted(String videoName) {
    try {
      MDC.put("event_type", "task_started");

      logger.debug("Task started: video={}", videoName);
    } finally {
      clearEventFields();
    }
  }

  /** Log task finished event. */
  public void logTaskFinished(
      String videoName, int frames, int outputTokens, double tokensPerSec, long elapsedMs) {
    try {
      MDC.put("event_type", "task_finished");
      MDC.put("frames", String.valueOf(frames));
      MDC.put("outputTokens", String.valueOf(outputTokens));
      MDC.put("tokensPerSec", String.valueOf(tokensPerSec));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Task finished: video={}, frames={}, tokens={}, rate={} tok/s, elapsed={}ms",
          videoName,
          frames,
          outputTokens,
          String.format("%.1f", tokensPerSec),
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log task failure event. */
  public void logTaskFailed(String videoName, String errorType, String message) {
    try {
      MDC.put("event_type", "task_failed");
      MDC.put("errorType", errorType);

      logger.warn("Task failed: video={}, error={}, message={}", videoName, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log task cancelled event. */
  public void logTaskCancelled(String videoName) {
    try {
      MDC.put("event_type", "task_cancelled");

      logger.info("Task cancelled: video={}", videoName);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int completed, int failed, int total, int percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("completed", String.valueOf(completed));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Job progress: jobId={}, done={}/{}, failed={}, progress={}%",
          jobId,
          completed + failed,
          total,
          failed,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log job finished event. */
  public void logJobFinished(
      String jobId, String stage, int completed, int failed, int remaining, String errorMessage) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("jobId", jobId);
      MDC.put("stage", stage);
      MDC.put("completed", String.valueOf(completed));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("remaining", String.valueOf(remaining));

      if (errorMessage != null) {
        logger.error(
            "Job finished: jobId={}, stage={}, completed={}, failed={}, remaining={}, error={}",
            jobId,
            stage,
            completed,
            failed,
            remaining,
            errorMessage);
      } else {
        logger.info(
            "Job finished: jobId={}, stage={}, completed={}, failed={}, remaining={}",
            jobId,
            stage,
            completed,
            failed,
            remaining);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Set worker context in MDC. */
  public static void setWorkerContext(String jobId, int workerId, String device) {
    MDC.put("jobId", jobId);
    MDC.put("workerId", String.valueOf(workerId));
    MDC.put("device", device);
  }

  /** Clear worker context from MDC. */
  public static void clearWorkerContext() {
    MDC.remove("jobId");
    MDC.remove("workerId");
    MDC.remove("device");
    MDC.remove("video");
  }

  /** Set the video being processed by the current worker. */
  public static void setVideoContext(String videoName) {
    MDC.put("video", videoName);
  }

  public static void clearVideoContext() {
    MDC.remove("video");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("totalVideos");
    MDC.remove("deviceCount");
    MDC.remove("modelId");
    MDC.remove("loadMs");
    MDC.remove("frames");
    MDC.remove("outputTokens");
    MDC.remove("tokensPerSec");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("completed");
    MDC.remove("failed");
    MDC.remove("total");
    MDC.remove("percentComplete");
    MDC.remove("stage");
    MDC.remove("remaining");
  }
}
