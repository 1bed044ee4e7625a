package com.scholary.captioner.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.captioner.job.JobStage;
import java.util.List;

/**
 * Immutable view of the current job, as sent to dashboards.
 *
 * <p>{@code overallProgress} counts finished videos plus the fraction of each video still on a
 * worker. {@code modelLoadProgress} is the fraction of devices prepared while the job is loading.
 */
public record ProgressSnapshot(
    String jobId,
    JobStage stage,
    int totalVideos,
    int completedVideos,
    int failedVideos,
    int remainingVideos,
    double overallProgress,
    double modelLoadProgress,
    double elapsedSeconds,
    long tokensGenerated,
    double tokensPerSec,
    List<WorkerProgress> workers,
    String errorMessage) {

  public static ProgressSnapshot idle() {
    return new ProgressSnapshot(
        null, JobStage.IDLE, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0, 0.0, List.of(), null);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return stage.isTerminal();
  }
}
