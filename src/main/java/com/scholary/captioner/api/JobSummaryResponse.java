package com.scholary.captioner.api;

import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.GenerationSettings;
import com.scholary.captioner.job.Job;
import com.scholary.captioner.job.JobStage;
import com.scholary.captioner.job.TaskStatus;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/** Final or in-progress summary of one job, with an entry per video. */
public record JobSummaryResponse(
    String jobId,
    JobStage stage,
    Instant createdAt,
    Instant finishedAt,
    List<String> devices,
    GenerationSettings settings,
    long completed,
    long failed,
    long cancelled,
    String errorMessage,
    String kibanaUrl,
    List<TaskSummary> tasks) {

  /** Outcome of one video. */
  public record TaskSummary(
      String videoName,
      TaskStatus status,
      Integer workerId,
      String error,
      int tokensGenerated,
      double elapsedSeconds,
      String outputPath,
      String captionPreview) {

    static TaskSummary from(CaptionTask task) {
      return new TaskSummary(
          task.getVideoName(),
          task.getStatus(),
          task.getAssignedWorker(),
          task.getError(),
          task.getTokensGenerated(),
          task.getElapsed().toMillis() / 1000.0,
          task.getOutputPath() != null ? task.getOutputPath().toString() : null,
          task.getCaptionPreview());
    }
  }

  public static JobSummaryResponse from(Job job, String kibanaUrl) {
    return new JobSummaryResponse(
        job.getJobId(),
        job.getStage(),
        job.getCreatedAt(),
        job.getFinishedAt(),
        job.getDevices(),
        job.getSettings(),
        job.countByStatus(TaskStatus.DONE),
        job.countByStatus(TaskStatus.FAILED),
        job.countByStatus(TaskStatus.CANCELLED),
        job.getErrorMessage(),
        kibanaUrl,
        job.getTasks().stream().map(TaskSummary::from).collect(Collectors.toList()));
  }
}
