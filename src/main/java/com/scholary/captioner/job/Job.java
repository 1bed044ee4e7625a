package com.scholary.captioner.job;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One captioning run.
 *
 * <p>The task list and settings are fixed when the job is created. The stage, error message and
 * finish time are written only by the progress aggregator and read by everyone else.
 */
public class Job {

  private final String jobId;
  private final List<CaptionTask> tasks;
  private final GenerationSettings settings;
  private final List<String> devices;
  private final Instant createdAt;

  private volatile JobStage stage;
  private volatile String errorMessage;
  private volatile Instant finishedAt;

  public Job(
      String jobId, List<CaptionTask> tasks, GenerationSettings settings, List<String> devices) {
    Set<String> names = new HashSet<>();
    for (CaptionTask task : tasks) {
      if (!names.add(task.getVideoName())) {
        throw new IllegalArgumentException("Duplicate video in job: " + task.getVideoName());
      }
    }
    this.jobId = jobId;
    this.tasks = List.copyOf(tasks);
    this.settings = settings;
    this.devices = List.copyOf(devices);
    this.createdAt = Instant.now();
    this.stage = JobStage.IDLE;
  }

  public String getJobId() {
    return jobId;
  }

  public List<CaptionTask> getTasks() {
    return tasks;
  }

  /** Video names in the order they were requested. */
  public List<String> getRequestedVideos() {
    return tasks.stream().map(CaptionTask::getVideoName).collect(Collectors.toList());
  }

  public int getTotal() {
    return tasks.size();
  }

  public GenerationSettings getSettings() {
    return settings;
  }

  public List<String> getDevices() {
    return devices;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public JobStage getStage() {
    return stage;
  }

  public void setStage(JobStage stage) {
    this.stage = stage;
    if (stage.isTerminal()) {
      this.finishedAt = Instant.now();
    }
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public long countByStatus(TaskStatus status) {
    return tasks.stream().filter(task -> task.getStatus() == status).count();
  }
}
