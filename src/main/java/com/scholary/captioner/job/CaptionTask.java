package com.scholary.captioner.job;

import java.nio.file.Path;
import java.time.Duration;

/**
 * One video to be captioned within a job.
 *
 * <p>The work queue assigns the task to a worker; from then on only that worker changes it. Fields
 * are volatile because the job summary endpoint reads them from request threads while the worker
 * is still writing.
 */
public class CaptionTask {

  private static final int PREVIEW_LENGTH = 200;

  private final String videoName;
  private final Path path;

  private volatile TaskStatus status;
  private volatile Integer assignedWorker;
  private volatile String error;
  private volatile int tokensGenerated;
  private volatile Duration elapsed;
  private volatile Path outputPath;
  private volatile String captionPreview;

  public CaptionTask(String videoName, Path path) {
    this.videoName = videoName;
    this.path = path;
    this.status = TaskStatus.QUEUED;
    this.elapsed = Duration.ZERO;
  }

  public String getVideoName() {
    return videoName;
  }

  public Path getPath() {
    return path;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Integer getAssignedWorker() {
    return assignedWorker;
  }

  public String getError() {
    return error;
  }

  public int getTokensGenerated() {
    return tokensGenerated;
  }

  public Duration getElapsed() {
    return elapsed;
  }

  public Path getOutputPath() {
    return outputPath;
  }

  public String getCaptionPreview() {
    return captionPreview;
  }

  /** Called by the work queue while it holds its lock. */
  void assignTo(int workerId) {
    if (status != TaskStatus.QUEUED) {
      throw new IllegalStateException(
          "Task " + videoName + " cannot be assigned from status " + status);
    }
    this.assignedWorker = workerId;
    this.status = TaskStatus.ASSIGNED;
  }

  public void advanceTo(TaskStatus pipelineStatus) {
    this.status = pipelineStatus;
  }

  public void markDone(String caption, int tokens, Duration elapsed, Path outputPath) {
    this.tokensGenerated = tokens;
    this.elapsed = elapsed;
    this.outputPath = outputPath;
    this.captionPreview =
        caption.length() > PREVIEW_LENGTH ? caption.substring(0, PREVIEW_LENGTH) + "..." : caption;
    this.status = TaskStatus.DONE;
  }

  public void markFailed(String error, Duration elapsed) {
    this.error = error;
    this.elapsed = elapsed;
    this.status = TaskStatus.FAILED;
  }

  public void markCancelled(Duration elapsed) {
    this.error = "stopped";
    this.elapsed = elapsed;
    this.status = TaskStatus.CANCELLED;
  }
}
