package com.scholary.captioner.progress;

import com.scholary.captioner.job.Job;
import com.scholary.captioner.job.WorkerSubstage;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One update travelling to the progress aggregator.
 *
 * <p>Only the fields relevant to the {@link Type} are set. {@code ack}, when present, is completed
 * with the snapshot published after the event was applied.
 */
public record ProgressEvent(
    Type type,
    Job job,
    int workerId,
    String videoName,
    WorkerSubstage substage,
    double progress,
    int tokens,
    String message,
    Map<Integer, String> workerDevices,
    CompletableFuture<ProgressSnapshot> ack) {

  public enum Type {
    JOB_ACCEPTED,
    MODEL_READY,
    PROCESSING_STARTED,
    TASK_STARTED,
    SUBSTAGE,
    TASK_DONE,
    TASK_FAILED,
    TASK_CANCELLED,
    WORKER_EXITED,
    JOB_FATAL,
    JOB_FINISHED
  }

  private static final int NO_WORKER = -1;

  public static ProgressEvent jobAccepted(Job job) {
    return new ProgressEvent(Type.JOB_ACCEPTED, job, NO_WORKER, null, null, 0, 0, null, null, null);
  }

  /** A device finished loading; {@code fraction} of the job's devices are now ready. */
  public static ProgressEvent modelReady(double fraction) {
    return new ProgressEvent(
        Type.MODEL_READY, null, NO_WORKER, null, null, fraction, 0, null, null, null);
  }

  /** Processing began with these workers, by worker id. */
  public static ProgressEvent processingStarted(Map<Integer, String> workerDevices) {
    return new ProgressEvent(
        Type.PROCESSING_STARTED, null, NO_WORKER, null, null, 0, 0, null, workerDevices, null);
  }

  public static ProgressEvent taskStarted(int workerId, String videoName) {
    return new ProgressEvent(
        Type.TASK_STARTED, null, workerId, videoName, null, 0, 0, null, null, null);
  }

  public static ProgressEvent substage(int workerId, WorkerSubstage substage, double progress) {
    return new ProgressEvent(
        Type.SUBSTAGE, null, workerId, null, substage, progress, 0, null, null, null);
  }

  public static ProgressEvent taskDone(int workerId, String videoName, int tokens) {
    return new ProgressEvent(
        Type.TASK_DONE, null, workerId, videoName, null, 0, tokens, null, null, null);
  }

  public static ProgressEvent taskFailed(int workerId, String videoName, String error) {
    return new ProgressEvent(
        Type.TASK_FAILED, null, workerId, videoName, null, 0, 0, error, null, null);
  }

  public static ProgressEvent taskCancelled(int workerId, String videoName) {
    return new ProgressEvent(
        Type.TASK_CANCELLED, null, workerId, videoName, null, 0, 0, null, null, null);
  }

  public static ProgressEvent workerExited(int workerId) {
    return new ProgressEvent(
        Type.WORKER_EXITED, null, workerId, null, null, 0, 0, null, null, null);
  }

  public static ProgressEvent jobFatal(int workerId, String message) {
    return new ProgressEvent(Type.JOB_FATAL, null, workerId, null, null, 0, 0, message, null, null);
  }

  /**
   * Every worker has exited.
   *
   * @param fatalError the job-fatal error, or null if the job was not failed
   */
  public static ProgressEvent jobFinished(String fatalError) {
    return new ProgressEvent(
        Type.JOB_FINISHED, null, NO_WORKER, null, null, 0, 0, fatalError, null, null);
  }

  ProgressEvent withAck(CompletableFuture<ProgressSnapshot> future) {
    return new ProgressEvent(
        type, job, workerId, videoName, substage, progress, tokens, message, workerDevices, future);
  }
}
