package com.scholary.captioner.worker;

import com.scholary.captioner.device.DeviceBackend;
import com.scholary.captioner.device.PipelineListener;
import com.scholary.captioner.device.PipelineResult;
import com.scholary.captioner.device.TaskCancelledException;
import com.scholary.captioner.generation.DeviceUnavailableException;
import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.GenerationSettings;
import com.scholary.captioner.job.WorkQueue;
import com.scholary.captioner.job.WorkerSubstage;
import com.scholary.captioner.logging.StructuredLogger;
import com.scholary.captioner.service.CaptionMetadata;
import com.scholary.captioner.service.CaptionWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes tasks on one device until the queue is empty or the job is stopped.
 *
 * <p>For each task pulled from the shared queue: run the device pipeline, write the caption, then
 * report the outcome. A failure of one video is recorded on its task and the worker moves on. A
 * device failure stops the whole job.
 *
 * <p>The stop signal is checked before each pull, at every pipeline progress report and before the
 * caption is written. A task abandoned at one of those points is marked cancelled.
 */
public class Worker implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final double MIN_REPORTED_INCREMENT = 0.01;

  private final String jobId;
  private final int workerId;
  private final DeviceBackend backend;
  private final WorkQueue queue;
  private final GenerationSettings settings;
  private final CaptionWriter captionWriter;
  private final StopSignal stopSignal;
  private final WorkerEventSink events;

  public Worker(
      String jobId,
      int workerId,
      DeviceBackend backend,
      WorkQueue queue,
      GenerationSettings settings,
      CaptionWriter captionWriter,
      StopSignal stopSignal,
      WorkerEventSink events) {
    this.jobId = jobId;
    this.workerId = workerId;
    this.backend = backend;
    this.queue = queue;
    this.settings = settings;
    this.captionWriter = captionWriter;
    this.stopSignal = stopSignal;
    this.events = events;
  }

  @Override
  public void run() {
    StructuredLogger.setWorkerContext(jobId, workerId, backend.device());
    int processed = 0;
    try {
      LOGGER.info("Worker {} started on {}", workerId, backend.device());

      while (!stopSignal.isCancelled()) {
        Optional<CaptionTask> next = queue.pull(workerId);
        if (next.isEmpty()) {
          break;
        }
        process(next.get());
        processed++;
      }

      LOGGER.info(
          "Worker {} exiting after {} tasks (stopped={})",
          workerId,
          processed,
          stopSignal.isCancelled());
    } finally {
      events.workerExited(workerId);
      StructuredLogger.clearWorkerContext();
    }
  }

  private void process(CaptionTask task) {
    String videoName = task.getVideoName();
    StructuredLogger.setVideoContext(videoName);
    long startNanos = System.nanoTime();

    try {
      events.taskStarted(workerId, videoName);
      structuredLogger.logTaskStarted(videoName);

      PipelineResult result =
          backend.runPipeline(task, settings, new ThrottledListener(task, stopSignal, events));

      // A caption that is ready but not yet written is still abandoned on stop
      checkpoint(videoName);

      CaptionMetadata metadata =
          new CaptionMetadata(
              videoName,
              workerId,
              backend.device(),
              result.framesProcessed(),
              result.outputTokens(),
              result.tokensPerSec());
      Path output =
          captionWriter.saveCaption(
              task.getPath(), result.text(), metadata, settings.includeMetadata());

      Duration elapsed = elapsedSince(startNanos);
      task.markDone(result.text(), result.outputTokens(), elapsed, output);
      events.taskDone(workerId, videoName, result.outputTokens());
      structuredLogger.logTaskFinished(
          videoName,
          result.framesProcessed(),
          result.outputTokens(),
          result.tokensPerSec(),
          elapsed.toMillis());

    } catch (TaskCancelledException e) {
      task.markCancelled(elapsedSince(startNanos));
      events.taskCancelled(workerId, videoName);
      structuredLogger.logTaskCancelled(videoName);

    } catch (DeviceUnavailableException e) {
      task.markFailed(e.getMessage(), elapsedSince(startNanos));
      events.taskFailed(workerId, videoName, e.getMessage());
      structuredLogger.logTaskFailed(videoName, e.getClass().getSimpleName(), e.getMessage());

      String reason =
          e.getMessage() != null ? e.getMessage() : "Device unavailable: " + e.getDevice();
      stopSignal.fail(reason);
      events.jobFatal(workerId, reason);

    } catch (IOException | RuntimeException e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      task.markFailed(message, elapsedSince(startNanos));
      events.taskFailed(workerId, videoName, message);
      structuredLogger.logTaskFailed(videoName, e.getClass().getSimpleName(), message);
      LOGGER.debug("Task failure detail for {}", videoName, e);

    } finally {
      StructuredLogger.clearVideoContext();
    }
  }

  private void checkpoint(String videoName) {
    if (stopSignal.isCancelled()) {
      throw new TaskCancelledException(videoName);
    }
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  /**
   * Forwards pipeline progress, dropping increments under one percent within a substage. Every call
   * is also a cancellation checkpoint.
   */
  static final class ThrottledListener implements PipelineListener {

    private final CaptionTask task;
    private final StopSignal stopSignal;
    private final WorkerEventSink events;

    private WorkerSubstage currentSubstage;
    private double lastReported;

    ThrottledListener(CaptionTask task, StopSignal stopSignal, WorkerEventSink events) {
      this.task = task;
      this.stopSignal = stopSignal;
      this.events = events;
    }

    @Override
    public void onProgress(WorkerSubstage substage, double progress) {
      if (stopSignal.isCancelled()) {
        throw new TaskCancelledException(task.getVideoName());
      }

      int workerId = task.getAssignedWorker();
      if (substage != currentSubstage) {
        currentSubstage = substage;
        lastReported = progress;
        task.advanceTo(substage.taskStatus());
        events.substageProgress(workerId, substage, progress);
        return;
      }

      boolean finishing = progress >= 1.0 && lastReported < 1.0;
      if (finishing || progress - lastReported >= MIN_REPORTED_INCREMENT) {
        lastReported = progress;
        events.substageProgress(workerId, substage, progress);
      }
    }
  }
}
