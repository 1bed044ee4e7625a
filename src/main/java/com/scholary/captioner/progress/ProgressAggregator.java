package com.scholary.captioner.progress;

import com.scholary.captioner.job.Job;
import com.scholary.captioner.job.JobStage;
import com.scholary.captioner.job.WorkerSubstage;
import com.scholary.captioner.logging.StructuredLogger;
import com.scholary.captioner.worker.WorkerEventSink;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the progress state and the job state machine.
 *
 * <p>Workers and the processing manager send {@link ProgressEvent}s through a bounded queue. A
 * single consumer thread applies them in arrival order, publishes a fresh immutable snapshot after
 * each one and hands it to the broadcaster. Nothing else writes progress state.
 *
 * <p>Stage transitions:
 *
 * <pre>
 * IDLE / terminal --accepted--> LOADING_MODEL --all devices ready--> PROCESSING
 * LOADING_MODEL / PROCESSING --finished--> COMPLETE | STOPPED | ERROR
 * </pre>
 *
 * <p>A finished job is ERROR when it carries a fatal error, COMPLETE when no video is left, and
 * STOPPED otherwise. An ERROR job counts every unfinished video as failed. Once a job is terminal,
 * events still in flight for it are ignored.
 */
public class ProgressAggregator implements WorkerEventSink, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressAggregator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final long POLL_MILLIS = 200;

  private final BlockingQueue<ProgressEvent> events;
  private final ProgressBroadcaster broadcaster;
  private final Thread consumer;

  private volatile boolean closed;
  private volatile ProgressSnapshot snapshot = ProgressSnapshot.idle();

  // State below is confined to the consumer thread
  private Job job;
  private JobStage stage = JobStage.IDLE;
  private int total;
  private int completed;
  private int failed;
  private long committedTokens;
  private double modelLoadProgress;
  private String errorMessage;
  private long acceptedNanos;
  private long processingStartedNanos;
  private long finishedNanos;
  private final Map<Integer, WorkerState> workers = new TreeMap<>();

  public ProgressAggregator(int capacity, ProgressBroadcaster broadcaster) {
    this.events = new ArrayBlockingQueue<>(capacity);
    this.broadcaster = broadcaster;
    this.consumer = new Thread(this::consume, "progress-aggregator");
    this.consumer.setDaemon(true);
  }

  public void start() {
    consumer.start();
    LOGGER.info("Progress aggregator started: capacity={}", events.remainingCapacity());
  }

  /** The last published snapshot. */
  public ProgressSnapshot current() {
    return snapshot;
  }

  /**
   * Queue an event, blocking while the queue is full.
   *
   * <p>If the calling thread is interrupted while waiting the event is dropped and the interrupt
   * flag is restored.
   */
  public void submit(ProgressEvent event) {
    try {
      events.put(event);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while queueing {} event, dropping it", event.type());
    }
  }

  /**
   * Queue an event and wait until it has been applied.
   *
   * @return the snapshot published right after the event
   * @throws IllegalStateException if the event is not applied within the timeout
   */
  public ProgressSnapshot submitAndAwait(ProgressEvent event, Duration timeout) {
    CompletableFuture<ProgressSnapshot> ack = new CompletableFuture<>();
    submit(event.withAck(ack));
    try {
      return ack.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted waiting for " + event.type(), e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Failed to apply " + event.type(), e.getCause());
    } catch (TimeoutException e) {
      throw new IllegalStateException("Timed out waiting for " + event.type(), e);
    }
  }

  @Override
  public void taskStarted(int workerId, String videoName) {
    submit(ProgressEvent.taskStarted(workerId, videoName));
  }

  @Override
  public void substageProgress(int workerId, WorkerSubstage substage, double progress) {
    submit(ProgressEvent.substage(workerId, substage, progress));
  }

  @Override
  public void taskDone(int workerId, String videoName, int outputTokens) {
    submit(ProgressEvent.taskDone(workerId, videoName, outputTokens));
  }

  @Override
  public void taskFailed(int workerId, String videoName, String error) {
    submit(ProgressEvent.taskFailed(workerId, videoName, error));
  }

  @Override
  public void taskCancelled(int workerId, String videoName) {
    submit(ProgressEvent.taskCancelled(workerId, videoName));
  }

  @Override
  public void jobFatal(int workerId, String message) {
    submit(ProgressEvent.jobFatal(workerId, message));
  }

  @Override
  public void workerExited(int workerId) {
    submit(ProgressEvent.workerExited(workerId));
  }

  @Override
  public void close() {
    closed = true;
    consumer.interrupt();
    try {
      consumer.join(TimeUnit.SECONDS.toMillis(1));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void consume() {
    while (!closed) {
      ProgressEvent event;
      try {
        event = events.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        if (closed) {
          break;
        }
        continue;
      }
      if (event == null) {
        continue;
      }

      try {
        apply(event);
        ProgressSnapshot published = buildSnapshot();
        snapshot = published;
        broadcaster.publish(published);
        if (event.ack() != null) {
          event.ack().complete(published);
        }
      } catch (RuntimeException e) {
        LOGGER.error("Failed to apply progress event {}", event.type(), e);
        if (event.ack() != null) {
          event.ack().completeExceptionally(e);
        }
      }
    }
    LOGGER.debug("Progress aggregator stopped");
  }

  private void apply(ProgressEvent event) {
    if (event.type() == ProgressEvent.Type.JOB_ACCEPTED) {
      accept(event.job());
      return;
    }
    if (job == null || stage.isTerminal()) {
      LOGGER.debug("Ignoring {} event in stage {}", event.type(), stage);
      return;
    }

    switch (event.type()) {
      case MODEL_READY:
        modelLoadProgress = event.progress();
        break;
      case PROCESSING_STARTED:
        for (Map.Entry<Integer, String> entry : event.workerDevices().entrySet()) {
          workers.put(entry.getKey(), new WorkerState(entry.getKey(), entry.getValue()));
        }
        modelLoadProgress = 1.0;
        processingStartedNanos = System.nanoTime();
        moveTo(JobStage.PROCESSING);
        break;
      case TASK_STARTED:
        worker(event.workerId()).startTask(event.videoName());
        break;
      case SUBSTAGE:
        worker(event.workerId())
            .update(event.substage(), event.progress(), job.getSettings().maxTokens());
        break;
      case TASK_DONE:
        completed++;
        committedTokens += event.tokens();
        worker(event.workerId()).idle();
        logProgress();
        break;
      case TASK_FAILED:
        failed++;
        worker(event.workerId()).idle();
        logProgress();
        break;
      case TASK_CANCELLED:
      case WORKER_EXITED:
        worker(event.workerId()).idle();
        break;
      case JOB_FATAL:
        if (errorMessage == null) {
          errorMessage = event.message();
        }
        break;
      case JOB_FINISHED:
        finish(event.message());
        break;
      default:
        throw new IllegalArgumentException("Unexpected event type: " + event.type());
    }
  }

  private void accept(Job accepted) {
    if (stage.isActive()) {
      throw new IllegalStateException("Job " + job.getJobId() + " is still " + stage);
    }
    job = accepted;
    total = accepted.getTotal();
    completed = 0;
    failed = 0;
    committedTokens = 0;
    modelLoadProgress = 0.0;
    errorMessage = null;
    acceptedNanos = System.nanoTime();
    processingStartedNanos = 0;
    finishedNanos = 0;
    workers.clear();
    moveTo(JobStage.LOADING_MODEL);
  }

  private void finish(String fatalError) {
    JobStage finalStage;
    if (fatalError != null) {
      finalStage = JobStage.ERROR;
      errorMessage = fatalError;
      // Videos that never finished are failed by the job error
      failed = total - completed;
    } else if (remaining() == 0) {
      finalStage = JobStage.COMPLETE;
    } else {
      finalStage = JobStage.STOPPED;
    }

    workers.values().forEach(WorkerState::idle);
    finishedNanos = System.nanoTime();
    job.setErrorMessage(errorMessage);
    moveTo(finalStage);

    structuredLogger.logJobFinished(
        job.getJobId(), finalStage.wireName(), completed, failed, remaining(), errorMessage);
  }

  private void moveTo(JobStage next) {
    LOGGER.debug("Job {} stage {} -> {}", job.getJobId(), stage, next);
    stage = next;
    job.setStage(next);
  }

  private WorkerState worker(int workerId) {
    WorkerState state = workers.get(workerId);
    if (state == null) {
      throw new IllegalStateException("Unknown worker " + workerId);
    }
    return state;
  }

  private int remaining() {
    return total - completed - failed;
  }

  private void logProgress() {
    int percent = total == 0 ? 100 : (int) ((completed + failed) * 100L / total);
    structuredLogger.logJobProgress(job.getJobId(), completed, failed, total, percent);
  }

  private ProgressSnapshot buildSnapshot() {
    if (job == null) {
      return ProgressSnapshot.idle();
    }

    long now = finishedNanos != 0 ? finishedNanos : System.nanoTime();
    boolean processing = stage == JobStage.PROCESSING;

    double inFlightFraction = 0.0;
    long inFlightTokens = 0;
    List<WorkerProgress> workerProgress = new ArrayList<>(workers.size());
    for (WorkerState state : workers.values()) {
      if (processing) {
        inFlightFraction += state.taskFraction();
        inFlightTokens += state.inFlightTokens();
      }
      workerProgress.add(state.toProgress());
    }

    double overall = 0.0;
    if (total > 0) {
      double floor = (double) (completed + failed) / total;
      overall = Math.min(1.0, floor + inFlightFraction / total);
    }

    long tokens = committedTokens + inFlightTokens;
    double tokensPerSec = 0.0;
    if (processingStartedNanos != 0) {
      double seconds = (now - processingStartedNanos) / 1_000_000_000.0;
      tokensPerSec = seconds > 0 ? tokens / seconds : 0.0;
    }

    return new ProgressSnapshot(
        job.getJobId(),
        stage,
        total,
        completed,
        failed,
        remaining(),
        overall,
        modelLoadProgress,
        (now - acceptedNanos) / 1_000_000_000.0,
        tokens,
        tokensPerSec,
        List.copyOf(workerProgress),
        errorMessage);
  }
}
