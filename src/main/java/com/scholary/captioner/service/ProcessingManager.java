package com.scholary.captioner.service;

import com.scholary.captioner.api.StartRequest;
import com.scholary.captioner.api.StartResponse;
import com.scholary.captioner.api.StopResponse;
import com.scholary.captioner.config.CaptionerProperties;
import com.scholary.captioner.device.DeviceBackend;
import com.scholary.captioner.device.DeviceBackendPool;
import com.scholary.captioner.device.ModelStatus;
import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.GenerationSettings;
import com.scholary.captioner.job.Job;
import com.scholary.captioner.job.JobRepository;
import com.scholary.captioner.job.WorkQueue;
import com.scholary.captioner.logging.StructuredLogger;
import com.scholary.captioner.monitoring.KibanaUrlGenerator;
import com.scholary.captioner.progress.ProgressAggregator;
import com.scholary.captioner.progress.ProgressEvent;
import com.scholary.captioner.progress.ProgressSnapshot;
import com.scholary.captioner.service.MediaLibrary.MediaFile;
import com.scholary.captioner.worker.StopSignal;
import com.scholary.captioner.worker.Worker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs captioning jobs, one at a time.
 *
 * <p>Flow of a job:
 *
 * <ol>
 *   <li>{@link #start} claims the run slot, resolves videos and settings, and reports the job
 *       accepted
 *   <li>a coordinator thread leases one prepared backend per selected device, in order, reusing
 *       models still resident from an earlier job
 *   <li>one {@link Worker} per prepared device pulls tasks from a shared queue
 *   <li>when every worker has exited the coordinator reports the job finished and frees the slot
 * </ol>
 *
 * <p>{@link #stop} sets the job's stop signal and waits for the coordinator to finish. The run
 * slot and the stop signal are published together, so a stop that arrives while a start is still
 * resolving videos is applied to that job.
 */
@Service
public class ProcessingManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Duration ACK_TIMEOUT = Duration.ofSeconds(30);

  private final CaptionerProperties properties;
  private final MediaLibrary mediaLibrary;
  private final DeviceBackendPool backendPool;
  private final CaptionWriter captionWriter;
  private final ProgressAggregator aggregator;
  private final JobRepository jobRepository;
  private final KibanaUrlGenerator kibanaUrlGenerator;
  private final TaskExecutor workerExecutor;
  private final TaskExecutor coordinatorExecutor;

  private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();

  public ProcessingManager(
      CaptionerProperties properties,
      MediaLibrary mediaLibrary,
      DeviceBackendPool backendPool,
      CaptionWriter captionWriter,
      ProgressAggregator aggregator,
      JobRepository jobRepository,
      KibanaUrlGenerator kibanaUrlGenerator,
      @Qualifier("workerExecutor") TaskExecutor workerExecutor,
      @Qualifier("coordinatorExecutor") TaskExecutor coordinatorExecutor) {
    this.properties = properties;
    this.mediaLibrary = mediaLibrary;
    this.backendPool = backendPool;
    this.captionWriter = captionWriter;
    this.aggregator = aggregator;
    this.jobRepository = jobRepository;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
    this.workerExecutor = workerExecutor;
    this.coordinatorExecutor = coordinatorExecutor;
  }

  /** The run slot: the job once it is built, its stop signal and its end. */
  private static final class ActiveRun {
    volatile Job job;
    final StopSignal stopSignal = new StopSignal();
    final CountDownLatch finished = new CountDownLatch(1);
  }

  /**
   * Start a captioning job.
   *
   * @param request the videos and settings to use; null selects every video with defaults
   * @return the accepted job
   * @throws JobConflictException if a job is already running
   * @throws NoVideosException if no requested video exists
   */
  public StartResponse start(StartRequest request) {
    ActiveRun run = new ActiveRun();
    if (!activeRun.compareAndSet(null, run)) {
      throw new JobConflictException("A captioning job is already running");
    }

    boolean handedOff = false;
    try {
      List<MediaFile> videos = mediaLibrary.resolve(request == null ? null : request.videoNames());
      if (videos.isEmpty()) {
        throw new NoVideosException("No matching videos found in " + properties.workingDirectory());
      }

      GenerationSettings settings =
          request == null ? properties.defaults() : request.resolveSettings(properties.defaults());
      List<String> devices = selectDevices(settings, videos.size());

      List<CaptionTask> tasks =
          videos.stream()
              .map(video -> new CaptionTask(video.name(), video.path()))
              .collect(Collectors.toList());
      Job job = new Job(UUID.randomUUID().toString(), tasks, settings, devices);
      jobRepository.save(job);

      run.job = job;
      aggregator.submitAndAwait(ProgressEvent.jobAccepted(job), ACK_TIMEOUT);

      StructuredLogger.setJobContext(job.getJobId());
      try {
        structuredLogger.logJobAccepted(
            job.getJobId(), job.getTotal(), devices.size(), settings.modelId());
        LOGGER.debug("Videos requested: {}", job.getRequestedVideos());
      } finally {
        StructuredLogger.clearJobContext();
      }

      try {
        coordinatorExecutor.execute(() -> coordinate(run));
        handedOff = true;
      } catch (RejectedExecutionException e) {
        LOGGER.error("Coordinator rejected job {}", job.getJobId(), e);
        failUnfinishedTasks(job, "Failed to start job: " + e.getMessage());
        aggregator.submitAndAwait(
            ProgressEvent.jobFinished("Failed to start job: " + e.getMessage()), ACK_TIMEOUT);
        throw new IllegalStateException("Failed to start job " + job.getJobId(), e);
      }

      return new StartResponse(
          true, job.getTotal(), job.getJobId(), kibanaUrlGenerator.generateJobUrl(job.getJobId()));
    } finally {
      if (!handedOff) {
        activeRun.compareAndSet(run, null);
        run.finished.countDown();
      }
    }
  }

  /**
   * Stop the running job and wait for it to wind down.
   *
   * @return counts from the final snapshot
   * @throws NotProcessingException if no job is running
   */
  public StopResponse stop() {
    ActiveRun run = activeRun.get();
    if (run == null) {
      throw new NotProcessingException("No captioning job is running");
    }

    Job requested = run.job;
    LOGGER.info(
        "Stop requested for job {}", requested == null ? "being started" : requested.getJobId());
    run.stopSignal.requestStop();

    boolean finished;
    try {
      finished = run.finished.await(properties.stopTimeoutSeconds(), TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      finished = false;
    }
    Job job = run.job;
    if (job == null && finished) {
      throw new NotProcessingException("The job ended before it was accepted");
    }
    if (!finished) {
      LOGGER.warn(
          "Job {} did not finish within {}s of stop request",
          job == null ? "being started" : job.getJobId(),
          properties.stopTimeoutSeconds());
    }

    ProgressSnapshot snapshot = aggregator.current();
    return new StopResponse(
        snapshot.completedVideos(),
        snapshot.remainingVideos(),
        finished && snapshot.isTerminal());
  }

  public ProgressSnapshot status() {
    return aggregator.current();
  }

  public Optional<Job> findJob(String jobId) {
    return jobRepository.findById(jobId);
  }

  public boolean isProcessing() {
    return activeRun.get() != null;
  }

  public ModelStatus modelStatus() {
    return backendPool.status();
  }

  /**
   * Load the default model on every configured device so the next job starts without waiting.
   *
   * @throws JobConflictException if a job is running
   * @throws com.scholary.captioner.generation.ModelLoadException if a device fails to load
   */
  public ModelStatus loadModels() {
    if (isProcessing()) {
      throw new JobConflictException("Cannot load models while a job is running");
    }
    GenerationSettings defaults = properties.defaults();
    List<String> devices = selectDevices(defaults, properties.devices().size());
    long startNanos = System.nanoTime();
    backendPool.preload(devices, defaults);
    LOGGER.info(
        "Preloaded {} on {} in {}ms",
        defaults.modelId(),
        devices,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    return backendPool.status();
  }

  /**
   * Unload every resident model.
   *
   * @throws JobConflictException if a job is running
   */
  public ModelStatus unloadModels() {
    if (isProcessing()) {
      throw new JobConflictException("Cannot unload models while a job is running");
    }
    backendPool.unloadAll();
    return backendPool.status();
  }

  /** Use the first devices in configuration order, never more than the job has videos. */
  private List<String> selectDevices(GenerationSettings settings, int videoCount) {
    List<String> configured = properties.devices();
    int count = Math.min(settings.batchSize(), Math.min(configured.size(), videoCount));
    return List.copyOf(configured.subList(0, count));
  }

  private void coordinate(ActiveRun run) {
    Job job = run.job;
    StopSignal stopSignal = run.stopSignal;
    StructuredLogger.setJobContext(job.getJobId());
    List<DeviceBackend> backends = new ArrayList<>();

    try {
      prepareBackends(job, stopSignal, backends);
      if (!stopSignal.isCancelled()) {
        runWorkers(job, stopSignal, backends);
      }
    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed unexpectedly", job.getJobId(), e);
      stopSignal.fail("Unexpected error: " + e.getMessage());
    } finally {
      boolean failed = stopSignal.fatalError() != null;
      for (DeviceBackend backend : backends) {
        if (failed) {
          backendPool.discard(backend);
        } else {
          backendPool.release(backend);
        }
      }
      finish(run);
      StructuredLogger.clearJobContext();
    }
  }

  private void prepareBackends(Job job, StopSignal stopSignal, List<DeviceBackend> prepared) {
    List<String> devices = job.getDevices();
    for (int i = 0; i < devices.size(); i++) {
      if (stopSignal.isCancelled()) {
        LOGGER.info("Stop requested while loading models");
        return;
      }

      String device = devices.get(i);
      long startNanos = System.nanoTime();
      DeviceBackend backend;
      try {
        backend = backendPool.acquire(device, job.getSettings());
      } catch (RuntimeException e) {
        LOGGER.error("Failed to prepare {}", device, e);
        stopSignal.fail("Failed to load model on " + device + ": " + e.getMessage());
        return;
      }
      prepared.add(backend);

      structuredLogger.logModelLoaded(
          device,
          job.getSettings().modelId(),
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      aggregator.submit(ProgressEvent.modelReady((double) (i + 1) / devices.size()));
    }
  }

  private void runWorkers(Job job, StopSignal stopSignal, List<DeviceBackend> backends) {
    WorkQueue queue = new WorkQueue();
    queue.enqueue(job.getTasks());

    Map<Integer, String> workerDevices = new LinkedHashMap<>();
    for (int i = 0; i < backends.size(); i++) {
      workerDevices.put(i, backends.get(i).device());
    }
    aggregator.submit(ProgressEvent.processingStarted(workerDevices));

    List<CompletableFuture<Void>> workers = new ArrayList<>();
    for (int i = 0; i < backends.size(); i++) {
      Worker worker =
          new Worker(
              job.getJobId(),
              i,
              backends.get(i),
              queue,
              job.getSettings(),
              captionWriter,
              stopSignal,
              aggregator);
      try {
        workers.add(CompletableFuture.runAsync(worker, workerExecutor));
      } catch (RejectedExecutionException e) {
        LOGGER.error("Worker pool rejected worker {}", i, e);
        stopSignal.fail("Worker pool rejected worker " + i + ": " + e.getMessage());
        aggregator.workerExited(i);
        break;
      }
    }

    try {
      CompletableFuture.allOf(workers.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      LOGGER.error("Worker terminated abnormally", e.getCause());
      stopSignal.fail("Worker terminated abnormally: " + e.getCause());
    }

    List<CaptionTask> unstarted = queue.drainRemaining();
    if (!unstarted.isEmpty()) {
      LOGGER.info("{} videos were not started", unstarted.size());
    }
  }

  private void finish(ActiveRun run) {
    Job job = run.job;
    String fatalError = run.stopSignal.fatalError();
    if (fatalError != null) {
      failUnfinishedTasks(job, fatalError);
    }

    try {
      aggregator.submitAndAwait(ProgressEvent.jobFinished(fatalError), ACK_TIMEOUT);
    } catch (IllegalStateException e) {
      LOGGER.error("Failed to record end of job {}", job.getJobId(), e);
    }
    jobRepository.save(job);

    activeRun.compareAndSet(run, null);
    run.finished.countDown();
  }

  private static void failUnfinishedTasks(Job job, String reason) {
    for (CaptionTask task : job.getTasks()) {
      if (!task.getStatus().isFinished()) {
        task.markFailed(reason, task.getElapsed());
      }
    }
  }
}
