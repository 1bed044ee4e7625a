package com.scholary.captioner.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.scholary.captioner.TestFixtures;
import com.scholary.captioner.job.CaptionTask;
import com.scholary.captioner.job.Job;
import com.scholary.captioner.job.JobStage;
import com.scholary.captioner.job.WorkerSubstage;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProgressAggregatorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private ProgressBroadcaster broadcaster;
  private ProgressAggregator aggregator;

  @BeforeEach
  void setUp() {
    broadcaster = mock(ProgressBroadcaster.class);
    aggregator = new ProgressAggregator(64, broadcaster);
    aggregator.start();
  }

  @AfterEach
  void tearDown() {
    aggregator.close();
  }

  private static Job job(String id, int videos) {
    List<CaptionTask> tasks =
        IntStream.range(0, videos)
            .mapToObj(i -> new CaptionTask("v" + i + ".mp4", Path.of("v" + i + ".mp4")))
            .collect(Collectors.toList());
    return new Job(id, tasks, TestFixtures.settings(2), List.of("cuda:0", "cuda:1"));
  }

  private ProgressSnapshot apply(ProgressEvent event) {
    return aggregator.submitAndAwait(event, TIMEOUT);
  }

  private void startProcessing(Job job) {
    apply(ProgressEvent.jobAccepted(job));
    apply(ProgressEvent.modelReady(0.5));
    apply(ProgressEvent.modelReady(1.0));
    apply(ProgressEvent.processingStarted(Map.of(0, "cuda:0", 1, "cuda:1")));
  }

  @Test
  void current_shouldBeIdleBeforeAnyJob() {
    ProgressSnapshot snapshot = aggregator.current();

    assertThat(snapshot.stage()).isEqualTo(JobStage.IDLE);
    assertThat(snapshot.jobId()).isNull();
    assertThat(snapshot.workers()).isEmpty();
  }

  @Test
  void jobAccepted_shouldEnterLoadingAndTrackLoadProgress() {
    Job job = job("job-1", 4);

    ProgressSnapshot accepted = apply(ProgressEvent.jobAccepted(job));
    ProgressSnapshot halfLoaded = apply(ProgressEvent.modelReady(0.5));

    assertThat(accepted.stage()).isEqualTo(JobStage.LOADING_MODEL);
    assertThat(accepted.totalVideos()).isEqualTo(4);
    assertThat(accepted.remainingVideos()).isEqualTo(4);
    assertThat(accepted.overallProgress()).isZero();
    assertThat(halfLoaded.modelLoadProgress()).isEqualTo(0.5);
    assertThat(job.getStage()).isEqualTo(JobStage.LOADING_MODEL);
  }

  @Test
  void processing_shouldCountFinishedVideosPlusInFlightFraction() {
    Job job = job("job-1", 4);
    startProcessing(job);

    apply(ProgressEvent.taskStarted(0, "v0.mp4"));
    ProgressSnapshot generating =
        apply(ProgressEvent.substage(0, WorkerSubstage.GENERATING, 0.5));

    assertThat(generating.stage()).isEqualTo(JobStage.PROCESSING);
    assertThat(generating.modelLoadProgress()).isEqualTo(1.0);
    // generating at 50% sits at 0.4 + 0.6 * 0.5 of the task
    assertThat(generating.overallProgress()).isCloseTo(0.7 / 4, within(1e-9));
    assertThat(generating.tokensGenerated()).isEqualTo(50);
    assertThat(generating.workers().get(0).currentVideo()).isEqualTo("v0.mp4");
    assertThat(generating.workers().get(0).substage()).isEqualTo(WorkerSubstage.GENERATING);
    assertThat(generating.workers().get(1).substage()).isEqualTo(WorkerSubstage.IDLE);

    ProgressSnapshot done = apply(ProgressEvent.taskDone(0, "v0.mp4", 80));
    assertThat(done.completedVideos()).isEqualTo(1);
    assertThat(done.overallProgress()).isCloseTo(0.25, within(1e-9));
    assertThat(done.tokensGenerated()).isEqualTo(80);
    assertThat(done.workers().get(0).currentVideo()).isNull();

    apply(ProgressEvent.taskStarted(1, "v1.mp4"));
    ProgressSnapshot failed = apply(ProgressEvent.taskFailed(1, "v1.mp4", "Cannot open video"));
    assertThat(failed.failedVideos()).isEqualTo(1);
    assertThat(failed.remainingVideos()).isEqualTo(2);
    assertThat(failed.overallProgress()).isCloseTo(0.5, within(1e-9));

    verify(broadcaster, atLeast(8)).publish(any());
  }

  @Test
  void overallProgress_shouldNotDropWhenTaskCompletes() {
    startProcessing(job("job-1", 2));
    apply(ProgressEvent.taskStarted(0, "v0.mp4"));

    ProgressSnapshot almost = apply(ProgressEvent.substage(0, WorkerSubstage.GENERATING, 1.0));
    ProgressSnapshot done = apply(ProgressEvent.taskDone(0, "v0.mp4", 100));

    assertThat(done.overallProgress()).isGreaterThanOrEqualTo(almost.overallProgress());
  }

  @Test
  void jobFinished_shouldCompleteWhenNothingRemains() {
    startProcessing(job("job-1", 2));
    apply(ProgressEvent.taskStarted(0, "v0.mp4"));
    apply(ProgressEvent.taskDone(0, "v0.mp4", 10));
    apply(ProgressEvent.taskStarted(1, "v1.mp4"));
    apply(ProgressEvent.taskFailed(1, "v1.mp4", "Cannot open video"));

    ProgressSnapshot finished = apply(ProgressEvent.jobFinished(null));

    assertThat(finished.stage()).isEqualTo(JobStage.COMPLETE);
    assertThat(finished.isTerminal()).isTrue();
    assertThat(finished.completedVideos() + finished.failedVideos())
        .isEqualTo(finished.totalVideos());
    assertThat(finished.overallProgress()).isEqualTo(1.0);
  }

  @Test
  void jobFinished_shouldStopWhenVideosRemain() {
    Job job = job("job-1", 4);
    startProcessing(job);
    apply(ProgressEvent.taskStarted(0, "v0.mp4"));
    apply(ProgressEvent.taskDone(0, "v0.mp4", 10));
    apply(ProgressEvent.taskStarted(1, "v1.mp4"));
    apply(ProgressEvent.taskCancelled(1, "v1.mp4"));

    ProgressSnapshot finished = apply(ProgressEvent.jobFinished(null));

    assertThat(finished.stage()).isEqualTo(JobStage.STOPPED);
    assertThat(finished.completedVideos()).isEqualTo(1);
    assertThat(finished.remainingVideos()).isEqualTo(3);
    assertThat(finished.workers()).allSatisfy(w -> assertThat(w.currentVideo()).isNull());
    assertThat(job.getStage()).isEqualTo(JobStage.STOPPED);
    assertThat(job.getFinishedAt()).isNotNull();
  }

  @Test
  void jobFinished_shouldFailUnfinishedVideosOnFatalError() {
    Job job = job("job-1", 5);
    startProcessing(job);
    apply(ProgressEvent.taskStarted(0, "v0.mp4"));
    apply(ProgressEvent.taskDone(0, "v0.mp4", 10));
    apply(ProgressEvent.jobFatal(1, "Model server unreachable for cuda:1"));

    ProgressSnapshot finished =
        apply(ProgressEvent.jobFinished("Model server unreachable for cuda:1"));

    assertThat(finished.stage()).isEqualTo(JobStage.ERROR);
    assertThat(finished.completedVideos()).isEqualTo(1);
    assertThat(finished.failedVideos()).isEqualTo(4);
    assertThat(finished.remainingVideos()).isZero();
    assertThat(finished.errorMessage()).isEqualTo("Model server unreachable for cuda:1");
    assertThat(job.getErrorMessage()).isEqualTo("Model server unreachable for cuda:1");
  }

  @Test
  void jobFinished_shouldEndInErrorWhenLoadingFails() {
    apply(ProgressEvent.jobAccepted(job("job-1", 3)));

    ProgressSnapshot finished = apply(ProgressEvent.jobFinished("Failed to load model on cuda:0"));

    assertThat(finished.stage()).isEqualTo(JobStage.ERROR);
    assertThat(finished.failedVideos()).isEqualTo(3);
    assertThat(finished.tokensPerSec()).isZero();
  }

  @Test
  void events_shouldBeIgnoredAfterJobIsTerminal() {
    startProcessing(job("job-1", 3));
    apply(ProgressEvent.jobFinished(null));

    ProgressSnapshot late = apply(ProgressEvent.taskDone(0, "v0.mp4", 10));

    assertThat(late.stage()).isEqualTo(JobStage.STOPPED);
    assertThat(late.completedVideos()).isZero();
    assertThat(late.tokensGenerated()).isZero();
  }

  @Test
  void jobAccepted_shouldRejectSecondJobWhileActive() {
    apply(ProgressEvent.jobAccepted(job("job-1", 1)));

    assertThatThrownBy(() -> apply(ProgressEvent.jobAccepted(job("job-2", 1))))
        .isInstanceOf(IllegalStateException.class);
    assertThat(aggregator.current().jobId()).isEqualTo("job-1");
  }

  @Test
  void jobAccepted_shouldResetStateAfterPreviousJobEnded() {
    startProcessing(job("job-1", 1));
    apply(ProgressEvent.taskStarted(0, "v0.mp4"));
    apply(ProgressEvent.taskDone(0, "v0.mp4", 10));
    apply(ProgressEvent.jobFinished(null));

    ProgressSnapshot next = apply(ProgressEvent.jobAccepted(job("job-2", 2)));

    assertThat(next.jobId()).isEqualTo("job-2");
    assertThat(next.stage()).isEqualTo(JobStage.LOADING_MODEL);
    assertThat(next.completedVideos()).isZero();
    assertThat(next.tokensGenerated()).isZero();
    assertThat(next.workers()).isEmpty();
  }
}
