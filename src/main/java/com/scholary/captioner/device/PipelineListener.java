package com.scholary.captioner.device;

import com.scholary.captioner.job.WorkerSubstage;

/**
 * Receives progress from a running device pipeline.
 *
 * <p>Implementations may throw {@link TaskCancelledException} to abandon the task at that point.
 */
@FunctionalInterface
public interface PipelineListener {

  void onProgress(WorkerSubstage substage, double progress);
}
