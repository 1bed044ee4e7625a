package com.scholary.captioner.progress;

import com.scholary.captioner.job.WorkerSubstage;

/** Mutable per-worker state. Only touched by the aggregator thread. */
class WorkerState {

  private final int workerId;
  private final String device;

  private String currentVideo;
  private WorkerSubstage substage = WorkerSubstage.IDLE;
  private double substageProgress;
  private int inFlightTokens;

  WorkerState(int workerId, String device) {
    this.workerId = workerId;
    this.device = device;
  }

  void startTask(String videoName) {
    currentVideo = videoName;
    substage = WorkerSubstage.EXTRACTING_FRAMES;
    substageProgress = 0.0;
    inFlightTokens = 0;
  }

  void update(WorkerSubstage newSubstage, double progress, int maxTokens) {
    if (currentVideo == null) {
      return;
    }
    substage = newSubstage;
    substageProgress = Math.max(0.0, Math.min(1.0, progress));
    boolean generating = newSubstage == WorkerSubstage.GENERATING;
    inFlightTokens = generating ? (int) Math.round(substageProgress * maxTokens) : 0;
  }

  void idle() {
    currentVideo = null;
    substage = WorkerSubstage.IDLE;
    substageProgress = 0.0;
    inFlightTokens = 0;
  }

  double taskFraction() {
    return currentVideo == null ? 0.0 : substage.taskFraction(substageProgress);
  }

  int inFlightTokens() {
    return inFlightTokens;
  }

  WorkerProgress toProgress() {
    return new WorkerProgress(workerId, device, currentVideo, substage, substageProgress);
  }
}
