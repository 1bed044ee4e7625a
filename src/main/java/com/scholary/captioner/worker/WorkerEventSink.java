package com.scholary.captioner.worker;

import com.scholary.captioner.job.WorkerSubstage;

/** Where a worker reports what it is doing. Calls may block while the receiver catches up. */
public interface WorkerEventSink {

  void taskStarted(int workerId, String videoName);

  void substageProgress(int workerId, WorkerSubstage substage, double progress);

  void taskDone(int workerId, String videoName, int outputTokens);

  void taskFailed(int workerId, String videoName, String error);

  void taskCancelled(int workerId, String videoName);

  void jobFatal(int workerId, String message);

  void workerExited(int workerId);
}
