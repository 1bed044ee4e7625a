package com.scholary.captioner.worker;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation flag shared by the coordinator and every worker of one job.
 *
 * <p>Set by a stop request or by a job-fatal error. Workers poll it at their checkpoints;
 * nothing is interrupted.
 */
public class StopSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final AtomicReference<String> fatalError = new AtomicReference<>();

  public void requestStop() {
    cancelled.set(true);
  }

  /** Stop the job because of an error that makes further work pointless. First reason wins. */
  public void fail(String reason) {
    fatalError.compareAndSet(null, reason);
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** The job-fatal error, or null when the job was not failed. */
  public String fatalError() {
    return fatalError.get();
  }
}
