package com.scholary.captioner.job;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared pool of pending tasks for one job.
 *
 * <p>Workers pull dynamically instead of being handed a fixed partition, so a fast device simply
 * takes more videos. Assignment is FIFO in request order; completion order is whatever the devices
 * produce.
 *
 * <p>{@link #pull(int)} is an atomic pop: a task leaves the queue exactly once, so no two workers
 * can ever hold the same task.
 */
public class WorkQueue {

  private final ConcurrentLinkedQueue<CaptionTask> pending = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean populated = new AtomicBoolean(false);

  /**
   * Load the job's tasks. Allowed once per queue.
   *
   * @throws IllegalStateException if the queue was already populated
   */
  public void enqueue(List<CaptionTask> tasks) {
    if (!populated.compareAndSet(false, true)) {
      throw new IllegalStateException("Work queue already populated");
    }
    for (CaptionTask task : tasks) {
      if (task.getStatus() != TaskStatus.QUEUED) {
        throw new IllegalArgumentException(
            "Task " + task.getVideoName() + " is not queued: " + task.getStatus());
      }
      pending.add(task);
    }
  }

  /**
   * Take the next queued task and assign it to a worker.
   *
   * @param workerId the worker taking the task
   * @return the task, or empty when nothing is left
   */
  public Optional<CaptionTask> pull(int workerId) {
    CaptionTask task = pending.poll();
    if (task == null) {
      return Optional.empty();
    }
    task.assignTo(workerId);
    return Optional.of(task);
  }

  public int size() {
    return pending.size();
  }

  public boolean isEmpty() {
    return pending.isEmpty();
  }

  /** Tasks that were never pulled, in request order. The queue is empty afterwards. */
  public List<CaptionTask> drainRemaining() {
    List<CaptionTask> remaining = new ArrayList<>();
    CaptionTask task;
    while ((task = pending.poll()) != null) {
      remaining.add(task);
    }
    return remaining;
  }
}
