package com.scholary.captioner.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline step a worker is in while processing a task.
 *
 * <p>Each substage covers a fixed slice of one task's progress, used to turn {@code
 * substage_progress} into a fraction of the whole task.
 */
public enum WorkerSubstage {
  IDLE("idle", 0.0, 0.0),
  EXTRACTING_FRAMES("extracting_frames", 0.0, 0.3),
  ENCODING("encoding", 0.3, 0.4),
  GENERATING("generating", 0.4, 1.0);

  private final String wireName;
  private final double start;
  private final double end;

  WorkerSubstage(String wireName, double start, double end) {
    this.wireName = wireName;
    this.start = start;
    this.end = end;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Fraction of the whole task done when this substage is {@code progress} complete. */
  public double taskFraction(double progress) {
    if (this == IDLE) {
      return 0.0;
    }
    double clamped = Math.max(0.0, Math.min(1.0, progress));
    return start + (end - start) * clamped;
  }

  /** The task status matching this substage. */
  public TaskStatus taskStatus() {
    switch (this) {
      case EXTRACTING_FRAMES:
        return TaskStatus.EXTRACTING;
      case ENCODING:
        return TaskStatus.ENCODING;
      case GENERATING:
        return TaskStatus.GENERATING;
      default:
        return TaskStatus.ASSIGNED;
    }
  }
}
