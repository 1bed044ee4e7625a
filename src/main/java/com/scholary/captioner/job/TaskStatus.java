package com.scholary.captioner.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single video within a job.
 *
 * <p>CANCELLED marks the task a worker abandoned because the job was stopped. It counts as
 * remaining, not as failed.
 */
public enum TaskStatus {
  QUEUED("queued"),
  ASSIGNED("assigned"),
  EXTRACTING("extracting"),
  ENCODING("encoding"),
  GENERATING("generating"),
  DONE("done"),
  FAILED("failed"),
  CANCELLED("cancelled");

  private final String wireName;

  TaskStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isFinished() {
    return this == DONE || this == FAILED;
  }
}
