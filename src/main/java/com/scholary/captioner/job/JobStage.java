package com.scholary.captioner.job;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle stage of a captioning job. Only the progress aggregator moves a job between stages. */
public enum JobStage {
  IDLE("idle"),
  LOADING_MODEL("loading_model"),
  PROCESSING("processing"),
  COMPLETE("complete"),
  ERROR("error"),
  STOPPED("stopped");

  private final String wireName;

  JobStage(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** True for stages that hold the run slot. */
  public boolean isActive() {
    return this == LOADING_MODEL || this == PROCESSING;
  }

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR || this == STOPPED;
  }
}
