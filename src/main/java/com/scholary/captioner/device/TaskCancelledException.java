package com.scholary.captioner.device;

/** Thrown at a pipeline checkpoint when the job has been asked to stop. */
public class TaskCancelledException extends RuntimeException {

  public TaskCancelledException(String videoName) {
    super("Task cancelled: " + videoName);
  }
}
