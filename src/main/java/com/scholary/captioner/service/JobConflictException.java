package com.scholary.captioner.service;

/** Exception thrown when a job is started while another one is still running. */
public class JobConflictException extends RuntimeException {

  public JobConflictException(String message) {
    super(message);
  }
}
