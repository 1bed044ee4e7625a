package com.scholary.captioner.service;

/** Exception thrown when stop is requested but no job is running. */
public class NotProcessingException extends RuntimeException {

  public NotProcessingException(String message) {
    super(message);
  }
}
