package com.scholary.captioner.service;

/** Exception thrown when a start request selects no videos. */
public class NoVideosException extends RuntimeException {

  public NoVideosException(String message) {
    super(message);
  }
}
