package com.scholary.captioner.device;

/** Thrown when resident models are needed by a running job. */
public class ModelsBusyException extends RuntimeException {

  public ModelsBusyException(String message) {
    super(message);
  }
}
