package com.scholary.captioner.generation;

/** Exception thrown when a model cannot be loaded onto a device. */
public class ModelLoadException extends RuntimeException {

  public ModelLoadException(String message) {
    super(message);
  }

  public ModelLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
