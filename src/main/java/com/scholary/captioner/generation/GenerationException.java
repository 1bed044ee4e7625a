package com.scholary.captioner.generation;

/**
 * Exception thrown when caption generation fails for one video.
 *
 * <p>This could be a malformed request, an error reported by the model mid-stream, or a response
 * that ended before generation finished.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
