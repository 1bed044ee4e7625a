package com.scholary.captioner.frames;

/**
 * Exception thrown when frames cannot be extracted from a media file.
 *
 * <p>Covers unreadable or corrupt files, files without a video stream and ffmpeg failures. It only
 * ever fails the one video being decoded.
 */
public class DecodeException extends RuntimeException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
