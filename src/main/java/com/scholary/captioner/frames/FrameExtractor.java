package com.scholary.captioner.frames;

import java.nio.file.Path;

/**
 * Interface for frame extraction.
 *
 * <p>This abstraction keeps the decoder (ffmpeg today) out of the device pipeline.
 */
public interface FrameExtractor {

  /**
   * Decode up to {@code maxFrames} frames sampled uniformly across the video.
   *
   * @param video the media file
   * @param maxFrames the maximum number of frames to return
   * @param frameSize the longest edge of each frame, in pixels
   * @param listener notified after every decoded frame; may throw to abort extraction
   * @return the decoded frames, which the caller must close
   * @throws DecodeException if the file cannot be decoded
   */
  ExtractedFrames extractFrames(
      Path video, int maxFrames, int frameSize, FrameProgressListener listener);

  /** Callback for per-frame extraction progress. */
  @FunctionalInterface
  interface FrameProgressListener {
    void onFrame(int extracted, int total);
  }
}
