package com.scholary.captioner.frames;

/** Duration and resolution reported by ffprobe. Still images have a duration of zero. */
public record VideoMetadata(double durationSeconds, int width, int height) {}
