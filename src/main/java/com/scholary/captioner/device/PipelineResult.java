package com.scholary.captioner.device;

/** Caption produced by one pass of a device pipeline. */
public record PipelineResult(
    String text, int outputTokens, double tokensPerSec, int framesProcessed) {}
