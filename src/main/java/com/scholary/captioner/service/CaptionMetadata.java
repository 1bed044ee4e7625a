package com.scholary.captioner.service;

/** Generation details optionally appended to a caption file. */
public record CaptionMetadata(
    String videoName,
    int workerId,
    String device,
    int framesProcessed,
    int outputTokens,
    double tokensPerSec) {}
