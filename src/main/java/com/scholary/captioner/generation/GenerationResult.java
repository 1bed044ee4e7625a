package com.scholary.captioner.generation;

/** Caption text and token statistics returned by the model. */
public record GenerationResult(String text, int outputTokens, double tokensPerSec) {}
