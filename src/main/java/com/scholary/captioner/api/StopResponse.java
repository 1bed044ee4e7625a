package com.scholary.captioner.api;

/**
 * Response for a stop request.
 *
 * <p>{@code stopped} is false when the job had not reached a final stage within the stop timeout;
 * the counts are then the latest known ones.
 */
public record StopResponse(int videosCompleted, int videosRemaining, boolean stopped) {}
