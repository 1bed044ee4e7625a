package com.scholary.captioner.api;

/**
 * Response for an accepted start request.
 *
 * <p>Returns the job ID for the summary endpoint and a Kibana URL for following its logs.
 */
public record StartResponse(boolean accepted, int totalVideos, String jobId, String kibanaUrl) {}
