package com.scholary.captions.api;

/**
 * Response for an accepted caption request.
 *
 * <p>Returns a job ID that can be used to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
