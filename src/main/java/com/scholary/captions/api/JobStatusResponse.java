package com.scholary.captions.api;

import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    CaptionResponse result,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
  }
}
