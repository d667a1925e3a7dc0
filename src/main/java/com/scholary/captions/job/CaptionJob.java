package com.scholary.captions.job;

import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.api.JobStatusResponse.Status;
import java.time.Instant;

/**
 * Represents an async caption job.
 *
 * <p>Tracks the job's state, progress, and result. Once a job is COMPLETED, FAILED or CANCELLED
 * its state no longer changes; late transitions are ignored and reported as {@code false}.
 */
public class CaptionJob {

  private final String jobId;
  private final CaptionRequest request;
  private final Instant createdAt;

  private Status status;
  private int progress; // 0-100
  private CaptionResponse result;
  private String error;
  private Instant updatedAt;

  public CaptionJob(String jobId, CaptionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.updatedAt = createdAt;
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public CaptionRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized Instant getUpdatedAt() {
    return updatedAt;
  }

  public synchronized Status getStatus() {
    return status;
  }

  public synchronized int getProgress() {
    return progress;
  }

  public synchronized CaptionResponse getResult() {
    return result;
  }

  public synchronized String getError() {
    return error;
  }

  public synchronized boolean isTerminal() {
    return status == Status.COMPLETED || status == Status.FAILED || status == Status.CANCELLED;
  }

  public synchronized boolean markProcessing() {
    if (status != Status.PENDING) {
      return false;
    }
    status = Status.PROCESSING;
    touch();
    return true;
  }

  /** Progress only moves forward and never reaches 100 before completion. */
  public synchronized void updateProgress(int percent) {
    if (isTerminal()) {
      return;
    }
    int bounded = Math.max(0, Math.min(99, percent));
    if (bounded > progress) {
      progress = bounded;
      touch();
    }
  }

  public synchronized boolean complete(CaptionResponse response) {
    if (isTerminal()) {
      return false;
    }
    status = Status.COMPLETED;
    progress = 100;
    result = response;
    touch();
    return true;
  }

  public synchronized boolean fail(String message) {
    if (isTerminal()) {
      return false;
    }
    status = Status.FAILED;
    error = message;
    touch();
    return true;
  }

  public synchronized boolean cancel() {
    if (isTerminal()) {
      return false;
    }
    status = Status.CANCELLED;
    error = "Cancelled";
    touch();
    return true;
  }

  private void touch() {
    updatedAt = Instant.now();
  }
}
