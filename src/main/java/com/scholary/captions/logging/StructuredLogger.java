package com.scholary.captions.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts an {@code event_type} plus event fields into the MDC for the duration of one
 * log statement, so a JSON or key-value appender can index them.
 */
public class StructuredLogger {

  public static final String JOB_ID = "jobId";
  public static final String SOURCE = "source";

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "window_index",
    "start",
    "end",
    "segments",
    "elapsedMs",
    "cached",
    "placeholders",
    "errorType",
    "dbfs",
    "kind",
    "classified",
    "inputSegments",
    "outputSegments",
    "applied",
    "reason",
    "windowsDone",
    "totalWindows",
    "percentComplete",
    "phase"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log window started event. */
  public void logWindowStarted(int windowIndex, double start, double end) {
    try {
      MDC.put("event_type", "window_started");
      MDC.put("window_index", String.valueOf(windowIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug("Window started: index={}, range=[{}-{}]", windowIndex, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log window finished event. */
  public void logWindowFinished(
      int windowIndex, double start, double end, int segments, long elapsedMs, boolean cached) {
    try {
      MDC.put("event_type", "window_finished");
      MDC.put("window_index", String.valueOf(windowIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("segments", String.valueOf(segments));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));
      MDC.put("cached", String.valueOf(cached));

      logger.debug(
          "Window finished: index={}, range=[{}-{}], segments={}, elapsed={}ms, cached={}",
          windowIndex,
          start,
          end,
          segments,
          elapsedMs,
          cached);
    } finally {
      clearEventFields();
    }
  }

  /** Log window fallback event: the window was covered with placeholders. */
  public void logWindowFallback(
      int windowIndex,
      double start,
      double end,
      int placeholders,
      String errorType,
      String message) {
    try {
      MDC.put("event_type", "window_fallback");
      MDC.put("window_index", String.valueOf(windowIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("placeholders", String.valueOf(placeholders));
      MDC.put("errorType", errorType);

      logger.warn(
          "Window fallback: index={}, range=[{}-{}], placeholders={}, error={}, message={}",
          windowIndex,
          start,
          end,
          placeholders,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log gap classified event. */
  public void logGapClassified(
      double start, double end, double dbfs, String kind, boolean classified) {
    try {
      MDC.put("event_type", "gap_classified");
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("dbfs", String.valueOf(dbfs));
      MDC.put("kind", kind);
      MDC.put("classified", String.valueOf(classified));

      logger.debug(
          "Gap classified: range=[{}-{}], dbfs={}, kind={}, classified={}",
          start,
          end,
          dbfs,
          kind,
          classified);
    } finally {
      clearEventFields();
    }
  }

  /** Log optimization result event. */
  public void logOptimizationResult(
      int inputSegments, int outputSegments, boolean applied, String reason) {
    try {
      MDC.put("event_type", "optimization_result");
      MDC.put("inputSegments", String.valueOf(inputSegments));
      MDC.put("outputSegments", String.valueOf(outputSegments));
      MDC.put("applied", String.valueOf(applied));
      MDC.put("reason", reason);

      logger.info(
          "Timing optimization: input={}, output={}, applied={}, reason={}",
          inputSegments,
          outputSegments,
          applied,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int windowsDone, int totalWindows, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("windowsDone", String.valueOf(windowsDone));
      MDC.put("totalWindows", String.valueOf(totalWindows));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, windows={}/{}, progress={}%",
          jobId,
          phase,
          windowsDone,
          totalWindows,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String source) {
    MDC.put(JOB_ID, jobId);
    MDC.put(SOURCE, source);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove(JOB_ID);
    MDC.remove(SOURCE);
  }

  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
