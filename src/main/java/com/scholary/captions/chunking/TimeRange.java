package com.scholary.captions.chunking;

/**
 * Represents a half-open time range {@code [start, end)} in seconds.
 *
 * <p>Used for window boundaries. All times are absolute to the track origin.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Pull a time point into this range. NaN maps to the range start.
   *
   * @param time the time to clamp
   * @return the nearest time within [start, end]
   */
  public double clamp(double time) {
    if (Double.isNaN(time)) {
      return start;
    }
    return Math.max(start, Math.min(time, end));
  }
}
