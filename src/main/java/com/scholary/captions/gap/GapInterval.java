package com.scholary.captions.gap;

/** A span inside one window that no draft segment covers. Times are absolute seconds. */
public record GapInterval(double startSec, double endSec) {

  public GapInterval {
    if (endSec < startSec) {
      throw new IllegalArgumentException("Gap end must be >= start");
    }
  }

  public double duration() {
    return endSec - startSec;
  }
}
