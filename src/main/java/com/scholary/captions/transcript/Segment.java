package com.scholary.captions.transcript;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A single timed caption unit with absolute times in seconds.
 *
 * <p>Construction enforces {@code 0 <= startSec < endSec} and non-blank text, so every segment
 * that reaches the formatter renders a valid cue.
 */
public record Segment(
    @JsonProperty("text") String text,
    @JsonProperty("start") double startSec,
    @JsonProperty("end") double endSec,
    @JsonProperty("type") SegmentKind kind) {

  public Segment {
    Objects.requireNonNull(kind, "kind");
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Segment text cannot be blank");
    }
    if (!Double.isFinite(startSec) || !Double.isFinite(endSec)) {
      throw new IllegalArgumentException("Segment times must be finite");
    }
    if (startSec < 0) {
      throw new IllegalArgumentException("Segment start cannot be negative: " + startSec);
    }
    if (endSec <= startSec) {
      throw new IllegalArgumentException(
          String.format("Segment end must be after start: [%s, %s)", startSec, endSec));
    }
  }

  public static Segment speech(String text, double startSec, double endSec) {
    return new Segment(text, startSec, endSec, SegmentKind.SPEECH);
  }

  @JsonIgnore
  public double duration() {
    return endSec - startSec;
  }
}
