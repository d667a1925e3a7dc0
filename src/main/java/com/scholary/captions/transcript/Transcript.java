package com.scholary.captions.transcript;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable, start-ordered list of segments for a whole track.
 *
 * <p>The canonical constructor rejects unordered input; use {@link #sorted(Collection)} to build
 * one from segments in arbitrary order. Sorting is stable, so segments sharing a start time keep
 * their relative order.
 */
public record Transcript(List<Segment> segments) {

  static final Comparator<Segment> BY_START = Comparator.comparingDouble(Segment::startSec);

  public Transcript {
    segments = List.copyOf(segments);
    for (int i = 1; i < segments.size(); i++) {
      if (segments.get(i).startSec() < segments.get(i - 1).startSec()) {
        throw new IllegalArgumentException(
            "Transcript segments must be ordered by start time (index " + i + ")");
      }
    }
  }

  public static Transcript empty() {
    return new Transcript(List.of());
  }

  /** Stable-sorts the given segments by start time. */
  public static Transcript sorted(Collection<Segment> segments) {
    List<Segment> copy = new ArrayList<>(segments);
    copy.sort(BY_START);
    return new Transcript(copy);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public int size() {
    return segments.size();
  }
}
