package com.scholary.captions.transcript;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges per-window segment lists into one ordered transcript.
 *
 * <p>Windows never overlap, so merging is concatenation followed by a stable sort on start time.
 * Segments are never merged or trimmed here. Overlapping segments and uncovered spans are logged
 * and left in place for the timing optimizer.
 */
@Component
public class TimelineAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineAssembler.class);

  private static final double EPSILON = 1e-6;

  /**
   * Assemble window results into a transcript.
   *
   * @param perWindow segment lists in any order; each list may itself be unordered
   * @return all segments, sorted by start time
   */
  public Transcript assemble(List<List<Segment>> perWindow) {
    if (perWindow.isEmpty()) {
      return Transcript.empty();
    }

    List<Segment> all = new ArrayList<>();
    for (List<Segment> segments : perWindow) {
      all.addAll(segments);
    }
    Transcript transcript = Transcript.sorted(all);

    logTimelineIssues(transcript);
    LOGGER.info(
        "Assembled transcript: {} segments from {} windows", transcript.size(), perWindow.size());
    return transcript;
  }

  private void logTimelineIssues(Transcript transcript) {
    List<Segment> segments = transcript.segments();
    int overlaps = 0;
    int holes = 0;
    double coveredUntil = 0.0;

    for (Segment segment : segments) {
      if (segment.startSec() < coveredUntil - EPSILON) {
        overlaps++;
        LOGGER.debug(
            "Overlap: segment at {}s starts before previous coverage ends at {}s",
            segment.startSec(),
            coveredUntil);
      } else if (segment.startSec() > coveredUntil + EPSILON) {
        holes++;
        LOGGER.debug("Hole: [{}s - {}s) not covered", coveredUntil, segment.startSec());
      }
      coveredUntil = Math.max(coveredUntil, segment.endSec());
    }

    if (overlaps > 0 || holes > 0) {
      LOGGER.info("Timeline has {} overlaps and {} uncovered spans", overlaps, holes);
    }
  }
}
