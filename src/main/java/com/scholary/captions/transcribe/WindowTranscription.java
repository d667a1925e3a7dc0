package com.scholary.captions.transcribe;

import com.scholary.captions.transcript.Segment;
import java.util.List;

/**
 * Draft segments produced for one window.
 *
 * @param segments drafts with absolute times, clamped to the window
 * @param fallback true when the inference call failed and the segments are placeholders
 */
public record WindowTranscription(List<Segment> segments, boolean fallback) {

  public WindowTranscription {
    segments = List.copyOf(segments);
  }
}
