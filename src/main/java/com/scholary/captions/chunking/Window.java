package com.scholary.captions.chunking;

import com.scholary.captions.audio.AudioBuffer;

/**
 * A fixed-duration slice of the audio track submitted as one inference request.
 *
 * <p>Windows produced by one split are contiguous: window {@code i} ends exactly where window
 * {@code i + 1} starts.
 */
public record Window(int index, double startSec, double endSec, AudioBuffer samples) {

  public double duration() {
    return endSec - startSec;
  }

  public TimeRange range() {
    return new TimeRange(startSec, endSec);
  }
}
