package com.scholary.captions.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic segments used when the inference service cannot provide real content.
 *
 * <p>Both the transcription path (whole window unavailable) and the gap classification path
 * (classification unavailable) build their fallbacks here, so the fallback text is the same
 * wherever it appears.
 */
public final class PlaceholderSegments {

  public static final String SILENCE_TEXT = "[Silence]";
  public static final String BACKGROUND_SOUND_TEXT = "[Sound: Background sounds]";

  private static final double EPSILON = 1e-9;

  private PlaceholderSegments() {}

  /**
   * Evenly spaced "unavailable" placeholders covering {@code [startSec, endSec)}.
   *
   * <p>Each placeholder is {@code placeholderSeconds} long except the last, which is truncated at
   * {@code endSec}. The result is contiguous and covers the whole range.
   *
   * @throws IllegalArgumentException if {@code placeholderSeconds} is not positive
   */
  public static List<Segment> unavailable(
      double startSec, double endSec, double placeholderSeconds) {
    if (!(placeholderSeconds > 0)) {
      throw new IllegalArgumentException(
          "Placeholder duration must be positive: " + placeholderSeconds);
    }
    List<Segment> placeholders = new ArrayList<>();
    for (int i = 0; ; i++) {
      double start = startSec + i * placeholderSeconds;
      if (start >= endSec - EPSILON) {
        break;
      }
      double end = Math.min(startSec + (i + 1) * placeholderSeconds, endSec);
      placeholders.add(Segment.speech(unavailableText(start, end), start, end));
    }
    return placeholders;
  }

  /** Text for an unavailable span, e.g. {@code [Transcription unavailable 5.00s - 10.00s]}. */
  public static String unavailableText(double startSec, double endSec) {
    return String.format(
        Locale.ROOT, "[Transcription unavailable %.2fs - %.2fs]", startSec, endSec);
  }

  /**
   * Heuristic description of an unclassified gap.
   *
   * @param quiet whether the gap's loudness is below the silence threshold
   */
  public static Segment gapFallback(double startSec, double endSec, boolean quiet) {
    return quiet
        ? new Segment(SILENCE_TEXT, startSec, endSec, SegmentKind.SILENCE)
        : new Segment(BACKGROUND_SOUND_TEXT, startSec, endSec, SegmentKind.SOUND);
  }
}
