package com.scholary.captions.cache;

import com.scholary.captions.transcript.Segment;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cache of successful window transcriptions.
 *
 * <p>Re-running a job for the same media reuses the drafts of windows that were already
 * transcribed. Placeholder results are never stored, so a window that failed is retried.
 *
 * <p>Cache keys are based on: source fingerprint + window index + window bounds
 */
public interface WindowCache {

  /**
   * Store the draft segments of a window.
   *
   * @param cacheKey unique key for this window
   * @param segments the drafts to cache
   */
  void put(String cacheKey, List<Segment> segments);

  /**
   * Retrieve cached drafts.
   *
   * @param cacheKey unique key for this window
   * @return the cached drafts, or empty if not found
   */
  Optional<List<Segment>> get(String cacheKey);

  /**
   * Generate a cache key for a window.
   *
   * @param sourceFingerprint identifies the media (e.g. content hash)
   * @param windowIndex the window index
   * @param startSec the window start time
   * @param endSec the window end time
   * @return a unique cache key
   */
  static String generateKey(
      String sourceFingerprint, int windowIndex, double startSec, double endSec) {
    return String.format(
        Locale.ROOT, "%s:window-%d:%.3f-%.3f", sourceFingerprint, windowIndex, startSec, endSec);
  }
}
