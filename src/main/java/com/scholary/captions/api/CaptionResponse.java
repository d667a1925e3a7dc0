package com.scholary.captions.api;

import com.scholary.captions.transcript.Segment;
import java.util.List;

/**
 * Result of a completed caption job.
 *
 * <p>Contains the final segments, where the output files were written, diagnostics, and storage
 * locations if the outputs were published.
 */
public record CaptionResponse(
    List<Segment> segments,
    String format,
    String captionPath,
    String transcriptPath,
    String videoPath,
    Diagnostics diagnostics,
    StorageInfo storageInfo) {

  /**
   * How the transcript was produced.
   *
   * @param windows number of windows transcribed
   * @param fallbackWindows windows covered by placeholders because inference failed
   * @param cachedWindows windows served from the window cache
   * @param gapSegments segments synthesized for gaps
   * @param optimizerApplied whether the timing optimizer's result was accepted
   * @param durationSeconds length of the decoded audio track
   */
  public record Diagnostics(
      int windows,
      int fallbackWindows,
      int cachedWindows,
      int gapSegments,
      boolean optimizerApplied,
      double durationSeconds) {}

  public record StorageInfo(
      String bucket,
      String captionKey,
      String transcriptKey,
      String captionUrl,
      String transcriptUrl) {}
}
