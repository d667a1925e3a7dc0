package com.scholary.captions.service;

import com.scholary.captions.audio.AudioTrack;
import com.scholary.captions.cache.WindowCache;
import com.scholary.captions.chunking.Chunker;
import com.scholary.captions.chunking.Window;
import com.scholary.captions.gap.GapAnalyzer;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.transcribe.TranscriptionClient;
import com.scholary.captions.transcribe.WindowTranscription;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TimelineAssembler;
import com.scholary.captions.transcript.TimingOptimizer;
import com.scholary.captions.transcript.Transcript;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs the segmented transcript pipeline over one audio track.
 *
 * <p>Windows are independent: each is transcribed and gap-filled on the window executor. Once every
 * window has finished, the per-window results are assembled into one ordered transcript and the
 * timing optimizer runs once over the whole.
 *
 * <p>If the calling thread is interrupted while waiting for windows, every window future is
 * cancelled, which interrupts windows already running, and a {@link CancellationException} is
 * thrown; no partial transcript is returned.
 */
@Service
public class CaptionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionPipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Chunker chunker;
  private final TranscriptionClient transcriptionClient;
  private final GapAnalyzer gapAnalyzer;
  private final TimelineAssembler timelineAssembler;
  private final TimingOptimizer timingOptimizer;
  private final WindowCache windowCache;
  private final AsyncTaskExecutor windowExecutor;

  public CaptionPipeline(
      Chunker chunker,
      TranscriptionClient transcriptionClient,
      GapAnalyzer gapAnalyzer,
      TimelineAssembler timelineAssembler,
      TimingOptimizer timingOptimizer,
      WindowCache windowCache,
      @Qualifier("windowExecutor") AsyncTaskExecutor windowExecutor) {
    this.chunker = chunker;
    this.transcriptionClient = transcriptionClient;
    this.gapAnalyzer = gapAnalyzer;
    this.timelineAssembler = timelineAssembler;
    this.timingOptimizer = timingOptimizer;
    this.windowCache = windowCache;
    this.windowExecutor = windowExecutor;
  }

  /**
   * Produce the transcript for a track.
   *
   * @param track the decoded audio
   * @param chunkDurationSec window length in seconds
   * @param context per-job state
   * @param progress notified as windows complete
   * @return the optimized transcript and diagnostics
   * @throws IllegalArgumentException if the window length is not positive
   * @throws CancellationException if the calling thread is interrupted
   */
  public PipelineResult run(
      AudioTrack track, double chunkDurationSec, JobContext context, ProgressListener progress) {
    List<Window> windows = chunker.split(track, chunkDurationSec).toList();
    int total = windows.size();
    AtomicInteger done = new AtomicInteger();

    List<Future<WindowOutcome>> futures = new ArrayList<>(total);
    for (Window window : windows) {
      futures.add(
          windowExecutor.submit(
              () -> {
                try {
                  return processWindow(window, context);
                } finally {
                  progress.windowsCompleted(done.incrementAndGet(), total);
                }
              }));
    }

    List<WindowOutcome> outcomes = awaitAll(futures);

    List<List<Segment>> perWindow = new ArrayList<>(total);
    int fallbackWindows = 0;
    int cachedWindows = 0;
    int gapSegments = 0;
    for (WindowOutcome outcome : outcomes) {
      perWindow.add(outcome.segments());
      fallbackWindows += outcome.fallback() ? 1 : 0;
      cachedWindows += outcome.cached() ? 1 : 0;
      gapSegments += outcome.gapSegments();
    }

    Transcript assembled = timelineAssembler.assemble(perWindow);
    Transcript optimized = timingOptimizer.optimize(assembled);

    LOGGER.info(
        "Pipeline complete: windows={}, fallbackWindows={}, cachedWindows={}, gapSegments={},"
            + " segments={}",
        total,
        fallbackWindows,
        cachedWindows,
        gapSegments,
        optimized.size());

    return new PipelineResult(
        optimized,
        total,
        fallbackWindows,
        cachedWindows,
        gapSegments,
        optimized != assembled);
  }

  private WindowOutcome processWindow(Window window, JobContext context) {
    long startTime = System.currentTimeMillis();
    STRUCTURED_LOGGER.logWindowStarted(window.index(), window.startSec(), window.endSec());

    String cacheKey =
        context.sourceFingerprint() == null
            ? null
            : WindowCache.generateKey(
                context.sourceFingerprint(), window.index(), window.startSec(), window.endSec());
    Optional<List<Segment>> cached =
        cacheKey == null ? Optional.empty() : windowCache.get(cacheKey);

    WindowTranscription drafts;
    if (cached.isPresent()) {
      drafts = new WindowTranscription(cached.get(), false);
    } else {
      drafts = transcriptionClient.transcribe(window, context.artifacts());
      if (drafts.fallback()) {
        STRUCTURED_LOGGER.logWindowFallback(
            window.index(),
            window.startSec(),
            window.endSec(),
            drafts.segments().size(),
            "InferenceException",
            "window covered with placeholders");
      } else if (cacheKey != null) {
        windowCache.put(cacheKey, drafts.segments());
      }
    }

    List<Segment> filled = gapAnalyzer.fillGaps(window, drafts.segments(), context.artifacts());
    int gapSegments = filled.size() - drafts.segments().size();

    STRUCTURED_LOGGER.logWindowFinished(
        window.index(),
        window.startSec(),
        window.endSec(),
        filled.size(),
        System.currentTimeMillis() - startTime,
        cached.isPresent());
    return new WindowOutcome(filled, drafts.fallback(), cached.isPresent(), gapSegments);
  }

  private static List<WindowOutcome> awaitAll(List<Future<WindowOutcome>> futures) {
    List<WindowOutcome> outcomes = new ArrayList<>(futures.size());
    try {
      for (Future<WindowOutcome> future : futures) {
        outcomes.add(future.get());
      }
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new CancellationException("Caption pipeline interrupted");
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Window processing failed", cause);
    } catch (CancellationException e) {
      futures.forEach(f -> f.cancel(true));
      throw e;
    }
    return outcomes;
  }

  private record WindowOutcome(
      List<Segment> segments, boolean fallback, boolean cached, int gapSegments) {}
}
