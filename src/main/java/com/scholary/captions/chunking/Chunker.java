package com.scholary.captions.chunking;

import com.scholary.captions.audio.AudioTrack;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Partitions an audio track into fixed-duration windows.
 *
 * <p>Window {@code i} spans {@code [i * chunk, min((i + 1) * chunk, duration))}. Both boundaries
 * are computed from the index alone, so the end of one window and the start of the next are the
 * same double value and the union is exactly {@code [0, duration)}. Only the last window can be
 * shorter than the configured duration.
 */
@Component
public class Chunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Chunker.class);

  /**
   * Split a track into windows.
   *
   * <p>The returned stream is lazy: audio views are created as windows are consumed.
   *
   * @param track the decoded track
   * @param chunkDurationSec window length in seconds, must be positive
   * @return the windows in order; empty for an empty track
   * @throws IllegalArgumentException if the duration is not a positive finite number
   */
  public Stream<Window> split(AudioTrack track, double chunkDurationSec) {
    int count = windowCount(track, chunkDurationSec);
    double total = track.durationSeconds();

    LOGGER.info(
        "Splitting track: duration={}s, chunkDuration={}s, windows={}",
        String.format("%.2f", total),
        chunkDurationSec,
        count);

    return IntStream.range(0, count)
        .mapToObj(
            i -> {
              double start = i * chunkDurationSec;
              double end = Math.min((i + 1) * chunkDurationSec, total);
              return new Window(i, start, end, track.slice(start, end));
            });
  }

  /**
   * Number of windows {@link #split} will produce.
   *
   * @throws IllegalArgumentException if the duration is not a positive finite number
   */
  public int windowCount(AudioTrack track, double chunkDurationSec) {
    if (!(chunkDurationSec > 0) || Double.isInfinite(chunkDurationSec)) {
      throw new IllegalArgumentException(
          "Chunk duration must be a positive number of seconds: " + chunkDurationSec);
    }
    double total = track.durationSeconds();
    if (total <= 0) {
      return 0;
    }
    int count = (int) Math.ceil(total / chunkDurationSec);
    // ceil can overshoot by one when the division rounds up past an exact multiple
    while (count > 1 && (count - 1) * chunkDurationSec >= total) {
      count--;
    }
    return count;
  }
}
