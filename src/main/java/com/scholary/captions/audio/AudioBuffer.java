package com.scholary.captions.audio;

/**
 * Read-only view over a contiguous sample range of an {@link AudioTrack}.
 *
 * <p>Offsets passed to {@link #slice(double, double)} are relative to the start of this buffer.
 */
public final class AudioBuffer {

  private static final double FULL_SCALE = 32768.0;

  private final short[] samples;
  private final int from;
  private final int to;
  private final int sampleRate;

  AudioBuffer(short[] samples, int from, int to, int sampleRate) {
    this.samples = samples;
    this.from = from;
    this.to = to;
    this.sampleRate = sampleRate;
  }

  public int sampleRate() {
    return sampleRate;
  }

  public int sampleCount() {
    return to - from;
  }

  public double durationSeconds() {
    return (double) sampleCount() / sampleRate;
  }

  /**
   * Narrow this view to {@code [startOffsetSec, endOffsetSec)} relative to its own start.
   *
   * @param startOffsetSec start offset in seconds, clamped to the buffer
   * @param endOffsetSec end offset in seconds, clamped to the buffer
   * @return the narrower view (possibly empty)
   */
  public AudioBuffer slice(double startOffsetSec, double endOffsetSec) {
    int start = clamp(from + (int) Math.round(startOffsetSec * sampleRate));
    int end = clamp(from + (int) Math.round(endOffsetSec * sampleRate));
    return new AudioBuffer(samples, start, Math.max(start, end), sampleRate);
  }

  /**
   * Loudness in dBFS: RMS amplitude relative to 16-bit full scale.
   *
   * @return dBFS, or negative infinity for an empty or all-zero buffer
   */
  public double dbfs() {
    if (sampleCount() == 0) {
      return Double.NEGATIVE_INFINITY;
    }
    double sumOfSquares = 0.0;
    for (int i = from; i < to; i++) {
      double sample = samples[i];
      sumOfSquares += sample * sample;
    }
    double rms = Math.sqrt(sumOfSquares / sampleCount());
    if (rms == 0.0) {
      return Double.NEGATIVE_INFINITY;
    }
    return 20.0 * Math.log10(rms / FULL_SCALE);
  }

  /** Encode this view as a 16-bit mono WAV file. */
  public byte[] toWav() {
    return WavEncoder.encode(samples, from, to, sampleRate);
  }

  private int clamp(int index) {
    return Math.max(from, Math.min(to, index));
  }
}
