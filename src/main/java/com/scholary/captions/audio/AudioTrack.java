package com.scholary.captions.audio;

/**
 * Decoded mono audio at a fixed sample rate.
 *
 * <p>Samples are signed 16-bit PCM. The track is immutable once built; windows and gap slices are
 * handed out as {@link AudioBuffer} views that share the underlying sample array read-only.
 */
public final class AudioTrack {

  private final short[] samples;
  private final int sampleRate;

  private AudioTrack(short[] samples, int sampleRate) {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive: " + sampleRate);
    }
    this.samples = samples;
    this.sampleRate = sampleRate;
  }

  /**
   * Build a track from decoded samples. The array is copied.
   *
   * @param samples signed 16-bit mono samples
   * @param sampleRate samples per second
   * @return the track
   */
  public static AudioTrack of(short[] samples, int sampleRate) {
    return new AudioTrack(samples.clone(), sampleRate);
  }

  /** Wrap samples that the caller hands over and never touches again. */
  static AudioTrack wrap(short[] samples, int sampleRate) {
    return new AudioTrack(samples, sampleRate);
  }

  public int sampleRate() {
    return sampleRate;
  }

  public int sampleCount() {
    return samples.length;
  }

  public double durationSeconds() {
    return (double) samples.length / sampleRate;
  }

  public boolean isEmpty() {
    return samples.length == 0;
  }

  /** View over the whole track. */
  public AudioBuffer buffer() {
    return new AudioBuffer(samples, 0, samples.length, sampleRate);
  }

  /**
   * View over {@code [startSec, endSec)} in absolute track time. Bounds are clamped to the track.
   */
  public AudioBuffer slice(double startSec, double endSec) {
    return buffer().slice(startSec, endSec);
  }
}
