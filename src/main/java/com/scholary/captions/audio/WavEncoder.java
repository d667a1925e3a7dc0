package com.scholary.captions.audio;

import com.scholary.captions.media.MediaProcessingException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

/** Writes signed 16-bit little-endian mono PCM as a WAV payload. */
final class WavEncoder {

  private WavEncoder() {}

  static byte[] encode(short[] samples, int from, int to, int sampleRate) {
    int count = to - from;
    byte[] pcm = new byte[count * 2];
    for (int i = 0; i < count; i++) {
      short sample = samples[from + i];
      pcm[2 * i] = (byte) (sample & 0xff);
      pcm[2 * i + 1] = (byte) ((sample >> 8) & 0xff);
    }

    AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
    try (AudioInputStream stream =
            new AudioInputStream(new ByteArrayInputStream(pcm), format, count);
        ByteArrayOutputStream out = new ByteArrayOutputStream(pcm.length + 44)) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new MediaProcessingException("Failed to encode WAV payload", e);
    }
  }
}
