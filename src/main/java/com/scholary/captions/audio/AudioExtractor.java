package com.scholary.captions.audio;

import com.scholary.captions.media.MediaProcessingException;
import com.scholary.captions.media.MediaProperties;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes the audio stream of a media file into an {@link AudioTrack} using ffmpeg.
 *
 * <p>ffmpeg writes raw signed 16-bit little-endian mono PCM to stdout, which is redirected to a
 * file in the work directory, and stderr goes to a log file. The calling thread only waits on the
 * process, so interrupting it stops the wait and the decoder is killed.
 */
@Component
public class AudioExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioExtractor.class);

  private final MediaProperties properties;

  public AudioExtractor(MediaProperties properties) {
    this.properties = properties;
  }

  /**
   * Extract the mono audio track of a media file.
   *
   * @param mediaFile a local audio or video file
   * @param workDir directory for the decoder log
   * @return the decoded track
   * @throws MediaProcessingException if ffmpeg fails or the file has no audio
   */
  public AudioTrack extract(Path mediaFile, Path workDir) {
    LOGGER.info(
        "Extracting audio: file={}, sampleRate={}",
        mediaFile.getFileName(),
        properties.sampleRate());

    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-v", "error",
            "-i", mediaFile.toString(),
            "-vn",
            "-ac", "1",
            "-ar", String.valueOf(properties.sampleRate()),
            "-f", "s16le",
            "-acodec", "pcm_s16le",
            "pipe:1");

    Path logFile = workDir.resolve("ffmpeg_extract.log");
    Path pcmFile = workDir.resolve("audio.pcm");
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectError(logFile.toFile());
    pb.redirectOutput(pcmFile.toFile());

    byte[] pcm;
    Process process = null;
    try {
      process = pb.start();
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new MediaProcessingException(
            String.format(
                "ffmpeg audio extraction failed with exit code %d: %s",
                exitCode, readLog(logFile)));
      }
      pcm = Files.readAllBytes(pcmFile);
    } catch (IOException e) {
      throw new MediaProcessingException("Failed to run ffmpeg for " + mediaFile, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaProcessingException("Audio extraction interrupted", e);
    } finally {
      if (process != null && process.isAlive()) {
        LOGGER.info("Killing ffmpeg audio extraction: file={}", mediaFile.getFileName());
        process.destroyForcibly();
      }
      deletePcm(pcmFile);
    }

    if (pcm.length < 2) {
      throw new MediaProcessingException("No audio stream found in " + mediaFile);
    }

    short[] samples = new short[pcm.length / 2];
    ByteBuffer.wrap(pcm, 0, samples.length * 2)
        .order(ByteOrder.LITTLE_ENDIAN)
        .asShortBuffer()
        .get(samples);

    AudioTrack track = AudioTrack.wrap(samples, properties.sampleRate());
    LOGGER.info("Extracted audio: duration={}s", String.format("%.2f", track.durationSeconds()));
    return track;
  }

  private static void deletePcm(Path pcmFile) {
    try {
      Files.deleteIfExists(pcmFile);
    } catch (IOException e) {
      LOGGER.debug("Could not delete {}", pcmFile, e);
    }
  }

  private String readLog(Path logFile) {
    try {
      return Files.readString(logFile, StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      LOGGER.debug("Could not read ffmpeg log {}", logFile, e);
      return "<no log>";
    }
  }
}
