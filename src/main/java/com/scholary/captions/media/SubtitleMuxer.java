package com.scholary.captions.media;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds an SRT caption file into a video as a soft-subtitle stream.
 *
 * <p>Audio and video streams are copied without re-encoding; the captions become a {@code
 * mov_text} stream tagged {@code language=eng}, which players show as a toggleable track.
 */
@Component
public class SubtitleMuxer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleMuxer.class);

  private final MediaProperties properties;

  public SubtitleMuxer(MediaProperties properties) {
    this.properties = properties;
  }

  /**
   * Mux captions into a copy of the video.
   *
   * @param video the source video
   * @param srt the SubRip caption file
   * @param output where to write the captioned video (overwritten if present)
   * @return {@code output}
   * @throws MediaProcessingException if ffmpeg fails
   */
  public Path mux(Path video, Path srt, Path output) {
    List<String> command = buildCommand(video, srt, output);
    LOGGER.info(
        "Embedding captions: video={}, captions={}", video.getFileName(), srt.getFileName());

    Path logFile = output.resolveSibling("ffmpeg_mux.log");
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    try {
      Process process = pb.start();
      int exitCode = process.waitFor();
      if (exitCode != 0 || !Files.isRegularFile(output)) {
        throw new MediaProcessingException(
            String.format(
                "ffmpeg subtitle muxing failed with exit code %d: %s",
                exitCode, readLog(logFile)));
      }
    } catch (IOException e) {
      throw new MediaProcessingException("Failed to run ffmpeg for " + video, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaProcessingException("Subtitle muxing interrupted", e);
    }

    LOGGER.info("Captioned video written: {}", output);
    return output;
  }

  List<String> buildCommand(Path video, Path srt, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-i", video.toString(),
        "-i", srt.toString(),
        "-map", "0:v?",
        "-map", "0:a?",
        "-map", "1:0",
        "-c:v", "copy",
        "-c:a", "copy",
        "-c:s", "mov_text",
        "-metadata:s:s:0", "language=eng",
        "-y",
        output.toString());
  }

  private static String readLog(Path logFile) {
    try {
      String log = Files.readString(logFile, StandardCharsets.UTF_8).trim();
      return log.length() > 4000 ? log.substring(log.length() - 4000) : log;
    } catch (IOException e) {
      LOGGER.debug("Could not read ffmpeg log {}", logFile, e);
      return "<no log>";
    }
  }
}
