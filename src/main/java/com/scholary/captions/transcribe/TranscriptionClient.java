package com.scholary.captions.transcribe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.chunking.TimeRange;
import com.scholary.captions.chunking.Window;
import com.scholary.captions.config.PipelineProperties;
import com.scholary.captions.diagnostics.ArtifactSink;
import com.scholary.captions.inference.InferenceException;
import com.scholary.captions.inference.InferencePurpose;
import com.scholary.captions.inference.InferenceRequest;
import com.scholary.captions.inference.InferenceService;
import com.scholary.captions.inference.JsonExtractor;
import com.scholary.captions.media.MediaProcessingException;
import com.scholary.captions.transcript.PlaceholderSegments;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.SegmentKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one audio window into draft caption segments.
 *
 * <p>The window is sent as WAV together with an instruction asking for a JSON array of timed
 * segments. Replies are parsed leniently (missing fields get defaults, out-of-window times are
 * clamped). Any failure of the call itself is absorbed: the window is covered with evenly spaced
 * placeholders instead, so a failing window never leaves a hole in the timeline.
 */
@Component
public class TranscriptionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionClient.class);

  static final String TRANSCRIPTION_ERROR_TEXT = "[Transcription error]";
  static final double DEFAULT_ENTRY_SECONDS = 5.0;

  private static final double EPSILON = 1e-9;

  private static final String PROMPT_TEMPLATE =
      """
      Transcribe this audio for captioning TV shows, videocasts or web series, with accurate
      timestamps. This audio chunk starts at %.2f seconds in the original video and is %.2f
      seconds long.

      In addition to speech, identify:
      - Music: describe the style or mood, marked as "[♪ Upbeat jazz music ♪]" or similar
      - Sound effects: describe important sounds, marked as "[Sound: door slamming]" or similar
      - Ambient noise: note significant background sounds such as "[Crowd chattering]"
      - Silence: if a silence matters to the scene, mark it as "[Silence]" or "[Tense silence]"

      Keep each caption segment self-contained and split long sentences at natural breaks.

      Return a JSON array where each element has:
      1. "text": the caption text, speech or a non-speech description
      2. "start": start time in seconds, relative to the start of this chunk
      3. "end": end time in seconds, relative to the start of this chunk
      4. "type": "speech", "music", "sound" or "silence"

      Example:
      [
        {"text": "This is the first line", "start": 0.0, "end": 2.5, "type": "speech"},
        {"text": "[♪ Upbeat music ♪]", "start": 2.5, "end": 5.0, "type": "music"},
        {"text": "[Sound: door slamming]", "start": 5.0, "end": 5.5, "type": "sound"},
        {"text": "[Tense silence]", "start": 5.5, "end": 8.0, "type": "silence"}
      ]

      Mark audio you cannot understand as "[unintelligible]".
      """;

  private final InferenceService inferenceService;
  private final JsonExtractor jsonExtractor;
  private final ObjectMapper objectMapper;
  private final PipelineProperties properties;

  public TranscriptionClient(
      InferenceService inferenceService,
      JsonExtractor jsonExtractor,
      ObjectMapper objectMapper,
      PipelineProperties properties) {
    this.inferenceService = inferenceService;
    this.jsonExtractor = jsonExtractor;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** Transcribe a window without writing diagnostics. */
  public WindowTranscription transcribe(Window window) {
    return transcribe(window, ArtifactSink.disabled());
  }

  /**
   * Transcribe a window.
   *
   * @param window the window to transcribe
   * @param artifacts where to write the window audio, raw reply and errors
   * @return draft segments with absolute times; never throws for service failures
   */
  public WindowTranscription transcribe(Window window, ArtifactSink artifacts) {
    String prefix = ArtifactSink.windowPrefix(window.startSec());

    String reply;
    try {
      byte[] wav = window.samples().toWav();
      artifacts.writeBytes(prefix + ".wav", wav);

      String prompt =
          String.format(Locale.ROOT, PROMPT_TEMPLATE, window.startSec(), window.duration());
      reply =
          inferenceService.generate(
              InferenceRequest.withWav(InferencePurpose.TRANSCRIPTION, prompt, wav));
    } catch (InferenceException | MediaProcessingException e) {
      return fallback(window, artifacts, prefix, e);
    }

    artifacts.writeText(prefix + "_response.json", responseArtifact(window, reply));
    return new WindowTranscription(parseReply(window, reply), false);
  }

  /**
   * Parse a reply into segments for {@code window}.
   *
   * <p>If no JSON array can be found, the trimmed reply becomes a single speech segment spanning
   * the window.
   */
  List<Segment> parseReply(Window window, String reply) {
    Optional<JsonNode> array = jsonExtractor.extractArray(reply);
    if (array.isEmpty()) {
      String text = reply == null ? "" : reply.strip();
      LOGGER.warn(
          "No JSON array in reply for window {}, using the reply text as one segment",
          window.index());
      if (text.isEmpty()) {
        return List.of();
      }
      return List.of(Segment.speech(text, window.startSec(), window.endSec()));
    }

    List<Segment> segments = new ArrayList<>();
    for (JsonNode entry : array.get()) {
      toSegment(window, entry).ifPresent(segments::add);
    }
    LOGGER.debug(
        "Parsed {} segments from {} entries for window {}",
        segments.size(),
        array.get().size(),
        window.index());
    return segments;
  }

  private Optional<Segment> toSegment(Window window, JsonNode entry) {
    if (!entry.isObject()) {
      LOGGER.warn("Skipping non-object entry in window {}: {}", window.index(), entry);
      return Optional.empty();
    }

    double relativeStart = number(entry.get("start"), 0.0);
    double relativeEnd = number(entry.get("end"), relativeStart + DEFAULT_ENTRY_SECONDS);

    JsonNode textNode = entry.get("text");
    String text =
        textNode != null && textNode.isTextual() && !textNode.asText().isBlank()
            ? textNode.asText().strip()
            : TRANSCRIPTION_ERROR_TEXT;

    JsonNode typeNode = entry.get("type");
    SegmentKind kind =
        SegmentKind.fromWire(typeNode == null ? null : typeNode.asText())
            .orElse(SegmentKind.SPEECH);

    TimeRange bounds = window.range();
    double start = bounds.clamp(window.startSec() + relativeStart);
    double end = bounds.clamp(window.startSec() + relativeEnd);
    if (end - start <= EPSILON) {
      LOGGER.warn(
          "Dropping entry outside window {} [{}s - {}s): start={}, end={}",
          window.index(),
          window.startSec(),
          window.endSec(),
          relativeStart,
          relativeEnd);
      return Optional.empty();
    }
    return Optional.of(new Segment(text, start, end, kind));
  }

  private WindowTranscription fallback(
      Window window, ArtifactSink artifacts, String prefix, RuntimeException e) {
    artifacts.writeText(
        prefix + "_error.txt",
        String.format(
            Locale.ROOT,
            "Error at %.2fs: %s: %s",
            window.startSec(),
            e.getClass().getSimpleName(),
            e.getMessage()));

    List<Segment> placeholders =
        PlaceholderSegments.unavailable(
            window.startSec(), window.endSec(), properties.placeholderSeconds());
    LOGGER.warn(
        "Transcription failed for window {} [{}s - {}s), using {} placeholders: {}",
        window.index(),
        window.startSec(),
        window.endSec(),
        placeholders.size(),
        e.getMessage());
    return new WindowTranscription(placeholders, true);
  }

  private String responseArtifact(Window window, String reply) {
    try {
      return objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(
              Map.of("window", window.index(), "start", window.startSec(), "text", reply));
    } catch (JsonProcessingException e) {
      LOGGER.debug("Could not serialize reply artifact, writing raw text: {}", e.getMessage());
      return reply;
    }
  }

  private static double number(JsonNode node, double defaultValue) {
    if (node == null || node.isNull()) {
      return defaultValue;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }
}
