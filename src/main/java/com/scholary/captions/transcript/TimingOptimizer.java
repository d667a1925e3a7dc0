package com.scholary.captions.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.config.PipelineProperties;
import com.scholary.captions.inference.InferenceException;
import com.scholary.captions.inference.InferencePurpose;
import com.scholary.captions.inference.InferenceRequest;
import com.scholary.captions.inference.InferenceService;
import com.scholary.captions.inference.JsonExtractor;
import com.scholary.captions.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One global timing pass over the assembled transcript.
 *
 * <p>The whole segment list is sent to the inference service as JSON with instructions to adjust
 * timing only. The reply is accepted only if every element is a complete, well-formed segment;
 * otherwise the input transcript is returned unchanged (the same instance).
 */
@Component
public class TimingOptimizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimingOptimizer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String PROMPT_TEMPLATE =
      """
      I have a set of caption segments for a video that need timing optimization.
      The goal is to make the captions readable and properly timed for viewers.

      Here are the current segments:
      %s

      Optimize the timing using these rules:
      1. Speech segments should align with natural speech patterns and sentence breaks.
      2. Music and sound segments should have durations long enough to read.
      3. Combine very short segments that are part of the same sentence.
      4. Keep gaps between captions appropriate for readability.
      5. Keep the original ordering; adjust only start and end times.
      6. Never change the text of a segment.

      Return the optimized segments as a JSON array with the same structure, with the fields
      "text", "start", "end" and "type" on every element.
      """;

  private final InferenceService inferenceService;
  private final JsonExtractor jsonExtractor;
  private final ObjectMapper objectMapper;
  private final PipelineProperties properties;

  public TimingOptimizer(
      InferenceService inferenceService,
      JsonExtractor jsonExtractor,
      ObjectMapper objectMapper,
      PipelineProperties properties) {
    this.inferenceService = inferenceService;
    this.jsonExtractor = jsonExtractor;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Optimize segment timing.
   *
   * @param transcript the assembled transcript
   * @return the optimized transcript, or {@code transcript} itself if the pass is skipped or its
   *     result is rejected
   */
  public Transcript optimize(Transcript transcript) {
    if (transcript.isEmpty()) {
      return transcript;
    }
    if (!properties.optimizer().enabled()) {
      STRUCTURED_LOGGER.logOptimizationResult(
          transcript.size(), transcript.size(), false, "disabled");
      return transcript;
    }

    String reply;
    try {
      String prompt = String.format(PROMPT_TEMPLATE, toJson(transcript));
      reply =
          inferenceService.generate(
              InferenceRequest.jsonOnly(InferencePurpose.TIMING_OPTIMIZATION, prompt));
    } catch (InferenceException e) {
      LOGGER.warn("Timing optimization call failed, keeping original timing: {}", e.getMessage());
      STRUCTURED_LOGGER.logOptimizationResult(
          transcript.size(), transcript.size(), false, "call_failed");
      return transcript;
    }

    Transcript optimized = reconcile(jsonExtractor.extractArray(reply).orElse(null), transcript);
    boolean applied = optimized != transcript;
    STRUCTURED_LOGGER.logOptimizationResult(
        transcript.size(), optimized.size(), applied, applied ? "accepted" : "rejected");
    return optimized;
  }

  /**
   * Validate an optimizer reply against the original transcript.
   *
   * <p>The candidate is accepted only if it is a non-empty array whose every element is an object
   * with non-blank string {@code text}, numeric {@code start} and {@code end} with {@code 0 <=
   * start < end}, and a {@code type}. Unknown types become speech. An accepted candidate is
   * stable-sorted by start time.
   *
   * @param candidate the parsed reply, may be null
   * @param original the transcript to fall back to
   * @return the candidate as a transcript, or {@code original} if it is rejected
   */
  public static Transcript reconcile(JsonNode candidate, Transcript original) {
    if (candidate == null || !candidate.isArray() || candidate.isEmpty()) {
      LOGGER.warn("Optimizer reply is not a non-empty JSON array, keeping original timing");
      return original;
    }

    List<Segment> segments = new ArrayList<>(candidate.size());
    for (int i = 0; i < candidate.size(); i++) {
      Optional<Segment> segment = toSegment(candidate.get(i));
      if (segment.isEmpty()) {
        LOGGER.warn("Optimizer reply element {} is invalid, keeping original timing", i);
        return original;
      }
      segments.add(segment.get());
    }
    return Transcript.sorted(segments);
  }

  private static Optional<Segment> toSegment(JsonNode node) {
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    JsonNode text = node.get("text");
    JsonNode start = node.get("start");
    JsonNode end = node.get("end");
    JsonNode type = node.get("type");
    if (text == null || !text.isTextual() || text.asText().isBlank()) {
      return Optional.empty();
    }
    if (start == null || !start.isNumber() || end == null || !end.isNumber()) {
      return Optional.empty();
    }
    if (type == null || type.isNull()) {
      return Optional.empty();
    }
    double startSec = start.asDouble();
    double endSec = end.asDouble();
    if (!Double.isFinite(startSec)
        || !Double.isFinite(endSec)
        || startSec < 0
        || startSec >= endSec) {
      return Optional.empty();
    }
    SegmentKind kind = SegmentKind.fromWire(type.asText()).orElse(SegmentKind.SPEECH);
    return Optional.of(new Segment(text.asText(), startSec, endSec, kind));
  }

  private String toJson(Transcript transcript) {
    try {
      return objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(transcript.segments());
    } catch (JsonProcessingException e) {
      throw new InferenceException("Failed to serialize segments for optimization", e);
    }
  }
}
