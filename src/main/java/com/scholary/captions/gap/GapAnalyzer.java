package com.scholary.captions.gap;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.captions.audio.AudioBuffer;
import com.scholary.captions.chunking.Window;
import com.scholary.captions.config.PipelineProperties;
import com.scholary.captions.config.PipelineProperties.GapProperties;
import com.scholary.captions.diagnostics.ArtifactSink;
import com.scholary.captions.inference.InferenceException;
import com.scholary.captions.inference.InferencePurpose;
import com.scholary.captions.inference.InferenceRequest;
import com.scholary.captions.inference.InferenceService;
import com.scholary.captions.inference.JsonExtractor;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.media.MediaProcessingException;
import com.scholary.captions.transcript.PlaceholderSegments;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.SegmentKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds uncovered spans inside a window and describes the ones worth captioning.
 *
 * <p>A gap is any span longer than the gap threshold between the window start, the draft
 * segments and the window end. Quiet gaps no longer than the force-include duration are dropped.
 * The rest are classified by the inference service as music, sound or silence; when
 * classification is disabled or fails, a loudness heuristic picks {@code [Silence]} or a
 * background-sound cue.
 */
@Component
public class GapAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GapAnalyzer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String PROMPT_TEMPLATE =
      """
      Analyze this audio gap between %.2fs and %.2fs.

      Determine whether it contains:
      1. Music or a background score
      2. Sound effects
      3. Ambient noise
      4. Meaningful silence

      Return only a JSON object with:
      - "type": one of "music", "sound", "silence"
      - "text": a description of what you hear, formatted as "[♪ Music description ♪]",
        "[Sound: sound description]" or "[Silence]"

      Examples:
      {"type": "music", "text": "[♪ Suspenseful music ♪]"}
      {"type": "sound", "text": "[Sound: footsteps approaching]"}
      {"type": "silence", "text": "[Tense silence]"}

      If there is nothing meaningful, return {"type": "silence", "text": "[Silence]"}.
      """;

  private final InferenceService inferenceService;
  private final JsonExtractor jsonExtractor;
  private final GapProperties properties;

  public GapAnalyzer(
      InferenceService inferenceService,
      JsonExtractor jsonExtractor,
      PipelineProperties pipelineProperties) {
    this.inferenceService = inferenceService;
    this.jsonExtractor = jsonExtractor;
    this.properties = pipelineProperties.gaps();
  }

  /** Fill gaps without writing diagnostics. */
  public List<Segment> fillGaps(Window window, List<Segment> drafts) {
    return fillGaps(window, drafts, ArtifactSink.disabled());
  }

  /**
   * Add descriptive segments for the significant gaps in a window.
   *
   * @param window the window the drafts belong to
   * @param drafts draft segments with absolute times inside the window
   * @param artifacts where to write gap audio and classification replies
   * @return the drafts plus synthesized gap segments, sorted by start time
   */
  public List<Segment> fillGaps(Window window, List<Segment> drafts, ArtifactSink artifacts) {
    List<Segment> result = new ArrayList<>(drafts);
    for (GapInterval gap : findGaps(window, drafts)) {
      describeGap(window, gap, artifacts).ifPresent(result::add);
    }
    result.sort(Comparator.comparingDouble(Segment::startSec));
    return result;
  }

  /**
   * Uncovered spans longer than the gap threshold, in time order.
   *
   * <p>The cursor starts at the window start and advances to the furthest segment end seen so far,
   * so overlapping drafts never produce a gap.
   */
  public List<GapInterval> findGaps(Window window, List<Segment> drafts) {
    List<Segment> sorted = new ArrayList<>(drafts);
    sorted.sort(Comparator.comparingDouble(Segment::startSec));

    List<GapInterval> gaps = new ArrayList<>();
    double cursor = window.startSec();
    for (Segment segment : sorted) {
      if (segment.startSec() - cursor > properties.gapThresholdSeconds()) {
        gaps.add(new GapInterval(cursor, segment.startSec()));
      }
      cursor = Math.max(cursor, segment.endSec());
    }
    if (window.endSec() - cursor > properties.gapThresholdSeconds()) {
      gaps.add(new GapInterval(cursor, window.endSec()));
    }
    return gaps;
  }

  private Optional<Segment> describeGap(Window window, GapInterval gap, ArtifactSink artifacts) {
    AudioBuffer audio =
        window
            .samples()
            .slice(gap.startSec() - window.startSec(), gap.endSec() - window.startSec());
    double dbfs = audio.dbfs();
    boolean quiet = dbfs < properties.silenceThresholdDbfs();

    if (quiet && gap.duration() <= properties.forceIncludeSeconds()) {
      LOGGER.debug(
          "Dropping quiet gap [{}s - {}s): {} dBFS", gap.startSec(), gap.endSec(), dbfs);
      return Optional.empty();
    }

    Optional<Segment> classified =
        properties.classificationEnabled()
            ? classify(gap, audio, artifacts)
            : Optional.empty();
    Segment segment =
        classified.orElseGet(
            () -> PlaceholderSegments.gapFallback(gap.startSec(), gap.endSec(), quiet));

    STRUCTURED_LOGGER.logGapClassified(
        gap.startSec(), gap.endSec(), dbfs, segment.kind().wireName(), classified.isPresent());
    return Optional.of(segment);
  }

  private Optional<Segment> classify(GapInterval gap, AudioBuffer audio, ArtifactSink artifacts) {
    String prefix = ArtifactSink.gapPrefix(gap.startSec());
    String reply;
    try {
      byte[] wav = audio.toWav();
      artifacts.writeBytes(prefix + ".wav", wav);
      String prompt = String.format(Locale.ROOT, PROMPT_TEMPLATE, gap.startSec(), gap.endSec());
      reply =
          inferenceService.generate(
              new InferenceRequest(
                  InferencePurpose.GAP_CLASSIFICATION,
                  prompt,
                  wav,
                  InferenceRequest.WAV_MIME_TYPE,
                  true));
    } catch (InferenceException | MediaProcessingException e) {
      LOGGER.warn(
          "Gap classification failed for [{}s - {}s), using heuristic: {}",
          gap.startSec(),
          gap.endSec(),
          e.getMessage());
      artifacts.writeText(prefix + "_error.txt", e.getMessage() == null ? "" : e.getMessage());
      return Optional.empty();
    }
    artifacts.writeText(prefix + "_response.json", reply);

    Optional<JsonNode> json = jsonExtractor.extractObject(reply);
    if (json.isEmpty()) {
      LOGGER.warn("Unparseable gap classification reply at {}s", gap.startSec());
      return Optional.empty();
    }

    JsonNode typeNode = json.get().get("type");
    JsonNode textNode = json.get().get("text");
    Optional<SegmentKind> kind =
        SegmentKind.fromWire(typeNode == null ? null : typeNode.asText())
            .filter(k -> k != SegmentKind.SPEECH);
    if (kind.isEmpty()
        || textNode == null
        || !textNode.isTextual()
        || textNode.asText().isBlank()) {
      LOGGER.warn("Gap classification reply at {}s has no usable type/text", gap.startSec());
      return Optional.empty();
    }
    return Optional.of(
        new Segment(textNode.asText().strip(), gap.startSec(), gap.endSec(), kind.get()));
  }
}
