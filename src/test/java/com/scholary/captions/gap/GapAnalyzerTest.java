package com.scholary.captions.gap;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.audio.AudioTrack;
import com.scholary.captions.chunking.Window;
import com.scholary.captions.diagnostics.ArtifactSink;
import com.scholary.captions.inference.InferencePurpose;
import com.scholary.captions.inference.JsonExtractor;
import com.scholary.captions.support.AudioFixtures;
import com.scholary.captions.support.ScriptedInferenceService;
import com.scholary.captions.support.TestProperties;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.SegmentKind;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GapAnalyzerTest {

  private ScriptedInferenceService inference;

  @BeforeEach
  void setUp() {
    inference = new ScriptedInferenceService();
  }

  private GapAnalyzer analyzer(boolean classificationEnabled) {
    return new GapAnalyzer(
        inference,
        new JsonExtractor(new ObjectMapper()),
        TestProperties.pipeline(classificationEnabled, false));
  }

  private static Window window(AudioTrack track) {
    return new Window(0, 0.0, 30.0, track.slice(0.0, 30.0));
  }

  @Test
  void findGaps_shouldIgnoreGapsBelowThreshold() {
    Window window = window(AudioFixtures.silence(30.0));
    List<Segment> drafts =
        List.of(Segment.speech("one", 0.0, 10.0), Segment.speech("two", 10.5, 30.0));

    assertThat(analyzer(true).findGaps(window, drafts)).isEmpty();
  }

  @Test
  void findGaps_shouldIncludeLeadingAndTrailingGaps() {
    Window window = window(AudioFixtures.silence(30.0));
    List<Segment> drafts = List.of(Segment.speech("middle", 5.0, 25.0));

    assertThat(analyzer(true).findGaps(window, drafts))
        .containsExactly(new GapInterval(0.0, 5.0), new GapInterval(25.0, 30.0));
  }

  @Test
  void findGaps_shouldAdvanceCursorPastOverlappingSegments() {
    Window window = window(AudioFixtures.silence(30.0));
    List<Segment> drafts =
        List.of(
            Segment.speech("long", 0.0, 20.0),
            Segment.speech("inside", 5.0, 10.0),
            Segment.speech("last", 21.0, 30.0));

    assertThat(analyzer(true).findGaps(window, drafts)).isEmpty();
  }

  @Test
  void findGaps_shouldTreatEmptyDraftsAsOneGap() {
    Window window = window(AudioFixtures.silence(30.0));

    assertThat(analyzer(true).findGaps(window, List.of()))
        .containsExactly(new GapInterval(0.0, 30.0));
  }

  @Test
  void fillGaps_shouldMarkLongQuietGapAsSilenceWithoutClassification() {
    Window window = window(AudioFixtures.silence(30.0));
    List<Segment> drafts =
        List.of(Segment.speech("one", 0.0, 10.0), Segment.speech("two", 14.0, 30.0));

    List<Segment> result = analyzer(false).fillGaps(window, drafts);

    assertThat(result)
        .containsExactly(
            drafts.get(0),
            new Segment("[Silence]", 10.0, 14.0, SegmentKind.SILENCE),
            drafts.get(1));
    assertThat(inference.requests()).isEmpty();
  }

  @Test
  void fillGaps_shouldDropShortQuietGap() {
    Window window = window(AudioFixtures.silence(30.0));
    List<Segment> drafts =
        List.of(Segment.speech("one", 0.0, 10.0), Segment.speech("two", 13.0, 30.0));

    assertThat(analyzer(true).fillGaps(window, drafts)).containsExactlyElementsOf(drafts);
    assertThat(inference.requests()).isEmpty();
  }

  @Test
  void fillGaps_shouldUseClassificationReply(@TempDir Path dir) {
    inference.reply(
        InferencePurpose.GAP_CLASSIFICATION,
        "{\"type\": \"music\", \"text\": \"[♪ Upbeat jazz ♪]\"}");
    Window window = window(AudioFixtures.square(30.0, (short) 6000));
    List<Segment> drafts =
        List.of(Segment.speech("one", 0.0, 10.0), Segment.speech("two", 12.0, 30.0));

    List<Segment> result = analyzer(true).fillGaps(window, drafts, ArtifactSink.directory(dir));

    assertThat(result.get(1))
        .isEqualTo(new Segment("[♪ Upbeat jazz ♪]", 10.0, 12.0, SegmentKind.MUSIC));
    assertThat(inference.requests().get(0).jsonResponse()).isTrue();
    assertThat(inference.requests().get(0).prompt()).contains("10.00s").contains("12.00s");
    assertThat(dir.resolve("gap_10.00.wav")).exists();
    assertThat(dir.resolve("gap_10.00_response.json")).exists();
  }

  @Test
  void fillGaps_shouldFallBackToSoundWhenClassificationFails() {
    Window window = window(AudioFixtures.square(30.0, (short) 6000));
    List<Segment> drafts = List.of(Segment.speech("one", 0.0, 28.0));

    List<Segment> result = analyzer(true).fillGaps(window, drafts);

    assertThat(result)
        .containsExactly(
            drafts.get(0),
            new Segment("[Sound: Background sounds]", 28.0, 30.0, SegmentKind.SOUND));
  }

  @Test
  void fillGaps_shouldRejectSpeechClassification() {
    inference.reply(
        InferencePurpose.GAP_CLASSIFICATION, "{\"type\": \"speech\", \"text\": \"Hello\"}");
    Window window = window(AudioFixtures.silence(30.0));
    List<Segment> drafts = List.of(Segment.speech("one", 0.0, 20.0));

    List<Segment> result = analyzer(true).fillGaps(window, drafts);

    assertThat(result.get(1)).isEqualTo(new Segment("[Silence]", 20.0, 30.0, SegmentKind.SILENCE));
  }
}
