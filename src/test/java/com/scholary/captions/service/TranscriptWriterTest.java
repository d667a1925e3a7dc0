package com.scholary.captions.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.caption.CaptionFormat;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreProperties;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.SegmentKind;
import com.scholary.captions.transcript.Transcript;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptWriterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private ObjectStoreClient objectStoreClient;

  private TranscriptWriter writer;

  @BeforeEach
  void setUp() {
    writer =
        new TranscriptWriter(
            objectMapper,
            objectStoreClient,
            new ObjectStoreProperties(
                "http://localhost:9000", "admin", "admin123", "captions", "us-east-1", true));
  }

  @Test
  void writeJson_shouldProduceSegmentsDocument() throws Exception {
    Transcript transcript =
        new Transcript(
            List.of(
                Segment.speech("Hello world", 0.0, 5.2),
                new Segment("[♪ Jazz ♪]", 5.2, 9.0, SegmentKind.MUSIC)));

    JsonNode json = objectMapper.readTree(writer.writeJson(transcript));

    assertThat(json.get("segments").size()).isEqualTo(2);
    JsonNode music = json.get("segments").get(1);
    assertThat(music.get("text").asText()).isEqualTo("[♪ Jazz ♪]");
    assertThat(music.get("start").asDouble()).isEqualTo(5.2);
    assertThat(music.get("end").asDouble()).isEqualTo(9.0);
    assertThat(music.get("type").asText()).isEqualTo("music");
  }

  @Test
  void writeJson_shouldHandleEmptyTranscript() throws Exception {
    JsonNode json = objectMapper.readTree(writer.writeJson(Transcript.empty()));

    assertThat(json.get("segments").isArray()).isTrue();
    assertThat(json.get("segments").isEmpty()).isTrue();
  }

  @Test
  void saveOutputs_shouldUploadUnderJobPrefixAndPresign() throws Exception {
    when(objectStoreClient.presignGet(
            eq("captions"), eq("captions/job-1/captions.vtt"), any(Duration.class)))
        .thenReturn(new URL("http://localhost:9000/captions/job-1/captions.vtt?sig=1"));
    when(objectStoreClient.presignGet(
            eq("captions"), eq("captions/job-1/transcript.json"), any(Duration.class)))
        .thenReturn(new URL("http://localhost:9000/captions/job-1/transcript.json?sig=2"));
    byte[] json = "{\"segments\":[]}".getBytes(StandardCharsets.UTF_8);

    CaptionResponse.StorageInfo storage =
        writer.saveOutputs("job-1", CaptionFormat.VTT, "WEBVTT\n\n", json);

    verify(objectStoreClient)
        .putObject(
            "captions",
            "captions/job-1/captions.vtt",
            "WEBVTT\n\n".getBytes(StandardCharsets.UTF_8),
            "text/vtt; charset=utf-8");
    verify(objectStoreClient)
        .putObject("captions", "captions/job-1/transcript.json", json, "application/json");
    assertThat(storage.bucket()).isEqualTo("captions");
    assertThat(storage.captionKey()).isEqualTo("captions/job-1/captions.vtt");
    assertThat(storage.captionUrl()).endsWith("sig=1");
    assertThat(storage.transcriptUrl()).endsWith("sig=2");
  }
}
