package com.scholary.captions.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.caption.CaptionFormat;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreProperties;
import com.scholary.captions.transcript.Transcript;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes transcripts as JSON and publishes job outputs to the object store.
 *
 * <p>JSON format:
 *
 * <pre>
 * {
 *   "segments": [
 *     {"text": "Hello world", "start": 0.0, "end": 5.2, "type": "speech"}
 *   ]
 * }
 * </pre>
 */
@Component
public class TranscriptWriter {

  static final Duration PRESIGN_TTL = Duration.ofDays(7);

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties objectStoreProperties;

  public TranscriptWriter(
      ObjectMapper objectMapper,
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties objectStoreProperties) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
    this.objectStoreProperties = objectStoreProperties;
  }

  /** Serialize a transcript as pretty-printed JSON. */
  public byte[] writeJson(Transcript transcript) throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("segments", transcript.segments());
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Upload the caption file and transcript JSON of a job.
   *
   * <p>Keys are {@code captions/<jobId>/captions.<ext>} and {@code
   * captions/<jobId>/transcript.json} in the configured bucket. The returned URLs are presigned
   * for 7 days.
   *
   * @throws com.scholary.captions.objectstore.ObjectStoreException if an upload fails
   */
  public CaptionResponse.StorageInfo saveOutputs(
      String jobId, CaptionFormat format, String captions, byte[] transcriptJson) {
    String bucket = objectStoreProperties.bucket();
    String baseKey = "captions/" + jobId + "/";
    String captionKey = baseKey + "captions." + format.extension();
    String transcriptKey = baseKey + "transcript.json";

    objectStoreClient.putObject(
        bucket,
        captionKey,
        captions.getBytes(StandardCharsets.UTF_8),
        format.mediaType() + "; charset=utf-8");
    objectStoreClient.putObject(bucket, transcriptKey, transcriptJson, "application/json");

    URL captionUrl = objectStoreClient.presignGet(bucket, captionKey, PRESIGN_TTL);
    URL transcriptUrl = objectStoreClient.presignGet(bucket, transcriptKey, PRESIGN_TTL);

    return new CaptionResponse.StorageInfo(
        bucket, captionKey, transcriptKey, captionUrl.toString(), transcriptUrl.toString());
  }
}
