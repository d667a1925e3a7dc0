package com.scholary.captions.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Gemini {@code generateContent} REST endpoint.
 *
 * <p>Builds the JSON payload (inline base64 audio plus a text part), sends it with the JDK
 * HttpClient, and pulls the reply text out of the first candidate. Error statuses, empty
 * candidate lists and I/O failures are retried with exponential backoff and jitter; once the
 * attempts are used up an {@link InferenceException} is thrown.
 */
public class GeminiClient implements InferenceService {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiClient.class);

  private final HttpClient httpClient;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiClient(GeminiProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  GeminiClient(GeminiProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized Gemini client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public String generate(InferenceRequest request) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new InferenceException("Gemini API key is not configured");
    }

    LOGGER.debug(
        "Sending inference request: purpose={}, audioBytes={}",
        request.purpose(),
        request.hasAudio() ? request.audio().length : 0);

    String body = buildRequestBody(request);
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptGenerate(body);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = backoffMillis(attempt);
          LOGGER.warn(
              "Inference attempt {} failed for {}, retrying in {}ms: {}",
              attempt,
              request.purpose(),
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InferenceException("Inference request interrupted", e);
      }
    }

    throw new InferenceException(
        String.format(
            "Inference failed after %d attempts: %s",
            properties.maxRetries(), lastException.getMessage()),
        lastException);
  }

  private String attemptGenerate(String body) throws IOException, InterruptedException {
    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(endpoint())
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

    HttpResponse<String> response =
        httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Gemini API returned status %d: %s", response.statusCode(), response.body()));
    }

    return extractText(objectMapper.readTree(response.body()));
  }

  /** Concatenates the text parts of the first candidate. */
  private String extractText(JsonNode root) throws IOException {
    JsonNode candidates = root.path("candidates");
    if (!candidates.isArray() || candidates.isEmpty()) {
      throw new IOException("No candidates in Gemini response");
    }
    JsonNode parts = candidates.get(0).path("content").path("parts");
    if (!parts.isArray() || parts.isEmpty()) {
      throw new IOException("No content parts in Gemini response");
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode part : parts) {
      JsonNode partText = part.get("text");
      if (partText != null && partText.isTextual()) {
        text.append(partText.asText());
      }
    }
    if (text.length() == 0) {
      throw new IOException("Gemini response contained no text");
    }
    return text.toString();
  }

  String buildRequestBody(InferenceRequest request) {
    ObjectNode root = objectMapper.createObjectNode();
    ArrayNode contents = root.putArray("contents");
    ObjectNode content = contents.addObject();
    content.put("role", "user");
    ArrayNode parts = content.putArray("parts");

    if (request.hasAudio()) {
      ObjectNode inlineData = parts.addObject().putObject("inline_data");
      inlineData.put("mimeType", request.audioMimeType());
      inlineData.put("data", Base64.getEncoder().encodeToString(request.audio()));
    }
    parts.addObject().put("text", request.prompt());

    ObjectNode generationConfig = root.putObject("generationConfig");
    generationConfig.put("temperature", properties.temperature());
    generationConfig.put("maxOutputTokens", properties.maxOutputTokens());
    if (request.jsonResponse()) {
      generationConfig.put("responseMimeType", "application/json");
    }

    try {
      return objectMapper.writeValueAsString(root);
    } catch (IOException e) {
      throw new InferenceException("Failed to serialize Gemini request", e);
    }
  }

  private URI endpoint() {
    String base = properties.baseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(
        base
            + "/v1beta/models/"
            + properties.model()
            + ":generateContent?key="
            + URLEncoder.encode(properties.apiKey(), StandardCharsets.UTF_8));
  }

  private long backoffMillis(int attempt) {
    long base = properties.retryBackoffMillis();
    if (base == 0) {
      return 0;
    }
    // Exponential backoff with jitter
    return (long)
        (Math.pow(2, attempt - 1) * base + ThreadLocalRandom.current().nextDouble() * base);
  }

  private static void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new InferenceException("Inference interrupted during backoff", ie);
    }
  }
}
