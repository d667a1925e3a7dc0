package com.scholary.captions.inference;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds JSON values embedded in free-form model replies.
 *
 * <p>Models often wrap JSON in prose or Markdown code fences. Each {@code [} (or <code>{</code>)
 * in the text is tried as the start of a value in order; the first one Jackson can read as a
 * complete array (or object) wins. Trailing text after the value is ignored.
 */
@Component
public class JsonExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonExtractor.class);

  private final ObjectMapper objectMapper;

  public JsonExtractor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** The first JSON array embedded in {@code text}, if any. */
  public Optional<JsonNode> extractArray(String text) {
    return extract(text, '[');
  }

  /** The first JSON object embedded in {@code text}, if any. */
  public Optional<JsonNode> extractObject(String text) {
    return extract(text, '{');
  }

  private Optional<JsonNode> extract(String text, char opening) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    int from = text.indexOf(opening);
    while (from >= 0) {
      JsonNode node = readValueAt(text, from);
      if (node != null && (opening == '[' ? node.isArray() : node.isObject())) {
        return Optional.of(node);
      }
      from = text.indexOf(opening, from + 1);
    }
    LOGGER.debug("No embedded JSON {} found in reply", opening == '[' ? "array" : "object");
    return Optional.empty();
  }

  private JsonNode readValueAt(String text, int offset) {
    try (JsonParser parser = objectMapper.getFactory().createParser(text.substring(offset))) {
      return objectMapper.readTree(parser);
    } catch (IOException e) {
      LOGGER.trace("No JSON value at offset {}: {}", offset, e.getMessage());
      return null;
    }
  }
}
