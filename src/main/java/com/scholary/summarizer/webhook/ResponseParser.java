package com.scholary.summarizer.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts the useful text from one webhook response.
 *
 * <p>The webhook does not guarantee a field name for its result, so JSON objects are probed with
 * {@link #COMMON_KEYS} in order and the first usable value wins. The order must not change: flows
 * on the remote side rely on {@code summary} taking precedence over {@code result} and so on.
 *
 * <p>Bodies that are not JSON are returned as plain text.
 */
@Component
public class ResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseParser.class);

  /** Keys probed in JSON object responses, highest precedence first. */
  public static final List<String> COMMON_KEYS =
      List.of("summary", "summarization", "result", "output", "text", "content");

  private static final int PREVIEW_LENGTH = 200;

  private final ObjectMapper objectMapper;
  // Strict: "2024 report ..." is plain text, not the number 2024 followed by garbage.
  private final ObjectReader strictReader;

  public ResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.strictReader =
        objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Extract text from a raw response body.
   *
   * @param body the response body, may be null
   * @return the most relevant text, or empty when the body carries nothing usable
   */
  public Optional<String> extract(String body) {
    if (body == null || body.isBlank()) {
      LOGGER.debug("Result: response body is empty");
      return Optional.empty();
    }

    JsonNode node;
    try {
      node = strictReader.readTree(body);
    } catch (JsonProcessingException e) {
      LOGGER.debug(
          "Result: returning plain text response ({} chars): {}", body.length(), preview(body));
      return Optional.of(body);
    }
    return extract(node);
  }

  /**
   * Extract text from an already parsed response.
   *
   * @param node the parsed body, may be null
   * @return the most relevant text, or empty when the body carries nothing usable
   */
  public Optional<String> extract(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      LOGGER.debug("Result: response is null");
      return Optional.empty();
    }

    if (node.isTextual()) {
      String text = node.asText();
      if (text.isBlank()) {
        LOGGER.debug("Result: response is an empty string");
        return Optional.empty();
      }
      LOGGER.debug("Result: returning string response ({} chars)", text.length());
      return Optional.of(text);
    }

    if (node.isObject()) {
      return extractFromObject((ObjectNode) node);
    }

    String stringified = node.isValueNode() ? node.asText() : prettyPrint(node);
    if (stringified.isBlank()) {
      LOGGER.debug("Result: response is empty after stringification");
      return Optional.empty();
    }
    LOGGER.debug(
        "Result: stringified {} response ({} chars)", node.getNodeType(), stringified.length());
    return Optional.of(stringified);
  }

  /**
   * Probe the known keys in order.
   *
   * <p>A key holding JSON {@code null} or a blank string is treated as absent and the probe moves
   * on, so {@code {"summary": null, "output": "x"}} yields {@code x} rather than the text "null".
   */
  private Optional<String> extractFromObject(ObjectNode object) {
    LOGGER.debug("Response keys: {}", fieldNames(object));

    for (String key : COMMON_KEYS) {
      JsonNode value = object.get(key);
      if (value == null || value.isNull()) {
        continue;
      }
      if (value.isTextual()) {
        if (value.asText().isBlank()) {
          LOGGER.debug("  Key '{}' is an empty string, continuing", key);
          continue;
        }
        LOGGER.debug("Result: extracted from key '{}' ({} chars)", key, value.asText().length());
        return Optional.of(value.asText());
      }
      if (value.isContainerNode()) {
        LOGGER.debug("Result: found {} in key '{}', returning as JSON", value.getNodeType(), key);
        return Optional.of(prettyPrint(value));
      }
      LOGGER.debug("Result: found {} in key '{}', stringified", value.getNodeType(), key);
      return Optional.of(value.asText());
    }

    if (object.isEmpty()) {
      LOGGER.debug("Result: response object is empty");
      return Optional.empty();
    }

    String json = prettyPrint(object);
    LOGGER.debug(
        "Result: no common keys found, returning full object as JSON ({} chars)", json.length());
    return Optional.of(json);
  }

  private String prettyPrint(JsonNode node) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Could not pretty-print response, using compact form: {}", e.getMessage());
      return node.toString();
    }
  }

  private static List<String> fieldNames(ObjectNode object) {
    List<String> names = new ArrayList<>();
    object.fieldNames().forEachRemaining(names::add);
    return names;
  }

  static String preview(String text) {
    return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
  }
}
