package com.scholary.summarizer.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.aggregate.Aggregator;
import com.scholary.summarizer.aggregate.Outcome;
import com.scholary.summarizer.chunking.ChunkConfig;
import com.scholary.summarizer.chunking.Piece;
import com.scholary.summarizer.logging.StructuredLogger;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Sends pieces to the webhook and classifies what comes back.
 *
 * <p>Pieces of one job are sent strictly one after another, in index order, each call blocking
 * until it answers or times out. The webhook's tolerance for parallel calls is unknown, and "chunk
 * N of M" metadata only means something to it when chunks arrive in order.
 *
 * <p>Failures never escape as exceptions: every timeout, connection problem or error status
 * becomes a {@link Outcome.Status#FAILED} outcome and the loop moves on to the next piece. Nothing
 * is retried here.
 */
@Component
public class ChunkDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkDispatcher.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  static final int MAX_ERROR_BODY_CHARS = 200;

  private final WebhookTransport transport;
  private final ResponseParser responseParser;
  private final Aggregator aggregator;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final AtomicReference<TransportResponse> lastResponse = new AtomicReference<>();

  @Autowired
  public ChunkDispatcher(
      WebhookTransport transport,
      ResponseParser responseParser,
      Aggregator aggregator,
      ObjectMapper objectMapper) {
    this(transport, responseParser, aggregator, objectMapper, Clock.systemDefaultZone());
  }

  public ChunkDispatcher(
      WebhookTransport transport,
      ResponseParser responseParser,
      Aggregator aggregator,
      ObjectMapper objectMapper,
      Clock clock) {
    this.transport = transport;
    this.responseParser = responseParser;
    this.aggregator = aggregator;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Parse the configured endpoint.
   *
   * @throws WebhookConfigurationException if the endpoint is missing or not a valid address
   */
  public static URI requireEndpoint(ChunkConfig.Snapshot config) {
    if (!config.hasEndpoint()) {
      throw new WebhookConfigurationException("Webhook URL not configured");
    }
    try {
      URI uri = URI.create(config.endpoint().trim());
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new WebhookConfigurationException(
            "Webhook URL is not absolute: " + config.endpoint());
      }
      return uri;
    } catch (IllegalArgumentException e) {
      throw new WebhookConfigurationException("Invalid webhook URL: " + config.endpoint(), e);
    }
  }

  /**
   * Send all pieces in order and combine the outcomes.
   *
   * @param pieces pieces of one job, ordered by index
   * @param config configuration snapshot taken at job start
   * @param shouldContinue checked before each piece; once false, no further piece is sent
   * @return the aggregate result
   * @throws WebhookConfigurationException if the endpoint is not configured
   */
  public AggregateResult sendAll(
      List<Piece> pieces, ChunkConfig.Snapshot config, BooleanSupplier shouldContinue) {
    URI endpoint = requireEndpoint(config);
    int total = pieces.size();

    List<Outcome> outcomes = new ArrayList<>(total);
    boolean cancelled = false;
    for (Piece piece : pieces) {
      if (!shouldContinue.getAsBoolean() || Thread.currentThread().isInterrupted()) {
        LOGGER.warn(
            "Job cancelled before chunk {}/{}, {} chunks not sent",
            piece.index(),
            total,
            total - outcomes.size());
        cancelled = true;
        break;
      }
      LOGGER.info("Processing chunk {}/{} ({} chars)", piece.index(), total, piece.text().length());
      outcomes.add(send(piece, endpoint, config));
    }

    return aggregator.combine(outcomes, total, cancelled);
  }

  /**
   * Send one piece and classify the response.
   *
   * @throws WebhookConfigurationException if the endpoint is not configured
   */
  public Outcome sendOne(Piece piece, ChunkConfig.Snapshot config) {
    return send(piece, requireEndpoint(config), config);
  }

  /** The last raw response received from the webhook, for diagnostics. */
  public Optional<TransportResponse> lastResponse() {
    return Optional.ofNullable(lastResponse.get());
  }

  private Outcome send(Piece piece, URI endpoint, ChunkConfig.Snapshot config) {
    int index = piece.index();
    int total = piece.totalPieces();
    long startedAt = System.currentTimeMillis();

    String payload;
    try {
      payload = objectMapper.writeValueAsString(buildPayload(piece));
    } catch (JsonProcessingException e) {
      return classified(
          Outcome.failed(index, "Could not serialize request: " + e.getMessage()),
          total,
          startedAt);
    }

    STRUCTURED.logPieceDispatched(index, total, piece.text().length(), endpoint.toString());

    TransportResponse response;
    try {
      response = transport.postJson(endpoint, payload, config.timeout());
    } catch (HttpConnectTimeoutException | ConnectException e) {
      return classified(
          Outcome.failed(index, "Cannot reach endpoint: " + describe(e)), total, startedAt);
    } catch (HttpTimeoutException e) {
      return classified(
          Outcome.failed(
              index, String.format("Request timeout (>%ds)", config.timeout().toSeconds())),
          total,
          startedAt);
    } catch (IOException e) {
      return classified(
          Outcome.failed(index, "HTTP request failed: " + describe(e)), total, startedAt);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return classified(Outcome.failed(index, "Request interrupted"), total, startedAt);
    }

    lastResponse.set(response);
    return classified(classify(index, response), total, startedAt);
  }

  private Outcome classify(int index, TransportResponse response) {
    int status = response.statusCode();

    if (status == 404) {
      Optional<String> notRegistered = notRegisteredMessage(response.body());
      if (notRegistered.isPresent()) {
        return Outcome.failed(index, "Endpoint returned 404: " + notRegistered.get());
      }
    }

    if (!response.isSuccessful()) {
      return Outcome.failed(
          index, String.format("Endpoint returned %d: %s", status, truncate(response.body())));
    }

    Optional<String> text = responseParser.extract(response.body());
    if (text.isEmpty()) {
      return Outcome.emptyAccepted(index);
    }
    return Outcome.contentReceived(index, text.get());
  }

  private Outcome classified(Outcome outcome, int total, long startedAt) {
    String detail;
    if (outcome.hasContent()) {
      detail = outcome.text().length() + " chars";
    } else if (outcome.isFailure()) {
      detail = outcome.reason();
    } else {
      detail = "accepted with empty response (async processing pattern)";
    }
    STRUCTURED.logPieceClassified(
        outcome.pieceIndex(),
        total,
        outcome.status().name(),
        detail,
        System.currentTimeMillis() - startedAt);
    return outcome;
  }

  private WebhookPayload buildPayload(Piece piece) {
    Map<String, Object> metadata = new LinkedHashMap<>(piece.metadata());
    Integer chunkNumber = null;
    Integer totalChunks = null;
    if (piece.isPartOfSplit()) {
      chunkNumber = piece.index();
      totalChunks = piece.totalPieces();
      metadata.put("chunk_index", piece.index());
      metadata.put("total_chunks", piece.totalPieces());
    }

    return new WebhookPayload(
        piece.sourceName(),
        piece.text(),
        LocalDateTime.now(clock).toString(),
        chunkNumber,
        totalChunks,
        metadata.isEmpty() ? null : metadata);
  }

  /**
   * Test-mode webhooks answer 404 with "... is not registered" when nobody is listening.
   *
   * <p>The message is taken from a JSON {@code message} field when there is one. A body that
   * mentions "not registered" without being JSON is still reported as an unregistered webhook
   * rather than echoed back raw.
   */
  private Optional<String> notRegisteredMessage(String body) {
    if (body == null || !body.contains("not registered")) {
      return Optional.empty();
    }
    try {
      JsonNode json = objectMapper.readTree(body);
      JsonNode message = json.get("message");
      if (message != null && message.isTextual()) {
        return Optional.of(message.asText());
      }
    } catch (JsonProcessingException e) {
      LOGGER.debug("404 body is not JSON: {}", e.getMessage());
    }
    return Optional.of("Webhook not registered");
  }

  private static String truncate(String body) {
    return body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) : body;
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
