package com.scholary.summarizer.service;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.chunking.ChunkConfig;
import com.scholary.summarizer.chunking.ContentChunker;
import com.scholary.summarizer.chunking.Piece;
import com.scholary.summarizer.config.WebhookProperties;
import com.scholary.summarizer.webhook.ChunkDispatcher;
import com.scholary.summarizer.webhook.TransportResponse;
import com.scholary.summarizer.webhook.WebhookConfigurationException;
import com.scholary.summarizer.webhook.WebhookTransport;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Entry point for sending content to the webhook.
 *
 * <p>Small content goes out as one request. Content whose original size exceeds the chunk budget
 * is split, sent piece by piece and the responses are combined into one result.
 *
 * <p>Each call takes a snapshot of {@link ChunkConfig} first, so changing the chunk size or the
 * endpoint while a job runs only affects the jobs started afterwards.
 */
@Service
public class SummarizationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummarizationService.class);

  /** Status codes that prove the webhook is listening, even if it rejects a test payload. */
  private static final Set<Integer> REACHABLE_CLIENT_ERRORS = Set.of(400, 404);

  static final String PROBE_PAYLOAD = "{\"test\":true}";

  private final ChunkConfig chunkConfig;
  private final ChunkDispatcher dispatcher;
  private final WebhookTransport transport;
  private final Duration probeTimeout;

  public SummarizationService(
      ChunkConfig chunkConfig,
      ChunkDispatcher dispatcher,
      WebhookTransport transport,
      WebhookProperties properties) {
    this.chunkConfig = chunkConfig;
    this.dispatcher = dispatcher;
    this.transport = transport;
    this.probeTimeout = Duration.ofSeconds(properties.probeTimeoutSeconds());

    LOGGER.info(
        "Summarization service initialized: endpoint={}, chunkSize={} bytes ({} KB)",
        chunkConfig.getEndpoint(),
        chunkConfig.getChunkSizeBytes(),
        chunkConfig.getChunkSizeBytes() / 1024);
  }

  public AggregateResult send(
      String sourceName, String content, Long originalByteSizeHint, Map<String, Object> metadata) {
    return send(sourceName, content, originalByteSizeHint, metadata, () -> true);
  }

  /**
   * Send content to the webhook, splitting it when needed.
   *
   * @param sourceName file or transcript name sent along with every piece
   * @param content the text to send
   * @param originalByteSizeHint size of the source in bytes; when null it is estimated as twice
   *     the character count
   * @param metadata optional metadata sent with every piece
   * @param shouldContinue checked before each piece, no piece is sent once it returns false
   * @return the aggregate result
   * @throws WebhookConfigurationException if the webhook URL is missing or invalid
   */
  public AggregateResult send(
      String sourceName,
      String content,
      Long originalByteSizeHint,
      Map<String, Object> metadata,
      BooleanSupplier shouldContinue) {
    String text = content == null ? "" : content;
    ChunkConfig.Snapshot config = chunkConfig.snapshot();
    ChunkDispatcher.requireEndpoint(config);

    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);
    try {
      long byteSize = resolveByteSize(text, originalByteSizeHint);

      LOGGER.info("Processing: {}", sourceName);
      LOGGER.info(
          "  File size: {} bytes ({} KB)", byteSize, String.format("%.1f", byteSize / 1024.0));
      LOGGER.info("  Content: {} characters", text.length());
      LOGGER.info(
          "  Chunk strategy: {} bytes ({} KB) per chunk",
          config.chunkSizeBytes(),
          config.chunkSizeBytes() / 1024);

      List<Piece> pieces =
          new ContentChunker(config.chunkSizeBytes()).split(text, byteSize, sourceName, metadata);
      if (pieces.size() == 1) {
        LOGGER.info("File size within chunk limit, sending as single chunk");
      } else {
        LOGGER.info("File exceeds chunk size, split into {} chunks", pieces.size());
      }

      return dispatcher.sendAll(pieces, config, shouldContinue);
    } finally {
      MDC.remove("correlationId");
    }
  }

  /**
   * Show how content would be split, without sending anything.
   *
   * @param content the text to split
   * @param originalByteSizeHint size of the source in bytes, estimated when null
   * @return the pieces that would be sent
   */
  public List<Piece> preview(String content, Long originalByteSizeHint) {
    String text = content == null ? "" : content;
    ChunkConfig.Snapshot config = chunkConfig.snapshot();
    return new ContentChunker(config.chunkSizeBytes())
        .split(text, resolveByteSize(text, originalByteSizeHint));
  }

  /**
   * Post a minimal probe to the webhook.
   *
   * <p>A test-mode webhook answers 404 for payloads it has no listener for, and a strict one may
   * answer 400 to {@code {"test": true}}; both still prove it is reachable.
   *
   * @return true if the webhook answered with 2xx, 400 or 404
   */
  public boolean testReachability() {
    ChunkConfig.Snapshot config = chunkConfig.snapshot();
    URI endpoint;
    try {
      endpoint = ChunkDispatcher.requireEndpoint(config);
    } catch (WebhookConfigurationException e) {
      LOGGER.error("Connection test failed: {}", e.getMessage());
      return false;
    }

    LOGGER.info("Testing connection to {}", endpoint);
    try {
      TransportResponse response = transport.postJson(endpoint, PROBE_PAYLOAD, probeTimeout);
      boolean reachable =
          response.isSuccessful() || REACHABLE_CLIENT_ERRORS.contains(response.statusCode());
      if (reachable) {
        LOGGER.info("Webhook connection test passed (status {})", response.statusCode());
      } else {
        LOGGER.warn(
            "Webhook returned unexpected status during test: {}", response.statusCode());
      }
      return reachable;
    } catch (IOException e) {
      LOGGER.error("Connection test failed: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.error("Connection test interrupted");
      return false;
    }
  }

  /** Change the chunk size for future jobs; the value is clamped into the accepted range. */
  public void setChunkSize(int sizeBytes) {
    chunkConfig.setChunkSize(sizeBytes);
  }

  /** Change the webhook address for future jobs. */
  public void setEndpoint(String endpoint) {
    chunkConfig.setEndpoint(endpoint);
  }

  public ChunkConfig.Snapshot currentSettings() {
    return chunkConfig.snapshot();
  }

  /** The last raw response received from the webhook, for debugging. */
  public Optional<TransportResponse> lastResponse() {
    return dispatcher.lastResponse();
  }

  /**
   * Byte size used to plan the pieces.
   *
   * <p>Without a hint the size is guessed as two bytes per character. This over-counts ASCII and
   * under-counts text dominated by 3- and 4-byte characters, so callers that know the real size
   * should pass it.
   */
  static long resolveByteSize(String content, Long originalByteSizeHint) {
    if (originalByteSizeHint != null) {
      return originalByteSizeHint;
    }
    long estimate = content.length() * 2L;
    LOGGER.warn(
        "Original byte size not provided, estimating as {} bytes ({} KB)",
        estimate,
        String.format("%.1f", estimate / 1024.0));
    return estimate;
  }
}
