package com.scholary.summarizer.chunking;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Active webhook configuration for one client session.
 *
 * <p>The chunk size budget is always clamped into [{@link #MIN_CHUNK_SIZE_BYTES}, {@link
 * #MAX_CHUNK_SIZE_BYTES}], both at construction and on every {@link #setChunkSize(int)}. Jobs never
 * read this object live: they take a {@link #snapshot()} at job start, so a mutation made while a
 * job is running only affects the next job.
 */
public class ChunkConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkConfig.class);

  public static final int MIN_CHUNK_SIZE_BYTES = 5 * 1024;
  public static final int MAX_CHUNK_SIZE_BYTES = 100 * 1024;
  public static final int DEFAULT_CHUNK_SIZE_BYTES = 50 * 1024;

  private volatile String endpoint;
  private volatile Duration timeout;
  private volatile int chunkSizeBytes;

  public ChunkConfig(String endpoint, Duration timeout) {
    this(endpoint, timeout, null);
  }

  /**
   * @param endpoint webhook address, may be blank (checked when a job starts)
   * @param timeout per-request timeout
   * @param chunkSizeBytes requested budget, or null for the default
   */
  public ChunkConfig(String endpoint, Duration timeout, Integer chunkSizeBytes) {
    this.endpoint = endpoint;
    this.timeout = timeout;
    this.chunkSizeBytes =
        validate(chunkSizeBytes != null ? chunkSizeBytes : DEFAULT_CHUNK_SIZE_BYTES);
  }

  /**
   * Clamp a chunk size into the accepted range.
   *
   * @param size requested size in bytes
   * @return the clamped size
   */
  public static int validate(int size) {
    if (size < MIN_CHUNK_SIZE_BYTES) {
      LOGGER.warn("Chunk size {} too small, using minimum {}", size, MIN_CHUNK_SIZE_BYTES);
      return MIN_CHUNK_SIZE_BYTES;
    }
    if (size > MAX_CHUNK_SIZE_BYTES) {
      LOGGER.warn("Chunk size {} too large, using maximum {}", size, MAX_CHUNK_SIZE_BYTES);
      return MAX_CHUNK_SIZE_BYTES;
    }
    return size;
  }

  /** Replace the active budget. Pieces already planned are not affected. */
  public void setChunkSize(int size) {
    int oldSize = chunkSizeBytes;
    chunkSizeBytes = validate(size);
    LOGGER.info("Chunk size changed: {} -> {} bytes", oldSize, chunkSizeBytes);
  }

  public void setEndpoint(String endpoint) {
    LOGGER.info("Webhook endpoint changed: {} -> {}", this.endpoint, endpoint);
    this.endpoint = endpoint;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public int getChunkSizeBytes() {
    return chunkSizeBytes;
  }

  /** Immutable copy of the current values, taken once per job. */
  public Snapshot snapshot() {
    return new Snapshot(endpoint, timeout, chunkSizeBytes);
  }

  /**
   * Configuration values frozen for the duration of one job.
   *
   * @param endpoint webhook address
   * @param timeout per-request timeout
   * @param chunkSizeBytes chunk size budget, already clamped
   */
  public record Snapshot(String endpoint, Duration timeout, int chunkSizeBytes) {

    public boolean hasEndpoint() {
      return endpoint != null && !endpoint.isBlank();
    }
  }
}
