package com.scholary.summarizer.api;

import com.scholary.summarizer.chunking.ChunkConfig;

/** Current webhook settings and the accepted chunk size range. */
public record WebhookSettingsResponse(
    String url,
    long timeoutSeconds,
    int chunkSizeBytes,
    int minChunkSizeBytes,
    int maxChunkSizeBytes) {

  public static WebhookSettingsResponse from(ChunkConfig.Snapshot snapshot) {
    return new WebhookSettingsResponse(
        snapshot.endpoint(),
        snapshot.timeout().toSeconds(),
        snapshot.chunkSizeBytes(),
        ChunkConfig.MIN_CHUNK_SIZE_BYTES,
        ChunkConfig.MAX_CHUNK_SIZE_BYTES);
  }
}
