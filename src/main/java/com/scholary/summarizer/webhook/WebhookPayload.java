package com.scholary.summarizer.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * JSON body posted to the webhook for one piece.
 *
 * <p>{@code chunk_number} and {@code total_chunks} are only present when the content was split.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookPayload(
    @JsonProperty("file_name") String fileName,
    @JsonProperty("content") String content,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("chunk_number") Integer chunkNumber,
    @JsonProperty("total_chunks") Integer totalChunks,
    @JsonProperty("metadata") Map<String, Object> metadata) {}
