package com.scholary.summarizer.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the webhook client.
 *
 * <p>The URL may be left blank at startup and set later through the API; sending fails fast
 * until it is. The chunk size is clamped by {@code ChunkConfig}, so out-of-range values are
 * accepted here and corrected with a warning.
 */
@ConfigurationProperties(prefix = "webhook")
@Validated
public record WebhookProperties(
    String url,
    @Positive int timeoutSeconds,
    @Positive int connectTimeoutSeconds,
    @Positive int probeTimeoutSeconds,
    Integer chunkSizeBytes) {}
