package com.scholary.summarizer.api;

import jakarta.validation.constraints.Positive;

/**
 * Request for changing webhook settings at runtime.
 *
 * <p>Both fields are optional; absent fields are left unchanged. The chunk size is clamped into
 * the accepted range rather than rejected.
 */
public record WebhookSettingsRequest(String url, @Positive Integer chunkSizeBytes) {}
