package com.scholary.summarizer.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;

/**
 * Request for summarizing one piece of content.
 *
 * <p>{@code originalByteSize} should be the size of the source file on disk. When it is missing
 * the size is estimated from the content length, which makes the piece count less accurate for
 * non-ASCII text.
 */
public record SummaryRequest(
    @NotBlank String sourceName,
    @NotNull String content,
    @PositiveOrZero Long originalByteSize,
    Map<String, Object> metadata) {}
