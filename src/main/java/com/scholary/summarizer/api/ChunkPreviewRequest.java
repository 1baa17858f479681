package com.scholary.summarizer.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for previewing how content would be split, without sending it.
 *
 * <p>Useful for checking the effect of a chunk size before running a job.
 */
public record ChunkPreviewRequest(@NotNull String content, @PositiveOrZero Long originalByteSize) {}
