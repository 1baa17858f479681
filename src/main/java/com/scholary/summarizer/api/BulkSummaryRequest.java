package com.scholary.summarizer.api;

import jakarta.validation.constraints.NotBlank;

/** Request for summarizing every supported file in a folder on the server. */
public record BulkSummaryRequest(@NotBlank String folder) {}
