package com.scholary.summarizer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for summarization jobs.
 *
 * <p>Controls the background worker pool and bulk folder processing.
 */
@ConfigurationProperties(prefix = "summarizer")
@Validated
public record SummarizerProperties(
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Valid BulkProperties bulk) {

  /**
   * @param rootFolder bulk runs only accept folders strictly below this one
   * @param supportedExtensions file extensions picked up from a folder, matched case-insensitively
   * @param outputFolderSuffix appended to the folder name to form the sibling output folder
   */
  public record BulkProperties(
      @NotBlank String rootFolder,
      @NotEmpty List<String> supportedExtensions,
      @NotBlank String outputFolderSuffix) {}
}
