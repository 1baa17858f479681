package com.scholary.summarizer.service;

import java.util.List;

/**
 * Result of summarizing every supported file in a folder.
 *
 * @param outputFolder folder the summaries were written to
 * @param totalFiles number of files discovered
 * @param succeeded files whose summary was written
 * @param failed files that could not be read, were empty, or got no result from the webhook
 * @param failedFiles names of the failed files with the reason, in processing order
 * @param cancelled true when the run stopped before every file was processed
 */
public record BulkSummaryReport(
    String outputFolder,
    int totalFiles,
    int succeeded,
    int failed,
    List<String> failedFiles,
    boolean cancelled) {

  public BulkSummaryReport {
    failedFiles = List.copyOf(failedFiles);
  }
}
