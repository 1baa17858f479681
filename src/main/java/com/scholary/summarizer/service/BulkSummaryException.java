package com.scholary.summarizer.service;

/**
 * Exception thrown when a bulk run cannot start or cannot create its output folder.
 *
 * <p>Failures of individual files are not raised; they are counted in the report.
 */
public class BulkSummaryException extends RuntimeException {

  public BulkSummaryException(String message) {
    super(message);
  }

  public BulkSummaryException(String message, Throwable cause) {
    super(message, cause);
  }
}
