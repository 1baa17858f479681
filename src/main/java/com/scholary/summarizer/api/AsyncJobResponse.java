package com.scholary.summarizer.api;

/**
 * Response for an async summarization request.
 *
 * <p>Returns a job ID that can be used to poll {@code /api/jobs/{id}}.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {

  public static AsyncJobResponse of(String jobId) {
    return new AsyncJobResponse(jobId, "/api/jobs/" + jobId);
  }
}
