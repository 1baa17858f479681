package com.scholary.summarizer.api;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.job.SummarizationJob;
import com.scholary.summarizer.service.BulkSummaryReport;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result once it is finished. Only
 * one of {@code result} and {@code bulkResult} is set, depending on the job type.
 */
public record JobStatusResponse(
    String jobId,
    SummarizationJob.Type type,
    Status status,
    Integer progress,
    AggregateResult result,
    BulkSummaryReport bulkResult,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
  }

  public static JobStatusResponse from(SummarizationJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getType(),
        job.getStatus(),
        job.getProgress(),
        job.getResult(),
        job.getBulkResult(),
        job.getError());
  }
}
