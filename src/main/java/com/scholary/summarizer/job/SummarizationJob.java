package com.scholary.summarizer.job;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.api.JobStatusResponse.Status;
import com.scholary.summarizer.service.BulkSummaryReport;
import java.time.Instant;

/**
 * Represents an async summarization job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory using Caffeine cache. A job is
 * read by request threads while its worker updates it, so all mutable state is volatile.
 */
public class SummarizationJob {

  public enum Type {
    SINGLE,
    BULK
  }

  private final String jobId;
  private final Type type;
  private final String source;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile AggregateResult result;
  private volatile BulkSummaryReport bulkResult;
  private volatile String error;
  private volatile boolean cancelRequested;

  public SummarizationJob(String jobId, Type type, String source) {
    this.jobId = jobId;
    this.type = type;
    this.source = source;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public Type getType() {
    return type;
  }

  public String getSource() {
    return source;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public AggregateResult getResult() {
    return result;
  }

  public void setResult(AggregateResult result) {
    this.result = result;
  }

  public BulkSummaryReport getBulkResult() {
    return bulkResult;
  }

  public void setBulkResult(BulkSummaryReport bulkResult) {
    this.bulkResult = bulkResult;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  /** Ask the worker to stop before the next piece or file. */
  public void requestCancel() {
    this.cancelRequested = true;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  /** Whether the job has reached a final state. */
  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED || status == Status.CANCELLED;
  }
}
