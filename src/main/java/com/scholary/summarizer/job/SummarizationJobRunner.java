package com.scholary.summarizer.job;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.api.JobStatusResponse.Status;
import com.scholary.summarizer.logging.StructuredLogger;
import com.scholary.summarizer.service.BulkSummarizationService;
import com.scholary.summarizer.service.BulkSummaryReport;
import com.scholary.summarizer.service.SummarizationService;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs summarization jobs on the background executor.
 *
 * <p>A job blocks its worker for as long as all of its pieces take, and this keeps that away from
 * request threads. The job object is updated as processing progresses so clients can poll it.
 * Failures are recorded on the job and never propagate out of the worker.
 */
@Service
public class SummarizationJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummarizationJobRunner.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final SummarizationService summarizationService;
  private final BulkSummarizationService bulkSummarizationService;
  private final JobRepository jobRepository;

  public SummarizationJobRunner(
      SummarizationService summarizationService,
      BulkSummarizationService bulkSummarizationService,
      JobRepository jobRepository) {
    this.summarizationService = summarizationService;
    this.bulkSummarizationService = bulkSummarizationService;
    this.jobRepository = jobRepository;
  }

  /** Send one piece of content, split as needed. */
  @Async
  public void runSummary(
      SummarizationJob job,
      String content,
      Long originalByteSize,
      Map<String, Object> metadata) {
    StructuredLogger.setJobContext(job.getJobId(), job.getSource());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      markProcessing(job);

      AggregateResult result =
          summarizationService.send(
              job.getSource(),
              content,
              originalByteSize,
              metadata,
              () -> !job.isCancelRequested());

      job.setResult(result);
      if (result.cancelled()) {
        job.setStatus(Status.CANCELLED);
      } else if (result.success()) {
        job.setStatus(Status.COMPLETED);
      } else {
        job.setStatus(Status.FAILED);
        job.setError(result.errorSummary());
      }
      job.setProgress(100);
      jobRepository.save(job);

      STRUCTURED.logJobProgress(
          job.getJobId(),
          result.totalPieces() - result.unsentPieces(),
          result.totalPieces(),
          100,
          job.getStatus().name());

    } catch (Exception e) {
      fail(job, e);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /** Summarize every supported file of a folder. */
  @Async
  public void runBulk(SummarizationJob job, Path folder) {
    StructuredLogger.setJobContext(job.getJobId(), job.getSource());
    LOGGER.info("Starting bulk processing for job: {}", job.getJobId());

    try {
      markProcessing(job);

      BulkSummaryReport report =
          bulkSummarizationService.summarizeFolder(
              folder,
              () -> !job.isCancelRequested(),
              (processed, total, fileName) -> {
                int percent = total == 0 ? 100 : processed * 100 / total;
                job.setProgress(percent);
                jobRepository.save(job);
                STRUCTURED.logJobProgress(job.getJobId(), processed, total, percent, fileName);
              });

      job.setBulkResult(report);
      job.setStatus(report.cancelled() ? Status.CANCELLED : Status.COMPLETED);
      job.setProgress(100);
      jobRepository.save(job);

      LOGGER.info(
          "Completed bulk job {}: {} succeeded, {} failed",
          job.getJobId(),
          report.succeeded(),
          report.failed());

    } catch (Exception e) {
      fail(job, e);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void markProcessing(SummarizationJob job) {
    job.setStatus(Status.PROCESSING);
    job.setProgress(10);
    jobRepository.save(job);
  }

  private void fail(SummarizationJob job, Exception e) {
    LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
    job.setStatus(Status.FAILED);
    job.setError(e.getMessage());
    jobRepository.save(job);
  }
}
