package com.scholary.summarizer.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.api.JobStatusResponse.Status;
import com.scholary.summarizer.service.BulkSummarizationService;
import com.scholary.summarizer.service.BulkSummarizationService.ProgressListener;
import com.scholary.summarizer.service.BulkSummaryReport;
import com.scholary.summarizer.service.SummarizationService;
import com.scholary.summarizer.webhook.WebhookConfigurationException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Runs jobs synchronously; the async proxy is not involved outside a Spring context. */
@ExtendWith(MockitoExtension.class)
class SummarizationJobRunnerTest {

  @Mock private SummarizationService summarizationService;
  @Mock private BulkSummarizationService bulkSummarizationService;

  private JobRepository jobRepository;
  private SummarizationJobRunner runner;

  @BeforeEach
  void setUp() {
    jobRepository = new JobRepository(10, 60);
    runner =
        new SummarizationJobRunner(summarizationService, bulkSummarizationService, jobRepository);
  }

  @Test
  void runSummary_shouldCompleteWithResult() {
    SummarizationJob job = newJob(SummarizationJob.Type.SINGLE);
    AggregateResult result = new AggregateResult(true, "summary", null, 1, 0, 0, 1, false);
    when(summarizationService.send(eq("memo"), eq("text"), eq(4L), any(), any()))
        .thenReturn(result);

    runner.runSummary(job, "text", 4L, null);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getProgress()).isEqualTo(100);
    assertThat(job.getResult()).isEqualTo(result);
    assertThat(job.getError()).isNull();
  }

  @Test
  void runSummary_shouldRecordAggregateFailure() {
    SummarizationJob job = newJob(SummarizationJob.Type.SINGLE);
    when(summarizationService.send(any(), any(), any(), any(), any()))
        .thenReturn(
            new AggregateResult(false, null, "Cannot reach endpoint: refused", 0, 0, 1, 1, false));

    runner.runSummary(job, "text", 4L, null);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("Cannot reach endpoint: refused");
  }

  @Test
  void runSummary_shouldRecordException() {
    SummarizationJob job = newJob(SummarizationJob.Type.SINGLE);
    when(summarizationService.send(any(), any(), any(), any(), any()))
        .thenThrow(new WebhookConfigurationException("Webhook URL not configured"));

    runner.runSummary(job, "text", null, null);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("Webhook URL not configured");
  }

  @Test
  void runSummary_shouldPassCancellationFlagToService() {
    SummarizationJob job = newJob(SummarizationJob.Type.SINGLE);
    when(summarizationService.send(any(), any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              BooleanSupplier shouldContinue = invocation.getArgument(4);
              job.requestCancel();
              boolean cancelled = !shouldContinue.getAsBoolean();
              return new AggregateResult(false, null, "stopped", 0, 0, 0, 2, cancelled);
            });

    runner.runSummary(job, "text", 4L, null);

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
  }

  @Test
  void runBulk_shouldTrackProgressAndReport() {
    SummarizationJob job = newJob(SummarizationJob.Type.BULK);
    Path folder = Path.of("notes");
    BulkSummaryReport report =
        new BulkSummaryReport("notes - Summarized", 2, 1, 1, List.of("b.txt: boom"), false);
    when(bulkSummarizationService.summarizeFolder(eq(folder), any(), any()))
        .thenAnswer(
            invocation -> {
              ProgressListener listener = invocation.getArgument(2);
              listener.onFileProcessed(1, 2, "a.txt");
              assertThat(job.getProgress()).isEqualTo(50);
              listener.onFileProcessed(2, 2, "b.txt");
              return report;
            });

    runner.runBulk(job, folder);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getBulkResult()).isEqualTo(report);
    assertThat(job.getProgress()).isEqualTo(100);
    assertThat(jobRepository.findById(job.getJobId())).containsSame(job);
  }

  private SummarizationJob newJob(SummarizationJob.Type type) {
    SummarizationJob job = new SummarizationJob("job-1", type, "memo");
    jobRepository.save(job);
    return job;
  }
}
