package com.scholary.summarizer.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.summarizer.aggregate.AggregateResult;
import com.scholary.summarizer.chunking.ChunkConfig;
import com.scholary.summarizer.chunking.Piece;
import com.scholary.summarizer.job.JobRepository;
import com.scholary.summarizer.job.SummarizationJob;
import com.scholary.summarizer.job.SummarizationJobRunner;
import com.scholary.summarizer.service.BulkSummarizationService;
import com.scholary.summarizer.service.BulkSummaryException;
import com.scholary.summarizer.service.SummarizationService;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SummarizationController.class)
class SummarizationControllerTest {

  private static final ChunkConfig.Snapshot CONFIGURED =
      new ChunkConfig.Snapshot("http://hook.test", Duration.ofSeconds(10), 5120);

  @Autowired private MockMvc mockMvc;

  @MockBean private SummarizationService summarizationService;
  @MockBean private BulkSummarizationService bulkSummarizationService;
  @MockBean private SummarizationJobRunner jobRunner;
  @MockBean private JobRepository jobRepository;

  @Test
  void summarize_shouldStartJob() throws Exception {
    when(summarizationService.currentSettings()).thenReturn(CONFIGURED);

    mockMvc
        .perform(
            post("/api/summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"sourceName\":\"memo\",\"content\":\"hello\",\"originalByteSize\":5}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty());

    verify(jobRunner).runSummary(any(SummarizationJob.class), eq("hello"), eq(5L), any());
  }

  @Test
  void summarize_shouldRejectMissingEndpoint() throws Exception {
    when(summarizationService.currentSettings())
        .thenReturn(new ChunkConfig.Snapshot("", Duration.ofSeconds(10), 5120));

    mockMvc
        .perform(
            post("/api/summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceName\":\"memo\",\"content\":\"hello\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Webhook URL not configured"));

    verify(jobRunner, never()).runSummary(any(), any(), any(), any());
  }

  @Test
  void summarize_shouldValidateRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceName\":\"\",\"content\":\"hello\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void summarizeFolder_shouldRejectMissingFolder() throws Exception {
    when(summarizationService.currentSettings()).thenReturn(CONFIGURED);
    when(bulkSummarizationService.discoverFiles(Path.of("/no/such/folder")))
        .thenThrow(new BulkSummaryException("Not a directory: /no/such/folder"));

    mockMvc
        .perform(
            post("/api/bulk-summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folder\":\"/no/such/folder\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Not a directory: /no/such/folder"));
  }

  @Test
  void preview_shouldDescribePieces() throws Exception {
    when(summarizationService.currentSettings()).thenReturn(CONFIGURED);
    when(summarizationService.preview("one two", 10_000L))
        .thenReturn(
            List.of(new Piece(1, 2, "one ", "", null), new Piece(2, 2, "two", "", null)));

    mockMvc
        .perform(
            post("/api/chunks/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"one two\",\"originalByteSize\":10000}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.chunkCount").value(2))
        .andExpect(jsonPath("$.chunkSizeBytes").value(5120))
        .andExpect(jsonPath("$.pieces[1].chars").value(3));
  }

  @Test
  void getJobStatus_shouldReturnResult() throws Exception {
    SummarizationJob job = new SummarizationJob("job-1", SummarizationJob.Type.SINGLE, "memo");
    job.setStatus(JobStatusResponse.Status.COMPLETED);
    job.setResult(new AggregateResult(true, "summary", null, 1, 0, 0, 1, false));
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.result.combinedText").value("summary"));
  }

  @Test
  void getJobStatus_shouldReturnNotFound() throws Exception {
    when(jobRepository.findById("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void cancelJob_shouldAcceptKnownJob() throws Exception {
    SummarizationJob job = new SummarizationJob("job-1", SummarizationJob.Type.BULK, "notes");
    when(jobRepository.requestCancel("job-1")).thenReturn(Optional.of(job));

    mockMvc.perform(delete("/api/jobs/job-1")).andExpect(status().isAccepted());
  }
}
