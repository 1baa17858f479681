package com.scholary.summarizer.api;

import com.scholary.summarizer.chunking.Piece;
import com.scholary.summarizer.job.JobRepository;
import com.scholary.summarizer.job.SummarizationJob;
import com.scholary.summarizer.job.SummarizationJobRunner;
import com.scholary.summarizer.service.BulkSummarizationService;
import com.scholary.summarizer.service.SummarizationService;
import com.scholary.summarizer.webhook.ChunkDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for summarization.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Previewing how content will be split
 *   <li>Asynchronous summarization of one text or a whole folder (returns job ID immediately)
 *   <li>Job status polling and cancellation
 * </ul>
 *
 * <p>A job may run for minutes when the webhook is slow, so nothing is sent on the request thread.
 */
@RestController
@Tag(name = "Summarization", description = "Chunked webhook summarization API")
public class SummarizationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummarizationController.class);

  private final SummarizationService summarizationService;
  private final BulkSummarizationService bulkSummarizationService;
  private final SummarizationJobRunner jobRunner;
  private final JobRepository jobRepository;

  public SummarizationController(
      SummarizationService summarizationService,
      BulkSummarizationService bulkSummarizationService,
      SummarizationJobRunner jobRunner,
      JobRepository jobRepository) {
    this.summarizationService = summarizationService;
    this.bulkSummarizationService = bulkSummarizationService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  /** Preview chunk boundaries without sending anything. */
  @PostMapping("/api/chunks/preview")
  @Operation(
      summary = "Preview chunks",
      description = "Show how content would be split with the current chunk size")
  public ResponseEntity<ChunkPreviewResponse> preview(
      @Valid @RequestBody ChunkPreviewRequest request) {
    List<Piece> pieces =
        summarizationService.preview(request.content(), request.originalByteSize());
    int chunkSize = summarizationService.currentSettings().chunkSizeBytes();
    LOGGER.info("Chunk preview: {} pieces at {} bytes per chunk", pieces.size(), chunkSize);
    return ResponseEntity.ok(ChunkPreviewResponse.of(chunkSize, pieces));
  }

  /** Start an asynchronous summarization job for one text. */
  @PostMapping("/api/summaries")
  @Operation(
      summary = "Start summarization",
      description = "Start an asynchronous summarization job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> summarize(@Valid @RequestBody SummaryRequest request) {
    ChunkDispatcher.requireEndpoint(summarizationService.currentSettings());

    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Summary request: source={}, chars={}", request.sourceName(), request.content().length());

    SummarizationJob job =
        new SummarizationJob(jobId, SummarizationJob.Type.SINGLE, request.sourceName());
    jobRepository.save(job);
    LOGGER.info("Created async summarization job: {}", jobId);

    jobRunner.runSummary(job, request.content(), request.originalByteSize(), request.metadata());
    return ResponseEntity.accepted().body(AsyncJobResponse.of(jobId));
  }

  /** Start an asynchronous job summarizing every supported file of a folder. */
  @PostMapping("/api/bulk-summaries")
  @Operation(
      summary = "Start bulk summarization",
      description = "Summarize every supported file of a server-side folder into a sibling folder")
  public ResponseEntity<AsyncJobResponse> summarizeFolder(
      @Valid @RequestBody BulkSummaryRequest request) {
    ChunkDispatcher.requireEndpoint(summarizationService.currentSettings());
    Path folder = Path.of(request.folder());
    List<Path> files = bulkSummarizationService.discoverFiles(folder);

    String jobId = UUID.randomUUID().toString();
    LOGGER.info("Bulk summary request: folder={}, files={}", folder, files.size());

    SummarizationJob job =
        new SummarizationJob(jobId, SummarizationJob.Type.BULK, folder.toString());
    jobRepository.save(job);

    jobRunner.runBulk(job, folder);
    return ResponseEntity.accepted().body(AsyncJobResponse.of(jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. Once the job is finished the response carries
   * its result.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  /** Ask a running job to stop before its next piece or file. */
  @DeleteMapping("/api/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description = "Stop a running job; the request already in flight is allowed to finish")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobRepository
        .requestCancel(id)
        .map(job -> ResponseEntity.accepted().body(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }
}
