package com.scholary.summarizer.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store for summarization jobs.
 *
 * <p>Backed by a Caffeine cache bounded in size. Entries expire a while after they were last read
 * or written, so a job that a client keeps polling survives while abandoned ones are dropped.
 * Nothing survives a restart.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final Cache<String, SummarizationJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(Duration.ofMinutes(expireAfterMinutes))
            .build();

    LOGGER.info(
        "Initialized job store: maxSize={}, expireAfterMinutes={}", maxSize, expireAfterMinutes);
  }

  public void save(SummarizationJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<SummarizationJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /**
   * Flag a job for cancellation.
   *
   * <p>The worker notices the flag before its next piece or file; a request already on the wire
   * is allowed to finish.
   *
   * @return the job, or empty if it is unknown or expired
   */
  public Optional<SummarizationJob> requestCancel(String jobId) {
    Optional<SummarizationJob> job = findById(jobId);
    job.ifPresent(
        j -> {
          if (!j.isFinished()) {
            j.requestCancel();
            LOGGER.info("Cancellation requested for job {}", jobId);
          }
        });
    return job;
  }
}
