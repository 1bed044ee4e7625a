package com.scholary.captioner.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for captioning jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so the per-task summary of recent runs
 * stays available without accumulating every job forever.
 */
@Repository
public class JobRepository {

  private final Cache<String, Job> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(Job job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<Job> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
