package com.scholary.captions.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for caption jobs.
 *
 * <p>Uses a Caffeine cache so old jobs are evicted automatically and memory stays bounded. Jobs
 * do not survive a restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, CaptionJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(CaptionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<CaptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
