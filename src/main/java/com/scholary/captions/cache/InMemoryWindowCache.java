package com.scholary.captions.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.captions.config.PipelineProperties;
import com.scholary.captions.transcript.Segment;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of WindowCache using Caffeine.
 *
 * <p>Entries expire after a configurable number of hours and the cache is bounded in size; the
 * least recently used windows are evicted first.
 */
@Component
public class InMemoryWindowCache implements WindowCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryWindowCache.class);

  private final Cache<String, List<Segment>> cache;

  public InMemoryWindowCache(PipelineProperties properties) {
    this(properties.cache().maxSize(), properties.cache().ttlHours());
  }

  public InMemoryWindowCache(int maxSize, int ttlHours) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .build();

    LOGGER.info("Initialized window cache: maxSize={}, ttlHours={}", maxSize, ttlHours);
  }

  @Override
  public void put(String cacheKey, List<Segment> segments) {
    cache.put(cacheKey, List.copyOf(segments));
    LOGGER.debug("Cached window: key={}, segments={}", cacheKey, segments.size());
  }

  @Override
  public Optional<List<Segment>> get(String cacheKey) {
    List<Segment> segments = cache.getIfPresent(cacheKey);
    if (segments != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(segments);
    } else {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    }
  }
}
