package com.scholary.captions.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the caption pipeline.
 *
 * <p>Controls window size, fallback granularity, gap handling, the optimizer pass, window caching
 * and the thread pools used for jobs and windows.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive double chunkDurationSeconds,
    @Positive double placeholderSeconds,
    @Positive int workerThreads,
    @Positive int jobThreads,
    @Positive int jobQueueSize,
    @NotBlank String outputDir,
    @Valid @NotNull GapProperties gaps,
    @Valid @NotNull OptimizerProperties optimizer,
    @Valid @NotNull CacheProperties cache) {

  /**
   * Gap detection inside a window.
   *
   * <p>A gap longer than {@code gapThresholdSeconds} is considered. It is dropped when quieter
   * than {@code silenceThresholdDbfs} and no longer than {@code forceIncludeSeconds}.
   */
  public record GapProperties(
      @Positive double gapThresholdSeconds,
      double silenceThresholdDbfs,
      @PositiveOrZero double forceIncludeSeconds,
      boolean classificationEnabled) {}

  public record OptimizerProperties(boolean enabled) {}

  public record CacheProperties(@Positive int maxSize, @Positive int ttlHours) {}
}
