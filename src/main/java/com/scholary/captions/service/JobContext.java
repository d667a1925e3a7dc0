package com.scholary.captions.service;

import com.scholary.captions.diagnostics.ArtifactSink;
import java.nio.file.Path;

/**
 * Per-job state passed explicitly through the pipeline.
 *
 * @param jobId the job identifier
 * @param outputDir the job's output directory
 * @param artifacts sink for diagnostic artifacts
 * @param sourceFingerprint content fingerprint of the media, or null to bypass the window cache
 */
public record JobContext(
    String jobId, Path outputDir, ArtifactSink artifacts, String sourceFingerprint) {

  /** Context writing artifacts to {@code outputDir/artifacts}. */
  public static JobContext create(String jobId, Path outputDir, String sourceFingerprint) {
    return new JobContext(
        jobId,
        outputDir,
        ArtifactSink.directory(outputDir.resolve("artifacts")),
        sourceFingerprint);
  }

  /** Context with no output directory, no artifacts and no caching. */
  public static JobContext detached(String jobId) {
    return new JobContext(jobId, null, ArtifactSink.disabled(), null);
  }
}
