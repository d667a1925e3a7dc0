package com.scholary.captions.diagnostics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort writer for per-job diagnostic artifacts (window audio, raw replies, errors).
 *
 * <p>Write failures are logged and never propagate: diagnostics must not change the outcome of a
 * job. A disabled sink ignores every write.
 */
public final class ArtifactSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactSink.class);

  private static final ArtifactSink DISABLED = new ArtifactSink(null);

  private final Path directory;

  private ArtifactSink(Path directory) {
    this.directory = directory;
  }

  /** A sink that writes into {@code directory}, creating it on first write. */
  public static ArtifactSink directory(Path directory) {
    return new ArtifactSink(directory);
  }

  public static ArtifactSink disabled() {
    return DISABLED;
  }

  public boolean isEnabled() {
    return directory != null;
  }

  public void writeBytes(String name, byte[] content) {
    if (!isEnabled()) {
      return;
    }
    Path target = directory.resolve(name);
    try {
      Files.createDirectories(directory);
      Files.write(target, content);
    } catch (IOException e) {
      LOGGER.warn("Failed to write artifact {}: {}", target, e.getMessage());
    }
  }

  public void writeText(String name, String content) {
    writeBytes(name, content.getBytes(StandardCharsets.UTF_8));
  }

  /** Artifact name prefix for a window starting at {@code startSec}, e.g. {@code chunk_30.00}. */
  public static String windowPrefix(double startSec) {
    return String.format(Locale.ROOT, "chunk_%.2f", startSec);
  }

  /** Artifact name prefix for a gap starting at {@code startSec}, e.g. {@code gap_12.50}. */
  public static String gapPrefix(double startSec) {
    return String.format(Locale.ROOT, "gap_%.2f", startSec);
  }
}
