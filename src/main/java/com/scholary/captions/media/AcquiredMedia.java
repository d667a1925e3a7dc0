package com.scholary.captions.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * A media file available on local disk.
 *
 * @param file the local file
 * @param fingerprint SHA-256 of the file content, used as the window cache namespace
 */
public record AcquiredMedia(Path file, String fingerprint) {

  private static final Set<String> AUDIO_ONLY_EXTENSIONS =
      Set.of("mp3", "wav", "m4a", "aac", "flac", "ogg", "opus", "wma");

  /** Whether the file can carry an embedded subtitle stream, judged by its extension. */
  public boolean hasVideo() {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return true;
    }
    return !AUDIO_ONLY_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
