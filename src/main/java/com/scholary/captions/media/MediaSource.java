package com.scholary.captions.media;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Where a job's media comes from.
 *
 * <p>Parsed from the user-supplied source string:
 *
 * <ul>
 *   <li>{@code s3://bucket/key} - object store
 *   <li>{@code https://www.youtube.com/...} or {@code https://youtu.be/...} - YouTube via yt-dlp
 *   <li>any other {@code http(s)://} URL - plain HTTP download
 *   <li>{@code file:} URI or anything else - a local path
 * </ul>
 */
public record MediaSource(Type type, String location) {

  public enum Type {
    LOCAL,
    YOUTUBE,
    HTTP,
    OBJECT_STORE
  }

  public MediaSource {
    if (type == null || location == null || location.isBlank()) {
      throw new IllegalArgumentException("Media source type and location are required");
    }
  }

  /**
   * Parse a source string.
   *
   * @throws IllegalArgumentException if the source is blank or a malformed URL
   */
  public static MediaSource parse(String source) {
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("Media source cannot be blank");
    }
    String trimmed = source.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);

    if (lower.startsWith("s3://")) {
      String rest = trimmed.substring("s3://".length());
      int slash = rest.indexOf('/');
      if (slash <= 0 || slash == rest.length() - 1) {
        throw new IllegalArgumentException(
            "Object store source must be s3://bucket/key: " + source);
      }
      return new MediaSource(Type.OBJECT_STORE, trimmed);
    }

    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      URI uri = toUri(trimmed);
      if (uri.getHost() == null) {
        throw new IllegalArgumentException("URL has no host: " + source);
      }
      return new MediaSource(isYouTubeHost(uri.getHost()) ? Type.YOUTUBE : Type.HTTP, trimmed);
    }

    if (lower.startsWith("file:")) {
      return new MediaSource(Type.LOCAL, Path.of(toUri(trimmed)).toString());
    }

    return new MediaSource(Type.LOCAL, trimmed);
  }

  /** Bucket of an object store source. */
  public String bucket() {
    requireObjectStore();
    String rest = location.substring("s3://".length());
    return rest.substring(0, rest.indexOf('/'));
  }

  /** Key of an object store source. */
  public String key() {
    requireObjectStore();
    String rest = location.substring("s3://".length());
    return rest.substring(rest.indexOf('/') + 1);
  }

  private void requireObjectStore() {
    if (type != Type.OBJECT_STORE) {
      throw new IllegalStateException("Not an object store source: " + location);
    }
  }

  private static boolean isYouTubeHost(String host) {
    String h = host.toLowerCase(Locale.ROOT);
    return h.equals("youtube.com") || h.endsWith(".youtube.com") || h.equals("youtu.be");
  }

  private static URI toUri(String value) {
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Malformed media URL: " + value, e);
    }
  }
}
