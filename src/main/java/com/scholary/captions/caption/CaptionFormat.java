package com.scholary.captions.caption;

import java.util.Locale;

/** Supported caption file formats. */
public enum CaptionFormat {
  SRT("srt", "text/srt"),
  VTT("vtt", "text/vtt");

  private final String extension;
  private final String mediaType;

  CaptionFormat(String extension, String mediaType) {
    this.extension = extension;
    this.mediaType = mediaType;
  }

  public String extension() {
    return extension;
  }

  public String mediaType() {
    return mediaType;
  }

  /**
   * Parse a format name such as {@code srt} or {@code VTT}.
   *
   * @throws IllegalArgumentException for null or unsupported names
   */
  public static CaptionFormat fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (CaptionFormat format : values()) {
        if (format.extension.equals(normalized)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported caption format: " + name);
  }
}
